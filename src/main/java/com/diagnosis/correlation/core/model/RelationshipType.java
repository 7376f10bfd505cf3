package com.diagnosis.correlation.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Type of a directed relationship between two canonical entities.
 */
public enum RelationshipType {
    EXPLICITLY_RELATED("explicitly_related", "Relationship stated directly in a source document"),
    CONTROLS("controls", "Component manages or controls another component"),
    PROCESSES_DATA_FROM("processes_data_from", "Component handles data from another component"),
    INTERFACES_WITH("interfaces_with", "Component communicates with another component"),
    MONITORS("monitors", "Component observes or tracks another component"),
    CONTAINS("contains", "Component physically contains another component"),
    DEPENDS_ON("depends_on", "Component requires another component to function");

    private final String wireName;
    private final String description;

    RelationshipType(String wireName, String description) {
        this.wireName = wireName;
        this.description = description;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getDescription() {
        return description;
    }

    @JsonCreator
    public static RelationshipType fromWireName(String value) {
        for (RelationshipType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown relationship type: " + value);
    }
}
