package com.diagnosis.correlation.source;

import com.diagnosis.correlation.core.model.ModelCollections;

import java.util.Map;

/**
 * Inventory record for one component.
 *
 * @param name           component name as listed in the inventory
 * @param type           component type (hardware, software, ...)
 * @param function       free-text description of what the component does
 * @param specifications component specifications
 */
public record ComponentRecord(
        String name,
        String type,
        String function,
        Map<String, Object> specifications
) {
    public ComponentRecord {
        name = name != null ? name : "";
        type = type != null ? type : "";
        function = function != null ? function : "";
        specifications = ModelCollections.mapCopy(specifications);
    }

    public static ComponentRecord of(String name, String function) {
        return new ComponentRecord(name, "", function, Map.of());
    }
}
