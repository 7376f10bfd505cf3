package com.diagnosis.correlation.source;

import com.diagnosis.correlation.core.model.ModelCollections;

import java.util.List;
import java.util.Map;

/**
 * Component inventory built from engineering documents.
 *
 * @param components    component records keyed by component name
 * @param aliases       alternate names mapped to inventory component names
 * @param relationships documented relations from a component to other components
 */
public record ComponentInventory(
        Map<String, ComponentRecord> components,
        Map<String, String> aliases,
        Map<String, List<String>> relationships
) {
    public ComponentInventory {
        components = ModelCollections.mapCopy(components);
        aliases = ModelCollections.mapCopy(aliases);
        relationships = ModelCollections.multimapCopy(relationships);
    }

    public static ComponentInventory empty() {
        return new ComponentInventory(Map.of(), Map.of(), Map.of());
    }

    /**
     * True when the inventory carries no components, aliases or relationships.
     */
    public boolean isEmpty() {
        return components.isEmpty() && aliases.isEmpty() && relationships.isEmpty();
    }
}
