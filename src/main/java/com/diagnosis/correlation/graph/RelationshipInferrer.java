package com.diagnosis.correlation.graph;

import com.diagnosis.correlation.core.model.OriginSource;
import com.diagnosis.correlation.core.model.RelationshipEdge;
import com.diagnosis.correlation.core.model.RelationshipType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds relationship edges between canonical entities, either copied from documented
 * relations or inferred from the entities' function descriptions.
 *
 * <p>Inference heuristics, applied to every ordered pair (A, B) with A != B:</p>
 * <ul>
 *   <li>A's function mentions "control" and B's mentions temperature, pressure or flow:
 *       {@code controls} (0.7)</li>
 *   <li>A's function mentions "process" and B's mentions "detect":
 *       {@code processes_data_from} (0.6)</li>
 *   <li>A's function mentions "interface" or "communication":
 *       {@code interfaces_with} (0.5) to every other entity</li>
 * </ul>
 */
public class RelationshipInferrer {
    private static final Logger log = LoggerFactory.getLogger(RelationshipInferrer.class);

    public static final double EXPLICIT_CONFIDENCE = 0.9;
    public static final double CONTROLS_CONFIDENCE = 0.7;
    public static final double PROCESSES_DATA_CONFIDENCE = 0.6;
    public static final double INTERFACES_CONFIDENCE = 0.5;

    private static final List<String> CONTROLLED_QUANTITIES = List.of("temperature", "pressure", "flow");

    /**
     * Creates a documented edge between two resolved entities.
     */
    public RelationshipEdge explicitEdge(String sourceEntity, String targetEntity) {
        return new RelationshipEdge(sourceEntity, targetEntity, RelationshipType.EXPLICITLY_RELATED,
                EXPLICIT_CONFIDENCE, OriginSource.DOCUMENTATION);
    }

    /**
     * Infers edges from function text.
     *
     * @param functionsByEntity function description per canonical name, in entity order
     * @return inferred edges, grouped by source entity in input order
     */
    public List<RelationshipEdge> inferFromFunctions(Map<String, String> functionsByEntity) {
        List<RelationshipEdge> edges = new ArrayList<>();

        for (Map.Entry<String, String> source : functionsByEntity.entrySet()) {
            String sourceFunction = source.getValue().toLowerCase(Locale.ROOT);
            if (sourceFunction.isBlank()) {
                continue;
            }
            for (Map.Entry<String, String> target : functionsByEntity.entrySet()) {
                if (target.getKey().equals(source.getKey())) {
                    continue;
                }
                String targetFunction = target.getValue().toLowerCase(Locale.ROOT);

                if (sourceFunction.contains("control")
                        && CONTROLLED_QUANTITIES.stream().anyMatch(targetFunction::contains)) {
                    edges.add(inferred(source.getKey(), target.getKey(),
                            RelationshipType.CONTROLS, CONTROLS_CONFIDENCE));
                }
                if (sourceFunction.contains("process") && targetFunction.contains("detect")) {
                    edges.add(inferred(source.getKey(), target.getKey(),
                            RelationshipType.PROCESSES_DATA_FROM, PROCESSES_DATA_CONFIDENCE));
                }
                if (sourceFunction.contains("interface") || sourceFunction.contains("communication")) {
                    edges.add(inferred(source.getKey(), target.getKey(),
                            RelationshipType.INTERFACES_WITH, INTERFACES_CONFIDENCE));
                }
            }
        }

        log.debug("relationships.inferred count={}", edges.size());
        return edges;
    }

    private RelationshipEdge inferred(String source, String target, RelationshipType type, double confidence) {
        return new RelationshipEdge(source, target, type, confidence, OriginSource.FUNCTION_INFERENCE);
    }
}
