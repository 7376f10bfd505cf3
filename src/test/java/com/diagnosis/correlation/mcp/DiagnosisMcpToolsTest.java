package com.diagnosis.correlation.mcp;

import com.diagnosis.correlation.api.CorrelationEngine;
import com.diagnosis.correlation.core.model.ViolationTypes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosisMcpToolsTest {

    private DiagnosisMcpTools tools;
    private Map<String, Object> inventory;
    private Map<String, Object> logAnalysis;
    private Map<String, Object> documentAnalysis;

    @BeforeEach
    void setUp() {
        tools = new DiagnosisMcpTools(CorrelationEngine.builder().build());

        Map<String, Object> components = new LinkedHashMap<>();
        components.put("Laser Diode", Map.of("name", "Laser Diode", "function", "Emits the excitation beam"));
        components.put("Detector Array", Map.of("name", "Detector Array", "function", "Detects emitted photons"));
        inventory = Map.of("inventory", Map.of(
                "components", components,
                "relationships", Map.of("Laser Diode", List.of("Detector Array", "Ghost Board"))));

        logAnalysis = Map.of(
                "top_issues", List.of(Map.of(
                        "type", "optical_alignment",
                        "description", "Laser diode power drop detected",
                        "severity", "HIGH",
                        "sample_matches", List.of("ERROR laser diode output below threshold"))),
                "analysis_summary", Map.of("risk_level", "HIGH"));

        documentAnalysis = Map.of("structured_sections", Map.of(
                "procedures", List.of(Map.of(
                        "title", "Realign laser diode",
                        "description", "Restore laser diode power after a drop",
                        "troubleshooting_steps", List.of("Check laser diode alignment"))),
                "symptoms", List.of("Power drop on the laser diode")));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> map(Object value) {
        return (Map<String, Object>) value;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> list(Object value) {
        return (List<Object>) value;
    }

    private Map<String, Object> call(String tool, Map<String, Object> params) {
        return tools.getTool(tool).orElseThrow().call(params);
    }

    @Test
    @DisplayName("Should expose the five tools")
    void testToolDefinitions() {
        List<String> names = tools.getToolDefinitions().stream().map(McpToolDefinition::name).toList();

        assertEquals(List.of("correlate_components_across_sources", "correlate_failures_to_procedures",
                "validate_cross_source_consistency", "resolve_consistency_conflicts",
                "generate_comprehensive_diagnostic_report"), names);
        assertTrue(tools.getTool("delete_everything").isEmpty());
        assertEquals(List.of("failure_analysis_data", "troubleshooting_guides"),
                tools.getTool("correlate_failures_to_procedures").orElseThrow().inputSchema().get("required"));
    }

    @Nested
    @DisplayName("correlate_components_across_sources")
    class CorrelateComponentsTests {

        @Test
        @DisplayName("Should return entities, relationships and dangling references")
        void testCorrelate() {
            Map<String, Object> result = call("correlate_components_across_sources",
                    Map.of("component_inventory", inventory));

            assertFalse(result.containsKey("error"), () -> String.valueOf(result.get("error")));
            List<Object> entities = list(result.get("component_correlations"));
            assertEquals(2, entities.size());
            assertEquals("Detector Array", map(entities.get(0)).get("canonical_name"));
            assertEquals(1, list(result.get("dangling_references")).size());
            assertEquals(2, map(result.get("correlation_summary")).get("components_correlated"));
        }

        @Test
        @DisplayName("Should return the relationship matrix next to the relationship summary")
        void testRelationshipMatrix() {
            Map<String, Object> result = call("correlate_components_across_sources",
                    Map.of("component_inventory", inventory));

            Map<String, Object> matrix = map(result.get("relationship_matrix"));
            assertEquals("explicitly_related", map(matrix.get("Laser Diode")).get("Detector Array"));
            assertEquals("self", map(matrix.get("Detector Array")).get("Detector Array"));
            assertEquals("none", map(matrix.get("Detector Array")).get("Laser Diode"));

            Map<String, Object> analysis = map(result.get("relationship_analysis"));
            assertTrue(analysis.containsKey("average_connections_per_component"));
            assertFalse(analysis.containsKey("relationship_matrix"));
        }

        @Test
        @DisplayName("Should return an error map when every source is empty")
        void testNoSources() {
            Map<String, Object> result = call("correlate_components_across_sources", null);

            assertEquals("No component mentions found in any source", result.get("error"));
        }

        @Test
        @DisplayName("Should propagate an upstream error as invalid input")
        void testUpstreamError() {
            Map<String, Object> result = call("correlate_components_across_sources",
                    Map.of("log_analysis_data", Map.of("error", "log file unreadable")));

            assertTrue(result.get("error").toString().contains("log file unreadable"));
        }

        @Test
        @DisplayName("Should reject a source that is not an object")
        void testWrongShape() {
            Map<String, Object> result = call("correlate_components_across_sources",
                    Map.of("component_inventory", "Laser Diode"));

            assertEquals("component_inventory must be an object", result.get("error"));
        }
    }

    @Nested
    @DisplayName("correlate_failures_to_procedures")
    class CorrelateFailuresTests {

        @Test
        @DisplayName("Should report statistics for the analyzed patterns")
        void testCorrelate() {
            Map<String, Object> result = call("correlate_failures_to_procedures", Map.of(
                    "failure_analysis_data", logAnalysis,
                    "troubleshooting_guides", documentAnalysis));

            assertFalse(result.containsKey("error"), () -> String.valueOf(result.get("error")));
            Map<String, Object> statistics = map(result.get("correlation_statistics"));
            assertEquals(1, statistics.get("failure_patterns_analyzed"));
            assertEquals(0.5, statistics.get("correlation_threshold"));
            assertNotNull(result.get("correlations_by_severity"));
        }

        @Test
        @DisplayName("Should require the troubleshooting guides")
        void testMissingGuides() {
            Map<String, Object> result = call("correlate_failures_to_procedures",
                    Map.of("failure_analysis_data", logAnalysis));

            assertEquals("troubleshooting_guides is required", result.get("error"));
        }
    }

    @Nested
    @DisplayName("validate_cross_source_consistency and resolve_consistency_conflicts")
    class ValidateAndResolveTests {

        private Map<String, Object> unifiedAnalysis() {
            Map<String, Object> references = new LinkedHashMap<>();
            references.put("log_analysis", List.of("Mirror", "Reflector"));
            references.put("component_inventory", List.of("Mirror Assembly", "Beam Mirror"));
            Map<String, Object> mirror = new LinkedHashMap<>();
            mirror.put("canonical_name", "Mirror");
            mirror.put("original_name", "Mirror");
            mirror.put("source_references", references);
            mirror.put("confidence_scores", Map.of("log_analysis", 0.9, "component_inventory", 0.9));
            mirror.put("consistency_score", 0.9);

            Map<String, Object> failure = new LinkedHashMap<>();
            failure.put("failure_pattern", "Fan stall");
            failure.put("pattern_type", "temperature_control");
            failure.put("severity", "MEDIUM");
            failure.put("associated_components", List.of("Cooling Fan X9"));

            return Map.of("unified_analysis", Map.of(
                    "component_correlations", List.of(mirror),
                    "failure_correlations", List.of(failure)));
        }

        @Test
        @DisplayName("Should validate posted entities and failures")
        void testValidate() {
            Map<String, Object> result = call("validate_cross_source_consistency",
                    Map.of("unified_analysis_data", unifiedAnalysis()));

            assertFalse(result.containsKey("error"), () -> String.valueOf(result.get("error")));
            List<String> types = list(result.get("violations_found")).stream()
                    .map(v -> (String) map(v).get("violation_type"))
                    .toList();
            assertTrue(types.contains(ViolationTypes.COMPONENT_NAME_CONFLICT));
            assertTrue(types.contains(ViolationTypes.BROKEN_CROSS_REFERENCE));
            assertEquals(1, map(result.get("validation_metadata")).get("components_analyzed"));
            assertEquals(false, map(result.get("consistency_validation")).get("meets_threshold"));
        }

        @Test
        @DisplayName("Should require the unified_analysis key")
        void testMissingUnifiedAnalysis() {
            Map<String, Object> result = call("validate_cross_source_consistency",
                    Map.of("unified_analysis_data", Map.of()));

            assertEquals("Missing required key: unified_analysis", result.get("error"));
        }

        @Test
        @DisplayName("Should plan resolutions from a validation result")
        void testResolve() {
            Map<String, Object> validation = call("validate_cross_source_consistency",
                    Map.of("unified_analysis_data", unifiedAnalysis()));

            Map<String, Object> result = call("resolve_consistency_conflicts", Map.of(
                    "consistency_validation_data", validation,
                    "resolution_priority", "quick_wins"));

            assertFalse(result.containsKey("error"), () -> String.valueOf(result.get("error")));
            Map<String, Object> plan = map(result.get("resolution_plan"));
            assertEquals("quick_wins", plan.get("prioritization_strategy"));
            assertEquals(list(validation.get("violations_found")).size(), plan.get("total_resolutions"));
            assertEquals(4, map(result.get("implementation_timeline")).size());
        }

        @Test
        @DisplayName("Should report no action for a clean validation")
        void testResolveNothing() {
            Map<String, Object> result = call("resolve_consistency_conflicts",
                    Map.of("consistency_validation_data", Map.of("violations_found", List.of())));

            assertEquals("no_action_required", map(result.get("resolution_plan")).get("status"));
        }

        @Test
        @DisplayName("Should reject an unknown prioritization strategy")
        void testUnknownStrategy() {
            Map<String, Object> result = call("resolve_consistency_conflicts", Map.of(
                    "consistency_validation_data", Map.of("violations_found", List.of()),
                    "resolution_priority", "fastest"));

            assertEquals("Unknown prioritization strategy: fastest", result.get("error"));
        }
    }

    @Nested
    @DisplayName("generate_comprehensive_diagnostic_report")
    class ReportTests {

        @Test
        @DisplayName("Should run the pipeline and summarize the report")
        void testReport() {
            Map<String, Object> params = new HashMap<>();
            params.put("log_analysis_data", logAnalysis);
            params.put("component_inventory", inventory);
            params.put("document_analysis", documentAnalysis);
            params.put("report_format", "executive");

            Map<String, Object> result = call("generate_comprehensive_diagnostic_report", params);

            assertFalse(result.containsKey("error"), () -> String.valueOf(result.get("error")));
            assertNotNull(result.get("run_id"));
            Map<String, Object> summary = map(result.get("report_summary"));
            assertEquals("FAIL", summary.get("system_status"));
            Map<String, Object> report = map(result.get("diagnostic_report"));
            assertFalse(report.containsKey("detailed_findings"));
            assertFalse(list(result.get("follow_up_recommendations")).isEmpty());
        }

        @Test
        @DisplayName("Should reject an unknown report format")
        void testUnknownFormat() {
            Map<String, Object> result = call("generate_comprehensive_diagnostic_report", Map.of(
                    "component_inventory", inventory,
                    "report_format", "verbose"));

            assertTrue(result.get("error").toString().contains("verbose"));
        }
    }
}
