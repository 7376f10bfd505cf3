package com.diagnosis.correlation.extraction;

import com.diagnosis.correlation.core.model.Mention;
import com.diagnosis.correlation.core.model.Procedure;
import com.diagnosis.correlation.source.ComponentInventory;
import com.diagnosis.correlation.source.ComponentRecord;
import com.diagnosis.correlation.source.DocumentAnalysis;
import com.diagnosis.correlation.source.LogAnalysisOutput;
import com.diagnosis.correlation.source.LogIssue;
import com.diagnosis.correlation.source.SourceData;
import com.diagnosis.correlation.source.SourceTypes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MentionExtractionTest {

    @Nested
    @DisplayName("PatternMentionExtractor")
    class ExtractorTests {

        private final PatternMentionExtractor extractor = new PatternMentionExtractor();

        @Test
        @DisplayName("Should extract role phrases and technical prefixes in order")
        void testExtractPhrases() {
            List<String> mentions = extractor.extract("Temperature sensor reading drifted near the laser diode");

            assertEquals(List.of("Temperature sensor", "laser diode"), mentions);
        }

        @Test
        @DisplayName("Should keep only the leading word before component, assembly or interface")
        void testLeadingWordPattern() {
            assertEquals(List.of("mirror"), extractor.extract("Realign the mirror assembly"));
        }

        @Test
        @DisplayName("Should return an empty list for blank text")
        void testBlank() {
            assertTrue(extractor.extract(null).isEmpty());
            assertTrue(extractor.extract("  ").isEmpty());
            assertTrue(extractor.extract("nothing to see here").isEmpty());
        }
    }

    @Nested
    @DisplayName("SourceMentionCollector")
    class CollectorTests {

        private final SourceMentionCollector collector = new SourceMentionCollector();

        @Test
        @DisplayName("Should collect mentions per source and skip absent sources")
        void testCollect() {
            ComponentInventory inventory = new ComponentInventory(
                    Map.of("Laser Diode", ComponentRecord.of("Laser Diode", "Emits light")),
                    Map.of("LD", "Laser Diode"),
                    Map.of());
            LogAnalysisOutput logs = LogAnalysisOutput.ofIssues(List.of(
                    LogIssue.of("temperature_control", "Cooling fan stalled", "HIGH",
                            List.of("ERROR temperature sensor timeout"))));

            Map<String, List<String>> bySource = collector.collect(new SourceData(logs, inventory, null));

            assertEquals(List.of(SourceTypes.LOG_ANALYSIS, SourceTypes.COMPONENT_INVENTORY),
                    List.copyOf(bySource.keySet()));
            assertEquals(List.of("temperature sensor"), bySource.get(SourceTypes.LOG_ANALYSIS));
            assertEquals(List.of("Laser Diode", "LD"), bySource.get(SourceTypes.COMPONENT_INVENTORY));
        }

        @Test
        @DisplayName("Should treat an inventory with aliases or relationships as present")
        void testInventoryWithoutComponents() {
            ComponentInventory aliasesOnly = new ComponentInventory(Map.of(), Map.of("LD", "Laser Diode"), Map.of());
            ComponentInventory relationshipsOnly = new ComponentInventory(Map.of(), Map.of(),
                    Map.of("Laser Diode", List.of("Detector Array")));

            assertFalse(aliasesOnly.isEmpty());
            assertFalse(relationshipsOnly.isEmpty());
            assertTrue(ComponentInventory.empty().isEmpty());
            assertEquals(List.of("LD"),
                    collector.collect(new SourceData(null, aliasesOnly, null)).get(SourceTypes.COMPONENT_INVENTORY));
            // relationships alone name no mentions
            assertTrue(collector.collect(new SourceData(null, relationshipsOnly, null)).isEmpty());
        }

        @Test
        @DisplayName("Should extract document mentions from procedures, symptoms and steps")
        void testDocuments() {
            DocumentAnalysis docs = new DocumentAnalysis(
                    List.of(new Procedure("Replace pressure regulator", "", List.of(), List.of())),
                    List.of("Flow controller oscillates"),
                    List.of());

            List<String> mentions = collector.collect(new SourceData(null, null, docs))
                    .get(SourceTypes.DOCUMENT_ANALYSIS);

            assertEquals(List.of("pressure regulator", "Flow controller"), mentions);
        }

        @Test
        @DisplayName("Should flatten collected lists into mentions")
        void testToMentions() {
            List<Mention> mentions = SourceMentionCollector.toMentions(
                    Map.of(SourceTypes.LOG_ANALYSIS, List.of("laser diode")));

            assertEquals(1, mentions.size());
            assertEquals(SourceTypes.LOG_ANALYSIS, mentions.get(0).sourceType());
        }
    }
}
