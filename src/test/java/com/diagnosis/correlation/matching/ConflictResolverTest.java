package com.diagnosis.correlation.matching;

import com.diagnosis.correlation.source.SourceTypes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConflictResolverTest {

    private ConflictResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ConflictResolver();
    }

    @Test
    @DisplayName("Should pick the candidate with the highest priority-weighted score")
    void testWeightedResolution() {
        Map<String, List<MatchCandidate>> matches = new LinkedHashMap<>();
        matches.put(SourceTypes.LOG_ANALYSIS,
                List.of(new MatchCandidate("Laser Module", SourceTypes.LOG_ANALYSIS, 0.75)));
        matches.put(SourceTypes.ENGINEERING_DOCS,
                List.of(new MatchCandidate("Laser Diode", SourceTypes.ENGINEERING_DOCS, 0.95)));

        Resolution resolution = resolver.resolve(matches);

        assertTrue(resolution.isResolved());
        assertEquals("Laser Diode", resolution.canonicalName());
        assertEquals(0.95, resolution.confidence(), 0.0001);
        assertEquals(SourceTypes.ENGINEERING_DOCS, resolution.sourceType());
    }

    @Test
    @DisplayName("Should break ties in favour of the higher-priority source")
    void testTieBreak() {
        Map<String, List<MatchCandidate>> matches = new LinkedHashMap<>();
        matches.put(SourceTypes.LOG_ANALYSIS,
                List.of(new MatchCandidate("Laser", SourceTypes.LOG_ANALYSIS, 1.0)));
        matches.put(SourceTypes.ENGINEERING_DOCS,
                List.of(new MatchCandidate("Laser Source", SourceTypes.ENGINEERING_DOCS, 0.8)));

        Resolution resolution = resolver.resolve(matches);

        assertEquals("Laser Source", resolution.canonicalName());
        assertEquals(0.8, resolution.confidence(), 0.0001);
    }

    @Test
    @DisplayName("Should weight unknown sources with 0.5")
    void testUnknownSource() {
        Map<String, List<MatchCandidate>> matches = Map.of("vendor_portal",
                List.of(new MatchCandidate("Laser", "vendor_portal", 1.0)));

        assertEquals(0.5, resolver.resolve(matches).confidence(), 0.0001);
        assertEquals(0.5, SourcePriorities.priorityOf(null));
    }

    @Test
    @DisplayName("Should return no resolution when nothing matched")
    void testNoMatches() {
        assertFalse(resolver.resolve(Map.of()).isResolved());
        assertFalse(resolver.resolve(null).isResolved());
        assertFalse(resolver.resolve(Map.of(SourceTypes.LOG_ANALYSIS, List.of())).isResolved());
        assertEquals(0.0, resolver.resolve(Map.of()).confidence());
    }
}
