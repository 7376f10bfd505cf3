package com.diagnosis.correlation.graph;

import com.diagnosis.correlation.core.model.FailurePatternCorrelation;
import com.diagnosis.correlation.core.model.Procedure;
import com.diagnosis.correlation.core.model.Severity;
import com.diagnosis.correlation.extraction.MentionExtractor;
import com.diagnosis.correlation.extraction.PatternMentionExtractor;
import com.diagnosis.correlation.similarity.JaccardSimilarity;
import com.diagnosis.correlation.source.DocumentAnalysis;
import com.diagnosis.correlation.source.FailureIndicator;
import com.diagnosis.correlation.source.LogAnalysisOutput;
import com.diagnosis.correlation.source.LogIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Links failure patterns to the troubleshooting procedures that address them.
 *
 * <p>Strength of a (pattern, procedure) pair is
 * {@code 0.6 x (keywords of the pattern type found in the procedure / keywords of the type)
 * + 0.4 x Jaccard(pattern description, procedure text)}, capped at 1.0. Pattern types
 * without a keyword entry only get the Jaccard part. Procedures scoring above 0.5 are
 * kept, strongest three first.</p>
 */
public class FailureProcedureCorrelator {
    private static final Logger log = LoggerFactory.getLogger(FailureProcedureCorrelator.class);

    public static final double PROCEDURE_MATCH_THRESHOLD = 0.5;
    public static final int MAX_PROCEDURES = 3;
    static final int MAX_LINES_FOR_EXTRACTION = 5;

    public static final Map<String, List<String>> FAILURE_KEYWORDS;

    static {
        Map<String, List<String>> keywords = new LinkedHashMap<>();
        keywords.put("connection_timeout", List.of("connection", "cable", "communication", "timeout"));
        keywords.put("service_failures", List.of("service", "software", "restart", "process"));
        keywords.put("memory_issues", List.of("memory", "ram", "allocation", "leak"));
        keywords.put("disk_issues", List.of("disk", "storage", "space", "write"));
        keywords.put("performance_degradation", List.of("performance", "slow", "optimization", "speed"));
        keywords.put("driver_issues", List.of("driver", "version", "compatibility", "update"));
        keywords.put("optical_alignment", List.of("optical", "alignment", "laser", "mirror"));
        keywords.put("temperature_control", List.of("temperature", "heating", "cooling", "thermal"));
        FAILURE_KEYWORDS = Collections.unmodifiableMap(keywords);
    }

    private final MentionExtractor extractor;
    private final JaccardSimilarity jaccard = new JaccardSimilarity();

    public FailureProcedureCorrelator() {
        this(new PatternMentionExtractor());
    }

    public FailureProcedureCorrelator(MentionExtractor extractor) {
        this.extractor = extractor;
    }

    /**
     * Collects failure patterns from categorized indicators, then from top issues.
     */
    public List<FailurePattern> collectFailurePatterns(LogAnalysisOutput logAnalysis) {
        List<FailurePattern> patterns = new ArrayList<>();
        logAnalysis.categorizedIndicators().forEach((category, indicators) -> {
            for (FailureIndicator indicator : indicators) {
                String type = indicator.type() != null && !indicator.type().isBlank() ? indicator.type() : category;
                patterns.add(new FailurePattern(type, indicator.description(),
                        Severity.parseOrDefault(indicator.severity(), Severity.MEDIUM),
                        indicator.confidence(), indicator.sampleLines(), List.of()));
            }
        });
        for (LogIssue issue : logAnalysis.topIssues()) {
            patterns.add(new FailurePattern(issue.type(), issue.description(),
                    Severity.parseOrDefault(issue.severity(), Severity.MEDIUM),
                    issue.confidence(), issue.sampleMatches(), issue.components()));
        }
        return patterns;
    }

    /**
     * Collects documented procedures, then turns every listed symptom and step into a
     * single-item procedure.
     */
    public List<Procedure> collectProcedures(DocumentAnalysis documents) {
        List<Procedure> procedures = new ArrayList<>(documents.procedures());
        List<String> symptoms = documents.symptoms();
        for (int i = 0; i < symptoms.size(); i++) {
            procedures.add(new Procedure("Symptom " + (i + 1) + " Resolution", symptoms.get(i),
                    List.of(symptoms.get(i)), List.of()));
        }
        List<String> steps = documents.troubleshootingSteps();
        for (int i = 0; i < steps.size(); i++) {
            procedures.add(new Procedure("Troubleshooting Step " + (i + 1), steps.get(i),
                    List.of(), List.of(steps.get(i))));
        }
        return procedures;
    }

    public List<FailurePatternCorrelation> correlate(List<FailurePattern> patterns, List<Procedure> procedures) {
        List<FailurePatternCorrelation> correlations = new ArrayList<>();

        for (FailurePattern pattern : patterns) {
            List<ScoredProcedure> matching = new ArrayList<>();
            for (Procedure procedure : procedures) {
                double strength = correlationStrength(pattern.type(), pattern.description(), procedure);
                if (strength > PROCEDURE_MATCH_THRESHOLD) {
                    matching.add(new ScoredProcedure(procedure, strength));
                }
            }
            matching.sort(Comparator.comparingDouble(ScoredProcedure::strength).reversed());

            List<String> components = pattern.components();
            if (components.isEmpty() && !pattern.matchedLines().isEmpty()) {
                List<String> lines = pattern.matchedLines();
                components = extractor.extract(String.join(" ",
                        lines.subList(0, Math.min(MAX_LINES_FOR_EXTRACTION, lines.size()))));
            }

            correlations.add(new FailurePatternCorrelation(
                    pattern.description(),
                    pattern.type(),
                    pattern.severity(),
                    components,
                    matching.stream().limit(MAX_PROCEDURES).map(ScoredProcedure::procedure).toList(),
                    matching.isEmpty() ? 0.0 : matching.get(0).strength()
            ));
        }

        log.debug("failures.correlated patterns={} procedures={}", patterns.size(), procedures.size());
        return correlations;
    }

    double correlationStrength(String patternType, String patternDescription, Procedure procedure) {
        String procedureText = procedure.searchableText();
        double score = 0.0;

        List<String> keywords = FAILURE_KEYWORDS.get(patternType);
        if (keywords != null) {
            long found = keywords.stream().filter(procedureText::contains).count();
            score += ((double) found / keywords.size()) * 0.6;
        }

        score += jaccard.compute(JaccardSimilarity.tokenize(patternDescription),
                JaccardSimilarity.tokenize(procedureText)) * 0.4;

        return Math.min(1.0, score);
    }

    private record ScoredProcedure(Procedure procedure, double strength) {
    }
}
