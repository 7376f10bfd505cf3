package com.diagnosis.correlation.rules;

import com.diagnosis.correlation.cache.NormalizationCache;
import com.diagnosis.correlation.metrics.MetricsService;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalization rules for instrument component names.
 *
 * <p>Order: abbreviation expansion, spelling substitution, qualifier stripping (main, primary, secondary,
 * backup), then role-suffix stripping (unit, module, system, component). Suffix
 * stripping repeats until no role word is left at the end, which keeps
 * normalization idempotent.</p>
 */
public final class ComponentNormalizationRules {

    /**
     * Fixed abbreviation table, expanded on token boundaries.
     */
    public static final Map<String, String> ABBREVIATIONS;

    static {
        Map<String, String> abbreviations = new LinkedHashMap<>();
        abbreviations.put("temp", "temperature");
        abbreviations.put("ctrl", "control");
        abbreviations.put("sys", "system");
        abbreviations.put("mod", "module");
        abbreviations.put("det", "detector");
        abbreviations.put("opt", "optical");
        abbreviations.put("proc", "processor");
        abbreviations.put("mgmt", "management");
        abbreviations.put("intf", "interface");
        ABBREVIATIONS = Collections.unmodifiableMap(abbreviations);
    }

    /**
     * British spellings rewritten to the American form, on token boundaries.
     */
    public static final Map<String, String> SUBSTITUTIONS;

    static {
        Map<String, String> substitutions = new LinkedHashMap<>();
        substitutions.put("centre", "center");
        substitutions.put("colour", "color");
        substitutions.put("analogue", "analog");
        substitutions.put("programme", "program");
        SUBSTITUTIONS = Collections.unmodifiableMap(substitutions);
    }

    public static final List<String> QUALIFIER_WORDS = List.of("main", "primary", "secondary", "backup");
    public static final List<String> ROLE_WORDS = List.of("unit", "module", "system", "component");

    private ComponentNormalizationRules() {
        // Utility class
    }

    /**
     * Creates an engine with all component rules and no cache.
     */
    public static NormalizationEngine createDefaultEngine() {
        return new NormalizationEngine(getAllRules());
    }

    /**
     * Creates an engine with all component rules backed by the given cache.
     */
    public static NormalizationEngine createEngine(NormalizationCache cache, MetricsService metricsService) {
        return new NormalizationEngine(getAllRules(), cache, metricsService);
    }

    public static List<NormalizationRule> getAllRules() {
        List<NormalizationRule> rules = new ArrayList<>(getAbbreviationRules());
        rules.addAll(getSubstitutionRules());
        rules.addAll(getQualifierRules());
        return rules;
    }

    /**
     * Gets one rule per abbreviation, matched on word boundaries.
     */
    public static List<NormalizationRule> getAbbreviationRules() {
        List<NormalizationRule> rules = new ArrayList<>();
        ABBREVIATIONS.forEach((abbreviation, expansion) -> rules.add(
                NormalizationRule.builder()
                        .name("abbreviation-" + abbreviation)
                        .pattern("\\b" + abbreviation + "\\b")
                        .replacement(expansion)
                        .priority(10)
                        .build()));
        return rules;
    }

    public static List<NormalizationRule> getSubstitutionRules() {
        List<NormalizationRule> rules = new ArrayList<>();
        SUBSTITUTIONS.forEach((spelling, replacement) -> rules.add(
                NormalizationRule.builder()
                        .name("substitution-" + spelling)
                        .pattern("\\b" + spelling + "\\b")
                        .replacement(replacement)
                        .priority(15)
                        .build()));
        return rules;
    }

    /**
     * Gets the qualifier-prefix and role-suffix rules.
     */
    public static List<NormalizationRule> getQualifierRules() {
        return List.of(
                // Qualifier words followed by whitespace, wherever they occur
                NormalizationRule.builder()
                        .name("qualifier-prefix")
                        .pattern("\\b(" + String.join("|", QUALIFIER_WORDS) + ")\\s+")
                        .replacement("")
                        .priority(20)
                        .build(),

                NormalizationRule.builder()
                        .name("role-suffix")
                        .pattern("\\s+(" + String.join("|", ROLE_WORDS) + ")$")
                        .replacement("")
                        .priority(30)
                        .repeatUntilStable(true)
                        .build()
        );
    }
}
