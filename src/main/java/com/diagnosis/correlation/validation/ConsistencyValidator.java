package com.diagnosis.correlation.validation;

import com.diagnosis.correlation.core.model.ConsistencyViolation;
import com.diagnosis.correlation.core.model.CrossReference;
import com.diagnosis.correlation.validation.rules.BrokenCrossReferenceRule;
import com.diagnosis.correlation.validation.rules.ComponentNameConflictRule;
import com.diagnosis.correlation.validation.rules.DataSourceMismatchRule;
import com.diagnosis.correlation.validation.rules.FailureSeverityMismatchRule;
import com.diagnosis.correlation.validation.rules.InconsistentFailureAssociationRule;
import com.diagnosis.correlation.validation.rules.MissingCanonicalNameRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a fixed, ordered set of consistency rules and computes the consistency metrics.
 *
 * <p>The violation list is the concatenation of every rule's output; an item may trigger
 * several rule types. A rule that fails is logged and skipped so that the other rules
 * still report.</p>
 */
public class ConsistencyValidator {
    private static final Logger log = LoggerFactory.getLogger(ConsistencyValidator.class);

    private final List<ConsistencyRule> rules;
    private final CrossReferenceValidator crossReferenceValidator;

    public ConsistencyValidator(List<ConsistencyRule> rules, CrossReferenceValidator crossReferenceValidator) {
        this.rules = List.copyOf(rules);
        this.crossReferenceValidator = crossReferenceValidator;
    }

    /**
     * Creates a validator with the standard rule set.
     */
    public static ConsistencyValidator createDefault() {
        CrossReferenceValidator crossReferenceValidator = new CrossReferenceValidator();
        return new ConsistencyValidator(List.of(
                new ComponentNameConflictRule(),
                new MissingCanonicalNameRule(),
                new DataSourceMismatchRule(),
                new FailureSeverityMismatchRule(),
                new InconsistentFailureAssociationRule(),
                new BrokenCrossReferenceRule(crossReferenceValidator)
        ), crossReferenceValidator);
    }

    public List<ConsistencyRule> getRules() {
        return rules;
    }

    public ValidationReport validate(ValidationContext context, double consistencyThreshold) {
        List<ConsistencyViolation> violations = new ArrayList<>();
        for (ConsistencyRule rule : rules) {
            try {
                List<ConsistencyViolation> found = rule.check(context);
                if (!found.isEmpty()) {
                    log.debug("Rule '{}' found {} violations", rule.violationType(), found.size());
                }
                violations.addAll(found);
            } catch (RuntimeException e) {
                log.warn("validation.rule_failed rule={} error={}", rule.violationType(), e.getMessage(), e);
            }
        }

        List<CrossReference> crossReferences = crossReferenceValidator.validate(context).crossReferences();
        ConsistencyMetrics metrics = ConsistencyMetrics.calculate(violations, crossReferences,
                context.entities().size(), context.failures().size());
        double overall = metrics.overallConsistency();

        log.info("validation.completed components={} failures={} violations={} overall={}",
                context.entities().size(), context.failures().size(), violations.size(), overall);

        return new ValidationReport(metrics, ConsistencyLevel.of(overall), overall >= consistencyThreshold,
                consistencyThreshold, violations, crossReferences,
                context.entities().size(), context.failures().size());
    }
}
