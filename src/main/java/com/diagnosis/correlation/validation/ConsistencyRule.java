package com.diagnosis.correlation.validation;

import com.diagnosis.correlation.core.model.ConsistencyViolation;

import java.util.List;

/**
 * An independent consistency check. Rules do not see each other's output, so they can
 * run in any order.
 */
public interface ConsistencyRule {

    /**
     * The violation type this rule emits.
     */
    String violationType();

    /**
     * Checks the context and returns the violations found, possibly none.
     */
    List<ConsistencyViolation> check(ValidationContext context);
}
