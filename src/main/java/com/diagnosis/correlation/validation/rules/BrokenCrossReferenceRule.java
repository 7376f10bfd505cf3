package com.diagnosis.correlation.validation.rules;

import com.diagnosis.correlation.core.model.ConsistencyViolation;
import com.diagnosis.correlation.core.model.ViolationTypes;
import com.diagnosis.correlation.validation.ConsistencyRule;
import com.diagnosis.correlation.validation.CrossReferenceValidator;
import com.diagnosis.correlation.validation.ValidationContext;

import java.util.List;

/**
 * Flags failure patterns and documented relationships naming components that do not
 * resolve to any canonical entity.
 */
public class BrokenCrossReferenceRule implements ConsistencyRule {

    private final CrossReferenceValidator crossReferenceValidator;

    public BrokenCrossReferenceRule(CrossReferenceValidator crossReferenceValidator) {
        this.crossReferenceValidator = crossReferenceValidator;
    }

    @Override
    public String violationType() {
        return ViolationTypes.BROKEN_CROSS_REFERENCE;
    }

    @Override
    public List<ConsistencyViolation> check(ValidationContext context) {
        return crossReferenceValidator.validate(context).violations();
    }
}
