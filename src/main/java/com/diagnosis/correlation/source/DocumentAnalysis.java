package com.diagnosis.correlation.source;

import com.diagnosis.correlation.core.model.ModelCollections;
import com.diagnosis.correlation.core.model.Procedure;

import java.util.List;

/**
 * Structured sections parsed from troubleshooting documents.
 *
 * @param procedures           documented procedures
 * @param symptoms             listed symptoms
 * @param troubleshootingSteps listed troubleshooting steps
 */
public record DocumentAnalysis(
        List<Procedure> procedures,
        List<String> symptoms,
        List<String> troubleshootingSteps
) {
    public DocumentAnalysis {
        procedures = ModelCollections.listCopy(procedures);
        symptoms = ModelCollections.listCopy(symptoms);
        troubleshootingSteps = ModelCollections.listCopy(troubleshootingSteps);
    }

    public static DocumentAnalysis empty() {
        return new DocumentAnalysis(List.of(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return procedures.isEmpty() && symptoms.isEmpty() && troubleshootingSteps.isEmpty();
    }
}
