package com.diagnosis.correlation.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Locale;

/**
 * A troubleshooting procedure taken from a document.
 *
 * @param title               procedure title
 * @param description         free-text description
 * @param symptoms            symptoms the procedure addresses
 * @param troubleshootingSteps ordered steps
 */
public record Procedure(
        String title,
        String description,
        List<String> symptoms,
        List<String> troubleshootingSteps
) {
    public Procedure {
        title = title != null && !title.isBlank() ? title : "Unnamed procedure";
        description = description != null ? description : "";
        symptoms = ModelCollections.listCopy(symptoms);
        troubleshootingSteps = ModelCollections.listCopy(troubleshootingSteps);
    }

    /**
     * Lower-cased concatenation of all text fields, used for keyword matching.
     */
    @JsonIgnore
    public String searchableText() {
        return String.join(" ", title, description,
                        String.join(" ", symptoms), String.join(" ", troubleshootingSteps))
                .toLowerCase(Locale.ROOT);
    }
}
