package com.diagnosis.correlation.source;

/**
 * The three extractor outputs a correlation run works from. Missing inputs are
 * replaced with empty ones.
 *
 * @param logAnalysis        log analyzer output
 * @param componentInventory component inventory
 * @param documentAnalysis   parsed troubleshooting documents
 */
public record SourceData(
        LogAnalysisOutput logAnalysis,
        ComponentInventory componentInventory,
        DocumentAnalysis documentAnalysis
) {
    public SourceData {
        logAnalysis = logAnalysis != null ? logAnalysis : LogAnalysisOutput.empty();
        componentInventory = componentInventory != null ? componentInventory : ComponentInventory.empty();
        documentAnalysis = documentAnalysis != null ? documentAnalysis : DocumentAnalysis.empty();
    }

    public static SourceData empty() {
        return new SourceData(null, null, null);
    }

    public boolean isEmpty() {
        return logAnalysis.isEmpty() && componentInventory.isEmpty() && documentAnalysis.isEmpty();
    }
}
