package com.diagnosis.correlation.source;

/**
 * Names of the mention sources the engine knows about.
 */
public final class SourceTypes {

    public static final String ENGINEERING_DOCS = "engineering_docs";
    public static final String TROUBLESHOOTING_GUIDES = "troubleshooting_guides";
    public static final String LOG_ANALYSIS = "log_analysis";
    public static final String COMPONENT_INVENTORY = "component_inventory";
    public static final String DOCUMENT_ANALYSIS = "document_analysis";

    private SourceTypes() {
        // Constants class
    }
}
