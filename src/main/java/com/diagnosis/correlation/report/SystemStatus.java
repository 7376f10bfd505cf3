package com.diagnosis.correlation.report;

import java.util.Locale;
import java.util.Map;

/**
 * Overall instrument status derived from the log analyzer's risk level.
 */
public enum SystemStatus {
    PASS,
    FAIL,
    UNCERTAIN;

    public static final String RISK_LEVEL_KEY = "risk_level";

    /**
     * HIGH risk means FAIL, LOW risk means PASS, anything else (or no risk level) is UNCERTAIN.
     */
    public static SystemStatus fromAnalysisSummary(Map<String, Object> analysisSummary) {
        Object riskLevel = analysisSummary != null ? analysisSummary.get(RISK_LEVEL_KEY) : null;
        if (riskLevel == null) {
            return UNCERTAIN;
        }
        return switch (riskLevel.toString().trim().toUpperCase(Locale.ROOT)) {
            case "HIGH" -> FAIL;
            case "LOW" -> PASS;
            default -> UNCERTAIN;
        };
    }
}
