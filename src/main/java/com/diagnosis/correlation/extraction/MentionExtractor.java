package com.diagnosis.correlation.extraction;

import java.util.List;

/**
 * Extracts component mentions from free text.
 */
public interface MentionExtractor {

    /**
     * Returns the distinct component mentions found in the text, in order of first
     * appearance. Never null.
     */
    List<String> extract(String text);
}
