package com.diagnosis.correlation.extraction;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-based mention extractor for instrument component names.
 *
 * <ul>
 *   <li>{@code <word> sensor|detector|controller|module|system|unit}: the whole phrase</li>
 *   <li>{@code laser|optical|temperature|pressure|flow <word>}: the whole phrase</li>
 *   <li>{@code <word> component|assembly|interface}: the leading word only</li>
 * </ul>
 */
public class PatternMentionExtractor implements MentionExtractor {

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("\\b(\\w+\\s+(?:sensor|detector|controller|module|system|unit))\\b",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b((?:laser|optical|temperature|pressure|flow)\\s+\\w+)\\b",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(\\w+)\\s+(?:component|assembly|interface)\\b",
                    Pattern.CASE_INSENSITIVE)
    );

    @Override
    public List<String> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Set<String> mentions = new LinkedHashSet<>();
        for (Pattern pattern : PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String mention = matcher.group(1).trim().replaceAll("\\s+", " ");
                if (!mention.isEmpty()) {
                    mentions.add(mention);
                }
            }
        }
        return new ArrayList<>(mentions);
    }
}
