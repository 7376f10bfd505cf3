package com.diagnosis.correlation.planning;

import com.diagnosis.correlation.core.model.ConsistencyViolation;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives a stable identifier from the content of a violation:
 * {@code <type>-<first 12 hex chars of SHA-256(type | sorted sources | sorted values)>}.
 * Identical violations always get the same id, in any process.
 */
public final class ViolationIdGenerator {

    static final int HEX_LENGTH = 12;

    private ViolationIdGenerator() {
        // Utility class
    }

    public static String idFor(ConsistencyViolation violation) {
        List<String> sources = new ArrayList<>(violation.affectedSources());
        sources.sort(null);

        StringBuilder content = new StringBuilder(violation.violationType())
                .append('|').append(String.join(",", sources))
                .append('|');
        new TreeMap<>(violation.conflictingValues()).forEach((key, value) ->
                content.append(key).append('=').append(canonical(value)).append(';'));

        return violation.violationType() + "-" + sha256Hex(content.toString()).substring(0, HEX_LENGTH);
    }

    /**
     * Renders a value with collection elements and map entries in sorted order.
     */
    private static String canonical(Object value) {
        if (value instanceof Map<?, ?> map) {
            List<String> entries = new ArrayList<>();
            map.forEach((k, v) -> entries.add(k + ":" + canonical(v)));
            entries.sort(null);
            return "{" + String.join(",", entries) + "}";
        }
        if (value instanceof Collection<?> collection) {
            List<String> items = new ArrayList<>();
            collection.forEach(item -> items.add(canonical(item)));
            items.sort(null);
            return "[" + String.join(",", items) + "]";
        }
        return String.valueOf(value);
    }

    private static String sha256Hex(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
