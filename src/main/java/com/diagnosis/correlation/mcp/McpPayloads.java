package com.diagnosis.correlation.mcp;

import com.diagnosis.correlation.api.InputValidator;
import com.diagnosis.correlation.api.InvalidInputException;
import com.diagnosis.correlation.json.JsonSupport;
import com.diagnosis.correlation.source.ComponentInventory;
import com.diagnosis.correlation.source.DocumentAnalysis;
import com.diagnosis.correlation.source.LogAnalysisOutput;
import com.diagnosis.correlation.source.SourceData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts tool parameters into engine inputs.
 *
 * <p>Whole-payload problems raise {@link InvalidInputException}. Inside a list of
 * records, each malformed record is logged and skipped.</p>
 */
final class McpPayloads {
    private static final Logger log = LoggerFactory.getLogger(McpPayloads.class);

    static final String INVENTORY_KEY = "inventory";
    static final String STRUCTURED_SECTIONS_KEY = "structured_sections";

    private McpPayloads() {
    }

    static SourceData sources(Map<String, Object> params, String logKey, String inventoryKey, String documentKey) {
        return new SourceData(
                logAnalysis(params.get(logKey), logKey),
                inventory(params.get(inventoryKey), inventoryKey),
                documents(params.get(documentKey), documentKey));
    }

    static LogAnalysisOutput logAnalysis(Object value, String name) {
        if (value == null) {
            return LogAnalysisOutput.empty();
        }
        return convert(payload(value, name), LogAnalysisOutput.class, name);
    }

    static ComponentInventory inventory(Object value, String name) {
        if (value == null) {
            return ComponentInventory.empty();
        }
        Map<String, Object> data = payload(value, name);
        Object inventory = data.getOrDefault(INVENTORY_KEY, data);
        return convert(inventory, ComponentInventory.class, name);
    }

    static DocumentAnalysis documents(Object value, String name) {
        if (value == null) {
            return DocumentAnalysis.empty();
        }
        Map<String, Object> data = payload(value, name);
        Object sections = data.getOrDefault(STRUCTURED_SECTIONS_KEY, data);
        return convert(sections, DocumentAnalysis.class, name);
    }

    /**
     * Converts every item of a list, skipping items that do not convert.
     */
    static <T> List<T> items(Object value, Class<T> type, String name) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new InvalidInputException(name + " must be a list");
        }
        List<T> items = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            try {
                items.add(JsonSupport.fromMap(list.get(i), type));
            } catch (IllegalArgumentException e) {
                log.warn("mcp.item_skipped kind={} index={} error={}", name, i, e.getMessage());
            }
        }
        return items;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> payload(Object value, String name) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new InvalidInputException(name + " must be an object");
        }
        return InputValidator.requireNoUpstreamError((Map<String, Object>) map, name);
    }

    static String string(Map<String, Object> params, String key, String defaultValue) {
        Object value = params.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static <T> T convert(Object value, Class<T> type, String name) {
        try {
            return JsonSupport.fromMap(value, type);
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("Malformed " + name + ": " + e.getMessage(), e);
        }
    }
}
