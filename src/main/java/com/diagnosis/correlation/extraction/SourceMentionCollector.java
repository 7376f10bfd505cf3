package com.diagnosis.correlation.extraction;

import com.diagnosis.correlation.core.model.Mention;
import com.diagnosis.correlation.core.model.Procedure;
import com.diagnosis.correlation.source.ComponentInventory;
import com.diagnosis.correlation.source.DocumentAnalysis;
import com.diagnosis.correlation.source.LogAnalysisOutput;
import com.diagnosis.correlation.source.LogIssue;
import com.diagnosis.correlation.source.SourceData;
import com.diagnosis.correlation.source.SourceTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Gathers the component mentions of each source into candidate lists keyed by source type.
 *
 * <p>Log mentions are extracted from top-issue descriptions and sample matches, document
 * mentions from every structured section, and inventory mentions are the inventory
 * component names followed by their aliases. A source with no input is left out.</p>
 */
public class SourceMentionCollector {
    private static final Logger log = LoggerFactory.getLogger(SourceMentionCollector.class);

    private final MentionExtractor extractor;

    public SourceMentionCollector() {
        this(new PatternMentionExtractor());
    }

    public SourceMentionCollector(MentionExtractor extractor) {
        this.extractor = extractor;
    }

    public Map<String, List<String>> collect(SourceData sources) {
        Map<String, List<String>> bySource = new LinkedHashMap<>();

        if (!sources.logAnalysis().topIssues().isEmpty()) {
            bySource.put(SourceTypes.LOG_ANALYSIS, fromLogs(sources.logAnalysis()));
        }
        List<String> inventoryMentions = fromInventory(sources.componentInventory());
        if (!inventoryMentions.isEmpty()) {
            bySource.put(SourceTypes.COMPONENT_INVENTORY, inventoryMentions);
        }
        if (!sources.documentAnalysis().isEmpty()) {
            bySource.put(SourceTypes.DOCUMENT_ANALYSIS, fromDocuments(sources.documentAnalysis()));
        }

        log.debug("mentions.collected sources={} counts={}", bySource.keySet(),
                bySource.values().stream().map(List::size).toList());
        return Collections.unmodifiableMap(bySource);
    }

    /**
     * Flattens collected candidate lists into mention records.
     */
    public static List<Mention> toMentions(Map<String, List<String>> bySource) {
        List<Mention> mentions = new ArrayList<>();
        bySource.forEach((source, texts) -> texts.forEach(text -> mentions.add(Mention.of(text, source))));
        return mentions;
    }

    List<String> fromLogs(LogAnalysisOutput logAnalysis) {
        Set<String> mentions = new LinkedHashSet<>();
        for (LogIssue issue : logAnalysis.topIssues()) {
            String text = issue.description() + " " + String.join(" ", issue.sampleMatches());
            mentions.addAll(extractor.extract(text));
        }
        return List.copyOf(mentions);
    }

    List<String> fromInventory(ComponentInventory inventory) {
        Set<String> mentions = new LinkedHashSet<>(inventory.components().keySet());
        mentions.addAll(inventory.aliases().keySet());
        return List.copyOf(mentions);
    }

    List<String> fromDocuments(DocumentAnalysis documents) {
        Set<String> mentions = new LinkedHashSet<>();
        for (Procedure procedure : documents.procedures()) {
            mentions.addAll(extractor.extract(procedure.title()));
            mentions.addAll(extractor.extract(procedure.description()));
            procedure.symptoms().forEach(s -> mentions.addAll(extractor.extract(s)));
            procedure.troubleshootingSteps().forEach(s -> mentions.addAll(extractor.extract(s)));
        }
        documents.symptoms().forEach(s -> mentions.addAll(extractor.extract(s)));
        documents.troubleshootingSteps().forEach(s -> mentions.addAll(extractor.extract(s)));
        return List.copyOf(mentions);
    }
}
