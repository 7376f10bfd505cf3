package com.diagnosis.correlation.planning;

import com.diagnosis.correlation.core.model.ResolutionItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Resolutions grouped into time windows, keeping plan order within each window.
 */
public record ImplementationTimeline(Map<TimelineBucket, List<ResolutionItem>> buckets) {

    public ImplementationTimeline {
        Map<TimelineBucket, List<ResolutionItem>> copy = new EnumMap<>(TimelineBucket.class);
        for (TimelineBucket bucket : TimelineBucket.values()) {
            List<ResolutionItem> items = buckets != null ? buckets.get(bucket) : null;
            copy.put(bucket, items != null ? List.copyOf(items) : List.of());
        }
        buckets = Collections.unmodifiableMap(copy);
    }

    public static ImplementationTimeline empty() {
        return new ImplementationTimeline(Map.of());
    }

    public static ImplementationTimeline of(List<ResolutionItem> resolutions) {
        Map<TimelineBucket, List<ResolutionItem>> buckets = new EnumMap<>(TimelineBucket.class);
        for (ResolutionItem resolution : resolutions) {
            buckets.computeIfAbsent(TimelineBucket.of(resolution), b -> new ArrayList<>()).add(resolution);
        }
        return new ImplementationTimeline(buckets);
    }

    public List<ResolutionItem> bucket(TimelineBucket bucket) {
        return buckets.get(bucket);
    }
}
