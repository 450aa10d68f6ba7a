package dev.flowbulk.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Counts and scores of a single workflow, before sub-workflows are aggregated.
 */
public record FlowMetrics(
    int elementCount,
    Map<StepKind, Integer> elementCounts,
    int dmlCount,
    int soqlCount,
    List<String> dmlSources,
    List<String> soqlSources,
    int complexity,
    int bulkificationScore,
    boolean shouldBulkify,
    String reason,
    List<LoopMetrics> loops
) {
    public FlowMetrics {
        var counts = new EnumMap<StepKind, Integer>(StepKind.class);
        counts.putAll(elementCounts);
        elementCounts = Collections.unmodifiableMap(counts);
        dmlSources = List.copyOf(dmlSources);
        soqlSources = List.copyOf(soqlSources);
        loops = List.copyOf(loops);
    }
}
