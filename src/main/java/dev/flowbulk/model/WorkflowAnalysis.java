package dev.flowbulk.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The analysis of one workflow, top-level ({@code depth == 0}) or nested.
 * Analyses served from the resolver's cache are shared between parents and must be treated as read-only.
 */
@JsonPropertyOrder({"name", "depth", "version", "elementCount", "directDmlCount", "directSoqlCount",
    "complexity", "cumulativeComplexity", "cumulativeDmlCount", "cumulativeSoqlCount",
    "bulkificationScore", "shouldBulkify", "reason"})
public record WorkflowAnalysis(
    String name,
    int depth,
    FlowVersion version,
    int elementCount,
    Map<StepKind, Integer> elementCounts,
    int cumulativeElementCount,
    int directDmlCount,
    int directSoqlCount,
    List<String> dmlSources,
    List<String> soqlSources,
    int complexity,
    int cumulativeComplexity,
    int cumulativeDmlCount,
    int cumulativeSoqlCount,
    int bulkificationScore,
    boolean shouldBulkify,
    String reason,
    Map<String, LoopContext> loopContexts,
    List<LoopMetrics> loops,
    List<String> objectDependencies,
    SecurityContext securityContext,
    List<SubflowCall> subflowCalls,
    List<WorkflowAnalysis> childSubflows,
    List<Recommendation> recommendations,
    List<String> warnings
) {
    public static final String DEPTH_LIMIT_REASON = "maximum recursion depth reached";

    public WorkflowAnalysis {
        var counts = new EnumMap<StepKind, Integer>(StepKind.class);
        counts.putAll(elementCounts);
        elementCounts = Collections.unmodifiableMap(counts);
        dmlSources = List.copyOf(dmlSources);
        soqlSources = List.copyOf(soqlSources);
        loopContexts = Collections.unmodifiableMap(new LinkedHashMap<>(loopContexts));
        loops = List.copyOf(loops);
        objectDependencies = List.copyOf(objectDependencies);
        subflowCalls = List.copyOf(subflowCalls);
        childSubflows = List.copyOf(childSubflows);
        recommendations = List.copyOf(recommendations);
        warnings = List.copyOf(warnings);
    }

    /**
     * Conservative stand-in returned when sub-workflow nesting reaches the recursion limit.
     */
    public static WorkflowAnalysis depthLimit(String name, int depth) {
        return new WorkflowAnalysis(name, depth, FlowVersion.unknown(), 0, Map.of(), 0, 0, 0,
            List.of(), List.of(), 0, 0, 0, 0, 100, true, DEPTH_LIMIT_REASON,
            Map.of(), List.of(), List.of(), SecurityContext.none(), List.of(), List.of(),
            List.of(new Recommendation(false, "Max recursion depth reached", List.of("MainFlowProcessor"))),
            List.of());
    }

    @JsonIgnore
    public boolean isDepthLimit() {
        return DEPTH_LIMIT_REASON.equals(reason) && elementCount == 0;
    }

    /** Number of elements of the given kind in this workflow alone. */
    public int count(StepKind kind) {
        return elementCounts.getOrDefault(kind, 0);
    }
}
