package dev.flowbulk.engine;

import dev.flowbulk.model.AnalyzerSettings;
import dev.flowbulk.model.Element;
import dev.flowbulk.model.ElementGraph;
import dev.flowbulk.model.FlowMetrics;
import dev.flowbulk.model.FlowTraits;
import dev.flowbulk.model.LoopContext;
import dev.flowbulk.model.LoopMetrics;
import dev.flowbulk.model.StepKind;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Counts operations and derives complexity and bulkification scores from a graph and its loop contexts.
 */
public final class MetricsCalculator {

    static final int DML_WEIGHT = 2;
    static final int SOQL_WEIGHT = 2;

    static final int EXTRA_DML_PENALTY = 10;
    static final int EXTRA_SOQL_PENALTY = 5;
    static final int DML_IN_LOOP_PENALTY = 30;
    static final int SOQL_IN_LOOP_PENALTY = 20;
    static final int SUBFLOW_IN_LOOP_PENALTY = 15;
    static final int BUSY_LOOP_OPERATIONS = 5;
    static final int BUSY_LOOP_MAX_PENALTY = 20;

    private MetricsCalculator() {}

    /**
     * Compute the metrics of one workflow.
     *
     * @param graph        the workflow's element graph
     * @param loopContexts the propagated loop contexts of {@code graph}
     * @param subflow      true when the workflow is analysed as a sub-workflow; nesting raises the weights
     * @param settings     bulkification thresholds
     */
    public static FlowMetrics calculate(ElementGraph graph, Map<String, LoopContext> loopContexts,
                                        boolean subflow, AnalyzerSettings settings) {
        FlowTraits traits = graph.traits();

        var counts = new EnumMap<StepKind, Integer>(StepKind.class);
        for (Element element : graph.elements().values()) {
            counts.merge(element.kind(), 1, Integer::sum);
        }

        var dmlSources = new ArrayList<String>();
        int dml = 0;
        dml += countSource(counts, StepKind.RECORD_CREATE, "Record Creates", dmlSources);
        dml += countSource(counts, StepKind.RECORD_UPDATE, "Record Updates", dmlSources);
        dml += countSource(counts, StepKind.RECORD_DELETE, "Record Deletes", dmlSources);

        var soqlSources = new ArrayList<String>();
        int lookups = countSource(counts, StepKind.RECORD_LOOKUP, "Record Lookups", soqlSources);
        int soql = lookups + traits.dynamicChoiceSets() + traits.crossObjectFormulas();
        if (traits.dynamicChoiceSets() > 0) {
            soqlSources.add("Dynamic Choice Sets");
        }
        if (traits.recordTriggered()) {
            soql++;
            soqlSources.add("Record-Triggered Flow");
        }
        if (traits.crossObjectFormulas() > 0) {
            soqlSources.add("Cross-Object Formula References");
        }

        int complexity = complexity(counts, traits, dml, lookups + traits.dynamicChoiceSets(), subflow);
        List<LoopMetrics> loops = loopMetrics(graph, loopContexts);
        int score = bulkificationScore(dml, soql, loops);

        boolean hasLoops = counts.getOrDefault(StepKind.LOOP, 0) > 0;
        boolean shouldBulkify = score < settings.bulkifyScoreThreshold()
            || dml > 0
            || soql > 0
            || complexity > settings.bulkifyComplexityThreshold()
            || hasLoops;

        String reason = reason(graph, loopContexts, settings, dml, soql, complexity, score, loops);
        return new FlowMetrics(graph.size(), counts, dml, soql, dmlSources, soqlSources,
            complexity, score, shouldBulkify, reason, loops);
    }

    private static int countSource(Map<StepKind, Integer> counts, StepKind kind, String label, List<String> sources) {
        int count = counts.getOrDefault(kind, 0);
        if (count > 0) {
            sources.add(label);
        }
        return count;
    }

    static int complexity(Map<StepKind, Integer> counts, FlowTraits traits, int dml, int soql, boolean subflow) {
        int decisionWeight = subflow ? 3 : 2;
        int loopWeight = subflow ? 4 : 3;
        int subflowWeight = subflow ? 3 : 2;

        return 1
            + counts.getOrDefault(StepKind.DECISION, 0) * decisionWeight
            + counts.getOrDefault(StepKind.LOOP, 0) * loopWeight
            + dml * DML_WEIGHT
            + soql * SOQL_WEIGHT
            + counts.getOrDefault(StepKind.SUBFLOW, 0) * subflowWeight
            + traits.crossObjectFormulas();
    }

    /**
     * Per-loop operation counts. An element is nested in a loop when its context names that loop
     * or its context path passes through it.
     */
    static List<LoopMetrics> loopMetrics(ElementGraph graph, Map<String, LoopContext> loopContexts) {
        var result = new ArrayList<LoopMetrics>();
        for (Element loop : graph.ofKind(StepKind.LOOP)) {
            int nestedDml = 0;
            int nestedSoql = 0;
            int nestedSubflows = 0;
            int nestedOther = 0;
            for (var entry : loopContexts.entrySet()) {
                Element element = graph.element(entry.getKey());
                if (element == null || element.name().equals(loop.name()) || !isNestedIn(entry.getValue(), loop.name())) {
                    continue;
                }
                if (element.kind().isDml()) {
                    nestedDml++;
                } else if (element.kind().isSoql()) {
                    nestedSoql++;
                } else if (element.kind().isInvocation()) {
                    nestedSubflows++;
                } else {
                    nestedOther++;
                }
            }
            result.add(new LoopMetrics(loop.name(), nestedDml, nestedSoql, nestedSubflows, nestedOther));
        }
        return result;
    }

    private static boolean isNestedIn(LoopContext context, String loopName) {
        return context.inLoop()
            && (loopName.equals(context.loopReferenceName()) || context.path().contains(loopName));
    }

    static int bulkificationScore(int dml, int soql, List<LoopMetrics> loops) {
        int score = 100;
        score -= EXTRA_DML_PENALTY * Math.max(0, dml - 1);
        score -= EXTRA_SOQL_PENALTY * Math.max(0, soql - 1);
        for (LoopMetrics loop : loops) {
            if (loop.nestedDml() > 0) {
                score -= DML_IN_LOOP_PENALTY;
            }
            if (loop.nestedSoql() > 0) {
                score -= SOQL_IN_LOOP_PENALTY;
            }
            if (loop.nestedSubflows() > 0) {
                score -= SUBFLOW_IN_LOOP_PENALTY;
            }
            int operations = loop.nestedOperations();
            if (operations > BUSY_LOOP_OPERATIONS) {
                score -= Math.min(BUSY_LOOP_MAX_PENALTY, (operations - BUSY_LOOP_OPERATIONS) * 2);
            }
        }
        return Math.max(0, Math.min(100, score));
    }

    private static String reason(ElementGraph graph, Map<String, LoopContext> loopContexts, AnalyzerSettings settings,
                                 int dml, int soql, int complexity, int score, List<LoopMetrics> loops) {
        var reasons = new ArrayList<String>();
        if (dml > 0) {
            reasons.add("Contains %d DML operation(s)".formatted(dml));
        }
        if (soql > 0) {
            boolean inLoop = loops.stream().anyMatch(loop -> loop.nestedSoql() > 0);
            reasons.add("Contains %d SOQL queries%s".formatted(soql, inLoop ? " (found in loop)" : ""));
        }
        if (complexity > settings.bulkifyComplexityThreshold()) {
            reasons.add("High complexity score: " + complexity);
        }
        if (!loops.isEmpty()) {
            reasons.add("Contains %d loop(s)".formatted(loops.size()));
        }
        if (score < settings.bulkifyScoreThreshold()) {
            reasons.add("Bulkification score %d is below %d".formatted(score, settings.bulkifyScoreThreshold()));
        }

        var calledInLoop = new LinkedHashSet<String>();
        for (Element element : graph.elements().values()) {
            LoopContext context = loopContexts.get(element.name());
            if (element.kind().isInvocation() && context != null && context.inLoop()) {
                String called = element.calledWorkflow();
                calledInLoop.add(called != null ? called : element.name());
            }
        }
        if (!calledInLoop.isEmpty()) {
            reasons.add("Contains subflow calls inside loop: " + String.join(", ", calledInLoop));
        }

        if (reasons.isEmpty()) {
            return "Simple flow - bulkification not required";
        }
        return reasons.stream().map(r -> "- " + r).collect(Collectors.joining("\n"));
    }
}
