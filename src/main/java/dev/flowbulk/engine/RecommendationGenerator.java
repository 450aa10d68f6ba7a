package dev.flowbulk.engine;

import dev.flowbulk.model.AnalyzerSettings;
import dev.flowbulk.model.FlowMetrics;
import dev.flowbulk.model.LoopMetrics;
import dev.flowbulk.model.Recommendation;
import dev.flowbulk.model.StepKind;
import dev.flowbulk.model.WorkflowAnalysis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;

/**
 * Decides whether generated code for a workflow should be split into several classes.
 */
public final class RecommendationGenerator {

    static final String DEFAULT_CLASS_NAME = "MainFlowProcessor";
    static final String SIMPLE_REASON = "Simple flow structure - single class recommended";

    /** Groups of sub-workflows, in the priority their classification rule checks them. */
    enum SubflowGroup {
        DATA_ACCESS("DataService"),
        DATA_MODIFICATION("DataManager"),
        BUSINESS_LOGIC("BusinessService"),
        UTILITY("Processor");

        private final String classSuffix;

        SubflowGroup(String classSuffix) {
            this.classSuffix = classSuffix;
        }

        String classSuffix() {
            return classSuffix;
        }

        static SubflowGroup of(WorkflowAnalysis child) {
            if (child.count(StepKind.RECORD_LOOKUP) > 0) {
                return DATA_ACCESS;
            }
            if (child.count(StepKind.RECORD_CREATE) > 0
                || child.count(StepKind.RECORD_UPDATE) > 0
                || child.count(StepKind.RECORD_DELETE) > 0) {
                return DATA_MODIFICATION;
            }
            if (child.count(StepKind.DECISION) > 0) {
                return BUSINESS_LOGIC;
            }
            return UTILITY;
        }
    }

    private RecommendationGenerator() {}

    /**
     * Build the split recommendation from cumulative metrics.
     *
     * @param visited names of the workflows on the call chain; children with these names are already grouped
     */
    public static Recommendation generate(int cumulativeComplexity, int cumulativeDml, int cumulativeSoql,
                                          List<WorkflowAnalysis> children, Collection<String> visited,
                                          AnalyzerSettings settings) {
        var reasons = new ArrayList<String>();
        if (cumulativeComplexity > settings.splitComplexityThreshold()) {
            reasons.add("High cumulative complexity (%d > %d)"
                .formatted(cumulativeComplexity, settings.splitComplexityThreshold()));
        }
        int operations = cumulativeDml + cumulativeSoql;
        if (operations > settings.splitOperationsThreshold()) {
            reasons.add("High number of database operations (%d > %d)"
                .formatted(operations, settings.splitOperationsThreshold()));
        }
        boolean shouldSplit = !reasons.isEmpty();
        String reason = shouldSplit ? String.join(", ", reasons) : SIMPLE_REASON;
        return new Recommendation(shouldSplit, reason, suggestedClassNames(children, visited));
    }

    /**
     * Advice that does not call for a split: one entry per loop that runs DML or SOQL per
     * iteration, then hints for a workflow with several DML operations or several queries of its own.
     */
    public static List<Recommendation> loopAdvice(FlowMetrics metrics) {
        var advice = new ArrayList<Recommendation>();
        for (LoopMetrics loop : metrics.loops()) {
            if (loop.nestedDml() > 0) {
                advice.add(advice("Move DML operations outside of loop in element: " + loop.loopName()));
            }
            if (loop.nestedSoql() > 0) {
                advice.add(advice("Move SOQL queries outside of loop in element: " + loop.loopName()));
            }
        }
        if (metrics.dmlCount() > 1) {
            advice.add(advice("Consider consolidating multiple DML operations"));
        }
        if (metrics.soqlCount() > 1) {
            advice.add(advice("Consider combining SOQL queries where possible"));
        }
        return advice;
    }

    private static Recommendation advice(String reason) {
        return new Recommendation(false, reason, List.of());
    }

    static List<String> suggestedClassNames(List<WorkflowAnalysis> children, Collection<String> visited) {
        var groups = new EnumMap<SubflowGroup, List<WorkflowAnalysis>>(SubflowGroup.class);
        for (WorkflowAnalysis child : children) {
            if (visited.contains(child.name())) {
                continue;
            }
            groups.computeIfAbsent(SubflowGroup.of(child), g -> new ArrayList<>()).add(child);
        }
        if (groups.isEmpty()) {
            return List.of(DEFAULT_CLASS_NAME);
        }
        var names = new ArrayList<String>();
        groups.forEach((group, members) -> names.add(sanitize(members.get(0).name()) + group.classSuffix()));
        return names;
    }

    /** Strips everything but ASCII letters and digits. */
    static String sanitize(String name) {
        return name == null ? "" : name.replaceAll("[^A-Za-z0-9]", "");
    }
}
