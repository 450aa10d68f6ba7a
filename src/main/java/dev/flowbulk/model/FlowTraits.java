package dev.flowbulk.model;

/**
 * Workflow-level facts outside the step graph that still cost queries.
 */
public record FlowTraits(
    int dynamicChoiceSets,
    boolean recordTriggered,
    int crossObjectFormulas
) {
    public static FlowTraits none() {
        return new FlowTraits(0, false, 0);
    }
}
