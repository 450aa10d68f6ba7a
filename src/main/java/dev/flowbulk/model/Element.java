package dev.flowbulk.model;

import java.util.List;

/**
 * One workflow step. Immutable for the duration of an analysis.
 */
public record Element(
    String name,
    StepKind kind,
    ElementDetails details,
    List<Edge> edges
) {
    public static final String UNNAMED = "Unnamed";

    public Element {
        edges = List.copyOf(edges);
    }

    /**
     * Name of the workflow this element calls, or null when it calls none.
     */
    public String calledWorkflow() {
        if (details instanceof ElementDetails.Subflow subflow) {
            return subflow.flowName();
        }
        if (details instanceof ElementDetails.ActionCall action && action.invokesWorkflow()) {
            return action.actionName();
        }
        return null;
    }
}
