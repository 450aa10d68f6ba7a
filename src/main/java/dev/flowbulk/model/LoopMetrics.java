package dev.flowbulk.model;

/**
 * Operations found inside one loop's body.
 */
public record LoopMetrics(
    String loopName,
    int nestedDml,
    int nestedSoql,
    int nestedSubflows,
    int nestedOther
) {
    public int nestedOperations() {
        return nestedDml + nestedSoql + nestedSubflows;
    }
}
