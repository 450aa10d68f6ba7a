package dev.flowbulk.model;

/**
 * Limits and thresholds used by the analysis.
 */
public record AnalyzerSettings(
    int maxRecursionDepth,
    int splitComplexityThreshold,
    int splitOperationsThreshold,
    int bulkifyScoreThreshold,
    int bulkifyComplexityThreshold
) {
    public static final int DEFAULT_MAX_RECURSION_DEPTH = 10;
    public static final int DEFAULT_SPLIT_COMPLEXITY_THRESHOLD = 15;
    public static final int DEFAULT_SPLIT_OPERATIONS_THRESHOLD = 5;
    public static final int DEFAULT_BULKIFY_SCORE_THRESHOLD = 80;
    public static final int DEFAULT_BULKIFY_COMPLEXITY_THRESHOLD = 5;

    public AnalyzerSettings {
        if (maxRecursionDepth < 1) {
            throw new IllegalArgumentException("maxRecursionDepth must be at least 1, was " + maxRecursionDepth);
        }
    }

    public static AnalyzerSettings defaults() {
        return new AnalyzerSettings(DEFAULT_MAX_RECURSION_DEPTH, DEFAULT_SPLIT_COMPLEXITY_THRESHOLD,
            DEFAULT_SPLIT_OPERATIONS_THRESHOLD, DEFAULT_BULKIFY_SCORE_THRESHOLD,
            DEFAULT_BULKIFY_COMPLEXITY_THRESHOLD);
    }

    public AnalyzerSettings withMaxRecursionDepth(int depth) {
        return new AnalyzerSettings(depth, splitComplexityThreshold, splitOperationsThreshold,
            bulkifyScoreThreshold, bulkifyComplexityThreshold);
    }
}
