package dev.flowbulk.model;

import java.util.List;

/**
 * Whether the generated code should be split, and into which classes.
 */
public record Recommendation(
    boolean shouldSplit,
    String reason,
    List<String> suggestedClassNames
) {
    public Recommendation {
        suggestedClassNames = List.copyOf(suggestedClassNames);
    }
}
