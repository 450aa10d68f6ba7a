package dev.flowbulk.model;

/**
 * One comparison inside a decision rule.
 */
public record Condition(
    String leftValueReference,
    String operator,
    String rightValue // nullable
) {}
