package dev.flowbulk.model;

/**
 * A named input or output binding whose value is a reference expression such as {@code Loop_over_Accounts.Id}.
 */
public record ValueAssignment(
    String name,
    String expression // nullable when the value is a literal we do not track
) {}
