package dev.flowbulk.model;

/**
 * One call site of a sub-workflow inside the analysed workflow.
 */
public record SubflowCall(
    String elementName,
    String flowName,
    boolean inLoop,
    String loopReferenceName // nullable
) {}
