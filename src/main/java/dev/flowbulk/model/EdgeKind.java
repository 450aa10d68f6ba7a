package dev.flowbulk.model;

/**
 * Which connector property an edge was read from.
 */
public enum EdgeKind {
    /** The element's {@code connector}. */
    PRIMARY,
    /** A loop's per-iteration {@code nextValueConnector}. */
    NEXT_VALUE,
    /** A loop's {@code noMoreValuesConnector} or a decision's {@code defaultConnector}. */
    DEFAULT,
    /** A {@code faultConnector}. */
    FAULT,
    /** One decision rule's connector. */
    RULE
}
