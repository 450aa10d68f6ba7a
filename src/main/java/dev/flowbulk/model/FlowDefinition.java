package dev.flowbulk.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A workflow definition in canonical form: every step category and nested list field is an array.
 */
public record FlowDefinition(
    String name,
    FlowVersion version,
    ObjectNode root
) {}
