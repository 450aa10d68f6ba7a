package dev.flowbulk.fetch;

import dev.flowbulk.model.FlowVersion;

/**
 * Workflow metadata exactly as fetched, XML or JSON text, with its version record.
 */
public record RawMetadata(
    String name,
    String content,
    FlowVersion version
) {}
