package dev.flowbulk.model;

/**
 * Version information that accompanies every workflow fetch.
 */
public record FlowVersion(
    String version,
    String status,
    String lastModified
) {
    public static FlowVersion unknown() {
        return new FlowVersion("0", "Unknown", "");
    }

    public FlowVersion withStatus(String newStatus) {
        return new FlowVersion(version, newStatus, lastModified);
    }
}
