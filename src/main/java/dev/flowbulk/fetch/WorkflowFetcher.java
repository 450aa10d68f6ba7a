package dev.flowbulk.fetch;

/**
 * Abstraction over where workflow definitions come from (local files, a remote metadata service).
 */
public interface WorkflowFetcher {

    /**
     * Fetch the raw metadata of a workflow.
     *
     * @param nameOrPath workflow name, or a path the fetcher understands
     * @return the raw metadata and its version record
     * @throws WorkflowNotFoundException when nothing matches {@code nameOrPath} or it cannot be read
     */
    RawMetadata fetch(String nameOrPath) throws WorkflowNotFoundException;

    /** Short description used in log messages. */
    String describe();
}
