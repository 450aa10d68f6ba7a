package dev.flowbulk.fetch;

/**
 * The named workflow could not be located or read.
 */
public class WorkflowNotFoundException extends FlowAnalysisException {

    private final String workflowName;

    public WorkflowNotFoundException(String workflowName, String message) {
        super(message);
        this.workflowName = workflowName;
    }

    public WorkflowNotFoundException(String workflowName, String message, Throwable cause) {
        super(message, cause);
        this.workflowName = workflowName;
    }

    public String workflowName() {
        return workflowName;
    }
}
