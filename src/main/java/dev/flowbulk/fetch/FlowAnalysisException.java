package dev.flowbulk.fetch;

/**
 * Base of the failures that stop an analysis.
 */
public class FlowAnalysisException extends Exception {

    public FlowAnalysisException(String message) {
        super(message);
    }

    public FlowAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
