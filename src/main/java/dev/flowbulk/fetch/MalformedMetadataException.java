package dev.flowbulk.fetch;

/**
 * The root metadata element is missing or cannot be parsed.
 */
public class MalformedMetadataException extends FlowAnalysisException {

    public MalformedMetadataException(String message) {
        super(message);
    }

    public MalformedMetadataException(String message, Throwable cause) {
        super(message, cause);
    }
}
