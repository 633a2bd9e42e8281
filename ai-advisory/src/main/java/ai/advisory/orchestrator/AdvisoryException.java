package ai.advisory.orchestrator;

public class AdvisoryException extends RuntimeException {
    public AdvisoryException(String message) {
        super(message);
    }

    public AdvisoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
