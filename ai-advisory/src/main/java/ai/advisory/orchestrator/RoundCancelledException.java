package ai.advisory.orchestrator;

/**
 * The caller abandoned a round (interrupt or session close). Nothing from the round was
 * appended to any history.
 */
public class RoundCancelledException extends AdvisoryException {
    public RoundCancelledException(String message) {
        super(message);
    }

    public RoundCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
