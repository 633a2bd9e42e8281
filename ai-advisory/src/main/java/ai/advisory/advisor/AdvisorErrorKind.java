package ai.advisory.advisor;

public enum AdvisorErrorKind {
    UNAUTHENTICATED,
    RATE_LIMITED,
    UNREACHABLE,
    MALFORMED_RESPONSE,
    TIMEOUT;

    /** Failures worth another attempt within the same round. A timeout has spent the budget. */
    public boolean retryable() {
        return this == RATE_LIMITED || this == UNREACHABLE;
    }
}
