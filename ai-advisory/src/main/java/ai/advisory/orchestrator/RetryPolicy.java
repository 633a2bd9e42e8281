package ai.advisory.orchestrator;

import ai.advisory.advisor.AdvisorErrorKind;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry of transient advisor failures within one round. Attempts stay inside the
 * advisor's own timeout; {@link #NONE} makes a single attempt.
 */
public record RetryPolicy(int maxAttempts, Duration backoff) {
    public static final RetryPolicy NONE = new RetryPolicy(1, Duration.ZERO);

    public RetryPolicy {
        Objects.requireNonNull(backoff, "backoff");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        if (backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must not be negative: " + backoff);
        }
    }

    boolean shouldRetry(AdvisorErrorKind kind, int attempt, Duration remaining) {
        if (!kind.retryable()) {
            return false;
        }
        return attempt < maxAttempts && remaining.compareTo(backoff) > 0;
    }
}
