package ai.advisory.orchestrator;

import ai.advisory.advisor.AdvisorErrorKind;
import ai.advisory.advisor.AdvisorIdentity;

import java.time.Duration;
import java.util.Objects;

public record AdvisorOutcome(
        AdvisorIdentity advisor,
        OutcomeStatus status,
        String reply,
        AdvisorErrorKind errorKind,
        String errorDetail,
        Duration latency
) {
    public AdvisorOutcome {
        Objects.requireNonNull(advisor, "advisor");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(latency, "latency");
        if (status == OutcomeStatus.OK && reply == null) {
            throw new IllegalArgumentException("OK outcome requires a reply");
        }
        if (status != OutcomeStatus.OK && errorKind == null) {
            throw new IllegalArgumentException(status + " outcome requires an error kind");
        }
    }

    public static AdvisorOutcome ok(AdvisorIdentity advisor, String reply, Duration latency) {
        return new AdvisorOutcome(advisor, OutcomeStatus.OK, reply, null, null, latency);
    }

    public static AdvisorOutcome error(AdvisorIdentity advisor, AdvisorErrorKind kind, String detail, Duration latency) {
        return new AdvisorOutcome(advisor, OutcomeStatus.ERROR, null, kind, detail, latency);
    }

    public static AdvisorOutcome timeout(AdvisorIdentity advisor, String detail, Duration latency) {
        return new AdvisorOutcome(advisor, OutcomeStatus.TIMEOUT, null, AdvisorErrorKind.TIMEOUT, detail, latency);
    }

    public String advisorName() {
        return advisor.name();
    }

    public boolean isOk() {
        return status == OutcomeStatus.OK;
    }
}
