package ai.advisory.service;

import ai.advisory.orchestrator.AdvisoryOrchestrator;
import ai.advisory.orchestrator.OrchestrationResult;

import java.time.Instant;
import java.util.Optional;

/**
 * One dashboard session: its orchestrator (and with it the conversation store) plus the
 * latest round, kept for proposal hand-off.
 */
public class AdvisorySession {
    private final String id;
    private final Instant openedAt;
    private final AdvisoryOrchestrator orchestrator;
    private volatile OrchestrationResult lastRound;
    private volatile Instant lastUsedAt;

    AdvisorySession(String id, Instant openedAt, AdvisoryOrchestrator orchestrator) {
        this.id = id;
        this.openedAt = openedAt;
        this.orchestrator = orchestrator;
        this.lastUsedAt = openedAt;
    }

    public String id() {
        return id;
    }

    public Instant openedAt() {
        return openedAt;
    }

    public Instant lastUsedAt() {
        return lastUsedAt;
    }

    void touch(Instant now) {
        this.lastUsedAt = now;
    }

    public AdvisoryOrchestrator orchestrator() {
        return orchestrator;
    }

    public Optional<OrchestrationResult> lastRound() {
        return Optional.ofNullable(lastRound);
    }

    void lastRound(OrchestrationResult result) {
        this.lastRound = result;
    }
}
