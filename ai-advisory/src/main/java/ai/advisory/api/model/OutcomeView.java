package ai.advisory.api.model;

import ai.advisory.orchestrator.AdvisorOutcome;
import ai.advisory.orchestrator.OrchestrationResult;
import ai.advisory.proposal.TradeProposal;

public record OutcomeView(
        String advisor,
        String provider,
        String status,
        String errorKind,
        String errorDetail,
        String reply,
        long latencyMs,
        TradeProposal proposal,
        String proposalWarning
) {
    public static OutcomeView from(AdvisorOutcome outcome, OrchestrationResult round) {
        return new OutcomeView(
                outcome.advisorName(),
                outcome.advisor().provider().name(),
                outcome.status().name(),
                outcome.errorKind() == null ? null : outcome.errorKind().name(),
                outcome.errorDetail(),
                outcome.reply(),
                outcome.latency().toMillis(),
                round.proposals().get(outcome.advisorName()),
                round.proposalWarnings().get(outcome.advisorName())
        );
    }
}
