package ai.advisory.orchestrator;

import ai.advisory.proposal.TradeProposal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One round: outcomes in registration order, plus proposals and soft extraction warnings
 * keyed by advisor name.
 */
public record OrchestrationResult(
        MarketContext context,
        List<AdvisorOutcome> outcomes,
        Map<String, TradeProposal> proposals,
        Map<String, String> proposalWarnings
) {
    public OrchestrationResult {
        Objects.requireNonNull(context, "context");
        outcomes = List.copyOf(outcomes);
        proposals = Collections.unmodifiableMap(new LinkedHashMap<>(proposals));
        proposalWarnings = Collections.unmodifiableMap(new LinkedHashMap<>(proposalWarnings));
    }

    public Optional<AdvisorOutcome> outcome(String advisorName) {
        return outcomes.stream()
                .filter(o -> o.advisorName().equals(advisorName))
                .findFirst();
    }

    public Optional<TradeProposal> proposal(String advisorName) {
        return Optional.ofNullable(proposals.get(advisorName));
    }

    public long count(OutcomeStatus status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }
}
