package ai.advisory.api.model;

import ai.advisory.orchestrator.OrchestrationResult;

import java.time.Instant;
import java.util.List;

public record RoundResponse(
        String sessionId,
        String symbol,
        Instant contextTimestamp,
        List<OutcomeView> outcomes
) {
    public static RoundResponse from(String sessionId, OrchestrationResult round) {
        return new RoundResponse(
                sessionId,
                round.context().symbol(),
                round.context().timestamp(),
                round.outcomes().stream().map(o -> OutcomeView.from(o, round)).toList()
        );
    }
}
