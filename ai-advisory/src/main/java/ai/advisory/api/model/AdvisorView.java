package ai.advisory.api.model;

import ai.advisory.orchestrator.AdvisorStatus;

public record AdvisorView(
        String name,
        String provider,
        String model,
        long timeoutMs,
        boolean usable,
        String unusableReason
) {
    public static AdvisorView from(AdvisorStatus status) {
        return new AdvisorView(
                status.identity().name(),
                status.identity().provider().name(),
                status.identity().config().modelId(),
                status.identity().config().timeout().toMillis(),
                status.usable(),
                status.unusableReason()
        );
    }
}
