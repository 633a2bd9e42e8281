package ai.advisory.orchestrator;

import ai.advisory.advisor.AdvisorIdentity;

public record AdvisorStatus(
        AdvisorIdentity identity,
        boolean usable,
        String unusableReason
) {}
