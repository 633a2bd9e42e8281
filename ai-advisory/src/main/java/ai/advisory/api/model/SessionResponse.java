package ai.advisory.api.model;

import java.time.Instant;
import java.util.List;

public record SessionResponse(
        String sessionId,
        Instant openedAt,
        List<AdvisorView> advisors
) {}
