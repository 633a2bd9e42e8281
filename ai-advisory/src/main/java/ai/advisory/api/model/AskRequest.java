package ai.advisory.api.model;

import ai.advisory.orchestrator.MarketContext;

import java.time.Instant;
import java.util.Map;

public record AskRequest(
        String symbol,
        Double price,
        Map<String, Object> indicators,
        Instant timestamp,
        String question
) {
    public MarketContext toContext() {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        if (price == null) {
            throw new IllegalArgumentException("price is required");
        }
        return new MarketContext(
                symbol.trim(),
                price,
                indicators,
                timestamp == null ? Instant.now() : timestamp
        );
    }
}
