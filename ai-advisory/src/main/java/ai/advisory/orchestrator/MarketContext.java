package ai.advisory.orchestrator;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of what the advisors see for one round. Indicator values are embedded in the
 * prompt as given; nothing here checks their numeric content.
 */
public record MarketContext(
        String symbol,
        double price,
        Map<String, Object> indicators,
        Instant timestamp
) {
    public MarketContext {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(timestamp, "timestamp");
        indicators = indicators == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(indicators));
    }
}
