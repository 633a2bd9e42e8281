package ai.advisory.proposal;

import java.util.Locale;
import java.util.Optional;

public enum TradeAction {
    BUY,
    SELL,
    HOLD;

    static Optional<TradeAction> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "BUY":
            case "LONG":
                return Optional.of(BUY);
            case "SELL":
            case "SHORT":
                return Optional.of(SELL);
            case "HOLD":
            case "WAIT":
                return Optional.of(HOLD);
            default:
                return Optional.empty();
        }
    }

    public boolean directional() {
        return this != HOLD;
    }
}
