package ai.advisory.proposal;

import java.util.List;
import java.util.Objects;

/**
 * Structured trade suggestion taken from an advisor reply. Numeric fields are
 * {@code null} when the advisor left them out; present values are finite and, for
 * BUY and SELL, ordered consistently with the action.
 */
public record TradeProposal(
        TradeAction action,
        String symbol,
        Double entry,
        Double stopLoss,
        Double takeProfit,
        Double positionSize,
        Double confidence,
        String rationale,
        String strategyName,
        Double trailingStopPercent,
        List<Double> scalingTargets
) {
    public TradeProposal {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(symbol, "symbol");
        scalingTargets = scalingTargets == null ? List.of() : List.copyOf(scalingTargets);
    }
}
