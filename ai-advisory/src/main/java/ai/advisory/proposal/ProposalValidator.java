package ai.advisory.proposal;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Schema and consistency checks for a parsed proposal block. Accepts the flat layout
 * ({@code entry}, {@code stop_loss}, ...) and the nested {@code trade_params} layout.
 */
final class ProposalValidator {

    private ProposalValidator() {
    }

    static Extraction validate(JsonNode root) {
        JsonNode params = root.path("trade_params").isObject() ? root.path("trade_params") : root;

        String rawAction = text(root, params, "action");
        if (rawAction == null) {
            return Extraction.invalid("missing field: action");
        }
        Optional<TradeAction> parsedAction = TradeAction.parse(rawAction);
        if (parsedAction.isEmpty()) {
            return Extraction.invalid("unknown action: " + rawAction);
        }
        TradeAction action = parsedAction.get();

        String symbol = text(root, params, "symbol", "pair");
        if (symbol == null) {
            return Extraction.invalid("missing field: symbol");
        }

        try {
            Double entry = positive("entry", number(root, params, "entry", "entry_price"));
            Double stopLoss = positive("stop_loss", number(root, params, "stop_loss", "stopLoss"));
            Double takeProfit = positive("take_profit", number(root, params, "take_profit", "takeProfit"));
            Double positionSize = positive("position_size", number(root, params, "position_size", "size", "quantity"));
            Double confidence = number(root, params, "confidence", "confidence_score");
            Double trailingStop = positive("trailing_stop_percent", number(root, params, "trailing_stop_percent"));
            List<Double> scalingTargets = numbers(root, params, "scaling_targets");

            if (action.directional() && entry == null) {
                return Extraction.invalid("missing field: entry");
            }
            String inconsistency = directionalConflict(action, entry, stopLoss, takeProfit);
            if (inconsistency != null) {
                return Extraction.invalid(inconsistency);
            }

            return Extraction.of(new TradeProposal(
                    action,
                    symbol,
                    entry,
                    stopLoss,
                    takeProfit,
                    positionSize,
                    confidence,
                    text(root, params, "rationale"),
                    text(root, params, "strategy_name"),
                    trailingStop,
                    scalingTargets
            ));
        } catch (IllegalArgumentException e) {
            return Extraction.invalid(e.getMessage());
        }
    }

    private static String directionalConflict(TradeAction action, Double entry, Double stopLoss, Double takeProfit) {
        if (!action.directional()) {
            return null;
        }
        boolean buy = action == TradeAction.BUY;
        if (entry != null && stopLoss != null && (buy ? stopLoss >= entry : stopLoss <= entry)) {
            return action + " stop_loss " + stopLoss + " is on the wrong side of entry " + entry;
        }
        if (entry != null && takeProfit != null && (buy ? takeProfit <= entry : takeProfit >= entry)) {
            return action + " take_profit " + takeProfit + " is on the wrong side of entry " + entry;
        }
        if (stopLoss != null && takeProfit != null && (buy ? stopLoss >= takeProfit : stopLoss <= takeProfit)) {
            return action + " stop_loss " + stopLoss + " and take_profit " + takeProfit + " are inverted";
        }
        return null;
    }

    private static JsonNode field(JsonNode root, JsonNode params, String... names) {
        for (String name : names) {
            JsonNode node = params.get(name);
            if (node == null || node.isNull()) {
                node = root.get(name);
            }
            if (node != null && !node.isNull()) {
                return node;
            }
        }
        return null;
    }

    private static String text(JsonNode root, JsonNode params, String... names) {
        JsonNode node = field(root, params, names);
        if (node == null || node.isContainerNode()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    private static Double number(JsonNode root, JsonNode params, String... names) {
        JsonNode node = field(root, params, names);
        return node == null ? null : toDouble(names[0], node);
    }

    private static List<Double> numbers(JsonNode root, JsonNode params, String name) {
        JsonNode node = field(root, params, name);
        if (node == null) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException(name + " must be an array");
        }
        List<Double> values = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            values.add(positive(name, toDouble(name, element)));
        }
        return values;
    }

    private static Double toDouble(String name, JsonNode node) {
        double value;
        if (node.isNumber()) {
            value = node.doubleValue();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().replace(",", "").replace("$", "").trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(name + " is not a number: " + node.asText());
            }
        } else {
            throw new IllegalArgumentException(name + " is not a number: " + node);
        }
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " is not finite: " + value);
        }
        return value;
    }

    private static Double positive(String name, Double value) {
        if (value != null && value <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
        return value;
    }
}
