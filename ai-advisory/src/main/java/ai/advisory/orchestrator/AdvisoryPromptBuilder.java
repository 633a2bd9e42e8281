package ai.advisory.orchestrator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class AdvisoryPromptBuilder {
    private static final String SYSTEM_PROMPT = """
            You are a crypto trading mentor. You receive a JSON snapshot of one asset \
            (price plus indicators such as RSI, ADX, volatility and trend) and give a \
            careful, plain-English opinion on it.

            When a trade is appropriate, include exactly one JSON object in your reply:
            {"action": "BUY|SELL|HOLD", "symbol": "...", "entry": 0, "stop_loss": 0,
             "take_profit": 0, "position_size": 0, "confidence": 0, "rationale": "..."}
            Always set a stop loss. If the situation is unclear or too risky, answer with \
            text only and no JSON.
            """;

    private final ObjectMapper objectMapper;

    public AdvisoryPromptBuilder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    public String userTurn(MarketContext context, String question) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("pair", context.symbol());
        payload.put("price", context.price());
        payload.put("timestamp", context.timestamp().toString());
        payload.put("metrics", context.indicators());

        String marketData;
        try {
            marketData = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("market context is not serializable: " + e.getOriginalMessage(), e);
        }

        StringBuilder turn = new StringBuilder("CURRENT MARKET DATA:\n").append(marketData);
        if (question != null && !question.isBlank()) {
            turn.append("\n\nUSER'S QUESTION: ").append(question.trim());
        } else {
            turn.append("\n\nPlease provide a full strategy analysis based on the current data.");
        }
        return turn.toString();
    }
}
