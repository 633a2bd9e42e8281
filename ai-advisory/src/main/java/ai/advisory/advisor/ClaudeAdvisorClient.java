package ai.advisory.advisor;

import ai.advisory.conversation.Message;
import ai.advisory.conversation.Role;
import ai.advisory.orchestrator.MarketContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.util.List;

/** Anthropic Messages API. */
public class ClaudeAdvisorClient extends AbstractHttpAdvisorClient {
    static final String API_VERSION = "2023-06-01";

    public ClaudeAdvisorClient(
            AdvisorIdentity identity,
            String apiKey,
            String systemPrompt,
            ObjectMapper objectMapper,
            HttpClient httpClient
    ) {
        super(identity, apiKey, systemPrompt, objectMapper, httpClient);
    }

    @Override
    protected HttpRequest buildRequest(List<Message> messages, MarketContext context) throws JsonProcessingException {
        ArrayNode turns = objectMapper.createArrayNode();
        for (Message message : messages) {
            turns.add(objectMapper.createObjectNode()
                    .put("role", message.role() == Role.ADVISOR ? "assistant" : "user")
                    .put("content", message.text()));
        }

        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", identity.config().modelId());
        body.put("max_tokens", identity.config().maxTokens());
        body.put("temperature", identity.config().temperature());
        body.put("system", systemPrompt);
        body.set("messages", turns);

        return jsonPost(identity.config().endpoint(), body)
                .header("x-api-key", apiKey)
                .header("anthropic-version", API_VERSION)
                .build();
    }

    @Override
    protected String extractText(JsonNode root) {
        StringBuilder text = new StringBuilder();
        for (JsonNode block : root.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText());
            }
        }
        return text.toString();
    }
}
