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

/**
 * Chat Completions wire format, spoken by OpenAI and by xAI's Grok endpoint.
 */
public class OpenAiCompatibleAdvisorClient extends AbstractHttpAdvisorClient {

    public OpenAiCompatibleAdvisorClient(
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
        ArrayNode turns = objectMapper.createArrayNode()
                .add(objectMapper.createObjectNode()
                        .put("role", "system")
                        .put("content", systemPrompt));
        for (Message message : messages) {
            turns.add(objectMapper.createObjectNode()
                    .put("role", message.role() == Role.ADVISOR ? "assistant" : "user")
                    .put("content", message.text()));
        }

        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", identity.config().modelId());
        body.put("temperature", identity.config().temperature());
        body.put("max_tokens", identity.config().maxTokens());
        body.set("messages", turns);

        return jsonPost(identity.config().endpoint(), body)
                .header("Authorization", "Bearer " + apiKey)
                .build();
    }

    @Override
    protected String extractText(JsonNode root) {
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        return content.isMissingNode() || content.isNull() ? null : content.asText();
    }
}
