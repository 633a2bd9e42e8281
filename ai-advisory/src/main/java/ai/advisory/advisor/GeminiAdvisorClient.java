package ai.advisory.advisor;

import ai.advisory.conversation.Message;
import ai.advisory.conversation.Role;
import ai.advisory.orchestrator.MarketContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.util.List;

/**
 * Google Gemini {@code generateContent}. The configured endpoint is the API base; the
 * model path is appended per call.
 */
public class GeminiAdvisorClient extends AbstractHttpAdvisorClient {

    public GeminiAdvisorClient(
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
        ArrayNode contents = objectMapper.createArrayNode();
        for (Message message : messages) {
            ObjectNode turn = objectMapper.createObjectNode()
                    .put("role", message.role() == Role.ADVISOR ? "model" : "user");
            turn.putArray("parts").addObject().put("text", message.text());
            contents.add(turn);
        }

        ObjectNode body = objectMapper.createObjectNode();
        body.putObject("systemInstruction").putArray("parts").addObject().put("text", systemPrompt);
        body.set("contents", contents);
        body.putObject("generationConfig")
                .put("maxOutputTokens", identity.config().maxTokens())
                .put("temperature", identity.config().temperature());

        return jsonPost(generateContentUri(), body)
                .header("x-goog-api-key", apiKey)
                .build();
    }

    @Override
    protected String extractText(JsonNode root) {
        StringBuilder text = new StringBuilder();
        for (JsonNode part : root.path("candidates").path(0).path("content").path("parts")) {
            text.append(part.path("text").asText());
        }
        return text.toString();
    }

    URI generateContentUri() {
        String base = identity.config().endpoint().toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + "/models/" + identity.config().modelId() + ":generateContent");
    }
}
