package ai.advisory.advisor;

import ai.advisory.conversation.ConversationHistory;
import ai.advisory.conversation.Message;
import ai.advisory.orchestrator.MarketContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Transport and failure mapping shared by the provider adapters. Subclasses only shape the
 * request body and unwrap the reply text.
 */
public abstract class AbstractHttpAdvisorClient implements AdvisorClient {
    protected final AdvisorIdentity identity;
    protected final ObjectMapper objectMapper;
    protected final String apiKey;
    protected final String systemPrompt;
    private final HttpClient httpClient;

    protected AbstractHttpAdvisorClient(
            AdvisorIdentity identity,
            String apiKey,
            String systemPrompt,
            ObjectMapper objectMapper,
            HttpClient httpClient
    ) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.objectMapper = objectMapper;
        this.systemPrompt = systemPrompt;
        this.httpClient = httpClient;
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("api key is required for " + identity.name());
        }
        this.apiKey = apiKey;
    }

    @Override
    public AdvisorIdentity identity() {
        return identity;
    }

    @Override
    public String send(ConversationHistory history, MarketContext context) throws AdvisorException {
        Objects.requireNonNull(history, "history");
        Objects.requireNonNull(context, "context");
        if (!identity.name().equals(history.advisorName())) {
            throw new IllegalArgumentException("history of " + history.advisorName() + " sent to " + identity.name());
        }
        List<Message> messages = history.messages();
        if (messages.isEmpty()) {
            throw new IllegalArgumentException("history must end with the new user turn");
        }

        HttpRequest request;
        try {
            request = buildRequest(alternating(messages), context);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("could not encode request for " + identity.name(), e);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new AdvisorException(AdvisorErrorKind.TIMEOUT, identity.provider() + " request timed out", e);
        } catch (IOException e) {
            throw new AdvisorException(AdvisorErrorKind.UNREACHABLE, identity.provider() + " unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AdvisorException(AdvisorErrorKind.UNREACHABLE, identity.provider() + " call interrupted", e);
        }

        checkStatus(response);

        JsonNode root;
        try {
            root = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new AdvisorException(AdvisorErrorKind.MALFORMED_RESPONSE, identity.provider() + " returned invalid JSON", e);
        }
        String text = extractText(root);
        if (text == null || text.isBlank()) {
            throw new AdvisorException(AdvisorErrorKind.MALFORMED_RESPONSE, identity.provider() + " returned no reply text");
        }
        return text;
    }

    protected abstract HttpRequest buildRequest(List<Message> messages, MarketContext context) throws JsonProcessingException;

    /** Reply text from a 2xx body, or {@code null} when the shape is not recognised. */
    protected abstract String extractText(JsonNode root);

    protected HttpRequest.Builder jsonPost(URI uri, ObjectNode body) throws JsonProcessingException {
        return HttpRequest.newBuilder()
                .uri(uri)
                .timeout(identity.config().timeout())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));
    }

    /**
     * Folds consecutive turns of the same role into one. A failed call leaves a user turn
     * without a reply, and providers expect user and assistant turns to alternate.
     */
    static List<Message> alternating(List<Message> messages) {
        List<Message> turns = new ArrayList<>(messages.size());
        for (Message message : messages) {
            int last = turns.size() - 1;
            if (last >= 0 && turns.get(last).role() == message.role()) {
                Message previous = turns.get(last);
                turns.set(last, new Message(message.role(), previous.text() + "\n\n" + message.text(), message.timestamp()));
            } else {
                turns.add(message);
            }
        }
        return turns;
    }

    private void checkStatus(HttpResponse<String> response) throws AdvisorException {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return;
        }
        String detail = identity.provider() + " returned HTTP " + status;
        if (status == 401 || status == 403) {
            throw new AdvisorException(AdvisorErrorKind.UNAUTHENTICATED, detail);
        }
        if (status == 429) {
            throw new AdvisorException(AdvisorErrorKind.RATE_LIMITED, detail);
        }
        if (status >= 500) {
            throw new AdvisorException(AdvisorErrorKind.UNREACHABLE, detail);
        }
        throw new AdvisorException(AdvisorErrorKind.MALFORMED_RESPONSE, detail);
    }
}
