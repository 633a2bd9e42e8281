package ai.advisory.advisor;

import ai.advisory.orchestrator.AdvisoryPromptBuilder;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Maps each {@link ProviderKind} to its adapter. All adapters share one {@link HttpClient}.
 */
@Component
public class HttpAdvisorClientFactory implements AdvisorClientFactory {
    private final ObjectMapper objectMapper;
    private final AdvisoryPromptBuilder promptBuilder;
    private final HttpClient httpClient;

    public HttpAdvisorClientFactory(
            ObjectMapper objectMapper,
            AdvisoryPromptBuilder promptBuilder,
            @Value("${ai.advisory.http.connect-timeout-ms:3000}") long connectTimeoutMs
    ) {
        this.objectMapper = objectMapper;
        this.promptBuilder = promptBuilder;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(100, connectTimeoutMs)))
                .build();
    }

    @Override
    public AdvisorClient create(AdvisorIdentity identity, String apiKey) {
        String systemPrompt = promptBuilder.systemPrompt();
        return switch (identity.provider()) {
            case CLAUDE -> new ClaudeAdvisorClient(identity, apiKey, systemPrompt, objectMapper, httpClient);
            case GEMINI -> new GeminiAdvisorClient(identity, apiKey, systemPrompt, objectMapper, httpClient);
            case OPENAI, GROK -> new OpenAiCompatibleAdvisorClient(identity, apiKey, systemPrompt, objectMapper, httpClient);
        };
    }
}
