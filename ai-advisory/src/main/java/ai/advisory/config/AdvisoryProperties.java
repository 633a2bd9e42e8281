package ai.advisory.config;

import ai.advisory.advisor.AdvisorConfig;
import ai.advisory.advisor.AdvisorIdentity;
import ai.advisory.advisor.ProviderKind;
import ai.advisory.orchestrator.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * {@code ai.advisory.*}. Advisor entries are kept loosely typed so that one bad entry is
 * rejected at registration instead of failing application startup.
 */
@ConfigurationProperties(prefix = "ai.advisory")
public record AdvisoryProperties(
        List<Advisor> advisors,
        Retry retry
) {
    public AdvisoryProperties {
        advisors = advisors == null ? List.of() : List.copyOf(advisors);
        retry = retry == null ? new Retry(1, Duration.ZERO) : retry;
    }

    public record Advisor(
            String name,
            String provider,
            String endpoint,
            String model,
            String credentialRef,
            Duration timeout,
            Integer maxTokens,
            Double temperature
    ) {
        public AdvisorIdentity toIdentity() {
            if (provider == null || provider.isBlank()) {
                throw new IllegalArgumentException("advisor " + name + " has no provider");
            }
            ProviderKind kind = ProviderKind.valueOf(provider.trim().toUpperCase(Locale.ROOT));
            AdvisorConfig config = new AdvisorConfig(
                    endpoint == null || endpoint.isBlank() ? kind.defaultEndpoint() : URI.create(endpoint.trim()),
                    model == null || model.isBlank() ? kind.defaultModel() : model.trim(),
                    credentialRef,
                    timeout == null ? AdvisorConfig.DEFAULT_TIMEOUT : timeout,
                    maxTokens == null ? AdvisorConfig.DEFAULT_MAX_TOKENS : maxTokens,
                    temperature == null ? AdvisorConfig.DEFAULT_TEMPERATURE : temperature
            );
            return new AdvisorIdentity(name == null ? "" : name.trim(), kind, config);
        }
    }

    public record Retry(int maxAttempts, Duration backoff) {
        public RetryPolicy toPolicy() {
            return new RetryPolicy(Math.max(1, maxAttempts), backoff == null ? Duration.ZERO : backoff);
        }
    }
}
