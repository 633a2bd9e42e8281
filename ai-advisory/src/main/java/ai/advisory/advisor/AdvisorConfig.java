package ai.advisory.advisor;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

public record AdvisorConfig(
        URI endpoint,
        String modelId,
        String credentialRef,
        Duration timeout,
        int maxTokens,
        double temperature
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_TOKENS = 2048;
    public static final double DEFAULT_TEMPERATURE = 0.2;

    public AdvisorConfig {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(modelId, "modelId");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
    }

    public static AdvisorConfig defaults(ProviderKind provider, String credentialRef, Duration timeout) {
        return new AdvisorConfig(
                provider.defaultEndpoint(),
                provider.defaultModel(),
                credentialRef,
                timeout,
                DEFAULT_MAX_TOKENS,
                DEFAULT_TEMPERATURE
        );
    }
}
