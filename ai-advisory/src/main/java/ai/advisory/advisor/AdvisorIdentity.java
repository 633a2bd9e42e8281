package ai.advisory.advisor;

import java.util.Objects;

/**
 * One configured advisor. The name is the registration key and must be unique
 * within an orchestrator.
 */
public record AdvisorIdentity(
        String name,
        ProviderKind provider,
        AdvisorConfig config
) {
    public AdvisorIdentity {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(config, "config");
        if (name.isBlank()) {
            throw new IllegalArgumentException("advisor name must not be blank");
        }
    }

    public static AdvisorIdentity of(String name, ProviderKind provider, String credentialRef) {
        return new AdvisorIdentity(name, provider, AdvisorConfig.defaults(provider, credentialRef, AdvisorConfig.DEFAULT_TIMEOUT));
    }
}
