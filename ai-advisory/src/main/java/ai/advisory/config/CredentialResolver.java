package ai.advisory.config;

import java.util.Optional;

/**
 * Turns a credential reference (a property or environment variable name) into the secret.
 * Empty when the reference is blank or nothing is configured under it.
 */
@FunctionalInterface
public interface CredentialResolver {
    Optional<String> resolve(String credentialRef);
}
