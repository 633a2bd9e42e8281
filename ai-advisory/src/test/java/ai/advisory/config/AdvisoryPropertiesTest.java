package ai.advisory.config;

import ai.advisory.advisor.AdvisorConfig;
import ai.advisory.advisor.AdvisorIdentity;
import ai.advisory.advisor.ProviderKind;
import ai.advisory.orchestrator.RetryPolicy;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AdvisoryPropertiesTest {

    @Test
    void shouldFillProviderDefaults() {
        AdvisoryProperties.Advisor entry = new AdvisoryProperties.Advisor(
                " Grok ", "grok", null, "", "GROK_API_KEY", null, null, null);

        AdvisorIdentity identity = entry.toIdentity();

        assertEquals("Grok", identity.name());
        assertEquals(ProviderKind.GROK, identity.provider());
        assertEquals(ProviderKind.GROK.defaultEndpoint(), identity.config().endpoint());
        assertEquals("grok-beta", identity.config().modelId());
        assertEquals(AdvisorConfig.DEFAULT_TIMEOUT, identity.config().timeout());
        assertEquals("GROK_API_KEY", identity.config().credentialRef());
    }

    @Test
    void shouldHonourExplicitSettings() {
        AdvisoryProperties.Advisor entry = new AdvisoryProperties.Advisor(
                "Local", "OpenAI", "http://localhost:8000/v1/chat/completions", "llama-3", "LOCAL_KEY",
                Duration.ofSeconds(5), 512, 0.7);

        AdvisorIdentity identity = entry.toIdentity();

        assertEquals(URI.create("http://localhost:8000/v1/chat/completions"), identity.config().endpoint());
        assertEquals("llama-3", identity.config().modelId());
        assertEquals(Duration.ofSeconds(5), identity.config().timeout());
        assertEquals(512, identity.config().maxTokens());
        assertEquals(0.7, identity.config().temperature());
    }

    @Test
    void shouldRejectUnknownProviderOrBlankName() {
        assertThrows(IllegalArgumentException.class,
                () -> new AdvisoryProperties.Advisor("X", "fax", null, null, "K", null, null, null).toIdentity());
        assertThrows(IllegalArgumentException.class,
                () -> new AdvisoryProperties.Advisor("X", null, null, null, "K", null, null, null).toIdentity());
        assertThrows(IllegalArgumentException.class,
                () -> new AdvisoryProperties.Advisor(" ", "claude", null, null, "K", null, null, null).toIdentity());
        assertThrows(IllegalArgumentException.class,
                () -> new AdvisoryProperties.Advisor("X", "claude", null, null, "K", Duration.ZERO, null, null).toIdentity());
    }

    @Test
    void shouldDefaultToSingleAttempt() {
        AdvisoryProperties properties = new AdvisoryProperties(null, null);

        assertTrue(properties.advisors().isEmpty());
        assertEquals(RetryPolicy.NONE, properties.retry().toPolicy());
    }

    @Test
    void shouldResolveCredentialsFromEnvironment() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("CLAUDE_API_KEY", " sk-test ")
                .withProperty("EMPTY_KEY", "  ");
        EnvironmentCredentialResolver resolver = new EnvironmentCredentialResolver(environment);

        assertEquals(Optional.of("sk-test"), resolver.resolve("CLAUDE_API_KEY"));
        assertEquals(Optional.empty(), resolver.resolve("EMPTY_KEY"));
        assertEquals(Optional.empty(), resolver.resolve("MISSING_KEY"));
        assertEquals(Optional.empty(), resolver.resolve(null));
    }
}
