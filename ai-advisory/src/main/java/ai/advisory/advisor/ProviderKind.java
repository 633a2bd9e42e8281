package ai.advisory.advisor;

import java.net.URI;

public enum ProviderKind {
    CLAUDE("https://api.anthropic.com/v1/messages", "claude-sonnet-4-5"),
    GEMINI("https://generativelanguage.googleapis.com/v1beta", "gemini-1.5-pro"),
    OPENAI("https://api.openai.com/v1/chat/completions", "gpt-4o-mini"),
    GROK("https://api.x.ai/v1/chat/completions", "grok-beta");

    private final URI defaultEndpoint;
    private final String defaultModel;

    ProviderKind(String defaultEndpoint, String defaultModel) {
        this.defaultEndpoint = URI.create(defaultEndpoint);
        this.defaultModel = defaultModel;
    }

    public URI defaultEndpoint() {
        return defaultEndpoint;
    }

    public String defaultModel() {
        return defaultModel;
    }
}
