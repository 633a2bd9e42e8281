package ai.advisory.conversation;

public enum Role {
    USER,
    ADVISOR
}
