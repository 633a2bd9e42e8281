package ai.advisory.orchestrator;

public enum OutcomeStatus {
    OK,
    ERROR,
    TIMEOUT
}
