package ai.advisory.orchestrator;

public class UnknownAdvisorException extends AdvisoryException {
    public UnknownAdvisorException(String advisorName) {
        super("unknown advisor: " + advisorName);
    }
}
