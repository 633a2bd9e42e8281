package ai.advisory.orchestrator;

public class NoAdvisorsRegisteredException extends AdvisoryException {
    public NoAdvisorsRegisteredException() {
        super("no advisors registered");
    }
}
