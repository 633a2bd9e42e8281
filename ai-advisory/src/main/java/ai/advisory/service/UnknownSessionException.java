package ai.advisory.service;

import ai.advisory.orchestrator.AdvisoryException;

public class UnknownSessionException extends AdvisoryException {
    public UnknownSessionException(String sessionId) {
        super("unknown session: " + sessionId);
    }
}
