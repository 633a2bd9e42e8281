package ai.advisory.service;

import ai.advisory.orchestrator.AdvisoryException;

public class ProposalNotFoundException extends AdvisoryException {
    public ProposalNotFoundException(String sessionId, String advisorName) {
        super("no proposal from " + advisorName + " in the latest round of session " + sessionId);
    }
}
