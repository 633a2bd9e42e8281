package ai.advisory.execution;

import ai.advisory.proposal.TradeProposal;

/**
 * Receives validated proposals, unmodified, for execution.
 */
public interface TradeExecutionGateway {
    void submit(String advisorName, TradeProposal proposal);
}
