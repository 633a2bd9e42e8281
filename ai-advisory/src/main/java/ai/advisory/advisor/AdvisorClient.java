package ai.advisory.advisor;

import ai.advisory.conversation.ConversationHistory;
import ai.advisory.orchestrator.MarketContext;

/**
 * Capability shared by every provider adapter.
 */
public interface AdvisorClient {

    AdvisorIdentity identity();

    /**
     * Sends the conversation, whose last message is the new user turn, and returns the
     * advisor's reply text. Never mutates {@code history}.
     *
     * @throws AdvisorException with the failure kind when no usable reply text was obtained
     */
    String send(ConversationHistory history, MarketContext context) throws AdvisorException;
}
