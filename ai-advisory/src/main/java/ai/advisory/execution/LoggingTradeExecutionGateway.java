package ai.advisory.execution;

import ai.advisory.proposal.TradeProposal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "ai.advisory.execution", name = "mode", havingValue = "log", matchIfMissing = true)
public class LoggingTradeExecutionGateway implements TradeExecutionGateway {
    private static final Logger log = LoggerFactory.getLogger(LoggingTradeExecutionGateway.class);

    @Override
    public void submit(String advisorName, TradeProposal proposal) {
        log.info(
                "event=trade_proposal_handoff advisor={} action={} symbol={} entry={} stop_loss={} take_profit={} size={}",
                advisorName,
                proposal.action(),
                proposal.symbol(),
                proposal.entry(),
                proposal.stopLoss(),
                proposal.takeProfit(),
                proposal.positionSize()
        );
    }
}
