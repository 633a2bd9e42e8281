package ai.advisory.service;

import ai.advisory.audit.AdvisoryAuditLogger;
import ai.advisory.conversation.Message;
import ai.advisory.execution.TradeExecutionGateway;
import ai.advisory.orchestrator.AdvisorOutcome;
import ai.advisory.orchestrator.MarketContext;
import ai.advisory.orchestrator.OrchestrationResult;
import ai.advisory.proposal.TradeProposal;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.TimeUnit;

@Service
public class AdvisoryService {
    private final AdvisorySessions sessions;
    private final TradeExecutionGateway executionGateway;
    private final AdvisoryAuditLogger auditLogger;
    private final MeterRegistry meterRegistry;

    public AdvisoryService(
            AdvisorySessions sessions,
            TradeExecutionGateway executionGateway,
            AdvisoryAuditLogger auditLogger,
            MeterRegistry meterRegistry
    ) {
        this.sessions = sessions;
        this.executionGateway = executionGateway;
        this.auditLogger = auditLogger;
        this.meterRegistry = meterRegistry;
    }

    public OrchestrationResult askAll(String sessionId, MarketContext context, String question) {
        AdvisorySession session = sessions.require(sessionId);
        long startNs = System.nanoTime();
        OrchestrationResult result = session.orchestrator().askAll(context, question);
        return finish(session, "all", result, startNs);
    }

    public OrchestrationResult askOne(String sessionId, String advisorName, MarketContext context, String question) {
        AdvisorySession session = sessions.require(sessionId);
        long startNs = System.nanoTime();
        OrchestrationResult result = session.orchestrator().askOneRound(advisorName, context, question);
        return finish(session, "one", result, startNs);
    }

    public List<Message> history(String sessionId, String advisorName) {
        return sessions.require(sessionId).orchestrator().history(advisorName).messages();
    }

    public void reset(String sessionId, String advisorName) {
        sessions.require(sessionId).orchestrator().reset(advisorName);
    }

    public void resetAll(String sessionId) {
        sessions.require(sessionId).orchestrator().resetAll();
    }

    /**
     * Hands the advisor's proposal from the session's latest round to execution, unmodified.
     */
    public TradeProposal submitProposal(String sessionId, String advisorName) {
        AdvisorySession session = sessions.require(sessionId);
        TradeProposal proposal = session.lastRound()
                .flatMap(round -> round.proposal(advisorName))
                .orElseThrow(() -> new ProposalNotFoundException(sessionId, advisorName));
        executionGateway.submit(advisorName, proposal);
        Counter.builder("ai_advisory_proposal_submitted_total")
                .tag("advisor", advisorName)
                .register(meterRegistry)
                .increment();
        return proposal;
    }

    private OrchestrationResult finish(AdvisorySession session, String kind, OrchestrationResult result, long startNs) {
        long processingMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
        session.lastRound(result);
        recordMetrics(kind, result, processingMs);
        auditLogger.logRound(session.id(), kind, result, processingMs);
        return result;
    }

    private void recordMetrics(String kind, OrchestrationResult result, long processingMs) {
        Counter.builder("ai_advisory_round_total")
                .tag("kind", kind)
                .register(meterRegistry)
                .increment();

        for (AdvisorOutcome outcome : result.outcomes()) {
            Counter.builder("ai_advisory_outcome_total")
                    .tag("advisor", outcome.advisorName())
                    .tag("status", outcome.status().name())
                    .register(meterRegistry)
                    .increment();
        }
        result.proposals().keySet().forEach(advisor -> proposalCounter(advisor, "valid"));
        result.proposalWarnings().keySet().forEach(advisor -> proposalCounter(advisor, "invalid"));

        Timer.builder("ai_advisory_round_latency")
                .tag("kind", kind)
                .publishPercentileHistogram()
                .register(meterRegistry)
                .record(processingMs, TimeUnit.MILLISECONDS);
    }

    private void proposalCounter(String advisor, String outcome) {
        Counter.builder("ai_advisory_proposal_total")
                .tag("advisor", advisor)
                .tag("result", outcome)
                .register(meterRegistry)
                .increment();
    }
}
