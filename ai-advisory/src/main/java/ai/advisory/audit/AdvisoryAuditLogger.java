package ai.advisory.audit;

import ai.advisory.orchestrator.AdvisorOutcome;
import ai.advisory.orchestrator.OrchestrationResult;
import ai.advisory.orchestrator.OutcomeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class AdvisoryAuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AdvisoryAuditLogger.class);

    public void logRound(String sessionId, String roundKind, OrchestrationResult result, long processingMs) {
        log.info(
                "event=advisory_round session_id={} kind={} symbol={} advisors={} ok={} error={} timeout={} proposals={} processing_ms={}",
                sessionId,
                roundKind,
                result.context().symbol(),
                result.outcomes().size(),
                result.count(OutcomeStatus.OK),
                result.count(OutcomeStatus.ERROR),
                result.count(OutcomeStatus.TIMEOUT),
                result.proposals().keySet(),
                processingMs
        );
        for (AdvisorOutcome outcome : result.outcomes()) {
            if (!outcome.isOk()) {
                log.warn(
                        "event=advisor_failed session_id={} advisor={} provider={} status={} kind={} detail={} latency_ms={}",
                        sessionId,
                        outcome.advisorName(),
                        outcome.advisor().provider(),
                        outcome.status(),
                        outcome.errorKind(),
                        outcome.errorDetail(),
                        outcome.latency().toMillis()
                );
            }
        }
    }

    public void logSession(String sessionId, String action, int advisors) {
        log.info("event=advisory_session session_id={} action={} advisors={}", sessionId, action, advisors);
    }
}
