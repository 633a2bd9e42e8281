package ai.advisory.service;

import ai.advisory.advisor.AdvisorClientFactory;
import ai.advisory.audit.AdvisoryAuditLogger;
import ai.advisory.config.AdvisoryProperties;
import ai.advisory.config.CredentialResolver;
import ai.advisory.orchestrator.AdvisoryOrchestrator;
import ai.advisory.orchestrator.AdvisoryPromptBuilder;
import ai.advisory.orchestrator.AdvisorStatus;
import ai.advisory.proposal.ProposalExtractor;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Opens one orchestrator per dashboard session and registers the configured advisors on
 * it. Bad advisor entries are logged and skipped; the rest still register.
 *
 * <p>Sessions that go unused for longer than the idle timeout are closed by a periodic
 * sweep, together with their histories and worker threads.
 */
@Service
public class AdvisorySessions {
    private static final Logger log = LoggerFactory.getLogger(AdvisorySessions.class);

    private final AdvisorClientFactory clientFactory;
    private final CredentialResolver credentialResolver;
    private final ProposalExtractor proposalExtractor;
    private final AdvisoryPromptBuilder promptBuilder;
    private final AdvisoryProperties properties;
    private final AdvisoryAuditLogger auditLogger;
    private final Duration idleTimeout;
    private final Map<String, AdvisorySession> sessions = new ConcurrentHashMap<>();

    public AdvisorySessions(
            AdvisorClientFactory clientFactory,
            CredentialResolver credentialResolver,
            ProposalExtractor proposalExtractor,
            AdvisoryPromptBuilder promptBuilder,
            AdvisoryProperties properties,
            AdvisoryAuditLogger auditLogger,
            @Value("${ai.advisory.session.idle-timeout:30m}") Duration idleTimeout
    ) {
        this.clientFactory = clientFactory;
        this.credentialResolver = credentialResolver;
        this.proposalExtractor = proposalExtractor;
        this.promptBuilder = promptBuilder;
        this.properties = properties;
        this.auditLogger = auditLogger;
        if (idleTimeout.isZero() || idleTimeout.isNegative()) {
            throw new IllegalArgumentException("session idle timeout must be positive: " + idleTimeout);
        }
        this.idleTimeout = idleTimeout;
    }

    public AdvisorySession open() {
        AdvisoryOrchestrator orchestrator = new AdvisoryOrchestrator(
                clientFactory,
                credentialResolver,
                proposalExtractor,
                promptBuilder,
                properties.retry().toPolicy()
        );
        for (AdvisoryProperties.Advisor entry : properties.advisors()) {
            register(orchestrator, entry);
        }

        String id = "adv_" + UUID.randomUUID().toString().replace("-", "");
        AdvisorySession session = new AdvisorySession(id, Instant.now(), orchestrator);
        sessions.put(id, session);
        auditLogger.logSession(id, "open", orchestrator.advisors().size());
        return session;
    }

    /**
     * Adds or replaces one advisor on an open session.
     *
     * @throws IllegalArgumentException when the entry cannot be turned into an identity
     */
    public AdvisorStatus register(String sessionId, AdvisoryProperties.Advisor entry) {
        return require(sessionId).orchestrator().registerAdvisor(entry.toIdentity());
    }

    public AdvisorySession require(String sessionId) {
        AdvisorySession session = sessions.get(sessionId);
        if (session == null) {
            throw new UnknownSessionException(sessionId);
        }
        session.touch(Instant.now());
        return session;
    }

    public void close(String sessionId) {
        AdvisorySession session = sessions.remove(sessionId);
        if (session == null) {
            throw new UnknownSessionException(sessionId);
        }
        session.orchestrator().close();
        auditLogger.logSession(sessionId, "close", 0);
    }

    @Scheduled(fixedDelayString = "${ai.advisory.session.sweep-ms:60000}")
    public void sweepIdleSessions() {
        expireIdle(Instant.now());
    }

    int expireIdle(Instant now) {
        Instant cutoff = now.minus(idleTimeout);
        int expired = 0;
        for (AdvisorySession session : List.copyOf(sessions.values())) {
            if (session.lastUsedAt().isBefore(cutoff) && sessions.remove(session.id(), session)) {
                session.orchestrator().close();
                auditLogger.logSession(session.id(), "expire", 0);
                expired++;
            }
        }
        if (expired > 0) {
            log.info("event=advisory_sessions_expired count={} idle_timeout={}", expired, idleTimeout);
        }
        return expired;
    }

    @PreDestroy
    public void closeAll() {
        for (String id : List.copyOf(sessions.keySet())) {
            AdvisorySession session = sessions.remove(id);
            if (session != null) {
                session.orchestrator().close();
            }
        }
    }

    private static void register(AdvisoryOrchestrator orchestrator, AdvisoryProperties.Advisor entry) {
        try {
            orchestrator.registerAdvisor(entry.toIdentity());
        } catch (IllegalArgumentException e) {
            log.warn("event=advisor_config_invalid name={} provider={} reason={}", entry.name(), entry.provider(), e.getMessage());
        }
    }
}
