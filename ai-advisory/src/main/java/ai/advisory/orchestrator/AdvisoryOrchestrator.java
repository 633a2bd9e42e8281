package ai.advisory.orchestrator;

import ai.advisory.advisor.AdvisorClient;
import ai.advisory.advisor.AdvisorClientFactory;
import ai.advisory.advisor.AdvisorErrorKind;
import ai.advisory.advisor.AdvisorException;
import ai.advisory.advisor.AdvisorIdentity;
import ai.advisory.config.CredentialResolver;
import ai.advisory.conversation.ConversationHistory;
import ai.advisory.conversation.ConversationStore;
import ai.advisory.conversation.Message;
import ai.advisory.proposal.Extraction;
import ai.advisory.proposal.ProposalExtractor;
import ai.advisory.proposal.TradeProposal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Session-scoped fan-out of market rounds to the registered advisors.
 *
 * <p>Every dispatched advisor gets its own task and its own deadline; the caller waits
 * until each task has replied, failed or timed out. Per-advisor failures become
 * {@link AdvisorOutcome}s. History is only written on the calling thread, after the whole
 * round has settled, so an abandoned round leaves every history untouched.
 *
 * <p>Rounds touching the same advisor are serialized by a per-advisor lock, taken in
 * registration order.
 */
public class AdvisoryOrchestrator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AdvisoryOrchestrator.class);
    private static final AtomicInteger THREAD_SEQ = new AtomicInteger();

    private final AdvisorClientFactory clientFactory;
    private final CredentialResolver credentialResolver;
    private final ProposalExtractor proposalExtractor;
    private final AdvisoryPromptBuilder promptBuilder;
    private final RetryPolicy retryPolicy;
    private final ConversationStore conversations = new ConversationStore();
    private final Map<String, Registration> registrations = new LinkedHashMap<>();
    private final Set<Call> inFlight = ConcurrentHashMap.newKeySet();
    private final ExecutorService executor = Executors.newCachedThreadPool(task -> {
        Thread thread = new Thread(task, "advisor-call-" + THREAD_SEQ.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });
    private volatile boolean closed;

    public AdvisoryOrchestrator(
            AdvisorClientFactory clientFactory,
            CredentialResolver credentialResolver,
            ProposalExtractor proposalExtractor,
            AdvisoryPromptBuilder promptBuilder,
            RetryPolicy retryPolicy
    ) {
        this.clientFactory = clientFactory;
        this.credentialResolver = credentialResolver;
        this.proposalExtractor = proposalExtractor;
        this.promptBuilder = promptBuilder;
        this.retryPolicy = retryPolicy;
    }

    /**
     * Registers or replaces an advisor by name. A replacement keeps the advisor's history
     * and its position in registration order. An advisor whose credential cannot be
     * resolved stays registered but is never dispatched.
     */
    public synchronized AdvisorStatus registerAdvisor(AdvisorIdentity identity) {
        if (closed) {
            throw new IllegalStateException("orchestrator is closed");
        }
        Registration previous = registrations.get(identity.name());
        ReentrantLock lock = previous != null ? previous.lock : new ReentrantLock();

        Registration next;
        String credentialRef = identity.config().credentialRef();
        Optional<String> credential = credentialResolver.resolve(credentialRef);
        if (credential.isEmpty()) {
            log.warn("event=advisor_unauthenticated advisor={} provider={} credential_ref={}",
                    identity.name(), identity.provider(), credentialRef);
            next = new Registration(identity, null, "credential not configured: " + credentialRef, lock);
        } else {
            try {
                next = new Registration(identity, clientFactory.create(identity, credential.get()), null, lock);
                log.info("event=advisor_registered advisor={} provider={} model={} timeout_ms={} replaced={}",
                        identity.name(), identity.provider(), identity.config().modelId(),
                        identity.config().timeout().toMillis(), previous != null);
            } catch (RuntimeException e) {
                log.warn("event=advisor_rejected advisor={} provider={} reason={}",
                        identity.name(), identity.provider(), e.getMessage(), e);
                next = new Registration(identity, null, "invalid configuration: " + e.getMessage(), lock);
            }
        }
        registrations.put(identity.name(), next);
        return next.status();
    }

    public synchronized List<AdvisorStatus> advisors() {
        List<AdvisorStatus> statuses = new ArrayList<>(registrations.size());
        registrations.values().forEach(r -> statuses.add(r.status()));
        return statuses;
    }

    public OrchestrationResult askAll(MarketContext context) {
        return askAll(context, null);
    }

    /**
     * Asks every usable advisor at once. Fails only when nothing is registered; every
     * per-advisor failure is reported in the result.
     */
    public OrchestrationResult askAll(MarketContext context, String question) {
        List<Registration> targets = new ArrayList<>();
        synchronized (this) {
            if (registrations.isEmpty()) {
                throw new NoAdvisorsRegisteredException();
            }
            registrations.values().stream().filter(Registration::usable).forEach(targets::add);
        }
        return runRound(targets, context, question);
    }

    public AdvisorOutcome askOne(String advisorName, MarketContext context) {
        return askOne(advisorName, context, null);
    }

    public AdvisorOutcome askOne(String advisorName, MarketContext context, String question) {
        return askOneRound(advisorName, context, question).outcomes().get(0);
    }

    /**
     * Same as {@link #askOne(String, MarketContext, String)} but keeps the extracted
     * proposal alongside the single outcome.
     */
    public OrchestrationResult askOneRound(String advisorName, MarketContext context, String question) {
        Registration target;
        synchronized (this) {
            target = registrations.get(advisorName);
        }
        if (target == null) {
            throw new UnknownAdvisorException(advisorName);
        }
        return runRound(List.of(target), context, question);
    }

    public ConversationHistory history(String advisorName) {
        requireRegistered(advisorName);
        return ConversationHistory.detached(advisorName, conversations.get(advisorName).messages());
    }

    public void reset(String advisorName) {
        requireRegistered(advisorName);
        conversations.reset(advisorName);
    }

    public void resetAll() {
        conversations.resetAll();
    }

    /**
     * Ends the session: cancels outstanding calls, stops the worker pool and destroys
     * every history. Rounds still waiting fail with {@link RoundCancelledException}.
     */
    @Override
    public void close() {
        closed = true;
        inFlight.forEach(Call::cancel);
        executor.shutdownNow();
        conversations.close();
    }

    public boolean isClosed() {
        return closed;
    }

    private synchronized void requireRegistered(String advisorName) {
        if (!registrations.containsKey(advisorName)) {
            throw new UnknownAdvisorException(advisorName);
        }
    }

    private OrchestrationResult runRound(List<Registration> targets, MarketContext context, String question) {
        if (context == null) {
            throw new IllegalArgumentException("market context is required");
        }
        ensureOpen();
        Message userTurn = Message.user(promptBuilder.userTurn(context, question));

        List<ReentrantLock> held = new ArrayList<>(targets.size());
        try {
            for (Registration target : targets) {
                target.lock.lockInterruptibly();
                held.add(target.lock);
            }
            return dispatchAndCollect(targets, context, userTurn);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RoundCancelledException("interrupted while waiting for an outstanding round", e);
        } finally {
            for (int i = held.size() - 1; i >= 0; i--) {
                held.get(i).unlock();
            }
        }
    }

    private OrchestrationResult dispatchAndCollect(List<Registration> targets, MarketContext context, Message userTurn) {
        ensureOpen();
        List<Call> calls = new ArrayList<>(targets.size());
        for (Registration target : targets) {
            calls.add(start(target, context, userTurn));
        }

        CompletableFuture<?>[] slots = calls.stream().map(c -> c.outcome).toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(slots).get();
        } catch (InterruptedException e) {
            calls.forEach(Call::cancel);
            Thread.currentThread().interrupt();
            throw new RoundCancelledException("round abandoned by caller", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("outcome slot failed", e.getCause());
        }
        if (closed) {
            throw new RoundCancelledException("session closed during round");
        }

        List<AdvisorOutcome> outcomes = new ArrayList<>(calls.size());
        Map<String, TradeProposal> proposals = new LinkedHashMap<>();
        Map<String, String> warnings = new LinkedHashMap<>();
        for (Call call : calls) {
            AdvisorOutcome outcome = call.outcome.join();
            outcomes.add(outcome);
            if (call.dispatched) {
                record(outcome, userTurn);
            }
            if (outcome.isOk()) {
                Extraction extraction = proposalExtractor.inspect(outcome.reply());
                switch (extraction.kind()) {
                    case PROPOSAL -> proposals.put(outcome.advisorName(), extraction.proposal());
                    case INVALID -> {
                        log.warn("event=proposal_invalid advisor={} reason={}", outcome.advisorName(), extraction.reason());
                        warnings.put(outcome.advisorName(), extraction.reason());
                    }
                    case NONE -> {
                    }
                }
            }
        }
        return new OrchestrationResult(context, outcomes, proposals, warnings);
    }

    private void record(AdvisorOutcome outcome, Message userTurn) {
        String name = outcome.advisorName();
        try {
            conversations.append(name, userTurn);
            if (outcome.isOk()) {
                conversations.append(name, Message.advisor(outcome.reply()));
            }
        } catch (RuntimeException e) {
            log.error("event=history_append_failed advisor={}", name, e);
        }
    }

    private Call start(Registration target, MarketContext context, Message userTurn) {
        AdvisorIdentity identity = target.identity;
        if (!target.usable()) {
            AdvisorOutcome outcome = AdvisorOutcome.error(identity, AdvisorErrorKind.UNAUTHENTICATED, target.unusableReason, Duration.ZERO);
            return new Call(false, new CompletableFuture<>(), null, CompletableFuture.completedFuture(outcome));
        }

        Duration timeout = identity.config().timeout();
        ConversationHistory history = conversations.get(identity.name()).extendedWith(userTurn);
        long startedNs = System.nanoTime();
        long deadlineNs = startedNs + timeout.toNanos();

        CompletableFuture<String> reply = new CompletableFuture<>();
        Future<?> task;
        try {
            task = executor.submit(() -> {
                try {
                    reply.complete(callWithRetry(target, history, context, deadlineNs));
                } catch (AdvisorException | RuntimeException e) {
                    reply.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            throw new RoundCancelledException("session closed", e);
        }
        reply.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);

        CompletableFuture<AdvisorOutcome> outcome = new CompletableFuture<>();
        Call call = new Call(true, reply, task, outcome);
        inFlight.add(call);
        reply.whenComplete((text, error) -> {
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            if (cause instanceof TimeoutException || cause instanceof CancellationException) {
                task.cancel(true);
            }
            inFlight.remove(call);
            outcome.complete(toOutcome(identity, text, cause, Duration.ofNanos(System.nanoTime() - startedNs)));
        });
        return call;
    }

    private String callWithRetry(Registration target, ConversationHistory history, MarketContext context, long deadlineNs)
            throws AdvisorException {
        int attempt = 1;
        while (true) {
            try {
                return target.client.send(history, context);
            } catch (AdvisorException e) {
                Duration remaining = Duration.ofNanos(deadlineNs - System.nanoTime());
                if (!retryPolicy.shouldRetry(e.kind(), attempt, remaining)) {
                    throw e;
                }
                log.info("event=advisor_retry advisor={} attempt={} kind={} backoff_ms={}",
                        target.identity.name(), attempt, e.kind(), retryPolicy.backoff().toMillis());
                attempt++;
                try {
                    Thread.sleep(retryPolicy.backoff().toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }

    private static AdvisorOutcome toOutcome(AdvisorIdentity identity, String text, Throwable error, Duration latency) {
        if (error == null) {
            return AdvisorOutcome.ok(identity, text, latency);
        }
        if (error instanceof TimeoutException) {
            return AdvisorOutcome.timeout(identity,
                    "no reply within " + identity.config().timeout().toMillis() + "ms", latency);
        }
        if (error instanceof AdvisorException advisorError) {
            if (advisorError.kind() == AdvisorErrorKind.TIMEOUT) {
                return AdvisorOutcome.timeout(identity, advisorError.getMessage(), latency);
            }
            return AdvisorOutcome.error(identity, advisorError.kind(), advisorError.getMessage(), latency);
        }
        if (error instanceof CancellationException) {
            return AdvisorOutcome.error(identity, AdvisorErrorKind.UNREACHABLE, "call cancelled", latency);
        }
        log.error("event=advisor_unexpected_failure advisor={}", identity.name(), error);
        return AdvisorOutcome.error(identity, AdvisorErrorKind.MALFORMED_RESPONSE, "unexpected failure: " + error, latency);
    }

    private void ensureOpen() {
        if (closed) {
            throw new RoundCancelledException("session closed");
        }
    }

    private static final class Registration {
        final AdvisorIdentity identity;
        final AdvisorClient client;
        final String unusableReason;
        final ReentrantLock lock;

        Registration(AdvisorIdentity identity, AdvisorClient client, String unusableReason, ReentrantLock lock) {
            this.identity = identity;
            this.client = client;
            this.unusableReason = unusableReason;
            this.lock = lock;
        }

        boolean usable() {
            return client != null;
        }

        AdvisorStatus status() {
            return new AdvisorStatus(identity, usable(), unusableReason);
        }
    }

    private static final class Call {
        final boolean dispatched;
        final CompletableFuture<String> reply;
        final Future<?> task;
        final CompletableFuture<AdvisorOutcome> outcome;

        Call(boolean dispatched, CompletableFuture<String> reply, Future<?> task, CompletableFuture<AdvisorOutcome> outcome) {
            this.dispatched = dispatched;
            this.reply = reply;
            this.task = task;
            this.outcome = outcome;
        }

        void cancel() {
            reply.cancel(false);
            if (task != null) {
                task.cancel(true);
            }
        }
    }
}
