package ai.advisory.orchestrator;

import ai.advisory.advisor.AdvisorConfig;
import ai.advisory.advisor.AdvisorErrorKind;
import ai.advisory.advisor.AdvisorException;
import ai.advisory.advisor.AdvisorIdentity;
import ai.advisory.advisor.ProviderKind;
import ai.advisory.conversation.Message;
import ai.advisory.conversation.Role;
import ai.advisory.proposal.ProposalExtractor;
import ai.advisory.proposal.TradeAction;
import ai.advisory.proposal.TradeProposal;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static ai.advisory.orchestrator.ScriptedAdvisors.fail;
import static ai.advisory.orchestrator.ScriptedAdvisors.replyAfter;
import static org.junit.jupiter.api.Assertions.*;

class AdvisoryOrchestratorTest {
    private static final String BUY_BLOCK =
            "{\"action\":\"buy\",\"symbol\":\"BTCUSDT\",\"entry\":60000,\"stop_loss\":58000,\"take_profit\":64000}";

    private final ScriptedAdvisors advisors = new ScriptedAdvisors();
    private AdvisoryOrchestrator orchestrator = newOrchestrator(RetryPolicy.NONE);

    @AfterEach
    void tearDown() {
        orchestrator.close();
    }

    @Test
    void shouldFailWhenNoAdvisorRegistered() {
        assertThrows(NoAdvisorsRegisteredException.class, () -> orchestrator.askAll(context()));
    }

    @Test
    void shouldReturnOutcomesInRegistrationOrderRegardlessOfCompletionOrder() {
        advisors.script("A", replyAfter(300, "slow"))
                .script("B", replyAfter(5, "fast"))
                .script("C", replyAfter(120, "medium"));
        register("A", 2000);
        register("B", 2000);
        register("C", 2000);

        OrchestrationResult result = orchestrator.askAll(context());

        assertEquals(List.of("A", "B", "C"), result.outcomes().stream().map(AdvisorOutcome::advisorName).toList());
        assertEquals(List.of("slow", "fast", "medium"), result.outcomes().stream().map(AdvisorOutcome::reply).toList());
    }

    @Test
    void shouldIsolateTimeoutAndMalformedResponseFromSuccessfulAdvisor() throws Exception {
        CountDownLatch slowCallInterrupted = new CountDownLatch(1);
        advisors.script("A", replyAfter(200, "steady uptrend, no trade"))
                .script("B", history -> {
                    try {
                        Thread.sleep(10_000);
                    } catch (InterruptedException e) {
                        slowCallInterrupted.countDown();
                        throw e;
                    }
                    return "too late";
                })
                .script("C", fail(AdvisorErrorKind.MALFORMED_RESPONSE));
        register("A", 2000);
        register("B", 100);
        register("C", 2000);

        long started = System.nanoTime();
        OrchestrationResult result = orchestrator.askAll(context());
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertEquals(3, result.outcomes().size());
        AdvisorOutcome a = result.outcomes().get(0);
        AdvisorOutcome b = result.outcomes().get(1);
        AdvisorOutcome c = result.outcomes().get(2);
        assertEquals(OutcomeStatus.OK, a.status());
        assertEquals("steady uptrend, no trade", a.reply());
        assertEquals(OutcomeStatus.TIMEOUT, b.status());
        assertEquals(AdvisorErrorKind.TIMEOUT, b.errorKind());
        assertNull(b.reply());
        assertEquals(OutcomeStatus.ERROR, c.status());
        assertEquals(AdvisorErrorKind.MALFORMED_RESPONSE, c.errorKind());

        assertTrue(elapsedMs < 2000, "round took " + elapsedMs + "ms");
        assertTrue(slowCallInterrupted.await(2, TimeUnit.SECONDS));

        assertEquals(2, orchestrator.history("A").size());
        assertEquals(1, orchestrator.history("B").size());
        assertEquals(1, orchestrator.history("C").size());
    }

    @Test
    void shouldDiscardLateReplyOfTimedOutAdvisor() throws Exception {
        CountDownLatch finished = new CountDownLatch(1);
        advisors.script("Slow", history -> {
            long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(300);
            while (System.nanoTime() < until) {
                Thread.onSpinWait();
            }
            finished.countDown();
            return "late reply";
        });
        register("Slow", 50);

        AdvisorOutcome outcome = orchestrator.askOne("Slow", context());
        assertTrue(finished.await(2, TimeUnit.SECONDS));
        Thread.sleep(50);

        assertEquals(OutcomeStatus.TIMEOUT, outcome.status());
        List<Message> history = orchestrator.history("Slow").messages();
        assertEquals(1, history.size());
        assertEquals(Role.USER, history.get(0).role());
    }

    @Test
    void shouldGrowHistoryByTwoPerSuccessfulRoundPerAdvisor() {
        advisors.script("A", replyAfter(0, "a")).script("B", replyAfter(0, "b"));
        register("A", 1000);
        register("B", 1000);

        for (int i = 0; i < 3; i++) {
            orchestrator.askAll(context());
        }
        orchestrator.askOne("B", context());

        assertEquals(6, orchestrator.history("A").size());
        assertEquals(8, orchestrator.history("B").size());
        List<Message> a = orchestrator.history("A").messages();
        for (int i = 0; i < a.size(); i++) {
            assertEquals(i % 2 == 0 ? Role.USER : Role.ADVISOR, a.get(i).role());
        }
    }

    @Test
    void shouldSendStoredHistoryPlusNewUserTurn() {
        List<Integer> seenSizes = new CopyOnWriteArrayList<>();
        List<Role> lastRoles = new CopyOnWriteArrayList<>();
        advisors.script("A", history -> {
            seenSizes.add(history.size());
            lastRoles.add(history.messages().get(history.size() - 1).role());
            return "ok";
        });
        register("A", 1000);

        orchestrator.askAll(context());
        orchestrator.askAll(context(), "Should I add to the position?");

        assertEquals(List.of(1, 3), seenSizes);
        assertEquals(List.of(Role.USER, Role.USER), lastRoles);
        String lastQuestion = orchestrator.history("A").messages().get(2).text();
        assertTrue(lastQuestion.contains("Should I add to the position?"));
        assertTrue(lastQuestion.contains("BTCUSDT"));
    }

    @Test
    void shouldResetOnlyOneAdvisor() {
        advisors.script("A", replyAfter(0, "a")).script("B", replyAfter(0, "b"));
        register("A", 1000);
        register("B", 1000);
        orchestrator.askAll(context());

        orchestrator.reset("A");

        assertEquals(0, orchestrator.history("A").size());
        assertEquals(2, orchestrator.history("B").size());

        orchestrator.resetAll();
        assertEquals(0, orchestrator.history("B").size());
    }

    @Test
    void shouldExtractProposalsAndKeepInvalidOnesAsWarnings() {
        advisors.script("A", replyAfter(0, "Breakout confirmed. " + BUY_BLOCK + " Size it small."))
                .script("B", replyAfter(0, "{\"action\":\"buy\",\"symbol\":\"BTCUSDT\",\"entry\":60000,\"stop_loss\":61000}"))
                .script("C", replyAfter(0, "Just chatting, no trade."));
        register("A", 1000);
        register("B", 1000);
        register("C", 1000);

        OrchestrationResult result = orchestrator.askAll(context());

        assertEquals(Set.of("A"), result.proposals().keySet());
        TradeProposal proposal = result.proposal("A").orElseThrow();
        assertEquals(TradeAction.BUY, proposal.action());
        assertEquals("BTCUSDT", proposal.symbol());
        assertEquals(60000.0, proposal.entry());
        assertEquals(58000.0, proposal.stopLoss());
        assertEquals(64000.0, proposal.takeProfit());
        assertTrue(result.proposalWarnings().containsKey("B"));
        assertFalse(result.proposalWarnings().containsKey("C"));
        assertEquals(3, result.count(OutcomeStatus.OK));
    }

    @Test
    void shouldExcludeAdvisorWithoutCredentialFromDispatch() {
        advisors.script("A", replyAfter(0, "a")).script("NoKey", replyAfter(0, "never"));
        register("A", 1000);
        AdvisorStatus status = orchestrator.registerAdvisor(identity("NoKey", "MISSING_KEY", 1000));

        assertFalse(status.usable());
        assertFalse(advisors.created().contains("NoKey"));

        OrchestrationResult result = orchestrator.askAll(context());
        assertEquals(List.of("A"), result.outcomes().stream().map(AdvisorOutcome::advisorName).toList());

        AdvisorOutcome direct = orchestrator.askOne("NoKey", context());
        assertEquals(OutcomeStatus.ERROR, direct.status());
        assertEquals(AdvisorErrorKind.UNAUTHENTICATED, direct.errorKind());
        assertEquals(0, orchestrator.history("NoKey").size());
    }

    @Test
    void shouldKeepRegisteringWhenOneAdvisorConfigurationIsRejected() {
        advisors.script("B", replyAfter(0, "b"));
        AdvisorStatus rejected = orchestrator.registerAdvisor(identity("Unscripted", "KEY", 1000));
        register("B", 1000);

        assertFalse(rejected.usable());
        assertEquals(1, orchestrator.askAll(context()).outcomes().size());
    }

    @Test
    void shouldKeepHistoryAndPositionWhenAdvisorIsReRegistered() {
        advisors.script("A", replyAfter(0, "a")).script("B", replyAfter(0, "b"));
        register("A", 1000);
        register("B", 1000);
        orchestrator.askAll(context());

        orchestrator.registerAdvisor(identity("A", "KEY", 5000));

        List<AdvisorStatus> registered = orchestrator.advisors();
        assertEquals(List.of("A", "B"), registered.stream().map(s -> s.identity().name()).toList());
        assertEquals(Duration.ofMillis(5000), registered.get(0).identity().config().timeout());
        assertEquals(2, orchestrator.history("A").size());
        assertEquals(List.of("A", "B", "A"), advisors.created());
    }

    @Test
    void shouldRejectUnknownAdvisor() {
        assertThrows(UnknownAdvisorException.class, () -> orchestrator.askOne("Nobody", context()));
        assertThrows(UnknownAdvisorException.class, () -> orchestrator.history("Nobody"));
    }

    @Test
    void shouldNotRetryTransientFailureByDefault() {
        AtomicInteger calls = new AtomicInteger();
        advisors.script("A", history -> {
            calls.incrementAndGet();
            throw new AdvisorException(AdvisorErrorKind.RATE_LIMITED, "429");
        });
        register("A", 1000);

        AdvisorOutcome outcome = orchestrator.askOne("A", context());

        assertEquals(OutcomeStatus.ERROR, outcome.status());
        assertEquals(AdvisorErrorKind.RATE_LIMITED, outcome.errorKind());
        assertEquals(1, calls.get());
    }

    @Test
    void shouldRetryTransientFailureWhenPolicyAllows() {
        orchestrator.close();
        orchestrator = newOrchestrator(new RetryPolicy(3, Duration.ofMillis(10)));
        AtomicInteger calls = new AtomicInteger();
        advisors.script("A", history -> {
            if (calls.incrementAndGet() < 3) {
                throw new AdvisorException(AdvisorErrorKind.UNREACHABLE, "connection reset");
            }
            return "third time lucky";
        });
        register("A", 1000);

        AdvisorOutcome outcome = orchestrator.askOne("A", context());

        assertEquals(OutcomeStatus.OK, outcome.status());
        assertEquals(3, calls.get());
        assertEquals(2, orchestrator.history("A").size());
    }

    @Test
    void shouldNotRetryMalformedResponseEvenWhenPolicyAllows() {
        orchestrator.close();
        orchestrator = newOrchestrator(new RetryPolicy(3, Duration.ofMillis(10)));
        AtomicInteger calls = new AtomicInteger();
        advisors.script("A", history -> {
            calls.incrementAndGet();
            throw new AdvisorException(AdvisorErrorKind.MALFORMED_RESPONSE, "empty reply");
        });
        register("A", 1000);

        AdvisorOutcome outcome = orchestrator.askOne("A", context());

        assertEquals(AdvisorErrorKind.MALFORMED_RESPONSE, outcome.errorKind());
        assertEquals(1, calls.get());
        assertFalse(AdvisorErrorKind.TIMEOUT.retryable());
        assertTrue(AdvisorErrorKind.RATE_LIMITED.retryable());
    }

    @Test
    void shouldSerializeConcurrentRoundsForSameAdvisor() throws Exception {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        advisors.script("A", history -> {
            maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
            Thread.sleep(100);
            active.decrementAndGet();
            return "a";
        });
        register("A", 2000);

        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            Future<AdvisorOutcome> first = callers.submit(() -> orchestrator.askOne("A", context()));
            Future<OrchestrationResult> second = callers.submit(() -> orchestrator.askAll(context()));
            assertEquals(OutcomeStatus.OK, first.get(5, TimeUnit.SECONDS).status());
            assertEquals(OutcomeStatus.OK, second.get(5, TimeUnit.SECONDS).outcomes().get(0).status());
        } finally {
            callers.shutdownNow();
        }

        assertEquals(1, maxActive.get());
        assertEquals(4, orchestrator.history("A").size());
    }

    @Test
    void shouldCancelOutstandingRoundOnClose() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        advisors.script("A", history -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return "never";
        });
        register("A", 10_000);

        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<OrchestrationResult> round = caller.submit(() -> orchestrator.askAll(context()));
            assertTrue(started.await(2, TimeUnit.SECONDS));

            orchestrator.close();

            ExecutionException failure = assertThrows(ExecutionException.class, () -> round.get(2, TimeUnit.SECONDS));
            assertInstanceOf(RoundCancelledException.class, failure.getCause());
            assertTrue(interrupted.await(2, TimeUnit.SECONDS));
        } finally {
            caller.shutdownNow();
        }
        assertTrue(orchestrator.isClosed());
        assertThrows(RoundCancelledException.class, () -> orchestrator.askAll(context()));
    }

    private AdvisoryOrchestrator newOrchestrator(RetryPolicy retryPolicy) {
        return new AdvisoryOrchestrator(
                advisors,
                ref -> "KEY".equals(ref) ? Optional.of("secret") : Optional.empty(),
                new ProposalExtractor(),
                new AdvisoryPromptBuilder(new ObjectMapper()),
                retryPolicy
        );
    }

    private void register(String name, long timeoutMs) {
        assertTrue(orchestrator.registerAdvisor(identity(name, "KEY", timeoutMs)).usable());
    }

    private static AdvisorIdentity identity(String name, String credentialRef, long timeoutMs) {
        return new AdvisorIdentity(
                name,
                ProviderKind.CLAUDE,
                AdvisorConfig.defaults(ProviderKind.CLAUDE, credentialRef, Duration.ofMillis(timeoutMs))
        );
    }

    private static MarketContext context() {
        return new MarketContext("BTCUSDT", 60123.5, Map.of("RSI", 54.2, "trend", "UP"), Instant.now());
    }
}
