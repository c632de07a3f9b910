package com.crossreview.core.pipeline;

import com.crossreview.core.cache.ReviewCache;
import com.crossreview.core.events.EventBus;
import com.crossreview.core.events.ReviewEvent;
import com.crossreview.core.identity.FileIdentityService;
import com.crossreview.core.llm.CancellationToken;
import com.crossreview.core.llm.LlmTask;
import com.crossreview.core.llm.LlmTaskResult;
import com.crossreview.core.llm.LlmTaskRunner;
import com.crossreview.core.metrics.ReviewMetrics;
import com.crossreview.core.model.FileClassification;
import com.crossreview.core.model.Finding;
import com.crossreview.core.model.HighRiskStatus;
import com.crossreview.core.model.ReviewStage;
import com.crossreview.core.model.RiskLevel;
import com.crossreview.core.model.VerificationStatus;
import com.crossreview.core.projection.JsonExtractor;
import com.crossreview.core.projection.ResultProjector;
import com.crossreview.core.session.SessionRegistry;
import com.crossreview.core.session.SessionSnapshot;
import com.crossreview.core.source.ProjectSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the orchestrator end to end against a scripted runner and in-memory collaborators.
 */
class ReviewOrchestratorTest {

    private static final String ROOT = "/repo";
    private static final String AUTH = "src/auth.ts";
    private static final String README = "README.md";
    private static final String CONFIG = "config.json";
    private static final List<String> FILES = List.of(AUTH, README, CONFIG);

    private static final String CLASSIFICATIONS = """
            [
              {"file": "src/auth.ts", "riskLevel": "high-risk", "reasoning": "auth logic"},
              {"file": "README.md", "riskLevel": "low-risk", "reasoning": "docs"},
              {"file": "config.json", "riskLevel": "low-risk", "reasoning": "config"}
            ]
            """;
    private static final String LOW_RISK_FINDINGS = """
            [{"file": "README.md", "line": 3, "severity": "suggestion", "category": "Typo",
              "title": "Misspelling", "description": "teh should be the"}]
            """;
    private static final String AGENT_FINDINGS = """
            [{"file": "src/auth.ts", "line": 10, "severity": "critical", "category": "Security",
              "title": "Missing token check", "description": "token is never validated"}]
            """;
    private static final String COORDINATED = """
            [{"file": "src/auth.ts", "line": 10, "severity": "critical", "category": "Security",
              "title": "Missing token check", "description": "token is never validated",
              "aiPrompt": "Validate the token before use",
              "sourceAgents": ["reviewer-1", "reviewer-2", "reviewer-3"], "confidence": 0.2}]
            """;
    private static final String TWO_COORDINATED = """
            [{"file": "src/auth.ts", "line": 10, "severity": "critical", "category": "Security",
              "title": "Missing token check", "description": "token is never validated",
              "sourceAgents": ["reviewer-1", "reviewer-2"]},
             {"file": "src/auth.ts", "line": 12, "severity": "warning", "category": "Error Handling",
              "title": "Unhandled decode error", "description": "decode may throw",
              "sourceAgents": ["reviewer-3"]}]
            """;
    private static final String VERIFIED = """
            {"isAccurate": true, "confidence": 0.9, "reasoning": "confirmed in the diff"}
            """;

    private final FileIdentityService identities = new FileIdentityService();
    private SimpleMeterRegistry meterRegistry;
    private SessionRegistry sessions;
    private ReviewCache cache;
    private ScriptedRunner runner;
    private FakeSource source;
    private ReviewProperties properties;
    private List<ReviewEvent> events;
    private ReviewOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        sessions = new SessionRegistry();
        cache = new ReviewCache();
        runner = new ScriptedRunner();
        source = new FakeSource();
        properties = new ReviewProperties();
        var eventBus = new EventBus();
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(events::add);
        var projector = new ResultProjector(new JsonExtractor(new ObjectMapper()), identities);
        orchestrator = new ReviewOrchestrator(sessions, cache, identities, source, runner, projector, eventBus,
                new ReviewMetrics(meterRegistry), properties, Executors.newCachedThreadPool());
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
    }

    private void startAndConfirm(String sessionId) {
        assertTrue(orchestrator.start(ROOT, FILES, sessionId).success());
        assertTrue(orchestrator.startLowRisk(sessionId, List.of(README, CONFIG), List.of(AUTH)).success());
    }

    private List<ReviewEvent> eventsOfType(String type) {
        return events.stream().filter(e -> e.eventType().equals(type)).toList();
    }

    private Optional<List<Finding>> cachedFindings(String path, RiskLevel reviewedAs) {
        return cache.get(identities.identify(ROOT, path), identities.fingerprint(source.diff(ROOT, path)))
                .flatMap(entry -> entry.cachedFindings(reviewedAs));
    }

    private static String awaitAll(CountDownLatch latch, String answer) {
        latch.countDown();
        try {
            return latch.await(5, TimeUnit.SECONDS) ? answer : null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    // -- full pipeline ----------------------------------------------------------------------

    @Nested
    @DisplayName("full pipeline")
    class FullPipelineTests {

        @Test
        @DisplayName("classifies, reviews low-risk files, then reviews the high-risk file with consensus")
        void happyPath() {
            StartResult started = orchestrator.start(ROOT, FILES, "s1");

            assertTrue(started.success());
            assertEquals(List.of(AUTH, README, CONFIG),
                    started.classifications().stream().map(FileClassification::path).toList());
            assertEquals(RiskLevel.HIGH_RISK, started.classifications().get(0).riskLevel());
            assertEquals(ReviewStage.AWAITING_CONFIRMATION, sessions.require("s1").getStage());

            LowRiskResult lowRisk = orchestrator.startLowRisk("s1", List.of(README, CONFIG), List.of(AUTH));

            assertTrue(lowRisk.success());
            assertEquals(1, lowRisk.findingCount());
            Finding typo = lowRisk.findings().get(0);
            assertEquals("s1-low-risk-1", typo.id());
            assertEquals(README, typo.path());
            assertTrue(typo.sourceAgents().isEmpty());
            assertEquals(ReviewStage.REVIEWING_HIGH_RISK, sessions.require("s1").getStage());

            HighRiskResult highRisk = orchestrator.advanceHighRisk("s1");

            assertTrue(highRisk.success());
            assertTrue(highRisk.complete());
            assertEquals(AUTH, highRisk.file());
            assertEquals(1, highRisk.findingCount());
            Finding issue = highRisk.findings().get(0);
            assertEquals("s1-highrisk-0-1", issue.id());
            assertEquals(1.0, issue.confidence());
            assertEquals(Set.of("reviewer-1", "reviewer-2", "reviewer-3"), issue.sourceAgents());
            assertEquals(VerificationStatus.VERIFIED, issue.verificationStatus());
            assertEquals(identities.identify(ROOT, AUTH), issue.fileIdentity());

            SessionSnapshot snapshot = sessions.require("s1").snapshot();
            assertEquals(ReviewStage.COMPLETED, snapshot.stage());
            assertEquals(2, snapshot.findings().size());
            assertEquals(1, snapshot.highRiskCursor());
        }

        @Test
        @DisplayName("issues namespaced task ids, one per stage call")
        void taskIds() {
            startAndConfirm("s1");
            orchestrator.advanceHighRisk("s1");

            assertEquals(Set.of("s1-classify", "s1-batch-0", "s1-file0-agent1", "s1-file0-agent2",
                            "s1-file0-agent3", "s1-file0-coordinator", "s1-file0-verify-0"),
                    runner.calls.stream().map(LlmTask::taskId).collect(Collectors.toSet()));
            assertEquals(7, runner.calls.size());
        }

        @Test
        @DisplayName("publishes progress events in order")
        void events() {
            startAndConfirm("s1");
            orchestrator.advanceHighRisk("s1");

            List<Object> statuses = eventsOfType(ReviewEvent.TYPE_HIGH_RISK_STATUS).stream()
                    .map(e -> e.payload().get("status"))
                    .toList();
            assertEquals(List.of(HighRiskStatus.REVIEWING, HighRiskStatus.COORDINATING,
                    HighRiskStatus.VERIFYING, HighRiskStatus.COMPLETE), statuses);

            ReviewEvent classified = eventsOfType(ReviewEvent.TYPE_CLASSIFICATIONS).get(0);
            assertEquals(0L, classified.payload().get("cachedCount"));

            ReviewEvent findings = eventsOfType(ReviewEvent.TYPE_HIGH_RISK_FINDINGS).get(0);
            assertEquals(AUTH, findings.file());
            assertEquals(0, findings.payload().get("fileIndex"));
            assertEquals(true, findings.payload().get("complete"));
            assertEquals(false, findings.payload().get("cached"));
        }

        @Test
        @DisplayName("advancing a completed session reports completion without work")
        void alreadyComplete() {
            startAndConfirm("s1");
            orchestrator.advanceHighRisk("s1");
            int calls = runner.calls.size();

            HighRiskResult again = orchestrator.advanceHighRisk("s1");

            assertTrue(again.success());
            assertTrue(again.complete());
            assertNull(again.file());
            assertEquals(calls, runner.calls.size());
        }

        @Test
        @DisplayName("a session without high-risk files completes after the low-risk review")
        void noHighRisk() {
            orchestrator.start(ROOT, FILES, "s1");

            LowRiskResult result = orchestrator.startLowRisk("s1", FILES, List.of());

            assertTrue(result.success());
            assertEquals(ReviewStage.COMPLETED, sessions.require("s1").getStage());
            assertTrue(orchestrator.advanceHighRisk("s1").complete());
        }

        @Test
        @DisplayName("runs the three reviewers concurrently")
        void concurrentReviewers() {
            var allEntered = new CountDownLatch(3);
            runner.agent = task -> awaitAll(allEntered, AGENT_FINDINGS);
            startAndConfirm("s1");

            HighRiskResult result = orchestrator.advanceHighRisk("s1");

            assertTrue(result.success());
            String coordinatorPrompt = runner.prompt("s1-file0-coordinator");
            assertTrue(coordinatorPrompt.contains("token is never validated"));
        }

        @Test
        @DisplayName("dispatches every low-risk batch before awaiting any")
        void concurrentBatches() {
            properties.setLowRiskBatchSize(1);
            var allEntered = new CountDownLatch(2);
            runner.lowRisk = task -> awaitAll(allEntered, LOW_RISK_FINDINGS);
            orchestrator.start(ROOT, FILES, "s1");

            LowRiskResult result = orchestrator.startLowRisk("s1", List.of(README, CONFIG), List.of(AUTH));

            assertTrue(result.success());
            assertEquals(0, eventsOfType(ReviewEvent.TYPE_LOW_RISK_FINDINGS).get(0).payload().get("failedBatches"));
            assertTrue(cachedFindings(README, RiskLevel.LOW_RISK).isPresent());
            assertTrue(cachedFindings(CONFIG, RiskLevel.LOW_RISK).isPresent());
        }

        @Test
        @DisplayName("verifies all findings of a file concurrently")
        void concurrentVerifiers() {
            runner.coordinator = task -> TWO_COORDINATED;
            var allEntered = new CountDownLatch(2);
            runner.verify = task -> awaitAll(allEntered, VERIFIED);
            startAndConfirm("s1");

            HighRiskResult result = orchestrator.advanceHighRisk("s1");

            assertTrue(result.success());
            assertEquals(2, result.findingCount());
            assertTrue(result.findings().stream().allMatch(Finding::isVerified));
        }
    }

    // -- failure modes ----------------------------------------------------------------------

    @Nested
    @DisplayName("failure handling")
    class FailureTests {

        @Test
        @DisplayName("classification that omits a file fails the stage")
        void classificationOmission() {
            runner.classify = task -> """
                    [{"file": "src/auth.ts", "riskLevel": "high-risk"}, {"file": "README.md", "riskLevel": "low-risk"}]
                    """;

            StartResult result = orchestrator.start(ROOT, FILES, "s1");

            assertFalse(result.success());
            assertEquals(ReviewError.STAGE_FAILED, result.error());
            assertTrue(result.message().contains(CONFIG));
            ReviewEvent failed = eventsOfType(ReviewEvent.TYPE_FAILED).get(0);
            assertEquals("classify", failed.payload().get("stage"));
            assertNotNull(sessions.require("s1").snapshot().lastError());
        }

        @Test
        @DisplayName("unparseable classification output fails the stage")
        void classificationGarbage() {
            runner.classify = task -> "I am unable to help with that.";

            StartResult result = orchestrator.start(ROOT, FILES, "s1");

            assertEquals(ReviewError.STAGE_FAILED, result.error());
        }

        @Test
        @DisplayName("coordinator failure leaves the cursor in place so the step can be retried")
        void coordinatorFailure() {
            startAndConfirm("s1");
            runner.coordinator = task -> null;

            HighRiskResult failed = orchestrator.advanceHighRisk("s1");

            assertFalse(failed.success());
            assertEquals(ReviewError.STAGE_FAILED, failed.error());
            SessionSnapshot snapshot = sessions.require("s1").snapshot();
            assertEquals(0, snapshot.highRiskCursor());
            assertEquals(ReviewStage.REVIEWING_HIGH_RISK, snapshot.stage());
            ReviewEvent event = eventsOfType(ReviewEvent.TYPE_FAILED).get(0);
            assertEquals("high-risk", event.payload().get("stage"));
            assertEquals(AUTH, event.file());
            assertTrue(cachedFindings(AUTH, RiskLevel.HIGH_RISK).isEmpty());
            assertEquals(1.0, meterRegistry.find("crossreview.stage.failures")
                    .tag("stage", "high-risk").counter().count());

            runner.coordinator = task -> COORDINATED;
            HighRiskResult retried = orchestrator.advanceHighRisk("s1");

            assertTrue(retried.success());
            assertTrue(retried.complete());
        }

        @Test
        @DisplayName("failed reviewers still hand the coordinator three (empty) reviews")
        void allReviewersFail() {
            runner.agent = task -> null;
            runner.coordinator = task -> "[]";
            startAndConfirm("s1");

            HighRiskResult result = orchestrator.advanceHighRisk("s1");

            assertTrue(result.success());
            assertEquals(0, result.findingCount());
            String prompt = runner.prompt("s1-file0-coordinator");
            assertTrue(prompt.contains("3 independent reviewers"));
            assertTrue(prompt.contains("\"agentId\" : \"reviewer-1\""));
            assertTrue(prompt.contains("\"agentId\" : \"reviewer-3\""));
            assertEquals(Optional.of(List.of()), cachedFindings(AUTH, RiskLevel.HIGH_RISK));
        }

        @Test
        @DisplayName("findings whose verification fails or cannot be parsed are dropped")
        void verificationFailsClosed() {
            runner.verify = task -> "Looks plausible to me.";
            startAndConfirm("s1");

            HighRiskResult result = orchestrator.advanceHighRisk("s1");

            assertTrue(result.success());
            assertEquals(0, result.findingCount());
            assertEquals(1.0, meterRegistry.find("crossreview.verification.results")
                    .tag("result", "rejected").counter().count());
        }

        @Test
        @DisplayName("findings the verifier rejects are dropped")
        void verificationRejects() {
            runner.verify = task -> "{\"isAccurate\": false, \"confidence\": 0.8, \"reasoning\": \"pre-existing\"}";
            startAndConfirm("s1");

            assertEquals(0, orchestrator.advanceHighRisk("s1").findingCount());
        }

        @Test
        @DisplayName("a failed low-risk batch contributes nothing and is not cached")
        void failedBatch() {
            properties.setLowRiskBatchSize(1);
            runner.lowRisk = task -> task.taskId().endsWith("batch-1") ? null : LOW_RISK_FINDINGS;
            orchestrator.start(ROOT, FILES, "s1");

            LowRiskResult result = orchestrator.startLowRisk("s1", List.of(README, CONFIG), List.of(AUTH));

            assertTrue(result.success());
            assertEquals(1, result.findingCount());
            assertEquals(1, eventsOfType(ReviewEvent.TYPE_LOW_RISK_FINDINGS).get(0).payload().get("failedBatches"));
            assertTrue(cachedFindings(README, RiskLevel.LOW_RISK).isPresent());
            assertTrue(cachedFindings(CONFIG, RiskLevel.LOW_RISK).isEmpty());
        }

        @Test
        @DisplayName("low-risk findings for files outside the batch are dropped")
        void foreignFinding() {
            runner.lowRisk = task -> """
                    [{"file": "src/auth.ts", "line": 1, "title": "Not my file"},
                     {"file": "config.json", "line": 2, "title": "Debug flag"}]
                    """;
            orchestrator.start(ROOT, FILES, "s1");

            LowRiskResult result = orchestrator.startLowRisk("s1", List.of(README, CONFIG), List.of(AUTH));

            assertEquals(1, result.findingCount());
            assertEquals(CONFIG, result.findings().get(0).path());
            assertEquals(Optional.of(List.of()), cachedFindings(README, RiskLevel.LOW_RISK));
        }
    }

    // -- request validation -----------------------------------------------------------------

    @Nested
    @DisplayName("validation")
    class ValidationTests {

        @Test
        @DisplayName("start requires a project path and files")
        void startValidation() {
            assertEquals(ReviewError.INVALID_REQUEST, orchestrator.start(" ", FILES, "s1").error());
            assertEquals(ReviewError.INVALID_REQUEST, orchestrator.start(ROOT, List.of(), "s1").error());
            assertTrue(runner.calls.isEmpty());
        }

        @Test
        @DisplayName("generates a session id when none is given")
        void generatedId() {
            StartResult result = orchestrator.start(ROOT, FILES, null);
            assertTrue(result.sessionId().startsWith("review-"));
            assertTrue(sessions.find(result.sessionId()).isPresent());
        }

        @Test
        @DisplayName("rejects a partition that overlaps, misses files or repeats them")
        void partitionValidation() {
            orchestrator.start(ROOT, FILES, "s1");

            assertEquals(ReviewError.INVALID_REQUEST,
                    orchestrator.startLowRisk("s1", List.of(README, AUTH), List.of(AUTH, CONFIG)).error());
            assertEquals(ReviewError.INVALID_REQUEST,
                    orchestrator.startLowRisk("s1", List.of(README), List.of(AUTH)).error());
            assertEquals(ReviewError.INVALID_REQUEST,
                    orchestrator.startLowRisk("s1", List.of(README, "./README.md", CONFIG), List.of(AUTH)).error());
            assertEquals(ReviewError.INVALID_REQUEST,
                    orchestrator.startLowRisk("s1", null, List.of(AUTH)).error());
            assertEquals(ReviewStage.AWAITING_CONFIRMATION, sessions.require("s1").getStage());

            assertTrue(orchestrator.startLowRisk("s1", List.of(README, CONFIG), List.of(AUTH)).success());
        }

        @Test
        @DisplayName("steps called out of order report an invalid state")
        void outOfOrder() {
            orchestrator.start(ROOT, FILES, "s1");
            assertEquals(ReviewError.INVALID_STATE, orchestrator.advanceHighRisk("s1").error());

            orchestrator.startLowRisk("s1", List.of(README, CONFIG), List.of(AUTH));
            assertEquals(ReviewError.INVALID_STATE,
                    orchestrator.startLowRisk("s1", List.of(README, CONFIG), List.of(AUTH)).error());
            assertTrue(eventsOfType(ReviewEvent.TYPE_FAILED).isEmpty());
        }

        @Test
        @DisplayName("unknown sessions are not found")
        void unknownSession() {
            assertEquals(ReviewError.SESSION_NOT_FOUND, orchestrator.advanceHighRisk("nope").error());
            assertEquals(ReviewError.SESSION_NOT_FOUND,
                    orchestrator.startLowRisk("nope", List.of(), List.of()).error());
        }
    }

    // -- cache ------------------------------------------------------------------------------

    @Nested
    @DisplayName("review cache")
    class CacheTests {

        @Test
        @DisplayName("a second review of unchanged files makes no LLM calls")
        void idempotent() {
            startAndConfirm("s1");
            orchestrator.advanceHighRisk("s1");
            int calls = runner.calls.size();

            StartResult started = orchestrator.start(ROOT, FILES, "s2");
            LowRiskResult lowRisk = orchestrator.startLowRisk("s2", List.of(README, CONFIG), List.of(AUTH));
            HighRiskResult highRisk = orchestrator.advanceHighRisk("s2");

            assertEquals(calls, runner.calls.size());
            assertTrue(started.classifications().stream().allMatch(FileClassification::cached));
            assertEquals("s2-low-risk-1", lowRisk.findings().get(0).id());
            assertTrue(lowRisk.findings().get(0).cached());
            Finding cached = highRisk.findings().get(0);
            assertEquals("s2-highrisk-0-1", cached.id());
            assertTrue(cached.cached());
            assertTrue(cached.isVerified());
            assertEquals(true, eventsOfType(ReviewEvent.TYPE_HIGH_RISK_FINDINGS).get(1).payload().get("cached"));
        }

        @Test
        @DisplayName("low-risk results of a file never stand in for its high-risk review, nor the reverse")
        void reviewKindsDoNotShareCachedFindings() {
            runner.lowRisk = task -> """
                    [{"file": "src/auth.ts", "line": 4, "severity": "suggestion", "category": "Typo",
                      "title": "Misspelled variable", "description": "tokne should be token"}]
                    """;
            orchestrator.start(ROOT, FILES, "s1");
            assertTrue(orchestrator.startLowRisk("s1", FILES, List.of()).success());
            assertEquals(1, cachedFindings(AUTH, RiskLevel.LOW_RISK).orElseThrow().size());
            assertTrue(cachedFindings(AUTH, RiskLevel.HIGH_RISK).isEmpty());

            startAndConfirm("s2");
            HighRiskResult highRisk = orchestrator.advanceHighRisk("s2");

            assertTrue(highRisk.success());
            assertEquals(1, highRisk.findingCount());
            Finding issue = highRisk.findings().get(0);
            assertFalse(issue.cached());
            assertTrue(issue.isVerified());
            assertEquals(Set.of("reviewer-1", "reviewer-2", "reviewer-3"), issue.sourceAgents());
            assertEquals("Missing token check", issue.title());
            assertEquals(1, runner.calls.stream().filter(t -> t.taskId().equals("s2-file0-coordinator")).count());
            assertEquals(false, eventsOfType(ReviewEvent.TYPE_HIGH_RISK_FINDINGS).get(0).payload().get("cached"));

            int calls = runner.calls.size();
            orchestrator.start(ROOT, FILES, "s3");
            LowRiskResult lowRisk = orchestrator.startLowRisk("s3", FILES, List.of());

            assertEquals(calls, runner.calls.size());
            List<Finding> authFindings = lowRisk.findings().stream().filter(f -> f.path().equals(AUTH)).toList();
            assertEquals(1, authFindings.size());
            assertEquals("Misspelled variable", authFindings.get(0).title());
            assertNull(authFindings.get(0).verificationStatus());
        }

        @Test
        @DisplayName("only files whose diff changed are classified again")
        void changedDiff() {
            orchestrator.start(ROOT, FILES, "s1");
            source.diffs.put(AUTH, "+if (token == null) return;");
            runner.classify = task -> "[{\"file\": \"src/auth.ts\", \"riskLevel\": \"high-risk\"}]";

            StartResult result = orchestrator.start(ROOT, FILES, "s2");

            assertTrue(result.success());
            String prompt = runner.prompt("s2-classify");
            assertTrue(prompt.contains(AUTH));
            assertFalse(prompt.contains("=== README.md ==="));
            assertFalse(result.classifications().get(0).cached());
            assertTrue(result.classifications().get(1).cached());
        }

        @Test
        @DisplayName("invalidation forces a fresh review")
        void invalidate() {
            orchestrator.start(ROOT, FILES, "s1");

            InvalidateResult one = orchestrator.invalidate(ROOT, List.of("./" + AUTH));
            assertEquals(1, one.invalidated());

            InvalidateResult rest = orchestrator.invalidate(ROOT, List.of());
            assertEquals(2, rest.invalidated());

            orchestrator.start(ROOT, FILES, "s2");
            assertEquals(1, runner.calls.stream().filter(t -> t.taskId().equals("s2-classify")).count());
        }

        @Test
        @DisplayName("fingerprints are keyed by normalized path")
        void fingerprints() {
            FingerprintResult result = orchestrator.computeFingerprints(ROOT, List.of("./README.md"));

            assertTrue(result.success());
            assertEquals(identities.fingerprint(source.diff(ROOT, README)).hex(),
                    result.fingerprints().get(README));
            assertEquals(ReviewError.INVALID_REQUEST, orchestrator.computeFingerprints(ROOT, null).error());
        }
    }

    // -- cancellation -----------------------------------------------------------------------

    @Nested
    @DisplayName("cancellation")
    class CancellationTests {

        @Test
        @DisplayName("cancelling mid-step discards the step's results")
        void cancelMidAdvance() throws Exception {
            startAndConfirm("s1");
            var coordinatorEntered = new CountDownLatch(1);
            runner.coordinator = task -> {
                coordinatorEntered.countDown();
                return runner.awaitCancel(task.taskId()) ? null : COORDINATED;
            };

            CompletableFuture<HighRiskResult> pending = CompletableFuture.supplyAsync(
                    () -> orchestrator.advanceHighRisk("s1"));
            assertTrue(coordinatorEntered.await(5, TimeUnit.SECONDS));

            CancelResult cancelled = orchestrator.cancel("s1");
            HighRiskResult result = pending.get(5, TimeUnit.SECONDS);

            assertTrue(cancelled.success());
            assertEquals(1, cancelled.cancelledTasks());
            assertEquals(List.of("s1-file0-coordinator"), runner.cancelled);
            assertEquals(ReviewError.SESSION_NOT_FOUND, result.error());
            assertTrue(sessions.find("s1").isEmpty());
            assertTrue(cachedFindings(AUTH, RiskLevel.HIGH_RISK).isEmpty());
            assertTrue(eventsOfType(ReviewEvent.TYPE_HIGH_RISK_FINDINGS).isEmpty());
            assertTrue(eventsOfType(ReviewEvent.TYPE_FAILED).isEmpty());
            assertEquals(ReviewEvent.TYPE_CANCELLED, events.get(events.size() - 1).eventType());
        }

        @Test
        @DisplayName("a task that finishes successfully after cancel leaves no trace")
        void successAfterCancel() throws Exception {
            startAndConfirm("s1");
            var coordinatorEntered = new CountDownLatch(1);
            runner.coordinator = task -> {
                coordinatorEntered.countDown();
                assertTrue(runner.awaitCancel(task.taskId()));
                return COORDINATED;
            };

            CompletableFuture<HighRiskResult> pending = CompletableFuture.supplyAsync(
                    () -> orchestrator.advanceHighRisk("s1"));
            assertTrue(coordinatorEntered.await(5, TimeUnit.SECONDS));

            assertTrue(orchestrator.cancel("s1").success());
            HighRiskResult result = pending.get(5, TimeUnit.SECONDS);

            assertFalse(result.success());
            assertEquals(ReviewError.SESSION_NOT_FOUND, result.error());
            assertTrue(cachedFindings(AUTH, RiskLevel.HIGH_RISK).isEmpty());
            assertTrue(runner.calls.stream().noneMatch(t -> t.taskId().contains("-verify-")));
            assertTrue(eventsOfType(ReviewEvent.TYPE_HIGH_RISK_FINDINGS).isEmpty());
            assertTrue(eventsOfType(ReviewEvent.TYPE_FAILED).isEmpty());
            assertFalse(eventsOfType(ReviewEvent.TYPE_HIGH_RISK_STATUS).stream()
                    .anyMatch(e -> e.payload().get("status") == HighRiskStatus.VERIFYING));
        }

        @Test
        @DisplayName("only tasks of the cancelled session are signalled")
        void prefixIsolation() {
            runner.active.addAll(List.of("abc-classify", "abc-file2-verify-0", "abc-2-file0-agent1", "abcd-batch-0"));

            CancelResult result = orchestrator.cancel("abc");

            assertTrue(result.success());
            assertEquals(2, result.cancelledTasks());
            assertEquals(Set.of("abc-classify", "abc-file2-verify-0"), Set.copyOf(runner.cancelled));
        }

        @Test
        @DisplayName("cancel is idempotent and tolerates unknown sessions")
        void idempotent() {
            orchestrator.start(ROOT, FILES, "s1");

            assertTrue(orchestrator.cancel("s1").success());
            assertTrue(orchestrator.cancel("s1").success());
            assertTrue(orchestrator.cancel("never-existed").success());
            assertEquals(1, eventsOfType(ReviewEvent.TYPE_CANCELLED).size());
        }

        @Test
        @DisplayName("a cancelled session rejects further steps")
        void stepsAfterCancel() {
            orchestrator.start(ROOT, FILES, "s1");
            orchestrator.cancel("s1");

            assertEquals(ReviewError.SESSION_NOT_FOUND,
                    orchestrator.startLowRisk("s1", List.of(README, CONFIG), List.of(AUTH)).error());
        }
    }

    // -- fakes ------------------------------------------------------------------------------

    /**
     * Answers each task by its id suffix. A {@code null} answer is reported as a task failure.
     */
    private static final class ScriptedRunner implements LlmTaskRunner {

        final List<LlmTask> calls = new CopyOnWriteArrayList<>();
        final Set<String> active = ConcurrentHashMap.newKeySet();
        final List<String> cancelled = new CopyOnWriteArrayList<>();
        private final Map<String, CountDownLatch> cancelSignals = new ConcurrentHashMap<>();

        volatile Function<LlmTask, String> classify = task -> CLASSIFICATIONS;
        volatile Function<LlmTask, String> lowRisk = task -> LOW_RISK_FINDINGS;
        volatile Function<LlmTask, String> agent = task -> AGENT_FINDINGS;
        volatile Function<LlmTask, String> coordinator = task -> COORDINATED;
        volatile Function<LlmTask, String> verify = task -> VERIFIED;

        @Override
        public LlmTaskResult run(LlmTask task, CancellationToken token) {
            calls.add(task);
            active.add(task.taskId());
            try {
                String output = responderFor(task.taskId()).apply(task);
                return output == null
                        ? LlmTaskResult.failure(task.taskId(), "scripted failure", 1)
                        : LlmTaskResult.success(task.taskId(), output, 1);
            } finally {
                active.remove(task.taskId());
            }
        }

        @Override
        public void cancel(String taskId) {
            cancelled.add(taskId);
            cancelSignals.computeIfAbsent(taskId, k -> new CountDownLatch(1)).countDown();
        }

        @Override
        public Set<String> activeTaskIds() {
            return Set.copyOf(active);
        }

        boolean awaitCancel(String taskId) {
            try {
                return cancelSignals.computeIfAbsent(taskId, k -> new CountDownLatch(1)).await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }

        String prompt(String taskId) {
            return calls.stream()
                    .filter(t -> t.taskId().equals(taskId))
                    .map(LlmTask::prompt)
                    .findFirst()
                    .orElseThrow(() -> new AssertionError("No task " + taskId));
        }

        private Function<LlmTask, String> responderFor(String taskId) {
            if (taskId.endsWith("-classify")) return classify;
            if (taskId.matches(".*-batch-\\d+")) return lowRisk;
            if (taskId.matches(".*-agent\\d+")) return agent;
            if (taskId.endsWith("-coordinator")) return coordinator;
            if (taskId.matches(".*-verify-\\d+")) return verify;
            throw new AssertionError("Unexpected task " + taskId);
        }
    }

    private static final class FakeSource implements ProjectSource {

        final Map<String, String> diffs = new ConcurrentHashMap<>(Map.of(
                AUTH, "+const user = decode(token);",
                README, "+Install teh package",
                CONFIG, "+\"debug\": true"));

        @Override
        public String diff(String projectRoot, String path) {
            return diffs.getOrDefault(path, "");
        }

        @Override
        public String content(String projectRoot, String path) {
            return "// full content of " + path + "\nimport { decode } from './jwt';";
        }
    }
}
