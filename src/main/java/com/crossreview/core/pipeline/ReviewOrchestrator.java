package com.crossreview.core.pipeline;

import com.crossreview.core.cache.CacheEntry;
import com.crossreview.core.cache.ReviewCache;
import com.crossreview.core.events.EventBus;
import com.crossreview.core.events.ReviewEvent;
import com.crossreview.core.identity.FileIdentityService;
import com.crossreview.core.llm.LlmTask;
import com.crossreview.core.llm.LlmTaskResult;
import com.crossreview.core.llm.LlmTaskRunner;
import com.crossreview.core.logging.MdcContext;
import com.crossreview.core.logging.MdcPropagatingExecutor;
import com.crossreview.core.metrics.ReviewMetrics;
import com.crossreview.core.model.FileClassification;
import com.crossreview.core.model.FileIdentity;
import com.crossreview.core.model.Finding;
import com.crossreview.core.model.HighRiskStatus;
import com.crossreview.core.model.ReviewStage;
import com.crossreview.core.model.RiskLevel;
import com.crossreview.core.model.SubAgentReview;
import com.crossreview.core.model.VerificationResult;
import com.crossreview.core.projection.ParseResult;
import com.crossreview.core.projection.ResultProjector;
import com.crossreview.core.prompt.FileContext;
import com.crossreview.core.prompt.ReviewPromptBuilder;
import com.crossreview.core.session.ReviewSession;
import com.crossreview.core.session.SessionNotFoundException;
import com.crossreview.core.session.SessionRegistry;
import com.crossreview.core.source.ProjectSource;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.IntFunction;
import java.util.regex.Pattern;

/**
 * Drives a review session through classification, batched low-risk review and the per-file
 * high-risk protocol (three reviewers, a coordinator and one verifier per finding).
 * <p>
 * Every operation is a synchronous, caller-invoked step; there is no background loop. Within a
 * step all fan-out tasks are submitted before any is awaited. Results are only applied through
 * {@link ReviewSession#commit}, so a step that finishes after {@link #cancel} leaves no trace in
 * the session, the cache or the event stream.
 */
@Service
public class ReviewOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ReviewOrchestrator.class);

    static final String STAGE_CLASSIFY = "classify";
    static final String STAGE_LOW_RISK = "low-risk";
    static final String STAGE_SUB_AGENT = "sub-agent";
    static final String STAGE_COORDINATOR = "coordinator";
    static final String STAGE_VERIFY = "verify";
    static final String STAGE_HIGH_RISK = "high-risk";

    /** Suffixes of the task ids this orchestrator issues, used to scope prefix cancellation. */
    private static final Pattern TASK_SUFFIX =
            Pattern.compile("classify|batch-\\d+|file\\d+-(?:agent\\d+|coordinator|verify-\\d+)");

    private final SessionRegistry sessions;
    private final ReviewCache cache;
    private final FileIdentityService identityService;
    private final ProjectSource source;
    private final LlmTaskRunner runner;
    private final ResultProjector projector;
    private final EventBus eventBus;
    private final ReviewMetrics metrics;
    private final ReviewProperties properties;
    private final Executor fanOut;
    private final ExecutorService ownedPool;

    @Autowired
    public ReviewOrchestrator(SessionRegistry sessions, ReviewCache cache, FileIdentityService identityService,
                              ProjectSource source, LlmTaskRunner runner, ResultProjector projector,
                              EventBus eventBus, ReviewMetrics metrics, ReviewProperties properties) {
        this(sessions, cache, identityService, source, runner, projector, eventBus, metrics, properties,
                newFanOutPool());
    }

    ReviewOrchestrator(SessionRegistry sessions, ReviewCache cache, FileIdentityService identityService,
                       ProjectSource source, LlmTaskRunner runner, ResultProjector projector,
                       EventBus eventBus, ReviewMetrics metrics, ReviewProperties properties,
                       ExecutorService pool) {
        this.sessions = sessions;
        this.cache = cache;
        this.identityService = identityService;
        this.source = source;
        this.runner = runner;
        this.projector = projector;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
        this.ownedPool = pool;
        this.fanOut = new MdcPropagatingExecutor(pool);
    }

    // -- start / classification -------------------------------------------------------------

    public StartResult start(String projectPath, List<String> files, String requestedSessionId) {
        if (projectPath == null || projectPath.isBlank()) {
            return StartResult.failure(requestedSessionId, ReviewError.INVALID_REQUEST, "projectPath is required");
        }
        List<String> paths = normalizeFiles(files);
        if (paths.isEmpty()) {
            return StartResult.failure(requestedSessionId, ReviewError.INVALID_REQUEST, "At least one file is required");
        }
        String sessionId = requestedSessionId == null || requestedSessionId.isBlank()
                ? "review-" + UUID.randomUUID().toString().substring(0, 8)
                : requestedSessionId.trim();

        ReviewSession session = sessions.create(sessionId, projectPath, paths);
        MdcContext.setStage(sessionId, STAGE_CLASSIFY);
        try {
            commitOrThrow(session, s -> s.transitionTo(ReviewStage.CLASSIFYING));
            return StartResult.success(sessionId, classify(session));
        } catch (SessionNotFoundException e) {
            return StartResult.failure(sessionId, ReviewError.SESSION_NOT_FOUND, e.getMessage());
        } catch (ReviewException e) {
            ReviewError error = onStageError(session, STAGE_CLASSIFY, null, e);
            return StartResult.failure(sessionId, error, e.getMessage());
        } catch (RuntimeException e) {
            ReviewError error = onUnexpected(session, STAGE_CLASSIFY, null, e);
            return StartResult.failure(sessionId, error, describe(e));
        } finally {
            MdcContext.clear();
        }
    }

    private List<FileClassification> classify(ReviewSession session) {
        String root = session.getProjectPath();
        Map<String, FileContext> contexts = new LinkedHashMap<>();
        for (String path : session.getFiles()) {
            contexts.put(path, context(root, path, false));
        }

        Map<String, FileClassification> byPath = new HashMap<>();
        List<FileContext> uncached = new ArrayList<>();
        for (FileContext ctx : contexts.values()) {
            Optional<FileClassification> hit = cache.get(ctx.identity(), ctx.fingerprint())
                    .flatMap(CacheEntry::cachedClassification);
            metrics.recordCacheLookup(STAGE_CLASSIFY, hit.isPresent());
            if (hit.isPresent()) {
                byPath.put(ctx.path(), hit.get());
            } else {
                uncached.add(ctx);
            }
        }

        List<FileClassification> fresh = new ArrayList<>();
        if (uncached.isEmpty()) {
            log.info("All {} file(s) classified from cache, skipping LLM", contexts.size());
        } else {
            log.info("Classifying {} file(s) ({} from cache)", uncached.size(), contexts.size() - uncached.size());
            String output = runRequired(session, taskId(session, "classify"), STAGE_CLASSIFY,
                    ReviewPromptBuilder.classificationPrompt(uncached), properties.getClassifyTimeout());
            ParseResult<List<FileClassification>> parsed = projector.classifications(output, root);
            if (!parsed.isParsed()) {
                throw new ReviewException(ReviewError.STAGE_FAILED,
                        "Could not parse classification response: " + parsed.errorReason());
            }
            Set<String> expected = new HashSet<>();
            uncached.forEach(ctx -> expected.add(ctx.path()));
            for (FileClassification classification : parsed.orElse(List.of())) {
                if (!expected.contains(classification.path())) {
                    log.warn("Ignoring classification for unknown file {}", classification.path());
                    continue;
                }
                if (byPath.putIfAbsent(classification.path(), classification) == null) {
                    fresh.add(classification);
                }
            }
            List<String> missing = expected.stream().filter(p -> !byPath.containsKey(p)).sorted().toList();
            if (!missing.isEmpty()) {
                throw new ReviewException(ReviewError.STAGE_FAILED,
                        "Classification omitted " + missing.size() + " file(s): " + String.join(", ", missing));
            }
        }

        List<FileClassification> ordered = session.getFiles().stream().map(byPath::get).toList();
        long cachedCount = ordered.stream().filter(FileClassification::cached).count();
        commitOrThrow(session, s -> {
            for (FileClassification classification : fresh) {
                FileContext ctx = contexts.get(classification.path());
                cache.putClassification(ctx.identity(), ctx.fingerprint(), classification);
            }
            s.setClassifications(ordered);
            s.transitionTo(ReviewStage.AWAITING_CONFIRMATION);
            eventBus.publish(ReviewEvent.of(ReviewEvent.TYPE_CLASSIFICATIONS, s.getId(), null,
                    Map.of("classifications", ordered, "cachedCount", cachedCount)));
        });
        return ordered;
    }

    // -- low-risk ---------------------------------------------------------------------------

    public LowRiskResult startLowRisk(String sessionId, List<String> lowRiskFiles, List<String> highRiskFiles) {
        ReviewSession session;
        try {
            session = sessions.require(sessionId);
        } catch (SessionNotFoundException e) {
            return LowRiskResult.failure(sessionId, ReviewError.SESSION_NOT_FOUND, e.getMessage());
        }
        MdcContext.setStage(sessionId, STAGE_LOW_RISK);
        try {
            List<String> low = normalizeFiles(lowRiskFiles);
            List<String> high = normalizeFiles(highRiskFiles);
            validatePartition(session, lowRiskFiles, highRiskFiles, low, high);
            commitOrThrow(session, s -> {
                requireStage(s, ReviewStage.AWAITING_CONFIRMATION);
                s.setPartition(low, high);
                s.transitionTo(ReviewStage.REVIEWING_LOW_RISK);
            });
            return LowRiskResult.success(sessionId, reviewLowRisk(session, low, high));
        } catch (SessionNotFoundException e) {
            return LowRiskResult.failure(sessionId, ReviewError.SESSION_NOT_FOUND, e.getMessage());
        } catch (ReviewException e) {
            ReviewError error = onStageError(session, STAGE_LOW_RISK, null, e);
            return LowRiskResult.failure(sessionId, error, e.getMessage());
        } catch (RuntimeException e) {
            ReviewError error = onUnexpected(session, STAGE_LOW_RISK, null, e);
            return LowRiskResult.failure(sessionId, error, describe(e));
        } finally {
            MdcContext.clear();
        }
    }

    private List<Finding> reviewLowRisk(ReviewSession session, List<String> low, List<String> high) {
        String root = session.getProjectPath();
        List<Finding> collected = new ArrayList<>();
        List<FileContext> uncached = new ArrayList<>();
        for (String path : low) {
            FileContext ctx = context(root, path, false);
            Optional<List<Finding>> hit = cache.get(ctx.identity(), ctx.fingerprint())
                    .flatMap(entry -> entry.cachedFindings(RiskLevel.LOW_RISK));
            metrics.recordCacheLookup(STAGE_LOW_RISK, hit.isPresent());
            if (hit.isPresent()) {
                collected.addAll(hit.get());
            } else {
                uncached.add(ctx);
            }
        }

        List<List<FileContext>> batches = partition(uncached, Math.max(1, properties.getLowRiskBatchSize()));
        log.info("Low-risk review: {} file(s) in {} batch(es), {} from cache",
                uncached.size(), batches.size(), low.size() - uncached.size());

        var futures = new ArrayList<CompletableFuture<BatchOutcome>>();
        for (int i = 0; i < batches.size(); i++) {
            final int index = i;
            final List<FileContext> batch = batches.get(i);
            futures.add(CompletableFuture.supplyAsync(() -> runBatch(session, index, batch), fanOut));
        }
        List<BatchOutcome> outcomes = joinAll(futures, i -> BatchOutcome.failed(batches.get(i)));

        int failedBatches = 0;
        for (BatchOutcome outcome : outcomes) {
            if (!outcome.succeeded()) {
                failedBatches++;
                continue;
            }
            for (FileContext ctx : outcome.batch()) {
                collected.addAll(outcome.findingsByPath().getOrDefault(ctx.path(), List.of()));
            }
        }

        var counter = new AtomicInteger();
        List<Finding> findings = collected.stream()
                .map(f -> f.withId(session.getId() + "-low-risk-" + counter.incrementAndGet()))
                .toList();
        metrics.recordFindings(STAGE_LOW_RISK, findings.size());

        final int failed = failedBatches;
        commitOrThrow(session, s -> {
            for (BatchOutcome outcome : outcomes) {
                if (!outcome.succeeded()) continue;
                for (FileContext ctx : outcome.batch()) {
                    cache.putFindings(ctx.identity(), ctx.fingerprint(), RiskLevel.LOW_RISK,
                            outcome.findingsByPath().getOrDefault(ctx.path(), List.of()));
                }
            }
            s.addFindings(findings);
            s.transitionTo(high.isEmpty() ? ReviewStage.COMPLETED : ReviewStage.REVIEWING_HIGH_RISK);
            eventBus.publish(ReviewEvent.of(ReviewEvent.TYPE_LOW_RISK_FINDINGS, s.getId(), null,
                    Map.of("findings", findings, "findingCount", findings.size(),
                            "batchCount", outcomes.size(), "failedBatches", failed,
                            ReviewEvent.KEY_COMPLETE, high.isEmpty())));
        });
        return findings;
    }

    private BatchOutcome runBatch(ReviewSession session, int index, List<FileContext> batch) {
        String taskId = taskId(session, "batch-" + index);
        MdcContext.setTask(session.getId(), taskId, null);
        try {
            LlmTaskResult result = runner.run(new LlmTask(taskId, STAGE_LOW_RISK,
                    ReviewPromptBuilder.lowRiskPrompt(batch), session.getProjectPath(),
                    properties.getBatchTimeout()), session.getToken());
            if (!result.success()) {
                log.warn("Low-risk batch {} contributed no findings: {}", index, result.error());
                return BatchOutcome.failed(batch);
            }
            ParseResult<List<Finding>> parsed = projector.findings(result.output(), session.getProjectPath());
            if (!parsed.isParsed()) {
                log.warn("Low-risk batch {} output unparseable: {}", index, parsed.errorReason());
                return BatchOutcome.failed(batch);
            }
            Map<String, FileContext> byPath = new HashMap<>();
            batch.forEach(ctx -> byPath.put(ctx.path(), ctx));
            Map<String, List<Finding>> perFile = new HashMap<>();
            for (Finding finding : parsed.orElse(List.of())) {
                FileContext ctx = byPath.get(finding.path());
                if (ctx == null) {
                    log.warn("Dropping low-risk finding for {} which is not in batch {}", finding.path(), index);
                    continue;
                }
                perFile.computeIfAbsent(ctx.path(), k -> new ArrayList<>())
                        .add(finding.withFileIdentity(ctx.identity(), ctx.path()));
            }
            return new BatchOutcome(batch, true, perFile);
        } finally {
            MdcContext.clearTask();
        }
    }

    private record BatchOutcome(List<FileContext> batch, boolean succeeded, Map<String, List<Finding>> findingsByPath) {

        static BatchOutcome failed(List<FileContext> batch) {
            return new BatchOutcome(batch, false, Map.of());
        }
    }

    // -- high-risk --------------------------------------------------------------------------

    public HighRiskResult advanceHighRisk(String sessionId) {
        ReviewSession session;
        try {
            session = sessions.require(sessionId);
        } catch (SessionNotFoundException e) {
            return HighRiskResult.failure(sessionId, ReviewError.SESSION_NOT_FOUND, e.getMessage());
        }
        MdcContext.setStage(sessionId, STAGE_HIGH_RISK);
        String file = null;
        try {
            if (session.getStage() == ReviewStage.COMPLETED) {
                return HighRiskResult.alreadyComplete(sessionId);
            }
            requireStage(session, ReviewStage.REVIEWING_HIGH_RISK);
            int cursor = session.getHighRiskCursor();
            List<String> highRisk = session.getHighRiskFiles();
            if (cursor >= highRisk.size()) {
                commitOrThrow(session, s -> s.transitionTo(ReviewStage.COMPLETED));
                return HighRiskResult.alreadyComplete(sessionId);
            }
            file = highRisk.get(cursor);
            return reviewHighRiskFile(session, cursor, file, cursor + 1 >= highRisk.size());
        } catch (SessionNotFoundException e) {
            return HighRiskResult.failure(sessionId, ReviewError.SESSION_NOT_FOUND, e.getMessage());
        } catch (ReviewException e) {
            ReviewError error = onStageError(session, STAGE_HIGH_RISK, file, e);
            return HighRiskResult.failure(sessionId, error, e.getMessage());
        } catch (RuntimeException e) {
            ReviewError error = onUnexpected(session, STAGE_HIGH_RISK, file, e);
            return HighRiskResult.failure(sessionId, error, describe(e));
        } finally {
            MdcContext.clear();
        }
    }

    private HighRiskResult reviewHighRiskFile(ReviewSession session, int cursor, String path, boolean last) {
        FileContext ctx = context(session.getProjectPath(), path, true);
        Optional<List<Finding>> hit = cache.get(ctx.identity(), ctx.fingerprint())
                .flatMap(entry -> entry.cachedFindings(RiskLevel.HIGH_RISK));
        metrics.recordCacheLookup(STAGE_HIGH_RISK, hit.isPresent());

        List<Finding> reviewed;
        if (hit.isPresent()) {
            log.info("High-risk file {} served from cache ({} finding(s))", path, hit.get().size());
            reviewed = hit.get();
        } else {
            publishStatus(session, path, HighRiskStatus.REVIEWING);
            List<SubAgentReview> reviews = runSubAgents(session, cursor, ctx, riskReasoning(session, path));

            publishStatus(session, path, HighRiskStatus.COORDINATING);
            List<Finding> coordinated = runCoordinator(session, cursor, ctx, reviews);
            List<Finding> consensus = ConsensusPolicy.enforce(coordinated, reviews);
            var counter = new AtomicInteger();
            consensus = consensus.stream()
                    .map(f -> f.withFileIdentity(ctx.identity(), ctx.path())
                            .withId(session.getId() + "-highrisk-" + cursor + "-" + counter.incrementAndGet()))
                    .toList();

            publishStatus(session, path, HighRiskStatus.VERIFYING);
            reviewed = runVerification(session, cursor, ctx, consensus);
        }

        var cachedIds = new AtomicInteger();
        List<Finding> findings = hit.isPresent()
                ? reviewed.stream()
                        .map(f -> f.withId(session.getId() + "-highrisk-" + cursor + "-" + cachedIds.incrementAndGet()))
                        .toList()
                : reviewed;
        metrics.recordFindings(STAGE_HIGH_RISK, findings.size());

        final boolean fromCache = hit.isPresent();
        commitOrThrow(session, s -> {
            requireStage(s, ReviewStage.REVIEWING_HIGH_RISK);
            if (s.getHighRiskCursor() != cursor) {
                throw new ReviewException(ReviewError.INVALID_STATE,
                        "High-risk file " + path + " was already processed by a concurrent call");
            }
            if (!fromCache) {
                cache.putFindings(ctx.identity(), ctx.fingerprint(), RiskLevel.HIGH_RISK, findings);
            }
            s.addFindings(findings);
            s.advanceCursor();
            if (last) {
                s.transitionTo(ReviewStage.COMPLETED);
            }
            eventBus.publish(ReviewEvent.of(ReviewEvent.TYPE_HIGH_RISK_STATUS, s.getId(), path,
                    Map.of("status", HighRiskStatus.COMPLETE)));
            eventBus.publish(ReviewEvent.of(ReviewEvent.TYPE_HIGH_RISK_FINDINGS, s.getId(), path,
                    Map.of("findings", findings, "findingCount", findings.size(), "cached", fromCache,
                            "fileIndex", cursor, ReviewEvent.KEY_COMPLETE, last)));
        });
        return HighRiskResult.success(session.getId(), last, path, findings);
    }

    private List<SubAgentReview> runSubAgents(ReviewSession session, int cursor, FileContext ctx, String reasoning) {
        int agentCount = ConsensusPolicy.AGENT_IDS.size();
        var futures = new ArrayList<CompletableFuture<SubAgentReview>>();
        for (int n = 1; n <= agentCount; n++) {
            final int agentNumber = n;
            futures.add(CompletableFuture.supplyAsync(
                    () -> runSubAgent(session, cursor, ctx, agentNumber, reasoning), fanOut));
        }
        return joinAll(futures, i -> SubAgentReview.empty(ConsensusPolicy.agentId(i + 1)));
    }

    private SubAgentReview runSubAgent(ReviewSession session, int cursor, FileContext ctx, int agentNumber,
                                       String reasoning) {
        String agentId = ConsensusPolicy.agentId(agentNumber);
        String taskId = taskId(session, "file" + cursor + "-agent" + agentNumber);
        MdcContext.setTask(session.getId(), taskId, agentId);
        try {
            LlmTaskResult result = runner.run(new LlmTask(taskId, STAGE_SUB_AGENT,
                    ReviewPromptBuilder.subAgentPrompt(ctx, agentNumber, reasoning), session.getProjectPath(),
                    properties.getAgentTimeout()), session.getToken());
            if (!result.success()) {
                log.warn("Reviewer {} failed, contributing no findings: {}", agentId, result.error());
                return SubAgentReview.empty(agentId);
            }
            ParseResult<List<Finding>> parsed = projector.findings(result.output(), session.getProjectPath());
            if (!parsed.isParsed()) {
                log.warn("Reviewer {} output unparseable, contributing no findings: {}", agentId, parsed.errorReason());
                return SubAgentReview.empty(agentId);
            }
            List<Finding> findings = parsed.orElse(List.of()).stream()
                    .map(f -> f.withFileIdentity(ctx.identity(), ctx.path())
                            .withConsensus(Set.of(agentId), ConsensusPolicy.confidenceFor(1)))
                    .toList();
            return new SubAgentReview(agentId, findings, Instant.now());
        } finally {
            MdcContext.clearTask();
        }
    }

    private List<Finding> runCoordinator(ReviewSession session, int cursor, FileContext ctx,
                                         List<SubAgentReview> reviews) {
        String taskId = taskId(session, "file" + cursor + "-coordinator");
        MdcContext.setTask(session.getId(), taskId, "coordinator");
        try {
            String output = runRequired(session, taskId, STAGE_COORDINATOR,
                    ReviewPromptBuilder.coordinatorPrompt(ctx, reviews), properties.getCoordinatorTimeout());
            ParseResult<List<Finding>> parsed = projector.findings(output, session.getProjectPath());
            if (!parsed.isParsed()) {
                throw new ReviewException(ReviewError.STAGE_FAILED,
                        "Could not parse coordinator response for " + ctx.path() + ": " + parsed.errorReason());
            }
            return parsed.orElse(List.of());
        } finally {
            MdcContext.clearTask();
        }
    }

    private List<Finding> runVerification(ReviewSession session, int cursor, FileContext ctx, List<Finding> findings) {
        var futures = new ArrayList<CompletableFuture<Finding>>();
        for (int i = 0; i < findings.size(); i++) {
            final int index = i;
            final Finding finding = findings.get(i);
            futures.add(CompletableFuture.supplyAsync(() -> verify(session, cursor, ctx, index, finding), fanOut));
        }
        List<Finding> checked = joinAll(futures, i -> findings.get(i).withVerification(null));
        List<Finding> verified = checked.stream().filter(Finding::isVerified).toList();
        log.info("Verification kept {} of {} finding(s) for {}", verified.size(), findings.size(), ctx.path());
        return verified;
    }

    private Finding verify(ReviewSession session, int cursor, FileContext ctx, int index, Finding finding) {
        String taskId = taskId(session, "file" + cursor + "-verify-" + index);
        MdcContext.setTask(session.getId(), taskId, "verifier");
        try {
            LlmTaskResult result = runner.run(new LlmTask(taskId, STAGE_VERIFY,
                    ReviewPromptBuilder.verificationPrompt(ctx, finding), session.getProjectPath(),
                    properties.getVerifyTimeout()), session.getToken());
            VerificationResult verification = null;
            if (result.success()) {
                ParseResult<VerificationResult> parsed = projector.verification(result.output(), finding.id());
                if (parsed.isParsed()) {
                    verification = parsed.orElse(null);
                } else {
                    log.warn("Verifier output for {} unparseable, rejecting: {}", finding.id(), parsed.errorReason());
                }
            }
            Finding checked = finding.withVerification(verification);
            metrics.recordVerification(checked.isVerified());
            return checked;
        } finally {
            MdcContext.clearTask();
        }
    }

    // -- cancel / fingerprints / invalidation -----------------------------------------------

    /**
     * Removes the session and signals cancellation to its in-flight tasks. Does not wait for them.
     */
    public CancelResult cancel(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return new CancelResult(true, sessionId, 0);
        }
        Optional<ReviewSession> removed = sessions.remove(sessionId);
        String prefix = sessionId + "-";
        int signalled = 0;
        for (String taskId : runner.activeTaskIds()) {
            if (taskId.startsWith(prefix) && TASK_SUFFIX.matcher(taskId.substring(prefix.length())).matches()) {
                runner.cancel(taskId);
                signalled++;
            }
        }
        if (removed.isPresent()) {
            log.info("Cancelled review session {} ({} active task(s) signalled)", sessionId, signalled);
            eventBus.publish(ReviewEvent.of(ReviewEvent.TYPE_CANCELLED, sessionId, null,
                    Map.of("cancelledTasks", signalled)));
        }
        return new CancelResult(true, sessionId, signalled);
    }

    public FingerprintResult computeFingerprints(String projectPath, List<String> files) {
        if (projectPath == null || projectPath.isBlank()) {
            return FingerprintResult.failure(ReviewError.INVALID_REQUEST, "projectPath is required");
        }
        if (files == null) {
            return FingerprintResult.failure(ReviewError.INVALID_REQUEST, "files is required");
        }
        Map<String, String> fingerprints = new LinkedHashMap<>();
        for (String path : normalizeFiles(files)) {
            fingerprints.put(path, identityService.fingerprint(source.diff(projectPath, path)).hex());
        }
        return FingerprintResult.success(fingerprints);
    }

    /**
     * Drops cached results so the next review calls the LLM again. An empty file list drops
     * every entry of the project.
     */
    public InvalidateResult invalidate(String projectPath, List<String> files) {
        if (projectPath == null || projectPath.isBlank()) {
            return InvalidateResult.failure(ReviewError.INVALID_REQUEST, "projectPath is required");
        }
        List<String> paths = normalizeFiles(files);
        if (paths.isEmpty()) {
            return InvalidateResult.success(cache.invalidateProject(projectPath));
        }
        Collection<FileIdentity> identities = paths.stream()
                .map(p -> identityService.identify(projectPath, p))
                .toList();
        return InvalidateResult.success(cache.invalidate(identities));
    }

    @PreDestroy
    void shutdown() {
        ownedPool.shutdownNow();
    }

    // -- helpers ----------------------------------------------------------------------------

    private FileContext context(String root, String path, boolean full) {
        String diff = source.diff(root, path);
        return new FileContext(path, identityService.identify(root, path), identityService.fingerprint(diff), diff,
                full ? source.content(root, path) : "", full ? source.imports(root, path) : "");
    }

    private String runRequired(ReviewSession session, String taskId, String stage, String prompt, Duration timeout) {
        LlmTaskResult result = runner.run(new LlmTask(taskId, stage, prompt, session.getProjectPath(), timeout),
                session.getToken());
        if (!result.success()) {
            throw new ReviewException(ReviewError.STAGE_FAILED, stage + " task failed: " + result.error());
        }
        return result.output();
    }

    private void publishStatus(ReviewSession session, String path, HighRiskStatus status) {
        commitOrThrow(session, s -> eventBus.publish(ReviewEvent.of(ReviewEvent.TYPE_HIGH_RISK_STATUS,
                s.getId(), path, Map.of("status", status))));
    }

    private void commitOrThrow(ReviewSession session, Consumer<ReviewSession> mutation) {
        if (!session.commit(mutation)) {
            throw new SessionNotFoundException(session.getId());
        }
    }

    private static void requireStage(ReviewSession session, ReviewStage expected) {
        ReviewStage actual = session.getStage();
        if (actual != expected) {
            throw new ReviewException(ReviewError.INVALID_STATE,
                    "Session " + session.getId() + " is " + actual + ", expected " + expected);
        }
    }

    private static String riskReasoning(ReviewSession session, String path) {
        return session.getClassifications().stream()
                .filter(c -> c.path().equals(path))
                .map(FileClassification::reasoning)
                .findFirst()
                .orElse("");
    }

    private static void validatePartition(ReviewSession session, List<String> rawLow, List<String> rawHigh,
                                          List<String> low, List<String> high) {
        if (rawLow == null || rawHigh == null) {
            throw new ReviewException(ReviewError.INVALID_REQUEST, "lowRiskFiles and highRiskFiles are required");
        }
        if (low.size() != rawLow.size() || high.size() != rawHigh.size()) {
            throw new ReviewException(ReviewError.INVALID_REQUEST, "Risk partition contains duplicate or blank paths");
        }
        Set<String> overlap = new LinkedHashSet<>(low);
        overlap.retainAll(high);
        if (!overlap.isEmpty()) {
            throw new ReviewException(ReviewError.INVALID_REQUEST,
                    "Files cannot be both low- and high-risk: " + String.join(", ", overlap));
        }
        Set<String> union = new HashSet<>(low);
        union.addAll(high);
        if (!union.equals(new HashSet<>(session.getFiles()))) {
            throw new ReviewException(ReviewError.INVALID_REQUEST,
                    "Risk partition must cover exactly the session's files");
        }
    }

    private static List<String> normalizeFiles(List<String> files) {
        if (files == null) {
            return List.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String file : files) {
            String path = FileIdentityService.normalizePath(file);
            if (!path.isBlank()) {
                normalized.add(path);
            }
        }
        return List.copyOf(normalized);
    }

    private static <T> List<List<T>> partition(List<T> items, int size) {
        var batches = new ArrayList<List<T>>();
        for (int i = 0; i < items.size(); i += size) {
            batches.add(List.copyOf(items.subList(i, Math.min(items.size(), i + size))));
        }
        return batches;
    }

    private static <T> List<T> joinAll(List<CompletableFuture<T>> futures,
                                       IntFunction<T> onError) {
        var results = new ArrayList<T>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).join());
            } catch (CompletionException e) {
                log.error("Unexpected error in fan-out task {}", i, e);
                results.add(onError.apply(i));
            }
        }
        return results;
    }

    private static String taskId(ReviewSession session, String suffix) {
        return session.getId() + "-" + suffix;
    }

    private ReviewError onStageError(ReviewSession session, String stage, String file, ReviewException e) {
        if (!session.isActive()) {
            return ReviewError.SESSION_NOT_FOUND;
        }
        if (e.getError() != ReviewError.STAGE_FAILED) {
            log.info("Rejected {} call for session {}: {}", stage, session.getId(), e.getMessage());
            return e.getError();
        }
        log.warn("Stage {} failed for session {}: {}", stage, session.getId(), e.getMessage());
        metrics.recordStageFailure(stage);
        boolean reported = session.commit(s -> {
            s.setLastError(e.getMessage());
            eventBus.publish(failedEvent(s, stage, file, e.getMessage(), false));
        });
        return reported ? ReviewError.STAGE_FAILED : ReviewError.SESSION_NOT_FOUND;
    }

    private ReviewError onUnexpected(ReviewSession session, String stage, String file, RuntimeException e) {
        if (!session.isActive()) {
            return ReviewError.SESSION_NOT_FOUND;
        }
        log.error("Unexpected error in stage {} for session {}", stage, session.getId(), e);
        metrics.recordStageFailure(stage);
        String message = describe(e);
        boolean reported = session.commit(s -> {
            s.setLastError(message);
            if (!s.getStage().isTerminal()) {
                s.transitionTo(ReviewStage.FAILED);
            }
            eventBus.publish(failedEvent(s, stage, file, message, true));
        });
        return reported ? ReviewError.INTERNAL_ERROR : ReviewError.SESSION_NOT_FOUND;
    }

    private static ReviewEvent failedEvent(ReviewSession session, String stage, String file, String message,
                                           boolean fatal) {
        return ReviewEvent.of(ReviewEvent.TYPE_FAILED, session.getId(), file,
                Map.of("stage", stage, "message", message, ReviewEvent.KEY_FATAL, fatal));
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static ExecutorService newFanOutPool() {
        var counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "review-fanout-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
