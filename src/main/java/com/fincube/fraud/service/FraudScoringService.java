package com.fincube.fraud.service;

import com.fincube.fraud.config.FraudScoringConfig;
import com.fincube.fraud.config.MetricsConfig;
import com.fincube.fraud.engine.CrossValidator;
import com.fincube.fraud.engine.DecisionFusion;
import com.fincube.fraud.engine.EdgeCaseDetector;
import com.fincube.fraud.engine.NeighborEvidenceModel;
import com.fincube.fraud.engine.PatternDetectorSuite;
import com.fincube.fraud.engine.ScoringContext;
import com.fincube.fraud.engine.ScoringContext.Stage;
import com.fincube.fraud.engine.SimilarityIndex;
import com.fincube.fraud.engine.features.FeatureVectorBuilder;
import com.fincube.fraud.engine.features.ScalerRegistry;
import com.fincube.fraud.engine.reasoning.ReasoningAdapter;
import com.fincube.fraud.exception.EvidenceUnavailableException;
import com.fincube.fraud.exception.ScoringCapacityException;
import com.fincube.fraud.model.AccountActivity;
import com.fincube.fraud.model.FeatureVector;
import com.fincube.fraud.model.FraudLabel;
import com.fincube.fraud.model.NeighborMatch;
import com.fincube.fraud.model.PatternReport;
import com.fincube.fraud.model.ReasoningRequest;
import com.fincube.fraud.model.Scaler;
import com.fincube.fraud.model.ScoreDecision;
import com.fincube.fraud.model.ScoreLedgerEntry;
import com.fincube.fraud.model.ScoreRequest;
import com.fincube.fraud.model.ScoreResponse;
import com.fincube.fraud.model.TentativeDecision;
import com.fincube.fraud.repository.ScoreLedgerRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Main orchestrator for account fraud scoring.
 *
 * Flow:
 * 1. Capture the current scaler snapshot (no scaler means no evidence)
 * 2. Concurrently: build and normalize the feature vector, then query neighbors;
 *    run all pattern detectors and aggregate behavioral risk
 * 3. Detect edge cases and cross-validate neighbor and pattern evidence
 * 4. Ask the reasoning oracle (or fallback voting) for a tentative decision
 * 5. Apply guardrails to produce the final decision
 * 6. Record non-Undecided outcomes in the score ledger
 * 7. Record metrics and send a fraud alert (async)
 */
@Service
public class FraudScoringService {

    private static final Logger log = LoggerFactory.getLogger(FraudScoringService.class);

    static final int RESPONSE_NEIGHBORS = 5;

    private final LedgerDataSource ledgerDataSource;
    private final ScalerRegistry scalerRegistry;
    private final SimilarityIndex similarityIndex;
    private final NeighborEvidenceModel neighborEvidenceModel;
    private final PatternDetectorSuite patternDetectorSuite;
    private final EdgeCaseDetector edgeCaseDetector;
    private final CrossValidator crossValidator;
    private final ReasoningAdapter reasoningAdapter;
    private final DecisionFusion decisionFusion;
    private final ScoreLedgerRepository scoreLedgerRepository;
    private final FraudAlertNotificationService notificationService;
    private final MetricsConfig metricsConfig;
    private final FraudScoringConfig config;
    private final AsyncTaskExecutor scoringExecutor;
    private final AsyncTaskExecutor pipelineExecutor;

    public FraudScoringService(LedgerDataSource ledgerDataSource,
                               ScalerRegistry scalerRegistry,
                               SimilarityIndex similarityIndex,
                               NeighborEvidenceModel neighborEvidenceModel,
                               PatternDetectorSuite patternDetectorSuite,
                               EdgeCaseDetector edgeCaseDetector,
                               CrossValidator crossValidator,
                               ReasoningAdapter reasoningAdapter,
                               DecisionFusion decisionFusion,
                               ScoreLedgerRepository scoreLedgerRepository,
                               FraudAlertNotificationService notificationService,
                               MetricsConfig metricsConfig,
                               FraudScoringConfig config,
                               @Qualifier("scoringExecutor") AsyncTaskExecutor scoringExecutor,
                               @Qualifier("pipelineExecutor") AsyncTaskExecutor pipelineExecutor) {
        this.ledgerDataSource = ledgerDataSource;
        this.scalerRegistry = scalerRegistry;
        this.similarityIndex = similarityIndex;
        this.neighborEvidenceModel = neighborEvidenceModel;
        this.patternDetectorSuite = patternDetectorSuite;
        this.edgeCaseDetector = edgeCaseDetector;
        this.crossValidator = crossValidator;
        this.reasoningAdapter = reasoningAdapter;
        this.decisionFusion = decisionFusion;
        this.scoreLedgerRepository = scoreLedgerRepository;
        this.notificationService = notificationService;
        this.metricsConfig = metricsConfig;
        this.config = config;
        this.scoringExecutor = scoringExecutor;
        this.pipelineExecutor = pipelineExecutor;
    }

    /**
     * Score an account, fetching its activity from the ledger unless the
     * request already carries it.
     */
    @Observed(name = "fraud.score", contextualName = "score-account")
    public ScoreResponse score(ScoreRequest request) {
        AccountActivity activity = request.getActivity() != null
                ? request.getActivity()
                : ledgerDataSource.fetchActivity(request.getAddress());
        return scoreActivity(request.getEffectiveReferenceId(), request.getAddress(), activity);
    }

    /**
     * Runs the pipeline on a background thread. Cancelling the returned future
     * interrupts the pipeline; a cancelled request persists nothing and sends
     * no alert.
     */
    public CompletableFuture<ScoreResponse> scoreAsync(ScoreRequest request) {
        CompletableFuture<ScoreResponse> result = new CompletableFuture<>();
        Future<?> task;
        try {
            task = pipelineExecutor.submit(() -> {
                try {
                    result.complete(score(request));
                } catch (Throwable e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new ScoringCapacityException(
                    "Scoring capacity exhausted, retry later", e));
            return result;
        }
        result.whenComplete((response, error) -> {
            if (result.isCancelled()) {
                task.cancel(true);
                log.info("Scoring cancelled for reference={}", request.getEffectiveReferenceId());
            }
        });
        return result;
    }

    @Observed(name = "fraud.score.activity", contextualName = "score-activity")
    public ScoreResponse scoreActivity(String referenceId, String address, AccountActivity activity) {
        AccountActivity safeActivity = activity != null ? activity : AccountActivity.empty();

        // 1. Capture the scaler snapshot this request will use throughout
        Scaler scaler = scalerRegistry.current()
                .orElseThrow(() -> new EvidenceUnavailableException(
                        "No feature scaler fitted. Load reference data before scoring."));

        ScoringContext context = ScoringContext.builder()
                .referenceId(referenceId)
                .address(address)
                .activity(safeActivity)
                .scaler(scaler)
                .build();

        // 2. Feature/neighbor and pattern stages run concurrently
        ScoringContext base = context;
        Future<ScoringContext> featureBranch = submitBranch(
                () -> gatherNeighborEvidence(buildFeatures(base)), null);
        Future<PatternReport> patternBranch = submitBranch(
                () -> patternDetectorSuite.analyze(base.getActivity()), featureBranch);

        context = await(featureBranch, patternBranch);
        PatternReport patternReport = await(patternBranch, featureBranch);
        context = context.toBuilder()
                .patternReport(patternReport)
                .build()
                .advance(Stage.VALIDATE);

        // 3. Edge cases and cross-validation
        context = validate(context);

        // 4. Tentative decision
        context = reason(context);

        // 5. Guardrails
        context = fuse(context);

        ScoreResponse response = toResponse(context);

        // Cancelled requests stop here without side effects
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Scoring cancelled for reference " + referenceId);
        }

        // 6. Persist non-Undecided outcomes
        ScoreDecision decision = context.getDecision();
        if (decision.getLabel() != FraudLabel.UNDECIDED) {
            try {
                scoreLedgerRepository.recordOutcome(referenceId,
                        decision.getLabel() == FraudLabel.FRAUD, decision.getConfidence());
            } catch (Exception e) {
                log.error("Failed to record score ledger outcome for reference={}: {}",
                        referenceId, e.getMessage(), e);
            }
        }

        // 7. Metrics and notification
        metricsConfig.recordScoring(decision.getLabel().getWireName(), decision.getConfidence());
        notificationService.notifyIfFraud(response);

        if (decision.getLabel() == FraudLabel.FRAUD) {
            log.warn("Fraud detected for reference={}, address={}: confidence={}, fallback={}",
                    referenceId, address, decision.getConfidence(), decision.isFallbackUsed());
        } else {
            log.info("Scored reference={}, address={}: label={}, confidence={}",
                    referenceId, address, decision.getLabel(), decision.getConfidence());
        }

        return response;
    }

    public Optional<ScoreLedgerEntry> getLedgerEntry(String referenceId) {
        return scoreLedgerRepository.findByReferenceId(referenceId);
    }

    ScoringContext buildFeatures(ScoringContext context) {
        FeatureVector raw = FeatureVectorBuilder.build(context.getActivity());
        FeatureVector normalized = FeatureVectorBuilder.normalize(context.getScaler(), raw);
        return context.toBuilder()
                .features(raw.asMap())
                .rawVector(raw)
                .normalizedVector(normalized)
                .build()
                .advance(Stage.NEIGHBOR_EVIDENCE);
    }

    ScoringContext gatherNeighborEvidence(ScoringContext context) {
        List<NeighborMatch> neighbors = similarityIndex.findNearest(
                context.getNormalizedVector(), config.getKnnNeighbors());
        if (neighbors == null || neighbors.isEmpty()) {
            throw new EvidenceUnavailableException(
                    "No reference neighbors available for scaler v" + context.getScaler().getVersion()
                            + ". Load reference data before scoring.");
        }
        return context.toBuilder()
                .neighbors(List.copyOf(neighbors))
                .neighborAnalysis(neighborEvidenceModel.analyze(neighbors))
                .build()
                .advance(Stage.PATTERN_DETECT);
    }

    ScoringContext validate(ScoringContext context) {
        List<String> edgeCases = edgeCaseDetector.detect(
                context.getFeatures(), context.getNeighborAnalysis(), context.getPatternReport());
        return context.toBuilder()
                .edgeCases(edgeCases)
                .validation(crossValidator.validate(context.getNeighborAnalysis(), context.getPatternReport()))
                .build()
                .advance(Stage.REASON);
    }

    ScoringContext reason(ScoringContext context) {
        ReasoningRequest request = ReasoningRequest.builder()
                .address(context.getAddress())
                .neighborAnalysis(context.getNeighborAnalysis())
                .features(context.getFeatures())
                .patternReport(context.getPatternReport())
                .validation(context.getValidation())
                .edgeCases(context.getEdgeCases())
                .build();

        TentativeDecision tentative = reasoningAdapter.decide(request);

        Set<String> edgeCases = new LinkedHashSet<>(context.getEdgeCases());
        edgeCases.addAll(tentative.getEdgeCases());

        return context.toBuilder()
                .tentative(tentative.toBuilder().edgeCases(new ArrayList<>(edgeCases)).build())
                .build()
                .advance(Stage.FUSE);
    }

    ScoringContext fuse(ScoringContext context) {
        ScoreDecision decision = decisionFusion.fuse(context.getTentative(), context.getNeighborAnalysis(),
                context.getBehavioralRisk(), context.getValidation());
        return context.toBuilder()
                .decision(decision)
                .build()
                .advance(Stage.DONE);
    }

    private ScoreResponse toResponse(ScoringContext context) {
        List<NeighborMatch> neighbors = context.getNeighbors();
        return ScoreResponse.builder()
                .referenceId(context.getReferenceId())
                .address(context.getAddress())
                .decision(context.getDecision())
                .neighborAnalysis(context.getNeighborAnalysis())
                .nearestNeighbors(neighbors.subList(0, Math.min(RESPONSE_NEIGHBORS, neighbors.size())))
                .features(context.getFeatures())
                .scalerVersion(context.getScaler().getVersion())
                .scoredAt(System.currentTimeMillis())
                .build();
    }

    /**
     * Submits one concurrent branch. A rejected submission cancels the
     * already running sibling, if any.
     */
    private <T> Future<T> submitBranch(Callable<T> branch, Future<?> sibling) {
        try {
            return scoringExecutor.submit(branch);
        } catch (RejectedExecutionException e) {
            if (sibling != null) {
                sibling.cancel(true);
            }
            metricsConfig.recordScoringRejected();
            throw new ScoringCapacityException("Scoring capacity exhausted, retry later", e);
        }
    }

    /**
     * Waits for one branch. If it fails or the wait is interrupted, the
     * sibling branch is cancelled.
     */
    private static <T> T await(Future<T> branch, Future<?> sibling) {
        try {
            return branch.get();
        } catch (InterruptedException e) {
            branch.cancel(true);
            sibling.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Scoring cancelled");
        } catch (ExecutionException e) {
            sibling.cancel(true);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Scoring stage failed", cause);
        }
    }
}
