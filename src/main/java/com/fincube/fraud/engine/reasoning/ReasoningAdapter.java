package com.fincube.fraud.engine.reasoning;

import com.fincube.fraud.config.MetricsConfig;
import com.fincube.fraud.config.ReasoningOracleConfig;
import com.fincube.fraud.exception.OracleMalformedResponseException;
import com.fincube.fraud.exception.OracleTransportException;
import com.fincube.fraud.model.ReasoningRequest;
import com.fincube.fraud.model.TentativeDecision;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Boundary to the reasoning oracle. Each attempt is bounded by a timeout;
 * transport failures and timeouts are retried once with backoff, malformed
 * answers are not. Any failure ends in fallback voting, so this never throws
 * except when the calling request is cancelled.
 */
@Component
public class ReasoningAdapter {

    private static final Logger log = LoggerFactory.getLogger(ReasoningAdapter.class);

    private final ReasoningOracle oracle;
    private final ReasoningOracleConfig config;
    private final Retry oracleRetry;
    private final AsyncTaskExecutor executor;
    private final FallbackVoter fallbackVoter;
    private final MetricsConfig metricsConfig;

    public ReasoningAdapter(ReasoningOracle oracle, ReasoningOracleConfig config, Retry oracleRetry,
                            @Qualifier("scoringExecutor") AsyncTaskExecutor executor,
                            FallbackVoter fallbackVoter, MetricsConfig metricsConfig) {
        this.oracle = oracle;
        this.config = config;
        this.oracleRetry = oracleRetry;
        this.executor = executor;
        this.fallbackVoter = fallbackVoter;
        this.metricsConfig = metricsConfig;
    }

    public TentativeDecision decide(ReasoningRequest request) {
        if (!config.isEnabled()) {
            metricsConfig.recordOracleCall("disabled");
            return fallback(request, "oracle disabled");
        }

        try {
            String text = oracleRetry.executeSupplier(() -> callOnce(request));
            TentativeDecision decision = ReasoningResponseParser.parse(text);
            metricsConfig.recordOracleCall("success");
            log.debug("Oracle decision for {}: {} ({})", request.getAddress(),
                    decision.getLabel(), decision.getConfidence());
            return decision;
        } catch (OracleTransportException e) {
            metricsConfig.recordOracleCall("transport_error");
            log.warn("Reasoning oracle unavailable for {}: {}", request.getAddress(), e.getMessage());
            return fallback(request, "transport failure");
        } catch (OracleMalformedResponseException e) {
            metricsConfig.recordOracleCall("malformed");
            log.error("Malformed reasoning oracle response for {}: {}", request.getAddress(), e.getMessage());
            return fallback(request, "unparseable response");
        }
    }

    private String callOnce(ReasoningRequest request) {
        Future<String> future;
        try {
            future = executor.submit(() -> oracle.judge(request));
        } catch (RejectedExecutionException e) {
            throw new OracleTransportException("Oracle call rejected, scoring pool saturated", e);
        }
        try {
            return future.get(config.getTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new OracleTransportException("Oracle call timed out after " + config.getTimeoutMs() + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Scoring cancelled while waiting for the reasoning oracle");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof OracleTransportException) {
                throw (OracleTransportException) cause;
            }
            throw new OracleTransportException("Oracle call failed: " + cause.getMessage(), cause);
        }
    }

    private TentativeDecision fallback(ReasoningRequest request, String cause) {
        return fallbackVoter.vote(request.getNeighborAnalysis(), request.getPatternReport(),
                request.getValidation(), request.getEdgeCases(), cause);
    }
}
