package com.fincube.fraud.engine.reasoning;

import com.fincube.fraud.config.FraudScoringConfig;
import com.fincube.fraud.config.MetricsConfig;
import com.fincube.fraud.config.ReasoningOracleConfig;
import com.fincube.fraud.config.ResilienceConfig;
import com.fincube.fraud.exception.OracleTransportException;
import com.fincube.fraud.model.FraudLabel;
import com.fincube.fraud.model.ReasoningRequest;
import com.fincube.fraud.model.TentativeDecision;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.fincube.fraud.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReasoningAdapterTest {

    private static final String FRAUD_JSON = "```json\n{\"final_decision\": \"Fraud\", \"confidence\": 0.9, "
            + "\"reasoning\": \"Mixer profile\"}\n```";

    @Mock
    private ReasoningOracle oracle;

    private ReasoningOracleConfig oracleConfig;
    private SimpleMeterRegistry registry;
    private ThreadPoolTaskExecutor executor;

    @BeforeEach
    void setUp() {
        oracleConfig = new ReasoningOracleConfig();
        oracleConfig.setEnabled(true);
        oracleConfig.setBackoffMs(1);
        oracleConfig.setTimeoutMs(2000);
        registry = new SimpleMeterRegistry();

        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setThreadNamePrefix("oracle-test-");
        executor.initialize();
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private ReasoningAdapter adapter() {
        return new ReasoningAdapter(oracle, oracleConfig, new ResilienceConfig().oracleRetry(oracleConfig),
                executor, new FallbackVoter(new FraudScoringConfig()), new MetricsConfig(registry));
    }

    private static ReasoningRequest request() {
        return ReasoningRequest.builder()
                .address(ADDRESS)
                .neighborAnalysis(neighborAnalysis(0.8, 0.7))
                .features(Map.of())
                .patternReport(patternReport(0.7))
                .validation(validation(true))
                .edgeCases(List.of("High transaction volume with minimal balance - possible mixer/tumbler"))
                .build();
    }

    private double oracleCalls(String outcome) {
        return registry.get("oracle.call.count").tag("outcome", outcome).counter().count();
    }

    @Test
    void decide_validAnswer_returnsOracleDecision() {
        when(oracle.judge(any())).thenReturn(FRAUD_JSON);

        TentativeDecision decision = adapter().decide(request());

        assertThat(decision.getLabel()).isEqualTo(FraudLabel.FRAUD);
        assertThat(decision.getConfidence()).isEqualTo(0.9);
        assertThat(decision.isFallback()).isFalse();
        assertThat(oracleCalls("success")).isEqualTo(1.0);
    }

    @Test
    void decide_disabled_fallbackWithoutCallingOracle() {
        oracleConfig.setEnabled(false);

        TentativeDecision decision = adapter().decide(request());

        assertThat(decision.isFallback()).isTrue();
        assertThat(decision.getReasoning()).contains("oracle disabled");
        verifyNoInteractions(oracle);
    }

    @Test
    void decide_nonJsonAnswer_fallbackWithoutRetry() {
        when(oracle.judge(any())).thenReturn("This account looks suspicious to me.");

        TentativeDecision decision = adapter().decide(request());

        assertThat(decision.isFallback()).isTrue();
        assertThat(decision.getLabel()).isEqualTo(FraudLabel.FRAUD);
        assertThat(decision.getConfidence()).isEqualTo(0.7);
        assertThat(decision.getReasoning()).contains("unparseable response");
        assertThat(decision.getEdgeCases()).hasSize(1);
        verify(oracle, times(1)).judge(any());
        assertThat(oracleCalls("malformed")).isEqualTo(1.0);
    }

    @Test
    void decide_transientTransportFailure_retriedOnce() {
        when(oracle.judge(any()))
                .thenThrow(new OracleTransportException("connection reset"))
                .thenReturn(FRAUD_JSON);

        TentativeDecision decision = adapter().decide(request());

        assertThat(decision.isFallback()).isFalse();
        verify(oracle, times(2)).judge(any());
    }

    @Test
    void decide_persistentTransportFailure_fallbackAfterTwoAttempts() {
        when(oracle.judge(any())).thenThrow(new OracleTransportException("503 from oracle"));

        TentativeDecision decision = adapter().decide(request());

        assertThat(decision.isFallback()).isTrue();
        assertThat(decision.getReasoning()).contains("transport failure");
        verify(oracle, times(2)).judge(any());
        assertThat(oracleCalls("transport_error")).isEqualTo(1.0);
    }

    @Test
    void decide_slowOracle_timesOutIntoFallback() {
        oracleConfig.setTimeoutMs(50);
        oracleConfig.setMaxAttempts(1);
        when(oracle.judge(any())).thenAnswer(invocation -> {
            Thread.sleep(1000);
            return FRAUD_JSON;
        });

        TentativeDecision decision = adapter().decide(request());

        assertThat(decision.isFallback()).isTrue();
        assertThat(decision.getReasoning()).contains("transport failure");
    }

    @Test
    void decide_scoringPoolSaturated_fallbackWithoutCallingOracle() {
        executor.shutdown();
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("oracle-saturated-");
        executor.initialize();
        CountDownLatch release = new CountDownLatch(1);
        executor.execute(() -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        try {
            TentativeDecision decision = adapter().decide(request());

            assertThat(decision.isFallback()).isTrue();
            assertThat(decision.getReasoning()).contains("transport failure");
            assertThat(oracleCalls("transport_error")).isEqualTo(1.0);
            verifyNoInteractions(oracle);
        } finally {
            release.countDown();
        }
    }
}
