package com.fincube.fraud.config;

import com.fincube.fraud.exception.OracleTransportException;
import com.fincube.fraud.exception.OracleMalformedResponseException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class ResilienceConfig {

    private static final Logger log = LoggerFactory.getLogger(ResilienceConfig.class);

    /**
     * Retry for the reasoning oracle: fixed backoff, transport failures only.
     * A malformed answer is never retried.
     */
    @Bean
    public Retry oracleRetry(ReasoningOracleConfig config) {
        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(Math.max(1, config.getMaxAttempts()))
                .waitDuration(Duration.ofMillis(config.getBackoffMs()))
                .retryExceptions(OracleTransportException.class)
                .ignoreExceptions(OracleMalformedResponseException.class)
                .build();

        Retry retry = Retry.of("reasoningOracle", retryConfig);
        retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying reasoning oracle (attempt {}): {}",
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }
}
