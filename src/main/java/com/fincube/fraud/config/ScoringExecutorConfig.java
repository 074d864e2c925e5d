package com.fincube.fraud.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ScoringExecutorConfig {

    /**
     * Leaf tasks of a scoring request: the feature/neighbor stage, the pattern
     * stage and each reasoning oracle attempt. Tasks on this pool never wait on
     * other tasks of the same pool.
     */
    @Bean(name = "scoringExecutor")
    @Primary
    public ThreadPoolTaskExecutor scoringExecutor(FraudScoringConfig config) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getScoringPoolSize());
        executor.setMaxPoolSize(config.getScoringPoolSize() * 2);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("scoring-");
        executor.initialize();
        return executor;
    }

    /**
     * Runs whole pipelines for asynchronous scoring requests.
     */
    @Bean(name = "pipelineExecutor")
    public ThreadPoolTaskExecutor pipelineExecutor(FraudScoringConfig config) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(2, config.getScoringPoolSize() / 2));
        executor.setMaxPoolSize(config.getScoringPoolSize());
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("pipeline-");
        executor.initialize();
        return executor;
    }
}
