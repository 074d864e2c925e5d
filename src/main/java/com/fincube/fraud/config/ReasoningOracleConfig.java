package com.fincube.fraud.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "oracle")
public class ReasoningOracleConfig {

    // When disabled every decision comes from fallback voting.
    private boolean enabled = false;

    private String baseUrl = "https://generativelanguage.googleapis.com/v1beta";
    private String apiKey;
    private String model = "gemini-2.0-flash";
    private double temperature = 0.1;

    // Per-attempt timeout.
    private long timeoutMs = 20000;

    // Total attempts, including the first. Retries happen only on transport failure.
    private int maxAttempts = 2;
    private long backoffMs = 500;

    private int connectTimeoutMs = 5000;
}
