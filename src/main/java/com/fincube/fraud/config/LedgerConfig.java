package com.fincube.fraud.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "ledger")
public class LedgerConfig {

    private String baseUrl = "https://eth-mainnet.g.alchemy.com/v2";
    private String apiKey;

    // Max transfers requested per direction.
    private int maxCount = 1000;

    private int connectTimeoutMs = 5000;
    private int readTimeoutMs = 30000;
}
