package com.fincube.fraud.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * RestClient instances for the ledger provider and the reasoning oracle.
 * Each gets its own connect and read timeouts.
 */
@Configuration
public class RestClientConfig {

    @Bean
    @Qualifier("ledgerRestClient")
    public RestClient ledgerRestClient(RestClient.Builder builder, LedgerConfig config) {
        return builder.clone()
                .requestFactory(requestFactory(config.getConnectTimeoutMs(), config.getReadTimeoutMs()))
                .build();
    }

    @Bean
    @Qualifier("oracleRestClient")
    public RestClient oracleRestClient(RestClient.Builder builder, ReasoningOracleConfig config) {
        return builder.clone()
                .requestFactory(requestFactory(config.getConnectTimeoutMs(), config.getTimeoutMs()))
                .build();
    }

    @Bean
    @Qualifier("datasetRestClient")
    public RestClient datasetRestClient(RestClient.Builder builder, ReferenceImportConfig config) {
        return builder.clone()
                .requestFactory(requestFactory(config.getConnectTimeoutMs(), config.getReadTimeoutMs()))
                .build();
    }

    private JdkClientHttpRequestFactory requestFactory(long connectTimeoutMs, long readTimeoutMs) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(readTimeoutMs));
        return requestFactory;
    }
}
