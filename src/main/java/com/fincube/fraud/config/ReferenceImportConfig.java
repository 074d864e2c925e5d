package com.fincube.fraud.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "reference.import")
public class ReferenceImportConfig {

    private int connectTimeoutMs = 5000;

    // Datasets run to tens of megabytes.
    private int readTimeoutMs = 60000;
}
