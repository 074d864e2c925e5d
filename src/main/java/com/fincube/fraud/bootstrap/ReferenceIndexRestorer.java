package com.fincube.fraud.bootstrap;

import com.fincube.fraud.service.ReferenceDataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Loads the persisted scaler and reference vectors into memory on startup.
 * A failure leaves the service running without evidence; scoring answers 503
 * until reference data is loaded.
 */
@Component
@Order(1)
public class ReferenceIndexRestorer implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ReferenceIndexRestorer.class);

    private final ReferenceDataService referenceDataService;

    public ReferenceIndexRestorer(ReferenceDataService referenceDataService) {
        this.referenceDataService = referenceDataService;
    }

    @Override
    public void run(String... args) {
        log.info("=== Restoring reference index ===");
        try {
            referenceDataService.restore();
        } catch (Exception e) {
            log.error("Failed to restore reference index: {}", e.getMessage(), e);
        }
    }
}
