package com.fincube.fraud.engine;

import com.fincube.fraud.config.MetricsConfig;
import com.fincube.fraud.model.AccountActivity;
import com.fincube.fraud.model.PatternDimension;
import com.fincube.fraud.model.PatternFinding;
import com.fincube.fraud.model.PatternReport;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every registered pattern detector against an account and aggregates
 * their findings into a behavioral risk score.
 * Uses the Strategy pattern: each PatternDimension is handled by one PatternDetector.
 */
@Component
public class PatternDetectorSuite {

    private static final Logger log = LoggerFactory.getLogger(PatternDetectorSuite.class);

    private final Map<PatternDimension, PatternDetector> detectorMap;
    private final RiskAggregator riskAggregator;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public PatternDetectorSuite(List<PatternDetector> detectors, RiskAggregator riskAggregator,
                                Tracer tracer, MetricsConfig metricsConfig) {
        this.detectorMap = new EnumMap<>(PatternDimension.class);
        this.riskAggregator = riskAggregator;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        // Auto-register all detector implementations
        for (PatternDetector detector : detectors) {
            detectorMap.put(detector.getDimension(), detector);
            log.info("Registered pattern detector: {} -> {}",
                    detector.getDimension(), detector.getClass().getSimpleName());
        }
    }

    /**
     * Run all detectors and aggregate. A detector that throws contributes an
     * empty finding for its dimension.
     */
    public PatternReport analyze(AccountActivity activity) {
        Map<PatternDimension, PatternFinding> findings = new EnumMap<>(PatternDimension.class);

        for (PatternDimension dimension : PatternDimension.values()) {
            PatternDetector detector = detectorMap.get(dimension);
            if (detector == null) {
                findings.put(dimension, PatternFinding.empty(dimension));
                continue;
            }

            Span span = tracer.nextSpan()
                    .name("pattern.detect." + dimension.getDisplayName())
                    .tag("pattern.dimension", dimension.name())
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
                PatternFinding finding = detector.detect(activity);
                findings.put(dimension, finding);

                span.tag("pattern.risk", String.valueOf(finding.getRiskLevel()));
                span.tag("pattern.tags", String.valueOf(finding.getTags().size()));

                finding.getTags().forEach(tag -> metricsConfig.recordPatternTriggered(tag.name()));
                if (!finding.getTags().isEmpty()) {
                    log.debug("Pattern detector {} triggered {} (risk={})",
                            dimension, finding.getTags(), finding.getRiskLevel());
                }
            } catch (Exception e) {
                span.error(e);
                log.error("Error in {} pattern detector: {}", dimension, e.getMessage(), e);
                findings.put(dimension, PatternFinding.empty(dimension));
            } finally {
                span.end();
            }
        }

        return PatternReport.builder()
                .findings(findings)
                .behavioralRisk(riskAggregator.aggregate(findings))
                .build();
    }
}
