package com.fincube.fraud.engine.detectors;

import com.fincube.fraud.config.FraudScoringConfig;
import com.fincube.fraud.engine.Numbers;
import com.fincube.fraud.engine.PatternDetector;
import com.fincube.fraud.model.AccountActivity;
import com.fincube.fraud.model.PatternDimension;
import com.fincube.fraud.model.PatternFinding;
import com.fincube.fraud.model.PatternTag;
import com.fincube.fraud.model.TransferRecord;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Detects timing anomalies over all sent and received transfers.
 *
 * Logic: sorts every timestamp and looks at consecutive gaps.
 *   - many gaps under a minute: burst activity
 *   - low-variance gaps under an hour: scheduled bot
 *   - most activity in the 01:00-05:00 UTC band
 *   - a very busy account that lived less than a day
 */
@Component
public class TemporalPatternDetector implements PatternDetector {

    private final FraudScoringConfig config;

    public TemporalPatternDetector(FraudScoringConfig config) {
        this.config = config;
    }

    @Override
    public PatternDimension getDimension() {
        return PatternDimension.TEMPORAL;
    }

    @Override
    public PatternFinding detect(AccountActivity activity) {
        List<Long> timestamps = activity.getAll().stream()
                .filter(TransferRecord::hasTimestamp)
                .map(TransferRecord::getTimestamp)
                .sorted()
                .toList();

        if (timestamps.size() < 2) {
            return PatternFinding.empty(PatternDimension.TEMPORAL);
        }

        FraudScoringConfig.Patterns p = config.getPatterns();
        List<Double> gaps = new ArrayList<>(timestamps.size() - 1);
        for (int i = 1; i < timestamps.size(); i++) {
            gaps.add((timestamps.get(i) - timestamps.get(i - 1)) / 1000.0);
        }

        PatternFinding.PatternFindingBuilder finding = PatternFinding.builder()
                .dimension(PatternDimension.TEMPORAL);
        double risk = 0.0;

        long burstCount = gaps.stream().filter(gap -> gap < p.getBurstGapSeconds()).count();
        if (burstCount >= p.getBurstMinCount()) {
            finding.tag(PatternTag.BURST_ACTIVITY);
            risk += p.getBurstWeight();
        }

        double meanGap = Numbers.mean(gaps);
        if (gaps.size() >= p.getRegularMinGaps()) {
            double stdGap = Numbers.populationStd(gaps);
            if (stdGap < meanGap * p.getRegularMaxCv() && meanGap < p.getRegularMaxMeanSeconds()) {
                finding.tag(PatternTag.REGULAR_INTERVALS);
                risk += p.getRegularWeight();
            }
        }

        long nightCount = timestamps.stream()
                .map(ts -> Instant.ofEpochMilli(ts).atZone(ZoneOffset.UTC).getHour())
                .filter(hour -> hour >= p.getNightStartHourUtc() && hour <= p.getNightEndHourUtc())
                .count();
        double nightShare = (double) nightCount / timestamps.size();
        if (nightShare > p.getNightMinShare()) {
            finding.tag(PatternTag.NIGHT_ACTIVITY);
            risk += p.getNightWeight();
        }

        double lifespanHours = (timestamps.get(timestamps.size() - 1) - timestamps.get(0)) / 3_600_000.0;
        if (lifespanHours < p.getShortLifespanHours() && timestamps.size() > p.getShortLifespanMinCount()) {
            finding.tag(PatternTag.SHORT_LIFESPAN_HIGH_VOLUME);
            risk += p.getShortLifespanWeight();
        }

        return finding
                .riskLevel(Numbers.clamp01(risk))
                .metric("burst_count", (double) burstCount)
                .metric("avg_seconds_between_tx", meanGap)
                .metric("night_share", nightShare)
                .metric("lifespan_hours", lifespanHours)
                .build();
    }
}
