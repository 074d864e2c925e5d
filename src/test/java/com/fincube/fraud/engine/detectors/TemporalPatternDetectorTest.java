package com.fincube.fraud.engine.detectors;

import com.fincube.fraud.config.FraudScoringConfig;
import com.fincube.fraud.model.AccountActivity;
import com.fincube.fraud.model.PatternFinding;
import com.fincube.fraud.model.PatternTag;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.fincube.fraud.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TemporalPatternDetectorTest {

    // 2024-03-12T02:00:00Z
    private static final long NIGHT_TS = BASE_TS - 12 * 3_600_000L;

    private TemporalPatternDetector detector;

    @BeforeEach
    void setUp() {
        detector = new TemporalPatternDetector(new FraudScoringConfig());
    }

    @Test
    void detect_singleTransfer_emptyFinding() {
        PatternFinding finding = detector.detect(activity(List.of(sent(1.0, address(1), BASE_TS)), List.of(), 1.0));

        assertThat(finding.getTags()).isEmpty();
        assertThat(finding.getRiskLevel()).isEqualTo(0.0);
    }

    @Test
    void detect_fiveSubMinuteGaps_burstActivity() {
        AccountActivity activity = activity(sentSeries(6, 0.3, BASE_TS, 30_000), List.of(), 1.0);

        PatternFinding finding = detector.detect(activity);

        assertThat(finding.getTags()).containsExactly(PatternTag.BURST_ACTIVITY);
        assertThat(finding.getRiskLevel()).isCloseTo(0.3, within(1e-9));
        assertThat(finding.getMetrics()).containsEntry("burst_count", 5.0);
    }

    @Test
    void detect_fourSubMinuteGaps_noBurst() {
        AccountActivity activity = activity(sentSeries(5, 0.3, BASE_TS, 30_000), List.of(), 1.0);

        assertThat(detector.detect(activity).getTags()).isEmpty();
    }

    @Test
    void detect_evenTenMinuteGaps_regularIntervals() {
        AccountActivity activity = activity(sentSeries(12, 0.3, BASE_TS, 600_000), List.of(), 1.0);

        PatternFinding finding = detector.detect(activity);

        assertThat(finding.getTags()).containsExactly(PatternTag.REGULAR_INTERVALS);
        assertThat(finding.getRiskLevel()).isCloseTo(0.2, within(1e-9));
    }

    @Test
    void detect_irregularGaps_noRegularIntervals() {
        List<Long> offsets = List.of(0L, 120_000L, 900_000L, 1_000_000L, 2_400_000L, 2_460_000L,
                3_000_000L, 4_800_000L, 4_900_000L, 6_000_000L, 7_900_000L);
        AccountActivity activity = activity(
                offsets.stream().map(o -> sent(0.3, address(o.intValue() % 97), BASE_TS + o)).toList(),
                List.of(), 1.0);

        assertThat(detector.detect(activity).getTags()).doesNotContain(PatternTag.REGULAR_INTERVALS);
    }

    @Test
    void detect_activityBetweenOneAndFiveUtc_nightActivity() {
        AccountActivity activity = activity(sentSeries(4, 0.3, NIGHT_TS, 1_800_000), List.of(), 1.0);

        PatternFinding finding = detector.detect(activity);

        assertThat(finding.getTags()).containsExactly(PatternTag.NIGHT_ACTIVITY);
        assertThat(finding.getMetrics().get("night_share")).isEqualTo(1.0);
    }

    @Test
    void detect_fiftyOneTransfersWithinOneHour_shortLifespan() {
        AccountActivity activity = activity(sentSeries(51, 0.3, BASE_TS, 60_000), List.of(), 1.0);

        PatternFinding finding = detector.detect(activity);

        assertThat(finding.getTags()).contains(PatternTag.SHORT_LIFESPAN_HIGH_VOLUME);
        assertThat(finding.getTags()).doesNotContain(PatternTag.BURST_ACTIVITY);
        assertThat(finding.getRiskLevel()).isCloseTo(0.6, within(1e-9));
    }

    @Test
    void detect_transfersWithoutTimestamps_ignored() {
        AccountActivity activity = activity(sentSeries(10, 0.3, 0, 0), List.of(), 1.0);

        assertThat(detector.detect(activity).getRiskLevel()).isEqualTo(0.0);
    }
}
