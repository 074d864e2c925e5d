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

import java.util.Arrays;
import java.util.List;

/**
 * Detects account-level behavioral flags: dust accounts, pass-through
 * forwarding, one-directional flow and zero-value spam.
 */
@Component
public class BehavioralPatternDetector implements PatternDetector {

    private final FraudScoringConfig config;

    public BehavioralPatternDetector(FraudScoringConfig config) {
        this.config = config;
    }

    @Override
    public PatternDimension getDimension() {
        return PatternDimension.BEHAVIORAL;
    }

    @Override
    public PatternFinding detect(AccountActivity activity) {
        FraudScoringConfig.Patterns p = config.getPatterns();
        List<TransferRecord> sent = activity.getSent();
        List<TransferRecord> received = activity.getReceived();
        int total = sent.size() + received.size();

        PatternFinding.PatternFindingBuilder finding = PatternFinding.builder()
                .dimension(PatternDimension.BEHAVIORAL);
        double risk = 0.0;

        if (total > p.getDustMinTxns() && activity.getBalance() < p.getDustMaxBalance()) {
            finding.tag(PatternTag.DUST_ACCOUNT);
            risk += p.getDustWeight();
        }

        int forwards = 0;
        if (received.size() > p.getForwardingMinPerSide() && sent.size() > p.getForwardingMinPerSide()) {
            forwards = countImmediateForwards(received, sent, (long) (p.getForwardingWindowSeconds() * 1000));
            if (forwards > p.getForwardingMinCount()) {
                finding.tag(PatternTag.IMMEDIATE_FORWARDING);
                risk += p.getForwardingWeight();
            }
        }

        double sentShare = Numbers.ratio(sent.size(), total);
        if (total > p.getAsymmetryMinTxns()
                && (sentShare > p.getAsymmetryHighShare() || sentShare < p.getAsymmetryLowShare())) {
            finding.tag(PatternTag.ASYMMETRIC_FLOW);
            risk += p.getAsymmetryWeight();
        }

        long zeroCount = activity.getAll().stream().filter(r -> r.getValue() == 0.0).count();
        double zeroShare = Numbers.ratio(zeroCount, total);
        if (total > p.getZeroValueMinTxns() && zeroShare > p.getZeroValueMinShare()) {
            finding.tag(PatternTag.ZERO_VALUE_SPAM);
            risk += p.getZeroValueWeight();
        }

        return finding
                .riskLevel(Numbers.clamp01(risk))
                .metric("balance", activity.getBalance())
                .metric("immediate_forwards", (double) forwards)
                .metric("sent_share", sentShare)
                .metric("zero_value_share", zeroShare)
                .build();
    }

    /**
     * Counts received transfers followed by some sent transfer within the window
     * (strictly after, strictly less than the window). Each received transfer counts once.
     */
    static int countImmediateForwards(List<TransferRecord> received, List<TransferRecord> sent, long windowMs) {
        long[] sentTimes = sent.stream()
                .filter(TransferRecord::hasTimestamp)
                .mapToLong(TransferRecord::getTimestamp)
                .sorted()
                .toArray();
        if (sentTimes.length == 0) return 0;

        int forwards = 0;
        for (TransferRecord record : received) {
            if (!record.hasTimestamp()) continue;
            long receivedAt = record.getTimestamp();
            // first sent timestamp strictly after receivedAt
            int idx = Arrays.binarySearch(sentTimes, receivedAt + 1);
            if (idx < 0) idx = -idx - 1;
            else while (idx > 0 && sentTimes[idx - 1] == receivedAt + 1) idx--;
            if (idx < sentTimes.length && sentTimes[idx] - receivedAt < windowMs) {
                forwards++;
            }
        }
        return forwards;
    }
}
