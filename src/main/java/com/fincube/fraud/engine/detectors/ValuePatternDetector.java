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

import java.util.ArrayList;
import java.util.List;

/**
 * Detects value-shape anomalies: round amounts, mirrored send/receive amounts
 * (wash trading), balanced high-volume in/out flows (mixing) and uniform
 * outgoing amounts (draining or farming).
 */
@Component
public class ValuePatternDetector implements PatternDetector {

    private final FraudScoringConfig config;

    public ValuePatternDetector(FraudScoringConfig config) {
        this.config = config;
    }

    @Override
    public PatternDimension getDimension() {
        return PatternDimension.VALUE;
    }

    @Override
    public PatternFinding detect(AccountActivity activity) {
        FraudScoringConfig.Patterns p = config.getPatterns();
        List<Double> sentValues = values(activity.getSent());
        List<Double> receivedValues = values(activity.getReceived());

        PatternFinding.PatternFindingBuilder finding = PatternFinding.builder()
                .dimension(PatternDimension.VALUE);
        double risk = 0.0;

        // Round values across both directions
        int allCount = sentValues.size() + receivedValues.size();
        long roundCount = sentValues.stream().filter(this::isRound).count()
                + receivedValues.stream().filter(this::isRound).count();
        double roundRatio = allCount > 0 ? (double) roundCount / allCount : 0.0;
        if (roundRatio > p.getRoundMinShare()) {
            finding.tag(PatternTag.ROUND_VALUES);
            risk += p.getRoundWeight();
        }

        if (hasMatchingPair(tail(sentValues, p.getMatchingWindow()), tail(receivedValues, p.getMatchingWindow()))) {
            finding.tag(PatternTag.MATCHING_SEND_RECEIVE_VALUES);
            risk += p.getMatchingWeight();
        }

        double totalSent = Numbers.sum(sentValues);
        double totalReceived = Numbers.sum(receivedValues);
        double balanceRatio = Numbers.ratio(Math.min(totalSent, totalReceived), Math.max(totalSent, totalReceived));
        if (totalSent > p.getMixerMinTotal() && totalReceived > p.getMixerMinTotal()
                && balanceRatio > p.getMixerMinBalanceRatio()
                && sentValues.size() > p.getMixerMinSentCount()) {
            finding.tag(PatternTag.MIXER_VALUE_PATTERN);
            risk += p.getMixerWeight();
        }

        double sentMean = Numbers.mean(sentValues);
        double sentStd = sentValues.size() > 1 ? Numbers.populationStd(sentValues) : 0.0;
        if (sentValues.size() > p.getDrainingMinSamples() && sentMean > 0
                && sentStd < sentMean * p.getDrainingMaxCv()) {
            finding.tag(PatternTag.CONSISTENT_SMALL_VALUES);
            risk += p.getDrainingWeight();
        }

        return finding
                .riskLevel(Numbers.clamp01(risk))
                .metric("round_value_ratio", roundRatio)
                .metric("value_balance_ratio", balanceRatio)
                .metric("total_sent", totalSent)
                .metric("total_received", totalReceived)
                .build();
    }

    private boolean isRound(double value) {
        double tolerance = config.getPatterns().getRoundTolerance();
        for (double round : config.getPatterns().getRoundValues()) {
            if (Math.abs(value - round) < tolerance) return true;
        }
        return false;
    }

    private boolean hasMatchingPair(List<Double> sent, List<Double> received) {
        double tolerance = config.getPatterns().getMatchingTolerance();
        for (double sv : sent) {
            if (sv <= 0) continue;
            for (double rv : received) {
                if (Math.abs(sv - rv) < tolerance) return true;
            }
        }
        return false;
    }

    private static List<Double> values(List<TransferRecord> records) {
        List<Double> values = new ArrayList<>(records.size());
        for (TransferRecord record : records) {
            values.add(record.getValue());
        }
        return values;
    }

    // Most recent entries in ledger order.
    private static List<Double> tail(List<Double> values, int window) {
        return values.size() <= window ? values : values.subList(values.size() - window, values.size());
    }
}
