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

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Detects counterparty-graph anomalies. Addresses are compared lower-cased.
 *
 * Circular flow compares the overlap of sent-to and received-from sets against
 * the smaller of the two sets.
 */
@Component
public class NetworkPatternDetector implements PatternDetector {

    private final FraudScoringConfig config;

    public NetworkPatternDetector(FraudScoringConfig config) {
        this.config = config;
    }

    @Override
    public PatternDimension getDimension() {
        return PatternDimension.NETWORK;
    }

    @Override
    public PatternFinding detect(AccountActivity activity) {
        FraudScoringConfig.Patterns p = config.getPatterns();
        List<String> sentTo = counterparties(activity.getSent());
        List<String> receivedFrom = counterparties(activity.getReceived());
        Set<String> sentSet = new HashSet<>(sentTo);
        Set<String> receivedSet = new HashSet<>(receivedFrom);
        int totalTx = activity.getTotalCount();

        PatternFinding.PatternFindingBuilder finding = PatternFinding.builder()
                .dimension(PatternDimension.NETWORK);
        double risk = 0.0;

        double diversityRatio = Numbers.ratio(sentSet.size() + receivedSet.size(), totalTx);
        if (diversityRatio > p.getDiversityMinRatio() && totalTx > p.getDiversityMinTxns()) {
            finding.tag(PatternTag.HIGH_ADDRESS_DIVERSITY);
            risk += p.getDiversityWeight();
        }

        double oneTimeRatio = 0.0;
        if (!sentTo.isEmpty()) {
            Map<String, Long> counts = sentTo.stream()
                    .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
            long oneTime = counts.values().stream().filter(c -> c == 1L).count();
            oneTimeRatio = (double) oneTime / counts.size();
            if (oneTimeRatio > p.getOneTimeMinRatio() && sentTo.size() > p.getOneTimeMinInteractions()) {
                finding.tag(PatternTag.ONE_TIME_INTERACTIONS);
                risk += p.getOneTimeWeight();
            }
        }

        Set<String> overlap = new HashSet<>(sentSet);
        overlap.retainAll(receivedSet);
        double circularRatio = Numbers.ratio(overlap.size(), Math.min(sentSet.size(), receivedSet.size()));
        if (overlap.size() >= p.getCircularMinOverlap() && totalTx > p.getCircularMinTxns()
                && circularRatio > p.getCircularMinRatio()) {
            finding.tag(PatternTag.CIRCULAR_FLOW);
            risk += p.getCircularWeight();
        }

        long denylisted = sentTo.stream().filter(this::matchesDenylist).count();
        if (denylisted > p.getDenylistMinMatches()) {
            finding.tag(PatternTag.DENYLISTED_COUNTERPARTIES);
            risk += p.getDenylistWeight();
        }

        return finding
                .riskLevel(Numbers.clamp01(risk))
                .metric("unique_counterparties", (double) (sentSet.size() + receivedSet.size()))
                .metric("address_diversity_ratio", diversityRatio)
                .metric("one_time_ratio", oneTimeRatio)
                .metric("circular_addresses", (double) overlap.size())
                .metric("denylisted_interactions", (double) denylisted)
                .build();
    }

    private boolean matchesDenylist(String address) {
        for (String pattern : config.getPatterns().getDenylistPatterns()) {
            if (pattern != null && !pattern.isEmpty() && address.contains(pattern.toLowerCase())) {
                return true;
            }
        }
        return false;
    }

    private static List<String> counterparties(List<TransferRecord> records) {
        return records.stream()
                .map(TransferRecord::getNormalizedCounterparty)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }
}
