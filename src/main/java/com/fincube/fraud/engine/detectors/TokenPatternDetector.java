package com.fincube.fraud.engine.detectors;

import com.fincube.fraud.config.FraudScoringConfig;
import com.fincube.fraud.engine.Numbers;
import com.fincube.fraud.engine.PatternDetector;
import com.fincube.fraud.model.AccountActivity;
import com.fincube.fraud.model.PatternDimension;
import com.fincube.fraud.model.PatternFinding;
import com.fincube.fraud.model.PatternTag;
import com.fincube.fraud.model.TransferCategory;
import com.fincube.fraud.model.TransferRecord;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Detects token-level anomalies over fungible, NFT and multi-token transfers:
 * airdrop-farmer token spread, per-contract back-and-forth flows and heavy NFT use.
 */
@Component
public class TokenPatternDetector implements PatternDetector {

    private final FraudScoringConfig config;

    public TokenPatternDetector(FraudScoringConfig config) {
        this.config = config;
    }

    @Override
    public PatternDimension getDimension() {
        return PatternDimension.TOKEN;
    }

    @Override
    public PatternFinding detect(AccountActivity activity) {
        List<TransferRecord> sentTokens = activity.getSent().stream().filter(r -> r.getCategory().isToken()).toList();
        List<TransferRecord> receivedTokens = activity.getReceived().stream().filter(r -> r.getCategory().isToken()).toList();

        if (sentTokens.isEmpty() && receivedTokens.isEmpty()) {
            return PatternFinding.empty(PatternDimension.TOKEN);
        }

        FraudScoringConfig.Patterns p = config.getPatterns();
        PatternFinding.PatternFindingBuilder finding = PatternFinding.builder()
                .dimension(PatternDimension.TOKEN);
        double risk = 0.0;

        // contract -> {sent, received}
        Map<String, int[]> flows = new HashMap<>();
        Set<String> uniqueContracts = new HashSet<>();
        countFlows(sentTokens, flows, uniqueContracts, 0);
        countFlows(receivedTokens, flows, uniqueContracts, 1);

        if (uniqueContracts.size() > p.getTokenDiversityMinContracts()) {
            finding.tag(PatternTag.EXCESSIVE_TOKEN_DIVERSITY);
            risk += p.getTokenDiversityWeight();
        }

        long washCandidates = flows.values().stream()
                .filter(f -> f[0] > p.getWashMinFlowPerSide() && f[1] > p.getWashMinFlowPerSide()
                        && Math.abs(f[0] - f[1]) <= p.getWashMaxImbalance())
                .count();
        if (washCandidates >= p.getWashMinContracts()) {
            finding.tag(PatternTag.TOKEN_WASH_TRADING);
            risk += p.getWashWeight();
        }

        long nftCount = sentTokens.stream().filter(r -> r.getCategory() == TransferCategory.NFT).count()
                + receivedTokens.stream().filter(r -> r.getCategory() == TransferCategory.NFT).count();
        if (nftCount > p.getNftMinCount()) {
            finding.tag(PatternTag.HIGH_NFT_ACTIVITY);
            risk += p.getNftWeight();
        }

        return finding
                .riskLevel(Numbers.clamp01(risk))
                .metric("unique_tokens", (double) uniqueContracts.size())
                .metric("wash_trading_candidates", (double) washCandidates)
                .metric("nft_transaction_count", (double) nftCount)
                .build();
    }

    private static void countFlows(List<TransferRecord> records, Map<String, int[]> flows,
                                   Set<String> uniqueContracts, int side) {
        for (TransferRecord record : records) {
            String contract = record.getNormalizedTokenContract();
            if (contract == null) continue;
            uniqueContracts.add(contract);
            flows.computeIfAbsent(contract, k -> new int[2])[side]++;
        }
    }
}
