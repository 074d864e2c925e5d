package com.fincube.fraud.engine.reasoning;

import com.fincube.fraud.config.FraudScoringConfig;
import com.fincube.fraud.model.Archetype;
import com.fincube.fraud.model.FraudLabel;
import com.fincube.fraud.model.PatternTag;
import com.fincube.fraud.model.TentativeDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.fincube.fraud.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FallbackVoterTest {

    private FallbackVoter voter;

    @BeforeEach
    void setUp() {
        voter = new FallbackVoter(new FraudScoringConfig());
    }

    @Test
    void vote_strongFraudSignals_fraudWithCappedConfidence() {
        TentativeDecision decision = voter.vote(neighborAnalysis(0.8, 0.7),
                patternReport(0.7, PatternTag.CIRCULAR_FLOW), validation(true, Archetype.MIXER),
                List.of("note"), "oracle disabled");

        assertThat(decision.getLabel()).isEqualTo(FraudLabel.FRAUD);
        assertThat(decision.getConfidence()).isEqualTo(0.7);
        assertThat(decision.isFallback()).isTrue();
        assertThat(decision.getReasoning()).contains("oracle disabled")
                .endsWith("[Fallback decision based on 6 fraud signals vs 0 legitimate signals]");
        assertThat(decision.getRiskFactors()).containsExactly(PatternTag.CIRCULAR_FLOW.getDescription());
        assertThat(decision.getEdgeCases()).containsExactly("note");
    }

    @Test
    void vote_lowProbabilityWithAlignment_notFraud() {
        TentativeDecision decision = voter.vote(neighborAnalysis(0.2, 0.7), patternReport(0.5),
                validation(true), null, "transport failure");

        assertThat(decision.getLabel()).isEqualTo(FraudLabel.NOT_FRAUD);
        assertThat(decision.getConfidence()).isCloseTo(0.6, within(1e-9));
        assertThat(decision.getEdgeCases()).isEmpty();
    }

    @Test
    void vote_conflictingSignals_undecided() {
        TentativeDecision decision = voter.vote(neighborAnalysis(0.5, 0.7), patternReport(0.5),
                validation(false), List.of(), "unparseable response");

        assertThat(decision.getLabel()).isEqualTo(FraudLabel.UNDECIDED);
        assertThat(decision.getConfidence()).isEqualTo(0.4);
        assertThat(decision.getReasoning()).contains("0 fraud signals vs 0 legitimate signals");
    }

    @Test
    void vote_twoVotesOnEachSide_undecided() {
        // neighbors favor fraud, behavior looks clean
        TentativeDecision decision = voter.vote(neighborAnalysis(0.7, 0.7), patternReport(0.1),
                validation(false), List.of(), "oracle disabled");

        assertThat(decision.getLabel()).isEqualTo(FraudLabel.UNDECIDED);
    }

    @Test
    void vote_washTradingArchetypeTipsBalance() {
        TentativeDecision decision = voter.vote(neighborAnalysis(0.7, 0.7), patternReport(0.5),
                validation(false, Archetype.WASH_TRADING), List.of(), "oracle disabled");

        assertThat(decision.getLabel()).isEqualTo(FraudLabel.FRAUD);
        assertThat(decision.getConfidence()).isCloseTo(0.6, within(1e-9));
    }
}
