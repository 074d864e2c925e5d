package com.fincube.fraud.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

@Value
@Builder
@Jacksonized
@Schema(description = "Cross-signal validation of neighbor evidence against behavioral risk")
public class ValidationReport {

    @Schema(description = "Neighbor probability and behavioral risk agree on the same side", example = "true")
    boolean neighborPatternAlignment;

    @Schema(description = "Neighbor confidence meets the configured floor", example = "true")
    boolean confidenceThresholdMet;

    @Schema(description = "At least two independent detector dimensions are high-risk", example = "false")
    boolean multipleRiskSignals;

    @Schema(description = "Number of non-token dimensions with high risk", example = "1")
    int highRiskDimensionCount;

    @Schema(description = "1 - |fraudProbability - behavioralRisk|", example = "0.81")
    double agreementScore;

    @Schema(description = "Fraud archetypes recognised from pattern tags")
    Set<Archetype> archetypes;

    @Schema(description = "Weighted validation score (0-1)", example = "0.66")
    double overallValidationScore;

    @Schema(description = "Decision quality tier derived from the validation score", example = "MEDIUM")
    QualityTier qualityTier;

    public Set<Archetype> getArchetypes() {
        return archetypes == null || archetypes.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(archetypes));
    }

    public boolean hasArchetype(Archetype archetype) {
        return archetypes != null && archetypes.contains(archetype);
    }

    public boolean isMixerProfileDetected() {
        return hasArchetype(Archetype.MIXER);
    }

    public boolean isWashTradingDetected() {
        return hasArchetype(Archetype.WASH_TRADING);
    }

    public boolean isBotBehaviorDetected() {
        return hasArchetype(Archetype.BOT);
    }
}
