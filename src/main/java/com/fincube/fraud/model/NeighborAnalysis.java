package com.fincube.fraud.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Aggregated neighbor evidence. An empty neighbor list produces the
 * "no evidence" sentinel: probability 0.5, confidence 0, all counts 0.
 */
@Value
@Builder
@Jacksonized
@Schema(description = "Distance-weighted neighbor voting result")
public class NeighborAnalysis {

    @Schema(description = "Inverse-distance weighted fraud probability (0-1)", example = "0.93")
    double fraudProbability;

    @Schema(description = "Unweighted fraud share among neighbors (0-1)", example = "0.8")
    double simpleFraudProbability;

    @Schema(description = "Number of fraud-labeled neighbors", example = "8")
    int fraudCount;

    @Schema(description = "Number of legitimate neighbors", example = "2")
    int nonFraudCount;

    @Schema(description = "Total neighbors considered", example = "10")
    int totalCount;

    @Schema(description = "Mean distance to neighbors", example = "1.008")
    double avgDistance;

    @Schema(description = "Confidence from proximity and agreement (0-1)", example = "0.65")
    double confidence;

    public boolean hasEvidence() {
        return totalCount > 0;
    }
}
