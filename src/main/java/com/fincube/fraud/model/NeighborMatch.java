package com.fincube.fraud.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "A labeled reference account close to the scored account in feature space")
public class NeighborMatch {

    @Schema(description = "Reference account address", example = "0x00009277775ac7d0d59eaad8fee3d10ac6c805e8")
    String address;

    @Schema(description = "Reference label: 1 = fraud, 0 = legitimate", example = "1")
    int label;

    @Schema(description = "Distance to the scored vector (non-negative)", example = "0.42")
    double distance;

    public boolean isFraud() {
        return label == 1;
    }

    public double getDistance() {
        return Double.isFinite(distance) && distance > 0 ? distance : 0.0;
    }
}
