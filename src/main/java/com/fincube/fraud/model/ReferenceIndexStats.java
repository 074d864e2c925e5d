package com.fincube.fraud.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "State of the reference population and scaler")
public class ReferenceIndexStats {

    @Schema(description = "Whether any reference vectors are loaded", example = "true")
    private boolean exists;

    @Schema(description = "Number of reference vectors", example = "9841")
    private int documentCount;

    @Schema(description = "Number of fraud-labeled vectors", example = "2179")
    private int fraudCount;

    @Schema(description = "Vector dimension", example = "44")
    private int dimension;

    @Schema(description = "Version of the scaler the vectors were normalized with", example = "3")
    private long scalerVersion;

    @Schema(description = "Scaler fit timestamp in epoch milliseconds")
    private long fittedAt;
}
