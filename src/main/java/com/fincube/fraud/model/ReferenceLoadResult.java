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
@Schema(description = "Outcome of a reference population load")
public class ReferenceLoadResult {

    @Schema(description = "Number of reference vectors indexed", example = "9841")
    private int loadedCount;

    @Schema(description = "Number of fraud-labeled vectors", example = "2179")
    private int fraudCount;

    @Schema(description = "Records skipped for a missing address or an invalid flag", example = "0")
    private int skippedCount;

    @Schema(description = "Version of the scaler fitted over this batch", example = "4")
    private long scalerVersion;
}
