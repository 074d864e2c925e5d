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
@Schema(description = "Accumulated fraud score for a reference")
public class ScoreLedgerEntry {

    @Schema(description = "Reference identifier", example = "REF-2024-000117")
    private String referenceId;

    @Schema(description = "Accumulated score (0-1); rises with fraud outcomes, decays with legitimate ones", example = "0.17")
    private double score;

    @Schema(description = "Last non-undecided outcome", example = "fraud", allowableValues = {"fraud", "not_fraud"})
    private String lastResult;

    @Schema(description = "Confidence of the last outcome", example = "0.7")
    private double lastConfidence;

    @Schema(description = "Creation timestamp in epoch milliseconds")
    private long createdAt;

    @Schema(description = "Last update timestamp in epoch milliseconds")
    private long updatedAt;
}
