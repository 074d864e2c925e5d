package com.fincube.fraud.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Scoring outcome returned to API callers")
public class ScoreResponse {

    @Schema(description = "Reference the outcome was recorded under", example = "REF-2024-000117")
    private String referenceId;

    @Schema(description = "Scored address", example = "0x8ba1f109551bd432803012645ac136ddd64dba72")
    private String address;

    @Schema(description = "Final fused decision")
    private ScoreDecision decision;

    @Schema(description = "Neighbor voting summary")
    private NeighborAnalysis neighborAnalysis;

    @Schema(description = "Five nearest reference accounts")
    private List<NeighborMatch> nearestNeighbors;

    @Schema(description = "Raw extracted features by canonical name")
    private Map<String, Double> features;

    @Schema(description = "Scaler version used to normalize the query vector", example = "3")
    private long scalerVersion;

    @Schema(description = "Scoring timestamp in epoch milliseconds", example = "1739886764000")
    private long scoredAt;
}
