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
@Schema(description = "Remote labeled dataset to load as the reference population")
public class ReferenceImportRequest {

    @Schema(description = "HTTP(S) location of the dataset",
            example = "https://datasets.example.org/ethereum/transaction_dataset.csv")
    private String sourceUrl;

    @Schema(description = "Dataset format", example = "CSV_URL")
    private ReferenceSourceType sourceType;
}
