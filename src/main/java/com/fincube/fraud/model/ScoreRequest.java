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
@Schema(description = "Request to score an account for fraud")
public class ScoreRequest {

    @Schema(description = "Opaque reference under which the outcome is recorded; defaults to the address",
            example = "REF-2024-000117")
    private String referenceId;

    @Schema(description = "Account address to score", example = "0x8ba1f109551bd432803012645ac136ddd64dba72")
    private String address;

    @Schema(description = "Caller-supplied activity; when absent the ledger is queried")
    private AccountActivity activity;

    public String getEffectiveReferenceId() {
        return referenceId != null && !referenceId.isBlank() ? referenceId : address;
    }
}
