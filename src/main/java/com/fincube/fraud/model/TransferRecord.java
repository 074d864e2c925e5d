package com.fincube.fraud.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@AllArgsConstructor
@Schema(description = "A single asset transfer touching the scored account")
public class TransferRecord {

    @Schema(description = "Whether the account sent or received this transfer", example = "SENT")
    TransferDirection direction;

    @Schema(description = "Asset category", example = "EXTERNAL")
    TransferCategory category;

    @Schema(description = "Transferred value in native units (ether for EXTERNAL)", example = "0.5")
    double value;

    @Schema(description = "The other side of the transfer: recipient for SENT, sender for RECEIVED",
            example = "0x8ba1f109551bd432803012645ac136ddd64dba72")
    String counterparty;

    @Schema(description = "Block timestamp in epoch milliseconds", example = "1739886764000")
    long timestamp;

    @Schema(description = "Token contract address for token transfers, null otherwise",
            example = "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48")
    String tokenContract;

    public TransferCategory getCategory() {
        return category != null ? category : TransferCategory.EXTERNAL;
    }

    /**
     * Negative and non-finite values are treated as zero.
     */
    public double getValue() {
        return Double.isFinite(value) && value > 0 ? value : 0.0;
    }

    /**
     * Lower-cased counterparty, or null when absent.
     */
    public String getNormalizedCounterparty() {
        return counterparty == null || counterparty.isBlank() ? null : counterparty.trim().toLowerCase();
    }

    public String getNormalizedTokenContract() {
        return tokenContract == null || tokenContract.isBlank() ? null : tokenContract.trim().toLowerCase();
    }

    public boolean hasTimestamp() {
        return timestamp > 0;
    }
}
