package com.fincube.fraud.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Raw ledger activity of one account. Null lists and null entries are dropped,
 * so an empty activity is valid input.
 */
@Value
@Builder
@Jacksonized
@Schema(description = "Sent and received transfers plus current balance of an account")
public class AccountActivity {

    @Schema(description = "Transfers sent by the account")
    List<TransferRecord> sent;

    @Schema(description = "Transfers received by the account")
    List<TransferRecord> received;

    @Schema(description = "Current native balance", example = "1.25")
    double balance;

    public static AccountActivity empty() {
        return AccountActivity.builder().build();
    }

    public List<TransferRecord> getSent() {
        return clean(sent);
    }

    public List<TransferRecord> getReceived() {
        return clean(received);
    }

    public double getBalance() {
        return Double.isFinite(balance) ? balance : 0.0;
    }

    public List<TransferRecord> getAll() {
        List<TransferRecord> all = new ArrayList<>(getSent());
        all.addAll(getReceived());
        return all;
    }

    public int getTotalCount() {
        return getSent().size() + getReceived().size();
    }

    private static List<TransferRecord> clean(List<TransferRecord> records) {
        if (records == null || records.isEmpty()) return Collections.emptyList();
        return records.stream().filter(Objects::nonNull).toList();
    }
}
