package com.flagship.atm.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.atm.ledger.LedgerEntry;
import com.flagship.atm.ledger.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Response DTO for a committed deposit or withdrawal.
 */
@Value
@Builder
public class TransactionResponse {

    @JsonProperty("status")
    String status;

    @JsonProperty("entry_id")
    long entryId;

    @JsonProperty("type")
    TransactionType type;

    /**
     * Magnitude as requested; the signed delta is in the transaction history.
     */
    @JsonProperty("amount")
    long amount;

    @JsonProperty("balance")
    long balance;

    @JsonProperty("created_at")
    Instant createdAt;

    public static TransactionResponse from(LedgerEntry entry) {
        return TransactionResponse.builder()
            .status("ok")
            .entryId(entry.getId())
            .type(entry.getType())
            .amount(Math.abs(entry.getAmount()))
            .balance(entry.getBalanceAfter())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
