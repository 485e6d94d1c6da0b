package com.flagship.atm.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.atm.ledger.LedgerEntry;
import com.flagship.atm.ledger.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Response DTO for one entry of the transaction history. amount is signed.
 */
@Value
@Builder
public class LedgerEntryResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("balance_after")
    long balanceAfter;

    @JsonProperty("created_at")
    Instant createdAt;

    public static LedgerEntryResponse from(LedgerEntry entry) {
        return LedgerEntryResponse.builder()
            .id(entry.getId())
            .type(entry.getType())
            .amount(entry.getAmount())
            .balanceAfter(entry.getBalanceAfter())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
