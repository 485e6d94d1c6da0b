package com.flagship.atm.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.atm.ledger.Reconciliation;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ReconciliationResponse {

    @JsonProperty("account_id")
    long accountId;

    @JsonProperty("balance")
    long balance;

    @JsonProperty("initial_balance")
    long initialBalance;

    @JsonProperty("entries_total")
    long entriesTotal;

    @JsonProperty("entry_count")
    long entryCount;

    @JsonProperty("consistent")
    boolean consistent;

    public static ReconciliationResponse from(Reconciliation reconciliation) {
        return ReconciliationResponse.builder()
            .accountId(reconciliation.getAccountId())
            .balance(reconciliation.getBalance())
            .initialBalance(reconciliation.getInitialBalance())
            .entriesTotal(reconciliation.getEntriesTotal())
            .entryCount(reconciliation.getEntryCount())
            .consistent(reconciliation.isConsistent())
            .build();
    }
}
