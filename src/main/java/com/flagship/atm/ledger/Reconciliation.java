package com.flagship.atm.ledger;

import lombok.Value;

/**
 * Snapshot comparing an account's stored balance with its derivation from the log.
 */
@Value
public class Reconciliation {
    long accountId;
    long balance;
    long initialBalance;
    long entriesTotal;
    long entryCount;

    public long expectedBalance() {
        return initialBalance + entriesTotal;
    }

    public boolean isConsistent() {
        return balance == expectedBalance();
    }
}
