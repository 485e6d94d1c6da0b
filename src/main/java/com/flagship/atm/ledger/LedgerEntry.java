package com.flagship.atm.ledger;

import lombok.Value;

import java.time.Instant;

/**
 * Domain model for a Ledger Entry.
 * Represents one committed deposit or withdrawal on an account.
 *
 * Key invariant: amount is the signed delta that was applied to the balance,
 * and balanceAfter is the balance the same database transaction stored.
 */
@Value
public class LedgerEntry {
    long id;
    long accountId;
    TransactionType type;
    long amount;
    long balanceAfter;
    Instant createdAt;
}
