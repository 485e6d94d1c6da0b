package com.flagship.atm.ledger;

import lombok.Getter;

/**
 * Storage failure while applying a transaction. The database transaction was rolled
 * back: neither the balance nor the log reflect the attempted movement.
 */
@Getter
public class TransactionFailedException extends RuntimeException {

    private final long accountId;
    private final TransactionType type;

    public TransactionFailedException(long accountId, TransactionType type, Throwable cause) {
        super(String.format("Failed to apply %s on account %d", type, accountId), cause);
        this.accountId = accountId;
        this.type = type;
    }
}
