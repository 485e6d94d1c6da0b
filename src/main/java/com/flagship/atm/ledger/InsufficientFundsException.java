package com.flagship.atm.ledger;

import lombok.Getter;

/**
 * A withdrawal would take the balance below zero while overdrafts are disabled.
 * Nothing was written.
 */
@Getter
public class InsufficientFundsException extends RuntimeException {

    private final long accountId;
    private final long balance;
    private final long requested;

    public InsufficientFundsException(long accountId, long balance, long requested) {
        super(String.format("Insufficient funds: balance=%d, requested=%d", balance, requested));
        this.accountId = accountId;
        this.balance = balance;
        this.requested = requested;
    }
}
