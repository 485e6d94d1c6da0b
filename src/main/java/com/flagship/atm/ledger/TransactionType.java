package com.flagship.atm.ledger;

/**
 * Kind of balance movement. The caller always supplies a non-negative magnitude;
 * the type decides the sign applied to the balance.
 */
public enum TransactionType {
    DEPOSIT,
    WITHDRAWAL;

    /**
     * Signed delta for a magnitude: +amount for a deposit, -amount for a withdrawal.
     *
     * @throws IllegalArgumentException if amount is negative
     */
    public long signedAmount(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Amount must not be negative: " + amount);
        }
        return this == DEPOSIT ? amount : -amount;
    }
}
