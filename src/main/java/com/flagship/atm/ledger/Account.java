package com.flagship.atm.ledger;

import lombok.Value;

import java.time.Instant;

/**
 * Domain model for an Account.
 * Plain Java class mapped by hand from JDBC rows. The PIN never leaves the database layer.
 */
@Value
public class Account {
    long id;
    long balance;
    long initialBalance;
    Instant createdAt;
}
