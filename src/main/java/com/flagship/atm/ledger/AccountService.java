package com.flagship.atm.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Service for account lookup and provisioning.
 *
 * PINs are compared as stored, by exact match. The schema keeps them unique,
 * so a PIN resolves to at most one account.
 */
@Service
@Slf4j
public class AccountService {

    private final JdbcTemplate jdbcTemplate;

    public AccountService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Provisions an account. Account creation is not part of the public API;
     * this exists for seeding and tests.
     *
     * @param pin login credential, unique across accounts
     * @param initialBalance opening balance, also recorded for reconciliation
     * @return the new account id
     */
    public long createAccount(String pin, long initialBalance) {
        if (pin == null || pin.isBlank()) {
            throw new IllegalArgumentException("PIN cannot be null or blank");
        }
        Long accountId = jdbcTemplate.queryForObject(
            "INSERT INTO accounts (pin, balance, initial_balance) VALUES (?, ?, ?) RETURNING id",
            Long.class,
            pin,
            initialBalance,
            initialBalance
        );
        log.info("Provisioned account {}", accountId);
        return accountId;
    }

    /**
     * Resolves a PIN to its account.
     *
     * @param pin credential presented at login
     * @return the account id, empty when no account uses this PIN
     */
    public Optional<Long> resolveAccount(String pin) {
        if (pin == null || pin.isBlank()) {
            return Optional.empty();
        }

        List<Long> matches = jdbcTemplate.queryForList(
            "SELECT id FROM accounts WHERE pin = ?",
            Long.class,
            pin
        );

        if (matches.size() > 1) {
            throw new IllegalStateException("PIN maps to " + matches.size() + " accounts");
        }
        return matches.stream().findFirst();
    }

    public Optional<Account> findAccount(long accountId) {
        return jdbcTemplate.query(
            "SELECT id, balance, initial_balance, created_at FROM accounts WHERE id = ?",
            accountRowMapper(),
            accountId
        ).stream().findFirst();
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            rs.getLong("id"),
            rs.getLong("balance"),
            rs.getLong("initial_balance"),
            rs.getObject("created_at", OffsetDateTime.class).toInstant()
        );
    }
}
