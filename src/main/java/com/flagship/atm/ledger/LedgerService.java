package com.flagship.atm.ledger;

import com.flagship.atm.observability.AtmMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.JdbcUpdateAffectedIncorrectNumberOfRowsException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Service for posting deposits and withdrawals to the ledger.
 *
 * This service enforces the core invariants:
 * 1. balance = initial balance + sum of all committed entries
 * 2. Ledger entries are immutable once written (also enforced by a trigger)
 * 3. The balance update and the log append commit or roll back together
 * 4. Transactions on the same account are serialized by a row lock
 *
 * Uses JDBC directly so the locking and the transaction boundary stay explicit.
 */
@Service
@Slf4j
public class LedgerService {

    private static final String LOCK_BALANCE_SQL =
        "SELECT balance FROM accounts WHERE id = ? FOR UPDATE";

    private static final String UPDATE_BALANCE_SQL =
        "UPDATE accounts SET balance = ? WHERE id = ?";

    private static final String INSERT_ENTRY_SQL =
        "INSERT INTO ledger_entries (account_id, entry_type, amount, balance_after) VALUES (?, ?, ?, ?) " +
        "RETURNING id, account_id, entry_type, amount, balance_after, created_at";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final LedgerProperties properties;
    private final AtmMetrics metrics;

    public LedgerService(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                         LedgerProperties properties, AtmMetrics metrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Gets the committed balance of an account.
     *
     * @throws AccountNotFoundException if the account does not exist
     */
    public long getBalance(long accountId) {
        List<Long> balances = jdbcTemplate.queryForList(
            "SELECT balance FROM accounts WHERE id = ?",
            Long.class,
            accountId
        );
        if (balances.isEmpty()) {
            throw new AccountNotFoundException(accountId);
        }
        return balances.get(0);
    }

    /**
     * Applies a deposit or withdrawal.
     *
     * Within one database transaction this method:
     * 1. Locks the account row and reads the current balance
     * 2. Computes the new balance and applies the overdraft policy
     * 3. Stores the new balance
     * 4. Appends the entry to the log
     *
     * If any step fails, including the commit itself, nothing is kept.
     *
     * @param accountId account to move funds on
     * @param type deposit or withdrawal
     * @param amount non-negative magnitude
     * @return the committed entry
     * @throws IllegalArgumentException if the amount is negative, before touching storage
     * @throws AccountNotFoundException if the account does not exist
     * @throws InsufficientFundsException if overdrafts are disabled and the withdrawal exceeds the balance
     * @throws TransactionFailedException if storage failed and the transaction was rolled back
     */
    public LedgerEntry applyTransaction(long accountId, TransactionType type, long amount) {
        if (type == null) {
            throw new IllegalArgumentException("Transaction type is required");
        }
        long delta = type.signedAmount(amount);

        long startTime = System.currentTimeMillis();
        try {
            LedgerEntry entry = transactionTemplate.execute(status -> post(accountId, type, delta));

            metrics.recordTransaction(type.name(), "committed");
            log.info("Ledger transaction committed: accountId={}, type={}, amount={}, balance={}, entryId={}",
                    accountId, type, amount, entry.getBalanceAfter(), entry.getId());
            return entry;

        } catch (AccountNotFoundException | InsufficientFundsException e) {
            metrics.recordTransaction(type.name(), "rejected");
            log.warn("Ledger transaction rejected: accountId={}, type={}, amount={}, reason={}",
                    accountId, type, amount, e.getMessage());
            throw e;

        } catch (DataAccessException | TransactionException e) {
            metrics.recordTransaction(type.name(), "failed");
            log.error("Ledger transaction rolled back: accountId={}, type={}, amount={}, error={}",
                    accountId, type, amount, e.getMessage());
            throw new TransactionFailedException(accountId, type, e);

        } finally {
            metrics.recordLedgerLatency("apply", System.currentTimeMillis() - startTime);
        }
    }

    private LedgerEntry post(long accountId, TransactionType type, long delta) {
        List<Long> locked = jdbcTemplate.queryForList(LOCK_BALANCE_SQL, Long.class, accountId);
        if (locked.isEmpty()) {
            throw new AccountNotFoundException(accountId);
        }
        long currentBalance = locked.get(0);

        long newBalance;
        try {
            newBalance = Math.addExact(currentBalance, delta);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Amount would overflow the balance of account " + accountId);
        }

        if (delta < 0 && newBalance < 0 && !properties.isAllowOverdraft()) {
            throw new InsufficientFundsException(accountId, currentBalance, -delta);
        }

        int updated = jdbcTemplate.update(UPDATE_BALANCE_SQL, newBalance, accountId);
        if (updated != 1) {
            throw new JdbcUpdateAffectedIncorrectNumberOfRowsException(UPDATE_BALANCE_SQL, 1, updated);
        }

        return jdbcTemplate.queryForObject(
            INSERT_ENTRY_SQL,
            ledgerEntryRowMapper(),
            accountId,
            type.name(),
            delta,
            newBalance
        );
    }

    /**
     * Gets the ledger entries of an account in commit order.
     *
     * @throws AccountNotFoundException if the account does not exist
     */
    public List<LedgerEntry> getTransactions(long accountId) {
        getBalance(accountId);
        return jdbcTemplate.query(
            "SELECT id, account_id, entry_type, amount, balance_after, created_at " +
            "FROM ledger_entries WHERE account_id = ? ORDER BY id",
            ledgerEntryRowMapper(),
            accountId
        );
    }

    /**
     * Compares the stored balance with initial balance plus the sum of entries.
     * Both sides are read by one statement, so they come from the same snapshot.
     *
     * @throws AccountNotFoundException if the account does not exist
     */
    public Reconciliation reconcile(long accountId) {
        List<Reconciliation> rows = jdbcTemplate.query(
            "SELECT a.id, a.balance, a.initial_balance, " +
            "       COALESCE(SUM(e.amount), 0) AS entries_total, COUNT(e.id) AS entry_count " +
            "FROM accounts a LEFT JOIN ledger_entries e ON e.account_id = a.id " +
            "WHERE a.id = ? GROUP BY a.id, a.balance, a.initial_balance",
            (rs, rowNum) -> new Reconciliation(
                rs.getLong("id"),
                rs.getLong("balance"),
                rs.getLong("initial_balance"),
                rs.getLong("entries_total"),
                rs.getLong("entry_count")
            ),
            accountId
        );
        if (rows.isEmpty()) {
            throw new AccountNotFoundException(accountId);
        }

        Reconciliation reconciliation = rows.get(0);
        if (!reconciliation.isConsistent()) {
            log.error("Ledger drift detected: accountId={}, balance={}, expected={}",
                    accountId, reconciliation.getBalance(), reconciliation.expectedBalance());
        }
        return reconciliation;
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            rs.getLong("id"),
            rs.getLong("account_id"),
            TransactionType.valueOf(rs.getString("entry_type")),
            rs.getLong("amount"),
            rs.getLong("balance_after"),
            rs.getObject("created_at", OffsetDateTime.class).toInstant()
        );
    }
}
