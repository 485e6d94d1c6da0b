package com.flagship.atm.api;

import com.flagship.atm.api.dto.AmountRequest;
import com.flagship.atm.api.dto.BalanceResponse;
import com.flagship.atm.api.dto.LedgerEntryResponse;
import com.flagship.atm.api.dto.ReconciliationResponse;
import com.flagship.atm.api.dto.TransactionResponse;
import com.flagship.atm.ledger.LedgerEntry;
import com.flagship.atm.ledger.LedgerService;
import com.flagship.atm.ledger.TransactionType;
import com.flagship.atm.session.Session;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST Controller for balance queries and movements on the session's account.
 *
 * Every route here runs behind {@link SessionAuthenticationFilter}; the account is
 * always the one bound to the session, never taken from the request.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private final LedgerService ledgerService;

    @GetMapping("/balance")
    public ResponseEntity<BalanceResponse> getBalance(
            @RequestAttribute(name = AuthenticatedSessions.ATTRIBUTE, required = false) Session session) {
        long accountId = AuthenticatedSessions.require(session, "/api/balance").getAccountId();
        return ResponseEntity.ok(new BalanceResponse(accountId, ledgerService.getBalance(accountId)));
    }

    @PostMapping("/deposit")
    public ResponseEntity<TransactionResponse> deposit(
            @RequestAttribute(name = AuthenticatedSessions.ATTRIBUTE, required = false) Session session,
            @Valid @RequestBody AmountRequest request) {
        long accountId = AuthenticatedSessions.require(session, "/api/deposit").getAccountId();
        return ResponseEntity.ok(apply(accountId, TransactionType.DEPOSIT, request.getAmount()));
    }

    @PostMapping("/withdraw")
    public ResponseEntity<TransactionResponse> withdraw(
            @RequestAttribute(name = AuthenticatedSessions.ATTRIBUTE, required = false) Session session,
            @Valid @RequestBody AmountRequest request) {
        long accountId = AuthenticatedSessions.require(session, "/api/withdraw").getAccountId();
        return ResponseEntity.ok(apply(accountId, TransactionType.WITHDRAWAL, request.getAmount()));
    }

    @GetMapping("/transactions")
    public ResponseEntity<List<LedgerEntryResponse>> getTransactions(
            @RequestAttribute(name = AuthenticatedSessions.ATTRIBUTE, required = false) Session session) {
        long accountId = AuthenticatedSessions.require(session, "/api/transactions").getAccountId();
        List<LedgerEntryResponse> entries = ledgerService.getTransactions(accountId).stream()
            .map(LedgerEntryResponse::from)
            .toList();
        return ResponseEntity.ok(entries);
    }

    @GetMapping("/reconciliation")
    public ResponseEntity<ReconciliationResponse> reconcile(
            @RequestAttribute(name = AuthenticatedSessions.ATTRIBUTE, required = false) Session session) {
        long accountId = AuthenticatedSessions.require(session, "/api/reconciliation").getAccountId();
        return ResponseEntity.ok(ReconciliationResponse.from(ledgerService.reconcile(accountId)));
    }

    private TransactionResponse apply(long accountId, TransactionType type, long amount) {
        log.info("Received {} request: amount={}", type, amount);
        LedgerEntry entry = ledgerService.applyTransaction(accountId, type, amount);
        return TransactionResponse.from(entry);
    }
}
