package com.flagship.atm.api;

import com.flagship.atm.config.JacksonConfig;
import com.flagship.atm.ledger.AccountNotFoundException;
import com.flagship.atm.ledger.AccountService;
import com.flagship.atm.ledger.InsufficientFundsException;
import com.flagship.atm.ledger.LedgerEntry;
import com.flagship.atm.ledger.LedgerService;
import com.flagship.atm.ledger.Reconciliation;
import com.flagship.atm.ledger.TransactionFailedException;
import com.flagship.atm.ledger.TransactionType;
import com.flagship.atm.observability.AtmMetrics;
import com.flagship.atm.session.Session;
import com.flagship.atm.session.SessionManager;
import com.flagship.atm.session.SessionValidation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web layer tests: routing, session filter, request decoding and error rendering.
 * The ledger and the session manager are mocked.
 */
@WebMvcTest(controllers = {AccountController.class, AuthController.class, SessionController.class})
@Import(JacksonConfig.class)
class AccountControllerTest {

    private static final long ACCOUNT_ID = 7L;
    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SessionManager sessionManager;

    @MockBean
    private LedgerService ledgerService;

    @MockBean
    private AccountService accountService;

    @MockBean
    private AtmMetrics metrics;

    private Session session;

    @BeforeEach
    void setUp() {
        session = new Session(UUID.randomUUID(), ACCOUNT_ID, NOW, NOW.plus(Duration.ofMinutes(10)));
        when(sessionManager.validate(session.getId())).thenReturn(SessionValidation.valid(session));
    }

    private String token() {
        return session.getId().toString();
    }

    private LedgerEntry entry(long id, TransactionType type, long amount, long balanceAfter) {
        return new LedgerEntry(id, ACCOUNT_ID, type, amount, balanceAfter, NOW);
    }

    @Nested
    @DisplayName("POST /api/login")
    class Login {

        @Test
        @DisplayName("Known PIN opens a session and returns its id in the SessionID header")
        void knownPin() throws Exception {
            when(accountService.resolveAccount("4623")).thenReturn(Optional.of(ACCOUNT_ID));
            when(sessionManager.createSession(ACCOUNT_ID)).thenReturn(session);

            mockMvc.perform(post("/api/login").header("nip", "4623"))
                .andExpect(status().isOk())
                .andExpect(header().string("SessionID", token()))
                .andExpect(jsonPath("$.session_id").value(token()))
                .andExpect(jsonPath("$.account_id").value(ACCOUNT_ID))
                .andExpect(jsonPath("$.expires_at").value("2026-01-15T10:10:00Z"));

            verify(metrics).recordLogin("success");
        }

        @Test
        @DisplayName("Unknown PIN is rejected with 401 and no session is created")
        void unknownPin() throws Exception {
            when(accountService.resolveAccount("0000")).thenReturn(Optional.empty());

            mockMvc.perform(post("/api/login").header("nip", "0000"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("invalid nip"));

            verify(sessionManager, never()).createSession(anyLong());
            verify(metrics).recordLogin("rejected");
        }

        @Test
        @DisplayName("Missing nip header is a bad request")
        void missingHeader() throws Exception {
            mockMvc.perform(post("/api/login"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("missing header: 'nip'"));
        }

        @Test
        @DisplayName("Login does not require an Authorization header")
        void loginIsNotFiltered() throws Exception {
            when(accountService.resolveAccount("4623")).thenReturn(Optional.of(ACCOUNT_ID));
            when(sessionManager.createSession(ACCOUNT_ID)).thenReturn(session);

            mockMvc.perform(post("/api/login").header("nip", "4623"))
                .andExpect(status().isOk());

            verify(sessionManager, never()).validate(any());
        }
    }

    @Nested
    @DisplayName("Session filter")
    class SessionFilter {

        @Test
        @DisplayName("Missing Authorization header is 401")
        void missingAuthorization() throws Exception {
            mockMvc.perform(get("/api/balance"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("unauthorized"));

            verify(ledgerService, never()).getBalance(anyLong());
        }

        @Test
        @DisplayName("Authorization that is not a session id is 400")
        void malformedToken() throws Exception {
            mockMvc.perform(get("/api/balance").header("Authorization", "not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("invalid authorization"));

            mockMvc.perform(get("/api/balance").header("Authorization", "1-1-1-1-1"))
                .andExpect(status().isBadRequest());

            verify(sessionManager, never()).validate(any());
        }

        @Test
        @DisplayName("Unknown session is 401 invalid authorization")
        void unknownSession() throws Exception {
            UUID unknown = UUID.randomUUID();
            when(sessionManager.validate(unknown)).thenReturn(SessionValidation.notFound(unknown));

            mockMvc.perform(get("/api/balance").header("Authorization", unknown.toString()))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("invalid authorization"));
        }

        @Test
        @DisplayName("Expired session is 401 session expired")
        void expiredSession() throws Exception {
            when(sessionManager.validate(session.getId())).thenReturn(SessionValidation.expired(session));

            mockMvc.perform(post("/api/deposit")
                    .header("Authorization", token())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"amount\": 100}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("session expired"));

            verify(ledgerService, never()).applyTransaction(anyLong(), any(), anyLong());
        }

        @Test
        @DisplayName("Bearer prefix is accepted")
        void bearerToken() throws Exception {
            when(ledgerService.getBalance(ACCOUNT_ID)).thenReturn(100L);

            mockMvc.perform(get("/api/balance").header("Authorization", "Bearer " + token()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(100));
        }

        @Test
        @DisplayName("Correlation id is echoed on rejected requests")
        void correlationIdEchoed() throws Exception {
            mockMvc.perform(get("/api/balance").header("X-Correlation-ID", "corr-123"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string("X-Correlation-ID", "corr-123"))
                .andExpect(jsonPath("$.correlation_id").value("corr-123"));
        }
    }

    @Nested
    @DisplayName("Balance and movements")
    class Movements {

        @Test
        @DisplayName("GET /api/balance returns the session account's balance")
        void balance() throws Exception {
            when(ledgerService.getBalance(ACCOUNT_ID)).thenReturn(250L);

            mockMvc.perform(get("/api/balance").header("Authorization", token()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.account_id").value(ACCOUNT_ID))
                .andExpect(jsonPath("$.balance").value(250));
        }

        @Test
        @DisplayName("Balance of a vanished account is 404")
        void balanceAccountMissing() throws Exception {
            when(ledgerService.getBalance(ACCOUNT_ID)).thenThrow(new AccountNotFoundException(ACCOUNT_ID));

            mockMvc.perform(get("/api/balance").header("Authorization", token()))
                .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("Deposit applies a DEPOSIT to the session account")
        void deposit() throws Exception {
            when(ledgerService.applyTransaction(ACCOUNT_ID, TransactionType.DEPOSIT, 100L))
                .thenReturn(entry(1L, TransactionType.DEPOSIT, 100L, 100L));

            mockMvc.perform(post("/api/deposit")
                    .header("Authorization", token())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"amount\": 100}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.entry_id").value(1))
                .andExpect(jsonPath("$.type").value("DEPOSIT"))
                .andExpect(jsonPath("$.amount").value(100))
                .andExpect(jsonPath("$.balance").value(100));
        }

        @Test
        @DisplayName("Withdrawal reports the magnitude and the resulting balance")
        void withdraw() throws Exception {
            when(ledgerService.applyTransaction(ACCOUNT_ID, TransactionType.WITHDRAWAL, 30L))
                .thenReturn(entry(2L, TransactionType.WITHDRAWAL, -30L, 70L));

            mockMvc.perform(post("/api/withdraw")
                    .header("Authorization", token())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"amount\": 30}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("WITHDRAWAL"))
                .andExpect(jsonPath("$.amount").value(30))
                .andExpect(jsonPath("$.balance").value(70));
        }

        @Test
        @DisplayName("Insufficient funds is 409")
        void insufficientFunds() throws Exception {
            when(ledgerService.applyTransaction(ACCOUNT_ID, TransactionType.WITHDRAWAL, 150L))
                .thenThrow(new InsufficientFundsException(ACCOUNT_ID, 100L, 150L));

            mockMvc.perform(post("/api/withdraw")
                    .header("Authorization", token())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"amount\": 150}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Insufficient Funds"));
        }

        @Test
        @DisplayName("Storage failure is 500 failed to perform deposit")
        void storageFailure() throws Exception {
            when(ledgerService.applyTransaction(ACCOUNT_ID, TransactionType.DEPOSIT, 100L))
                .thenThrow(new TransactionFailedException(ACCOUNT_ID, TransactionType.DEPOSIT,
                    new DataAccessResourceFailureException("connection reset")));

            mockMvc.perform(post("/api/deposit")
                    .header("Authorization", token())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"amount\": 100}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Transaction Failed"))
                .andExpect(jsonPath("$.message").value("failed to perform deposit"));
        }

        @Test
        @DisplayName("Negative, fractional, missing and undecodable amounts are 400")
        void malformedAmounts() throws Exception {
            for (String body : List.of("{\"amount\": -5}", "{\"amount\": 1.5}", "{}", "deposit 100", "{\"amount\": \"ten\"}")) {
                mockMvc.perform(post("/api/deposit")
                        .header("Authorization", token())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                    .andExpect(status().isBadRequest());
            }

            verify(ledgerService, never()).applyTransaction(anyLong(), any(), anyLong());
        }

        @Test
        @DisplayName("Zero amount is accepted")
        void zeroAmount() throws Exception {
            when(ledgerService.applyTransaction(ACCOUNT_ID, TransactionType.DEPOSIT, 0L))
                .thenReturn(entry(3L, TransactionType.DEPOSIT, 0L, 100L));

            mockMvc.perform(post("/api/deposit")
                    .header("Authorization", token())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"amount\": 0}"))
                .andExpect(status().isOk());
        }

        @Test
        @DisplayName("Wrong method on a movement route is 405")
        void wrongMethod() throws Exception {
            mockMvc.perform(get("/api/deposit").header("Authorization", token()))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.message").value("not allowed"));
        }

        @Test
        @DisplayName("Transaction history lists signed entries in order")
        void transactions() throws Exception {
            when(ledgerService.getTransactions(ACCOUNT_ID)).thenReturn(List.of(
                entry(1L, TransactionType.DEPOSIT, 100L, 100L),
                entry(2L, TransactionType.WITHDRAWAL, -30L, 70L)));

            mockMvc.perform(get("/api/transactions").header("Authorization", token()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].amount").value(100))
                .andExpect(jsonPath("$[1].amount").value(-30))
                .andExpect(jsonPath("$[1].balance_after").value(70));
        }

        @Test
        @DisplayName("Reconciliation report is rendered")
        void reconciliation() throws Exception {
            when(ledgerService.reconcile(ACCOUNT_ID))
                .thenReturn(new Reconciliation(ACCOUNT_ID, 70L, 0L, 70L, 2L));

            mockMvc.perform(get("/api/reconciliation").header("Authorization", token()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entries_total").value(70))
                .andExpect(jsonPath("$.consistent").value(true));
        }
    }

    @Nested
    @DisplayName("Session routes")
    class SessionRoutes {

        @Test
        @DisplayName("GET /api/session describes the current session")
        void currentSession() throws Exception {
            mockMvc.perform(get("/api/session").header("Authorization", token()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.session_id").value(token()))
                .andExpect(jsonPath("$.account_id").value(ACCOUNT_ID));
        }

        @Test
        @DisplayName("POST /api/session/renew returns the extended expiry")
        void renew() throws Exception {
            Session renewed = session.renewedAt(NOW.plus(Duration.ofMinutes(5)), Duration.ofMinutes(10));
            when(sessionManager.renew(session.getId())).thenReturn(SessionValidation.valid(renewed));

            mockMvc.perform(post("/api/session/renew").header("Authorization", token()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.expires_at").value("2026-01-15T10:15:00Z"));
        }

        @Test
        @DisplayName("Renew racing with expiry is 401 session expired")
        void renewAfterExpiry() throws Exception {
            when(sessionManager.renew(session.getId())).thenReturn(SessionValidation.expired(session));

            mockMvc.perform(post("/api/session/renew").header("Authorization", token()))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("session expired"));
        }
    }
}
