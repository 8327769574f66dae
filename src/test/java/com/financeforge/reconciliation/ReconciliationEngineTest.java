package com.financeforge.reconciliation;

import com.financeforge.accounts.AccountKind;
import com.financeforge.accounts.AccountRegistration;
import com.financeforge.accounts.AccountService;
import com.financeforge.alerts.AlertSeverity;
import com.financeforge.common.exception.ValidationException;
import com.financeforge.ledger.EventKind;
import com.financeforge.ledger.LedgerCommandService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for single-account reconciliation.
 */
@SpringBootTest
@ActiveProfiles("test")
class ReconciliationEngineTest {

    @Autowired
    private ReconciliationEngine engine;

    @Autowired
    private LedgerCommandService commandService;

    @Autowired
    private AccountService accountService;

    private String accountId;

    @BeforeEach
    void setUp() {
        accountId = "recon-" + UUID.randomUUID();
        accountService.registerAccount(AccountRegistration.builder()
            .accountId(accountId)
            .displayName("Reconciliation " + accountId)
            .kind(AccountKind.REVOLVING_CREDIT)
            .apr(new BigDecimal("0.2499"))
            .creditLimit(new BigDecimal("5000.00"))
            .build());
        commandService.updateBalance(accountId, new BigDecimal("760.00"), null);
    }

    @Test
    void testSmallDriftAdjustedThenConverges() {
        ReconciliationResult result = engine.reconcile(accountId, new BigDecimal("760.02"), null);

        assertEquals(ReconciliationStatus.ADJUSTED, result.getStatus());
        assertEquals(new BigDecimal("0.02"), result.getDrift());
        assertEquals(EventKind.ADJUSTMENT, result.getAdjustment().getKind());
        assertEquals(new BigDecimal("0.02"), result.getAdjustment().getAmount());
        assertTrue(result.getAdjustment().getCausationId().startsWith("reconciliation:"));
        assertEquals(AlertSeverity.INFO, result.getAlert().getSeverity());
        assertEquals(ReconciliationEngine.DRIFT_ALERT, result.getAlert().getKind());

        ReconciliationResult again = engine.reconcile(accountId, new BigDecimal("760.02"), null);

        assertEquals(ReconciliationStatus.OK, again.getStatus());
        assertNull(again.getAdjustment());
        assertEquals(2, commandService.queryHistory(accountId, null, null).size());
    }

    @Test
    void testDriftWithinEpsilonIsOk() {
        ReconciliationResult result = engine.reconcile(accountId, new BigDecimal("760.01"), null);

        assertEquals(ReconciliationStatus.OK, result.getStatus());
        assertEquals(1, commandService.queryHistory(accountId, null, null).size());
    }

    @Test
    void testDriftAboveWarningThreshold() {
        ReconciliationResult result = engine.reconcile(accountId, new BigDecimal("735.00"), null);

        assertEquals(ReconciliationStatus.ADJUSTED, result.getStatus());
        assertEquals(new BigDecimal("-25.00"), result.getAdjustment().getAmount());
        assertEquals(AlertSeverity.WARNING, result.getAlert().getSeverity());
    }

    @Test
    void testLargeDriftLeftForReview() {
        ReconciliationResult result = engine.reconcile(accountId, new BigDecimal("5760.00"), null);

        assertEquals(ReconciliationStatus.NEEDS_REVIEW, result.getStatus());
        assertEquals(ReviewReason.LARGE_DRIFT, result.getReviewReason());
        assertEquals(new BigDecimal("5000.00"), result.getProposedAdjustment());
        assertEquals(AlertSeverity.WARNING, result.getAlert().getSeverity());
        assertEquals(1, commandService.queryHistory(accountId, null, null).size());
    }

    @Test
    void testStaleStatementWithDriftLeftForReview() {
        Instant beforeOpening = Instant.now().minus(1, ChronoUnit.HOURS);

        ReconciliationResult result = engine.reconcile(accountId, new BigDecimal("500.00"), beforeOpening);

        assertEquals(ReconciliationStatus.NEEDS_REVIEW, result.getStatus());
        assertEquals(ReviewReason.STALE_STATEMENT, result.getReviewReason());
        assertEquals(0, result.getProjectedBalance().signum());
        assertEquals(1, commandService.queryHistory(accountId, null, null).size());
    }

    @Test
    void testStaleStatementWithoutDriftIsOk() {
        Instant beforeOpening = Instant.now().minus(1, ChronoUnit.HOURS);

        ReconciliationResult result = engine.reconcile(accountId, new BigDecimal("0.00"), beforeOpening);

        assertEquals(ReconciliationStatus.OK, result.getStatus());
    }

    @Test
    void testFutureStatementRejected() {
        Instant tomorrow = Instant.now().plus(1, ChronoUnit.DAYS);

        assertThrows(ValidationException.class,
            () -> engine.reconcile(accountId, new BigDecimal("760.00"), tomorrow));
    }
}
