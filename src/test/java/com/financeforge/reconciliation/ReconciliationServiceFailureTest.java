package com.financeforge.reconciliation;

import com.financeforge.accounts.AccountKind;
import com.financeforge.accounts.CreditAccount;
import com.financeforge.alerts.AlertEngine;
import com.financeforge.common.exception.ConcurrencyConflictException;
import com.financeforge.common.exception.LedgerPersistenceException;
import com.financeforge.common.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for records that fail while being applied, after the batch passed validation.
 */
@ExtendWith(MockitoExtension.class)
class ReconciliationServiceFailureTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private AccountReferenceResolver resolver;

    @Mock
    private ReconciliationEngine engine;

    private ReconciliationService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        service = new ReconciliationService(resolver, engine, new AlertEngine(List.of(), clock), clock);
    }

    @Test
    void testExhaustedConflictBecomesRecordOutcome() {
        resolves("busy-1");
        resolves("calm-1");
        when(engine.reconcile(eq("busy-1"), any(), any()))
            .thenThrow(new ConcurrencyConflictException("busy-1", "Account busy-1 changed while it was being reconciled"));
        when(engine.reconcile(eq("calm-1"), any(), any()))
            .thenReturn(ReconciliationResult.builder()
                .accountId("calm-1")
                .status(ReconciliationStatus.OK)
                .candidates(List.of())
                .build());

        ReconciliationReport report = service.runReconciliation(List.of(
            new ExternalStatementRecord("busy-1", new BigDecimal("10.00"), null),
            new ExternalStatementRecord("calm-1", new BigDecimal("20.00"), null)));

        ReconciliationResult busy = report.getResults().get(0);
        assertEquals(ReconciliationStatus.NEEDS_REVIEW, busy.getStatus());
        assertEquals(ReviewReason.CONCURRENT_CHANGE, busy.getReviewReason());
        assertEquals("busy-1", busy.getAccountId());
        assertNotNull(busy.getFailure());
        assertNull(busy.getAdjustment());

        assertEquals(ReconciliationStatus.OK, report.getResults().get(1).getStatus());
        assertEquals("calm-1", report.getResults().get(1).getAccountReference());
    }

    @Test
    void testStorageFailureBecomesRecordOutcome() {
        resolves("down-1");
        when(engine.reconcile(eq("down-1"), any(), any()))
            .thenThrow(new LedgerPersistenceException("Event log storage unavailable",
                new DataAccessResourceFailureException("connection refused")));

        ReconciliationReport report = service.runReconciliation(List.of(
            new ExternalStatementRecord("down-1", new BigDecimal("10.00"), null)));

        ReconciliationResult result = report.getResults().get(0);
        assertEquals(ReconciliationStatus.FAILED, result.getStatus());
        assertEquals("Event log storage unavailable", result.getFailure());
        assertEquals(1L, report.getSummary().get(ReconciliationStatus.FAILED));
    }

    @Test
    void testFutureStatementRejectedBeforeResolving() {
        assertThrows(ValidationException.class, () -> service.runReconciliation(List.of(
            new ExternalStatementRecord("any-1", new BigDecimal("10.00"), null),
            new ExternalStatementRecord("any-2", new BigDecimal("10.00"), NOW.plusSeconds(1)))));

        verifyNoInteractions(resolver, engine);
    }

    private void resolves(String id) {
        CreditAccount account = new CreditAccount(id, "Account " + id, AccountKind.REVOLVING_CREDIT,
            new BigDecimal("0.20"), new BigDecimal("5000.00"), null, null, Instant.EPOCH);
        when(resolver.resolve(id)).thenReturn(AccountResolution.resolved(id, account, AccountResolution.Method.EXACT_ID));
    }
}
