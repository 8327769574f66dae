package com.financeforge.reconciliation;

import com.financeforge.accounts.AccountKind;
import com.financeforge.accounts.AccountRegistration;
import com.financeforge.accounts.AccountService;
import com.financeforge.ledger.EventKind;
import com.financeforge.ledger.EventStore;
import com.financeforge.ledger.LedgerCommandService;
import com.financeforge.ledger.LedgerEvent;
import com.financeforge.ledger.NewEvent;
import com.financeforge.projection.ProjectionBuilder;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.util.AopTestUtils;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;

/**
 * Integration test for a reconciliation that races another writer.
 *
 * Runs against its own in-memory database because the event store is spied.
 */
@SpringBootTest(properties = "spring.datasource.url=jdbc:h2:mem:reconcileretrydb;DB_CLOSE_DELAY=-1")
@ActiveProfiles("test")
class ReconciliationRetryTest {

    @SpyBean
    private EventStore eventStore;

    @Autowired
    private ReconciliationEngine reconciliationEngine;

    @Autowired
    private AccountService accountService;

    @Autowired
    private LedgerCommandService commandService;

    @Autowired
    private ProjectionBuilder projectionBuilder;

    @Test
    void testChargeLandingBeforeAdjustmentIsRetried() {
        String id = "retry-" + UUID.randomUUID();
        accountService.registerAccount(AccountRegistration.builder()
            .accountId(id)
            .displayName("Retry " + id)
            .kind(AccountKind.REVOLVING_CREDIT)
            .apr(new BigDecimal("0.1999"))
            .creditLimit(new BigDecimal("5000.00"))
            .build());
        commandService.updateBalance(id, new BigDecimal("100.00"), null);

        // The first adjustment attempt finds a charge committed after its tail was read
        AtomicBoolean charged = new AtomicBoolean();
        EventStore store = AopTestUtils.getUltimateTargetObject(eventStore);
        doAnswer(invocation -> {
            NewEvent event = invocation.getArgument(0);
            if (event.getKind() == EventKind.ADJUSTMENT && id.equals(event.getAccountId())
                    && charged.compareAndSet(false, true)) {
                commandService.recordCharge(id, new BigDecimal("5.00"), null);
            }
            return invocation.callRealMethod();
        }).when(store).append(any(NewEvent.class));

        ReconciliationResult result = reconciliationEngine.reconcile(id, new BigDecimal("130.00"), null);

        assertTrue(charged.get());
        assertEquals(ReconciliationStatus.ADJUSTED, result.getStatus());
        assertEquals(new BigDecimal("105.00"), result.getProjectedBalance());
        assertEquals(new BigDecimal("25.00"), result.getDrift());
        assertEquals(new BigDecimal("130.00"), projectionBuilder.balanceOf(id, null));

        List<LedgerEvent> history = commandService.queryHistory(id, null, null);
        assertEquals(List.of(EventKind.ADJUSTMENT, EventKind.CHARGE, EventKind.ADJUSTMENT),
            history.stream().map(LedgerEvent::getKind).toList());
        assertEquals(new BigDecimal("25.00"), history.get(2).getAmount());
    }
}
