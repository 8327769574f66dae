package com.financeforge.projection;

import com.financeforge.accounts.AccountKind;
import com.financeforge.accounts.AccountRegistration;
import com.financeforge.accounts.AccountService;
import com.financeforge.ledger.EventKind;
import com.financeforge.ledger.EventStore;
import com.financeforge.ledger.LedgerCommandService;
import com.financeforge.ledger.LedgerEvent;
import com.financeforge.ledger.NewEvent;
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
 * Integration tests for snapshots over the persisted log.
 */
@SpringBootTest
@ActiveProfiles("test")
class ProjectionBuilderTest {

    @Autowired
    private ProjectionBuilder projectionBuilder;

    @Autowired
    private LedgerCommandService commandService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private EventStore eventStore;

    private String accountId;

    @BeforeEach
    void setUp() {
        accountId = "proj-" + UUID.randomUUID();
        accountService.registerAccount(AccountRegistration.builder()
            .accountId(accountId)
            .displayName("Projection " + accountId)
            .kind(AccountKind.REVOLVING_CREDIT)
            .apr(new BigDecimal("0.1999"))
            .creditLimit(new BigDecimal("5000.00"))
            .build());
    }

    @Test
    void testRegisteredAccountWithoutEventsIsZero() {
        Snapshot snapshot = projectionBuilder.snapshot(null);

        assertTrue(snapshot.accountIds().contains(accountId));
        assertEquals(0, snapshot.balanceOf(accountId).signum());
        assertEquals(0L, snapshot.sequenceOf(accountId));
    }

    @Test
    void testReplayIsIdempotent() {
        commandService.recordCharge(accountId, new BigDecimal("250.00"), null);
        commandService.recordPayment(accountId, new BigDecimal("75.50"), null);

        Snapshot first = projectionBuilder.fullReplay(null);
        Snapshot second = projectionBuilder.fullReplay(null);

        assertEquals(first.getBalances(), second.getBalances());
        assertEquals(0, new BigDecimal("174.50").compareTo(first.balanceOf(accountId)));
    }

    @Test
    void testCheckpointPlusSuffixMatchesFullReplay() {
        commandService.recordCharge(accountId, new BigDecimal("1000.00"), null);
        projectionBuilder.checkpoint();
        commandService.recordPayment(accountId, new BigDecimal("200.00"), null);
        commandService.recordCharge(accountId, new BigDecimal("33.33"), null);

        Snapshot fromCheckpoint = projectionBuilder.snapshot(null);
        Snapshot replayed = projectionBuilder.fullReplay(null);

        assertEquals(0, replayed.balanceOf(accountId).compareTo(fromCheckpoint.balanceOf(accountId)));
        assertEquals(replayed.sequenceOf(accountId), fromCheckpoint.sequenceOf(accountId));
        assertEquals(0, new BigDecimal("833.33").compareTo(fromCheckpoint.balanceOf(accountId)));
        projectionBuilder.verifyCheckpoints();
    }

    @Test
    void testHistoricalSnapshot() {
        Instant start = Instant.now().minus(2, ChronoUnit.HOURS);
        LedgerEvent first = eventStore.append(NewEvent.after(accountId, null)
            .kind(EventKind.CHARGE)
            .amount(new BigDecimal("400.00"))
            .occurredAt(start)
            .causationId("test")
            .build());
        eventStore.append(NewEvent.after(accountId, first)
            .kind(EventKind.PAYMENT)
            .amount(new BigDecimal("-100.00"))
            .occurredAt(start.plus(1, ChronoUnit.HOURS))
            .causationId("test")
            .build());

        assertEquals(0, new BigDecimal("400.00")
            .compareTo(projectionBuilder.balanceOf(accountId, start.plus(30, ChronoUnit.MINUTES))));
        assertEquals(0, new BigDecimal("300.00").compareTo(projectionBuilder.balanceOf(accountId, null)));
        assertEquals(0, projectionBuilder.balanceOf(accountId, start.minusSeconds(1)).signum());
    }
}
