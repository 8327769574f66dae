package com.financeforge.projection;

import com.financeforge.accounts.AccountRepository;
import com.financeforge.common.exception.LedgerIntegrityException;
import com.financeforge.ledger.EventKind;
import com.financeforge.ledger.EventStore;
import com.financeforge.ledger.LedgerEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for checkpoint memoization and verification.
 */
@ExtendWith(MockitoExtension.class)
class ProjectionBuilderCheckpointTest {

    private static final String ACCOUNT = "card";
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Mock
    private EventStore eventStore;

    @Mock
    private AccountRepository accountRepository;

    private ProjectionBuilder projectionBuilder;

    private LedgerEvent first;
    private LedgerEvent second;

    @BeforeEach
    void setUp() {
        projectionBuilder = new ProjectionBuilder(eventStore, accountRepository, 500, true);
        first = event(1, EventKind.CHARGE, "100.00", "0.00", T0);
        second = event(2, EventKind.PAYMENT, "-40.00", "100.00", T0.plusSeconds(60));
        lenient().when(eventStore.accountIds()).thenReturn(List.of(ACCOUNT));
        lenient().when(accountRepository.findAll()).thenReturn(List.of());
    }

    @Test
    void testSnapshotResumesFromCheckpoint() {
        LedgerEvent third = event(3, EventKind.CHARGE, "15.00", "60.00", T0.plusSeconds(120));
        when(eventStore.replay(ACCOUNT, null)).thenReturn(List.of(first, second));
        when(eventStore.replaySince(ACCOUNT, 2L, null)).thenReturn(List.of(third));

        assertEquals(1, projectionBuilder.checkpoint());
        Snapshot snapshot = projectionBuilder.snapshot(null);

        assertEquals(0, new BigDecimal("75.00").compareTo(snapshot.balanceOf(ACCOUNT)));
        assertEquals(3L, snapshot.sequenceOf(ACCOUNT));
        verify(eventStore).replaySince(ACCOUNT, 2L, null);
    }

    @Test
    void testCheckpointBeyondAsOfFallsBackToReplay() {
        when(eventStore.replay(ACCOUNT, null)).thenReturn(List.of(first, second));
        when(eventStore.replay(ACCOUNT, T0)).thenReturn(List.of(first));

        projectionBuilder.checkpoint();
        Snapshot snapshot = projectionBuilder.snapshot(T0);

        assertEquals(0, new BigDecimal("100.00").compareTo(snapshot.balanceOf(ACCOUNT)));
        verify(eventStore, never()).replaySince(anyString(), anyLong(), any());
    }

    @Test
    void testDivergentCheckpointDetected() {
        LedgerEvent rewritten = event(2, EventKind.PAYMENT, "-70.00", "100.00", T0.plusSeconds(60));
        when(eventStore.replay(ACCOUNT, null))
            .thenReturn(List.of(first, second))
            .thenReturn(List.of(first, rewritten));

        projectionBuilder.checkpoint();

        assertThrows(LedgerIntegrityException.class, () -> projectionBuilder.verifyCheckpoints());
    }

    @Test
    void testBrokenChainDetectedDuringFold() {
        LedgerEvent gap = event(3, EventKind.CHARGE, "10.00", "60.00", T0.plusSeconds(60));
        when(eventStore.replay(ACCOUNT, null)).thenReturn(List.of(first, gap));

        assertThrows(LedgerIntegrityException.class, () -> projectionBuilder.fullReplay(null));
    }

    @Test
    void testCheckpointsAdvanceAfterInterval() {
        ProjectionBuilder eager = new ProjectionBuilder(eventStore, accountRepository, 2, true);
        when(eventStore.replay(ACCOUNT, null)).thenReturn(List.of(first, second));

        eager.snapshot(null);

        Checkpoint checkpoint = eager.getCheckpoints().get(ACCOUNT);
        assertNotNull(checkpoint);
        assertEquals(2L, checkpoint.getSequence());
        assertEquals(0, new BigDecimal("60.00").compareTo(checkpoint.getBalance()));
    }

    @Test
    void testFoldEventsBuildsSnapshotFromPrefix() {
        Snapshot snapshot = projectionBuilder.foldEvents(List.of(first, second));

        assertEquals(0, new BigDecimal("60.00").compareTo(snapshot.balanceOf(ACCOUNT)));
        assertEquals(2L, snapshot.sequenceOf(ACCOUNT));
    }

    private static LedgerEvent event(long sequence, EventKind kind, String amount, String before, Instant at) {
        return new LedgerEvent(ACCOUNT, sequence, kind, new BigDecimal(amount), new BigDecimal(before),
            at, at, "test:" + sequence, null);
    }
}
