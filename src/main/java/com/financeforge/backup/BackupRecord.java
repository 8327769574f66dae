package com.financeforge.backup;

import com.financeforge.ledger.EventKind;
import com.financeforge.ledger.LedgerEvent;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One exported event. balanceAfter is written out so a damaged line can be detected.
 */
@Value
@Builder
@Jacksonized
public class BackupRecord {
    long id;
    String accountId;
    long sequence;
    EventKind kind;
    BigDecimal amount;
    BigDecimal balanceBefore;
    BigDecimal balanceAfter;
    Instant occurredAt;
    Instant recordedAt;
    String causationId;
    String idempotencyKey;

    static BackupRecord of(LedgerEvent event) {
        return BackupRecord.builder()
            .id(event.getId())
            .accountId(event.getAccountId())
            .sequence(event.getSequence())
            .kind(event.getKind())
            .amount(event.getAmount())
            .balanceBefore(event.getBalanceBefore())
            .balanceAfter(event.getBalanceAfter())
            .occurredAt(event.getOccurredAt())
            .recordedAt(event.getRecordedAt())
            .causationId(event.getCausationId())
            .idempotencyKey(event.getIdempotencyKey())
            .build();
    }

    LedgerEvent toEvent() {
        return new LedgerEvent(accountId, sequence, kind, amount, balanceBefore,
            occurredAt, recordedAt, causationId, idempotencyKey);
    }
}
