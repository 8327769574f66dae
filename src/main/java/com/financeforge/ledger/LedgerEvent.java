package com.financeforge.ledger;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Immutable balance-changing event.
 *
 * Events are append-only: they are never updated or deleted, and corrections
 * are recorded as new ADJUSTMENT events. Within one account, events form a
 * chain where each event's balanceBefore equals the previous event's balanceAfter.
 */
@Entity
@Immutable
@Table(name = "ledger_events",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_ledger_account_sequence", columnNames = {"account_id", "account_sequence"}),
        @UniqueConstraint(name = "uk_ledger_idempotency_key", columnNames = {"idempotency_key"})
    },
    indexes = {
        @Index(name = "idx_ledger_account_id", columnList = "account_id"),
        @Index(name = "idx_ledger_causation_id", columnList = "causation_id"),
        @Index(name = "idx_ledger_occurred_at", columnList = "occurred_at")
    })
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LedgerEvent {

    /**
     * Store-assigned, monotonically increasing across the whole log.
     */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false, updatable = false)
    private String accountId;

    /**
     * Position in the account's chain, starting at 1 with no gaps.
     */
    @Column(name = "account_sequence", nullable = false, updatable = false)
    private long sequence;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private EventKind kind;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal balanceBefore;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal balanceAfter;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    /**
     * Command or reconciliation action that produced this event.
     */
    @Column(name = "causation_id", nullable = false, updatable = false)
    private String causationId;

    @Column(name = "idempotency_key", updatable = false)
    private String idempotencyKey;

    public LedgerEvent(String accountId, long sequence, EventKind kind, BigDecimal amount,
                       BigDecimal balanceBefore, Instant occurredAt, Instant recordedAt,
                       String causationId, String idempotencyKey) {
        this.accountId = accountId;
        this.sequence = sequence;
        this.kind = kind;
        this.amount = amount;
        this.balanceBefore = balanceBefore;
        this.balanceAfter = balanceBefore.add(amount);
        this.occurredAt = occurredAt;
        this.recordedAt = recordedAt;
        this.causationId = causationId;
        this.idempotencyKey = idempotencyKey;
    }

    /**
     * True when this event directly continues the given predecessor's chain.
     */
    public boolean follows(LedgerEvent previous) {
        return previous.getAccountId().equals(accountId)
            && previous.getSequence() + 1 == sequence
            && previous.getBalanceAfter().compareTo(balanceBefore) == 0;
    }
}
