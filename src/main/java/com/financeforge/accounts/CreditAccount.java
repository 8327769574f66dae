package com.financeforge.accounts;

import com.financeforge.common.Amounts;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Credit account metadata.
 *
 * Accounts never carry a balance: the balance of an account is always derived
 * by folding its ledger events. Metadata is what the optimization and alert
 * engines need alongside a snapshot (rate, limit, promotional expiry).
 */
@Entity
@Table(name = "credit_accounts")
@Data
@NoArgsConstructor
public class CreditAccount {

    static final BigDecimal MINIMUM_PAYMENT_FLOOR = new BigDecimal("25.00");
    static final BigDecimal MINIMUM_PAYMENT_RATE = new BigDecimal("0.02");

    @Id
    private String accountId;

    private String displayName;

    @Enumerated(EnumType.STRING)
    private AccountKind kind;

    /**
     * Annual percentage rate as a decimal fraction (0.2999 for 29.99%).
     */
    @Column(precision = 9, scale = 6)
    private BigDecimal apr;

    /**
     * Null for installment loans.
     */
    @Column(precision = 19, scale = 2)
    private BigDecimal creditLimit;

    private LocalDate promoRateExpiry;

    /**
     * Contractual minimum monthly payment. Derived from the balance when absent.
     */
    @Column(precision = 19, scale = 2)
    private BigDecimal minimumPayment;

    @Column(name = "registered_at", nullable = false, updatable = false)
    private Instant registeredAt;

    public CreditAccount(String accountId, String displayName, AccountKind kind, BigDecimal apr,
                         BigDecimal creditLimit, LocalDate promoRateExpiry, BigDecimal minimumPayment,
                         Instant registeredAt) {
        this.accountId = accountId;
        this.displayName = displayName;
        this.kind = kind;
        this.apr = apr;
        this.creditLimit = creditLimit;
        this.promoRateExpiry = promoRateExpiry;
        this.minimumPayment = minimumPayment;
        this.registeredAt = registeredAt;
    }

    public boolean hasCreditLimit() {
        return creditLimit != null;
    }

    /**
     * Remaining room under the credit limit for the given balance; zero when the
     * account has no limit or is at or over it.
     */
    public BigDecimal availableCapacity(BigDecimal balance) {
        if (creditLimit == null) {
            return Amounts.ZERO;
        }
        return Amounts.max(Amounts.ZERO, creditLimit.subtract(balance));
    }

    /**
     * Minimum payment due for the given balance, never more than the balance itself.
     */
    public BigDecimal minimumPaymentFor(BigDecimal balance) {
        if (balance.signum() <= 0) {
            return Amounts.ZERO;
        }
        BigDecimal minimum = minimumPayment != null
            ? minimumPayment
            : Amounts.max(MINIMUM_PAYMENT_FLOOR,
                balance.multiply(MINIMUM_PAYMENT_RATE).setScale(Amounts.SCALE, RoundingMode.HALF_UP));
        return Amounts.min(Amounts.round(minimum), balance);
    }
}
