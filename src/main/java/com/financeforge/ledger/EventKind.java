package com.financeforge.ledger;

import java.math.BigDecimal;

/**
 * Kinds of balance-changing events.
 *
 * Balances are amounts owed, so charges and incoming transfers raise them while
 * payments and outgoing transfers lower them. Each kind fixes the sign of its amount.
 */
public enum EventKind {
    /**
     * New spending or interest on the account. Positive amount.
     */
    CHARGE(1),

    /**
     * Payment towards the balance. Negative amount.
     */
    PAYMENT(-1),

    /**
     * Balance moved away to another account. Negative amount.
     */
    TRANSFER_OUT(-1),

    /**
     * Balance received from another account. Positive amount.
     */
    TRANSFER_IN(1),

    /**
     * Correction of the balance: reconciliation drift or a stated balance update.
     * Either sign, never zero.
     */
    ADJUSTMENT(0);

    private final int requiredSign;

    EventKind(int requiredSign) {
        this.requiredSign = requiredSign;
    }

    /**
     * True when the signed amount is acceptable for this kind.
     */
    public boolean accepts(BigDecimal amount) {
        if (amount.signum() == 0) {
            return false;
        }
        return requiredSign == 0 || amount.signum() == requiredSign;
    }
}
