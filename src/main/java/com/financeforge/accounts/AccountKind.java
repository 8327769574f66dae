package com.financeforge.accounts;

/**
 * Kinds of credit facility tracked by FinanceForge.
 */
public enum AccountKind {
    /**
     * Credit card style revolving line with a credit limit.
     */
    REVOLVING_CREDIT(true),

    /**
     * Home-equity line of credit (HELOC). Revolving, usually at a lower rate.
     */
    HOME_EQUITY_LINE(true),

    /**
     * Fixed installment loan. Has no credit limit and cannot receive transfers.
     */
    INSTALLMENT_LOAN(false);

    private final boolean revolving;

    AccountKind(boolean revolving) {
        this.revolving = revolving;
    }

    public boolean isRevolving() {
        return revolving;
    }
}
