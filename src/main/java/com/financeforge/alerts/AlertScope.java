package com.financeforge.alerts;

/**
 * What a rule is evaluated against.
 */
public enum AlertScope {
    /** Each account position; subject is the account id. */
    ACCOUNT,
    /** Each arbitrage opportunity; subject is {@code from->to}. */
    OPPORTUNITY,
    /** The portfolio as a whole; subject is {@code portfolio}. */
    PORTFOLIO
}
