package com.financeforge.common.exception;

import java.math.BigDecimal;

/**
 * Thrown when an appended event does not continue its account's balance chain.
 * The append is refused and the log is left unchanged.
 */
public class ConsistencyException extends FinanceForgeException {

    private final String accountId;

    public ConsistencyException(String accountId, BigDecimal expectedBalanceBefore, BigDecimal actualBalanceBefore) {
        super(String.format("Balance chain broken for account %s: tail balance is %s but event starts from %s",
            accountId, expectedBalanceBefore, actualBalanceBefore));
        this.accountId = accountId;
    }

    public String getAccountId() {
        return accountId;
    }
}
