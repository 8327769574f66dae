package com.financeforge.common.exception;

/**
 * Thrown when another writer appended to the same account between the
 * caller's read of the tail and its append. Safe to retry after re-reading.
 */
public class ConcurrencyConflictException extends FinanceForgeException {

    private final String accountId;

    public ConcurrencyConflictException(String accountId, long expectedSequence, long actualSequence) {
        super(String.format("Concurrent append on account %s: expected tail sequence %d but found %d",
            accountId, expectedSequence, actualSequence));
        this.accountId = accountId;
    }

    public ConcurrencyConflictException(String accountId, String message) {
        super(message);
        this.accountId = accountId;
    }

    public String getAccountId() {
        return accountId;
    }
}
