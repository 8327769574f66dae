package com.financeforge.common.exception;

/**
 * Thrown when the storage backing the event log is unavailable.
 * Previously committed events are never affected.
 */
public class LedgerPersistenceException extends FinanceForgeException {

    public LedgerPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
