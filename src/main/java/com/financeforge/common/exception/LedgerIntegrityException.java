package com.financeforge.common.exception;

/**
 * Internal-consistency failure: a checkpoint disagrees with a full replay, or a
 * committed log violates the balance chain. Not recoverable.
 */
public class LedgerIntegrityException extends FinanceForgeException {

    public LedgerIntegrityException(String message) {
        super(message);
    }
}
