package com.financeforge.common.exception;

/**
 * Thrown when a command is malformed (bad amount, negative credit limit, ...).
 * Raised before anything touches the event log.
 */
public class ValidationException extends FinanceForgeException {

    public ValidationException(String message) {
        super(message);
    }
}
