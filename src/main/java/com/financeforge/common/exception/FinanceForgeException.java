package com.financeforge.common.exception;

/**
 * Base exception for all FinanceForge exceptions.
 */
public class FinanceForgeException extends RuntimeException {

    public FinanceForgeException(String message) {
        super(message);
    }

    public FinanceForgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
