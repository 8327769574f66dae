package com.financeforge.common.exception;

/**
 * Thrown when an account reference cannot be resolved.
 */
public class AccountNotFoundException extends FinanceForgeException {

    private final String accountReference;

    public AccountNotFoundException(String accountReference) {
        super("Account not found: " + accountReference);
        this.accountReference = accountReference;
    }

    public String getAccountReference() {
        return accountReference;
    }
}
