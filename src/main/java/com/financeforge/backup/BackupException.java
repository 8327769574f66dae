package com.financeforge.backup;

import com.financeforge.common.exception.FinanceForgeException;

/**
 * A backup could not be written or read.
 */
public class BackupException extends FinanceForgeException {

    public BackupException(String message, Throwable cause) {
        super(message, cause);
    }
}
