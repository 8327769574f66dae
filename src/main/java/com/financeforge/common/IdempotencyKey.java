package com.financeforge.common;

import com.financeforge.common.exception.ValidationException;

import java.util.UUID;

/**
 * Utility class for generating and validating idempotency keys.
 * Commands carrying the same key are applied at most once.
 */
public final class IdempotencyKey {

    static final int MAX_LENGTH = 128;

    private IdempotencyKey() {
    }

    public static String generate() {
        return UUID.randomUUID().toString();
    }

    public static boolean isValid(String key) {
        if (key == null || key.trim().isEmpty()) {
            return false;
        }
        return key.length() <= MAX_LENGTH && key.equals(key.trim());
    }

    public static void validate(String key) {
        if (!isValid(key)) {
            throw new ValidationException("Invalid idempotency key: " + key);
        }
    }

    /**
     * Keys are optional on the command boundary; a present key must be valid.
     */
    public static void validateOptional(String key) {
        if (key != null) {
            validate(key);
        }
    }
}
