package com.financeforge.ledger;

/**
 * Outcome of a command at the ledger boundary.
 */
public enum CommandStatus {
    /**
     * Events were appended by this call.
     */
    COMMITTED,

    /**
     * The idempotency key was already used; the original events are returned.
     */
    DUPLICATE,

    /**
     * Nothing to record (e.g. a stated balance equal to the projected one).
     */
    NO_OP
}
