package com.financeforge.reconciliation;

public enum ReconciliationStatus {
    /** Projection agrees with the external balance. */
    OK,
    /** An ADJUSTMENT event was appended to close the drift. */
    ADJUSTED,
    /** Nothing was appended; a person has to decide. */
    NEEDS_REVIEW,
    /** The reference matches no account. */
    NOT_FOUND,
    /** Storage failed while applying the record; nothing was appended. */
    FAILED
}
