package com.financeforge.reconciliation;

public enum ReviewReason {
    AMBIGUOUS_REFERENCE,
    LARGE_DRIFT,
    STALE_STATEMENT,
    CONCURRENT_CHANGE
}
