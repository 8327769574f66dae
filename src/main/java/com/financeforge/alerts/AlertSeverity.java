package com.financeforge.alerts;

/**
 * Declared most severe first; alert lists sort by this order.
 */
public enum AlertSeverity {
    CRITICAL,
    WARNING,
    INFO
}
