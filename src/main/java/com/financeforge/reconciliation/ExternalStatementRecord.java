package com.financeforge.reconciliation;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A balance reported by an external source (statement, bank feed) for an account
 * identified by id or by name.
 */
@Value
public class ExternalStatementRecord {
    String accountReference;
    BigDecimal balance;
    Instant asOf;
}
