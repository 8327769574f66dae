package com.financeforge.backup;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * First line of a backup file: what follows and the balances it must reproduce.
 */
@Value
@Builder
@Jacksonized
public class BackupHeader {

    public static final String FORMAT = "financeforge-ledger";
    public static final int VERSION = 1;

    String format;
    int version;
    Instant createdAt;
    long eventCount;
    /** Id of the last exported event; 0 for an empty log. */
    long highWaterMark;
    Map<String, BigDecimal> balances;
    Map<String, Long> sequences;
}
