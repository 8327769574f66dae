package com.financeforge.backup;

import lombok.Value;

import java.time.Instant;

@Value
public class BackupSummary {
    Instant createdAt;
    long eventCount;
    long highWaterMark;
    int accountCount;
}
