package com.financeforge.alerts;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class Alert {
    String kind;
    AlertSeverity severity;
    String subject;
    String message;
    Instant triggeredAt;
}
