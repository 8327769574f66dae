package com.financeforge.api.dto;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
public class BalanceResponse {
    String accountId;
    BigDecimal balance;
    long sequence;
    Instant asOf;
}
