package com.financeforge.accounts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Terms of a credit account being registered.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountRegistration {

    private String accountId;
    private String displayName;
    private AccountKind kind;
    private BigDecimal apr;
    private BigDecimal creditLimit;
    private LocalDate promoRateExpiry;
    private BigDecimal minimumPayment;
}
