package com.financeforge.api.dto;

import com.financeforge.accounts.AccountKind;
import com.financeforge.accounts.AccountRegistration;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * DTO for registering a credit account, optionally with its current balance.
 */
@Data
public class RegisterAccountRequest {

    @NotBlank(message = "Account ID is required")
    private String accountId;

    @NotBlank(message = "Display name is required")
    private String displayName;

    @NotNull(message = "Account kind is required")
    private AccountKind kind;

    @NotNull(message = "APR is required")
    @DecimalMin(value = "0", message = "APR cannot be negative")
    @DecimalMax(value = "1", message = "APR is a fraction, at most 1")
    private BigDecimal apr;

    @PositiveOrZero(message = "Credit limit cannot be negative")
    private BigDecimal creditLimit;

    private LocalDate promoRateExpiry;

    @PositiveOrZero(message = "Minimum payment cannot be negative")
    private BigDecimal minimumPayment;

    /**
     * Amount owed at registration; recorded as the account's first event.
     */
    private BigDecimal openingBalance;

    public AccountRegistration toRegistration() {
        return AccountRegistration.builder()
            .accountId(accountId)
            .displayName(displayName)
            .kind(kind)
            .apr(apr)
            .creditLimit(creditLimit)
            .promoRateExpiry(promoRateExpiry)
            .minimumPayment(minimumPayment)
            .build();
    }
}
