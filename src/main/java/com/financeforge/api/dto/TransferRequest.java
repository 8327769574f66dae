package com.financeforge.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigDecimal;

/**
 * DTO for moving balance between two accounts.
 */
@Data
public class TransferRequest {

    @NotBlank(message = "Source account is required")
    private String fromAccountId;

    @NotBlank(message = "Destination account is required")
    private String toAccountId;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be positive")
    private BigDecimal amount;
}
