package com.financeforge.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class BalanceUpdateRequest {

    @NotNull(message = "Balance is required")
    private BigDecimal balance;
}
