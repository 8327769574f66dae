package com.financeforge.api.dto;

import com.financeforge.reconciliation.ExternalStatementRecord;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

@Data
public class StatementRecordRequest {

    @NotBlank(message = "Account reference is required")
    private String accountReference;

    @NotNull(message = "Balance is required")
    private BigDecimal balance;

    /**
     * Statement time; defaults to now.
     */
    private Instant asOf;

    public ExternalStatementRecord toRecord() {
        return new ExternalStatementRecord(accountReference, balance, asOf);
    }
}
