package com.financeforge.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

/**
 * DTO for a batch of external statement records.
 */
@Data
public class ReconciliationRequest {

    @NotEmpty(message = "At least one record is required")
    private List<@Valid StatementRecordRequest> records;
}
