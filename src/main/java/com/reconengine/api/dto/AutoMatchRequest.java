package com.reconengine.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.LocalDate;
import java.util.List;

/**
 * DTO for running automatic matching over a date window.
 */
@Data
public class AutoMatchRequest {

    @NotNull(message = "Start date is required")
    private LocalDate startDate;

    @NotNull(message = "End date is required")
    private LocalDate endDate;

    /**
     * Restrict the ledger side to these accounts; empty means all accounts.
     */
    private List<String> accountIds;

    /**
     * Apply every proposal in the same call.
     */
    private boolean apply;
}
