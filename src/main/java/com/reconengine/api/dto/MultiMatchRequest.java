package com.reconengine.api.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

/**
 * DTO for reconciling several ledger transactions with several counterparty transactions.
 */
@Data
public class MultiMatchRequest {

    @NotEmpty(message = "At least one ledger transaction ID is required")
    private List<String> ledgerTransactionIds;

    @NotEmpty(message = "At least one counterparty transaction ID is required")
    private List<String> counterpartyTransactionIds;
}
