package com.reconengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * DTO for matching a pair by hand.
 */
@Data
public class ManualMatchRequest {

    @NotBlank(message = "Ledger transaction ID is required")
    private String ledgerTransactionId;

    @NotBlank(message = "Counterparty transaction ID is required")
    private String counterpartyTransactionId;
}
