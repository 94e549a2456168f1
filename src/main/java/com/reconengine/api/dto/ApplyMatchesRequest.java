package com.reconengine.api.dto;

import com.reconengine.ledger.LedgerSource;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

/**
 * DTO for applying matches the user accepted.
 */
@Data
public class ApplyMatchesRequest {

    @NotEmpty(message = "At least one match is required")
    @Valid
    private List<AcceptedMatch> matches;

    @Data
    public static class AcceptedMatch {

        @NotBlank(message = "Ledger transaction ID is required")
        private String ledgerTransactionId;

        /**
         * Optional; echoed back from the proposal when known.
         */
        private LedgerSource ledgerSource;

        @NotBlank(message = "Counterparty transaction ID is required")
        private String counterpartyTransactionId;
    }
}
