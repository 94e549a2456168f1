package com.reconengine.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class UpdateRuleRequest {

    @NotNull(message = "Active flag is required")
    private Boolean active;
}
