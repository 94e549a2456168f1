package com.reconengine.api.controller;

import com.reconengine.api.dto.UpdateRuleRequest;
import com.reconengine.rules.ReconciliationRule;
import com.reconengine.rules.ReconciliationRuleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for learned reconciliation rules.
 */
@RestController
@RequestMapping("/api/v1/reconciliation/rules")
@RequiredArgsConstructor
@Tag(name = "Reconciliation Rules", description = "Learned matching rules API")
public class ReconciliationRuleController {

    private final ReconciliationRuleService ruleService;

    @GetMapping
    @Operation(summary = "List learned rules")
    public ResponseEntity<List<ReconciliationRule>> listRules(
            @RequestHeader(ReconciliationController.USER_HEADER) String userId) {
        return ResponseEntity.ok(ruleService.listRules(userId));
    }

    @PatchMapping("/{ruleId}")
    @Operation(summary = "Enable or disable a rule")
    public ResponseEntity<ReconciliationRule> updateRule(
            @RequestHeader(ReconciliationController.USER_HEADER) String userId,
            @PathVariable String ruleId,
            @Valid @RequestBody UpdateRuleRequest request) {
        return ResponseEntity.ok(ruleService.setRuleActive(userId, ruleId, request.getActive()));
    }

    @DeleteMapping("/{ruleId}")
    @Operation(summary = "Delete a rule")
    public ResponseEntity<Void> deleteRule(
            @RequestHeader(ReconciliationController.USER_HEADER) String userId,
            @PathVariable String ruleId) {
        ruleService.deleteRule(userId, ruleId);
        return ResponseEntity.noContent().build();
    }
}
