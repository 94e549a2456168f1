package com.reconengine.api.controller;

import com.reconengine.api.dto.*;
import com.reconengine.counterparty.CounterpartyTransaction;
import com.reconengine.matching.ProposedMatch;
import com.reconengine.reconciliation.*;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for matching and unmatching transactions.
 */
@RestController
@RequestMapping("/api/v1/reconciliation")
@RequiredArgsConstructor
@Tag(name = "Reconciliation", description = "Bank to business-ledger reconciliation API")
public class ReconciliationController {

    static final String USER_HEADER = "X-User-Id";

    private final ReconciliationService reconciliationService;
    private final MatchApplier matchApplier;
    private final MatchGroupManager matchGroupManager;
    private final MatchRepairService matchRepairService;

    @PostMapping("/auto-match")
    @Operation(summary = "Propose matches for a date window, optionally applying them")
    public ResponseEntity<AutoMatchResponse> autoMatch(
            @RequestHeader(USER_HEADER) String userId,
            @Valid @RequestBody AutoMatchRequest request) {

        List<ProposedMatch> matches = reconciliationService.autoReconcile(
            userId, request.getStartDate(), request.getEndDate(), request.getAccountIds());

        if (request.isApply() && !matches.isEmpty()) {
            int appliedCount = matchApplier.applyMatches(userId, matches);
            return ResponseEntity.ok(new AutoMatchResponse(matches, true, appliedCount));
        }
        return ResponseEntity.ok(new AutoMatchResponse(matches, false, 0));
    }

    @PostMapping("/apply-matches")
    @Operation(summary = "Apply accepted matches")
    public ResponseEntity<MatchResultResponse> applyMatches(
            @RequestHeader(USER_HEADER) String userId,
            @Valid @RequestBody ApplyMatchesRequest request) {

        List<ProposedMatch> accepted = request.getMatches().stream()
            .map(match -> ProposedMatch.builder()
                .ledgerTransactionId(match.getLedgerTransactionId())
                .ledgerSource(match.getLedgerSource())
                .counterpartyTransactionId(match.getCounterpartyTransactionId())
                .build())
            .toList();

        return ResponseEntity.ok(MatchResultResponse.applied(matchApplier.applyMatches(userId, accepted)));
    }

    @PostMapping("/manual-match")
    @Operation(summary = "Match a pair by hand and learn a rule from it")
    public ResponseEntity<MatchResultResponse> manualMatch(
            @RequestHeader(USER_HEADER) String userId,
            @Valid @RequestBody ManualMatchRequest request) {

        boolean matched = matchApplier.manualMatch(
            userId, request.getLedgerTransactionId(), request.getCounterpartyTransactionId());
        return ResponseEntity.ok(MatchResultResponse.of(matched));
    }

    @PostMapping("/multi-match")
    @Operation(summary = "Reconcile several ledger transactions with several counterparty transactions")
    public ResponseEntity<MatchResultResponse> multiMatch(
            @RequestHeader(USER_HEADER) String userId,
            @Valid @RequestBody MultiMatchRequest request) {

        String matchGroupId = matchGroupManager.multiMatch(
            userId, request.getLedgerTransactionIds(), request.getCounterpartyTransactionIds());
        return ResponseEntity.ok(MatchResultResponse.group(matchGroupId));
    }

    @PostMapping("/ledger/{ledgerId}/unmatch")
    @Operation(summary = "Undo the match of a ledger transaction")
    public ResponseEntity<MatchResultResponse> unmatch(
            @RequestHeader(USER_HEADER) String userId,
            @PathVariable String ledgerId) {
        return ResponseEntity.ok(MatchResultResponse.of(matchGroupManager.unmatch(userId, ledgerId)));
    }

    @PostMapping("/counterparty/{counterpartyId}/unmatch")
    @Operation(summary = "Undo the match of a counterparty transaction")
    public ResponseEntity<MatchResultResponse> unmatchCounterparty(
            @RequestHeader(USER_HEADER) String userId,
            @PathVariable String counterpartyId) {
        return ResponseEntity.ok(MatchResultResponse.of(matchGroupManager.unmatchCounterparty(userId, counterpartyId)));
    }

    @DeleteMapping("/match-groups/{matchGroupId}")
    @Operation(summary = "Dissolve a match group")
    public ResponseEntity<MatchResultResponse> unmatchGroup(
            @RequestHeader(USER_HEADER) String userId,
            @PathVariable String matchGroupId) {
        return ResponseEntity.ok(MatchResultResponse.of(matchGroupManager.unmatchGroup(userId, matchGroupId)));
    }

    @GetMapping("/match-groups/{matchGroupId}")
    @Operation(summary = "Get the members of a match group")
    public ResponseEntity<MatchGroup> getMatchGroup(@PathVariable String matchGroupId) {
        return matchGroupManager.getMatchGroup(matchGroupId)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/ledger/{ledgerId}/details")
    @Operation(summary = "Get every transaction linked to a ledger transaction")
    public ResponseEntity<MatchDetails> getLedgerMatchDetails(@PathVariable String ledgerId) {
        return ResponseEntity.ok(matchGroupManager.getLedgerMatchDetails(ledgerId));
    }

    @GetMapping("/counterparty/{counterpartyId}/details")
    @Operation(summary = "Get every transaction linked to a counterparty transaction")
    public ResponseEntity<MatchDetails> getCounterpartyMatchDetails(@PathVariable String counterpartyId) {
        return ResponseEntity.ok(matchGroupManager.getCounterpartyMatchDetails(counterpartyId));
    }

    @GetMapping("/orphaned-matches")
    @Operation(summary = "List counterparty transactions matched with something that no longer exists")
    public ResponseEntity<List<CounterpartyTransaction>> findOrphanedMatches(
            @RequestHeader(USER_HEADER) String userId) {
        return ResponseEntity.ok(matchRepairService.findOrphanedMatches(userId));
    }

    @PostMapping("/repair-matches")
    @Operation(summary = "Re-synchronize both sides of 1:1 matches")
    public ResponseEntity<RepairReport> repairMatches(@RequestHeader(USER_HEADER) String userId) {
        return ResponseEntity.ok(matchRepairService.repairMatches(userId));
    }
}
