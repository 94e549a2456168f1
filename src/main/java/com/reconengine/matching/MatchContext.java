package com.reconengine.matching;

import com.reconengine.ledger.LedgerTransaction;
import com.reconengine.rules.NarrationPattern;
import com.reconengine.rules.PatternExtractor;
import com.reconengine.rules.ReconciliationRule;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-run lookup state shared by the tiers.
 *
 * Indexes the rule set by pattern and caches narration parsing per ledger transaction,
 * so each narration is parsed once per run regardless of how many candidates it meets.
 */
public class MatchContext {

    private final Map<NarrationPattern, ReconciliationRule> rulesByPattern = new HashMap<>();
    private final Map<String, Optional<NarrationPattern>> patternsByLedgerId = new HashMap<>();
    private final Map<String, String> partyNamesByLedgerId = new HashMap<>();
    private final PatternExtractor patternExtractor;
    private final SimilarityScorer similarityScorer;

    public MatchContext(List<ReconciliationRule> rules, PatternExtractor patternExtractor,
                        SimilarityScorer similarityScorer) {
        this.patternExtractor = patternExtractor;
        this.similarityScorer = similarityScorer;

        // rules arrive in priority order; the first rule for a pattern wins
        if (rules != null) {
            for (ReconciliationRule rule : rules) {
                if (rule.isActive() && rule.getBankPatternType() != null && rule.getBankPatternValue() != null) {
                    rulesByPattern.putIfAbsent(rule.getPattern(), rule);
                }
            }
        }
    }

    public Optional<NarrationPattern> patternFor(LedgerTransaction ledger) {
        return patternsByLedgerId.computeIfAbsent(ledger.getId(),
            id -> patternExtractor.extractPattern(ledger.getNarration()));
    }

    public Optional<ReconciliationRule> ruleFor(NarrationPattern pattern) {
        return Optional.ofNullable(rulesByPattern.get(pattern));
    }

    public String partyNameFor(LedgerTransaction ledger) {
        return partyNamesByLedgerId.computeIfAbsent(ledger.getId(),
            id -> similarityScorer.extractPartyName(ledger.getNarration()));
    }

    public double similarity(String a, String b) {
        return similarityScorer.similarity(a, b);
    }

    public int ruleCount() {
        return rulesByPattern.size();
    }
}
