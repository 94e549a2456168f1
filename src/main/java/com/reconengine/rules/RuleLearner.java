package com.reconengine.rules;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Turns user-confirmed matches into reusable rules.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RuleLearner {

    private final PatternExtractor patternExtractor;
    private final RuleStore ruleStore;

    /**
     * Learn from a manual match.
     *
     * Narrations without a recognisable payment rail, and counterparty entries without
     * a party name, teach nothing; that is not an error.
     *
     * @return the created or reinforced rule, or empty if nothing was learned
     */
    public Optional<ReconciliationRule> learn(String userId, String narration, String partyName) {
        if (userId == null || partyName == null || partyName.isBlank()) {
            log.debug("Skipping rule learning: no user or party name");
            return Optional.empty();
        }

        Optional<NarrationPattern> pattern = patternExtractor.extractPattern(narration);
        if (pattern.isEmpty()) {
            log.debug("Skipping rule learning: no pattern in narration '{}'", narration);
            return Optional.empty();
        }

        return Optional.of(ruleStore.upsertRule(userId, pattern.get(), partyName.trim()));
    }
}
