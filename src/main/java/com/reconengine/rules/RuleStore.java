package com.reconengine.rules;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of learned reconciliation rules, scoped per user.
 */
public interface RuleStore {

    /**
     * Active rules ordered by priority, then by reinforcement count, both descending.
     */
    List<ReconciliationRule> listActiveRules(String userId);

    /**
     * All rules ordered by reinforcement count, then by priority, both descending.
     */
    List<ReconciliationRule> listRules(String userId);

    Optional<ReconciliationRule> findById(String userId, String ruleId);

    /**
     * Insert a rule for the pattern, or reinforce the existing one.
     *
     * Reinforcing increments the match count and overwrites the party name with the
     * newly confirmed one; a pattern never has more than one rule per user.
     */
    ReconciliationRule upsertRule(String userId, NarrationPattern pattern, String partyName);

    ReconciliationRule save(ReconciliationRule rule);

    void delete(ReconciliationRule rule);
}
