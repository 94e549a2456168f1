package com.reconengine.rules;

import com.reconengine.common.exception.RuleNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Service for managing a user's learned rules.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationRuleService {

    private final RuleStore ruleStore;

    @Transactional(readOnly = true)
    public List<ReconciliationRule> listRules(String userId) {
        return ruleStore.listRules(userId);
    }

    @Transactional
    public ReconciliationRule setRuleActive(String userId, String ruleId, boolean active) {
        ReconciliationRule rule = ruleStore.findById(userId, ruleId)
            .orElseThrow(() -> new RuleNotFoundException(ruleId));
        rule.changeActive(active);
        ReconciliationRule saved = ruleStore.save(rule);
        log.info("Rule {} is now {}", ruleId, active ? "active" : "inactive");
        return saved;
    }

    @Transactional
    public void deleteRule(String userId, String ruleId) {
        ReconciliationRule rule = ruleStore.findById(userId, ruleId)
            .orElseThrow(() -> new RuleNotFoundException(ruleId));
        ruleStore.delete(rule);
        log.info("Deleted rule {}", ruleId);
    }
}
