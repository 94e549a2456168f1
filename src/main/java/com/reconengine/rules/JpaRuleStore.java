package com.reconengine.rules;

import com.reconengine.common.exception.ReconciliationStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link RuleStore} over the reconciliation rules table.
 */
@Component
@Slf4j
public class JpaRuleStore implements RuleStore {

    private static final String STORE_NAME = "rule";

    private final ReconciliationRuleRepository repository;
    private final int manualPriority;

    public JpaRuleStore(
            ReconciliationRuleRepository repository,
            @Value("${recon-engine.rules.manual-priority:10}") int manualPriority) {
        this.repository = repository;
        this.manualPriority = manualPriority;
    }

    @Override
    public List<ReconciliationRule> listActiveRules(String userId) {
        return execute("listActiveRules",
            () -> repository.findByUserIdAndActiveTrueOrderByPriorityDescMatchCountDesc(userId));
    }

    @Override
    public List<ReconciliationRule> listRules(String userId) {
        return execute("listRules", () -> repository.findByUserIdOrderByMatchCountDescPriorityDesc(userId));
    }

    @Override
    public Optional<ReconciliationRule> findById(String userId, String ruleId) {
        return execute("findById", () -> repository.findByIdAndUserId(ruleId, userId));
    }

    @Override
    public ReconciliationRule upsertRule(String userId, NarrationPattern pattern, String partyName) {
        return execute("upsertRule", () -> {
            Optional<ReconciliationRule> existing = repository
                .findByUserIdAndBankPatternTypeAndBankPatternValue(userId, pattern.getType(), pattern.getValue());

            if (existing.isPresent()) {
                ReconciliationRule rule = existing.get();
                rule.reinforce(partyName);
                log.info("Reinforced rule {} ({} {}) -> {}, matchCount={}",
                    rule.getId(), pattern.getType().getCode(), pattern.getValue(), partyName, rule.getMatchCount());
                return repository.save(rule);
            }

            ReconciliationRule rule = new ReconciliationRule(userId, pattern, partyName, manualPriority);
            log.info("Learned rule {} ({} {}) -> {}",
                rule.getId(), pattern.getType().getCode(), pattern.getValue(), partyName);
            return repository.save(rule);
        });
    }

    @Override
    public ReconciliationRule save(ReconciliationRule rule) {
        return execute("save", () -> repository.save(rule));
    }

    @Override
    public void delete(ReconciliationRule rule) {
        execute("delete", () -> {
            repository.delete(rule);
            return null;
        });
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("Rule store operation {} failed", operation, e);
            throw new ReconciliationStoreException(
                "Rule store operation failed: " + operation, STORE_NAME, operation, e);
        }
    }
}
