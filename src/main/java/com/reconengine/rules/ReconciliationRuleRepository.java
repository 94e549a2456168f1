package com.reconengine.rules;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for learned reconciliation rules.
 */
@Repository
public interface ReconciliationRuleRepository extends JpaRepository<ReconciliationRule, String> {

    List<ReconciliationRule> findByUserIdAndActiveTrueOrderByPriorityDescMatchCountDesc(String userId);

    List<ReconciliationRule> findByUserIdOrderByMatchCountDescPriorityDesc(String userId);

    Optional<ReconciliationRule> findByUserIdAndBankPatternTypeAndBankPatternValue(
        String userId, PatternType bankPatternType, String bankPatternValue);

    Optional<ReconciliationRule> findByIdAndUserId(String id, String userId);
}
