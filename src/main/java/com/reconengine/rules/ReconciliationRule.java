package com.reconengine.rules;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A learned association between a narration pattern and a counterparty party name.
 *
 * Created on the first manual match for a pattern and reinforced by every later one.
 * Rules are never removed automatically.
 */
@Entity
@Table(name = "reconciliation_rules",
    uniqueConstraints = @UniqueConstraint(name = "uk_rule_user_pattern",
        columnNames = {"user_id", "bank_pattern_type", "bank_pattern_value"}),
    indexes = @Index(name = "idx_rule_user_id", columnList = "user_id"))
@Data
@NoArgsConstructor
public class ReconciliationRule {

    @Id
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "bank_pattern_type", nullable = false)
    private PatternType bankPatternType;

    @Column(name = "bank_pattern_value", nullable = false)
    private String bankPatternValue;

    @Column(name = "vyapar_party_name", nullable = false)
    private String counterpartyPartyName;

    /**
     * How many times this rule has been confirmed.
     */
    private int matchCount;

    /**
     * Higher priority rules are preferred.
     */
    private int priority;

    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    private Instant updatedAt;

    public ReconciliationRule(String userId, NarrationPattern pattern, String counterpartyPartyName, int priority) {
        this.id = UUID.randomUUID().toString();
        this.userId = userId;
        this.bankPatternType = pattern.getType();
        this.bankPatternValue = pattern.getValue();
        this.counterpartyPartyName = counterpartyPartyName;
        this.matchCount = 1;
        this.priority = priority;
        this.active = true;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    public NarrationPattern getPattern() {
        return new NarrationPattern(bankPatternType, bankPatternValue);
    }

    public void reinforce(String confirmedPartyName) {
        this.matchCount++;
        this.counterpartyPartyName = confirmedPartyName;
        this.updatedAt = Instant.now();
    }

    public void changeActive(boolean active) {
        this.active = active;
        this.updatedAt = Instant.now();
    }
}
