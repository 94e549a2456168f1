package com.reconengine.matching;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Amount, date and name thresholds shared by the matching tiers.
 */
@Component
public class MatchCriteria {

    private final BigDecimal amountTolerance;
    private final int dateWindowDays;
    private final double partySimilarityThreshold;

    public MatchCriteria(
            @Value("${recon-engine.matching.amount-tolerance:0.01}") BigDecimal amountTolerance,
            @Value("${recon-engine.matching.date-window-days:7}") int dateWindowDays,
            @Value("${recon-engine.matching.party-similarity-threshold:0.8}") double partySimilarityThreshold) {
        this.amountTolerance = amountTolerance;
        this.dateWindowDays = dateWindowDays;
        this.partySimilarityThreshold = partySimilarityThreshold;
    }

    public static MatchCriteria defaults() {
        return new MatchCriteria(new BigDecimal("0.01"), 7, 0.8);
    }

    /**
     * Absolute amounts equal within the tolerance. Null never matches.
     */
    public boolean amountsMatch(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) {
            return false;
        }
        return a.abs().subtract(b.abs()).abs().compareTo(amountTolerance) <= 0;
    }

    public long daysApart(LocalDate a, LocalDate b) {
        return Math.abs(ChronoUnit.DAYS.between(a, b));
    }

    public boolean withinDateWindow(LocalDate a, LocalDate b) {
        return a != null && b != null && daysApart(a, b) <= dateWindowDays;
    }

    public boolean isSimilarParty(double similarity) {
        return similarity > partySimilarityThreshold;
    }
}
