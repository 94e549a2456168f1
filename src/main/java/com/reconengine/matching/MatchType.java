package com.reconengine.matching;

/**
 * How a proposed match was found.
 */
public enum MatchType {
    /**
     * Same amount on the same day, or confirmed by a learned rule.
     */
    EXACT,

    /**
     * Same amount a few days apart.
     */
    DATE_FUZZY,

    /**
     * Same amount with a similar party name.
     */
    PARTY_FUZZY
}
