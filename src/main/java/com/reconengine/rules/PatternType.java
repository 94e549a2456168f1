package com.reconengine.rules;

import java.util.regex.Pattern;

/**
 * Payment rails whose narrations carry a recognisable counterparty token.
 *
 * Constants are declared in lookup order; the first rail found in a narration wins.
 */
public enum PatternType {
    /**
     * UPI-PartyName/...
     */
    UPI_NAME("upi_name", "\\bUPI[-/]([^/]+)/"),

    /**
     * NEFT-RefNo/PartyName/...
     */
    NEFT_NAME("neft_name", "\\bNEFT[-/][^/]+/([^/]+)"),

    /**
     * RTGS-RefNo/PartyName/...
     */
    RTGS_NAME("rtgs_name", "\\bRTGS[-/][^/]+/([^/]+)"),

    /**
     * IMPS-RefNo/PartyName/...
     */
    IMPS_NAME("imps_name", "\\bIMPS[-/][^/]+/([^/]+)");

    private final String code;
    private final Pattern railPattern;

    PatternType(String code, String railRegex) {
        this.code = code;
        this.railPattern = Pattern.compile(railRegex, Pattern.CASE_INSENSITIVE);
    }

    public String getCode() {
        return code;
    }

    /**
     * Pattern whose first group captures the counterparty token.
     */
    public Pattern getRailPattern() {
        return railPattern;
    }
}
