package com.reconengine.matching;

import com.reconengine.rules.PatternType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Edit-distance based similarity between free-text party names.
 */
@Component
public class SimilarityScorer {

    private static final List<Pattern> GENERIC_PARTY_PATTERNS = List.of(
        Pattern.compile("(?:TO|FROM)\\s+([A-Z][A-Za-z\\s]+)"),
        Pattern.compile("BY\\s+([A-Z][A-Za-z\\s]+)")
    );

    /**
     * Similarity in [0, 1]: {@code 1 - distance / max(length)}, compared case-insensitively.
     * Two empty strings are identical.
     */
    public double similarity(String a, String b) {
        String left = a == null ? "" : a.toLowerCase(Locale.ROOT);
        String right = b == null ? "" : b.toLowerCase(Locale.ROOT);

        int longest = Math.max(left.length(), right.length());
        if (longest == 0) {
            return 1.0;
        }

        return 1.0 - (double) editDistance(left, right) / longest;
    }

    /**
     * Best guess at the party name inside a bank narration.
     *
     * Tries the payment rail patterns first, then "TO/FROM/BY Name" forms, and falls back
     * to the whole narration.
     */
    public String extractPartyName(String narration) {
        if (narration == null) {
            return "";
        }

        for (PatternType type : PatternType.values()) {
            String token = firstGroup(type.getRailPattern(), narration);
            if (token != null) {
                return token;
            }
        }
        for (Pattern pattern : GENERIC_PARTY_PATTERNS) {
            String token = firstGroup(pattern, narration);
            if (token != null) {
                return token;
            }
        }

        return narration;
    }

    int editDistance(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }

        return previous[b.length()];
    }

    private String firstGroup(Pattern pattern, String narration) {
        Matcher matcher = pattern.matcher(narration);
        if (matcher.find()) {
            String token = matcher.group(1).trim();
            return token.isEmpty() ? null : token;
        }
        return null;
    }
}
