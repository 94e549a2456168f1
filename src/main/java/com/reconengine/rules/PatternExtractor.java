package com.reconengine.rules;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Parses transfer narrations into {@link NarrationPattern}s for rule lookup and rule learning.
 */
@Component
public class PatternExtractor {

    /**
     * Extract the counterparty token of the first payment rail found in the narration.
     *
     * @param narration bank narration, may be null
     * @return the pattern, or empty if no rail marker is present
     */
    public Optional<NarrationPattern> extractPattern(String narration) {
        if (narration == null || narration.isBlank()) {
            return Optional.empty();
        }

        for (PatternType type : PatternType.values()) {
            Matcher matcher = type.getRailPattern().matcher(narration);
            if (matcher.find()) {
                String token = matcher.group(1).trim();
                if (token.isEmpty()) {
                    continue;
                }
                return Optional.of(new NarrationPattern(type, token.toUpperCase(Locale.ROOT)));
            }
        }

        return Optional.empty();
    }
}
