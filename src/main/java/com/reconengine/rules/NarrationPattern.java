package com.reconengine.rules;

import lombok.Value;

/**
 * A typed token extracted from a bank narration, e.g. (UPI_NAME, "ACMECORP").
 *
 * The value is always trimmed and upper case so it can be compared directly.
 */
@Value
public class NarrationPattern {
    PatternType type;
    String value;
}
