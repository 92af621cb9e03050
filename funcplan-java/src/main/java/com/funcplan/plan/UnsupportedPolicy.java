package com.funcplan.plan;

import java.util.Locale;

/**
 * What the builder does with a statement it cannot model.
 */
public enum UnsupportedPolicy {
    /** Emit a {@code Statement} placeholder and record a warning. */
    PLACEHOLDER,
    /** Fail the build with {@link UnsupportedConstructException}. */
    ABORT;

    public static UnsupportedPolicy parse(String value) {
        if (value == null) {
            return PLACEHOLDER;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown unsupported-construct policy: " + value
                    + " (expected placeholder or abort)", e);
        }
    }
}
