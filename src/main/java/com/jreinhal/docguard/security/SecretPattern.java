package com.jreinhal.docguard.security;

import com.jreinhal.docguard.model.SeverityClass;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One detection rule of the secret registry.
 *
 * <p>{@code suppression} selects which false-positive heuristic applies to matches
 * of this rule before they are reported.</p>
 */
public record SecretPattern(String typeName, Pattern pattern, SeverityClass severity, String description, Suppression suppression) {

    public SecretPattern {
        Objects.requireNonNull(typeName, "typeName");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(severity, "severity");
        suppression = suppression == null ? Suppression.NONE : suppression;
    }

    public static SecretPattern of(String typeName, String regex, SeverityClass severity, String description) {
        return new SecretPattern(typeName, Pattern.compile(regex), severity, description, Suppression.NONE);
    }

    public static SecretPattern generic(String typeName, String regex, SeverityClass severity, String description) {
        return new SecretPattern(typeName, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), severity, description, Suppression.PLACEHOLDER_CONTEXT);
    }

    public static SecretPattern heuristic(String typeName, String regex, SeverityClass severity, String description) {
        return new SecretPattern(typeName, Pattern.compile(regex), severity, description, Suppression.RANDOM_STRING_HEURISTIC);
    }

    public static enum Suppression {
        /** Every match is reported. */
        NONE,
        /** Suppressed when a placeholder marker ("example", "dummy", ...) appears nearby. */
        PLACEHOLDER_CONTEXT,
        /** Catch-all: suppressed for lowercase hex, URL context, or low entropy. */
        RANDOM_STRING_HEURISTIC;

    }
}
