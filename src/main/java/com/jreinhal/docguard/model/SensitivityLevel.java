package com.jreinhal.docguard.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Ordered document sensitivity classification.
 *
 * public (0) &lt; internal (1) &lt; confidential (2) &lt; restricted (3)
 *
 * A document may include context documents at its own level or below. Comparisons
 * always go through {@link #level()}, never through label equality.
 */
public enum SensitivityLevel {
    PUBLIC(0, "public"),
    INTERNAL(1, "internal"),
    CONFIDENTIAL(2, "confidential"),
    RESTRICTED(3, "restricted");

    private final int level;
    private final String label;

    SensitivityLevel(int level, String label) {
        this.level = level;
        this.label = label;
    }

    public int level() {
        return level;
    }

    public String label() {
        return label;
    }

    /**
     * Check if a document at this level may include a context document at the given level.
     */
    public boolean canInclude(SensitivityLevel context) {
        return this.level >= context.level;
    }

    public boolean isHigherThan(SensitivityLevel other) {
        return this.level > other.level;
    }

    /**
     * Case-sensitive lookup by metadata label ("public", "internal", ...).
     */
    public static Optional<SensitivityLevel> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        for (SensitivityLevel candidate : values()) {
            if (candidate.label.equals(label)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    public static List<String> labels() {
        return Arrays.stream(values()).map(SensitivityLevel::label).toList();
    }

    @Override
    public String toString() {
        return label;
    }
}
