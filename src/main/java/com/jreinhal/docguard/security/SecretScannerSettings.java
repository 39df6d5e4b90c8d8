package com.jreinhal.docguard.security;

import java.util.List;
import java.util.Locale;

/**
 * Tunables for the false-positive suppression heuristics of {@link SecretScanner}.
 */
public record SecretScannerSettings(double entropyThreshold, int urlLookbehindChars, int placeholderWindowChars,
                                    List<String> placeholderMarkers, int excerptChars) {

    public static final List<String> DEFAULT_PLACEHOLDER_MARKERS = List.of("example", "placeholder", "test", "dummy", "fake");

    public SecretScannerSettings {
        if (entropyThreshold < 0.0) {
            throw new IllegalArgumentException("entropyThreshold must be non-negative");
        }
        if (urlLookbehindChars < 0 || placeholderWindowChars < 0 || excerptChars < 0) {
            throw new IllegalArgumentException("Window sizes must be non-negative");
        }
        placeholderMarkers = placeholderMarkers == null ? DEFAULT_PLACEHOLDER_MARKERS
                : placeholderMarkers.stream().map(m -> m.trim().toLowerCase(Locale.ROOT)).filter(m -> !m.isEmpty()).toList();
    }

    public static SecretScannerSettings defaults() {
        return new SecretScannerSettings(3.0, 100, 100, DEFAULT_PLACEHOLDER_MARKERS, 50);
    }

    public SecretScannerSettings withEntropyThreshold(double threshold) {
        return new SecretScannerSettings(threshold, this.urlLookbehindChars, this.placeholderWindowChars, this.placeholderMarkers, this.excerptChars);
    }
}
