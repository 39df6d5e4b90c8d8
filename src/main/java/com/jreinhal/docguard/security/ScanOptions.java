package com.jreinhal.docguard.security;

/**
 * Per-call scan options.
 *
 * @param skipFalsePositives apply the suppression heuristics (default {@code true})
 * @param contextLength      characters of surrounding text kept on each side of a finding;
 *                           {@code null} uses the scanner's configured excerpt length
 */
public record ScanOptions(boolean skipFalsePositives, Integer contextLength) {

    public ScanOptions {
        if (contextLength != null && contextLength < 0) {
            throw new IllegalArgumentException("contextLength must be non-negative");
        }
    }

    public static ScanOptions defaults() {
        return new ScanOptions(true, null);
    }

    public ScanOptions withoutFalsePositiveSuppression() {
        return new ScanOptions(false, this.contextLength);
    }

    public ScanOptions withContextLength(int contextLength) {
        return new ScanOptions(this.skipFalsePositives, contextLength);
    }
}
