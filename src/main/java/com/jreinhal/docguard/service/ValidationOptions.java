package com.jreinhal.docguard.service;

/**
 * @param strictMode    hold content with warning-level findings for manual review
 * @param allowWarnings in strict mode, let warnings through anyway
 */
public record ValidationOptions(boolean strictMode, boolean allowWarnings) {

    public static ValidationOptions defaults() {
        return new ValidationOptions(false, false);
    }

    public static ValidationOptions strict() {
        return new ValidationOptions(true, false);
    }
}
