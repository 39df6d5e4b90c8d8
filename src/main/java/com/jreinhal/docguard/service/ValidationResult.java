package com.jreinhal.docguard.service;

import com.jreinhal.docguard.security.ScanResult;
import java.util.List;

/**
 * Outcome of the pre-distribution gate.
 *
 * <p>{@code valid=false} always carries at least one blocking reason. {@code hardBlock}
 * separates a secret or blocking-keyword finding from a strict-mode manual review hold.</p>
 */
public record ValidationResult(boolean valid, List<String> errors, List<String> warnings, List<String> blockingReasons,
                               ScanResult scanResult, boolean hardBlock) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        blockingReasons = List.copyOf(blockingReasons);
        if (!valid && blockingReasons.isEmpty()) {
            throw new IllegalStateException("An invalid result must name at least one blocking reason");
        }
        if (hardBlock && valid) {
            throw new IllegalStateException("A hard block cannot be valid");
        }
    }

    public boolean requiresManualReview() {
        return !this.valid;
    }
}
