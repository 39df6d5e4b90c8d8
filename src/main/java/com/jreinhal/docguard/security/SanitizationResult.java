package com.jreinhal.docguard.security;

import java.util.List;

/**
 * Outcome of {@link InputSanitizer#sanitize(String)}.
 *
 * @param removedDescriptions one entry per distinct hidden-text or injection technique found,
 *                            in detection order
 * @param reason              "; "-joined summary of the flag reasons, empty when not flagged
 */
public record SanitizationResult(String sanitizedText, boolean flagged, List<String> removedDescriptions, String reason) {

    public SanitizationResult {
        removedDescriptions = List.copyOf(removedDescriptions);
        reason = reason == null ? "" : reason;
    }
}
