package com.jreinhal.docguard.security;

import com.jreinhal.docguard.model.SeverityClass;

/**
 * A match that survived false-positive suppression.
 *
 * @param offset start index of {@code matchedText} in the scanned text
 */
public record DetectedSecret(String type, String matchedText, int offset, SeverityClass severity, String surroundingExcerpt) {

    public int end() {
        return this.offset + this.matchedText.length();
    }
}
