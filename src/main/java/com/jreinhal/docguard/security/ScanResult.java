package com.jreinhal.docguard.security;

import com.jreinhal.docguard.model.SeverityClass;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable outcome of a single {@link SecretScanner} run. Secrets are ordered by offset.
 */
public record ScanResult(boolean hasSecrets, List<DetectedSecret> secrets, String redactedText, int totalCount, int criticalCount) {

    public ScanResult {
        secrets = List.copyOf(secrets);
    }

    static ScanResult of(List<DetectedSecret> secrets, String redactedText) {
        int critical = (int) secrets.stream().filter(s -> s.severity() == SeverityClass.CRITICAL).count();
        return new ScanResult(!secrets.isEmpty(), secrets, redactedText, secrets.size(), critical);
    }

    public static ScanResult clean(String text) {
        return new ScanResult(false, List.of(), text == null ? "" : text, 0, 0);
    }

    /** Distinct detected type names in order of first occurrence. */
    public Set<String> detectedTypes() {
        Set<String> types = new LinkedHashSet<>();
        for (DetectedSecret secret : this.secrets) {
            types.add(secret.type());
        }
        return types;
    }

    public long countBySeverity(SeverityClass severity) {
        return this.secrets.stream().filter(s -> s.severity() == severity).count();
    }
}
