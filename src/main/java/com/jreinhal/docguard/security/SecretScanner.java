package com.jreinhal.docguard.security;

import com.jreinhal.docguard.model.SeverityClass;
import com.jreinhal.docguard.util.LogSanitizer;
import com.jreinhal.docguard.util.ShannonEntropy;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects and redacts credentials in free text.
 *
 * <p>Every rule of the {@link SecretPatternRegistry} runs in registry order. Matches pass
 * the false-positive heuristics of their rule; overlapping survivors are merged into one
 * finding covering their union (see {@link RedactionSpans}). Each finding is replaced by
 * {@code [REDACTED: TYPE]}, working from the highest offset down so earlier offsets stay valid.</p>
 *
 * <p>Pure and synchronous. Instances hold only immutable configuration and are shared
 * between threads.</p>
 */
public class SecretScanner {
    private static final Logger log = LoggerFactory.getLogger(SecretScanner.class);
    private static final Pattern LOWERCASE_HEX = Pattern.compile("^[a-f0-9]+$");
    private static final String[] URL_SCHEMES = {"http://", "https://"};

    private final SecretPatternRegistry registry;
    private final SecretScannerSettings settings;

    public SecretScanner(SecretPatternRegistry registry, SecretScannerSettings settings) {
        this.registry = registry;
        this.settings = settings;
    }

    public static SecretScanner withDefaults() {
        return new SecretScanner(SecretPatternRegistry.defaults(), SecretScannerSettings.defaults());
    }

    public static String marker(String typeName) {
        return "[REDACTED: " + typeName + "]";
    }

    public ScanResult scan(String text) {
        return this.scan(text, ScanOptions.defaults());
    }

    public ScanResult scan(String text, ScanOptions options) {
        if (text == null || text.isEmpty()) {
            return ScanResult.clean(text);
        }
        ScanOptions effective = options == null ? ScanOptions.defaults() : options;
        int contextLength = effective.contextLength() != null ? effective.contextLength() : this.settings.excerptChars();

        RedactionSpans accepted = new RedactionSpans();
        int suppressed = 0;
        for (SecretPattern rule : this.registry.patterns()) {
            Matcher matcher = rule.pattern().matcher(text);
            while (matcher.find()) {
                int start = matcher.start();
                int end = matcher.end();
                if (start == end) {
                    continue;
                }
                if (effective.skipFalsePositives() && this.isFalsePositive(rule, text, start, end)) {
                    suppressed++;
                    log.debug("Suppressed likely false positive for {} at offset {}", rule.typeName(), start);
                    continue;
                }
                if (accepted.add(rule, start, end)) {
                    log.debug("Merged {} at offset {} into an overlapping finding", rule.typeName(), start);
                }
            }
        }

        if (accepted.isEmpty()) {
            log.debug("Secret scan clean for {} ({} suppressed)", LogSanitizer.contentSummary(text), suppressed);
            return ScanResult.clean(text);
        }

        List<DetectedSecret> secrets = new ArrayList<>(accepted.spans().size());
        for (RedactionSpans.Span span : accepted.spans()) {
            String matched = text.substring(span.start(), span.end());
            secrets.add(new DetectedSecret(span.rule().typeName(), matched, span.start(), span.rule().severity(),
                    excerpt(text, span, contextLength)));
            log.warn("Secret detected: type={} severity={} offset={}", span.rule().typeName(), span.rule().severity(), span.start());
        }

        ScanResult result = ScanResult.of(secrets, accepted.apply(text));
        log.info("Secret scan complete for {}: {} secret(s), {} critical, {} suppressed",
                LogSanitizer.contentSummary(text), result.totalCount(), result.criticalCount(), suppressed);
        return result;
    }

    public String redact(String text) {
        return this.scan(text).redactedText();
    }

    public boolean containsSecrets(String text) {
        return this.scan(text).hasSecrets();
    }

    public Statistics statistics() {
        Map<SeverityClass, Integer> bySeverity = this.registry.countBySeverity();
        return new Statistics(this.registry.size(), bySeverity.get(SeverityClass.CRITICAL),
                bySeverity.get(SeverityClass.HIGH), bySeverity.get(SeverityClass.MEDIUM));
    }

    SecretScannerSettings settings() {
        return this.settings;
    }

    private boolean isFalsePositive(SecretPattern rule, String text, int start, int end) {
        return switch (rule.suppression()) {
            case NONE -> false;
            case PLACEHOLDER_CONTEXT -> this.hasPlaceholderNearby(text, start, end);
            case RANDOM_STRING_HEURISTIC -> this.isUnlikelyRandomSecret(text, start, end);
        };
    }

    private boolean isUnlikelyRandomSecret(String text, int start, int end) {
        String value = text.substring(start, end);
        if (LOWERCASE_HEX.matcher(value).matches()) {
            return true;
        }
        String before = text.substring(Math.max(0, start - this.settings.urlLookbehindChars()), start).toLowerCase(Locale.ROOT);
        for (String scheme : URL_SCHEMES) {
            if (before.contains(scheme)) {
                return true;
            }
        }
        return ShannonEntropy.bitsPerChar(value) < this.settings.entropyThreshold();
    }

    private boolean hasPlaceholderNearby(String text, int start, int end) {
        int window = this.settings.placeholderWindowChars();
        String context = text.substring(Math.max(0, start - window), Math.min(text.length(), end + window)).toLowerCase(Locale.ROOT);
        for (String marker : this.settings.placeholderMarkers()) {
            if (context.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Surrounding text of a finding with the finding itself replaced by its marker, so the
     * excerpt is safe to show a reviewer.
     */
    private static String excerpt(String text, RedactionSpans.Span span, int contextLength) {
        int from = Math.max(0, span.start() - contextLength);
        int to = Math.min(text.length(), span.end() + contextLength);
        return (from > 0 ? "..." : "")
                + text.substring(from, span.start())
                + marker(span.rule().typeName())
                + text.substring(span.end(), to)
                + (to < text.length() ? "..." : "");
    }

    public record Statistics(int totalPatterns, int criticalPatterns, int highPatterns, int mediumPatterns) {
    }
}
