package com.jreinhal.docguard.service;

import com.jreinhal.docguard.security.DetectedSecret;
import com.jreinhal.docguard.security.KeywordPolicy;
import com.jreinhal.docguard.security.ScanOptions;
import com.jreinhal.docguard.security.ScanResult;
import com.jreinhal.docguard.security.SecretScanner;
import com.jreinhal.docguard.util.LogSanitizer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last gate before any post or publish action.
 *
 * <p>The secret scan always runs, whatever an upstream stage reported. Any detected
 * secret or blocking keyword is a hard block: the item is queued for manual review, a
 * security event is emitted and {@link #validate} throws {@link DistributionBlockedException}.
 * Warning keywords are informational unless strict mode is requested.</p>
 */
public class PreDistributionValidator {
    private static final Logger log = LoggerFactory.getLogger(PreDistributionValidator.class);
    static final String MANUAL_REVIEW_REQUIRED = "manual review required";
    private static final int ALERT_CONTEXT_CHARS = 100;
    private static final String RULE = "-".repeat(80);

    private final SecretScanner secretScanner;
    private final KeywordPolicy keywordPolicy;
    private final SecurityEventService securityEventService;
    private final ManualReviewQueue manualReviewQueue;

    public PreDistributionValidator(SecretScanner secretScanner, KeywordPolicy keywordPolicy,
                                    SecurityEventService securityEventService, ManualReviewQueue manualReviewQueue) {
        this.secretScanner = secretScanner;
        this.keywordPolicy = keywordPolicy;
        this.securityEventService = securityEventService;
        this.manualReviewQueue = manualReviewQueue;
    }

    /**
     * Validates content and throws on a hard block. A strict-mode hold is returned as
     * {@code valid=false} with reason {@value #MANUAL_REVIEW_REQUIRED}.
     *
     * @throws DistributionBlockedException when a secret or blocking keyword is found
     */
    public ValidationResult validate(String content, DistributionMetadata metadata, ValidationOptions options) {
        ValidationResult result = this.evaluate(content, metadata, options);
        if (result.hardBlock()) {
            ScanResult scan = result.scanResult();
            String message = scan != null && scan.hasSecrets()
                    ? "Cannot distribute content containing secrets. Found: " + String.join(", ", scan.detectedTypes())
                    : "Pre-distribution validation failed: " + String.join("; ", result.blockingReasons());
            throw new DistributionBlockedException(message, result);
        }
        return result;
    }

    /**
     * Same decision and side effects as {@link #validate}, returned instead of thrown.
     */
    public ValidationResult evaluate(String content, DistributionMetadata metadata, ValidationOptions options) {
        String text = content == null ? "" : content;
        DistributionMetadata meta = metadata == null ? DistributionMetadata.unknown() : metadata;
        ValidationOptions opts = options == null ? ValidationOptions.defaults() : options;
        String documentId = LogSanitizer.sanitize(meta.documentId());

        log.info("Pre-distribution validation started: document={} content={} strictMode={}",
                documentId, LogSanitizer.contentSummary(text), opts.strictMode());
        if (meta.upstreamScanClean()) {
            log.debug("Upstream stage reported a clean scan for {}; re-scanning regardless", documentId);
        }

        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> blockingReasons = new ArrayList<>();

        ScanResult scan = this.secretScanner.scan(text, ScanOptions.defaults().withContextLength(ALERT_CONTEXT_CHARS));
        if (scan.hasSecrets()) {
            String types = String.join(", ", scan.detectedTypes());
            log.error("SECRETS DETECTED IN DISTRIBUTION CONTENT: document={} count={} critical={} types={}",
                    documentId, scan.totalCount(), scan.criticalCount(), types);
            errors.add("Secrets detected in content: " + types);
            blockingReasons.add("Found " + scan.totalCount() + " secrets (" + scan.criticalCount() + " critical)");
            this.securityEventService.secretsBlocked(meta.requestedBy(), meta.documentId(), scan.detectedTypes(),
                    scan.totalCount(), scan.criticalCount(), this.formatSecretAlertBody(text, meta, scan));
        }

        List<String> blockingKeywords = new ArrayList<>();
        for (KeywordPolicy.KeywordRule rule : this.keywordPolicy.rules()) {
            if (!rule.matches(text)) {
                continue;
            }
            if (rule.action() == KeywordPolicy.Action.BLOCK) {
                log.error("Blocking keyword detected: keyword='{}' document={}", rule.keyword(), documentId);
                errors.add(rule.message());
                blockingReasons.add(rule.message());
                blockingKeywords.add(rule.keyword());
            } else {
                log.warn("Suspicious keyword detected: keyword='{}' document={}", rule.keyword(), documentId);
                warnings.add(rule.message());
            }
        }

        if (!errors.isEmpty()) {
            log.error("Pre-distribution validation FAILED: document={} reasons={}", documentId, blockingReasons);
            if (!scan.hasSecrets()) {
                this.securityEventService.distributionBlocked(meta.requestedBy(), meta.documentId(), blockingKeywords, blockingReasons);
            }
            this.flagForManualReview(meta, String.join("; ", errors), scan);
            return new ValidationResult(false, errors, warnings, blockingReasons, scan, true);
        }

        if (!warnings.isEmpty()) {
            log.warn("Pre-distribution validation passed with {} warning(s): document={}", warnings.size(), documentId);
            if (opts.strictMode() && !opts.allowWarnings()) {
                log.warn("Strict mode: holding document={} for manual review due to warnings", documentId);
                this.securityEventService.manualReviewRequested(meta.requestedBy(), meta.documentId(), warnings);
                this.flagForManualReview(meta, String.join("; ", warnings), scan);
                return new ValidationResult(false, List.of("Strict mode: manual review required due to warnings"),
                        warnings, List.of(MANUAL_REVIEW_REQUIRED), scan, false);
            }
        }

        log.info("Pre-distribution validation PASSED: document={}", documentId);
        return new ValidationResult(true, List.of(), warnings, List.of(), scan, false);
    }

    public Statistics statistics() {
        return new Statistics(this.keywordPolicy.rules().size(),
                (int) this.keywordPolicy.count(KeywordPolicy.Action.BLOCK),
                (int) this.keywordPolicy.count(KeywordPolicy.Action.WARN));
    }

    private void flagForManualReview(DistributionMetadata metadata, String reason, ScanResult scan) {
        this.manualReviewQueue.submit(new ManualReviewQueue.ReviewRequest(metadata.documentId(), metadata.documentName(),
                metadata.requestedBy(), reason, List.copyOf(scan.detectedTypes())));
    }

    /**
     * Alert text for the security team. Secret values never appear: each finding is listed
     * by type, severity, offset and its already-redacted excerpt.
     */
    String formatSecretAlertBody(String content, DistributionMetadata metadata, ScanResult scan) {
        StringBuilder body = new StringBuilder();
        body.append("CRITICAL SECURITY ALERT\n\n");
        body.append("Secrets detected in content scheduled for distribution.\n");
        body.append("Distribution has been BLOCKED automatically.\n\n");
        section(body, "DOCUMENT INFORMATION");
        body.append("  Document ID: ").append(orNa(metadata.documentId())).append('\n');
        body.append("  Document Name: ").append(orNa(metadata.documentName())).append('\n');
        body.append("  Author: ").append(orNa(metadata.author())).append('\n');
        body.append("  Target Channel: ").append(orNa(metadata.channel())).append('\n');
        body.append("  Content Length: ").append(content.length()).append(" characters\n\n");
        section(body, "SECRETS DETECTED");
        body.append("  Total Secrets: ").append(scan.totalCount()).append('\n');
        body.append("  Critical Secrets: ").append(scan.criticalCount()).append("\n\n");
        body.append("Secret Details:\n");
        for (DetectedSecret secret : scan.secrets()) {
            body.append("  * ").append(secret.type()).append(" (").append(secret.severity()).append(")\n");
            body.append("    Location: Character ").append(secret.offset()).append('\n');
            body.append("    Context: ").append(LogSanitizer.sanitize(secret.surroundingExcerpt())).append("\n\n");
        }
        section(body, "IMMEDIATE ACTIONS REQUIRED");
        body.append("  1. Review the source document immediately\n");
        body.append("  2. Identify why secrets were included in the document\n");
        body.append("  3. Rotate any exposed credentials as a precaution\n");
        body.append("  4. Review other recent documents from the same author\n\n");
        body.append("Distribution Status: BLOCKED\n");
        body.append("Timestamp: ").append(Instant.now()).append('\n');
        return body.toString();
    }

    private static void section(StringBuilder body, String title) {
        body.append(RULE).append('\n').append(title).append('\n').append(RULE).append("\n\n");
    }

    private static String orNa(String value) {
        return value == null || value.isBlank() ? "N/A" : LogSanitizer.sanitize(value);
    }

    public record Statistics(int totalKeywordRules, int blockingRules, int warningRules) {
    }
}
