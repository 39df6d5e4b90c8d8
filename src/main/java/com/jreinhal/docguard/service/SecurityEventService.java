package com.jreinhal.docguard.service;

import com.jreinhal.docguard.model.SecurityEvent;
import com.jreinhal.docguard.model.SensitivityLevel;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Builds security events for the pipeline stages and hands them to the configured sinks.
 *
 * <p>Emission is synchronous. A sink failure is logged; with
 * {@code docguard.audit.fail-closed=true} it also aborts the calling operation.</p>
 */
@Service
public class SecurityEventService {
    private static final Logger log = LoggerFactory.getLogger(SecurityEventService.class);
    private final List<SecurityEventSink> sinks;
    @Value(value="${docguard.audit.fail-closed:false}")
    private boolean failClosed;

    public SecurityEventService(List<SecurityEventSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    public void emit(SecurityEvent event) {
        for (SecurityEventSink sink : this.sinks) {
            try {
                sink.publish(event);
                log.debug("Security event emitted: {} - {} - {}", event.getEventType(), event.getRequestingIdentity(), event.getAction());
            }
            catch (RuntimeException e) {
                log.error("CRITICAL: Failed to emit security event: {} - {}", event.getEventType(), e.getMessage());
                if (this.failClosed) {
                    throw new SecurityEventFailureException("Security event emission failed - operation halted. Event: "
                            + event.getEventType() + ", Error: " + e.getMessage(), e);
                }
            }
        }
    }

    public void contextAccessDenied(String requestedBy, String primaryPath, SensitivityLevel primaryLevel,
                                    String contextPath, SensitivityLevel contextLevel) {
        SecurityEvent event = SecurityEvent.create(SecurityEvent.EventType.CONTEXT_ACCESS_DENIED, SecurityEvent.Severity.HIGH,
                        requestedBy, "Context document rejected by sensitivity hierarchy")
                .withResource(contextPath)
                .withOutcome(SecurityEvent.Outcome.DENIED, "Context sensitivity " + contextLevel + " exceeds primary sensitivity " + primaryLevel)
                .withMetadata("primaryDocument", primaryPath)
                .withMetadata("primarySensitivity", primaryLevel.label())
                .withMetadata("contextDocument", contextPath)
                .withMetadata("contextSensitivity", contextLevel.label());
        this.emit(event);
    }

    public void contextAssembled(String requestedBy, String primaryPath, int admitted, int rejected) {
        SecurityEvent event = SecurityEvent.create(SecurityEvent.EventType.CONTEXT_ASSEMBLED, SecurityEvent.Severity.INFO,
                        requestedBy, "Context assembled")
                .withResource(primaryPath)
                .withMetadata("admitted", admitted)
                .withMetadata("rejected", rejected);
        this.emit(event);
    }

    public void secretsBlocked(String requestedBy, String documentId, Collection<String> detectedTypes,
                               int totalCount, int criticalCount, String alertBody) {
        SecurityEvent event = SecurityEvent.create(SecurityEvent.EventType.SECRET_DETECTION_BLOCKED,
                        criticalCount > 0 ? SecurityEvent.Severity.CRITICAL : SecurityEvent.Severity.HIGH,
                        requestedBy, "Distribution blocked: secrets detected")
                .withResource(documentId)
                .withOutcome(SecurityEvent.Outcome.BLOCKED, "Found " + totalCount + " secrets (" + criticalCount + " critical)")
                .withDetectedTypes(detectedTypes)
                .withMetadata("totalSecrets", totalCount)
                .withMetadata("criticalSecrets", criticalCount)
                .withMetadata("alert", alertBody);
        this.emit(event);
    }

    public void distributionBlocked(String requestedBy, String documentId, Collection<String> blockingKeywords, List<String> reasons) {
        SecurityEvent event = SecurityEvent.create(SecurityEvent.EventType.DISTRIBUTION_BLOCKED, SecurityEvent.Severity.HIGH,
                        requestedBy, "Distribution blocked: blocking keyword policy")
                .withResource(documentId)
                .withOutcome(SecurityEvent.Outcome.BLOCKED, String.join("; ", reasons))
                .withDetectedTypes(blockingKeywords);
        this.emit(event);
    }

    public void manualReviewRequested(String requestedBy, String documentId, List<String> warnings) {
        SecurityEvent event = SecurityEvent.create(SecurityEvent.EventType.MANUAL_REVIEW_REQUESTED, SecurityEvent.Severity.MEDIUM,
                        requestedBy, "Distribution held for manual review")
                .withResource(documentId)
                .withOutcome(SecurityEvent.Outcome.PENDING, String.join("; ", warnings));
        this.emit(event);
    }

    public void sanitizationFlagged(String resource, String reason, List<String> removedDescriptions) {
        SecurityEvent event = SecurityEvent.create(SecurityEvent.EventType.SANITIZATION_FLAGGED, SecurityEvent.Severity.MEDIUM,
                        null, "Input sanitization flagged content")
                .withResource(resource)
                .withOutcome(SecurityEvent.Outcome.SUCCESS, reason)
                .withMetadata("findings", removedDescriptions.size());
        this.emit(event);
    }

    public static class SecurityEventFailureException
    extends RuntimeException {
        public SecurityEventFailureException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
