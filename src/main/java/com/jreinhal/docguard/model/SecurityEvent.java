package com.jreinhal.docguard.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class SecurityEvent {
    private final Instant timestamp;
    private EventType eventType;
    private Severity severity;
    private String requestingIdentity;
    private String action;
    private String resource;
    private Outcome outcome;
    private String outcomeReason;
    private final List<String> detectedTypes = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    private SecurityEvent() {
        this.timestamp = Instant.now();
    }

    public static SecurityEvent create(EventType type, Severity severity, String requestingIdentity, String action) {
        SecurityEvent event = new SecurityEvent();
        event.eventType = type;
        event.severity = severity;
        event.requestingIdentity = requestingIdentity == null || requestingIdentity.isBlank() ? "unknown" : requestingIdentity;
        event.action = action;
        event.outcome = Outcome.SUCCESS;
        return event;
    }

    public SecurityEvent withResource(String resource) {
        this.resource = resource;
        return this;
    }

    public SecurityEvent withOutcome(Outcome outcome, String reason) {
        this.outcome = outcome;
        this.outcomeReason = reason;
        return this;
    }

    public SecurityEvent withDetectedTypes(Collection<String> types) {
        if (types != null) {
            for (String type : types) {
                if (!this.detectedTypes.contains(type)) {
                    this.detectedTypes.add(type);
                }
            }
        }
        return this;
    }

    public SecurityEvent withMetadata(String key, Object value) {
        this.metadata.put(key, value);
        return this;
    }

    public Instant getTimestamp() {
        return this.timestamp;
    }

    public EventType getEventType() {
        return this.eventType;
    }

    public Severity getSeverity() {
        return this.severity;
    }

    public String getRequestingIdentity() {
        return this.requestingIdentity;
    }

    public String getAction() {
        return this.action;
    }

    public String getResource() {
        return this.resource;
    }

    public Outcome getOutcome() {
        return this.outcome;
    }

    public String getOutcomeReason() {
        return this.outcomeReason;
    }

    public List<String> getDetectedTypes() {
        return List.copyOf(this.detectedTypes);
    }

    public Map<String, Object> getMetadata() {
        return this.metadata;
    }

    public static enum EventType {
        SECRET_DETECTION_BLOCKED,
        DISTRIBUTION_BLOCKED,
        MANUAL_REVIEW_REQUESTED,
        CONTEXT_ACCESS_DENIED,
        CONTEXT_ASSEMBLED,
        SANITIZATION_FLAGGED;

    }

    public static enum Severity {
        INFO,
        LOW,
        MEDIUM,
        HIGH,
        CRITICAL;

    }

    public static enum Outcome {
        SUCCESS,
        BLOCKED,
        DENIED,
        PENDING;

    }
}
