package com.jreinhal.docguard.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.jreinhal.docguard.model.SecurityEvent;
import java.io.UncheckedIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes each security event as one JSON object per line to the {@code SECURITY_AUDIT} logger.
 */
@Component
public class LoggingSecurityEventSink implements SecurityEventSink {
    static final String AUDIT_LOGGER_NAME = "SECURITY_AUDIT";
    private static final Logger auditLog = LoggerFactory.getLogger(AUDIT_LOGGER_NAME);

    private final ObjectMapper objectMapper;

    public LoggingSecurityEventSink(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public void publish(SecurityEvent event) {
        String json = this.toJson(event);
        switch (event.getSeverity()) {
            case CRITICAL, HIGH -> auditLog.error(json);
            case MEDIUM, LOW -> auditLog.warn(json);
            default -> auditLog.info(json);
        }
    }

    String toJson(SecurityEvent event) {
        try {
            return this.objectMapper.writeValueAsString(event);
        }
        catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize security event " + event.getEventType(), e);
        }
    }
}
