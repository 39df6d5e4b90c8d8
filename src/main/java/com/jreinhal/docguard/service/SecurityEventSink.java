package com.jreinhal.docguard.service;

import com.jreinhal.docguard.model.SecurityEvent;

/**
 * Transport for security events (log sink, webhook, ticket system).
 */
public interface SecurityEventSink {

    void publish(SecurityEvent event);
}
