package com.jreinhal.docguard.service;

/**
 * @param maxContextDocuments default cap on declared context documents per assembly
 * @param resolveTimeoutMs    budget for resolving all context documents of one assembly;
 *                            documents still pending at the deadline count as not found
 */
public record ContextAssemblerSettings(int maxContextDocuments, long resolveTimeoutMs) {

    public ContextAssemblerSettings {
        if (maxContextDocuments < 0) {
            throw new IllegalArgumentException("maxContextDocuments must be non-negative");
        }
        if (resolveTimeoutMs <= 0L) {
            throw new IllegalArgumentException("resolveTimeoutMs must be positive");
        }
    }

    public static ContextAssemblerSettings defaults() {
        return new ContextAssemblerSettings(10, 5000L);
    }
}
