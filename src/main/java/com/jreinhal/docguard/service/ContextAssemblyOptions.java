package com.jreinhal.docguard.service;

/**
 * Per-call options for {@link ContextAssembler#assemble(String, ContextAssemblyOptions)}.
 *
 * @param maxContextDocuments cap for this call; {@code null} uses the configured default
 * @param requestedBy         identity recorded on security events
 */
public record ContextAssemblyOptions(Integer maxContextDocuments, boolean failOnValidationError,
                                     boolean allowCircularReferences, String requestedBy) {

    public ContextAssemblyOptions {
        if (maxContextDocuments != null && maxContextDocuments < 0) {
            throw new IllegalArgumentException("maxContextDocuments must be non-negative");
        }
    }

    public static ContextAssemblyOptions defaults() {
        return new ContextAssemblyOptions(null, false, false, null);
    }

    public ContextAssemblyOptions withMaxContextDocuments(int max) {
        return new ContextAssemblyOptions(max, this.failOnValidationError, this.allowCircularReferences, this.requestedBy);
    }

    public ContextAssemblyOptions withFailOnValidationError(boolean fail) {
        return new ContextAssemblyOptions(this.maxContextDocuments, fail, this.allowCircularReferences, this.requestedBy);
    }

    public ContextAssemblyOptions withAllowCircularReferences(boolean allow) {
        return new ContextAssemblyOptions(this.maxContextDocuments, this.failOnValidationError, allow, this.requestedBy);
    }

    public ContextAssemblyOptions withRequestedBy(String identity) {
        return new ContextAssemblyOptions(this.maxContextDocuments, this.failOnValidationError, this.allowCircularReferences, identity);
    }
}
