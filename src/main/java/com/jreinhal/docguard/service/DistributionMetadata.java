package com.jreinhal.docguard.service;

/**
 * Descriptive data about content headed for distribution. Used for alerts, audit
 * events and review requests.
 *
 * <p>{@code upstreamScanClean} records what an earlier stage claimed. The validator
 * logs it and scans anyway.</p>
 */
public record DistributionMetadata(String documentId, String documentName, String author, String channel,
                                   String requestedBy, boolean upstreamScanClean) {

    public static DistributionMetadata of(String documentId, String requestedBy) {
        return new DistributionMetadata(documentId, null, null, null, requestedBy, false);
    }

    public static DistributionMetadata unknown() {
        return new DistributionMetadata(null, null, null, null, null, false);
    }
}
