package com.jreinhal.docguard.service;

import java.util.List;

/**
 * Destination for content that must not be distributed until a human approves it.
 */
public interface ManualReviewQueue {

    void submit(ReviewRequest request);

    record ReviewRequest(String documentId, String documentName, String requestedBy, String reason, List<String> detectedTypes) {
        public ReviewRequest {
            detectedTypes = detectedTypes == null ? List.of() : List.copyOf(detectedTypes);
        }
    }
}
