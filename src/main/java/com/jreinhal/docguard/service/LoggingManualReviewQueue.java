package com.jreinhal.docguard.service;

import com.jreinhal.docguard.util.LogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingManualReviewQueue implements ManualReviewQueue {
    private static final Logger log = LoggerFactory.getLogger(LoggingManualReviewQueue.class);

    @Override
    public void submit(ReviewRequest request) {
        log.warn("Flagging content for manual security review: document={} name={} requestedBy={} reason={} types={}",
                LogSanitizer.sanitize(request.documentId()), LogSanitizer.sanitize(request.documentName()),
                LogSanitizer.sanitize(request.requestedBy()), LogSanitizer.sanitize(request.reason()), request.detectedTypes());
    }
}
