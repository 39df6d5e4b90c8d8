package com.jreinhal.docguard.service;

import com.jreinhal.docguard.model.ParsedDocument;
import java.util.List;

/**
 * Primary document plus the context documents admitted for it, in declared order.
 * Rejections are part of a successful result, never errors.
 */
public record ContextAssemblyResult(ParsedDocument primaryDocument, List<ParsedDocument> admittedContextDocuments,
                                    List<String> warnings, List<RejectedContext> rejectedContexts) {

    public ContextAssemblyResult {
        admittedContextDocuments = List.copyOf(admittedContextDocuments);
        warnings = List.copyOf(warnings);
        rejectedContexts = List.copyOf(rejectedContexts);
    }

    public List<String> admittedPaths() {
        return this.admittedContextDocuments.stream().map(ParsedDocument::path).toList();
    }

    public record RejectedContext(String path, String reason) {
    }
}
