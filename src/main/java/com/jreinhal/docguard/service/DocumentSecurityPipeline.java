package com.jreinhal.docguard.service;

import com.jreinhal.docguard.model.ParsedDocument;
import com.jreinhal.docguard.model.SensitivityLevel;
import com.jreinhal.docguard.security.InputSanitizer;
import com.jreinhal.docguard.security.SanitizationResult;
import com.jreinhal.docguard.security.ScanResult;
import com.jreinhal.docguard.security.SecretScanner;
import com.jreinhal.docguard.util.LogSanitizer;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry points that run the stages in pipeline order: assembled context is sanitized
 * before it reaches generation, generated text is scanned before storage, and
 * distribution always goes through the pre-distribution gate.
 */
@Service
public class DocumentSecurityPipeline {
    private static final Logger log = LoggerFactory.getLogger(DocumentSecurityPipeline.class);
    private final ContextAssembler contextAssembler;
    private final InputSanitizer inputSanitizer;
    private final SecretScanner secretScanner;
    private final PreDistributionValidator preDistributionValidator;
    private final SecurityEventService securityEventService;

    public DocumentSecurityPipeline(ContextAssembler contextAssembler, InputSanitizer inputSanitizer, SecretScanner secretScanner,
                                    PreDistributionValidator preDistributionValidator, SecurityEventService securityEventService) {
        this.contextAssembler = contextAssembler;
        this.inputSanitizer = inputSanitizer;
        this.secretScanner = secretScanner;
        this.preDistributionValidator = preDistributionValidator;
        this.securityEventService = securityEventService;
    }

    /**
     * Assembles context for {@code primaryPath} and sanitizes the primary body and every
     * admitted context body.
     */
    public PreparedContext prepareContext(String primaryPath, ContextAssemblyOptions options) {
        ContextAssemblyResult assembly = this.contextAssembler.assemble(primaryPath, options);
        SanitizedDocument primary = this.sanitizeDocument(assembly.primaryDocument());
        List<SanitizedDocument> context = new ArrayList<>(assembly.admittedContextDocuments().size());
        for (ParsedDocument document : assembly.admittedContextDocuments()) {
            context.add(this.sanitizeDocument(document));
        }
        return new PreparedContext(assembly, primary, context);
    }

    public SanitizationResult sanitizeInput(String resource, String text) {
        SanitizationResult result = this.inputSanitizer.sanitize(text);
        if (result.flagged()) {
            this.securityEventService.sanitizationFlagged(resource, result.reason(), result.removedDescriptions());
        }
        return result;
    }

    /**
     * Scans text before it is stored or cached. Callers persist {@link ScanResult#redactedText()}.
     */
    public ScanResult prepareForStorage(String text) {
        ScanResult result = this.secretScanner.scan(text);
        if (result.hasSecrets()) {
            log.warn("Redacted {} secret(s) before storage: types={}", result.totalCount(), result.detectedTypes());
        }
        return result;
    }

    /**
     * @throws DistributionBlockedException when the content must not be distributed
     */
    public ValidationResult releaseForDistribution(String content, DistributionMetadata metadata, ValidationOptions options) {
        ValidationResult result = this.preDistributionValidator.validate(content, metadata, options);
        if (!result.valid()) {
            log.warn("Distribution held for manual review: document={}", LogSanitizer.sanitize(metadata == null ? null : metadata.documentId()));
        }
        return result;
    }

    private SanitizedDocument sanitizeDocument(ParsedDocument document) {
        return new SanitizedDocument(document.path(), document.sensitivity(), this.sanitizeInput(document.path(), document.body()));
    }

    public record SanitizedDocument(String path, SensitivityLevel sensitivity, SanitizationResult sanitization) {

        public String text() {
            return this.sanitization.sanitizedText();
        }
    }

    public record PreparedContext(ContextAssemblyResult assembly, SanitizedDocument primary, List<SanitizedDocument> context) {

        public PreparedContext {
            context = List.copyOf(context);
        }

        public boolean anyFlagged() {
            return this.primary.sanitization().flagged() || this.context.stream().anyMatch(d -> d.sanitization().flagged());
        }
    }
}
