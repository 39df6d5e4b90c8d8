package com.jreinhal.docguard.model;

import java.util.List;

/**
 * Typed view of a document's frontmatter block.
 *
 * <p>{@code sensitivity} is the declared level when it parsed, otherwise the
 * default ({@link SensitivityLevel#INTERNAL}). {@code sensitivityValid} is false when
 * a value was declared but is not one of the four labels, or when the block could not
 * be read at all; callers decide how to treat such a document.</p>
 */
public record DocumentMetadata(
        SensitivityLevel sensitivity,
        boolean sensitivityDeclared,
        boolean sensitivityValid,
        String rawSensitivity,
        List<String> contextDocuments,
        List<String> tags,
        List<String> allowedAudiences,
        Boolean requiresApproval,
        Integer retentionDays,
        Boolean piiPresent,
        String title,
        String description,
        String version,
        String owner,
        String department) {

    public static final SensitivityLevel DEFAULT_SENSITIVITY = SensitivityLevel.INTERNAL;

    public DocumentMetadata {
        sensitivity = sensitivity == null ? DEFAULT_SENSITIVITY : sensitivity;
        contextDocuments = contextDocuments == null ? List.of() : List.copyOf(contextDocuments);
        tags = tags == null ? List.of() : List.copyOf(tags);
        allowedAudiences = allowedAudiences == null ? List.of() : List.copyOf(allowedAudiences);
    }

    /**
     * Metadata for a document with no frontmatter block.
     */
    public static DocumentMetadata defaults() {
        return new DocumentMetadata(DEFAULT_SENSITIVITY, false, true, null,
                List.of(), List.of(), List.of(), null, null, null, null, null, null, null, null);
    }

    /**
     * Metadata for a document whose frontmatter block exists but could not be read.
     * The level is unknown, so it is marked invalid.
     */
    public static DocumentMetadata unreadable() {
        return new DocumentMetadata(DEFAULT_SENSITIVITY, false, false, null,
                List.of(), List.of(), List.of(), null, null, null, null, null, null, null, null);
    }
}
