package com.jreinhal.docguard.model;

import java.util.List;

public record ParsedDocument(String path, DocumentMetadata metadata, String body, String rawContent, List<String> validationErrors) {

    public ParsedDocument {
        validationErrors = validationErrors == null ? List.of() : List.copyOf(validationErrors);
    }

    public boolean isValid() {
        return validationErrors.isEmpty();
    }

    public SensitivityLevel sensitivity() {
        return metadata.sensitivity();
    }

    /**
     * Level used when this document is the primary: an unparseable declaration
     * fails closed to the lowest level, so it admits as little as possible.
     */
    public SensitivityLevel effectiveLevelAsPrimary() {
        return metadata.sensitivityValid() ? metadata.sensitivity() : SensitivityLevel.PUBLIC;
    }

    /**
     * Level used when this document is a context candidate: an unparseable
     * declaration fails closed to the highest level.
     */
    public SensitivityLevel effectiveLevelAsContext() {
        return metadata.sensitivityValid() ? metadata.sensitivity() : SensitivityLevel.RESTRICTED;
    }
}
