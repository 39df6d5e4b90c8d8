package com.jreinhal.docguard.service;

import java.util.List;

/**
 * Primary document metadata is invalid and the caller asked for validation errors to be fatal.
 */
public class DocumentValidationException
extends RuntimeException {
    private final String path;
    private final List<String> errors;

    public DocumentValidationException(String path, String message, List<String> errors) {
        super(message);
        this.path = path;
        this.errors = List.copyOf(errors);
    }

    public String getPath() {
        return this.path;
    }

    public List<String> getErrors() {
        return this.errors;
    }
}
