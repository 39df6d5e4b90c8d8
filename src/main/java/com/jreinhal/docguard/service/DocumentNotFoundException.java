package com.jreinhal.docguard.service;

public class DocumentNotFoundException
extends RuntimeException {
    private final String path;

    public DocumentNotFoundException(String path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public String getPath() {
        return this.path;
    }
}
