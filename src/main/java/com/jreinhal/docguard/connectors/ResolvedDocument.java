package com.jreinhal.docguard.connectors;

public record ResolvedDocument(String path, boolean exists, String resolvedLocation, String error) {

    public static ResolvedDocument found(String path, String resolvedLocation) {
        return new ResolvedDocument(path, true, resolvedLocation, null);
    }

    public static ResolvedDocument missing(String path, String error) {
        return new ResolvedDocument(path, false, null, error);
    }
}
