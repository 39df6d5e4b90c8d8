package com.jreinhal.docguard.connectors;

import java.io.IOException;

/**
 * Read-only access to document storage. Implementations may block on network I/O;
 * callers impose their own timeouts.
 */
public interface DocumentResolver {

    /**
     * Locates a document. An unknown path is reported through {@link ResolvedDocument#exists()},
     * not thrown.
     */
    ResolvedDocument resolve(String path);

    /**
     * Reads the text of a document previously returned by {@link #resolve(String)} with
     * {@code exists=true}.
     */
    String read(ResolvedDocument document) throws IOException;
}
