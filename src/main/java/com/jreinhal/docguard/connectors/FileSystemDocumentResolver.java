package com.jreinhal.docguard.connectors;

import com.jreinhal.docguard.util.LogSanitizer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves relative document paths against a list of allowed base directories, tried in
 * order. A path that normalizes outside its base directory is never resolved.
 */
public class FileSystemDocumentResolver implements DocumentResolver {
    private static final Logger log = LoggerFactory.getLogger(FileSystemDocumentResolver.class);
    static final String NOT_FOUND = "File not found in allowed directories";

    private final List<Path> baseDirectories;

    public FileSystemDocumentResolver(List<Path> baseDirectories) {
        if (baseDirectories == null || baseDirectories.isEmpty()) {
            throw new IllegalArgumentException("At least one base directory is required");
        }
        this.baseDirectories = baseDirectories.stream().map(p -> p.toAbsolutePath().normalize()).toList();
    }

    @Override
    public ResolvedDocument resolve(String path) {
        if (path == null || path.isBlank()) {
            return ResolvedDocument.missing(path, "Empty document path");
        }
        for (Path base : this.baseDirectories) {
            Path candidate;
            try {
                candidate = base.resolve(path).normalize();
            }
            catch (InvalidPathException e) {
                log.warn("Invalid document path rejected: {}", LogSanitizer.sanitize(path));
                return ResolvedDocument.missing(path, "Invalid path");
            }
            if (!candidate.startsWith(base)) {
                log.warn("Path traversal attempt blocked: {}", LogSanitizer.sanitize(path));
                return ResolvedDocument.missing(path, "Path outside allowed directories");
            }
            if (Files.isRegularFile(candidate)) {
                return ResolvedDocument.found(path, candidate.toString());
            }
        }
        log.debug("Document not found in {} base directories: {}", this.baseDirectories.size(), LogSanitizer.sanitize(path));
        return ResolvedDocument.missing(path, NOT_FOUND);
    }

    @Override
    public String read(ResolvedDocument document) throws IOException {
        if (document == null || !document.exists() || document.resolvedLocation() == null) {
            throw new NoSuchFileException(document == null ? "null" : document.path(), null,
                    "Document does not exist: " + (document == null || document.error() == null ? "unknown error" : document.error()));
        }
        Path location = Path.of(document.resolvedLocation()).toAbsolutePath().normalize();
        if (this.baseDirectories.stream().noneMatch(location::startsWith)) {
            throw new IOException("Resolved location is outside allowed directories: " + LogSanitizer.sanitize(document.path()));
        }
        return Files.readString(location, StandardCharsets.UTF_8);
    }

    public List<Path> getBaseDirectories() {
        return this.baseDirectories;
    }
}
