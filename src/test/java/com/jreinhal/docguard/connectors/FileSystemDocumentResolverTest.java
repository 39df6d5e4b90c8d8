package com.jreinhal.docguard.connectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemDocumentResolverTest {

    @TempDir
    Path root;

    private Path primaryDir;
    private Path sharedDir;
    private FileSystemDocumentResolver resolver;

    @BeforeEach
    void setUp() throws IOException {
        primaryDir = Files.createDirectories(root.resolve("docs"));
        sharedDir = Files.createDirectories(root.resolve("shared"));
        Files.createDirectories(primaryDir.resolve("policies"));
        Files.writeString(primaryDir.resolve("policies/retention.md"), "---\nsensitivity: internal\n---\nKeep it.", StandardCharsets.UTF_8);
        Files.writeString(sharedDir.resolve("glossary.md"), "Terms", StandardCharsets.UTF_8);
        Files.writeString(root.resolve("outside.md"), "not reachable", StandardCharsets.UTF_8);
        resolver = new FileSystemDocumentResolver(List.of(primaryDir, sharedDir));
    }

    @Test
    void resolvesAndReadsDocumentInFirstBaseDirectory() throws IOException {
        ResolvedDocument doc = resolver.resolve("policies/retention.md");

        assertTrue(doc.exists());
        assertEquals("policies/retention.md", doc.path());
        assertEquals("---\nsensitivity: internal\n---\nKeep it.", resolver.read(doc));
    }

    @Test
    void fallsBackToLaterBaseDirectories() throws IOException {
        ResolvedDocument doc = resolver.resolve("glossary.md");

        assertTrue(doc.exists());
        assertEquals("Terms", resolver.read(doc));
    }

    @Test
    void reportsMissingDocumentWithoutThrowing() {
        ResolvedDocument doc = resolver.resolve("policies/unknown.md");

        assertFalse(doc.exists());
        assertEquals(FileSystemDocumentResolver.NOT_FOUND, doc.error());
    }

    @Test
    void blocksPathTraversal() {
        ResolvedDocument doc = resolver.resolve("../outside.md");

        assertFalse(doc.exists());
        assertEquals("Path outside allowed directories", doc.error());
    }

    @Test
    void blocksAbsolutePathOutsideBaseDirectories() {
        ResolvedDocument doc = resolver.resolve(root.resolve("outside.md").toString());

        assertFalse(doc.exists());
        assertEquals("Path outside allowed directories", doc.error());
    }

    @Test
    void rejectsBlankPath() {
        assertEquals("Empty document path", resolver.resolve("  ").error());
    }

    @Test
    void readOfMissingDocumentThrows() {
        ResolvedDocument missing = ResolvedDocument.missing("x.md", "File not found in allowed directories");

        assertThrows(NoSuchFileException.class, () -> resolver.read(missing));
    }

    @Test
    void readRefusesLocationOutsideBaseDirectories() {
        ResolvedDocument forged = ResolvedDocument.found("outside.md", root.resolve("outside.md").toString());

        assertThrows(IOException.class, () -> resolver.read(forged));
    }

    @Test
    void requiresAtLeastOneBaseDirectory() {
        assertThrows(IllegalArgumentException.class, () -> new FileSystemDocumentResolver(List.of()));
    }
}
