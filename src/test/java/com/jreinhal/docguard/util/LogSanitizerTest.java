package com.jreinhal.docguard.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Test
    void stripsLineBreaksAndControlCharacters() {
        assertEquals("docs/a.md forged line", LogSanitizer.sanitize("docs/a.md\r\nforged\u0007 line"));
    }

    @Test
    void nullBecomesEmpty() {
        assertEquals("", LogSanitizer.sanitize(null));
    }

    @Test
    void truncatesLongValues() {
        String sanitized = LogSanitizer.sanitize("x".repeat(500));

        assertEquals(203, sanitized.length());
        assertTrue(sanitized.endsWith("..."));
    }

    @Test
    void contentSummaryNeverContainsContent() {
        String summary = LogSanitizer.contentSummary("password: hunter2");

        assertTrue(summary.startsWith("[len=17,id="));
        assertFalse(summary.contains("hunter2"));
        assertEquals("[len=0,id=none]", LogSanitizer.contentSummary(null));
    }
}
