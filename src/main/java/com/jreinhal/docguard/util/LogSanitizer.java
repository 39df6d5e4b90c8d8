package com.jreinhal.docguard.util;

import java.util.regex.Pattern;

public final class LogSanitizer {
    // Control characters enable log injection/forging
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final int MAX_VALUE_LENGTH = 200;

    private LogSanitizer() {
    }

    /**
     * Loggable fingerprint of document content: length and hash, never the text itself.
     */
    public static String contentSummary(String content) {
        if (content == null) {
            return "[len=0,id=none]";
        }
        int len = content.length();
        String id = Integer.toHexString(content.hashCode());
        return "[len=" + len + ",id=" + id + "]";
    }

    /**
     * Strip control characters and line breaks from values (paths, reasons) before they reach log output.
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = CONTROL_CHARS.matcher(value).replaceAll("")
                .replace("\r", "")
                .replace("\n", " ");
        if (cleaned.length() > MAX_VALUE_LENGTH) {
            return cleaned.substring(0, MAX_VALUE_LENGTH) + "...";
        }
        return cleaned;
    }
}
