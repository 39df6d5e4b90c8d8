package com.jreinhal.docguard.util;

import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import com.jreinhal.docguard.security.RedactionSpans;
import com.jreinhal.docguard.security.SecretPattern;
import com.jreinhal.docguard.security.SecretPatternRegistry;
import com.jreinhal.docguard.security.SecretScanner;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Best-effort credential scrubbing for log output, registered as {@code %maskedMsg}.
 *
 * Applies every rule of the default secret registry except the long-random-string
 * catch-all, which would mangle hashes and identifiers in ordinary log lines. Matching
 * does not go through {@link SecretScanner#scan} because the scanner itself logs.
 */
public class SecretMaskingConverter extends ClassicConverter {
    private static final List<SecretPattern> RULES = SecretPatternRegistry.defaults().patterns().stream()
            .filter(p -> p.suppression() != SecretPattern.Suppression.RANDOM_STRING_HEURISTIC)
            .toList();

    @Override
    public String convert(ILoggingEvent event) {
        return mask(event.getFormattedMessage());
    }

    static String mask(String msg) {
        if (msg == null || msg.isEmpty()) {
            return "";
        }
        RedactionSpans spans = new RedactionSpans();
        for (SecretPattern rule : RULES) {
            Matcher matcher = rule.pattern().matcher(msg);
            while (matcher.find()) {
                if (matcher.end() > matcher.start()) {
                    spans.add(rule, matcher.start(), matcher.end());
                }
            }
        }
        return spans.isEmpty() ? msg : spans.apply(msg);
    }
}
