package com.jreinhal.docguard.security;

import com.jreinhal.docguard.util.LogSanitizer;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First-contact sanitizer for externally sourced text.
 *
 * <p>Removes invisible-character obfuscation, CSS-hidden markup and instruction-override
 * payloads before the text is used as model input or stored as context. The
 * sanitizer is stateless and safe to share between threads.</p>
 */
public final class InputSanitizer {
    private static final Logger log = LoggerFactory.getLogger(InputSanitizer.class);

    public static final String REDACTION_TOKEN = "[REDACTED]";
    static final String REASON_HIDDEN_TEXT = "Hidden text detected";
    static final String REASON_INJECTION = "Prompt injection keywords detected";
    static final String REASON_INSTRUCTIONS = "Excessive instructional content detected";

    private static final Map<Character, String> INVISIBLE_CHARACTERS = new LinkedHashMap<>();
    private static final Map<Character, String> UNICODE_SPACES = new LinkedHashMap<>();

    static {
        INVISIBLE_CHARACTERS.put('\u200B', "Zero-width space");
        INVISIBLE_CHARACTERS.put('\u200C', "Zero-width non-joiner");
        INVISIBLE_CHARACTERS.put('\u200D', "Zero-width joiner");
        INVISIBLE_CHARACTERS.put('\uFEFF', "Zero-width no-break space (byte order mark)");
        INVISIBLE_CHARACTERS.put('\u2060', "Word joiner");
        INVISIBLE_CHARACTERS.put('\u00AD', "Soft hyphen");

        UNICODE_SPACES.put('\u00A0', "No-break space");
        for (char c = '\u2000'; c <= '\u200A'; c++) {
            UNICODE_SPACES.put(c, "Typographic space");
        }
        UNICODE_SPACES.put('\u202F', "Narrow no-break space");
        UNICODE_SPACES.put('\u205F', "Medium mathematical space");
        UNICODE_SPACES.put('\u3000', "Ideographic space");
    }

    private static final Pattern CSS_HIDDEN_ELEMENT = Pattern.compile(
            "<(\\w+)[^>]*\\bstyle\\s*=\\s*[\"'][^\"']*"
                    + "(?:(?<![-\\w])color\\s*:\\s*(?:white|#fff(?:fff)?\\b|transparent|rgba\\([^)]*,\\s*0(?:\\.0+)?\\s*\\))"
                    + "|opacity\\s*:\\s*0(?:\\.0+)?(?![.\\d])"
                    + "|display\\s*:\\s*none"
                    + "|visibility\\s*:\\s*hidden"
                    + "|font-size\\s*:\\s*0(?:px|pt|em|rem)?(?![.\\d]))"
                    + "[^\"']*[\"'][^>]*>.*?</\\1\\s*>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern OPENING_TAG = Pattern.compile("^<[^>]*>");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n?");
    private static final Pattern MULTI_SPACE_PATTERN = Pattern.compile("[ \\t]+");
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{3,}");
    private static final Pattern WORD_SPLIT = Pattern.compile("\\s+");
    private static final Pattern NON_WORD_PATTERN = Pattern.compile("[^\\p{IsAlphabetic}\\p{IsDigit}]+");

    private final double instructionDensityThreshold;
    private final int instructionDensityMinWords;
    private final double maxRemovalRatio;

    public InputSanitizer(double instructionDensityThreshold, int instructionDensityMinWords, double maxRemovalRatio) {
        this.instructionDensityThreshold = instructionDensityThreshold;
        this.instructionDensityMinWords = instructionDensityMinWords;
        this.maxRemovalRatio = maxRemovalRatio;
    }

    public static InputSanitizer withDefaults() {
        return new InputSanitizer(0.10, 10, 0.90);
    }

    public SanitizationResult sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return new SanitizationResult("", false, List.of(), "");
        }
        List<String> removed = new ArrayList<>();
        List<String> reasons = new ArrayList<>();

        String working = Normalizer.normalize(text, Normalizer.Form.NFC);

        boolean hiddenText = false;
        working = this.stripInvisibleCharacters(working, removed);
        hiddenText |= !removed.isEmpty();
        int before = removed.size();
        working = this.redactHiddenMarkup(working, removed);
        hiddenText |= removed.size() > before;
        if (hiddenText) {
            reasons.add(REASON_HIDDEN_TEXT);
        }

        // Density is measured before redaction so that neutralized phrases still count.
        String densityFinding = this.checkInstructionDensity(working);

        before = removed.size();
        working = this.redactInjectionPatterns(working, removed);
        if (removed.size() > before) {
            reasons.add(REASON_INJECTION);
        }

        if (densityFinding != null) {
            removed.add(densityFinding);
            reasons.add(REASON_INSTRUCTIONS);
        }

        working = normalizeWhitespace(working);
        boolean flagged = !reasons.isEmpty();
        String reason = String.join("; ", reasons);
        if (flagged) {
            log.warn("Input sanitization flagged content {}: {} ({} finding(s))", LogSanitizer.contentSummary(text), reason, removed.size());
        }
        return new SanitizationResult(working, flagged, removed, reason);
    }

    /**
     * Checks a sanitization outcome. Fails when a known injection phrasing survived in
     * {@code sanitized}, or when more than the configured share of {@code original} was removed.
     */
    public boolean validate(String original, String sanitized) {
        String output = sanitized == null ? "" : sanitized;
        for (InjectionPatternLibrary.InjectionPattern injection : InjectionPatternLibrary.getPatterns()) {
            if (injection.pattern().matcher(output).find()) {
                log.warn("Sanitization validation failed: pattern '{}' survived", injection.description());
                return false;
            }
        }
        if (original == null || original.isEmpty()) {
            return true;
        }
        double removedRatio = (double) (original.length() - output.length()) / original.length();
        if (removedRatio > this.maxRemovalRatio) {
            log.warn("Sanitization validation failed: {}% of content removed", Math.round(removedRatio * 100.0));
            return false;
        }
        return true;
    }

    private String stripInvisibleCharacters(String text, List<String> removed) {
        Map<Character, Integer> invisible = new LinkedHashMap<>();
        Map<Character, Integer> spaces = new LinkedHashMap<>();
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (INVISIBLE_CHARACTERS.containsKey(c)) {
                invisible.merge(c, 1, Integer::sum);
            } else if (UNICODE_SPACES.containsKey(c)) {
                spaces.merge(c, 1, Integer::sum);
                sb.append(' ');
            } else {
                sb.append(c);
            }
        }
        invisible.forEach((c, count) -> removed.add(String.format(Locale.ROOT, "%s (U+%04X) removed, %d occurrence(s)",
                INVISIBLE_CHARACTERS.get(c), (int) c, count)));
        spaces.forEach((c, count) -> removed.add(String.format(Locale.ROOT, "%s (U+%04X) replaced with a regular space, %d occurrence(s)",
                UNICODE_SPACES.get(c), (int) c, count)));
        return sb.toString();
    }

    private String redactHiddenMarkup(String text, List<String> removed) {
        Matcher matcher = CSS_HIDDEN_ELEMENT.matcher(text);
        if (!matcher.find()) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        do {
            Matcher tag = OPENING_TAG.matcher(matcher.group());
            String opening = tag.find() ? tag.group() : matcher.group(1);
            removed.add("Potential color-based hiding: " + LogSanitizer.sanitize(opening));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(REDACTION_TOKEN));
        } while (matcher.find());
        matcher.appendTail(sb);
        return sb.toString();
    }

    private String redactInjectionPatterns(String text, List<String> removed) {
        String working = text;
        for (InjectionPatternLibrary.InjectionPattern injection : InjectionPatternLibrary.getPatterns()) {
            Matcher matcher = injection.pattern().matcher(working);
            if (!matcher.find()) {
                continue;
            }
            removed.add("Prompt injection pattern removed: " + injection.description() + " (\"" + LogSanitizer.sanitize(matcher.group()) + "\")");
            log.debug("Injection pattern '{}' matched", injection.description());
            working = matcher.replaceAll(Matcher.quoteReplacement(REDACTION_TOKEN));
        }
        return working;
    }

    private String checkInstructionDensity(String text) {
        String[] tokens = WORD_SPLIT.split(text.trim());
        int words = 0;
        int instructional = 0;
        for (String token : tokens) {
            String word = NON_WORD_PATTERN.matcher(token.toLowerCase(Locale.ROOT)).replaceAll("");
            if (word.isEmpty()) {
                continue;
            }
            words++;
            if (InjectionPatternLibrary.getInstructionalWords().contains(word)) {
                instructional++;
            }
        }
        if (words < this.instructionDensityMinWords) {
            return null;
        }
        double density = (double) instructional / words;
        if (density <= this.instructionDensityThreshold) {
            return null;
        }
        return String.format(Locale.ROOT, "Excessive instructional content: %d of %d words (%.0f%% > %.0f%%)",
                instructional, words, density * 100.0, this.instructionDensityThreshold * 100.0);
    }

    private static String normalizeWhitespace(String text) {
        String normalized = LINE_BREAK.matcher(text).replaceAll("\n");
        normalized = MULTI_SPACE_PATTERN.matcher(normalized).replaceAll(" ");
        normalized = EXCESS_NEWLINES.matcher(normalized).replaceAll("\n\n");
        return normalized.trim();
    }
}
