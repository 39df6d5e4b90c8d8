package com.jreinhal.docguard.security;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Fixed library of instruction-override phrasings neutralized by the {@link InputSanitizer}.
 */
public final class InjectionPatternLibrary {
    private static final List<InjectionPattern> PATTERNS = List.of(
            // Role reassignment and instruction override
            InjectionPattern.of("System role prefix", "\\bsystem\\s*:"),
            InjectionPattern.of("Ignore previous instructions", "ignore\\s+(?:all\\s+)?(?:the\\s+)?(?:previous|prior|above)(?:\\s+(?:instructions?|prompts?|rules?|context))?"),
            InjectionPattern.of("Disregard previous instructions", "disregard\\s+(?:all\\s+)?(?:the\\s+)?(?:previous|prior|above)(?:\\s+(?:instructions?|prompts?|rules?|context))?"),
            InjectionPattern.of("Forget previous instructions", "forget\\s+(?:all\\s+)?(?:previous|prior|your)\\s+(?:instructions?|context|rules?)"),
            InjectionPattern.of("Override instructions", "override\\s+(?:all\\s+)?(?:previous\\s+|prior\\s+)?(?:instructions?|rules?|settings|security)"),
            InjectionPattern.of("New instructions block", "new\\s+instructions?\\s*:"),
            InjectionPattern.of("Role reassignment", "you\\s+are\\s+now\\b|your\\s+new\\s+role"),
            InjectionPattern.of("Coercive directive", "you\\s+must\\s+(?:grant|give|provide|reveal|disclose|ignore|bypass|execute|run|disable|delete)"),
            InjectionPattern.of("Persona switch", "pretend\\s+(?:to\\s+be|you\\s+are)|act\\s+as\\s+(?:if|though)\\s+you"),
            InjectionPattern.of("Developer mode switch", "developer\\s+mode"),
            InjectionPattern.of("Safety bypass", "bypass\\s+(?:all\\s+|your\\s+)?(?:safety|security|restrictions?|filters?)"),
            InjectionPattern.of("System prompt extraction", "(?:show|reveal|display|print|output)\\s+(?:me\\s+)?(?:the\\s+)?(?:system|initial)\\s+prompt"),
            // Delimiter confusion
            InjectionPattern.of("System code fence", "```\\s*system"),
            InjectionPattern.of("System tag", "\\[\\s*system\\s*\\]|</?\\s*system\\s*>"),
            InjectionPattern.of("Chat template delimiter", "\\[/?INST\\]|<</?SYS>>"),
            // Command execution
            InjectionPattern.of("Command execution request", "execute\\s+(?:the\\s+)?(?:command|code|script)s?|run\\s+(?:the\\s+)?(?:script|command)s?"),
            InjectionPattern.of("Code evaluation call", "\\b(?:eval|exec)\\s*\\(")
    );

    private static final Set<String> INSTRUCTIONAL_WORDS = Set.of(
            "must", "should", "always", "never", "required", "mandatory",
            "instruction", "instructions", "command", "commands", "directive", "directives",
            "rule", "rules", "policy", "obey", "comply", "ignore", "override", "execute");

    private InjectionPatternLibrary() {
    }

    public static List<InjectionPattern> getPatterns() {
        return PATTERNS;
    }

    public static Set<String> getInstructionalWords() {
        return INSTRUCTIONAL_WORDS;
    }

    public record InjectionPattern(String description, Pattern pattern) {
        static InjectionPattern of(String description, String regex) {
            return new InjectionPattern(description, Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }
    }
}
