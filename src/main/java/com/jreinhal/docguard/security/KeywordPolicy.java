package com.jreinhal.docguard.security;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Keyword rules checked by the pre-distribution gate in addition to the secret scan.
 * {@link Action#BLOCK} rules stop distribution; {@link Action#WARN} rules are recorded
 * and only hold content back in strict mode.
 */
public final class KeywordPolicy {
    private static final KeywordPolicy DEFAULTS = new KeywordPolicy(List.of(
            KeywordRule.block("password", "password\\s*[:=]", "Password assignment detected"),
            KeywordRule.block("private key", "private\\s+key", "Private key reference"),
            KeywordRule.block("secret", "secret\\s*[:=]", "Secret assignment detected"),
            KeywordRule.block("api_key", "api[_-]?key\\s*[:=]", "API key assignment detected"),
            KeywordRule.block("token", "token\\s*[:=]", "Token assignment detected"),
            KeywordRule.block("credential", "credential", "Credential reference"),
            KeywordRule.warn("confidential", "confidential", "Confidential information reference"),
            KeywordRule.warn("internal only", "internal\\s+only", "Internal only designation"),
            KeywordRule.warn("do not share", "do\\s+not\\s+share", "Explicit no-share instruction"),
            KeywordRule.warn("proprietary", "proprietary", "Proprietary information reference")
    ));

    private final List<KeywordRule> rules;

    private KeywordPolicy(List<KeywordRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static KeywordPolicy defaults() {
        return DEFAULTS;
    }

    public static KeywordPolicy of(List<KeywordRule> rules) {
        return new KeywordPolicy(rules);
    }

    public List<KeywordRule> rules() {
        return this.rules;
    }

    public long count(Action action) {
        return this.rules.stream().filter(r -> r.action() == action).count();
    }

    public static enum Action {
        BLOCK,
        WARN;

    }

    public record KeywordRule(String keyword, Pattern pattern, Action action, String description) {

        public static KeywordRule block(String keyword, String regex, String description) {
            return new KeywordRule(keyword, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), Action.BLOCK, description);
        }

        public static KeywordRule warn(String keyword, String regex, String description) {
            return new KeywordRule(keyword, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), Action.WARN, description);
        }

        public boolean matches(String content) {
            return this.pattern.matcher(content).find();
        }

        public String message() {
            return "Sensitive keyword detected: \"" + this.keyword + "\" - " + this.description;
        }
    }
}
