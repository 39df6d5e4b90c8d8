package com.jreinhal.docguard.security;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class KeywordPolicyTest {

    private final KeywordPolicy policy = KeywordPolicy.defaults();

    @Test
    void defaultsSplitIntoBlockingAndWarningRules() {
        assertThat(policy.count(KeywordPolicy.Action.BLOCK)).isEqualTo(6);
        assertThat(policy.count(KeywordPolicy.Action.WARN)).isEqualTo(4);
    }

    @Test
    void assignmentSyntaxIsRequiredForPasswordRule() {
        KeywordPolicy.KeywordRule password = policy.rules().get(0);

        assertThat(password.matches("PASSWORD = hunter2")).isTrue();
        assertThat(password.matches("Reset your password in the portal")).isFalse();
    }

    @Test
    void warningPhrasesMatchAcrossWhitespace() {
        assertThat(policy.rules()).filteredOn(r -> r.action() == KeywordPolicy.Action.WARN)
                .filteredOn(r -> r.matches("Internal\n only: roadmap. Do not   share."))
                .extracting(KeywordPolicy.KeywordRule::keyword)
                .containsExactly("internal only", "do not share");
    }

    @Test
    void messageNamesKeywordAndDescription() {
        KeywordPolicy.KeywordRule rule = KeywordPolicy.KeywordRule.block("license key", "license\\s+key", "License key reference");

        assertThat(rule.message()).isEqualTo("Sensitive keyword detected: \"license key\" - License key reference");
        assertThat(KeywordPolicy.of(List.of(rule)).rules()).containsExactly(rule);
    }
}
