package com.jreinhal.docguard.util;

import static org.assertj.core.api.Assertions.assertThat;

import com.jreinhal.docguard.model.SensitivityLevel;
import com.jreinhal.docguard.util.FrontmatterParser.ParsedFrontmatter;
import org.junit.jupiter.api.Test;

class FrontmatterParserTest {

    private final FrontmatterParser parser = new FrontmatterParser(false);

    @Test
    void readsDeclaredFields() {
        String content = """
                ---
                sensitivity: confidential
                context_documents:
                  - docs/a.md
                  - docs/b.md
                tags: [finance, q3]
                requires_approval: true
                retention_days: 90
                owner: finance-team
                ---
                # Quarterly report
                Body text.
                """;

        ParsedFrontmatter parsed = parser.parse(content);

        assertThat(parsed.present()).isTrue();
        assertThat(parsed.errors()).isEmpty();
        assertThat(parsed.metadata().sensitivity()).isEqualTo(SensitivityLevel.CONFIDENTIAL);
        assertThat(parsed.metadata().sensitivityDeclared()).isTrue();
        assertThat(parsed.metadata().contextDocuments()).containsExactly("docs/a.md", "docs/b.md");
        assertThat(parsed.metadata().tags()).containsExactly("finance", "q3");
        assertThat(parsed.metadata().requiresApproval()).isTrue();
        assertThat(parsed.metadata().retentionDays()).isEqualTo(90);
        assertThat(parsed.metadata().owner()).isEqualTo("finance-team");
        assertThat(parsed.body()).isEqualTo("# Quarterly report\nBody text.\n");
    }

    @Test
    void missingBlockUsesInternalDefault() {
        ParsedFrontmatter parsed = parser.parse("Just a body");

        assertThat(parsed.present()).isFalse();
        assertThat(parsed.errors()).isEmpty();
        assertThat(parsed.metadata().sensitivity()).isEqualTo(SensitivityLevel.INTERNAL);
        assertThat(parsed.metadata().sensitivityDeclared()).isFalse();
        assertThat(parsed.body()).isEqualTo("Just a body");
    }

    @Test
    void missingSensitivityIsAnErrorWhenRequired() {
        FrontmatterParser strict = new FrontmatterParser(true);

        assertThat(strict.parse("---\ntitle: x\n---\nbody").errors()).containsExactly("Missing required field: sensitivity");
        assertThat(strict.parse("no block").errors()).containsExactly("Missing required field: sensitivity");
    }

    @Test
    void invalidSensitivityIsReportedNotThrown() {
        ParsedFrontmatter parsed = parser.parse("---\nsensitivity: Secret\n---\nbody");

        assertThat(parsed.metadata().sensitivityValid()).isFalse();
        assertThat(parsed.metadata().rawSensitivity()).isEqualTo("Secret");
        assertThat(parsed.errors()).containsExactly(
                "Invalid sensitivity level: Secret. Must be one of: public, internal, confidential, restricted");
    }

    @Test
    void typeErrorsAreCollected() {
        String content = "---\nsensitivity: public\ncontext_documents: docs/a.md\nrequires_approval: maybe\nretention_days: -5\n---\n";

        ParsedFrontmatter parsed = parser.parse(content);

        assertThat(parsed.errors()).containsExactlyInAnyOrder(
                "context_documents must be a list",
                "requires_approval must be a boolean",
                "retention_days must be a non-negative integer");
        assertThat(parsed.metadata().contextDocuments()).isEmpty();
    }

    @Test
    void malformedYamlMarksSensitivityInvalid() {
        ParsedFrontmatter parsed = parser.parse("---\nsensitivity: [unclosed\n---\nbody");

        assertThat(parsed.present()).isTrue();
        assertThat(parsed.errors()).singleElement().asString().startsWith("Malformed frontmatter: ");
        assertThat(parsed.metadata().sensitivityValid()).isFalse();
        assertThat(parsed.metadata().sensitivityDeclared()).isFalse();
        assertThat(parsed.body()).isEqualTo("body");
    }

    @Test
    void nonMapBlockMarksSensitivityInvalid() {
        ParsedFrontmatter parsed = parser.parse("---\n- restricted\n- secret\n---\nbody");

        assertThat(parsed.present()).isTrue();
        assertThat(parsed.errors()).containsExactly("Frontmatter is not a key/value block");
        assertThat(parsed.metadata().sensitivityValid()).isFalse();
    }

    @Test
    void leadingByteOrderMarkIsIgnored() {
        ParsedFrontmatter parsed = parser.parse("\uFEFF---\nsensitivity: restricted\n---\nbody");

        assertThat(parsed.present()).isTrue();
        assertThat(parsed.errors()).isEmpty();
        assertThat(parsed.metadata().sensitivity()).isEqualTo(SensitivityLevel.RESTRICTED);
        assertThat(parsed.metadata().sensitivityDeclared()).isTrue();
        assertThat(parsed.body()).isEqualTo("body");
    }

    @Test
    void emptyBlockParsesAsPresent() {
        ParsedFrontmatter parsed = parser.parse("---\n\n---\nbody");

        assertThat(parsed.present()).isTrue();
        assertThat(parsed.metadata().sensitivity()).isEqualTo(SensitivityLevel.INTERNAL);
    }
}
