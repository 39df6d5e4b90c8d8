package com.jreinhal.docguard.util;

import com.jreinhal.docguard.model.DocumentMetadata;
import com.jreinhal.docguard.model.SensitivityLevel;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Splits a document into its YAML frontmatter block and body, and reads the block
 * into a {@link DocumentMetadata}.
 *
 * <p>A missing block yields default metadata (sensitivity {@code internal}) with no
 * validation errors. A block that is present but unparseable yields metadata with an
 * invalid sensitivity and one validation error. Type problems inside a parseable block
 * are reported as validation errors, never thrown. One leading byte order mark is
 * ignored.</p>
 */
public final class FrontmatterParser {
    private static final Logger log = LoggerFactory.getLogger(FrontmatterParser.class);
    private static final Pattern FRONTMATTER = Pattern.compile("\\A---[ \\t]*\\r?\\n(.*?)\\r?\\n---[ \\t]*(?:\\r?\\n|\\z)", Pattern.DOTALL);
    private static final int MAX_ALIASES = 20;
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final boolean requireExplicitSensitivity;

    public FrontmatterParser(boolean requireExplicitSensitivity) {
        this.requireExplicitSensitivity = requireExplicitSensitivity;
    }

    public ParsedFrontmatter parse(String content) {
        if (content == null) {
            return this.withoutBlock("");
        }
        if (!content.isEmpty() && content.charAt(0) == BYTE_ORDER_MARK) {
            content = content.substring(1);
        }
        Matcher matcher = FRONTMATTER.matcher(content);
        if (!matcher.find()) {
            return this.withoutBlock(content);
        }
        String body = content.substring(matcher.end());
        Object loaded;
        try {
            loaded = this.newYaml().load(matcher.group(1));
        }
        catch (YAMLException e) {
            log.warn("Failed to parse YAML frontmatter, treating sensitivity as unknown: {}", LogSanitizer.sanitize(e.getMessage()));
            return unreadableBlock(body, "Malformed frontmatter: " + LogSanitizer.sanitize(firstLine(e.getMessage())));
        }
        if (loaded == null) {
            return this.readFields(Map.of(), body);
        }
        if (!(loaded instanceof Map<?, ?> fields)) {
            log.warn("Frontmatter is not a key/value block, treating sensitivity as unknown");
            return unreadableBlock(body, "Frontmatter is not a key/value block");
        }
        return this.readFields(fields, body);
    }

    private ParsedFrontmatter withoutBlock(String body) {
        List<String> errors = this.requireExplicitSensitivity ? List.of("Missing required field: sensitivity") : List.of();
        return new ParsedFrontmatter(false, DocumentMetadata.defaults(), body, errors);
    }

    private static ParsedFrontmatter unreadableBlock(String body, String error) {
        return new ParsedFrontmatter(true, DocumentMetadata.unreadable(), body, List.of(error));
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "unreadable YAML";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }

    private ParsedFrontmatter readFields(Map<?, ?> fields, String body) {
        List<String> errors = new ArrayList<>();

        Object rawSensitivity = fields.get("sensitivity");
        SensitivityLevel sensitivity = DocumentMetadata.DEFAULT_SENSITIVITY;
        boolean declared = rawSensitivity != null;
        boolean valid = true;
        if (!declared) {
            if (this.requireExplicitSensitivity) {
                errors.add("Missing required field: sensitivity");
            }
        } else {
            Optional<SensitivityLevel> parsed = rawSensitivity instanceof String label ? SensitivityLevel.fromLabel(label) : Optional.empty();
            if (parsed.isPresent()) {
                sensitivity = parsed.get();
            } else {
                valid = false;
                errors.add("Invalid sensitivity level: " + rawSensitivity + ". Must be one of: " + String.join(", ", SensitivityLevel.labels()));
            }
        }

        List<String> contextDocuments = readStringList(fields, "context_documents", errors);
        List<String> tags = readStringList(fields, "tags", errors);
        List<String> audiences = readStringList(fields, "allowed_audiences", errors);
        Boolean requiresApproval = readBoolean(fields, "requires_approval", errors);
        Boolean piiPresent = readBoolean(fields, "pii_present", errors);
        Integer retentionDays = readRetentionDays(fields, errors);

        DocumentMetadata metadata = new DocumentMetadata(sensitivity, declared, valid,
                declared ? String.valueOf(rawSensitivity) : null,
                contextDocuments, tags, audiences, requiresApproval, retentionDays, piiPresent,
                readString(fields, "title"), readString(fields, "description"), readString(fields, "version"),
                readString(fields, "owner"), readString(fields, "department"));
        return new ParsedFrontmatter(true, metadata, body, errors);
    }

    private static List<String> readStringList(Map<?, ?> fields, String key, List<String> errors) {
        Object value = fields.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> items)) {
            errors.add(key + " must be a list");
            return List.of();
        }
        List<String> result = new ArrayList<>(items.size());
        boolean nonString = false;
        for (Object item : items) {
            if (item instanceof String s) {
                result.add(s);
            } else {
                nonString = true;
            }
        }
        if (nonString) {
            errors.add(key + " entries must be strings");
        }
        return result;
    }

    private static Boolean readBoolean(Map<?, ?> fields, String key, List<String> errors) {
        Object value = fields.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        errors.add(key + " must be a boolean");
        return null;
    }

    private static Integer readRetentionDays(Map<?, ?> fields, List<String> errors) {
        Object value = fields.get("retention_days");
        if (value == null) {
            return null;
        }
        if ((value instanceof Integer || value instanceof Long) && ((Number) value).longValue() >= 0L
                && ((Number) value).longValue() <= Integer.MAX_VALUE) {
            return ((Number) value).intValue();
        }
        errors.add("retention_days must be a non-negative integer");
        return null;
    }

    private static String readString(Map<?, ?> fields, String key) {
        Object value = fields.get(key);
        return value == null ? null : String.valueOf(value);
    }

    private Yaml newYaml() {
        LoaderOptions options = new LoaderOptions();
        options.setMaxAliasesForCollections(MAX_ALIASES);
        options.setAllowDuplicateKeys(false);
        return new Yaml(new SafeConstructor(options));
    }

    public record ParsedFrontmatter(boolean present, DocumentMetadata metadata, String body, List<String> errors) {
        public ParsedFrontmatter {
            errors = List.copyOf(errors);
        }
    }
}
