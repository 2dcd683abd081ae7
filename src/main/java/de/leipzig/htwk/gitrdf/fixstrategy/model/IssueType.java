package de.leipzig.htwk.gitrdf.fixstrategy.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Kinds of quality findings reported by the lint, type, test and security stages.
 * The wire value is what gets stored in the attempt log.
 */
public enum IssueType {
    FORMATTING("formatting"),
    TYPE_ERROR("type_error"),
    SECURITY("security"),
    TEST_FAILURE("test_failure"),
    IMPORT_ERROR("import_error"),
    COMPLEXITY("complexity"),
    DEAD_CODE("dead_code"),
    DEPENDENCY("dependency"),
    DRY_VIOLATION("dry_violation"),
    PERFORMANCE("performance"),
    DOCUMENTATION("documentation"),
    TEST_ORGANIZATION("test_organization"),
    COVERAGE_IMPROVEMENT("coverage_improvement"),
    REGEX_VALIDATION("regex_validation"),
    SEMANTIC_CONTEXT("semantic_context"),
    WARNING_SUPPRESSION("warning_suppression"),
    REFURB("refurb");

    private final String value;

    IssueType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Parse either the wire value ("type_error") or the constant name ("TYPE_ERROR")
     */
    public static IssueType fromString(String input) {
        if (input == null || input.trim().isEmpty()) {
            throw new IllegalArgumentException("Issue type cannot be null or empty");
        }

        String normalized = input.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
            .filter(type -> type.value.equals(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unsupported issue type: " + input
                + ". Supported types: " + getSupportedTypes()));
    }

    public static String getSupportedTypes() {
        return String.join(", ", getAllValues());
    }

    public static List<String> getAllValues() {
        return Arrays.stream(values())
            .map(IssueType::getValue)
            .collect(Collectors.toList());
    }

    public static boolean isSupported(String input) {
        try {
            fromString(input);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
