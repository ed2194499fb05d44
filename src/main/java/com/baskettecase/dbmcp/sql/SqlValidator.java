package com.baskettecase.dbmcp.sql;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * SQL Validator for read-only queries
 *
 * Keyword-based gate applied before any raw SQL reaches a database:
 * <ol>
 *   <li>line ({@code -- ...}) and block ({@code /* ... *&#47;}) comments are removed,</li>
 *   <li>the remaining text must start with one of {@link #ALLOWED_OPENERS},</li>
 *   <li>and must not contain any of {@link #FORBIDDEN_KEYWORDS} as a whole word anywhere.</li>
 * </ol>
 *
 * This is a best-effort guard against accidental misuse by a cooperative caller, not a parser and
 * not a security boundary: functions with side effects or engine-specific extensions are not detected,
 * and a forbidden word inside a string literal is rejected as well. Pure and thread-safe.
 */
@Slf4j
@Component
public class SqlValidator {

    public static final List<String> ALLOWED_OPENERS = List.of(
        "SELECT", "WITH", "EXPLAIN", "SHOW", "DESCRIBE", "VALUES"
    );

    public static final List<String> FORBIDDEN_KEYWORDS = List.of(
        "INSERT", "UPDATE", "DELETE", "DROP", "CREATE", "ALTER",
        "TRUNCATE", "GRANT", "REVOKE", "EXEC", "EXECUTE"
    );

    private static final Pattern LINE_COMMENT = Pattern.compile("--.*$", Pattern.MULTILINE);
    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);

    private static final List<Pattern> FORBIDDEN_PATTERNS = FORBIDDEN_KEYWORDS.stream()
        .map(keyword -> Pattern.compile("\\b" + keyword + "\\b"))
        .toList();

    /**
     * Validate a raw SQL text.
     */
    public ValidationResult validate(String sql) {
        List<String> errors = new ArrayList<>();

        if (sql == null || sql.isBlank()) {
            errors.add("Query is empty");
            return new ValidationResult(false, errors);
        }

        String cleaned = normalize(sql);

        if (ALLOWED_OPENERS.stream().noneMatch(cleaned::startsWith)) {
            errors.add("Query must start with one of " + String.join(", ", ALLOWED_OPENERS));
        } else {
            for (int i = 0; i < FORBIDDEN_PATTERNS.size(); i++) {
                if (FORBIDDEN_PATTERNS.get(i).matcher(cleaned).find()) {
                    errors.add("Forbidden keyword: " + FORBIDDEN_KEYWORDS.get(i));
                }
            }
        }

        boolean valid = errors.isEmpty();
        if (valid) {
            log.debug("✅ SQL validation passed: {}", sql);
        } else {
            log.warn("❌ SQL validation failed: {} - Errors: {}", sql, errors);
        }

        return new ValidationResult(valid, errors);
    }

    /**
     * Shorthand for {@code validate(sql).isValid()}.
     */
    public boolean isAllowed(String sql) {
        return validate(sql).isValid();
    }

    /**
     * Strip comments, trim and uppercase.
     */
    static String normalize(String sql) {
        String withoutLineComments = LINE_COMMENT.matcher(sql).replaceAll("");
        String withoutComments = BLOCK_COMMENT.matcher(withoutLineComments).replaceAll("");
        return withoutComments.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Validation result
     */
    public record ValidationResult(
        boolean isValid,
        List<String> errors
    ) {
        public String getErrorMessage() {
            return String.join("; ", errors);
        }
    }
}
