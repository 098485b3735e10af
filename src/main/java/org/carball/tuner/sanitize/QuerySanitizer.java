package org.carball.tuner.sanitize;

import org.carball.tuner.model.query.SanitizedQueryRecord;
import org.carball.tuner.model.query.SlowQueryRecord;

import java.util.regex.Pattern;

/**
 * Strips personal and secret-looking substrings from query text before it is logged or persisted.
 * Substitutions run in a fixed order; digit-group patterns go before the generic token pattern.
 */
public class QuerySanitizer {

    public static final String EMAIL = "[EMAIL]";
    public static final String PHONE = "[PHONE]";
    public static final String CREDIT_CARD = "[CREDIT_CARD]";
    public static final String SSN = "[SSN]";
    public static final String API_KEY = "[API_KEY]";
    public static final String REDACTED = "[REDACTED]";

    private static final Pattern EMAIL_PATTERN = Pattern.compile(
            "[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}");

    private static final Pattern PHONE_PATTERN = Pattern.compile(
            "\\b\\d{3}[-.]?\\d{3}[-.]?\\d{4}\\b");

    private static final Pattern CREDIT_CARD_PATTERN = Pattern.compile(
            "\\b(?:\\d{4}[-\\s]?){3}\\d{4}\\b");

    private static final Pattern SSN_PATTERN = Pattern.compile(
            "\\b\\d{3}-?\\d{2}-?\\d{4}\\b");

    // Whole runs of 20-40 token characters mixing letters and digits
    private static final Pattern API_KEY_PATTERN = Pattern.compile(
            "(?<![A-Za-z0-9_-])(?=[A-Za-z_-]*\\d)(?=[0-9_-]*[A-Za-z])[A-Za-z0-9_-]{20,40}(?![A-Za-z0-9_-])");

    private static final Pattern QUOTED_SECRET_PATTERN = Pattern.compile(
            "\\b(password|passwd|pwd|secret|token|access_token|refresh_token|jwt)"
                    + "(\\s*(?:=|<>|!=|>=|<=|>|<)\\s*|\\s+IS\\s+|\\s+LIKE\\s+)(['\"])(.*?)\\3",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern BARE_SECRET_PATTERN = Pattern.compile(
            "\\b(password|passwd|pwd|secret|token|access_token|refresh_token|jwt|api_key|apikey)"
                    + "(\\s*=\\s*)([^\\s&;,'\"\\[\\]()]+)",
            Pattern.CASE_INSENSITIVE);

    private QuerySanitizer() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns the redacted form of {@code text}; {@code null} and empty input give an empty string.
     */
    public static String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        String sanitized = EMAIL_PATTERN.matcher(text).replaceAll(EMAIL);
        sanitized = PHONE_PATTERN.matcher(sanitized).replaceAll(PHONE);
        sanitized = CREDIT_CARD_PATTERN.matcher(sanitized).replaceAll(CREDIT_CARD);
        sanitized = SSN_PATTERN.matcher(sanitized).replaceAll(SSN);
        sanitized = API_KEY_PATTERN.matcher(sanitized).replaceAll(API_KEY);
        sanitized = QUOTED_SECRET_PATTERN.matcher(sanitized).replaceAll("$1$2" + REDACTED);
        sanitized = BARE_SECRET_PATTERN.matcher(sanitized).replaceAll("$1$2" + REDACTED);

        return sanitized;
    }

    public static SanitizedQueryRecord sanitize(SlowQueryRecord record) {
        return new SanitizedQueryRecord(
                record.storeKind(),
                sanitize(record.rawText()),
                record.source(),
                record.callCount(),
                record.totalTime(),
                record.meanTime(),
                record.rowsAffected(),
                record.bufferStats(),
                record.operationStats()
        );
    }

    /**
     * Sanitized text cut to {@code maxLength} characters, with whitespace collapsed, for logs and reports.
     */
    public static String preview(String text, int maxLength) {
        String sanitized = sanitize(text).replaceAll("\\s+", " ").trim();
        return sanitized.length() > maxLength
                ? sanitized.substring(0, maxLength) + "..."
                : sanitized;
    }
}
