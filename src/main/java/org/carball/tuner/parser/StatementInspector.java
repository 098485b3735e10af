package org.carball.tuner.parser;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.Select;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides which statements may be explained and derives stable fingerprints from statement text.
 */
@Slf4j
public class StatementInspector {

    private static final int FINGERPRINT_LENGTH = 10;

    private static final Pattern STRING_LITERAL = Pattern.compile("'(?:[^']|'')*'");
    private static final Pattern NUMERIC_LITERAL = Pattern.compile("(?<![A-Za-z0-9_$])-?\\d+(?:\\.\\d+)?\\b");
    private static final Pattern POSITIONAL_PARAMETER = Pattern.compile("\\$\\d+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern RETURNING = Pattern.compile("\\bRETURNING\\b", Pattern.CASE_INSENSITIVE);

    private StatementInspector() {
        // Utility class - prevent instantiation
    }

    /**
     * A statement can be explained when it is a SELECT or returns rows through RETURNING.
     * pg_stat_statements text carries {@code $n} placeholders the parser may reject, in which
     * case the decision falls back to the leading keyword.
     */
    public static boolean canExplain(String sql) {
        if (sql == null || sql.isBlank()) {
            return false;
        }

        try {
            Statement statement = CCJSqlParserUtil.parse(sql);
            return statement instanceof Select || RETURNING.matcher(sql).find();
        } catch (JSQLParserException e) {
            log.debug("Statement not parseable, using keyword check: {}", e.getMessage());
            String normalized = sql.trim().toUpperCase(Locale.ROOT);
            return normalized.startsWith("SELECT")
                    || normalized.startsWith("WITH")
                    || RETURNING.matcher(normalized).find();
        }
    }

    /**
     * Whether the statement carries {@code $n} placeholders outside string literals. Such statements
     * come from pg_stat_statements and cannot be explained without their parameter values.
     */
    public static boolean hasPlaceholders(String sql) {
        if (sql == null) {
            return false;
        }
        return POSITIONAL_PARAMETER.matcher(STRING_LITERAL.matcher(sql).replaceAll("''")).find();
    }

    /**
     * Normalized form used for fingerprinting: literals and parameters become {@code ?},
     * whitespace is collapsed and the text is lower-cased.
     */
    public static String normalize(String sql) {
        if (sql == null) {
            return "";
        }
        String normalized = STRING_LITERAL.matcher(sql).replaceAll("?");
        normalized = POSITIONAL_PARAMETER.matcher(normalized).replaceAll("?");
        normalized = NUMERIC_LITERAL.matcher(normalized).replaceAll("?");
        normalized = WHITESPACE.matcher(normalized).replaceAll(" ").trim();
        if (normalized.endsWith(";")) {
            normalized = normalized.substring(0, normalized.length() - 1).trim();
        }
        return normalized.toLowerCase(Locale.ROOT);
    }

    /**
     * First ten hex characters of the MD5 digest of the normalized statement.
     */
    public static String fingerprint(String sql) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            byte[] hash = digest.digest(normalize(sql).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, FINGERPRINT_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
