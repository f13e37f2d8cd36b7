package queryrouter.sql;

import io.micronaut.core.annotation.Nullable;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lexical views over raw SQL text used by classification and planning.
 * None of these views understand string literals or comments.
 */
public final class SqlText {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private SqlText() {
    }

    /**
     * Collapses every whitespace run to a single space and trims the result.
     * Letter case is preserved.
     *
     * @param sql raw statement text, may be null
     * @return the collapsed text, empty for null input
     */
    public static String collapse(@Nullable String sql) {
        if (sql == null) {
            return "";
        }
        return WHITESPACE.matcher(sql).replaceAll(" ").trim();
    }

    /**
     * Upper-cased, whitespace-collapsed view used for keyword matching.
     */
    public static String normalize(@Nullable String sql) {
        return collapse(sql).toUpperCase(Locale.ROOT);
    }

    /**
     * Drops everything enclosed in parentheses, keeping the parentheses themselves.
     * Unbalanced closing parentheses are ignored.
     *
     * @param sql statement text in any case
     * @return the statement with only its outermost level remaining
     */
    public static String topLevel(String sql) {
        StringBuilder out = new StringBuilder(sql.length());
        int depth = 0;
        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (c == '(') {
                if (depth == 0) {
                    out.append(c);
                }
                depth++;
            } else if (c == ')') {
                if (depth > 0) {
                    depth--;
                }
                if (depth == 0) {
                    out.append(c);
                }
            } else if (depth == 0) {
                out.append(c);
            }
        }
        return out.toString();
    }
}
