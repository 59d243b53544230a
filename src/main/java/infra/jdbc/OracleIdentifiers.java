package infra.jdbc;

import java.util.regex.Pattern;

/**
 * Plan table names end up in SQL text (they cannot be bound), so only plain
 * {@code [schema.]name} identifiers are accepted.
 */
public final class OracleIdentifiers {

    private static final Pattern TABLE = Pattern.compile("[A-Za-z][A-Za-z0-9_$#]{0,127}(\\.[A-Za-z][A-Za-z0-9_$#]{0,127})?");

    private OracleIdentifiers() {
    }

    public static boolean isTableName(String s) {
        return s != null && TABLE.matcher(s.trim()).matches();
    }

    static String requireTableName(String s) {
        if (!isTableName(s)) throw new IllegalArgumentException("not a plain table name: " + s);
        return s.trim();
    }
}
