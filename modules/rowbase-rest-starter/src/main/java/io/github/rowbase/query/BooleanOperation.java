package io.github.rowbase.query;

import java.util.Locale;

/**
 * Boolean operators joining filters.
 */
public enum BooleanOperation {
    AND(" AND "),
    OR(" OR "),
    NOT("NOT ");

    private final String sql;

    BooleanOperation(String sql) {
        this.sql = sql;
    }

    public String getSql() {
        return sql;
    }

    public static BooleanOperation fromKeyword(String keyword) {
        return valueOf(keyword.toUpperCase(Locale.ROOT));
    }
}
