package io.github.rowbase.query;

import java.util.Locale;

/**
 * Comparison operators of a filter condition.
 */
public enum Comparison {
    LT(" < "),
    LE(" <= "),
    EQ(" = "),
    GE(" >= "),
    GT(" > "),
    LIKE(" LIKE ");

    private final String sql;

    Comparison(String sql) {
        this.sql = sql;
    }

    public String getSql() {
        return sql;
    }

    public static Comparison fromKeyword(String keyword) {
        return valueOf(keyword.toUpperCase(Locale.ROOT));
    }
}
