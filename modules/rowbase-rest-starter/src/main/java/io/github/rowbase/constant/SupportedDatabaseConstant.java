package io.github.rowbase.constant;

/**
 * Constants for supported database types in Rowbase
 */
public final class SupportedDatabaseConstant {
    public static final String POSTGRES = "postgres";
    public static final String MYSQL = "mysql";

    private SupportedDatabaseConstant() {
        // Utility class
    }
}
