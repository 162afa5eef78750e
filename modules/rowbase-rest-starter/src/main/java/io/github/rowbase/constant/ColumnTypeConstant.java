package io.github.rowbase.constant;

import java.util.Set;

/**
 * Native column type names, grouped by the logical type they map to.
 * Names are lower case, without length or scale.
 */
public class ColumnTypeConstant {
    private ColumnTypeConstant() {
    }

    // Integer types
    public static final String INT = "int";
    public static final String INT2 = "int2";
    public static final String INT4 = "int4";
    public static final String INT8 = "int8";
    public static final String INTEGER = "integer";
    public static final String BIGINT = "bigint";
    public static final String SMALLINT = "smallint";
    public static final String TINYINT = "tinyint";
    public static final String MEDIUMINT = "mediumint";
    public static final String SERIAL = "serial";
    public static final String SMALLSERIAL = "smallserial";
    public static final String BIGSERIAL = "bigserial";

    // Decimal and floating-point types
    public static final String DECIMAL = "decimal";
    public static final String NUMERIC = "numeric";
    public static final String DOUBLE = "double";
    public static final String FLOAT = "float";
    public static final String FLOAT4 = "float4";
    public static final String FLOAT8 = "float8";
    public static final String REAL = "real";
    public static final String DOUBLE_PRECISION = "double precision";

    // Boolean types
    public static final String BOOL = "bool";
    public static final String BOOLEAN = "boolean";
    public static final String BIT = "bit";

    // Date and time types
    public static final String DATE = "date";
    public static final String DATETIME = "datetime";
    public static final String TIMESTAMP = "timestamp";
    public static final String TIMESTAMPTZ = "timestamptz";
    public static final String TIMESTAMP_WITH_TIME_ZONE = "timestamp with time zone";
    public static final String TIMESTAMP_WITHOUT_TIME_ZONE = "timestamp without time zone";

    // Text types
    public static final String TEXT = "text";
    public static final String VARCHAR = "varchar";
    public static final String CHAR = "char";
    public static final String CHARACTER = "character";
    public static final String CHARACTER_VARYING = "character varying";

    // Binary types
    public static final String BLOB = "blob";
    public static final String TINYBLOB = "tinyblob";
    public static final String MEDIUMBLOB = "mediumblob";
    public static final String LONGBLOB = "longblob";
    public static final String BINARY = "binary";
    public static final String VARBINARY = "varbinary";
    public static final String BYTEA = "bytea";

    public static final Set<String> NUMBER_TYPES = Set.of(
            INT, INT2, INT4, INT8, INTEGER, BIGINT, SMALLINT, TINYINT, MEDIUMINT,
            SERIAL, SMALLSERIAL, BIGSERIAL,
            DECIMAL, NUMERIC, DOUBLE, FLOAT, FLOAT4, FLOAT8, REAL, DOUBLE_PRECISION);

    public static final Set<String> BOOLEAN_TYPES = Set.of(BOOL, BOOLEAN);

    public static final Set<String> DATETIME_TYPES = Set.of(
            DATE, DATETIME, TIMESTAMP, TIMESTAMPTZ, TIMESTAMP_WITH_TIME_ZONE, TIMESTAMP_WITHOUT_TIME_ZONE);

    public static final Set<String> STRING_TYPES = Set.of(TEXT, VARCHAR, CHAR, CHARACTER, CHARACTER_VARYING);

    public static final Set<String> BLOB_TYPES = Set.of(
            BLOB, TINYBLOB, MEDIUMBLOB, LONGBLOB, BINARY, VARBINARY, BYTEA);

    public static final Set<String> AUTO_INCREMENT_TYPES = Set.of(SERIAL, SMALLSERIAL, BIGSERIAL);
}
