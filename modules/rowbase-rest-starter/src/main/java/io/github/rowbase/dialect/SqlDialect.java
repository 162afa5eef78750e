package io.github.rowbase.dialect;

import io.github.rowbase.constant.ColumnTypeConstant;
import io.github.rowbase.model.Cell;
import io.github.rowbase.model.LogicalType;

/**
 * Capabilities of one database engine: quoting, literals, table description and execution.
 *
 * <p>Implementations are Spring beans annotated with
 * {@link io.github.rowbase.annotation.RowbaseService} and are selected by database type through
 * {@link io.github.rowbase.service.ServiceLookup}. They must be safe for concurrent use.</p>
 */
public interface SqlDialect {

    /**
     * Database type name, one of {@link io.github.rowbase.constant.SupportedDatabaseConstant}.
     */
    String getName();

    String quoteIdentifier(String name);

    default String quoteTableName(String name) {
        return quoteIdentifier(name);
    }

    /**
     * Print a cell as a SQL literal for a column of the given native type.
     */
    String printLiteral(Cell cell, String nativeType);

    String printStringLiteral(String value);

    /**
     * Convert a raw driver value of a column of the given native type into a cell.
     */
    Cell parseLiteral(Object value, String nativeType);

    /**
     * Native {@code CREATE TABLE} text of the table.
     *
     * @throws io.github.rowbase.exception.DataSourceException if the table cannot be described
     */
    String describeTable(String tableName);

    /**
     * Execute a query. The caller closes the cursor.
     *
     * @throws io.github.rowbase.exception.DataSourceException on a driver failure
     */
    Cursor execute(String sql);

    /**
     * Execute a data modifying statement.
     *
     * @return number of affected rows
     * @throws io.github.rowbase.exception.DataSourceException on a driver failure
     */
    int executeUpdate(String sql);

    /**
     * Map a lower case native type name to its logical type. Unknown types are strings.
     */
    default LogicalType logicalTypeOf(String nativeType) {
        String type = nativeType == null ? "" : nativeType.toLowerCase();
        if (ColumnTypeConstant.NUMBER_TYPES.contains(type)) {
            return LogicalType.NUMBER;
        } else if (ColumnTypeConstant.BOOLEAN_TYPES.contains(type)) {
            return LogicalType.BOOLEAN;
        } else if (ColumnTypeConstant.DATETIME_TYPES.contains(type)) {
            return LogicalType.DATETIME;
        } else if (ColumnTypeConstant.BLOB_TYPES.contains(type)) {
            return LogicalType.BLOB;
        }
        return LogicalType.STRING;
    }

    /**
     * Select statement template. Empty clauses are left out.
     */
    default String printSelect(String tableName, String columns, String where, String groupBy,
                               String orderBy, String limit) {
        StringBuilder sql = new StringBuilder("SELECT ")
                .append(columns)
                .append(" FROM ")
                .append(quoteTableName(tableName));
        if (!where.isEmpty()) {
            sql.append(" WHERE ").append(where);
        }
        if (!groupBy.isEmpty()) {
            sql.append(" GROUP BY ").append(groupBy);
        }
        if (!orderBy.isEmpty()) {
            sql.append(" ORDER BY ").append(orderBy);
        }
        if (!limit.isEmpty()) {
            sql.append(" LIMIT ").append(limit);
        }
        return sql.append(';').toString();
    }
}
