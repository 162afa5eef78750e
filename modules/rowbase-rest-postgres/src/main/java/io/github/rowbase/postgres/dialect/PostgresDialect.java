package io.github.rowbase.postgres.dialect;

import io.github.rowbase.annotation.RowbaseService;
import io.github.rowbase.constant.SupportedDatabaseConstant;
import io.github.rowbase.dialect.AbstractJdbcDialect;
import io.github.rowbase.exception.DataSourceException;
import io.github.rowbase.postgres.model.ColumnInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * PostgreSQL dialect. Tables are described from {@code pg_catalog}, since PostgreSQL has no
 * statement returning the DDL of a table.
 */
@RowbaseService(serviceName = SupportedDatabaseConstant.POSTGRES)
public class PostgresDialect extends AbstractJdbcDialect {

    private static final Logger log = LoggerFactory.getLogger(PostgresDialect.class);

    private final String allowedSchema;

    public PostgresDialect(JdbcTemplate jdbcTemplate,
                           @Value("${app.allowed-schema:public}") String allowedSchema) {
        super(jdbcTemplate);
        this.allowedSchema = allowedSchema;
    }

    @Override
    public String getName() {
        return SupportedDatabaseConstant.POSTGRES;
    }

    @Override
    public String quoteIdentifier(String name) {
        return quote(name);
    }

    private static String quote(String name) {
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String quoteTableName(String name) {
        return quoteIdentifier(allowedSchema) + "." + quoteIdentifier(name);
    }

    @Override
    public String printStringLiteral(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    @Override
    protected String printBytesLiteral(byte[] value) {
        return "'\\x" + HexFormat.of().formatHex(value) + "'";
    }

    @Override
    public String describeTable(String tableName) {
        try {
            List<ColumnInfo> columns = getTableColumns(tableName);
            if (columns.isEmpty()) {
                throw new DataSourceException("Table '" + tableName + "' not found in schema '" + allowedSchema + "'");
            }
            Map<String, String> references = getTableForeignKeys(tableName);
            for (ColumnInfo column : columns) {
                column.setReferences(references.get(column.getName()));
            }
            String ddl = printCreateTable(tableName, columns);
            log.debug("Described table {}: {}", tableName, ddl);
            return ddl;
        } catch (DataAccessException e) {
            log.error("Error describing table {}: {}", tableName, e.getMostSpecificCause().getMessage());
            throw new DataSourceException("Failed to describe table " + tableName + ": "
                    + e.getMostSpecificCause().getMessage(), e);
        }
    }

    /**
     * Column information of a table, limited to the columns the current user may select.
     */
    private List<ColumnInfo> getTableColumns(String tableName) {
        String query = """
            SELECT
                a.attname as column_name,
                pg_catalog.format_type(a.atttypid, a.atttypmod) as full_type,
                NOT a.attnotnull as is_nullable,
                CASE WHEN pk.column_name IS NOT NULL THEN true ELSE false END as is_primary_key,
                (a.attidentity <> '' OR COALESCE(pg_catalog.pg_get_expr(d.adbin, d.adrelid), '') LIKE 'nextval(%') as is_auto_increment
            FROM pg_catalog.pg_attribute a
            JOIN pg_catalog.pg_class c ON a.attrelid = c.oid
            JOIN pg_catalog.pg_namespace n ON c.relnamespace = n.oid
            LEFT JOIN pg_catalog.pg_attrdef d ON d.adrelid = a.attrelid AND d.adnum = a.attnum
            LEFT JOIN (
                SELECT ku.column_name
                FROM information_schema.table_constraints tc
                JOIN information_schema.key_column_usage ku
                    ON tc.constraint_name = ku.constraint_name
                    AND tc.table_schema = ku.table_schema
                WHERE tc.constraint_type = 'PRIMARY KEY'
                AND tc.table_schema = ?
                AND tc.table_name = ?
            ) pk ON a.attname = pk.column_name
            WHERE n.nspname = ?
            AND c.relname = ?
            AND a.attnum > 0
            AND NOT a.attisdropped
            AND (
                has_column_privilege(current_user, n.nspname || '.' || c.relname, a.attname, 'SELECT')
                OR
                has_table_privilege(current_user, n.nspname || '.' || c.relname, 'SELECT')
            )
            ORDER BY a.attnum
            """;

        return jdbcTemplate.query(query, (rs, rowNum) -> {
            ColumnInfo column = new ColumnInfo(rs.getString("column_name"), rs.getString("full_type"),
                    rs.getBoolean("is_primary_key"), rs.getBoolean("is_nullable"));
            column.setAutoIncrement(rs.getBoolean("is_auto_increment"));
            return column;
        }, allowedSchema, tableName, allowedSchema, tableName);
    }

    /**
     * Referenced table and column per foreign key column.
     */
    private Map<String, String> getTableForeignKeys(String tableName) {
        String query = """
            SELECT
                kcu.column_name,
                ccu.table_name AS referenced_table,
                ccu.column_name AS referenced_column
            FROM information_schema.table_constraints tc
            JOIN information_schema.key_column_usage kcu
                ON tc.constraint_name = kcu.constraint_name
                AND tc.table_schema = kcu.table_schema
            JOIN information_schema.constraint_column_usage ccu
                ON ccu.constraint_name = tc.constraint_name
                AND ccu.table_schema = tc.table_schema
            WHERE tc.constraint_type = 'FOREIGN KEY'
            AND tc.table_schema = ?
            AND tc.table_name = ?
            ORDER BY kcu.ordinal_position
            """;

        List<String[]> rows = jdbcTemplate.query(query, (rs, rowNum) -> new String[]{
                rs.getString("column_name"),
                quote(rs.getString("referenced_table")) + "(" + quote(rs.getString("referenced_column")) + ")"
        }, allowedSchema, tableName);
        Map<String, String> references = new HashMap<>();
        for (String[] row : rows) {
            references.putIfAbsent(row[0], row[1]);
        }
        return references;
    }

    /**
     * Synthesize the {@code CREATE TABLE} statement of catalog columns.
     */
    public static String printCreateTable(String tableName, List<ColumnInfo> columns) {
        StringBuilder ddl = new StringBuilder("CREATE TABLE ")
                .append(quote(tableName))
                .append(" (\n");
        String separator = "";
        for (ColumnInfo column : columns) {
            ddl.append(separator).append("    ").append(quote(column.getName()))
                    .append(' ').append(column.getType());
            if (!column.isNullable()) {
                ddl.append(" NOT NULL");
            }
            if (column.isAutoIncrement()) {
                ddl.append(" GENERATED BY DEFAULT AS IDENTITY");
            }
            if (column.isForeignKey()) {
                ddl.append(" REFERENCES ").append(column.getReferences());
            }
            separator = ",\n";
        }
        List<String> keys = columns.stream()
                .filter(ColumnInfo::isPrimaryKey)
                .map(column -> quote(column.getName()))
                .collect(Collectors.toList());
        if (!keys.isEmpty()) {
            ddl.append(separator).append("    PRIMARY KEY (").append(String.join(", ", keys)).append(')');
        }
        return ddl.append("\n);").toString();
    }
}
