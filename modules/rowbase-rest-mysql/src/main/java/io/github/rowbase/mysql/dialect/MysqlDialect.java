package io.github.rowbase.mysql.dialect;

import io.github.rowbase.annotation.RowbaseService;
import io.github.rowbase.constant.ColumnTypeConstant;
import io.github.rowbase.constant.SupportedDatabaseConstant;
import io.github.rowbase.dialect.AbstractJdbcDialect;
import io.github.rowbase.exception.DataSourceException;
import io.github.rowbase.model.Cell;
import io.github.rowbase.model.LogicalType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;

/**
 * MySQL/MariaDB dialect. Tables are described with {@code SHOW CREATE TABLE}.
 */
@RowbaseService(serviceName = SupportedDatabaseConstant.MYSQL)
public class MysqlDialect extends AbstractJdbcDialect {

    private static final Logger log = LoggerFactory.getLogger(MysqlDialect.class);

    private static final DateTimeFormatter DATETIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS")
            .withZone(ZoneOffset.UTC);

    public MysqlDialect(JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate);
    }

    @Override
    public String getName() {
        return SupportedDatabaseConstant.MYSQL;
    }

    @Override
    public String quoteIdentifier(String name) {
        return "`" + name.replace("`", "``") + "`";
    }

    @Override
    public String printStringLiteral(String value) {
        StringBuilder literal = new StringBuilder(value.length() + 2).append('\'');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> literal.append("\\\\");
                case '\'' -> literal.append("\\'");
                case '\0' -> literal.append("\\0");
                case '\n' -> literal.append("\\n");
                case '\r' -> literal.append("\\r");
                case '\u001a' -> literal.append("\\Z");
                default -> literal.append(c);
            }
        }
        return literal.append('\'').toString();
    }

    @Override
    protected String printBytesLiteral(byte[] value) {
        return "x'" + HexFormat.of().formatHex(value) + "'";
    }

    @Override
    protected String printTimestampLiteral(Instant value) {
        return "'" + DATETIME_FORMAT.format(value) + "'";
    }

    /**
     * {@code bit} columns are booleans on MySQL.
     */
    @Override
    public LogicalType logicalTypeOf(String nativeType) {
        if (ColumnTypeConstant.BIT.equalsIgnoreCase(nativeType)) {
            return LogicalType.BOOLEAN;
        }
        return super.logicalTypeOf(nativeType);
    }

    /**
     * The driver reads {@code tinyint(1)} as Boolean; numeric columns keep numeric cells.
     */
    @Override
    public Cell parseLiteral(Object value, String nativeType) {
        if (value instanceof Boolean && logicalTypeOf(nativeType) == LogicalType.NUMBER) {
            return Cell.of((Boolean) value ? 1L : 0L);
        }
        return super.parseLiteral(value, nativeType);
    }

    @Override
    public String describeTable(String tableName) {
        String query = "SHOW CREATE TABLE " + quoteIdentifier(tableName);
        try {
            String ddl = jdbcTemplate.queryForObject(query, (rs, rowNum) -> rs.getString(2));
            if (ddl == null) {
                throw new DataSourceException("Table '" + tableName + "' has no description");
            }
            log.debug("Described table {}: {}", tableName, ddl);
            return ddl;
        } catch (DataAccessException e) {
            log.error("Error describing table {}: {}", tableName, e.getMostSpecificCause().getMessage());
            throw new DataSourceException("Failed to describe table " + tableName + ": "
                    + e.getMostSpecificCause().getMessage(), e);
        }
    }
}
