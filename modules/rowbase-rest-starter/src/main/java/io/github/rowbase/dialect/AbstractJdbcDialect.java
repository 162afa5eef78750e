package io.github.rowbase.dialect;

import io.github.rowbase.codec.FieldCodecs;
import io.github.rowbase.exception.DataSourceException;
import io.github.rowbase.model.Cell;
import io.github.rowbase.model.LogicalType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Blob;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.stream.Stream;

/**
 * Shared JDBC execution and value conversion for dialects backed by a {@link JdbcTemplate}.
 */
public abstract class AbstractJdbcDialect implements SqlDialect {

    private static final Logger log = LoggerFactory.getLogger(AbstractJdbcDialect.class);

    protected final JdbcTemplate jdbcTemplate;

    protected AbstractJdbcDialect(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Cursor execute(String sql) {
        log.debug("Executing query on {}: {}", getName(), sql);
        try {
            Stream<Object[]> rows = jdbcTemplate.queryForStream(sql, (rs, rowNum) -> {
                ResultSetMetaData meta = rs.getMetaData();
                Object[] values = new Object[meta.getColumnCount()];
                for (int i = 0; i < values.length; i++) {
                    values[i] = rs.getObject(i + 1);
                }
                return values;
            });
            return new StreamCursor(rows, -1);
        } catch (DataAccessException e) {
            log.error("Query failed on {}: {}", getName(), e.getMostSpecificCause().getMessage());
            throw new DataSourceException(e.getMostSpecificCause().getMessage(), e);
        }
    }

    @Override
    public int executeUpdate(String sql) {
        log.debug("Executing update on {}: {}", getName(), sql);
        try {
            return jdbcTemplate.update(sql);
        } catch (DataAccessException e) {
            log.error("Update failed on {}: {}", getName(), e.getMostSpecificCause().getMessage());
            throw new DataSourceException(e.getMostSpecificCause().getMessage(), e);
        }
    }

    @Override
    public String printLiteral(Cell cell, String nativeType) {
        if (cell == null || cell.isNull()) {
            return "NULL";
        }
        return switch (cell.getKind()) {
            case INT64, FLOAT64 -> cell.toText();
            case BOOL -> printBooleanLiteral(cell.asBoolean());
            case TIMESTAMP -> printTimestampLiteral(cell.asTimestamp());
            case BYTES -> printBytesLiteral(cell.asBytes());
            default -> printStringLiteral(cell.toText());
        };
    }

    protected String printBooleanLiteral(boolean value) {
        return value ? "TRUE" : "FALSE";
    }

    protected String printTimestampLiteral(Instant value) {
        return printStringLiteral(value.toString());
    }

    protected abstract String printBytesLiteral(byte[] value);

    /**
     * Converts the common JDBC value classes. Strings are read according to the logical
     * type of the column, anything unknown falls back to its text.
     */
    @Override
    public Cell parseLiteral(Object value, String nativeType) {
        if (value == null) {
            return Cell.NULL;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return Cell.of(((Number) value).longValue());
        }
        if (value instanceof BigInteger) {
            return parseBigInteger((BigInteger) value);
        }
        if (value instanceof BigDecimal) {
            return parseDecimal((BigDecimal) value);
        }
        if (value instanceof Number) {
            return Cell.of(((Number) value).doubleValue());
        }
        if (value instanceof Boolean) {
            return Cell.of((Boolean) value);
        }
        if (value instanceof Timestamp) {
            return Cell.of(((Timestamp) value).toInstant());
        }
        if (value instanceof java.sql.Date) {
            return Cell.of(((java.sql.Date) value).toLocalDate().atStartOfDay().toInstant(ZoneOffset.UTC));
        }
        if (value instanceof LocalDateTime) {
            return Cell.of(((LocalDateTime) value).toInstant(ZoneOffset.UTC));
        }
        if (value instanceof LocalDate) {
            return Cell.of(((LocalDate) value).atStartOfDay().toInstant(ZoneOffset.UTC));
        }
        if (value instanceof OffsetDateTime) {
            return Cell.of(((OffsetDateTime) value).toInstant());
        }
        if (value instanceof byte[]) {
            return Cell.of((byte[]) value);
        }
        if (value instanceof Blob) {
            return parseBlob((Blob) value);
        }
        return parseText(value.toString(), nativeType);
    }

    protected Cell parseText(String text, String nativeType) {
        LogicalType type = logicalTypeOf(nativeType);
        return switch (type) {
            case NUMBER -> FieldCodecs.parseNumber(text);
            case BOOLEAN -> Cell.of(FieldCodecs.parseBoolean(text));
            case DATETIME -> FieldCodecs.parseDatetime(text);
            default -> Cell.of(text);
        };
    }

    private static Cell parseBigInteger(BigInteger value) {
        if (value.bitLength() < Long.SIZE) {
            return Cell.of(value.longValue());
        }
        // unsigned bigint above Long.MAX_VALUE
        return Cell.of(value.doubleValue());
    }

    private static Cell parseDecimal(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            try {
                return Cell.of(stripped.longValueExact());
            } catch (ArithmeticException e) {
                return Cell.of(value.doubleValue());
            }
        }
        return Cell.of(value.doubleValue());
    }

    private static Cell parseBlob(Blob blob) {
        try {
            return Cell.of(blob.getBytes(1, (int) blob.length()));
        } catch (SQLException e) {
            throw new DataSourceException(e.getMessage(), e);
        }
    }
}
