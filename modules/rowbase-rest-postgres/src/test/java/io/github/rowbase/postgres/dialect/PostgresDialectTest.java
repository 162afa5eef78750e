package io.github.rowbase.postgres.dialect;

import io.github.rowbase.dialect.Cursor;
import io.github.rowbase.exception.DataSourceException;
import io.github.rowbase.model.Cell;
import io.github.rowbase.model.DataModel;
import io.github.rowbase.model.Field;
import io.github.rowbase.model.LogicalType;
import io.github.rowbase.postgres.model.ColumnInfo;
import io.github.rowbase.schema.SchemaIntrospector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

final class PostgresDialectTest {

    private JdbcTemplate jdbcTemplate;
    private PostgresDialect dialect;

    @BeforeEach
    void setUp() {
        jdbcTemplate = mock(JdbcTemplate.class);
        dialect = new PostgresDialect(jdbcTemplate, "shop");
    }

    private static ColumnInfo column(String name, String type, boolean primaryKey, boolean nullable) {
        return new ColumnInfo(name, type, primaryKey, nullable);
    }

    private static List<ColumnInfo> orderColumns() {
        List<ColumnInfo> columns = new ArrayList<>();
        ColumnInfo id = column("id", "integer", true, false);
        id.setAutoIncrement(true);
        columns.add(id);
        columns.add(column("customer_id", "bigint", false, false));
        columns.add(column("note", "character varying(50)", false, true));
        columns.add(column("total", "numeric(10,2)", false, true));
        columns.add(column("placed", "timestamp without time zone", false, true));
        columns.add(column("paid", "boolean", false, true));
        columns.add(column("scan", "bytea", false, true));
        return columns;
    }

    @Test
    void quotesIdentifiersAndQualifiesTables() {
        assertEquals("\"we\"\"ird\"", dialect.quoteIdentifier("we\"ird"));
        assertEquals("\"shop\".\"orders\"", dialect.quoteTableName("orders"));
    }

    @Test
    void printsLiterals() {
        assertEquals("'O''Brien'", dialect.printLiteral(Cell.of("O'Brien"), "text"));
        assertEquals("'\\x00ff10'", dialect.printLiteral(Cell.of(new byte[]{0, (byte) 0xff, 0x10}), "bytea"));
        assertEquals("TRUE", dialect.printLiteral(Cell.of(true), "boolean"));
        assertEquals("'2024-03-01T12:00:00Z'",
                dialect.printLiteral(Cell.of(Instant.parse("2024-03-01T12:00:00Z")), "timestamp"));
        assertEquals("12.5", dialect.printLiteral(Cell.of(12.5), "numeric"));
        assertEquals("NULL", dialect.printLiteral(Cell.NULL, "integer"));
    }

    @Test
    void parsesDriverValues() {
        assertEquals(Cell.of(12L), dialect.parseLiteral(new BigDecimal("12.00"), "numeric"));
        assertEquals(Cell.of(12.5), dialect.parseLiteral(new BigDecimal("12.50"), "numeric"));
        assertEquals(Cell.of(Instant.parse("2024-03-01T12:00:00Z")),
                dialect.parseLiteral(Timestamp.from(Instant.parse("2024-03-01T12:00:00Z")), "timestamp"));
        assertEquals(Cell.of(true), dialect.parseLiteral("t", "boolean"));
        assertEquals(Cell.of("{1,2}"), dialect.parseLiteral("{1,2}", "integer[]"));
        assertEquals(Cell.NULL, dialect.parseLiteral(null, "text"));
    }

    @Test
    void printsCreateTableThatParsesBack() {
        List<ColumnInfo> columns = orderColumns();
        columns.get(1).setReferences("\"customers\"(\"id\")");
        String ddl = PostgresDialect.printCreateTable("orders", columns);
        assertEquals("CREATE TABLE \"orders\" (\n"
                + "    \"id\" integer NOT NULL GENERATED BY DEFAULT AS IDENTITY,\n"
                + "    \"customer_id\" bigint NOT NULL REFERENCES \"customers\"(\"id\"),\n"
                + "    \"note\" character varying(50),\n"
                + "    \"total\" numeric(10,2),\n"
                + "    \"placed\" timestamp without time zone,\n"
                + "    \"paid\" boolean,\n"
                + "    \"scan\" bytea,\n"
                + "    PRIMARY KEY (\"id\")\n"
                + ");", ddl);

        DataModel model = SchemaIntrospector.build(ddl, dialect, null, null);
        Field id = model.findFieldByName("id");
        assertTrue(id.isPrimaryKey());
        assertTrue(id.isAutoIncrement());
        assertTrue(model.findFieldByName("customer_id").isForeignKey());
        assertEquals(50, model.findFieldByName("note").getMaxLength());
        assertEquals(LogicalType.NUMBER, model.findFieldByName("total").getLogicalType());
        assertEquals(LogicalType.DATETIME, model.findFieldByName("placed").getLogicalType());
        assertEquals(LogicalType.BOOLEAN, model.findFieldByName("paid").getLogicalType());
        assertEquals(LogicalType.BLOB, model.findFieldByName("scan").getLogicalType());
    }

    @Test
    @SuppressWarnings("unchecked")
    void describesTableFromCatalog() {
        doReturn(orderColumns()).when(jdbcTemplate)
                .query(contains("pg_attribute"), any(RowMapper.class), any(), any(), any(), any());
        List<String[]> foreignKeys = new ArrayList<>();
        foreignKeys.add(new String[]{"customer_id", "\"customers\"(\"id\")"});
        doReturn(foreignKeys).when(jdbcTemplate)
                .query(contains("FOREIGN KEY"), any(RowMapper.class), any(), any());

        String ddl = dialect.describeTable("orders");
        assertTrue(ddl.startsWith("CREATE TABLE \"orders\" ("));
        assertTrue(ddl.contains("\"customer_id\" bigint NOT NULL REFERENCES \"customers\"(\"id\")"));
        assertEquals(7, SchemaIntrospector.build(ddl, dialect, null, null).getFieldCount());
    }

    @Test
    @SuppressWarnings("unchecked")
    void missingTableIsDataSourceError() {
        doReturn(List.of()).when(jdbcTemplate)
                .query(contains("pg_attribute"), any(RowMapper.class), any(), any(), any(), any());
        DataSourceException e = assertThrows(DataSourceException.class, () -> dialect.describeTable("ghost"));
        assertEquals(500, e.getStatusCode());
    }

    @Test
    @SuppressWarnings("unchecked")
    void catalogFailureIsDataSourceError() {
        when(jdbcTemplate.query(contains("pg_attribute"), any(RowMapper.class), any(), any(), any(), any()))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));
        DataSourceException e = assertThrows(DataSourceException.class, () -> dialect.describeTable("orders"));
        assertTrue(e.getMessage().contains("connection refused"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void executesQueriesAndUpdates() {
        doReturn(Stream.of(new Object[]{1, "a"}, new Object[]{2, "b"})).when(jdbcTemplate)
                .queryForStream(eq("SELECT 1;"), any(RowMapper.class));
        Cursor cursor = dialect.execute("SELECT 1;");
        assertTrue(cursor.next());
        assertEquals(2, cursor.getColumnCount());
        assertEquals("a", cursor.getValue(1));
        assertTrue(cursor.next());
        assertFalse(cursor.next());
        cursor.close();

        when(jdbcTemplate.update("DELETE FROM x;")).thenReturn(3);
        assertEquals(3, dialect.executeUpdate("DELETE FROM x;"));

        when(jdbcTemplate.update("DELETE FROM y;")).thenThrow(new DataAccessResourceFailureException("gone"));
        assertThrows(DataSourceException.class, () -> dialect.executeUpdate("DELETE FROM y;"));
    }
}
