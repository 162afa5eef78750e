package io.github.rowbase.dialect;

import io.github.rowbase.model.DataModel;
import io.github.rowbase.schema.SchemaIntrospector;

import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * In-memory dialect: PostgreSQL style quoting and literals, recorded statements and
 * canned query results.
 */
public class FakeDialect extends AbstractJdbcDialect {

    public static final String CUSTOMERS_DDL = """
            CREATE TABLE customers (
                id serial PRIMARY KEY,
                name varchar(20) NOT NULL,
                age integer,
                active boolean,
                created timestamp,
                photo bytea,
                group_id integer REFERENCES groups(id)
            );
            """;

    private final List<String> executed = new ArrayList<>();
    private final List<Object[]> results = new ArrayList<>();
    private int updateCount = 1;
    private int openCursors;
    private RuntimeException failure;

    public FakeDialect() {
        super(null);
    }

    public static DataModel customers(FakeDialect dialect) {
        return SchemaIntrospector.build(CUSTOMERS_DDL, dialect, null, null);
    }

    public List<String> getExecuted() {
        return executed;
    }

    public void addResult(Object... row) {
        results.add(row);
    }

    public int getOpenCursors() {
        return openCursors;
    }

    public void setUpdateCount(int updateCount) {
        this.updateCount = updateCount;
    }

    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    @Override
    public String getName() {
        return "fake";
    }

    @Override
    public String quoteIdentifier(String name) {
        return "\"" + name.replace("\"", "\"\"") + "\"";
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
        return CUSTOMERS_DDL;
    }

    @Override
    public Cursor execute(String sql) {
        executed.add(sql);
        if (failure != null) {
            throw failure;
        }
        int columns = results.isEmpty() ? 0 : results.get(0).length;
        openCursors++;
        return new ListCursor(new ArrayList<>(results), columns) {
            private boolean closed;

            @Override
            public void close() {
                super.close();
                if (!closed) {
                    closed = true;
                    openCursors--;
                }
            }
        };
    }

    @Override
    public int executeUpdate(String sql) {
        executed.add(sql);
        if (failure != null) {
            throw failure;
        }
        return updateCount;
    }
}
