package io.github.rowbase.dialect;

import io.github.rowbase.exception.DataSourceException;
import org.springframework.dao.DataAccessException;

import java.util.Iterator;
import java.util.stream.Stream;

/**
 * Cursor over a lazily fetched JDBC result stream. Rows are pulled from the driver
 * one at a time, closing the cursor closes the underlying statement.
 */
public class StreamCursor implements Cursor {

    private final Stream<Object[]> stream;
    private final Iterator<Object[]> iterator;
    private final int columnCount;
    private Object[] current;
    private boolean closed;

    public StreamCursor(Stream<Object[]> stream, int columnCount) {
        this.stream = stream;
        this.iterator = stream.iterator();
        this.columnCount = columnCount;
    }

    @Override
    public boolean next() {
        if (closed) {
            return false;
        }
        try {
            if (iterator.hasNext()) {
                current = iterator.next();
                return true;
            }
        } catch (DataAccessException e) {
            close();
            throw new DataSourceException(e.getMostSpecificCause().getMessage(), e);
        }
        current = null;
        close();
        return false;
    }

    @Override
    public Object getValue(int columnIndex) {
        if (current == null) {
            throw new IllegalStateException("Cursor is not positioned on a row");
        }
        return current[columnIndex];
    }

    @Override
    public int getColumnCount() {
        return current != null ? current.length : columnCount;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            stream.close();
        }
    }
}
