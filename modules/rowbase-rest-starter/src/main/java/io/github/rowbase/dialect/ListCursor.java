package io.github.rowbase.dialect;

import java.util.List;

/**
 * Cursor over rows already held in memory.
 */
public class ListCursor implements Cursor {

    private final List<Object[]> rows;
    private final int columnCount;
    private int position = -1;

    public ListCursor(List<Object[]> rows, int columnCount) {
        this.rows = rows;
        this.columnCount = columnCount;
    }

    @Override
    public boolean next() {
        if (position < rows.size()) {
            position++;
        }
        return position < rows.size();
    }

    @Override
    public Object getValue(int columnIndex) {
        if (position < 0 || position >= rows.size()) {
            throw new IllegalStateException("Cursor is not positioned on a row");
        }
        return rows.get(position)[columnIndex];
    }

    @Override
    public int getColumnCount() {
        return columnCount;
    }

    @Override
    public void close() {
        position = rows.size();
    }
}
