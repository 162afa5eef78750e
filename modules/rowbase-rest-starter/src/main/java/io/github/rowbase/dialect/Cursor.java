package io.github.rowbase.dialect;

/**
 * Forward only cursor over the raw result of a statement, as returned by the driver.
 * Column indexes follow the select list of the statement.
 */
public interface Cursor extends AutoCloseable {

    /**
     * Advance to the next result row. May block on the driver for more rows.
     *
     * @return false when the result is exhausted
     */
    boolean next();

    /**
     * Raw driver value of the current row.
     *
     * @param columnIndex zero based column index
     */
    Object getValue(int columnIndex);

    int getColumnCount();

    /**
     * Release the driver resources. Safe to call more than once.
     */
    @Override
    void close();
}
