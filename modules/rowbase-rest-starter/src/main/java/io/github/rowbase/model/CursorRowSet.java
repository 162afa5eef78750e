/*
 * Copyright 2025 Rowbase Team and/or its affiliates
 * and other contributors as indicated by the @author tags.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.github.rowbase.model;

import io.github.rowbase.dialect.Cursor;
import io.github.rowbase.dialect.SqlDialect;
import io.github.rowbase.exception.DataSourceException;

/**
 * Row set reading typed rows from a dialect cursor. Columns are expected in field order;
 * fields outside the selection are left unsupplied.
 */
public class CursorRowSet implements RowSet {

    private final DataModel dataModel;
    private final Cursor cursor;
    private final boolean[] selected;
    private Row current;

    public CursorRowSet(DataModel dataModel, Cursor cursor, boolean[] selected) {
        if (selected.length != dataModel.getFieldCount()) {
            throw new IllegalArgumentException("Selection size does not match the data model");
        }
        this.dataModel = dataModel;
        this.cursor = cursor;
        this.selected = selected.clone();
    }

    @Override
    public DataModel getDataModel() {
        return dataModel;
    }

    @Override
    public boolean next() {
        if (!cursor.next()) {
            current = null;
            return false;
        }
        if (cursor.getColumnCount() != dataModel.getFieldCount()) {
            throw new DataSourceException("Result has " + cursor.getColumnCount() + " columns, table "
                    + dataModel.getTableName() + " has " + dataModel.getFieldCount() + " fields");
        }
        SqlDialect dialect = dataModel.getDialect();
        Row row = dataModel.newRow();
        for (int i = 0; i < selected.length; i++) {
            if (selected[i]) {
                Field field = dataModel.getField(i);
                row.set(i, dialect.parseLiteral(cursor.getValue(i), field.getNativeType()));
            }
        }
        current = row;
        return true;
    }

    @Override
    public Row getRow() {
        if (current == null) {
            throw new IllegalStateException("Row set is not positioned on a row");
        }
        return current;
    }

    @Override
    public void close() {
        current = null;
        cursor.close();
    }
}
