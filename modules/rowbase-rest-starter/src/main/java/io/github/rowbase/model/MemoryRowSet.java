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

import java.util.Iterator;
import java.util.List;

/**
 * Row set over rows held in memory, e.g. rows decoded from a request body.
 */
public class MemoryRowSet implements RowSet {

    private final DataModel dataModel;
    private final Iterator<Row> rows;
    private Row current;

    public MemoryRowSet(DataModel dataModel, List<Row> rows) {
        this.dataModel = dataModel;
        this.rows = List.copyOf(rows).iterator();
    }

    @Override
    public DataModel getDataModel() {
        return dataModel;
    }

    @Override
    public boolean next() {
        current = rows.hasNext() ? rows.next() : null;
        return current != null;
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
    }
}
