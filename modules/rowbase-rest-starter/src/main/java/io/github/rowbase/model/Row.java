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

import java.util.Arrays;

/**
 * Fixed length sequence of cells aligned to the field order of a {@link DataModel}.
 *
 * <p>A slot holding Java {@code null} means the value was not supplied at all, which is
 * different from a {@link Cell#NULL} value. Inserts and updates only touch supplied slots.</p>
 */
public final class Row {

    private final Cell[] cells;

    public Row(int size) {
        this.cells = new Cell[size];
    }

    public int size() {
        return cells.length;
    }

    public Cell get(int index) {
        return cells[index];
    }

    public boolean isSupplied(int index) {
        return cells[index] != null;
    }

    public void set(int index, Cell cell) {
        cells[index] = cell;
    }

    /**
     * True when no slot has been supplied.
     */
    public boolean isEmpty() {
        for (Cell cell : cells) {
            if (cell != null) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Row)) {
            return false;
        }
        return Arrays.equals(cells, ((Row) o).cells);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(cells);
    }

    @Override
    public String toString() {
        return Arrays.toString(cells);
    }
}
