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

import io.github.rowbase.dialect.SqlDialect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered, typed description of a table's columns, built once by schema introspection.
 *
 * <p>Instances are immutable and may be read concurrently without synchronization.
 * Field order is column order and defines the slot order of every {@link Row}.</p>
 */
public final class DataModel {

    private final String tableName;
    private final SqlDialect dialect;
    private final List<Field> fields;
    private final List<Field> primaryKeyFields;
    private final Map<String, Integer> indexByName;

    public DataModel(String tableName, SqlDialect dialect, List<Field> fields) {
        if (tableName == null || tableName.isEmpty()) {
            throw new IllegalArgumentException("Table name is required");
        }
        Map<String, Integer> index = new HashMap<>();
        List<Field> keys = new ArrayList<>();
        for (int i = 0; i < fields.size(); i++) {
            Field field = fields.get(i);
            if (index.put(field.getName(), i) != null) {
                throw new IllegalArgumentException("Duplicate field '" + field.getName() + "' in table " + tableName);
            }
            if (field.isPrimaryKey()) {
                keys.add(field);
            }
        }
        this.tableName = tableName;
        this.dialect = dialect;
        this.fields = List.copyOf(fields);
        this.primaryKeyFields = Collections.unmodifiableList(keys);
        this.indexByName = Collections.unmodifiableMap(index);
    }

    public String getTableName() {
        return tableName;
    }

    public SqlDialect getDialect() {
        return dialect;
    }

    public List<Field> getFields() {
        return fields;
    }

    public int getFieldCount() {
        return fields.size();
    }

    public Field getField(int index) {
        return fields.get(index);
    }

    /**
     * @return the field or {@code null} when the model has no field of that name
     */
    public Field findFieldByName(String name) {
        Integer index = indexByName.get(name);
        return index == null ? null : fields.get(index);
    }

    /**
     * @return the field index or -1
     */
    public int findFieldIndexByName(String name) {
        Integer index = indexByName.get(name);
        return index == null ? -1 : index;
    }

    public List<Field> getPrimaryKeyFields() {
        return primaryKeyFields;
    }

    public Row newRow() {
        return new Row(fields.size());
    }

    /**
     * Text values of the primary key cells of a row, in field order.
     * A missing or null key cell gives an empty string.
     */
    public List<String> getRowPrimaryKeyValues(Row row) {
        List<String> values = new ArrayList<>(primaryKeyFields.size());
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).isPrimaryKey()) {
                Cell cell = row.get(i);
                values.add(cell == null || cell.isNull() ? "" : cell.toText());
            }
        }
        return values;
    }

    @Override
    public String toString() {
        return "DataModel{" +
                "tableName='" + tableName + '\'' +
                ", dialect=" + (dialect == null ? null : dialect.getName()) +
                ", fields=" + fields +
                '}';
    }
}
