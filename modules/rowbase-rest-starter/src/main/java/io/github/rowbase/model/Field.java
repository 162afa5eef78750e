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

/**
 * Metadata of one table column as seen by the REST layer. Immutable.
 */
public final class Field {

    /** Column name, unique within a data model */
    private final String name;

    private final LogicalType logicalType;

    /** Lower case native type name without length or scale, e.g. {@code varchar} */
    private final String nativeType;

    /** Declared length or precision, 0 when the type has none */
    private final int maxLength;

    private final boolean isPrimaryKey;
    private final boolean isForeignKey;
    private final boolean isAutoIncrement;
    private final boolean isNotNull;

    public Field(String name, LogicalType logicalType, String nativeType, int maxLength,
                 boolean isPrimaryKey, boolean isForeignKey, boolean isAutoIncrement, boolean isNotNull) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Field name is required");
        }
        if (maxLength < 0) {
            throw new IllegalArgumentException("Field '" + name + "' max length must not be negative");
        }
        this.name = name;
        this.logicalType = logicalType;
        this.nativeType = nativeType;
        this.maxLength = maxLength;
        this.isPrimaryKey = isPrimaryKey;
        this.isForeignKey = isForeignKey;
        this.isAutoIncrement = isAutoIncrement;
        this.isNotNull = isNotNull;
    }

    public String getName() {
        return name;
    }

    public LogicalType getLogicalType() {
        return logicalType;
    }

    public String getNativeType() {
        return nativeType;
    }

    public int getMaxLength() {
        return maxLength;
    }

    public boolean isPrimaryKey() {
        return isPrimaryKey;
    }

    public boolean isForeignKey() {
        return isForeignKey;
    }

    public boolean isAutoIncrement() {
        return isAutoIncrement;
    }

    public boolean isNotNull() {
        return isNotNull;
    }

    @Override
    public String toString() {
        return "Field{" +
                "name='" + name + '\'' +
                ", logicalType=" + logicalType +
                ", nativeType='" + nativeType + '\'' +
                ", maxLength=" + maxLength +
                ", isPrimaryKey=" + isPrimaryKey +
                ", isForeignKey=" + isForeignKey +
                ", isAutoIncrement=" + isAutoIncrement +
                ", isNotNull=" + isNotNull +
                '}';
    }
}
