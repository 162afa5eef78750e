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

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * A single typed value of a row. Immutable.
 *
 * <p>The {@link CellKind} tells which accessor is valid. Numeric accessors accept both
 * numeric kinds; every other accessor throws {@link IllegalStateException} on a kind
 * mismatch.</p>
 */
public final class Cell {

    public static final Cell NULL = new Cell(CellKind.NULL, null);

    private static final Cell TRUE = new Cell(CellKind.BOOL, Boolean.TRUE);
    private static final Cell FALSE = new Cell(CellKind.BOOL, Boolean.FALSE);

    private final CellKind kind;
    private final Object value;

    private Cell(CellKind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static Cell of(String value) {
        return value == null ? NULL : new Cell(CellKind.STRING, value);
    }

    public static Cell of(long value) {
        return new Cell(CellKind.INT64, value);
    }

    public static Cell of(double value) {
        return new Cell(CellKind.FLOAT64, value);
    }

    public static Cell of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Cell of(Instant value) {
        return value == null ? NULL : new Cell(CellKind.TIMESTAMP, value);
    }

    public static Cell of(byte[] value) {
        return value == null ? NULL : new Cell(CellKind.BYTES, value.clone());
    }

    public CellKind getKind() {
        return kind;
    }

    public boolean isNull() {
        return kind == CellKind.NULL;
    }

    public boolean isNumber() {
        return kind == CellKind.INT64 || kind == CellKind.FLOAT64;
    }

    public String asString() {
        expect(CellKind.STRING);
        return (String) value;
    }

    public long asLong() {
        if (kind == CellKind.INT64) {
            return (Long) value;
        }
        if (kind == CellKind.FLOAT64) {
            return ((Double) value).longValue();
        }
        throw new IllegalStateException("Cell of kind " + kind + " is not numeric");
    }

    public double asDouble() {
        if (kind == CellKind.FLOAT64) {
            return (Double) value;
        }
        if (kind == CellKind.INT64) {
            return ((Long) value).doubleValue();
        }
        throw new IllegalStateException("Cell of kind " + kind + " is not numeric");
    }

    public boolean asBoolean() {
        expect(CellKind.BOOL);
        return (Boolean) value;
    }

    public Instant asTimestamp() {
        expect(CellKind.TIMESTAMP);
        return (Instant) value;
    }

    public byte[] asBytes() {
        expect(CellKind.BYTES);
        return ((byte[]) value).clone();
    }

    /**
     * Plain text form of the value: canonical decimal text for numbers, ISO-8601 for
     * timestamps, base64 for bytes. {@code null} for the null cell.
     */
    public String toText() {
        return switch (kind) {
            case STRING -> (String) value;
            case INT64 -> Long.toString((Long) value);
            case FLOAT64 -> printDecimal((Double) value);
            case BOOL, TIMESTAMP -> value.toString();
            case BYTES -> Base64.getEncoder().encodeToString((byte[]) value);
            case NULL -> null;
        };
    }

    static String printDecimal(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private void expect(CellKind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Cell of kind " + kind + " read as " + expected);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Cell)) {
            return false;
        }
        Cell other = (Cell) o;
        if (kind != other.kind) {
            return false;
        }
        if (kind == CellKind.BYTES) {
            return Arrays.equals((byte[]) value, (byte[]) other.value);
        }
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        if (kind == CellKind.BYTES) {
            return 31 * kind.hashCode() + Arrays.hashCode((byte[]) value);
        }
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind == CellKind.NULL ? "NULL" : kind + ":" + toText();
    }
}
