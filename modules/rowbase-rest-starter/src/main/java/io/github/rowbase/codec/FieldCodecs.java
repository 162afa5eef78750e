package io.github.rowbase.codec;

import io.github.rowbase.exception.SerializationException;
import io.github.rowbase.model.Cell;
import io.github.rowbase.model.Field;
import io.github.rowbase.model.LogicalType;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.Base64;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Serialize/deserialize rules per logical type, looked up from a table rather than
 * dispatched through a field class hierarchy.
 */
public final class FieldCodecs {

    private static final Pattern INTEGER_PATTERN = Pattern.compile("^[+-]?\\d+$");
    private static final Pattern DECIMAL_PATTERN = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");
    private static final Pattern ZEROS_PATTERN = Pattern.compile("^0+$");

    private static final DateTimeFormatter SQL_DATETIME = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .toFormatter();

    private static final Map<LogicalType, FieldCodec> CODECS;

    static {
        Map<LogicalType, FieldCodec> codecs = new EnumMap<>(LogicalType.class);
        codecs.put(LogicalType.STRING, codec(Cell::toText, Cell::of));
        codecs.put(LogicalType.NUMBER, codec(Cell::toText, FieldCodecs::parseNumber));
        codecs.put(LogicalType.BOOLEAN, codec(FieldCodecs::printBoolean, text -> Cell.of(parseBoolean(text))));
        codecs.put(LogicalType.DATETIME, codec(Cell::toText, FieldCodecs::parseDatetime));
        codecs.put(LogicalType.BLOB, codec(Cell::toText, FieldCodecs::parseBase64));
        CODECS = Collections.unmodifiableMap(codecs);
    }

    private FieldCodecs() {
    }

    public static FieldCodec forType(LogicalType type) {
        return CODECS.get(type);
    }

    /**
     * Text of a cell of the field. A missing or null cell gives {@code null}.
     */
    public static String serialize(Field field, Cell cell) {
        if (cell == null || cell.isNull()) {
            return null;
        }
        return forType(field.getLogicalType()).serialize(cell);
    }

    /**
     * Cell of the field from wire text. {@code null} text is an explicit null, except for
     * blobs where it becomes an empty byte buffer.
     */
    public static Cell deserialize(Field field, String text) {
        if (text == null) {
            return field.getLogicalType() == LogicalType.BLOB ? Cell.of(new byte[0]) : Cell.NULL;
        }
        return forType(field.getLogicalType()).deserialize(text);
    }

    /**
     * Empty text is zero. Integral text within the int64 range becomes an int64 cell,
     * other decimal text a float64 cell.
     */
    public static Cell parseNumber(String text) {
        String value = text.trim();
        if (value.isEmpty()) {
            return Cell.of(0L);
        }
        if (INTEGER_PATTERN.matcher(value).matches()) {
            try {
                return Cell.of(Long.parseLong(value));
            } catch (NumberFormatException e) {
                // out of int64 range
                return Cell.of(Double.parseDouble(value));
            }
        }
        if (DECIMAL_PATTERN.matcher(value).matches()) {
            return Cell.of(Double.parseDouble(value));
        }
        throw new SerializationException("Invalid number", text);
    }

    /**
     * Empty text, {@code false} and all-zero digit strings are false, anything else is true.
     */
    public static boolean parseBoolean(String text) {
        String value = text.trim();
        return !(value.isEmpty() || value.equalsIgnoreCase("false") || ZEROS_PATTERN.matcher(value).matches());
    }

    public static Cell parseDatetime(String text) {
        String value = text.trim();
        if (value.isEmpty()) {
            return Cell.NULL;
        }
        try {
            if (value.length() <= 10) {
                return Cell.of(LocalDate.parse(value).atStartOfDay().toInstant(ZoneOffset.UTC));
            }
            if (value.endsWith("Z") || value.endsWith("z")) {
                return Cell.of(Instant.parse(value.toUpperCase()));
            }
            if (value.indexOf('T') > 0) {
                return parseIsoDatetime(value);
            }
            return Cell.of(LocalDateTime.parse(value, SQL_DATETIME).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            throw new SerializationException("Invalid datetime", text, e);
        }
    }

    private static Cell parseIsoDatetime(String value) {
        try {
            return Cell.of(OffsetDateTime.parse(value).toInstant());
        } catch (DateTimeParseException e) {
            return Cell.of(LocalDateTime.parse(value).toInstant(ZoneOffset.UTC));
        }
    }

    public static Cell parseBase64(String text) {
        try {
            return Cell.of(Base64.getDecoder().decode(text.replaceAll("\\s", "")));
        } catch (IllegalArgumentException e) {
            throw new SerializationException("Invalid base64 data", abbreviate(text), e);
        }
    }

    private static String printBoolean(Cell cell) {
        return switch (cell.getKind()) {
            case BOOL -> Boolean.toString(cell.asBoolean());
            case INT64, FLOAT64 -> Boolean.toString(cell.asDouble() != 0);
            default -> Boolean.toString(parseBoolean(cell.toText()));
        };
    }

    public static String abbreviate(String text) {
        return text.length() > 64 ? text.substring(0, 64) + "..." : text;
    }

    private static FieldCodec codec(Function<Cell, String> serializer, Function<String, Cell> deserializer) {
        return new FieldCodec() {
            @Override
            public String serialize(Cell cell) {
                return serializer.apply(cell);
            }

            @Override
            public Cell deserialize(String text) {
                return deserializer.apply(text);
            }
        };
    }
}
