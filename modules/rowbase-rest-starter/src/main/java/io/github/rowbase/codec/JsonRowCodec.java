package io.github.rowbase.codec;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.rowbase.exception.SerializationException;
import io.github.rowbase.model.Cell;
import io.github.rowbase.model.CellKind;
import io.github.rowbase.model.DataModel;
import io.github.rowbase.model.Field;
import io.github.rowbase.model.Row;
import io.github.rowbase.model.RowSet;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * JSON rows: an array of objects keyed by field name, with the row id first.
 */
public class JsonRowCodec implements RowCodec {

    private final ObjectMapper objectMapper;

    public JsonRowCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ContentType getContentType() {
        return ContentType.JSON;
    }

    @Override
    public String encode(RowSet rows, CodecContext context) {
        StringBuilder body = new StringBuilder("[");
        int count = 0;
        while (rows.next()) {
            String row = encodeRow(rows.getRow(), context);
            body.append(count++ == 0 ? "\r\n" : ",\r\n").append(row);
        }
        if (count > 0) {
            body.append("\r\n");
        }
        return body.append(']').toString();
    }

    private String encodeRow(Row row, CodecContext context) {
        DataModel model = context.getDataModel();
        StringWriter buffer = new StringWriter();
        try (JsonGenerator generator = objectMapper.getFactory().createGenerator(buffer)) {
            generator.writeStartObject();
            generator.writeStringField(context.getIdFieldName(), context.printRowId(row));
            for (int i = 0; i < model.getFieldCount(); i++) {
                if (!row.isSupplied(i) || !context.isSelected(i)) {
                    continue;
                }
                Field field = model.getField(i);
                Cell cell = row.get(i);
                generator.writeFieldName(field.getName());
                if (cell.isNull()) {
                    generator.writeNull();
                } else if (context.isHashed(field)) {
                    generator.writeString(context.printCell(row, i));
                } else {
                    writeValue(generator, field, cell);
                }
            }
            generator.writeEndObject();
        } catch (IOException e) {
            throw new SerializationException("Failed to write JSON row", String.valueOf(row), e);
        }
        return buffer.toString();
    }

    private void writeValue(JsonGenerator generator, Field field, Cell cell) throws IOException {
        switch (field.getLogicalType()) {
            case NUMBER -> {
                if (cell.getKind() == CellKind.INT64) {
                    generator.writeNumber(cell.asLong());
                } else if (cell.getKind() == CellKind.FLOAT64) {
                    generator.writeNumber(cell.asDouble());
                } else {
                    generator.writeString(cell.toText());
                }
            }
            case BOOLEAN -> generator.writeBoolean(FieldCodecs.parseBoolean(FieldCodecs.serialize(field, cell)));
            default -> generator.writeString(FieldCodecs.serialize(field, cell));
        }
    }

    @Override
    public List<Row> decode(String body, CodecContext context) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Invalid JSON", FieldCodecs.abbreviate(body), e);
        }
        List<Row> rows = new ArrayList<>();
        if (root == null || root.isMissingNode()) {
            return rows;
        }
        if (root.isObject()) {
            rows.add(decodeRow(root, context));
        } else if (root.isArray()) {
            for (JsonNode element : root) {
                if (!element.isObject()) {
                    throw new SerializationException("JSON row is not an object", FieldCodecs.abbreviate(element.toString()));
                }
                rows.add(decodeRow(element, context));
            }
        } else {
            throw new SerializationException("JSON body is not an object or array", FieldCodecs.abbreviate(body));
        }
        return rows;
    }

    private Row decodeRow(JsonNode node, CodecContext context) {
        DataModel model = context.getDataModel();
        Row row = model.newRow();
        Iterator<Map.Entry<String, JsonNode>> entries = node.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (entry.getKey().equals(context.getIdFieldName())) {
                continue;
            }
            int index = model.findFieldIndexByName(entry.getKey());
            if (index < 0) {
                context.addWarning("Unknown field '" + entry.getKey() + "' ignored");
                continue;
            }
            JsonNode value = entry.getValue();
            String text;
            if (value.isNull()) {
                text = null;
            } else if (value.isValueNode()) {
                text = value.asText();
            } else {
                text = value.toString();
            }
            row.set(index, context.parseCell(model.getField(index), text));
        }
        return row;
    }
}
