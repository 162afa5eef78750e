package io.github.rowbase.codec;

import io.github.rowbase.exception.SerializationException;
import io.github.rowbase.model.DataModel;
import io.github.rowbase.model.Row;
import io.github.rowbase.model.RowSet;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * application/x-www-form-urlencoded rows, one row per line.
 */
public class UrlEncodedRowCodec implements RowCodec {

    @Override
    public ContentType getContentType() {
        return ContentType.URLENCODE;
    }

    @Override
    public String encode(RowSet rows, CodecContext context) {
        DataModel model = context.getDataModel();
        StringBuilder body = new StringBuilder();
        while (rows.next()) {
            Row row = rows.getRow();
            StringBuilder line = new StringBuilder();
            appendPair(line, context.getIdFieldName(), context.printRowId(row));
            for (int i = 0; i < model.getFieldCount(); i++) {
                if (!row.isSupplied(i) || !context.isSelected(i)) {
                    continue;
                }
                String value = context.printCell(row, i);
                if (value != null) {
                    appendPair(line, model.getField(i).getName(), value);
                }
            }
            body.append(line).append("\r\n");
        }
        return body.toString();
    }

    private static void appendPair(StringBuilder line, String name, String value) {
        if (line.length() > 0) {
            line.append('&');
        }
        line.append(encode(name)).append('=').append(encode(value));
    }

    // form encoding writes a space as '+'
    private static String encode(String text) {
        return UriUtils.encode(text, StandardCharsets.UTF_8).replace("%20", "+");
    }

    @Override
    public List<Row> decode(String body, CodecContext context) {
        DataModel model = context.getDataModel();
        List<Row> rows = new ArrayList<>();
        if (body == null) {
            return rows;
        }
        for (String line : body.split("\r?\n")) {
            if (line.isBlank()) {
                continue;
            }
            Row row = model.newRow();
            for (String pair : line.trim().split("&")) {
                if (pair.isEmpty()) {
                    continue;
                }
                int equals = pair.indexOf('=');
                String name = decode(equals < 0 ? pair : pair.substring(0, equals));
                String value = equals < 0 ? "" : decode(pair.substring(equals + 1));
                if (name.equals(context.getIdFieldName())) {
                    continue;
                }
                int index = model.findFieldIndexByName(name);
                if (index < 0) {
                    context.addWarning("Unknown form field '" + name + "' ignored");
                    continue;
                }
                row.set(index, context.parseCell(model.getField(index), value));
            }
            rows.add(row);
        }
        return rows;
    }

    private static String decode(String text) {
        try {
            return UriUtils.decode(text.replace("+", "%20"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new SerializationException("Invalid url encoding", text, e);
        }
    }
}
