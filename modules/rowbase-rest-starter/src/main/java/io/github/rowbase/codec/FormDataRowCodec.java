package io.github.rowbase.codec;

import io.github.rowbase.exception.SerializationException;
import io.github.rowbase.model.Cell;
import io.github.rowbase.model.DataModel;
import io.github.rowbase.model.Field;
import io.github.rowbase.model.LogicalType;
import io.github.rowbase.model.Row;
import io.github.rowbase.model.RowSet;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * multipart/form-data with one part per field. A body carries a single row; blobs travel
 * as base64 file parts.
 */
public class FormDataRowCodec implements RowCodec {

    private static final String CRLF = "\r\n";
    private static final Pattern NAME_PATTERN = Pattern.compile(";\\s*name=\"([^\"]*)\"", Pattern.CASE_INSENSITIVE);

    @Override
    public ContentType getContentType() {
        return ContentType.FORMDATA;
    }

    @Override
    public String encode(RowSet rows, CodecContext context) {
        String boundary = requireBoundary(context);
        if (!rows.next()) {
            return "";
        }
        DataModel model = context.getDataModel();
        Row row = rows.getRow();
        StringBuilder body = new StringBuilder();
        appendParameter(body, boundary, context.getIdFieldName(), context.printRowId(row));
        for (int i = 0; i < model.getFieldCount(); i++) {
            if (!row.isSupplied(i) || !context.isSelected(i)) {
                continue;
            }
            Field field = model.getField(i);
            String value = context.printCell(row, i);
            if (value == null) {
                continue;
            }
            if (field.getLogicalType() == LogicalType.BLOB) {
                appendFile(body, boundary, field.getName(), value);
            } else {
                appendParameter(body, boundary, field.getName(), value);
            }
        }
        body.append("--").append(boundary).append("--").append(CRLF);
        if (rows.next()) {
            context.addWarning("Form data carries one row, further rows were not encoded");
        }
        return body.toString();
    }

    private static void appendParameter(StringBuilder body, String boundary, String name, String value) {
        body.append("--").append(boundary).append(CRLF)
                .append("Content-Disposition: form-data; name=\"").append(name).append('"').append(CRLF)
                .append(CRLF)
                .append(value).append(CRLF);
    }

    private static void appendFile(StringBuilder body, String boundary, String name, String base64) {
        body.append("--").append(boundary).append(CRLF)
                .append("Content-Disposition: form-data; name=\"").append(name)
                .append("\"; filename=\"").append(name).append('"').append(CRLF)
                .append("Content-Type: application/octet-stream").append(CRLF)
                .append("Content-Transfer-Encoding: BASE64").append(CRLF)
                .append(CRLF)
                .append(base64).append(CRLF);
    }

    @Override
    public List<Row> decode(String body, CodecContext context) {
        String boundary = requireBoundary(context);
        DataModel model = context.getDataModel();
        List<Row> rows = new ArrayList<>();
        if (body == null || body.isBlank()) {
            return rows;
        }
        String delimiter = "--" + boundary;
        if (!body.contains(delimiter)) {
            throw new SerializationException("Form data body has no part delimiter", delimiter);
        }
        Row row = model.newRow();
        String[] parts = body.split(Pattern.quote(delimiter), -1);
        // parts[0] is the preamble, a part starting with "--" is the epilogue
        for (int p = 1; p < parts.length; p++) {
            String part = parts[p];
            if (part.startsWith("--")) {
                break;
            }
            decodePart(stripLineBreaks(part), row, context);
        }
        rows.add(row);
        return rows;
    }

    private void decodePart(String part, Row row, CodecContext context) {
        int headerEnd = part.indexOf(CRLF + CRLF);
        int separatorLength = 4;
        if (headerEnd < 0) {
            headerEnd = part.indexOf("\n\n");
            separatorLength = 2;
        }
        if (headerEnd < 0) {
            throw new SerializationException("Form data part has no header", FieldCodecs.abbreviate(part));
        }
        String headers = part.substring(0, headerEnd);
        String content = part.substring(headerEnd + separatorLength);

        String name = null;
        boolean base64 = false;
        for (String header : headers.split("\r?\n")) {
            String lower = header.toLowerCase(Locale.ROOT);
            if (lower.startsWith("content-disposition:")) {
                Matcher nameMatcher = NAME_PATTERN.matcher(header);
                if (nameMatcher.find()) {
                    name = nameMatcher.group(1);
                }
            } else if (lower.startsWith("content-transfer-encoding:")) {
                base64 = lower.substring("content-transfer-encoding:".length()).trim().equals("base64");
            }
        }
        if (name == null) {
            throw new SerializationException("Form data part has no name", FieldCodecs.abbreviate(headers));
        }
        if (name.equals(context.getIdFieldName())) {
            return;
        }
        DataModel model = context.getDataModel();
        int index = model.findFieldIndexByName(name);
        if (index < 0) {
            context.addWarning("Unknown form field '" + name + "' ignored");
            return;
        }
        Field field = model.getField(index);
        if (field.getLogicalType() == LogicalType.BLOB) {
            row.set(index, base64 ? FieldCodecs.parseBase64(content)
                    : Cell.of(content.getBytes(StandardCharsets.UTF_8)));
        } else if (base64) {
            try {
                String text = new String(Base64.getMimeDecoder().decode(content), StandardCharsets.UTF_8);
                row.set(index, context.parseCell(field, text));
            } catch (IllegalArgumentException e) {
                throw new SerializationException("Invalid base64 data", FieldCodecs.abbreviate(content), e);
            }
        } else {
            row.set(index, context.parseCell(field, content));
        }
    }

    private static String stripLineBreaks(String part) {
        String result = part;
        if (result.startsWith(CRLF)) {
            result = result.substring(2);
        } else if (result.startsWith("\n")) {
            result = result.substring(1);
        }
        if (result.endsWith(CRLF)) {
            result = result.substring(0, result.length() - 2);
        } else if (result.endsWith("\n")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static String requireBoundary(CodecContext context) {
        String boundary = context.getBoundary();
        if (boundary == null || boundary.isEmpty()) {
            throw new SerializationException("Missing multipart boundary", ContentType.FORMDATA.getMimeType());
        }
        return boundary;
    }
}
