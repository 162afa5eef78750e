package io.github.rowbase.codec;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.enums.CSVReaderNullFieldIndicator;
import com.opencsv.exceptions.CsvValidationException;
import io.github.rowbase.exception.SerializationException;
import io.github.rowbase.model.DataModel;
import io.github.rowbase.model.Row;
import io.github.rowbase.model.RowSet;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * RFC 4180 CSV rows with a header line. Values are always quoted and a null value is an
 * empty unquoted cell, so {@code ""} and null stay distinct.
 */
public class CsvRowCodec implements RowCodec {

    private static final String LINE_END = "\r\n";

    @Override
    public ContentType getContentType() {
        return ContentType.CSV;
    }

    @Override
    public String encode(RowSet rows, CodecContext context) {
        DataModel model = context.getDataModel();
        StringWriter body = new StringWriter();
        try (ICSVWriter writer = new CSVWriter(body, ',', '"', '"', LINE_END)) {
            List<String> header = new ArrayList<>();
            header.add(context.getIdFieldName());
            for (int i = 0; i < model.getFieldCount(); i++) {
                if (context.isSelected(i)) {
                    header.add(model.getField(i).getName());
                }
            }
            writer.writeNext(header.toArray(new String[0]), true);
            while (rows.next()) {
                Row row = rows.getRow();
                List<String> values = new ArrayList<>(header.size());
                values.add(context.printRowId(row));
                for (int i = 0; i < model.getFieldCount(); i++) {
                    if (context.isSelected(i)) {
                        values.add(row.isSupplied(i) ? context.printCell(row, i) : null);
                    }
                }
                writer.writeNext(values.toArray(new String[0]), true);
            }
        } catch (IOException e) {
            throw new SerializationException("Failed to write CSV", model.getTableName(), e);
        }
        return body.toString();
    }

    @Override
    public List<Row> decode(String body, CodecContext context) {
        DataModel model = context.getDataModel();
        List<Row> rows = new ArrayList<>();
        CSVReader reader = new CSVReaderBuilder(new StringReader(body))
                .withCSVParser(new RFC4180ParserBuilder()
                        .withFieldAsNull(CSVReaderNullFieldIndicator.EMPTY_SEPARATORS)
                        .build())
                .build();
        try (reader) {
            String[] header = reader.readNext();
            if (header == null) {
                return rows;
            }
            int[] fieldIndexes = new int[header.length];
            for (int i = 0; i < header.length; i++) {
                String name = header[i] == null ? "" : header[i].trim();
                fieldIndexes[i] = name.equals(context.getIdFieldName()) ? -1 : model.findFieldIndexByName(name);
                if (fieldIndexes[i] < 0 && !name.equals(context.getIdFieldName())) {
                    context.addWarning("Unknown CSV column '" + name + "' ignored");
                }
            }
            String[] line;
            while ((line = reader.readNext()) != null) {
                if (line.length == 1 && (line[0] == null || line[0].isEmpty())) {
                    continue;
                }
                if (line.length != header.length) {
                    throw new SerializationException("CSV line " + reader.getLinesRead() + " has " + line.length
                            + " values, header has " + header.length, FieldCodecs.abbreviate(Arrays.toString(line)));
                }
                Row row = model.newRow();
                for (int i = 0; i < line.length; i++) {
                    if (fieldIndexes[i] >= 0) {
                        row.set(fieldIndexes[i], context.parseCell(model.getField(fieldIndexes[i]), line[i]));
                    }
                }
                rows.add(row);
            }
        } catch (IOException | CsvValidationException e) {
            throw new SerializationException("Invalid CSV", FieldCodecs.abbreviate(body), e);
        }
        return rows;
    }
}
