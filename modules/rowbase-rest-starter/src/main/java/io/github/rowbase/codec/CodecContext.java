package io.github.rowbase.codec;

import io.github.rowbase.hashid.IdCodec;
import io.github.rowbase.model.Cell;
import io.github.rowbase.model.DataModel;
import io.github.rowbase.model.Field;
import io.github.rowbase.model.LogicalType;
import io.github.rowbase.model.Row;
import io.github.rowbase.query.ResourceId;
import io.github.rowbase.settings.ApiSettings;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Per request state shared by the row codecs: the table model, id settings, the field
 * selection and the warnings collected while encoding or decoding.
 */
public class CodecContext {

    private final DataModel dataModel;
    private final ApiSettings apiSettings;
    private final IdCodec idCodec;
    private final List<String> warnings = new ArrayList<>();
    private boolean[] selected;
    private String boundary;

    /**
     * @param idCodec codec of hashed ids, or {@code null} when ids are not hashed
     */
    public CodecContext(DataModel dataModel, ApiSettings apiSettings, IdCodec idCodec) {
        this.dataModel = dataModel;
        this.apiSettings = apiSettings;
        this.idCodec = idCodec;
        this.selected = new boolean[dataModel.getFieldCount()];
        Arrays.fill(selected, true);
    }

    public DataModel getDataModel() {
        return dataModel;
    }

    public ApiSettings getApiSettings() {
        return apiSettings;
    }

    public String getIdFieldName() {
        return apiSettings.getIdFieldName();
    }

    public boolean isSelected(int fieldIndex) {
        return selected[fieldIndex];
    }

    public void setSelected(boolean[] selected) {
        if (selected.length != dataModel.getFieldCount()) {
            throw new IllegalArgumentException("Selection size does not match the data model");
        }
        this.selected = selected.clone();
    }

    /**
     * Multipart boundary of the body, without the leading dashes.
     */
    public String getBoundary() {
        return boundary;
    }

    public void setBoundary(String boundary) {
        this.boundary = boundary;
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    /**
     * Whether values of the field travel as id tokens.
     */
    public boolean isHashed(Field field) {
        return idCodec != null && field.getLogicalType() == LogicalType.NUMBER
                && (field.isPrimaryKey() || field.isForeignKey());
    }

    /**
     * Id of a row: its primary key values, hashed where configured, joined with the separator.
     */
    public String printRowId(Row row) {
        String seed = rowSeed(row);
        List<String> keyValues = new ArrayList<>();
        for (int i = 0; i < dataModel.getFieldCount(); i++) {
            Field field = dataModel.getField(i);
            if (!field.isPrimaryKey()) {
                continue;
            }
            Cell cell = row.get(i);
            String value = cell == null || cell.isNull() ? "" : cell.toText();
            if (!value.isEmpty() && isHashed(field)) {
                value = idCodec.encode(value, field.getName() + " " + seed);
            }
            keyValues.add(value);
        }
        return ResourceId.print(keyValues, apiSettings.getIdSeparator());
    }

    /**
     * Wire text of a supplied cell, {@code null} for a null cell.
     */
    public String printCell(Row row, int fieldIndex) {
        Field field = dataModel.getField(fieldIndex);
        Cell cell = row.get(fieldIndex);
        if (cell == null || cell.isNull()) {
            return null;
        }
        if (isHashed(field)) {
            return idCodec.encode(cell.toText(), field.getName() + " " + rowSeed(row));
        }
        return FieldCodecs.serialize(field, cell);
    }

    /**
     * Cell of the field from wire text, decoding id tokens first.
     */
    public Cell parseCell(Field field, String text) {
        if (text != null && isHashed(field)) {
            return FieldCodecs.deserialize(field, idCodec.decode(text));
        }
        return FieldCodecs.deserialize(field, text);
    }

    private String rowSeed(Row row) {
        return String.join(" ", dataModel.getRowPrimaryKeyValues(row));
    }
}
