package io.github.rowbase.service;

import io.github.rowbase.model.Cell;
import io.github.rowbase.model.CellKind;
import io.github.rowbase.model.DataModel;
import io.github.rowbase.model.Field;
import io.github.rowbase.model.Row;
import io.github.rowbase.settings.ResourceSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks decoded rows against the constraints of their table before they are written.
 */
public class RowValidator {

    private static final Logger log = LoggerFactory.getLogger(RowValidator.class);

    private final DataModel dataModel;
    private final ResourceSettings settings;

    public RowValidator(DataModel dataModel, ResourceSettings settings) {
        this.dataModel = dataModel;
        this.settings = settings;
    }

    /**
     * Validate a row to insert or update.
     *
     * @param insert whether the row is inserted, otherwise it updates an existing row
     * @param result receives warnings that do not reject the row
     * @return errors rejecting the row, empty if the row is valid
     */
    public List<String> validate(Row row, boolean insert, ApiResult result, String operation) {
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < dataModel.getFieldCount(); i++) {
            Field field = dataModel.getField(i);
            Cell cell = row.get(i);

            if ((field.isNotNull() || field.isPrimaryKey()) && cell != null && cell.isNull()) {
                errors.add("Field '" + field.getName() + "' is not allowed to be NULL!");
            }
            if (insert && field.isPrimaryKey() && !field.isAutoIncrement()
                    && settings.isFailOnInsertWithoutKey() && (cell == null || cell.isNull())) {
                errors.add("Primary key '" + field.getName() + "' is not autoinc and missing from the data!");
            }
            if (!insert && field.isAutoIncrement() && !field.isPrimaryKey()
                    && settings.isFailOnUpdateOnAutoinc() && cell != null) {
                errors.add("Autoinc field '" + field.getName() + "' can't be updated!");
            }
            if (field.getMaxLength() > 0 && cell != null && cell.getKind() == CellKind.STRING
                    && cell.asString().length() > field.getMaxLength()) {
                String message = "Value of field '" + field.getName() + "' is longer than " + field.getMaxLength()
                        + " characters!";
                if (settings.isFailOnOversizedValues()) {
                    errors.add(message);
                } else {
                    result.addWarning(message, operation);
                }
            }
        }
        if (!errors.isEmpty()) {
            log.debug("Row rejected for table {}: {}", dataModel.getTableName(), errors);
        }
        return errors;
    }
}
