package io.github.rowbase.query;

import io.github.rowbase.model.DataModel;
import io.github.rowbase.model.Field;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Field selection: a comma separated list of field names. No list selects every field.
 */
public final class SelectSpec {

    private static final SelectSpec ALL = new SelectSpec(Collections.emptySet());

    private final Set<String> fieldNames;

    private SelectSpec(Set<String> fieldNames) {
        this.fieldNames = Collections.unmodifiableSet(fieldNames);
    }

    public static SelectSpec all() {
        return ALL;
    }

    public static SelectSpec parse(String select) {
        if (select == null || select.isBlank()) {
            return ALL;
        }
        Set<String> names = new LinkedHashSet<>();
        for (String name : select.split(",")) {
            String trimmed = name.trim();
            if (!trimmed.isEmpty()) {
                names.add(trimmed);
            }
        }
        return names.isEmpty() ? ALL : new SelectSpec(names);
    }

    public boolean isEmpty() {
        return fieldNames.isEmpty();
    }

    public Set<String> getFieldNames() {
        return fieldNames;
    }

    /**
     * Whether the field is selected. Primary keys are always selected.
     */
    public boolean isSelected(Field field) {
        return isSelected(field, true);
    }

    public boolean isSelected(Field field, boolean includePrimaryKeys) {
        return fieldNames.isEmpty() || (includePrimaryKeys && field.isPrimaryKey())
                || fieldNames.contains(field.getName());
    }

    public boolean[] toMask(DataModel model, boolean includePrimaryKeys) {
        boolean[] mask = new boolean[model.getFieldCount()];
        for (int i = 0; i < mask.length; i++) {
            mask[i] = isSelected(model.getField(i), includePrimaryKeys);
        }
        return mask;
    }
}
