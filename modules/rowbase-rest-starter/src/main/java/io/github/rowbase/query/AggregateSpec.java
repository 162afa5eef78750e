package io.github.rowbase.query;

import io.github.rowbase.model.DataModel;
import io.github.rowbase.model.Field;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Aggregation of a query: a comma separated list of {@code count|sum|avg|min|max(field)}.
 * Selected fields that are not aggregated become the GROUP BY list.
 */
public final class AggregateSpec {

    private static final Logger log = LoggerFactory.getLogger(AggregateSpec.class);

    private static final Pattern AGGREGATE_PATTERN = Pattern.compile("^\\s*(count|sum|avg|min|max)\\(\\s*(\\w+)\\s*\\)\\s*$",
            Pattern.CASE_INSENSITIVE);

    private static final AggregateSpec NONE = new AggregateSpec(Collections.emptyMap());

    // field name -> lower case function
    private final Map<String, String> functions;

    private AggregateSpec(Map<String, String> functions) {
        this.functions = Collections.unmodifiableMap(functions);
    }

    public static AggregateSpec none() {
        return NONE;
    }

    public static AggregateSpec parse(String aggregate) {
        if (aggregate == null || aggregate.isBlank()) {
            return NONE;
        }
        Map<String, String> functions = new LinkedHashMap<>();
        for (String item : aggregate.split(",")) {
            Matcher matcher = AGGREGATE_PATTERN.matcher(item);
            if (matcher.matches()) {
                functions.put(matcher.group(2), matcher.group(1).toLowerCase());
            } else {
                log.debug("Ignoring invalid aggregate item '{}'", item);
            }
        }
        return new AggregateSpec(functions);
    }

    public boolean isEmpty() {
        return functions.isEmpty();
    }

    public Set<String> getFieldNames() {
        return functions.keySet();
    }

    public boolean isAggregated(Field field) {
        return functions.containsKey(field.getName());
    }

    /**
     * Column list of the select statement, one entry per field in field order.
     */
    public String printColumns(DataModel model, SelectSpec select) {
        StringBuilder columns = new StringBuilder();
        for (Field field : model.getFields()) {
            if (columns.length() > 0) {
                columns.append(',');
            }
            String column = model.getDialect().quoteIdentifier(field.getName());
            String function = functions.get(field.getName());
            boolean selected = isSelected(field, select);
            if (function != null && selected) {
                columns.append(function).append('(').append(column).append(") as ").append(column);
            } else if (selected) {
                columns.append(column);
            } else if (isEmpty()) {
                columns.append("'' as ").append(column);
            } else {
                columns.append("min('') as ").append(column);
            }
        }
        return columns.toString();
    }

    /**
     * GROUP BY list: the selected fields that are not aggregated. Empty when nothing is
     * aggregated.
     */
    public String toSql(DataModel model, SelectSpec select) {
        if (isEmpty()) {
            return "";
        }
        StringBuilder groupBy = new StringBuilder();
        for (Field field : model.getFields()) {
            if (isSelected(field, select) && !isAggregated(field)) {
                if (groupBy.length() > 0) {
                    groupBy.append(',');
                }
                groupBy.append(model.getDialect().quoteIdentifier(field.getName()));
            }
        }
        return groupBy.toString();
    }

    /**
     * Whether a field is part of the result. Aggregated queries do not force primary keys
     * into the selection so that rows can actually be grouped.
     */
    public boolean isSelected(Field field, SelectSpec select) {
        return select.isSelected(field, isEmpty());
    }

    public boolean[] toMask(DataModel model, SelectSpec select) {
        return select.toMask(model, isEmpty());
    }
}
