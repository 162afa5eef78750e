package io.github.rowbase.query;

import io.github.rowbase.exception.OrderSyntaxException;
import io.github.rowbase.model.DataModel;
import io.github.rowbase.model.Field;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sort order of a query: a comma separated list of {@code field [ASC|DESC|+|-]}.
 */
public final class OrderSpec {

    private static final Logger log = LoggerFactory.getLogger(OrderSpec.class);

    private static final Pattern ORDER_PATTERN = Pattern.compile("^\\s*(\\w+)\\s?(ASC|DESC|\\+|\\-)?\\s*?$",
            Pattern.CASE_INSENSITIVE);

    private static final OrderSpec NONE = new OrderSpec(Collections.emptyList(), Collections.emptyList());

    private final List<String> fieldNames;
    private final List<Boolean> descending;

    private OrderSpec(List<String> fieldNames, List<Boolean> descending) {
        this.fieldNames = Collections.unmodifiableList(fieldNames);
        this.descending = Collections.unmodifiableList(descending);
    }

    public static OrderSpec none() {
        return NONE;
    }

    /**
     * Parse an order string, dropping items that do not match the order syntax.
     */
    public static OrderSpec parse(String order) {
        return parse(order, false);
    }

    /**
     * Parse an order string.
     *
     * @throws OrderSyntaxException if an item does not match the order syntax
     */
    public static OrderSpec parseStrict(String order) {
        return parse(order, true);
    }

    private static OrderSpec parse(String order, boolean strict) {
        if (order == null || order.isBlank()) {
            return NONE;
        }
        List<String> names = new ArrayList<>();
        List<Boolean> directions = new ArrayList<>();
        for (String item : order.split(",")) {
            Matcher matcher = ORDER_PATTERN.matcher(item);
            if (!matcher.matches()) {
                if (strict) {
                    throw new OrderSyntaxException("Invalid order item '" + item.trim() + "'");
                }
                log.debug("Ignoring invalid order item '{}'", item);
                continue;
            }
            String direction = matcher.group(2) == null ? "" : matcher.group(2).toUpperCase(Locale.ROOT);
            names.add(matcher.group(1));
            directions.add(direction.equals("DESC") || direction.equals("-"));
        }
        return new OrderSpec(names, directions);
    }

    public boolean isEmpty() {
        return fieldNames.isEmpty();
    }

    public Set<String> getFieldNames() {
        return new LinkedHashSet<>(fieldNames);
    }

    public boolean isDescending(int index) {
        return descending.get(index);
    }

    /**
     * Render as an ORDER BY list. Fields the model does not have are left out.
     */
    public String toSql(DataModel model) {
        StringBuilder sql = new StringBuilder();
        for (int i = 0; i < fieldNames.size(); i++) {
            Field field = model.findFieldByName(fieldNames.get(i));
            if (field == null) {
                log.debug("Ignoring order on unknown field {}", fieldNames.get(i));
                continue;
            }
            if (sql.length() > 0) {
                sql.append(',');
            }
            sql.append(model.getDialect().quoteIdentifier(field.getName()))
                    .append(descending.get(i) ? " DESC" : " ASC");
        }
        return sql.toString();
    }
}
