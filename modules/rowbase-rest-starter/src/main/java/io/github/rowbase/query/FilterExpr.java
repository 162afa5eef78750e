package io.github.rowbase.query;

import io.github.rowbase.codec.FieldCodecs;
import io.github.rowbase.dialect.SqlDialect;
import io.github.rowbase.exception.CryptoIntegrityException;
import io.github.rowbase.exception.FilterSyntaxException;
import io.github.rowbase.exception.SerializationException;
import io.github.rowbase.hashid.IdCodec;
import io.github.rowbase.model.Cell;
import io.github.rowbase.model.DataModel;
import io.github.rowbase.model.Field;
import io.github.rowbase.model.LogicalType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed filter of the query language.
 *
 * <p>Supported statements (keywords are case insensitive):</p>
 * <ul>
 *   <li>comparison: {@code (field)-lt|le|eq|ge|gt|like(value)}</li>
 *   <li>negation: {@code -not(filter)}</li>
 *   <li>conjunction/disjunction: {@code (filter)-and|or(filter)}</li>
 * </ul>
 *
 * <p>A filter is either {@link Kind#EMPTY}, a {@link Kind#CONDITION} leaf or a
 * {@link Kind#COMBINATOR} node, and is rendered by switching on its kind. Instances are
 * immutable.</p>
 */
public abstract class FilterExpr {

    private static final Logger log = LoggerFactory.getLogger(FilterExpr.class);

    private static final Pattern COMPARISON_PATTERN = Pattern.compile(
            "^\\(\\s*(?:\"([^'\"()]+)\"|([^'\"()]+))\\s*\\)\\s?-(lt|le|eq|ge|gt|like)\\s?\\(([^'\"()]+)\\)$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern NEGATION_PATTERN = Pattern.compile("^\\s?-not\\s?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern BOOLEAN_OPERATION_PATTERN = Pattern.compile("^\\s?-(and|or)\\s?$", Pattern.CASE_INSENSITIVE);

    private static final FilterExpr EMPTY = new Empty();

    public enum Kind {
        EMPTY,
        CONDITION,
        COMBINATOR
    }

    FilterExpr() {
    }

    public abstract Kind getKind();

    public static FilterExpr empty() {
        return EMPTY;
    }

    public static FilterExpr condition(String fieldName, Comparison comparison, String literal) {
        return new Condition(fieldName, comparison, literal);
    }

    public static FilterExpr not(FilterExpr inner) {
        return new Combinator(inner, BooleanOperation.NOT, null);
    }

    public static FilterExpr and(FilterExpr left, FilterExpr right) {
        return new Combinator(left, BooleanOperation.AND, right);
    }

    public static FilterExpr or(FilterExpr left, FilterExpr right) {
        return new Combinator(left, BooleanOperation.OR, right);
    }

    /**
     * Combine two filters, skipping sides that are missing or empty.
     */
    public static FilterExpr combine(FilterExpr left, BooleanOperation operation, FilterExpr right) {
        if (operation == BooleanOperation.NOT) {
            throw new IllegalArgumentException("Filters can only be combined with AND or OR");
        }
        boolean hasLeft = left != null && !left.isEmpty();
        boolean hasRight = right != null && !right.isEmpty();
        if (hasLeft && hasRight) {
            return new Combinator(left, operation, right);
        } else if (hasLeft) {
            return left;
        } else if (hasRight) {
            return right;
        }
        return EMPTY;
    }

    /**
     * Parse a filter string. A missing or blank string is the empty filter.
     *
     * @throws FilterSyntaxException if the string is not a valid filter
     */
    public static FilterExpr parse(String filter) {
        if (filter == null || filter.isBlank()) {
            return EMPTY;
        }
        String text = filter.trim();
        Matcher comparison = COMPARISON_PATTERN.matcher(text);
        if (comparison.matches()) {
            String field = comparison.group(1) != null ? comparison.group(1) : comparison.group(2).trim();
            return new Condition(field, Comparison.fromKeyword(comparison.group(3)), comparison.group(4));
        }

        List<String> parts = splitGroups(text);
        if (parts.size() == 2 && NEGATION_PATTERN.matcher(parts.get(0)).matches() && isGroup(parts.get(1))) {
            return not(parseGroup(parts.get(1)));
        }
        if (parts.size() == 3 && isGroup(parts.get(0)) && isGroup(parts.get(2))) {
            Matcher operation = BOOLEAN_OPERATION_PATTERN.matcher(parts.get(1));
            if (operation.matches()) {
                return new Combinator(parseGroup(parts.get(0)), BooleanOperation.fromKeyword(operation.group(1)),
                        parseGroup(parts.get(2)));
            }
        }
        if (parts.size() == 1 && isGroup(parts.get(0))) {
            return parseGroup(parts.get(0));
        }
        FilterExpr chained = parseChain(parts, BooleanOperation.OR);
        if (chained != null) {
            return chained;
        }
        log.debug("Invalid filter: {}", filter);
        throw new FilterSyntaxException("Invalid filter", filter);
    }

    /**
     * Fold a sequence of statements joined by boolean operators, {@code or} binding weaker
     * than {@code and}. Returns null when the parts contain no operator of the given kind or
     * a weaker one.
     */
    private static FilterExpr parseChain(List<String> parts, BooleanOperation splitOn) {
        List<List<String>> chunks = new ArrayList<>();
        List<String> current = new ArrayList<>();
        for (String part : parts) {
            Matcher operation = BOOLEAN_OPERATION_PATTERN.matcher(part);
            if (operation.matches() && BooleanOperation.fromKeyword(operation.group(1)) == splitOn) {
                chunks.add(current);
                current = new ArrayList<>();
            } else {
                current.add(part);
            }
        }
        chunks.add(current);
        if (chunks.size() == 1) {
            return splitOn == BooleanOperation.OR ? parseChain(parts, BooleanOperation.AND) : null;
        }
        FilterExpr result = null;
        for (List<String> chunk : chunks) {
            if (chunk.isEmpty()) {
                throw new FilterSyntaxException("Missing operand in filter", String.join("", parts));
            }
            FilterExpr operand = parseOperand(String.join("", chunk));
            result = result == null ? operand : new Combinator(result, splitOn, operand);
        }
        return result;
    }

    private static FilterExpr parseGroup(String group) {
        return parseOperand(group.substring(1, group.length() - 1));
    }

    private static FilterExpr parseOperand(String operand) {
        FilterExpr parsed = parse(operand);
        if (parsed.isEmpty()) {
            throw new FilterSyntaxException("Missing operand in filter", operand);
        }
        return parsed;
    }

    private static boolean isGroup(String part) {
        return part.startsWith("(") && part.endsWith(")");
    }

    /**
     * Split into top level parenthesis groups (kept with their parentheses) and the text
     * between them.
     */
    static List<String> splitGroups(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                if (depth == 0 && i > start) {
                    parts.add(text.substring(start, i));
                    start = i;
                } else if (depth == 0) {
                    start = i;
                }
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    throw new FilterSyntaxException("Unbalanced parenthesis in filter", text);
                }
                if (depth == 0) {
                    parts.add(text.substring(start, i + 1));
                    start = i + 1;
                }
            }
        }
        if (depth != 0) {
            throw new FilterSyntaxException("Unbalanced parenthesis in filter", text);
        }
        if (start < text.length()) {
            parts.add(text.substring(start));
        }
        return parts;
    }

    public boolean isEmpty() {
        return getKind() == Kind.EMPTY;
    }

    /**
     * Names of all fields the filter refers to.
     */
    public Set<String> getFieldNames() {
        Set<String> names = new LinkedHashSet<>();
        collectFieldNames(names);
        return names;
    }

    private void collectFieldNames(Set<String> names) {
        switch (getKind()) {
            case CONDITION -> names.add(((Condition) this).fieldName);
            case COMBINATOR -> {
                Combinator node = (Combinator) this;
                node.left.collectFieldNames(names);
                if (node.right != null) {
                    node.right.collectFieldNames(names);
                }
            }
            default -> {
            }
        }
    }

    /**
     * Render as a SQL condition. The empty filter renders as an empty string.
     */
    public String toSql(DataModel model) {
        return toSql(model, null);
    }

    /**
     * Render as a SQL condition, decoding id tokens of numeric key fields with the id codec.
     *
     * <p>A condition on a field the model does not have is rendered with the raw literal;
     * callers validate field names before rendering.</p>
     *
     * @throws FilterSyntaxException if a literal is not a valid value of its field
     */
    public String toSql(DataModel model, IdCodec idCodec) {
        return switch (getKind()) {
            case EMPTY -> "";
            case CONDITION -> renderCondition((Condition) this, model, idCodec);
            case COMBINATOR -> renderCombinator((Combinator) this, model, idCodec);
        };
    }

    private static String renderCondition(Condition condition, DataModel model, IdCodec idCodec) {
        SqlDialect dialect = model.getDialect();
        Field field = model.findFieldByName(condition.fieldName);
        if (field == null) {
            log.warn("Filter on unknown field {} of table {} rendered as is", condition.fieldName, model.getTableName());
            return "(" + dialect.quoteIdentifier(condition.fieldName) + condition.comparison.getSql()
                    + condition.literal + ")";
        }
        String text = condition.literal;
        if (idCodec != null && field.getLogicalType() == LogicalType.NUMBER
                && (field.isPrimaryKey() || field.isForeignKey())) {
            try {
                text = idCodec.decode(text);
            } catch (CryptoIntegrityException e) {
                throw new FilterSyntaxException("Invalid id for field " + field.getName(), condition.literal, e);
            }
        }
        String value;
        if (condition.comparison == Comparison.LIKE) {
            value = dialect.printStringLiteral(text);
        } else {
            Cell cell;
            try {
                cell = FieldCodecs.deserialize(field, text);
            } catch (SerializationException e) {
                throw new FilterSyntaxException("Invalid value for field " + field.getName(), condition.literal, e);
            }
            value = dialect.printLiteral(cell, field.getNativeType());
        }
        return "(" + dialect.quoteIdentifier(field.getName()) + condition.comparison.getSql() + value + ")";
    }

    private static String renderCombinator(Combinator node, DataModel model, IdCodec idCodec) {
        if (node.operation == BooleanOperation.NOT) {
            return BooleanOperation.NOT.getSql() + "(" + node.left.toSql(model, idCodec) + ")";
        }
        return "(" + node.left.toSql(model, idCodec) + node.operation.getSql() + node.right.toSql(model, idCodec) + ")";
    }

    static final class Empty extends FilterExpr {
        @Override
        public Kind getKind() {
            return Kind.EMPTY;
        }

        @Override
        public String toString() {
            return "";
        }
    }

    /**
     * Leaf comparing a field with a literal.
     */
    public static final class Condition extends FilterExpr {
        private final String fieldName;
        private final Comparison comparison;
        private final String literal;

        Condition(String fieldName, Comparison comparison, String literal) {
            if (fieldName == null || fieldName.isEmpty() || literal == null || literal.isEmpty()) {
                throw new IllegalArgumentException("Condition needs a field and a value");
            }
            this.fieldName = fieldName;
            this.comparison = comparison;
            this.literal = literal;
        }

        @Override
        public Kind getKind() {
            return Kind.CONDITION;
        }

        public String getFieldName() {
            return fieldName;
        }

        public Comparison getComparison() {
            return comparison;
        }

        public String getLiteral() {
            return literal;
        }

        @Override
        public String toString() {
            return "(" + fieldName + ")-" + comparison.name().toLowerCase() + "(" + literal + ")";
        }
    }

    /**
     * Node joining two filters, or negating one; {@code right} is null for {@code NOT}.
     */
    public static final class Combinator extends FilterExpr {
        private final FilterExpr left;
        private final BooleanOperation operation;
        private final FilterExpr right;

        Combinator(FilterExpr left, BooleanOperation operation, FilterExpr right) {
            if (left == null || (operation != BooleanOperation.NOT && right == null)) {
                throw new IllegalArgumentException("Combinator " + operation + " is missing an operand");
            }
            this.left = left;
            this.operation = operation;
            this.right = operation == BooleanOperation.NOT ? null : right;
        }

        @Override
        public Kind getKind() {
            return Kind.COMBINATOR;
        }

        public FilterExpr getLeft() {
            return left;
        }

        public BooleanOperation getOperation() {
            return operation;
        }

        public FilterExpr getRight() {
            return right;
        }

        @Override
        public String toString() {
            if (operation == BooleanOperation.NOT) {
                return "-not(" + left + ")";
            }
            return "(" + left + ")-" + operation.name().toLowerCase() + "(" + right + ")";
        }
    }
}
