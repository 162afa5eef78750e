package io.github.rowbase.schema;

import io.github.rowbase.constant.ColumnTypeConstant;
import io.github.rowbase.dialect.SqlDialect;
import io.github.rowbase.exception.SchemaParseException;
import io.github.rowbase.model.DataModel;
import io.github.rowbase.model.Field;
import io.github.rowbase.model.LogicalType;
import io.github.rowbase.settings.ResourceSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds a {@link DataModel} from the native {@code CREATE TABLE} text of a dialect.
 *
 * <p>The column block is split on top level commas. Each fragment is read as a column
 * definition or as a table level {@code PRIMARY KEY}/{@code FOREIGN KEY} constraint; any other
 * fragment is skipped with a warning. Only a description without a {@code CREATE TABLE} block,
 * or one that yields no field at all, is an error.</p>
 */
public class SchemaIntrospector {

    private static final Logger log = LoggerFactory.getLogger(SchemaIntrospector.class);

    private static final Set<String> TABLE_CONSTRAINT_KEYWORDS = Set.of(
            "PRIMARY", "FOREIGN", "CONSTRAINT", "UNIQUE", "KEY", "INDEX", "CHECK",
            "FULLTEXT", "SPATIAL", "EXCLUDE");

    /** Words that may follow the first word of a native type name */
    private static final Set<String> TYPE_CONTINUATIONS = Set.of(
            "VARYING", "PRECISION", "WITH", "WITHOUT", "TIME", "ZONE");

    private final SqlDialect dialect;

    public SchemaIntrospector(SqlDialect dialect) {
        this.dialect = dialect;
    }

    /**
     * Build the model of a table, keeping every field not excluded by prefix or name.
     * The table name is taken from the description.
     */
    public static DataModel build(String tableDescription, SqlDialect dialect, String excludeFieldPrefix,
                                  Set<String> excludeFields) {
        List<DdlToken> tokens = DdlTokenizer.tokenize(tableDescription);
        String tableName = findTableName(tokens, tableDescription);
        ResourceSettings settings = ResourceSettings.builder(tableName)
                .excludeFieldPrefix(excludeFieldPrefix)
                .excludeFields(excludeFields)
                .build();
        return new SchemaIntrospector(dialect).build(tableDescription, settings);
    }

    /**
     * Build the model of the table of a resource, applying its exclusion rules.
     *
     * @throws SchemaParseException if the description has no column block or no usable field
     */
    public DataModel build(String tableDescription, ResourceSettings settings) {
        String tableName = settings.getTableName();
        List<DdlToken> tokens = DdlTokenizer.tokenize(tableDescription);
        List<List<DdlToken>> fragments = splitColumnBlock(tokens, tableDescription);

        Map<String, ColumnDraft> columns = new LinkedHashMap<>();
        for (List<DdlToken> fragment : fragments) {
            if (fragment.isEmpty()) {
                continue;
            }
            DdlToken first = fragment.get(0);
            boolean handled;
            if (first.getType() == DdlToken.Type.WORD
                    && TABLE_CONSTRAINT_KEYWORDS.contains(first.getText().toUpperCase(Locale.ROOT))) {
                handled = applyTableConstraint(fragment, columns, tableName);
            } else {
                handled = parseColumn(fragment, columns);
            }
            if (!handled) {
                log.warn("Skipping unsupported definition in table {}: {}", tableName, printFragment(fragment));
            }
        }

        List<Field> fields = new ArrayList<>();
        for (ColumnDraft column : columns.values()) {
            if (!settings.isFieldExposed(column.name)) {
                if (column.primaryKey) {
                    log.warn("Primary key field {} of table {} is excluded", column.name, tableName);
                }
                continue;
            }
            LogicalType type = dialect.logicalTypeOf(column.nativeType);
            if (type == LogicalType.DATETIME && settings.isUseDatesAsString()) {
                type = LogicalType.STRING;
            }
            fields.add(new Field(column.name, type, column.nativeType, column.length,
                    column.primaryKey, column.foreignKey, column.autoIncrement, column.notNull));
        }
        if (fields.isEmpty()) {
            throw new SchemaParseException("No usable fields in the description of table " + tableName);
        }
        log.debug("Built data model of table {} with {} fields", tableName, fields.size());
        return new DataModel(tableName, dialect, fields);
    }

    private static int findCreateTable(List<DdlToken> tokens) {
        for (int i = 0; i + 1 < tokens.size(); i++) {
            if (tokens.get(i).isWord("CREATE")) {
                for (int j = i + 1; j < tokens.size() && j <= i + 3; j++) {
                    if (tokens.get(j).isWord("TABLE")) {
                        return j + 1;
                    }
                }
            }
        }
        return -1;
    }

    private static String findTableName(List<DdlToken> tokens, String description) {
        int pos = findCreateTable(tokens);
        if (pos < 0) {
            throw new SchemaParseException("No CREATE TABLE statement in table description: " + abbreviate(description));
        }
        pos = skipIfNotExists(tokens, pos);
        String name = null;
        while (pos < tokens.size() && tokens.get(pos).isIdentifier()) {
            name = tokens.get(pos).getText();
            if (pos + 1 < tokens.size() && tokens.get(pos + 1).getText().equals(".")) {
                pos += 2;
            } else {
                break;
            }
        }
        if (name == null) {
            throw new SchemaParseException("No table name in table description: " + abbreviate(description));
        }
        return name;
    }

    private static int skipIfNotExists(List<DdlToken> tokens, int pos) {
        if (pos + 2 < tokens.size() && tokens.get(pos).isWord("IF") && tokens.get(pos + 1).isWord("NOT")
                && tokens.get(pos + 2).isWord("EXISTS")) {
            return pos + 3;
        }
        return pos;
    }

    private static List<List<DdlToken>> splitColumnBlock(List<DdlToken> tokens, String description) {
        int pos = findCreateTable(tokens);
        if (pos < 0) {
            throw new SchemaParseException("No CREATE TABLE statement in table description: " + abbreviate(description));
        }
        while (pos < tokens.size() && tokens.get(pos).getType() != DdlToken.Type.OPEN) {
            pos++;
        }
        if (pos >= tokens.size()) {
            throw new SchemaParseException("No column block in table description: " + abbreviate(description));
        }
        List<List<DdlToken>> fragments = new ArrayList<>();
        List<DdlToken> current = new ArrayList<>();
        int depth = 0;
        for (int i = pos + 1; i < tokens.size(); i++) {
            DdlToken token = tokens.get(i);
            if (token.getType() == DdlToken.Type.OPEN) {
                depth++;
            } else if (token.getType() == DdlToken.Type.CLOSE) {
                if (depth == 0) {
                    fragments.add(current);
                    return fragments;
                }
                depth--;
            } else if (token.getType() == DdlToken.Type.COMMA && depth == 0) {
                fragments.add(current);
                current = new ArrayList<>();
                continue;
            }
            current.add(token);
        }
        throw new SchemaParseException("Unbalanced parentheses in table description: " + abbreviate(description));
    }

    private boolean parseColumn(List<DdlToken> fragment, Map<String, ColumnDraft> columns) {
        DdlToken nameToken = fragment.get(0);
        if (!nameToken.isIdentifier() || fragment.size() < 2 || fragment.get(1).getType() != DdlToken.Type.WORD) {
            return false;
        }
        ColumnDraft column = new ColumnDraft(nameToken.getText());
        int pos = 1;
        StringBuilder type = new StringBuilder(fragment.get(pos++).getText().toLowerCase(Locale.ROOT));
        pos = appendContinuations(fragment, pos, type);
        if (pos < fragment.size() && fragment.get(pos).getType() == DdlToken.Type.OPEN) {
            List<String> args = new ArrayList<>();
            pos++;
            while (pos < fragment.size() && fragment.get(pos).getType() != DdlToken.Type.CLOSE) {
                if (fragment.get(pos).getType() == DdlToken.Type.WORD) {
                    args.add(fragment.get(pos).getText());
                }
                pos++;
            }
            pos++;
            if (!args.isEmpty() && args.get(0).chars().allMatch(Character::isDigit)) {
                try {
                    column.length = Integer.parseInt(args.get(0));
                } catch (NumberFormatException e) {
                    log.warn("Length {} of column {} is out of range, ignored", args.get(0), column.name);
                }
            }
            pos = appendContinuations(fragment, pos, type);
        }
        while (pos < fragment.size() && fragment.get(pos).getText().equals("[]")) {
            type.append("[]");
            pos++;
        }
        column.nativeType = type.toString();
        if (ColumnTypeConstant.AUTO_INCREMENT_TYPES.contains(column.nativeType)) {
            column.autoIncrement = true;
        }
        applyColumnConstraints(fragment, pos, column);
        if (columns.containsKey(column.name)) {
            log.warn("Duplicate column {} ignored", column.name);
            return true;
        }
        columns.put(column.name, column);
        return true;
    }

    private static int appendContinuations(List<DdlToken> fragment, int pos, StringBuilder type) {
        while (pos < fragment.size() && fragment.get(pos).getType() == DdlToken.Type.WORD
                && TYPE_CONTINUATIONS.contains(fragment.get(pos).getText().toUpperCase(Locale.ROOT))) {
            type.append(' ').append(fragment.get(pos).getText().toLowerCase(Locale.ROOT));
            pos++;
        }
        return pos;
    }

    private static void applyColumnConstraints(List<DdlToken> fragment, int pos, ColumnDraft column) {
        int depth = 0;
        for (int i = pos; i < fragment.size(); i++) {
            DdlToken token = fragment.get(i);
            if (token.getType() == DdlToken.Type.OPEN) {
                depth++;
                continue;
            } else if (token.getType() == DdlToken.Type.CLOSE) {
                depth--;
                continue;
            }
            if (depth > 0 || token.getType() != DdlToken.Type.WORD) {
                continue;
            }
            DdlToken next = i + 1 < fragment.size() ? fragment.get(i + 1) : null;
            if (token.isWord("PRIMARY") && next != null && next.isWord("KEY")) {
                column.primaryKey = true;
            } else if (token.isWord("NOT") && next != null && next.isWord("NULL")) {
                column.notNull = true;
            } else if (token.isWord("AUTOINCREMENT") || token.isWord("AUTO_INCREMENT")
                    || token.isWord("IDENTITY") || token.isWord("nextval")) {
                column.autoIncrement = true;
            } else if (token.isWord("REFERENCES")) {
                column.foreignKey = true;
            }
        }
    }

    private static boolean applyTableConstraint(List<DdlToken> fragment, Map<String, ColumnDraft> columns,
                                                String tableName) {
        int pos = 0;
        if (fragment.get(0).isWord("CONSTRAINT")) {
            pos = 2;
        }
        if (pos + 1 >= fragment.size()) {
            return false;
        }
        boolean primary = fragment.get(pos).isWord("PRIMARY");
        boolean foreign = fragment.get(pos).isWord("FOREIGN");
        if (!(primary || foreign) || !fragment.get(pos + 1).isWord("KEY")) {
            return false;
        }
        pos += 2;
        if (pos >= fragment.size() || fragment.get(pos).getType() != DdlToken.Type.OPEN) {
            return false;
        }
        List<String> names = new ArrayList<>();
        for (pos++; pos < fragment.size() && fragment.get(pos).getType() != DdlToken.Type.CLOSE; pos++) {
            if (fragment.get(pos).isIdentifier()) {
                names.add(fragment.get(pos).getText());
            }
        }
        if (names.isEmpty()) {
            return false;
        }
        for (String name : names) {
            ColumnDraft column = columns.get(name);
            if (column == null) {
                log.warn("Key constraint of table {} references unknown column {}", tableName, name);
            } else if (primary) {
                column.primaryKey = true;
            } else {
                column.foreignKey = true;
            }
        }
        return true;
    }

    private static String printFragment(List<DdlToken> fragment) {
        return fragment.stream().map(DdlToken::toString).collect(Collectors.joining(" "));
    }

    private static String abbreviate(String text) {
        return text.length() > 80 ? text.substring(0, 80) + "..." : text;
    }

    private static final class ColumnDraft {
        private final String name;
        private String nativeType;
        private int length;
        private boolean primaryKey;
        private boolean foreignKey;
        private boolean autoIncrement;
        private boolean notNull;

        private ColumnDraft(String name) {
            this.name = name;
        }
    }
}
