package io.github.rowbase.query;

import io.github.rowbase.codec.FieldCodecs;
import io.github.rowbase.dialect.SqlDialect;
import io.github.rowbase.exception.ValidationException;
import io.github.rowbase.hashid.IdCodec;
import io.github.rowbase.model.Cell;
import io.github.rowbase.model.DataModel;
import io.github.rowbase.model.Field;
import io.github.rowbase.model.LogicalType;
import io.github.rowbase.model.Row;
import io.github.rowbase.settings.ApiSettings;

import java.util.List;

/**
 * Builds the SQL statements of one table. Values are always printed as literals by the
 * table's dialect.
 */
public class StatementBuilder {

    private final DataModel dataModel;
    private final SqlDialect dialect;
    private final ApiSettings apiSettings;
    private final IdCodec idCodec;

    /**
     * @param idCodec codec of hashed ids, or {@code null} when ids are not hashed
     */
    public StatementBuilder(DataModel dataModel, ApiSettings apiSettings, IdCodec idCodec) {
        this.dataModel = dataModel;
        this.dialect = dataModel.getDialect();
        this.apiSettings = apiSettings;
        this.idCodec = idCodec;
    }

    public String printSelect(String id, QueryParams params) {
        FilterExpr filter = params.getFilter();
        AggregateSpec aggregate = params.getAggregate();
        String where = "";
        if (id != null && !id.isEmpty()) {
            where = printPrimaryKeyCondition(id);
        }
        String filterSql = filter.toSql(dataModel, idCodec);
        if (!filterSql.isEmpty()) {
            where = where.isEmpty() ? filterSql : where + BooleanOperation.AND.getSql() + filterSql;
        }
        return dialect.printSelect(dataModel.getTableName(),
                aggregate.printColumns(dataModel, params.getSelect()),
                where,
                aggregate.toSql(dataModel, params.getSelect()),
                params.getOrder().toSql(dataModel),
                params.getLimit().toSql());
    }

    /**
     * INSERT of the supplied cells of the row.
     */
    public String printInsert(Row row) {
        StringBuilder columns = new StringBuilder();
        StringBuilder values = new StringBuilder();
        for (int i = 0; i < dataModel.getFieldCount(); i++) {
            if (!row.isSupplied(i)) {
                continue;
            }
            Field field = dataModel.getField(i);
            if (columns.length() > 0) {
                columns.append(',');
                values.append(',');
            }
            columns.append(dialect.quoteIdentifier(field.getName()));
            values.append(dialect.printLiteral(row.get(i), field.getNativeType()));
        }
        if (columns.length() == 0) {
            throw new ValidationException("No fields to insert into table " + dataModel.getTableName());
        }
        return "INSERT INTO " + dialect.quoteTableName(dataModel.getTableName())
                + " (" + columns + ") VALUES (" + values + ");";
    }

    /**
     * UPDATE of the supplied non key cells of the row identified by {@code id}.
     */
    public String printUpdate(String id, Row row) {
        String condition = printPrimaryKeyCondition(id);
        StringBuilder assignments = new StringBuilder();
        for (int i = 0; i < dataModel.getFieldCount(); i++) {
            Field field = dataModel.getField(i);
            if (field.isPrimaryKey() || !row.isSupplied(i)) {
                continue;
            }
            if (assignments.length() > 0) {
                assignments.append(',');
            }
            assignments.append(dialect.quoteIdentifier(field.getName()))
                    .append('=')
                    .append(dialect.printLiteral(row.get(i), field.getNativeType()));
        }
        if (assignments.length() == 0) {
            throw new ValidationException("No fields to update in table " + dataModel.getTableName());
        }
        return "UPDATE " + dialect.quoteTableName(dataModel.getTableName()) + " SET " + assignments
                + " WHERE " + condition + ";";
    }

    public String printDelete(String id) {
        return "DELETE FROM " + dialect.quoteTableName(dataModel.getTableName())
                + " WHERE " + printPrimaryKeyCondition(id) + ";";
    }

    /**
     * Condition matching the primary key values of an id, like {@code ("a"=1 AND "b"='x')}.
     *
     * @throws ValidationException if the id does not fit the primary key
     */
    public String printPrimaryKeyCondition(String id) {
        List<Field> keyFields = dataModel.getPrimaryKeyFields();
        if (keyFields.isEmpty()) {
            throw new ValidationException("Table " + dataModel.getTableName() + " has no primary key");
        }
        List<String> values = ResourceId.parse(id, apiSettings.getIdSeparator());
        if (values.size() != keyFields.size()) {
            throw new ValidationException("Id '" + id + "' has " + values.size() + " values, table "
                    + dataModel.getTableName() + " has " + keyFields.size() + " primary key fields");
        }
        StringBuilder condition = new StringBuilder("(");
        for (int i = 0; i < keyFields.size(); i++) {
            Field field = keyFields.get(i);
            String value = values.get(i);
            if (value.isEmpty()) {
                throw new ValidationException("Id '" + id + "' has an empty value for " + field.getName());
            }
            if (idCodec != null && field.getLogicalType() == LogicalType.NUMBER) {
                value = idCodec.decode(value);
            }
            Cell cell = FieldCodecs.deserialize(field, value);
            if (i > 0) {
                condition.append(BooleanOperation.AND.getSql());
            }
            condition.append(dialect.quoteIdentifier(field.getName()))
                    .append('=')
                    .append(dialect.printLiteral(cell, field.getNativeType()));
        }
        return condition.append(')').toString();
    }
}
