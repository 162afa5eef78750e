package io.github.rowbase.service;

import io.github.rowbase.codec.CodecContext;
import io.github.rowbase.codec.ContentNegotiator;
import io.github.rowbase.codec.ContentType;
import io.github.rowbase.codec.RowCodecs;
import io.github.rowbase.dialect.Cursor;
import io.github.rowbase.dialect.SqlDialect;
import io.github.rowbase.exception.RowbaseException;
import io.github.rowbase.exception.UnknownFieldException;
import io.github.rowbase.exception.ValidationException;
import io.github.rowbase.hashid.IdCodec;
import io.github.rowbase.model.CursorRowSet;
import io.github.rowbase.model.DataModel;
import io.github.rowbase.model.Row;
import io.github.rowbase.model.RowSet;
import io.github.rowbase.query.AggregateSpec;
import io.github.rowbase.query.FilterExpr;
import io.github.rowbase.query.LimitSpec;
import io.github.rowbase.query.OrderSpec;
import io.github.rowbase.query.QueryParams;
import io.github.rowbase.query.SelectSpec;
import io.github.rowbase.query.StatementBuilder;
import io.github.rowbase.settings.ApiSettings;
import io.github.rowbase.settings.ResourceSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Serves the requests of one table: validates the request, builds the SQL, executes it and
 * encodes the result.
 *
 * <p>Every failure is reported through the returned {@link ApiResult}; {@link #doRequest}
 * never throws for bad input or a failing database.</p>
 */
public class QueryEngine {

    private static final Logger log = LoggerFactory.getLogger(QueryEngine.class);

    private final DataModel dataModel;
    private final SqlDialect dialect;
    private final ApiSettings apiSettings;
    private final IdCodec idCodec;
    private final RowCodecs rowCodecs;
    private final StatementBuilder statementBuilder;
    private final RowValidator rowValidator;

    /**
     * @param idCodec codec of hashed ids, or {@code null} when ids are not hashed
     */
    public QueryEngine(DataModel dataModel, ApiSettings apiSettings, ResourceSettings resourceSettings,
                       IdCodec idCodec, RowCodecs rowCodecs) {
        this.dataModel = dataModel;
        this.dialect = dataModel.getDialect();
        this.apiSettings = apiSettings;
        this.idCodec = idCodec;
        this.rowCodecs = rowCodecs;
        this.statementBuilder = new StatementBuilder(dataModel, apiSettings, idCodec);
        this.rowValidator = new RowValidator(dataModel, resourceSettings);
    }

    public DataModel getDataModel() {
        return dataModel;
    }

    /**
     * Handle one request.
     *
     * @param method HTTP method name
     * @param id     row id, or {@code null}/empty for the whole table
     * @param body   request body, ignored by GET and DELETE
     */
    public ApiResult doRequest(String method, String id, String body, RequestParams request) {
        ApiResult result = new ApiResult();
        String operation = method == null ? "" : method.toUpperCase(Locale.ROOT);
        String rowId = id == null ? "" : id;
        try {
            switch (operation) {
                case "GET" -> doGet(rowId, request, result);
                case "POST" -> doPost(rowId, body, request, result);
                case "PUT" -> doPut(rowId, body, request, result);
                case "DELETE" -> doDelete(rowId, result);
                default -> result.setError(405, "Unsupported method '" + method + "'", operation);
            }
        } catch (RowbaseException e) {
            if (e.getStatusCode() >= 500) {
                log.error("{} on table {} failed: {}", operation, dataModel.getTableName(), e.getMessage(), e);
            } else {
                log.debug("{} on table {} rejected: {}", operation, dataModel.getTableName(), e.getMessage());
            }
            result.setError(e.getStatusCode(), e.getMessage(), operation);
        } catch (RuntimeException e) {
            log.error("Unexpected error during " + operation + " on table " + dataModel.getTableName() + ": "
                    + e.getMessage(), e);
            result.setError(500, "Internal server error: " + e.getMessage(), operation);
        }
        return result;
    }

    private void doGet(String id, RequestParams request, ApiResult result) {
        // Validate
        ContentType responseType = ContentNegotiator.responseType(
                request.getQueryParam(apiSettings.getResponseTypeParam()), request.getAccept());
        QueryParams params = parseQueryParams(request);
        validateFieldNames(params);

        // Build
        String sql = statementBuilder.printSelect(id, params);
        log.debug("GET {}: {}", dataModel.getTableName(), sql);

        CodecContext context = new CodecContext(dataModel, apiSettings, idCodec);
        boolean[] selected = params.getAggregate().toMask(dataModel, params.getSelect());
        context.setSelected(selected);
        String mediaType = responseType.getMimeType();
        if (responseType == ContentType.FORMDATA) {
            context.setBoundary("----RowbaseBoundary" + UUID.randomUUID().toString().replace("-", ""));
            mediaType = mediaType + "; boundary=" + context.getBoundary();
        }

        // Execute, materialize and encode
        try (Cursor cursor = dialect.execute(sql);
             RowSet rows = new CursorRowSet(dataModel, cursor, selected)) {
            String body = rowCodecs.forType(responseType).encode(rows, context);
            result.setBody(body, responseType, mediaType);
        }
        addWarnings(context, result, "GET");
    }

    private void doPost(String id, String body, RequestParams request, ApiResult result) {
        if (!id.isEmpty()) {
            throw new ValidationException("POST does not take an id");
        }
        List<Row> rows = decodeRows(body, request, result, "POST");
        if (rows.isEmpty()) {
            throw new ValidationException("No rows to POST");
        }
        int inserted = 0;
        for (int i = 0; i < rows.size(); i++) {
            Row row = rows.get(i);
            List<String> errors = rowValidator.validate(row, true, result, "POST");
            if (row.isEmpty()) {
                errors.add("Row has no known fields!");
            }
            if (!errors.isEmpty()) {
                for (String error : errors) {
                    result.addError("Row " + (i + 1) + ": " + error, "POST");
                }
                continue;
            }
            String sql = statementBuilder.printInsert(row);
            log.debug("POST {}: {}", dataModel.getTableName(), sql);
            inserted += dialect.executeUpdate(sql);
        }
        if (inserted == 0) {
            result.setError(405, "No valid rows for POST!", "POST");
        } else {
            result.setOk(201, "Inserted " + inserted + " row(s)");
        }
    }

    private void doPut(String id, String body, RequestParams request, ApiResult result) {
        requireId(id, "PUT");
        List<Row> rows = decodeRows(body, request, result, "PUT");
        if (rows.size() != 1) {
            throw new ValidationException("PUT takes exactly one row, got " + rows.size());
        }
        Row row = rows.get(0);
        List<String> errors = rowValidator.validate(row, false, result, "PUT");
        if (!errors.isEmpty()) {
            result.setError(405, errors.get(0), "PUT");
            for (String error : errors.subList(1, errors.size())) {
                result.addError(error, "PUT");
            }
            return;
        }
        String sql = statementBuilder.printUpdate(id, row);
        log.debug("PUT {}: {}", dataModel.getTableName(), sql);
        int updated = dialect.executeUpdate(sql);
        if (updated == 0) {
            result.setError(404, "No row with id '" + id + "'", "PUT");
        } else {
            result.setOk(200, "Updated " + updated + " row(s)");
        }
    }

    private void doDelete(String id, ApiResult result) {
        requireId(id, "DELETE");
        String sql = statementBuilder.printDelete(id);
        log.debug("DELETE {}: {}", dataModel.getTableName(), sql);
        int deleted = dialect.executeUpdate(sql);
        if (deleted == 0) {
            result.setError(404, "No row with id '" + id + "'", "DELETE");
        } else {
            result.setOk(200, "Deleted " + deleted + " row(s)");
        }
    }

    private List<Row> decodeRows(String body, RequestParams request, ApiResult result, String operation) {
        ContentType requestType = ContentNegotiator.requestType(
                request.getQueryParam(apiSettings.getRequestTypeParam()), request.getContentType());
        CodecContext context = new CodecContext(dataModel, apiSettings, idCodec);
        if (requestType == ContentType.FORMDATA) {
            context.setBoundary(ContentNegotiator.boundaryOf(request.getContentType()));
        }
        List<Row> rows = rowCodecs.forType(requestType).decode(body == null ? "" : body, context);
        addWarnings(context, result, operation);
        return rows;
    }

    private QueryParams parseQueryParams(RequestParams request) {
        return new QueryParams(
                FilterExpr.parse(request.getQueryParam(apiSettings.getFilterParam())),
                OrderSpec.parse(request.getQueryParam(apiSettings.getOrderParam())),
                LimitSpec.parse(request.getQueryParam(apiSettings.getLimitParam())),
                SelectSpec.parse(request.getQueryParam(apiSettings.getSelectParam())),
                AggregateSpec.parse(request.getQueryParam(apiSettings.getAggregateParam())));
    }

    private void validateFieldNames(QueryParams params) {
        requireKnownFields(params.getFilter().getFieldNames(), "filter");
        requireKnownFields(params.getSelect().getFieldNames(), "select");
        requireKnownFields(params.getAggregate().getFieldNames(), "aggregate");
    }

    private void requireKnownFields(Set<String> fieldNames, String parameter) {
        for (String fieldName : fieldNames) {
            if (dataModel.findFieldByName(fieldName) == null) {
                throw new UnknownFieldException("Unknown field '" + fieldName + "' in " + parameter);
            }
        }
    }

    private static void requireId(String id, String operation) {
        if (id.isEmpty()) {
            throw new ValidationException(operation + " requires an id");
        }
    }

    private static void addWarnings(CodecContext context, ApiResult result, String operation) {
        for (String warning : context.getWarnings()) {
            result.addWarning(warning, operation);
        }
    }
}
