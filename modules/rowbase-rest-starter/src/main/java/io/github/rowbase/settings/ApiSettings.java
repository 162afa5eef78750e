package io.github.rowbase.settings;

/**
 * Process wide naming settings: synthetic id field, id separator and request parameter names.
 * Immutable, built once from configuration and handed to the engine and the codecs.
 */
public final class ApiSettings {

    public static final String DEFAULT_ID_FIELD_NAME = "_ROWID_";
    public static final char DEFAULT_ID_SEPARATOR = '_';

    private final String idFieldName;
    private final char idSeparator;
    private final String filterParam;
    private final String orderParam;
    private final String limitParam;
    private final String selectParam;
    private final String aggregateParam;
    private final String requestTypeParam;
    private final String responseTypeParam;

    private ApiSettings(Builder builder) {
        this.idFieldName = builder.idFieldName;
        this.idSeparator = builder.idSeparator;
        this.filterParam = builder.filterParam;
        this.orderParam = builder.orderParam;
        this.limitParam = builder.limitParam;
        this.selectParam = builder.selectParam;
        this.aggregateParam = builder.aggregateParam;
        this.requestTypeParam = builder.requestTypeParam;
        this.responseTypeParam = builder.responseTypeParam;
    }

    public static ApiSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getIdFieldName() {
        return idFieldName;
    }

    public char getIdSeparator() {
        return idSeparator;
    }

    public String getFilterParam() {
        return filterParam;
    }

    public String getOrderParam() {
        return orderParam;
    }

    public String getLimitParam() {
        return limitParam;
    }

    public String getSelectParam() {
        return selectParam;
    }

    public String getAggregateParam() {
        return aggregateParam;
    }

    public String getRequestTypeParam() {
        return requestTypeParam;
    }

    public String getResponseTypeParam() {
        return responseTypeParam;
    }

    public static final class Builder {
        private String idFieldName = DEFAULT_ID_FIELD_NAME;
        private char idSeparator = DEFAULT_ID_SEPARATOR;
        private String filterParam = "filter";
        private String orderParam = "order";
        private String limitParam = "limit";
        private String selectParam = "select";
        private String aggregateParam = "aggregate";
        private String requestTypeParam = "requesttype";
        private String responseTypeParam = "responsetype";

        private Builder() {
        }

        public Builder idFieldName(String idFieldName) {
            this.idFieldName = idFieldName;
            return this;
        }

        public Builder idSeparator(char idSeparator) {
            this.idSeparator = idSeparator;
            return this;
        }

        public Builder filterParam(String filterParam) {
            this.filterParam = filterParam;
            return this;
        }

        public Builder orderParam(String orderParam) {
            this.orderParam = orderParam;
            return this;
        }

        public Builder limitParam(String limitParam) {
            this.limitParam = limitParam;
            return this;
        }

        public Builder selectParam(String selectParam) {
            this.selectParam = selectParam;
            return this;
        }

        public Builder aggregateParam(String aggregateParam) {
            this.aggregateParam = aggregateParam;
            return this;
        }

        public Builder requestTypeParam(String requestTypeParam) {
            this.requestTypeParam = requestTypeParam;
            return this;
        }

        public Builder responseTypeParam(String responseTypeParam) {
            this.responseTypeParam = responseTypeParam;
            return this;
        }

        public ApiSettings build() {
            if (idFieldName == null || idFieldName.isEmpty()) {
                throw new IllegalArgumentException("Id field name is required");
            }
            if (Character.isLetterOrDigit(idSeparator) || idSeparator == '%') {
                throw new IllegalArgumentException("Id separator '" + idSeparator + "' must not be a letter, digit or '%'");
            }
            return new ApiSettings(this);
        }
    }
}
