package io.github.rowbase.config;

import io.github.rowbase.settings.ApiSettings;
import io.github.rowbase.settings.ResourceSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Configuration properties for the REST API application
 */
@ConfigurationProperties(prefix = "app")
public class RestApiConfig {

    private String allowedSchema = "public";
    private String databaseType = "postgres";
    private String idFieldName = ApiSettings.DEFAULT_ID_FIELD_NAME;
    private String idSeparator = String.valueOf(ApiSettings.DEFAULT_ID_SEPARATOR);

    private ParamsConfig params = new ParamsConfig();

    // Tables served by the API
    private List<ResourceConfig> resources = new ArrayList<>();

    // CORS configuration
    private CorsConfig cors = new CorsConfig();

    public String getAllowedSchema() {
        return allowedSchema;
    }

    public void setAllowedSchema(String allowedSchema) {
        this.allowedSchema = allowedSchema;
    }

    public String getDatabaseType() {
        return databaseType;
    }

    public void setDatabaseType(String databaseType) {
        this.databaseType = databaseType;
    }

    public String getIdFieldName() {
        return idFieldName;
    }

    public void setIdFieldName(String idFieldName) {
        this.idFieldName = idFieldName;
    }

    public String getIdSeparator() {
        return idSeparator;
    }

    public void setIdSeparator(String idSeparator) {
        this.idSeparator = idSeparator;
    }

    public ParamsConfig getParams() {
        return params;
    }

    public void setParams(ParamsConfig params) {
        this.params = params;
    }

    public List<ResourceConfig> getResources() {
        return resources;
    }

    public void setResources(List<ResourceConfig> resources) {
        this.resources = resources;
    }

    public CorsConfig getCors() {
        return cors;
    }

    public void setCors(CorsConfig cors) {
        this.cors = cors;
    }

    /**
     * API wide settings of the query engines.
     *
     * @throws IllegalArgumentException if the id separator is not a single allowed character
     */
    public ApiSettings toApiSettings() {
        if (idSeparator == null || idSeparator.length() != 1) {
            throw new IllegalArgumentException("app.id-separator must be a single character: '" + idSeparator + "'");
        }
        return ApiSettings.builder()
                .idFieldName(idFieldName)
                .idSeparator(idSeparator.charAt(0))
                .filterParam(params.getFilter())
                .orderParam(params.getOrder())
                .limitParam(params.getLimit())
                .selectParam(params.getSelect())
                .aggregateParam(params.getAggregate())
                .requestTypeParam(params.getRequestType())
                .responseTypeParam(params.getResponseType())
                .build();
    }

    /**
     * Names of the query parameters.
     */
    public static class ParamsConfig {
        private String filter = "filter";
        private String order = "order";
        private String limit = "limit";
        private String select = "select";
        private String aggregate = "aggregate";
        private String requestType = "requesttype";
        private String responseType = "responsetype";

        public String getFilter() {
            return filter;
        }

        public void setFilter(String filter) {
            this.filter = filter;
        }

        public String getOrder() {
            return order;
        }

        public void setOrder(String order) {
            this.order = order;
        }

        public String getLimit() {
            return limit;
        }

        public void setLimit(String limit) {
            this.limit = limit;
        }

        public String getSelect() {
            return select;
        }

        public void setSelect(String select) {
            this.select = select;
        }

        public String getAggregate() {
            return aggregate;
        }

        public void setAggregate(String aggregate) {
            this.aggregate = aggregate;
        }

        public String getRequestType() {
            return requestType;
        }

        public void setRequestType(String requestType) {
            this.requestType = requestType;
        }

        public String getResponseType() {
            return responseType;
        }

        public void setResponseType(String responseType) {
            this.responseType = responseType;
        }
    }

    public static class ResourceConfig {
        private String tableName;
        private String excludeFieldPrefix;
        private List<String> excludeFields = new ArrayList<>();
        private List<String> includeFields = new ArrayList<>();
        private boolean useDatesAsString = false;
        private boolean failOnOversizedValues = false;
        private boolean failOnUpdateOnAutoinc = false;
        private boolean failOnInsertWithoutKey = false;
        private HashidConfig hashid = new HashidConfig();

        public String getTableName() {
            return tableName;
        }

        public void setTableName(String tableName) {
            this.tableName = tableName;
        }

        public String getExcludeFieldPrefix() {
            return excludeFieldPrefix;
        }

        public void setExcludeFieldPrefix(String excludeFieldPrefix) {
            this.excludeFieldPrefix = excludeFieldPrefix;
        }

        public List<String> getExcludeFields() {
            return excludeFields;
        }

        public void setExcludeFields(List<String> excludeFields) {
            this.excludeFields = excludeFields;
        }

        public List<String> getIncludeFields() {
            return includeFields;
        }

        public void setIncludeFields(List<String> includeFields) {
            this.includeFields = includeFields;
        }

        public boolean isUseDatesAsString() {
            return useDatesAsString;
        }

        public void setUseDatesAsString(boolean useDatesAsString) {
            this.useDatesAsString = useDatesAsString;
        }

        public boolean isFailOnOversizedValues() {
            return failOnOversizedValues;
        }

        public void setFailOnOversizedValues(boolean failOnOversizedValues) {
            this.failOnOversizedValues = failOnOversizedValues;
        }

        public boolean isFailOnUpdateOnAutoinc() {
            return failOnUpdateOnAutoinc;
        }

        public void setFailOnUpdateOnAutoinc(boolean failOnUpdateOnAutoinc) {
            this.failOnUpdateOnAutoinc = failOnUpdateOnAutoinc;
        }

        public boolean isFailOnInsertWithoutKey() {
            return failOnInsertWithoutKey;
        }

        public void setFailOnInsertWithoutKey(boolean failOnInsertWithoutKey) {
            this.failOnInsertWithoutKey = failOnInsertWithoutKey;
        }

        public HashidConfig getHashid() {
            return hashid;
        }

        public void setHashid(HashidConfig hashid) {
            this.hashid = hashid;
        }

        public ResourceSettings toResourceSettings() {
            ResourceSettings.Builder builder = ResourceSettings.builder(tableName)
                    .excludeFieldPrefix(excludeFieldPrefix)
                    .excludeFields(new HashSet<>(excludeFields))
                    .includeFields(new HashSet<>(includeFields))
                    .useDatesAsString(useDatesAsString)
                    .failOnOversizedValues(failOnOversizedValues)
                    .failOnUpdateOnAutoinc(failOnUpdateOnAutoinc)
                    .failOnInsertWithoutKey(failOnInsertWithoutKey);
            if (hashid.getKey() != null && !hashid.getKey().isEmpty()) {
                builder.hashid(hashid.getKey(), hashid.getMinLength(), hashid.isStaticIds(), hashid.getDomainId());
            }
            return builder.build();
        }
    }

    /**
     * Encryption of numeric ids. Disabled while no key is set.
     */
    public static class HashidConfig {
        private String key;
        private int minLength = 12;
        private boolean staticIds = false;
        private String domainId = "";

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }

        public int getMinLength() {
            return minLength;
        }

        public void setMinLength(int minLength) {
            this.minLength = minLength;
        }

        public boolean isStaticIds() {
            return staticIds;
        }

        public void setStaticIds(boolean staticIds) {
            this.staticIds = staticIds;
        }

        public String getDomainId() {
            return domainId;
        }

        public void setDomainId(String domainId) {
            this.domainId = domainId;
        }
    }

    public static class CorsConfig {
        private boolean enabled = true;
        private String[] allowedOrigins = {"*"};
        private String[] allowedMethods = {"GET", "POST", "PUT", "DELETE", "OPTIONS"};
        private String[] allowedHeaders = {"*"};
        private boolean allowCredentials = false;
        private long maxAge = 3600; // 1 hour

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String[] getAllowedOrigins() {
            return allowedOrigins;
        }

        public void setAllowedOrigins(String[] allowedOrigins) {
            this.allowedOrigins = allowedOrigins;
        }

        public String[] getAllowedMethods() {
            return allowedMethods;
        }

        public void setAllowedMethods(String[] allowedMethods) {
            this.allowedMethods = allowedMethods;
        }

        public String[] getAllowedHeaders() {
            return allowedHeaders;
        }

        public void setAllowedHeaders(String[] allowedHeaders) {
            this.allowedHeaders = allowedHeaders;
        }

        public boolean isAllowCredentials() {
            return allowCredentials;
        }

        public void setAllowCredentials(boolean allowCredentials) {
            this.allowCredentials = allowCredentials;
        }

        public long getMaxAge() {
            return maxAge;
        }

        public void setMaxAge(long maxAge) {
            this.maxAge = maxAge;
        }
    }
}
