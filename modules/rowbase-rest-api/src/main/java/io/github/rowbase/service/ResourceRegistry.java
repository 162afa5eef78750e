package io.github.rowbase.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.rowbase.codec.RowCodecs;
import io.github.rowbase.config.RestApiConfig;
import io.github.rowbase.dialect.SqlDialect;
import io.github.rowbase.hashid.IdCodec;
import io.github.rowbase.model.DataModel;
import io.github.rowbase.schema.SchemaIntrospector;
import io.github.rowbase.settings.ApiSettings;
import io.github.rowbase.settings.ResourceSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Query engines of the configured tables, built once at startup. A table that cannot be
 * described or modeled stops the application.
 */
@Service
public class ResourceRegistry {

    private static final Logger log = LoggerFactory.getLogger(ResourceRegistry.class);

    private final Map<String, QueryEngine> engines;

    @Autowired
    public ResourceRegistry(RestApiConfig restApiConfig, ServiceLookup serviceLookup, ObjectMapper objectMapper) {
        SqlDialect dialect = serviceLookup.forBean(SqlDialect.class, restApiConfig.getDatabaseType());
        ApiSettings apiSettings = restApiConfig.toApiSettings();
        RowCodecs rowCodecs = new RowCodecs(objectMapper);
        SchemaIntrospector introspector = new SchemaIntrospector(dialect);

        Map<String, QueryEngine> built = new LinkedHashMap<>();
        for (RestApiConfig.ResourceConfig resource : restApiConfig.getResources()) {
            ResourceSettings settings = resource.toResourceSettings();
            DataModel dataModel = introspector.build(dialect.describeTable(settings.getTableName()), settings);
            IdCodec idCodec = settings.isHashidEnabled()
                    ? new IdCodec(settings.getHashidKey(), settings.getHashidDomainId(),
                    settings.getHashidMinLength(), settings.isHashidStaticIds())
                    : null;
            built.put(settings.getTableName(), new QueryEngine(dataModel, apiSettings, settings, idCodec, rowCodecs));
            log.info("Serving table {} with {} fields", settings.getTableName(), dataModel.getFieldCount());
        }
        if (built.isEmpty()) {
            log.warn("No resources configured under app.resources");
        }
        this.engines = Collections.unmodifiableMap(built);
    }

    /**
     * Engine of a table, or {@code null} if the table is not served.
     */
    public QueryEngine find(String tableName) {
        return engines.get(tableName);
    }

    public Set<String> getTableNames() {
        return engines.keySet();
    }
}
