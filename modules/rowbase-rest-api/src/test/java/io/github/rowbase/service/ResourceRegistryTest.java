package io.github.rowbase.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.rowbase.config.RestApiConfig;
import io.github.rowbase.dialect.AbstractJdbcDialect;
import io.github.rowbase.dialect.SqlDialect;
import io.github.rowbase.exception.DataSourceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

final class ResourceRegistryTest {

    private final Map<String, String> descriptions = new HashMap<>();
    private ServiceLookup serviceLookup;
    private RestApiConfig config;

    @BeforeEach
    void setUp() {
        SqlDialect dialect = new AbstractJdbcDialect(null) {
            @Override
            public String getName() {
                return "postgres";
            }

            @Override
            public String quoteIdentifier(String name) {
                return "\"" + name + "\"";
            }

            @Override
            public String printStringLiteral(String value) {
                return "'" + value.replace("'", "''") + "'";
            }

            @Override
            protected String printBytesLiteral(byte[] value) {
                return "NULL";
            }

            @Override
            public String describeTable(String tableName) {
                String description = descriptions.get(tableName);
                if (description == null) {
                    throw new DataSourceException("Table '" + tableName + "' not found");
                }
                return description;
            }
        };
        serviceLookup = mock(ServiceLookup.class);
        when(serviceLookup.forBean(SqlDialect.class, "postgres")).thenReturn(dialect);
        config = new RestApiConfig();
    }

    private void addResource(String tableName, String ddl) {
        RestApiConfig.ResourceConfig resource = new RestApiConfig.ResourceConfig();
        resource.setTableName(tableName);
        config.getResources().add(resource);
        descriptions.put(tableName, ddl);
    }

    @Test
    void buildsOneEnginePerResource() {
        addResource("customers", "CREATE TABLE customers (id serial PRIMARY KEY, name text)");
        addResource("orders", "CREATE TABLE orders (id integer PRIMARY KEY, customer_id integer, secret text)");
        config.getResources().get(1).setExcludeFields(List.of("secret"));
        config.getResources().get(1).getHashid().setKey("00112233445566778899aabbccddeeff");

        ResourceRegistry registry = new ResourceRegistry(config, serviceLookup, new ObjectMapper());

        assertEquals(Set.of("customers", "orders"), registry.getTableNames());
        assertNotNull(registry.find("customers"));
        assertEquals(2, registry.find("orders").getDataModel().getFieldCount());
        assertNull(registry.find("ghosts"));
    }

    @Test
    void failsWhenATableCannotBeDescribed() {
        RestApiConfig.ResourceConfig resource = new RestApiConfig.ResourceConfig();
        resource.setTableName("ghosts");
        config.getResources().add(resource);

        assertThrows(DataSourceException.class, () -> new ResourceRegistry(config, serviceLookup, new ObjectMapper()));
    }
}
