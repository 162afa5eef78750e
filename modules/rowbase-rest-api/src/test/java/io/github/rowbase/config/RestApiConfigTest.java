package io.github.rowbase.config;

import io.github.rowbase.settings.ApiSettings;
import io.github.rowbase.settings.ResourceSettings;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class RestApiConfigTest {

    @Test
    void defaultsMatchApiDefaults() {
        ApiSettings settings = new RestApiConfig().toApiSettings();
        assertEquals("_ROWID_", settings.getIdFieldName());
        assertEquals('_', settings.getIdSeparator());
        assertEquals("filter", settings.getFilterParam());
        assertEquals("responsetype", settings.getResponseTypeParam());
    }

    @Test
    void renamedParametersAreApplied() {
        RestApiConfig config = new RestApiConfig();
        config.setIdFieldName("rowid");
        config.setIdSeparator("~");
        config.getParams().setFilter("where");
        config.getParams().setRequestType("in");
        ApiSettings settings = config.toApiSettings();
        assertEquals("rowid", settings.getIdFieldName());
        assertEquals('~', settings.getIdSeparator());
        assertEquals("where", settings.getFilterParam());
        assertEquals("in", settings.getRequestTypeParam());
    }

    @Test
    void separatorMustBeOneCharacter() {
        RestApiConfig config = new RestApiConfig();
        config.setIdSeparator("--");
        assertThrows(IllegalArgumentException.class, config::toApiSettings);
        config.setIdSeparator("");
        assertThrows(IllegalArgumentException.class, config::toApiSettings);
    }

    @Test
    void resourceConfigBecomesSettings() {
        RestApiConfig.ResourceConfig resource = new RestApiConfig.ResourceConfig();
        resource.setTableName("customers");
        resource.setExcludeFieldPrefix("_");
        resource.setExcludeFields(List.of("password"));
        resource.setFailOnInsertWithoutKey(true);

        ResourceSettings settings = resource.toResourceSettings();
        assertEquals("customers", settings.getTableName());
        assertFalse(settings.isFieldExposed("_internal"));
        assertFalse(settings.isFieldExposed("password"));
        assertTrue(settings.isFieldExposed("name"));
        assertTrue(settings.isFailOnInsertWithoutKey());
        assertFalse(settings.isHashidEnabled());

        resource.getHashid().setKey("00112233445566778899aabbccddeeff");
        resource.getHashid().setMinLength(20);
        ResourceSettings hashed = resource.toResourceSettings();
        assertTrue(hashed.isHashidEnabled());
        assertEquals(20, hashed.getHashidMinLength());
    }
}
