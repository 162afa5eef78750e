package io.github.rowbase.controller;

import io.github.rowbase.codec.ContentType;
import io.github.rowbase.service.ApiResult;
import io.github.rowbase.service.QueryEngine;
import io.github.rowbase.service.RequestParams;
import io.github.rowbase.service.ResourceRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.hamcrest.Matchers.contains;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

final class RestApiControllerTest {

    private QueryEngine engine;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ResourceRegistry registry = mock(ResourceRegistry.class);
        engine = mock(QueryEngine.class);
        when(registry.find("customers")).thenReturn(engine);
        mockMvc = MockMvcBuilders.standaloneSetup(new RestApiController(registry)).build();
    }

    @Test
    void unknownTableIsNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/ghosts"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Table 'ghosts' not found"));
        verify(engine, never()).doRequest(anyString(), any(), any(), any());
    }

    @Test
    void getReturnsEncodedBodyWithMessageHeaders() throws Exception {
        ApiResult result = new ApiResult();
        result.setBody("\"_ROWID_\",\"name\"\r\n\"1\",\"Ann\"\r\n", ContentType.CSV, "text/csv");
        result.addWarning("Unknown CSV column 'x' ignored", "GET");
        when(engine.doRequest(eq("GET"), isNull(), isNull(), any(RequestParams.class))).thenReturn(result);

        mockMvc.perform(get("/api/v1/customers")
                        .param("filter", "(age)-gt(30)")
                        .header("Accept", "text/csv"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(content().string("\"_ROWID_\",\"name\"\r\n\"1\",\"Ann\"\r\n"))
                .andExpect(header().string(RestApiController.MESSAGE_HEADER_PREFIX + "1",
                        "WARNING (GET): Unknown CSV column 'x' ignored"));

        verify(engine).doRequest(eq("GET"), isNull(), isNull(), argThat(request ->
                "(age)-gt(30)".equals(request.getQueryParam("filter")) && "text/csv".equals(request.getAccept())));
    }

    @Test
    void getByIdPassesTheId() throws Exception {
        ApiResult result = new ApiResult();
        result.setBody("[]", ContentType.JSON, "application/json");
        when(engine.doRequest(eq("GET"), eq("7"), isNull(), any(RequestParams.class))).thenReturn(result);

        mockMvc.perform(get("/api/v1/customers/7"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(content().string("[]"));
    }

    @Test
    void postAnswersWithStatusBody() throws Exception {
        ApiResult result = new ApiResult();
        result.setOk(201, "Inserted 1 row(s)");
        when(engine.doRequest(eq("POST"), isNull(), eq("name,age\r\nAnn,30\r\n"), any(RequestParams.class)))
                .thenReturn(result);

        mockMvc.perform(post("/api/v1/customers")
                        .contentType("text/csv")
                        .content("name,age\r\nAnn,30\r\n"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.statusCode").value(201))
                .andExpect(jsonPath("$.statusMessage").value("Inserted 1 row(s)"));

        verify(engine).doRequest(eq("POST"), isNull(), anyString(),
                argThat(request -> request.getContentType().startsWith("text/csv")));
    }

    @Test
    void putFailureCarriesMessages() throws Exception {
        ApiResult result = new ApiResult();
        result.setError(405, "Field 'name' is not allowed to be NULL!", "PUT");
        when(engine.doRequest(eq("PUT"), eq("7"), eq("{\"name\":null}"), any(RequestParams.class)))
                .thenReturn(result);

        mockMvc.perform(put("/api/v1/customers/7")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":null}"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.messages", contains("ERROR (PUT): Field 'name' is not allowed to be NULL!")))
                .andExpect(header().exists(RestApiController.MESSAGE_HEADER_PREFIX + "1"));
    }

    @Test
    void deleteMissingRowIsNotFound() throws Exception {
        ApiResult result = new ApiResult();
        result.setError(404, "No row with id '9'", "DELETE");
        when(engine.doRequest(eq("DELETE"), eq("9"), isNull(), any(RequestParams.class))).thenReturn(result);

        mockMvc.perform(delete("/api/v1/customers/9"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.statusMessage").value("No row with id '9'"));
    }
}
