package io.github.rowbase.controller;

import io.github.rowbase.service.ApiMessage;
import io.github.rowbase.service.ApiResult;
import io.github.rowbase.service.QueryEngine;
import io.github.rowbase.service.RequestParams;
import io.github.rowbase.service.ResourceRegistry;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1")
public class RestApiController {

    static final String MESSAGE_HEADER_PREFIX = "X-Rowbase-Message-";

    private final ResourceRegistry resourceRegistry;

    public RestApiController(ResourceRegistry resourceRegistry) {
        this.resourceRegistry = resourceRegistry;
    }

    // GET /api/v1/{table} - Rows of a table with optional filter, order, limit, select and aggregate
    @GetMapping("/{table}")
    public ResponseEntity<?> getRecords(
            @PathVariable String table,
            @RequestParam Map<String, String> allParams,
            @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
        return handle(table, "GET", null, null, new RequestParams(allParams, null, accept));
    }

    // GET /api/v1/{table}/{id} - A single row by id
    @GetMapping("/{table}/{id}")
    public ResponseEntity<?> getRecord(
            @PathVariable String table,
            @PathVariable String id,
            @RequestParam Map<String, String> allParams,
            @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
        return handle(table, "GET", id, null, new RequestParams(allParams, null, accept));
    }

    // POST /api/v1/{table} - Insert one or more rows
    @PostMapping("/{table}")
    public ResponseEntity<?> createRecords(
            @PathVariable String table,
            @RequestBody(required = false) String body,
            @RequestParam Map<String, String> allParams,
            @RequestHeader(value = HttpHeaders.CONTENT_TYPE, required = false) String contentType) {
        return handle(table, "POST", null, body, new RequestParams(allParams, contentType, null));
    }

    // PUT /api/v1/{table}/{id} - Update a row
    @PutMapping("/{table}/{id}")
    public ResponseEntity<?> updateRecord(
            @PathVariable String table,
            @PathVariable String id,
            @RequestBody(required = false) String body,
            @RequestParam Map<String, String> allParams,
            @RequestHeader(value = HttpHeaders.CONTENT_TYPE, required = false) String contentType) {
        return handle(table, "PUT", id, body, new RequestParams(allParams, contentType, null));
    }

    // DELETE /api/v1/{table}/{id} - Delete a row
    @DeleteMapping("/{table}/{id}")
    public ResponseEntity<?> deleteRecord(
            @PathVariable String table,
            @PathVariable String id,
            @RequestParam Map<String, String> allParams) {
        return handle(table, "DELETE", id, null, new RequestParams(allParams, null, null));
    }

    private ResponseEntity<?> handle(String table, String method, String id, String body, RequestParams request) {
        QueryEngine engine = resourceRegistry.find(table);
        if (engine == null) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "Table '" + table + "' not found"));
        }
        ApiResult result = engine.doRequest(method, id, body, request);

        HttpHeaders headers = new HttpHeaders();
        List<ApiMessage> messages = result.getMessages();
        for (int i = 0; i < messages.size(); i++) {
            headers.add(MESSAGE_HEADER_PREFIX + (i + 1), messages.get(i).toString());
        }

        if (result.isSuccess() && result.getBody() != null) {
            headers.setContentType(MediaType.parseMediaType(result.getMediaType()));
            return ResponseEntity.status(result.getStatusCode()).headers(headers).body(result.getBody());
        }
        headers.setContentType(MediaType.APPLICATION_JSON);
        return ResponseEntity.status(result.getStatusCode()).headers(headers).body(toStatusBody(result));
    }

    private static Map<String, Object> toStatusBody(ApiResult result) {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("success", result.isSuccess());
        status.put("statusCode", result.getStatusCode());
        status.put("statusMessage", result.getStatusMessage());
        status.put("messages", result.getMessages().stream()
                .map(ApiMessage::toString)
                .collect(Collectors.toList()));
        return status;
    }
}
