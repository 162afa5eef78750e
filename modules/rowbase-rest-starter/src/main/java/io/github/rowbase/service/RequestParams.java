package io.github.rowbase.service;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Transport details of a request: query parameters and the negotiation headers.
 */
public class RequestParams {

    private final Map<String, String> queryParams;
    private final String contentType;
    private final String accept;

    public RequestParams(Map<String, String> queryParams, String contentType, String accept) {
        this.queryParams = queryParams == null ? Collections.emptyMap() : new HashMap<>(queryParams);
        this.contentType = contentType;
        this.accept = accept;
    }

    public static RequestParams empty() {
        return new RequestParams(null, null, null);
    }

    public String getQueryParam(String name) {
        return queryParams.get(name);
    }

    public String getContentType() {
        return contentType;
    }

    public String getAccept() {
        return accept;
    }
}
