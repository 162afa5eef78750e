package io.github.rowbase.service;

import io.github.rowbase.codec.ContentType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one request: status, messages and, for reads, the encoded body.
 */
public class ApiResult {

    private boolean success = true;
    private int statusCode = 200;
    private String statusMessage = "OK";
    private final List<ApiMessage> messages = new ArrayList<>();
    private String body;
    private ContentType contentType;
    private String mediaType;

    public void setOk(int statusCode, String statusMessage) {
        this.success = true;
        this.statusCode = statusCode;
        this.statusMessage = statusMessage;
    }

    /**
     * Mark the result failed. The status message is also recorded as an error message.
     */
    public void setError(int statusCode, String statusMessage, String operation) {
        this.success = false;
        this.statusCode = statusCode;
        this.statusMessage = statusMessage;
        messages.add(new ApiMessage(ApiMessage.Level.ERROR, operation, statusMessage));
    }

    public void addError(String text, String operation) {
        messages.add(new ApiMessage(ApiMessage.Level.ERROR, operation, text));
    }

    public void addWarning(String text, String operation) {
        messages.add(new ApiMessage(ApiMessage.Level.WARNING, operation, text));
    }

    public void addInfo(String text, String operation) {
        messages.add(new ApiMessage(ApiMessage.Level.INFO, operation, text));
    }

    /**
     * @param mediaType full Content-Type header value, including a multipart boundary
     */
    public void setBody(String body, ContentType contentType, String mediaType) {
        this.body = body;
        this.contentType = contentType;
        this.mediaType = mediaType;
    }

    public boolean isSuccess() {
        return success;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getStatusMessage() {
        return statusMessage;
    }

    public List<ApiMessage> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public String getBody() {
        return body;
    }

    public ContentType getContentType() {
        return contentType;
    }

    public String getMediaType() {
        return mediaType;
    }

    @Override
    public String toString() {
        return "ApiResult{" +
                "success=" + success +
                ", statusCode=" + statusCode +
                ", statusMessage='" + statusMessage + '\'' +
                ", messages=" + messages +
                '}';
    }
}
