package io.github.rowbase.codec;

import io.github.rowbase.exception.UnsupportedMediaTypeException;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Picks request and response content types. An explicit override parameter wins over the
 * Content-Type and Accept headers.
 */
public final class ContentNegotiator {

    private ContentNegotiator() {
    }

    /**
     * Content type of a request body. No override and no Content-Type means JSON.
     *
     * @throws UnsupportedMediaTypeException if the override or header names an unsupported type
     */
    public static ContentType requestType(String override, String contentTypeHeader) {
        if (override != null && !override.isBlank()) {
            return require(override);
        }
        if (contentTypeHeader == null || contentTypeHeader.isBlank()) {
            return ContentType.JSON;
        }
        return require(contentTypeHeader);
    }

    /**
     * Content type of a response. Accept entries are tried in order of quality; if none is
     * supported the response is JSON.
     *
     * @throws UnsupportedMediaTypeException if the override names an unsupported type
     */
    public static ContentType responseType(String override, String acceptHeader) {
        if (override != null && !override.isBlank()) {
            return require(override);
        }
        if (acceptHeader == null || acceptHeader.isBlank()) {
            return ContentType.JSON;
        }
        List<MediaType> accepted;
        try {
            accepted = new ArrayList<>(MediaType.parseMediaTypes(acceptHeader));
        } catch (InvalidMediaTypeException e) {
            return ContentType.JSON;
        }
        accepted.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
        for (MediaType mediaType : accepted) {
            if (mediaType.getQualityValue() <= 0) {
                continue;
            }
            for (ContentType contentType : ContentType.values()) {
                if (mediaType.includes(MediaType.parseMediaType(contentType.getMimeType()))) {
                    return contentType;
                }
            }
        }
        return ContentType.JSON;
    }

    /**
     * Boundary parameter of a multipart Content-Type header, or {@code null}.
     */
    public static String boundaryOf(String contentTypeHeader) {
        if (contentTypeHeader == null || contentTypeHeader.isBlank()) {
            return null;
        }
        try {
            String boundary = MediaType.parseMediaType(contentTypeHeader).getParameter("boundary");
            if (boundary != null && boundary.length() > 1 && boundary.startsWith("\"") && boundary.endsWith("\"")) {
                boundary = boundary.substring(1, boundary.length() - 1);
            }
            return boundary;
        } catch (InvalidMediaTypeException e) {
            return null;
        }
    }

    private static ContentType require(String name) {
        ContentType contentType = ContentType.fromName(name);
        if (contentType == null) {
            throw new UnsupportedMediaTypeException("Unsupported content type '" + name + "'");
        }
        return contentType;
    }
}
