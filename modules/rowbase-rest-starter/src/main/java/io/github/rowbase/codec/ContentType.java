package io.github.rowbase.codec;

import java.util.Locale;

/**
 * Supported wire formats of request and response bodies.
 */
public enum ContentType {
    JSON("application/json", "json"),
    CSV("text/csv", "csv"),
    FORMDATA("multipart/form-data", "formdata"),
    URLENCODE("application/x-www-form-urlencoded", "urlencode");

    private final String mimeType;
    private final String shortName;

    ContentType(String mimeType, String shortName) {
        this.mimeType = mimeType;
        this.shortName = shortName;
    }

    public String getMimeType() {
        return mimeType;
    }

    public String getShortName() {
        return shortName;
    }

    /**
     * Look up by mime type or short name, ignoring case and mime type parameters.
     *
     * @return the content type, or {@code null} if unsupported
     */
    public static ContentType fromName(String name) {
        if (name == null) {
            return null;
        }
        String value = name.trim().toLowerCase(Locale.ROOT);
        int parameters = value.indexOf(';');
        if (parameters >= 0) {
            value = value.substring(0, parameters).trim();
        }
        for (ContentType type : values()) {
            if (type.mimeType.equals(value) || type.shortName.equals(value)) {
                return type;
            }
        }
        return null;
    }
}
