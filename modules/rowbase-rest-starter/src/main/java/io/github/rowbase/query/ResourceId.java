package io.github.rowbase.query;

import io.github.rowbase.exception.ValidationException;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Row ids: primary key values joined with the id separator. Each value is percent encoded
 * and the separator itself is always escaped, so values containing it survive the round trip.
 */
public final class ResourceId {

    private ResourceId() {
    }

    public static String print(List<String> keyValues, char separator) {
        String escapedSeparator = "%" + Integer.toHexString(separator).toUpperCase(Locale.ROOT);
        String separatorText = String.valueOf(separator);
        List<String> parts = new ArrayList<>(keyValues.size());
        for (String value : keyValues) {
            String encoded = UriUtils.encode(value == null ? "" : value, StandardCharsets.UTF_8);
            parts.add(encoded.replace(separatorText, escapedSeparator));
        }
        return String.join(separatorText, parts);
    }

    /**
     * Split an id into its decoded key values.
     *
     * @throws ValidationException if a value is not valid percent encoding
     */
    public static List<String> parse(String id, char separator) {
        String[] parts = id.split(Pattern.quote(String.valueOf(separator)), -1);
        List<String> values = new ArrayList<>(parts.length);
        for (String part : parts) {
            try {
                values.add(UriUtils.decode(part, StandardCharsets.UTF_8));
            } catch (IllegalArgumentException e) {
                throw new ValidationException("Invalid id '" + id + "'", e);
            }
        }
        return values;
    }
}
