package io.github.rowbase.codec;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Row codec per content type.
 */
public class RowCodecs {

    private final Map<ContentType, RowCodec> codecs;

    public RowCodecs(ObjectMapper objectMapper) {
        Map<ContentType, RowCodec> map = new EnumMap<>(ContentType.class);
        register(map, new JsonRowCodec(objectMapper));
        register(map, new CsvRowCodec());
        register(map, new FormDataRowCodec());
        register(map, new UrlEncodedRowCodec());
        this.codecs = Collections.unmodifiableMap(map);
    }

    private static void register(Map<ContentType, RowCodec> map, RowCodec codec) {
        map.put(codec.getContentType(), codec);
    }

    public RowCodec forType(ContentType contentType) {
        return codecs.get(contentType);
    }
}
