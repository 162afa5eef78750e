package io.github.rowbase.codec;

import io.github.rowbase.model.Row;
import io.github.rowbase.model.RowSet;

import java.util.List;

/**
 * Converts rows to and from one wire format.
 */
public interface RowCodec {

    ContentType getContentType();

    /**
     * Encode every row of the set. Each row is fully encoded before it is appended, so a
     * failure never leaves a partial row in the output.
     *
     * @throws io.github.rowbase.exception.SerializationException if a value cannot be encoded
     */
    String encode(RowSet rows, CodecContext context);

    /**
     * Decode a request body into rows. Fields missing from the body are left unsupplied.
     *
     * @throws io.github.rowbase.exception.SerializationException if the body is malformed
     */
    List<Row> decode(String body, CodecContext context);
}
