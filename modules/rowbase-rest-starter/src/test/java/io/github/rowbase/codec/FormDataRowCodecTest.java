package io.github.rowbase.codec;

import io.github.rowbase.exception.SerializationException;
import io.github.rowbase.model.Cell;
import io.github.rowbase.model.Row;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.rowbase.codec.CodecFixtures.AGE;
import static io.github.rowbase.codec.CodecFixtures.NAME;
import static io.github.rowbase.codec.CodecFixtures.PHOTO;
import static io.github.rowbase.codec.CodecFixtures.customer;
import static io.github.rowbase.codec.CodecFixtures.rows;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

final class FormDataRowCodecTest {

    private final FormDataRowCodec codec = new FormDataRowCodec();

    private static CodecContext context(String boundary) {
        CodecContext context = CodecFixtures.context();
        context.setBoundary(boundary);
        return context;
    }

    @Test
    void encodesFirstRowWithBlobAsFilePart() {
        Row row = customer(1, "Ann", 30);
        row.set(PHOTO, Cell.of(new byte[]{1, 2, 3}));
        CodecContext context = context("XyZ");
        String body = codec.encode(rows(row, customer(2, "Bob", 41)), context);
        assertEquals("--XyZ\r\nContent-Disposition: form-data; name=\"_ROWID_\"\r\n\r\n1\r\n"
                + "--XyZ\r\nContent-Disposition: form-data; name=\"id\"\r\n\r\n1\r\n"
                + "--XyZ\r\nContent-Disposition: form-data; name=\"name\"\r\n\r\nAnn\r\n"
                + "--XyZ\r\nContent-Disposition: form-data; name=\"age\"\r\n\r\n30\r\n"
                + "--XyZ\r\nContent-Disposition: form-data; name=\"photo\"; filename=\"photo\"\r\n"
                + "Content-Type: application/octet-stream\r\nContent-Transfer-Encoding: BASE64\r\n\r\nAQID\r\n"
                + "--XyZ--\r\n", body);
        assertEquals(1, context.getWarnings().size());
    }

    @Test
    void decodesParts() {
        String body = "preamble\r\n"
                + "--XyZ\r\nContent-Disposition: form-data; name=\"name\"\r\n\r\nAnn\r\nLee\r\n"
                + "--XyZ\r\nContent-Disposition: form-data; name=\"age\"\r\nContent-Transfer-Encoding: base64\r\n\r\nMzA=\r\n"
                + "--XyZ\r\nContent-Disposition: form-data; name=\"photo\"; filename=\"p.bin\"\r\n"
                + "Content-Type: application/octet-stream\r\nContent-Transfer-Encoding: base64\r\n\r\nAQID\r\n"
                + "--XyZ\r\nContent-Disposition: form-data; name=\"nickname\"\r\n\r\nA\r\n"
                + "--XyZ--\r\n";
        CodecContext context = context("XyZ");
        List<Row> rows = codec.decode(body, context);
        assertEquals(1, rows.size());
        assertEquals(Cell.of("Ann\r\nLee"), rows.get(0).get(NAME));
        assertEquals(Cell.of(30L), rows.get(0).get(AGE));
        assertArrayEquals(new byte[]{1, 2, 3}, rows.get(0).get(PHOTO).asBytes());
        assertEquals(List.of("Unknown form field 'nickname' ignored"), context.getWarnings());
    }

    @Test
    void requiresBoundary() {
        assertThrows(SerializationException.class, () -> codec.decode("--x--", CodecFixtures.context()));
        assertThrows(SerializationException.class, () -> codec.decode("no parts here", context("XyZ")));
    }
}
