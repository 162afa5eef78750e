package io.github.rowbase.codec;

import io.github.rowbase.exception.SerializationException;
import io.github.rowbase.model.Cell;
import io.github.rowbase.model.Row;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.rowbase.codec.CodecFixtures.AGE;
import static io.github.rowbase.codec.CodecFixtures.CREATED;
import static io.github.rowbase.codec.CodecFixtures.NAME;
import static io.github.rowbase.codec.CodecFixtures.customer;
import static io.github.rowbase.codec.CodecFixtures.rows;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

final class UrlEncodedRowCodecTest {

    private final UrlEncodedRowCodec codec = new UrlEncodedRowCodec();

    @Test
    void encodesOneLinePerRowWithoutNulls() {
        Row row = customer(1, "Ann Lee&Co", 30);
        row.set(CREATED, Cell.NULL);
        assertEquals("_ROWID_=1&id=1&name=Ann+Lee%26Co&age=30\r\n_ROWID_=2&id=2&name=Bob&age=41\r\n",
                codec.encode(rows(row, customer(2, "Bob", 41)), CodecFixtures.context()));
    }

    @Test
    void decodesLines() {
        CodecContext context = CodecFixtures.context();
        List<Row> rows = codec.decode("name=Ann+Lee&age=30&bogus=1\r\nname=Bob%21&age=\r\n", context);
        assertEquals(2, rows.size());
        assertEquals(Cell.of("Ann Lee"), rows.get(0).get(NAME));
        assertEquals(Cell.of(30L), rows.get(0).get(AGE));
        assertEquals(Cell.of("Bob!"), rows.get(1).get(NAME));
        assertEquals(Cell.of(0L), rows.get(1).get(AGE));
        assertEquals(List.of("Unknown form field 'bogus' ignored"), context.getWarnings());
    }

    @Test
    void keepsPlusSignsAndNonAsciiText() {
        String body = codec.encode(rows(customer(3, "1+1 = 2 \u00fc", 7)), CodecFixtures.context());
        assertEquals("_ROWID_=3&id=3&name=1%2B1+%3D+2+%C3%BC&age=7\r\n", body);
        assertEquals(Cell.of("1+1 = 2 \u00fc"), codec.decode(body, CodecFixtures.context()).get(0).get(NAME));
    }

    @Test
    void rejectsBrokenEscapes() {
        assertThrows(SerializationException.class, () -> codec.decode("name=%zz", CodecFixtures.context()));
    }
}
