package io.github.rowbase.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.rowbase.exception.SerializationException;
import io.github.rowbase.model.Cell;
import io.github.rowbase.model.Row;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static io.github.rowbase.codec.CodecFixtures.ACTIVE;
import static io.github.rowbase.codec.CodecFixtures.AGE;
import static io.github.rowbase.codec.CodecFixtures.CREATED;
import static io.github.rowbase.codec.CodecFixtures.GROUP_ID;
import static io.github.rowbase.codec.CodecFixtures.NAME;
import static io.github.rowbase.codec.CodecFixtures.PHOTO;
import static io.github.rowbase.codec.CodecFixtures.customer;
import static io.github.rowbase.codec.CodecFixtures.rows;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class JsonRowCodecTest {

    private final JsonRowCodec codec = new JsonRowCodec(new ObjectMapper());

    @Test
    void encodesSuppliedFieldsAfterTheRowId() {
        Row row = customer(1, "Ann \"A\"", 30);
        row.set(ACTIVE, Cell.of(true));
        row.set(CREATED, Cell.NULL);
        String body = codec.encode(rows(row, customer(2, "Bob", 41)), CodecFixtures.context());
        assertEquals("[\r\n"
                + "{\"_ROWID_\":\"1\",\"id\":1,\"name\":\"Ann \\\"A\\\"\",\"age\":30,\"active\":true,\"created\":null},\r\n"
                + "{\"_ROWID_\":\"2\",\"id\":2,\"name\":\"Bob\",\"age\":41}\r\n"
                + "]", body);
    }

    @Test
    void decodesWhatItEncodes() {
        Row row = customer(5, "tab\there\u0001", 44);
        row.set(ACTIVE, Cell.of(false));
        row.set(CREATED, Cell.of(Instant.parse("2024-03-01T12:00:00.250Z")));
        row.set(PHOTO, Cell.of(new byte[]{0, 1, (byte) 0xff}));
        row.set(GROUP_ID, Cell.of(Long.MAX_VALUE));
        Row empty = customer(6, "", 0);
        empty.set(CREATED, Cell.NULL);
        empty.set(PHOTO, Cell.NULL);

        String body = codec.encode(rows(row, empty), CodecFixtures.context());
        List<Row> decoded = codec.decode(body, CodecFixtures.context());

        assertEquals(2, decoded.size());
        for (int i = 0; i < CodecFixtures.CUSTOMERS.getFieldCount(); i++) {
            assertEquals(row.get(i), decoded.get(0).get(i), CodecFixtures.CUSTOMERS.getField(i).getName());
        }
        Row second = decoded.get(1);
        assertEquals(Cell.of(""), second.get(NAME));
        assertEquals(Cell.NULL, second.get(CREATED));
        assertEquals(Cell.of(new byte[0]), second.get(PHOTO));
    }

    @Test
    void encodesEmptySetAsEmptyArray() {
        assertEquals("[]", codec.encode(rows(), CodecFixtures.context()));
    }

    @Test
    void leavesOutUnselectedFields() {
        CodecContext context = CodecFixtures.context();
        boolean[] selected = new boolean[CodecFixtures.CUSTOMERS.getFieldCount()];
        selected[NAME] = true;
        context.setSelected(selected);
        assertEquals("[\r\n{\"_ROWID_\":\"1\",\"name\":\"Ann\"}\r\n]", codec.encode(rows(customer(1, "Ann", 30)), context));
    }

    @Test
    void decodesObjectAndArray() {
        CodecContext context = CodecFixtures.context();
        List<Row> single = codec.decode("{\"_ROWID_\":\"9\",\"name\":\"Ann\",\"age\":null}", context);
        assertEquals(1, single.size());
        assertEquals(Cell.of("Ann"), single.get(0).get(NAME));
        assertEquals(Cell.NULL, single.get(0).get(AGE));
        assertTrue(single.get(0).isSupplied(AGE));
        assertFalse(single.get(0).isSupplied(CodecFixtures.ID));

        List<Row> many = codec.decode("[{\"name\":\"A\",\"active\":true},{\"name\":\"B\",\"age\":\"41\"}]", context);
        assertEquals(2, many.size());
        assertEquals(Cell.of(true), many.get(0).get(ACTIVE));
        assertEquals(Cell.of(41L), many.get(1).get(AGE));
    }

    @Test
    void warnsAboutUnknownKeys() {
        CodecContext context = CodecFixtures.context();
        List<Row> rows = codec.decode("{\"name\":\"Ann\",\"nickname\":\"A\"}", context);
        assertEquals(1, rows.size());
        assertEquals(List.of("Unknown field 'nickname' ignored"), context.getWarnings());
    }

    @Test
    void emptyBodyHasNoRows() {
        assertTrue(codec.decode("", CodecFixtures.context()).isEmpty());
        assertTrue(codec.decode("[]", CodecFixtures.context()).isEmpty());
    }

    @Test
    void rejectsMalformedBodies() {
        CodecContext context = CodecFixtures.context();
        assertThrows(SerializationException.class, () -> codec.decode("{\"name\":", context));
        assertThrows(SerializationException.class, () -> codec.decode("42", context));
        assertThrows(SerializationException.class, () -> codec.decode("[1, 2]", context));
        assertThrows(SerializationException.class, () -> codec.decode("{\"age\":\"old\"}", context));
    }
}
