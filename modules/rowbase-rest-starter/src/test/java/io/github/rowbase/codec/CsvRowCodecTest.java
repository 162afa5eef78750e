package io.github.rowbase.codec;

import io.github.rowbase.exception.SerializationException;
import io.github.rowbase.model.Cell;
import io.github.rowbase.model.Row;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.rowbase.codec.CodecFixtures.ACTIVE;
import static io.github.rowbase.codec.CodecFixtures.AGE;
import static io.github.rowbase.codec.CodecFixtures.CREATED;
import static io.github.rowbase.codec.CodecFixtures.NAME;
import static io.github.rowbase.codec.CodecFixtures.customer;
import static io.github.rowbase.codec.CodecFixtures.rows;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class CsvRowCodecTest {

    private final CsvRowCodec codec = new CsvRowCodec();

    @Test
    void encodesHeaderAndQuotedValues() {
        Row row = customer(1, "Lee, \"Ann\"", 30);
        row.set(ACTIVE, Cell.of(true));
        row.set(CREATED, Cell.NULL);
        String body = codec.encode(rows(row), CodecFixtures.context());
        assertEquals("\"_ROWID_\",\"id\",\"name\",\"age\",\"active\",\"created\",\"photo\",\"group_id\"\r\n"
                + "\"1\",\"1\",\"Lee, \"\"Ann\"\"\",\"30\",\"true\",,,\r\n", body);
    }

    @Test
    void decodesWhatItEncodes() {
        Row row = customer(1, "Lee, \"Ann\"", 30);
        row.set(ACTIVE, Cell.of(true));
        row.set(CREATED, Cell.NULL);
        CodecContext context = CodecFixtures.context();
        List<Row> decoded = codec.decode(codec.encode(rows(row), CodecFixtures.context()), context);

        assertEquals(1, decoded.size());
        assertEquals(Cell.of("Lee, \"Ann\""), decoded.get(0).get(NAME));
        assertEquals(Cell.of(1L), decoded.get(0).get(CodecFixtures.ID));
        assertEquals(Cell.of(30L), decoded.get(0).get(AGE));
        assertEquals(Cell.of(true), decoded.get(0).get(ACTIVE));
        assertEquals(Cell.NULL, decoded.get(0).get(CREATED));
        assertTrue(context.getWarnings().isEmpty());
    }

    @Test
    void keepsEmptyStringApartFromNull() {
        CodecContext context = CodecFixtures.context();
        boolean[] selected = new boolean[CodecFixtures.CUSTOMERS.getFieldCount()];
        selected[NAME] = true;
        selected[AGE] = true;
        context.setSelected(selected);
        Row row = customer(1, "", 0);
        row.set(AGE, Cell.NULL);
        assertEquals("\"_ROWID_\",\"name\",\"age\"\r\n\"1\",\"\",\r\n", codec.encode(rows(row), context));

        List<Row> decoded = codec.decode("name,age\r\n\"\",\r\n", CodecFixtures.context());
        assertEquals(Cell.of(""), decoded.get(0).get(NAME));
        assertEquals(Cell.NULL, decoded.get(0).get(AGE));
    }

    @Test
    void decodesRowsByHeader() {
        CodecContext context = CodecFixtures.context();
        List<Row> rows = codec.decode("age,name,shoe_size\r\n30,Ann,38\r\n\r\n41,\"Bob\r\nJr\",44\r\n", context);
        assertEquals(2, rows.size());
        assertEquals(Cell.of(30L), rows.get(0).get(AGE));
        assertEquals(Cell.of("Ann"), rows.get(0).get(NAME));
        assertEquals(Cell.of("Bob\r\nJr"), rows.get(1).get(NAME));
        assertFalse(rows.get(0).isSupplied(ACTIVE));
        assertEquals(List.of("Unknown CSV column 'shoe_size' ignored"), context.getWarnings());
    }

    @Test
    void headerOnlyHasNoRows() {
        assertTrue(codec.decode("name,age\r\n", CodecFixtures.context()).isEmpty());
        assertTrue(codec.decode("", CodecFixtures.context()).isEmpty());
    }

    @Test
    void rejectsRaggedLines() {
        assertThrows(SerializationException.class,
                () -> codec.decode("name,age\r\nAnn\r\n", CodecFixtures.context()));
    }
}
