package io.github.rowbase.query;

import io.github.rowbase.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

final class ResourceIdTest {

    @Test
    void joinsValuesWithSeparator() {
        assertEquals("12_abc", ResourceId.print(List.of("12", "abc"), '_'));
    }

    @Test
    void escapesSeparatorAndReservedCharacters() {
        String id = ResourceId.print(List.of("a_b", "c/d e"), '_');
        assertEquals("a%5Fb_c%2Fd%20e", id);
        assertEquals(List.of("a_b", "c/d e"), ResourceId.parse(id, '_'));
    }

    @Test
    void keepsEmptyValues() {
        assertEquals(List.of("1", ""), ResourceId.parse("1_", '_'));
    }

    @Test
    void rejectsBrokenPercentEncoding() {
        assertThrows(ValidationException.class, () -> ResourceId.parse("a%zz", '_'));
    }
}
