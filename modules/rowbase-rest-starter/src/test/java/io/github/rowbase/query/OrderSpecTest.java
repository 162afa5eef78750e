package io.github.rowbase.query;

import io.github.rowbase.dialect.FakeDialect;
import io.github.rowbase.exception.OrderSyntaxException;
import io.github.rowbase.model.DataModel;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class OrderSpecTest {

    private final DataModel model = FakeDialect.customers(new FakeDialect());

    @Test
    void rendersDirections() {
        assertEquals("\"age\" DESC,\"name\" ASC", OrderSpec.parse("age DESC,name").toSql(model));
        assertEquals("\"age\" DESC,\"name\" ASC", OrderSpec.parse("age-, name+").toSql(model));
        assertEquals("\"age\" ASC", OrderSpec.parse("age asc").toSql(model));
    }

    @Test
    void dropsUnknownFieldsWhenRendering() {
        OrderSpec order = OrderSpec.parse("nope DESC,age");
        assertEquals(2, order.getFieldNames().size());
        assertEquals("\"age\" ASC", order.toSql(model));
    }

    @Test
    void lenientParseSkipsInvalidItems() {
        assertEquals("\"name\" ASC", OrderSpec.parse("age sideways,name").toSql(model));
        assertTrue(OrderSpec.parse(null).isEmpty());
        assertEquals("", OrderSpec.parse("").toSql(model));
    }

    @Test
    void strictParseRejectsInvalidItems() {
        assertThrows(OrderSyntaxException.class, () -> OrderSpec.parseStrict("age sideways"));
        assertEquals("\"age\" DESC", OrderSpec.parseStrict("age DESC").toSql(model));
    }
}
