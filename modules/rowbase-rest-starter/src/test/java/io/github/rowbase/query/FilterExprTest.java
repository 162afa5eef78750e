package io.github.rowbase.query;

import io.github.rowbase.dialect.FakeDialect;
import io.github.rowbase.exception.FilterSyntaxException;
import io.github.rowbase.model.DataModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class FilterExprTest {

    private DataModel model;

    @BeforeEach
    void setUp() {
        model = FakeDialect.customers(new FakeDialect());
    }

    @Test
    void rendersComparison() {
        assertEquals("(\"name\" = 'John')", FilterExpr.parse("(name)-eq(John)").toSql(model));
        assertEquals("(\"age\" > 30)", FilterExpr.parse("(age)-gt(30)").toSql(model));
        assertEquals("(\"age\" <= -5)", FilterExpr.parse("(age)-le(-5)").toSql(model));
        assertEquals("(\"name\" LIKE 'Jo%')", FilterExpr.parse("(name)-like(Jo%)").toSql(model));
    }

    @Test
    void acceptsQuotedFieldAndUpperCaseOperator() {
        assertEquals("(\"name\" = 'John')", FilterExpr.parse("(\"name\")-eq(John)").toSql(model));
        assertEquals("(\"age\" >= 18)", FilterExpr.parse("(age)-GE(18)").toSql(model));
    }

    @Test
    void printsLiteralsByFieldType() {
        assertEquals("(\"active\" = TRUE)", FilterExpr.parse("(active)-eq(true)").toSql(model));
        assertEquals("(\"created\" >= '2024-01-01T00:00:00Z')",
                FilterExpr.parse("(created)-ge(2024-01-01)").toSql(model));
        assertEquals("(\"name\" = 'Jean-Luc')", FilterExpr.parse("(name)-eq(Jean-Luc)").toSql(model));
    }

    @Test
    void rendersNegation() {
        assertEquals("NOT ((\"age\" > 30))", FilterExpr.parse("-not((age)-gt(30))").toSql(model));
    }

    @Test
    void rendersBracketedConjunction() {
        FilterExpr filter = FilterExpr.parse("((name)-eq(John))-and((age)-ge(18))");
        assertEquals("((\"name\" = 'John') AND (\"age\" >= 18))", filter.toSql(model));
    }

    @Test
    void foldsChainedConditions() {
        FilterExpr filter = FilterExpr.parse("(name)-eq(John)-and(age)-ge(18)");
        assertEquals("((\"name\" = 'John') AND (\"age\" >= 18))", filter.toSql(model));
    }

    @Test
    void orBindsWeakerThanAnd() {
        FilterExpr filter = FilterExpr.parse("(age)-lt(10)-or(age)-gt(60)-and(active)-eq(true)");
        assertEquals("((\"age\" < 10) OR ((\"age\" > 60) AND (\"active\" = TRUE)))", filter.toSql(model));
    }

    @Test
    void emptyFilterRendersNothing() {
        assertTrue(FilterExpr.parse(null).isEmpty());
        assertTrue(FilterExpr.parse("  ").isEmpty());
        assertEquals("", FilterExpr.parse("").toSql(model));
    }

    @Test
    void combineSkipsEmptySides() {
        FilterExpr condition = FilterExpr.parse("(age)-gt(30)");
        assertSame(condition, FilterExpr.combine(FilterExpr.empty(), BooleanOperation.AND, condition));
        assertSame(condition, FilterExpr.combine(condition, BooleanOperation.OR, null));
        assertTrue(FilterExpr.combine(null, BooleanOperation.AND, FilterExpr.empty()).isEmpty());
        assertEquals("((\"age\" > 30) OR (\"age\" > 30))",
                FilterExpr.combine(condition, BooleanOperation.OR, condition).toSql(model));
    }

    @Test
    void collectsFieldNames() {
        FilterExpr filter = FilterExpr.parse("-not((name)-eq(John))-and((age)-ge(18))");
        assertEquals(Set.of("name", "age"), filter.getFieldNames());
    }

    @Test
    void rejectsMalformedFilters() {
        assertThrows(FilterSyntaxException.class, () -> FilterExpr.parse("(name)-xx(John)"));
        assertThrows(FilterSyntaxException.class, () -> FilterExpr.parse("((name)-eq(John)"));
        assertThrows(FilterSyntaxException.class, () -> FilterExpr.parse("(name)-eq(O'Brien)"));
        assertThrows(FilterSyntaxException.class, () -> FilterExpr.parse("name = John"));
        assertThrows(FilterSyntaxException.class, () -> FilterExpr.parse("(name)-eq(John)-and"));
    }

    @Test
    void rejectsEmptyOperands() {
        assertThrows(FilterSyntaxException.class, () -> FilterExpr.parse("-not()"));
        assertThrows(FilterSyntaxException.class, () -> FilterExpr.parse("((age)-gt(1))-and()"));
        assertThrows(FilterSyntaxException.class, () -> FilterExpr.parse("()-or((age)-gt(1))"));
    }

    @Test
    void keepsNineteenDigitLiterals() {
        assertEquals("(\"id\" = 1234567890123456789)",
                FilterExpr.parse("(id)-eq(1234567890123456789)").toSql(model));
        assertEquals("(\"id\" = 9223372036854775807)",
                FilterExpr.parse("(id)-eq(9223372036854775807)").toSql(model));
    }

    @Test
    void rejectsLiteralOfWrongType() {
        FilterExpr filter = FilterExpr.parse("(age)-gt(abc)");
        FilterSyntaxException e = assertThrows(FilterSyntaxException.class, () -> filter.toSql(model));
        assertEquals("abc", e.getFragment());
    }

    @Test
    void unknownFieldIsRenderedAsIs() {
        assertEquals("(\"nope\" = 1)", FilterExpr.condition("nope", Comparison.EQ, "1").toSql(model));
    }
}
