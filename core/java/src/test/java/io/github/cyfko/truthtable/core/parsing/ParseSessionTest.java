package io.github.cyfko.truthtable.core.parsing;

import io.github.cyfko.truthtable.core.api.Expression;
import io.github.cyfko.truthtable.core.registry.VariableRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ParseSession} and {@link ParseResult}.
 */
@DisplayName("ParseSession Tests")
class ParseSessionTest {

    @Test
    @DisplayName("Parsing the whole text interns every variable into the session registry")
    void testParseAllInternsVariables() {
        VariableRegistry registry = new VariableRegistry();
        ParseSession session = new ParseSession("c|a&b", registry, true);

        ParseResult result = session.parseAll();

        assertTrue(result.isSuccess());
        assertEquals("(c | (a & b))", result.expression().toInfix());
        assertSame(registry, session.registry());
        assertEquals("[a, b, c]", registry.all().toString());
    }

    @Test
    @DisplayName("Sub-spans can be parsed on their own")
    void testParseSpan() {
        ParseSession session = new ParseSession("a&(b|c)", new VariableRegistry(), false);

        ParseResult inner = session.parse(2, 6);
        assertTrue(inner.isSuccess());
        assertEquals("(b | c)", inner.expression().toInfix());

        ParseResult broken = session.parse(0, 3);
        assertFalse(broken.isSuccess());
        assertEquals(0, broken.from());
        assertEquals(3, broken.to());
    }

    @Test
    @DisplayName("Empty spans fail")
    void testEmptySpan() {
        ParseSession session = new ParseSession("a", new VariableRegistry(), true);
        assertFalse(session.parse(1, 0).isSuccess());
    }

    @Test
    @DisplayName("Memoization evaluates fewer spans and gives the same outcome")
    void testMemoizationSavesAttempts() {
        String text = "a|b|c|d|e|f|g|";
        ParseSession memoized = new ParseSession(text, new VariableRegistry(), true);
        ParseSession plain = new ParseSession(text, new VariableRegistry(), false);

        assertFalse(memoized.parseAll().isSuccess());
        assertFalse(plain.parseAll().isSuccess());
        assertTrue(memoized.attempts() < plain.attempts(),
                () -> "memoized=" + memoized.attempts() + ", plain=" + plain.attempts());
    }

    @Test
    @DisplayName("Memoized and plain sessions build equal trees")
    void testMemoizationTransparent() {
        String text = "~(p->q)<->p&~q|(r->r)";
        Expression memoized = new ParseSession(text, new VariableRegistry(), true).parseAll().expression();
        Expression plain = new ParseSession(text, new VariableRegistry(), false).parseAll().expression();
        assertEquals(plain, memoized);
    }

    @Test
    @DisplayName("A failed result has no expression")
    void testFailureHasNoExpression() {
        ParseResult failure = ParseResult.failure(2, 5);

        assertFalse(failure.isSuccess());
        assertThrows(IllegalStateException.class, failure::expression);
        assertEquals("ParseResult[failure=[2, 5]]", failure.toString());
    }

    @Test
    @DisplayName("A successful result requires an expression")
    void testSuccessRequiresExpression() {
        assertThrows(IllegalArgumentException.class, () -> ParseResult.success(null));

        ParseResult success = ParseResult.success(Expression.Constant.TRUE);
        assertTrue(success.isSuccess());
        assertEquals(-1, success.from());
    }
}
