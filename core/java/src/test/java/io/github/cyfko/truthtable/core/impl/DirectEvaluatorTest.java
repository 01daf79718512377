package io.github.cyfko.truthtable.core.impl;

import io.github.cyfko.truthtable.core.api.Assignment;
import io.github.cyfko.truthtable.core.api.BinaryOperator;
import io.github.cyfko.truthtable.core.api.Expression;
import io.github.cyfko.truthtable.core.api.Expression.Binary;
import io.github.cyfko.truthtable.core.api.Expression.Constant;
import io.github.cyfko.truthtable.core.api.Expression.Literal;
import io.github.cyfko.truthtable.core.api.Expression.Negation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DirectEvaluator Tests")
class DirectEvaluatorTest {

    private final DirectEvaluator evaluator = new DirectEvaluator();
    private final Literal a = new Literal('a');
    private final Literal b = new Literal('b');

    private static Assignment ab(boolean a, boolean b) {
        return Assignment.of(Map.of('a', a, 'b', b));
    }

    @Test
    @DisplayName("Negation inverts its operand")
    void testNegation() {
        Expression notA = new Negation(a);
        assertFalse(evaluator.evaluate(notA, Assignment.of(Map.of('a', true))));
        assertTrue(evaluator.evaluate(notA, Assignment.of(Map.of('a', false))));
    }

    @Test
    @DisplayName("Constants ignore the assignment")
    void testConstants() {
        assertTrue(evaluator.evaluate(Constant.TRUE, Assignment.empty()));
        assertFalse(evaluator.evaluate(Constant.FALSE, ab(true, true)));
    }

    @ParameterizedTest(name = "a={0}, b={1}")
    @CsvSource({"false, false", "false, true", "true, false", "true, true"})
    @DisplayName("Binary connectives follow their truth functions")
    void testBinaryConnectives(boolean va, boolean vb) {
        Assignment assignment = ab(va, vb);

        assertEquals(va && vb, evaluator.evaluate(new Binary(BinaryOperator.AND, a, b), assignment));
        assertEquals(va || vb, evaluator.evaluate(new Binary(BinaryOperator.OR, a, b), assignment));
        assertEquals(!va || vb, evaluator.evaluate(new Binary(BinaryOperator.IMPLIES, a, b), assignment));
        assertEquals(va == vb, evaluator.evaluate(new Binary(BinaryOperator.IFF, a, b), assignment));
    }

    @Test
    @DisplayName("Iff equals the conjunction of both implications")
    void testIffIsMutualImplication() {
        Expression iff = new Binary(BinaryOperator.IFF, a, b);
        Expression both = new Binary(BinaryOperator.AND,
                new Binary(BinaryOperator.IMPLIES, a, b),
                new Binary(BinaryOperator.IMPLIES, b, a));

        for (boolean va : new boolean[]{false, true}) {
            for (boolean vb : new boolean[]{false, true}) {
                assertEquals(evaluator.evaluate(both, ab(va, vb)), evaluator.evaluate(iff, ab(va, vb)));
            }
        }
    }

    @Test
    @DisplayName("Unassigned variables are reported even when a sibling decides the result")
    void testMissingVariable() {
        Expression formula = new Binary(BinaryOperator.AND, Constant.FALSE, b);
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> evaluator.evaluate(formula, Assignment.of(Map.of('a', true))));
        assertTrue(exception.getMessage().contains("'b'"));
    }

    @Test
    @DisplayName("Null arguments are rejected")
    void testNullArguments() {
        assertThrows(NullPointerException.class, () -> evaluator.evaluate(null, Assignment.empty()));
        assertThrows(NullPointerException.class, () -> evaluator.evaluate(a, null));
    }
}
