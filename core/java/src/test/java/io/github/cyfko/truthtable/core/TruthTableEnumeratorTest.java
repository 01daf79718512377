package io.github.cyfko.truthtable.core;

import io.github.cyfko.truthtable.core.api.Assignment;
import io.github.cyfko.truthtable.core.api.AssignmentEvaluator;
import io.github.cyfko.truthtable.core.api.ParsedFormula;
import io.github.cyfko.truthtable.core.config.FormulaPolicy;
import io.github.cyfko.truthtable.core.exception.FormulaComplexityException;
import io.github.cyfko.truthtable.core.impl.DirectEvaluator;
import io.github.cyfko.truthtable.core.impl.SplitSearchFormulaParser;
import io.github.cyfko.truthtable.core.model.Row;
import io.github.cyfko.truthtable.core.model.TruthTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link TruthTableEnumerator}: row order, row count, results of the connectives and
 * the variable limit.
 */
@DisplayName("TruthTableEnumerator Tests")
class TruthTableEnumeratorTest {

    private SplitSearchFormulaParser parser;
    private TruthTableEnumerator enumerator;

    @Mock
    private AssignmentEvaluator mockEvaluator;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        parser = new SplitSearchFormulaParser();
        enumerator = new TruthTableEnumerator();
    }

    /** Results column of the table of {@code formula}, as a string of T/F. */
    private String results(String formula) {
        return enumerator.tabulate(parser.parse(formula)).rows().stream()
                .map(row -> row.result() ? "T" : "F")
                .collect(Collectors.joining());
    }

    @Nested
    @DisplayName("Connectives over a and b (rows FF, FT, TF, TT)")
    class Connectives {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "a&b,   FFFT",
            "a|b,   FTTT",
            "a->b,  TTFT",
            "a<->b, TFFT",
            "b->a,  TFTT",
            "~a,    TF",
            "~a|b,  TTFT"
        })
        @DisplayName("Result column matches the truth function")
        void testResultColumn(String formula, String expected) {
            assertEquals(expected, results(formula));
        }

        @Test
        @DisplayName("Chained implication groups to the left")
        void testChainedImplication() {
            // ((a -> b) -> c) over rows FFF..TTT
            assertEquals("FTFTTTFT", results("a->b->c"));
        }
    }

    @Nested
    @DisplayName("Row order")
    class RowOrder {

        @Test
        @DisplayName("Assignments count up in binary, first variable most significant")
        void testBinaryOrder() {
            TruthTable table = enumerator.tabulate(parser.parse("b & a"));

            List<Row> rows = table.rows();
            assertEquals(4, rows.size());
            assertEquals(Assignment.of(Map.of('a', false, 'b', false)), rows.get(0).assignment());
            assertEquals(Assignment.of(Map.of('a', false, 'b', true)), rows.get(1).assignment());
            assertEquals(Assignment.of(Map.of('a', true, 'b', false)), rows.get(2).assignment());
            assertEquals(Assignment.of(Map.of('a', true, 'b', true)), rows.get(3).assignment());
            for (int i = 0; i < rows.size(); i++) {
                assertEquals(i, rows.get(i).index());
            }
        }

        @ParameterizedTest
        @ValueSource(strings = {"a", "a & b", "(p | q) -> r", "a<->b<->c<->d", "~(a & b & c & d & e)"})
        @DisplayName("n variables give 2^n distinct rows")
        void testRowCount(String formula) {
            ParsedFormula parsed = parser.parse(formula);
            TruthTable table = enumerator.tabulate(parsed);

            int n = parsed.variables().size();
            assertEquals(1 << n, table.rows().size());

            Set<Assignment> distinct = new HashSet<>();
            table.rows().forEach(row -> distinct.add(row.assignment()));
            assertEquals(1 << n, distinct.size());
            table.rows().forEach(row -> assertEquals(n, row.assignment().size()));
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({"T&F, false", "T|F, true", "~F, true", "T->F, false", "F<->F, true"})
        @DisplayName("Formulas without variables have a single row")
        void testConstantFormula(String formula, boolean expected) {
            TruthTable table = enumerator.tabulate(parser.parse(formula));

            assertTrue(table.variables().isEmpty());
            assertEquals(1, table.rows().size());
            assertEquals(Assignment.empty(), table.rows().get(0).assignment());
            assertEquals(expected, table.rows().get(0).result());
        }

        @Test
        @DisplayName("Streamed rows equal the tabulated rows")
        void testStreamMatchesTable() {
            ParsedFormula formula = parser.parse("(a -> b) & (b -> c)");
            assertEquals(enumerator.tabulate(formula).rows(), enumerator.rows(formula).collect(Collectors.toList()));
        }
    }

    @Nested
    @DisplayName("Evaluator delegation")
    class Delegation {

        @Test
        @DisplayName("Evaluator is called once per row with the parsed tree")
        void testEvaluatorCalledPerRow() {
            when(mockEvaluator.evaluate(any(), any())).thenReturn(true);
            ParsedFormula formula = parser.parse("a | b | c");

            TruthTable table = new TruthTableEnumerator(mockEvaluator).tabulate(formula);

            ArgumentCaptor<Assignment> captor = ArgumentCaptor.forClass(Assignment.class);
            verify(mockEvaluator, times(8)).evaluate(eq(formula.root()), captor.capture());
            assertEquals(table.rows().stream().map(Row::assignment).collect(Collectors.toList()), captor.getAllValues());
            assertTrue(table.isTautology());
        }

        @Test
        @DisplayName("Lazy rows do not evaluate before consumption")
        void testLazyRows() {
            when(mockEvaluator.evaluate(any(), any())).thenReturn(false);
            ParsedFormula formula = parser.parse("a & b & c & d");

            TruthTableEnumerator lazy = new TruthTableEnumerator(mockEvaluator);
            var stream = lazy.rows(formula);
            verifyNoInteractions(mockEvaluator);

            assertEquals(2, stream.limit(2).count());
        }
    }

    @Nested
    @DisplayName("Variable limit")
    class VariableLimit {

        @Test
        @DisplayName("Tables over more variables than the policy allows are refused")
        void testTooManyVariables() {
            TruthTableEnumerator strict = new TruthTableEnumerator(mockEvaluator, FormulaPolicy.strict());
            ParsedFormula formula = parser.parse("a&b&c&d&e&f&g&h&i&j&k");

            FormulaComplexityException exception = assertThrows(FormulaComplexityException.class,
                    () -> strict.tabulate(formula));
            assertTrue(exception.getMessage().contains("Too many variables (11, max: 10)"));
            assertThrows(FormulaComplexityException.class, () -> strict.rows(formula));
            verifyNoInteractions(mockEvaluator);
        }

        @Test
        @DisplayName("Tables at the limit are produced")
        void testAtLimit() {
            TruthTableEnumerator tight = new TruthTableEnumerator(
                    new DirectEvaluator(),
                    FormulaPolicy.builder().maxVariables(2).build());
            assertEquals(4, tight.tabulate(parser.parse("a|b")).rows().size());
        }
    }

    @Test
    @DisplayName("Table exposes formula text and variables")
    void testTableMetadata() {
        TruthTable table = enumerator.tabulate(parser.parse("q -> p"));
        assertEquals("q -> p", table.formula());
        assertEquals("[p, q]", table.variables().toString());
        assertFalse(table.isTautology());
        assertTrue(table.isSatisfiable());
        assertEquals(3, table.models().size());
    }

    @Test
    @DisplayName("Tautologies and contradictions are recognised")
    void testTautologyAndContradiction() {
        assertTrue(enumerator.tabulate(parser.parse("a | ~a")).isTautology());
        assertTrue(enumerator.tabulate(parser.parse("a & ~a")).isContradiction());
        assertTrue(enumerator.tabulate(parser.parse("(p -> q) & p -> q")).isTautology());
    }

    @Test
    @DisplayName("Constructor rejects null collaborators")
    void testNullCollaborators() {
        assertThrows(NullPointerException.class, () -> new TruthTableEnumerator(null));
        assertThrows(NullPointerException.class, () -> new TruthTableEnumerator(mockEvaluator, null));
        assertThrows(NullPointerException.class, () -> enumerator.tabulate(null));
    }
}
