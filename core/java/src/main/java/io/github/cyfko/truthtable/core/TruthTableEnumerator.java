package io.github.cyfko.truthtable.core;

import io.github.cyfko.truthtable.core.api.Assignment;
import io.github.cyfko.truthtable.core.api.AssignmentEvaluator;
import io.github.cyfko.truthtable.core.api.Expression;
import io.github.cyfko.truthtable.core.api.ParsedFormula;
import io.github.cyfko.truthtable.core.config.FormulaPolicy;
import io.github.cyfko.truthtable.core.exception.FormulaComplexityException;
import io.github.cyfko.truthtable.core.impl.DirectEvaluator;
import io.github.cyfko.truthtable.core.model.Row;
import io.github.cyfko.truthtable.core.model.TruthTable;
import io.github.cyfko.truthtable.core.registry.Variable;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.LongStream;
import java.util.stream.Stream;

/**
 * Evaluates a parsed formula under every assignment of its variables.
 * <p>
 * For {@code n} variables (sorted alphabetically), row {@code i} for {@code i} in
 * {@code [0, 2^n)} assigns variable {@code v} the bit {@code (n - 1 - v)} of {@code i}. Rows are
 * produced in increasing {@code i}: for variables {@code a, b} the order is FF, FT, TF, TT.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ParsedFormula formula = new SplitSearchFormulaParser().parse("a -> b");
 * TruthTable table = new TruthTableEnumerator().tabulate(formula);
 *
 * table.rows().size();   // 4
 * table.isTautology();   // false
 *
 * // Lazily, without materializing the table
 * long models = new TruthTableEnumerator().rows(formula).filter(Row::result).count();
 * }</pre>
 *
 * <p>The variable limit of the {@link FormulaPolicy} is checked before the first row is built.</p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public class TruthTableEnumerator {

    private static final Logger log = Logger.getLogger(TruthTableEnumerator.class.getName());

    private final AssignmentEvaluator evaluator;
    private final FormulaPolicy policy;

    /**
     * Enumerator using {@link DirectEvaluator} and {@link FormulaPolicy#defaults()}.
     */
    public TruthTableEnumerator() {
        this(new DirectEvaluator(), FormulaPolicy.defaults());
    }

    public TruthTableEnumerator(AssignmentEvaluator evaluator) {
        this(evaluator, FormulaPolicy.defaults());
    }

    /**
     * @param evaluator evaluator computing each row's result
     * @param policy    limits to enforce
     */
    public TruthTableEnumerator(AssignmentEvaluator evaluator, FormulaPolicy policy) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * Builds the complete truth table of {@code formula}.
     *
     * @param formula a parsed formula and its variables
     * @return the table with exactly {@code 2^n} rows
     * @throws FormulaComplexityException if the formula has more variables than the policy allows
     */
    public TruthTable tabulate(ParsedFormula formula) {
        List<Variable> variables = checkedVariables(formula);
        long start = System.nanoTime();
        List<Row> rows = rows(formula.root(), formula.source(), variables).collect(Collectors.toList());

        log.fine(() -> String.format("Tabulated '%s': %d variable(s), %d row(s) in %d µs",
                formula.source(), variables.size(), rows.size(), (System.nanoTime() - start) / 1_000));

        return new TruthTable(formula.source(), variables, rows);
    }

    /**
     * Streams the rows of the truth table of {@code formula} in order, building each assignment
     * only when the row is consumed.
     *
     * @param formula a parsed formula and its variables
     * @return an ordered, sequential stream of {@code 2^n} rows
     * @throws FormulaComplexityException if the formula has more variables than the policy allows
     */
    public Stream<Row> rows(ParsedFormula formula) {
        return rows(formula.root(), formula.source(), checkedVariables(formula));
    }

    private Stream<Row> rows(Expression root, String source, List<Variable> variables) {
        long rowCount = 1L << variables.size();
        log.finer(() -> String.format("Enumerating %d assignment(s) of %s for '%s'", rowCount, variables, source));

        return LongStream.range(0, rowCount).mapToObj(i -> {
            Assignment assignment = Assignment.fromRowIndex(variables, i);
            return new Row(i, assignment, evaluator.evaluate(root, assignment));
        });
    }

    private List<Variable> checkedVariables(ParsedFormula formula) {
        Objects.requireNonNull(formula, "formula");
        List<Variable> variables = formula.variables();
        if (variables.size() > policy.maxVariables()) {
            throw new FormulaComplexityException(String.format(
                    "Too many variables (%d, max: %d) to tabulate '%s'. Policy applied: %s",
                    variables.size(), policy.maxVariables(), formula.source(), policy.policyName()));
        }
        return variables;
    }
}
