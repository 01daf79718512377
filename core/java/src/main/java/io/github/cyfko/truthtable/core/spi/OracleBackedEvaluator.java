package io.github.cyfko.truthtable.core.spi;

import io.github.cyfko.truthtable.core.api.Assignment;
import io.github.cyfko.truthtable.core.api.AssignmentEvaluator;
import io.github.cyfko.truthtable.core.api.Expression;
import io.github.cyfko.truthtable.core.utils.ExpressionUtils;

import java.util.Objects;

/**
 * {@link AssignmentEvaluator} delegating to a {@link DecisionOracle}.
 * <p>
 * The assignment is handed to the oracle as pinned values; because it is total the oracle has
 * nothing left to choose, and its verdict is the formula's value. Results are identical to those
 * of {@link io.github.cyfko.truthtable.core.impl.DirectEvaluator}; the adapter exists so a
 * truth table can be cross-checked against an external backend.
 * </p>
 *
 * <pre>{@code
 * TruthTableEnumerator enumerator =
 *         new TruthTableEnumerator(new OracleBackedEvaluator(new ExhaustiveDecisionOracle()));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class OracleBackedEvaluator implements AssignmentEvaluator {

    private final DecisionOracle oracle;

    public OracleBackedEvaluator(DecisionOracle oracle) {
        this.oracle = Objects.requireNonNull(oracle, "oracle");
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException if {@code assignment} does not bind every variable of
     *                                  {@code expression}; a partial assignment would turn the
     *                                  question into satisfiability
     */
    @Override
    public boolean evaluate(Expression expression, Assignment assignment) {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(assignment, "assignment");

        for (char name : ExpressionUtils.variablesOf(expression)) {
            if (!assignment.isAssigned(name)) {
                throw new IllegalArgumentException("Variable '" + name + "' is not assigned in " + assignment);
            }
        }
        return oracle.isSatisfiable(expression, assignment);
    }

    public DecisionOracle getOracle() {
        return oracle;
    }
}
