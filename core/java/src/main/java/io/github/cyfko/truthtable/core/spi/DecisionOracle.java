package io.github.cyfko.truthtable.core.spi;

import io.github.cyfko.truthtable.core.api.Assignment;
import io.github.cyfko.truthtable.core.api.Expression;

/**
 * Service Provider Interface for satisfiability backends.
 * <p>
 * An oracle decides whether a formula can be made true while the variables of {@code pinned}
 * keep their assigned values. Variables of the formula missing from {@code pinned} are free.
 * When {@code pinned} covers every variable, the answer is simply the formula's value under it,
 * which is how {@link OracleBackedEvaluator} turns an oracle into an
 * {@link io.github.cyfko.truthtable.core.api.AssignmentEvaluator}.
 * </p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * DecisionOracle oracle = new ExhaustiveDecisionOracle();
 * Expression formula = parser.parse("a & ~b").root();
 *
 * oracle.isSatisfiable(formula, Assignment.empty());                        // true
 * oracle.isSatisfiable(formula, Assignment.of(Map.of('b', true)));          // false
 * }</pre>
 *
 * <p>Implementations must be deterministic and must not modify their arguments.</p>
 *
 * @see ExhaustiveDecisionOracle
 * @see OracleBackedEvaluator
 * @author Frank KOSSI
 * @since 1.0
 */
public interface DecisionOracle {

    /**
     * @param formula the formula to satisfy
     * @param pinned  values that must be respected; may bind variables absent from the formula
     * @return {@code true} if some completion of {@code pinned} makes {@code formula} true
     */
    boolean isSatisfiable(Expression formula, Assignment pinned);
}
