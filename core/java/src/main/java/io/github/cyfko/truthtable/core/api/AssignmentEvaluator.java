package io.github.cyfko.truthtable.core.api;

/**
 * Computes the truth value of a formula under a total assignment.
 * <p>
 * Implementations must be pure: the same tree and assignment always give the same result, and
 * neither argument is modified. Two implementations ship with the core module:
 * </p>
 * <ul>
 *   <li>{@link io.github.cyfko.truthtable.core.impl.DirectEvaluator} - recursive evaluation of the tree</li>
 *   <li>{@link io.github.cyfko.truthtable.core.spi.OracleBackedEvaluator} - delegates to a
 *       {@link io.github.cyfko.truthtable.core.spi.DecisionOracle}</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
@FunctionalInterface
public interface AssignmentEvaluator {

    /**
     * Evaluates {@code expression} under {@code assignment}.
     *
     * @param expression the tree to evaluate
     * @param assignment values for every variable referenced by {@code expression}
     * @return the formula's value
     * @throws IllegalArgumentException if a referenced variable is missing from {@code assignment}
     * @throws NullPointerException if either argument is null
     */
    boolean evaluate(Expression expression, Assignment assignment);
}
