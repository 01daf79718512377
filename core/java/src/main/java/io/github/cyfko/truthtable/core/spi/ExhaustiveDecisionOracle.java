package io.github.cyfko.truthtable.core.spi;

import io.github.cyfko.truthtable.core.api.Assignment;
import io.github.cyfko.truthtable.core.api.AssignmentEvaluator;
import io.github.cyfko.truthtable.core.api.Expression;
import io.github.cyfko.truthtable.core.impl.DirectEvaluator;
import io.github.cyfko.truthtable.core.utils.ExpressionUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Decides satisfiability by trying every completion of the pinned assignment.
 * <p>
 * Cost is {@code 2^k} evaluations for {@code k} free variables; with a total assignment it
 * performs exactly one.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class ExhaustiveDecisionOracle implements DecisionOracle {

    private static final Logger log = Logger.getLogger(ExhaustiveDecisionOracle.class.getName());

    private final AssignmentEvaluator evaluator;

    public ExhaustiveDecisionOracle() {
        this(new DirectEvaluator());
    }

    /**
     * @param evaluator evaluator applied to each completed assignment
     */
    public ExhaustiveDecisionOracle(AssignmentEvaluator evaluator) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    }

    @Override
    public boolean isSatisfiable(Expression formula, Assignment pinned) {
        Objects.requireNonNull(formula, "formula");
        Objects.requireNonNull(pinned, "pinned");

        List<Character> free = new ArrayList<>();
        for (char name : ExpressionUtils.variablesOf(formula)) {
            if (!pinned.isAssigned(name)) {
                free.add(name);
            }
        }

        log.finest(() -> String.format("Deciding %s with %d free variable(s) %s",
                formula.toInfix(), free.size(), free));

        long completions = 1L << free.size();
        for (long i = 0; i < completions; i++) {
            Assignment candidate = pinned;
            for (int v = 0; v < free.size(); v++) {
                candidate = candidate.with(free.get(v), ((i >> v) & 1L) == 1L);
            }
            if (evaluator.evaluate(formula, candidate)) {
                return true;
            }
        }
        return false;
    }
}
