package io.github.cyfko.truthtable.core;

import io.github.cyfko.truthtable.core.api.AssignmentEvaluator;
import io.github.cyfko.truthtable.core.api.FormulaParser;
import io.github.cyfko.truthtable.core.api.ParsedFormula;
import io.github.cyfko.truthtable.core.config.FormulaPolicy;
import io.github.cyfko.truthtable.core.exception.FormulaComplexityException;
import io.github.cyfko.truthtable.core.exception.FormulaSyntaxException;
import io.github.cyfko.truthtable.core.impl.DirectEvaluator;
import io.github.cyfko.truthtable.core.impl.SplitSearchFormulaParser;
import io.github.cyfko.truthtable.core.model.TruthTable;

import java.util.Objects;

/**
 * Entry point combining a {@link FormulaParser} and a {@link TruthTableEnumerator}.
 * <p>
 * Each call to {@link #tabulate(String)} is an independent session: the formula is parsed with
 * a fresh variable registry, so tabulating unrelated formulas one after the other never mixes
 * their variables.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * TruthTable table = TruthTables.defaults().tabulate("(a | b) & ~c");
 *
 * TruthTables strict = TruthTables.create(FormulaPolicy.strict());
 * TruthTables crossChecked = TruthTables.create(FormulaPolicy.defaults(),
 *         new OracleBackedEvaluator(new ExhaustiveDecisionOracle()));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class TruthTables {

    private final FormulaParser parser;
    private final TruthTableEnumerator enumerator;

    private TruthTables(FormulaParser parser, TruthTableEnumerator enumerator) {
        this.parser = parser;
        this.enumerator = enumerator;
    }

    /**
     * @return an instance applying {@link FormulaPolicy#defaults()} and direct evaluation
     */
    public static TruthTables defaults() {
        return create(FormulaPolicy.defaults());
    }

    public static TruthTables create(FormulaPolicy policy) {
        return create(policy, new DirectEvaluator());
    }

    /**
     * @param policy    limits applied to both parsing and enumeration
     * @param evaluator evaluator computing each row
     * @return a configured instance
     */
    public static TruthTables create(FormulaPolicy policy, AssignmentEvaluator evaluator) {
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(evaluator, "evaluator");
        return new TruthTables(new SplitSearchFormulaParser(policy), new TruthTableEnumerator(evaluator, policy));
    }

    /**
     * Parses {@code formula} in a new session.
     *
     * @throws FormulaSyntaxException if the formula has no valid parse
     * @throws FormulaComplexityException if the formula is longer than the policy allows
     */
    public ParsedFormula parse(String formula) {
        return parser.parse(formula);
    }

    /**
     * Parses {@code formula} in a new session and tabulates it.
     *
     * @param formula the formula text
     * @return its complete truth table
     * @throws FormulaSyntaxException if the formula has no valid parse; no row is produced
     * @throws FormulaComplexityException if the formula exceeds a limit of the policy
     */
    public TruthTable tabulate(String formula) {
        return enumerator.tabulate(parser.parse(formula));
    }

    public TruthTableEnumerator getEnumerator() {
        return enumerator;
    }
}
