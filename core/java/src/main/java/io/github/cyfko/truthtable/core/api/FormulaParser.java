package io.github.cyfko.truthtable.core.api;

import io.github.cyfko.truthtable.core.exception.FormulaComplexityException;
import io.github.cyfko.truthtable.core.exception.FormulaSyntaxException;

/**
 * Parser transforming propositional formulas written in linear infix notation into
 * {@link Expression} trees.
 *
 * <h2>Grammar (after whitespace removal)</h2>
 * <pre>
 * Expr  := '(' Expr ')' | Var | Const
 *        | Expr '&lt;-&gt;' Expr | Expr '-&gt;' Expr | Expr '|' Expr | Expr '&amp;' Expr
 *        | '~' Expr
 * Var   := [a-z]
 * Const := 'T' | 'F'
 * </pre>
 * <p>
 * The grammar is ambiguous. Implementations define how a span is resolved; the default
 * implementation tries the alternatives above in the order written and, for binary
 * connectives, splits at the rightmost occurrence that yields two valid operands.
 * </p>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * FormulaParser parser = new SplitSearchFormulaParser();
 *
 * parser.parse("a & b");        // (a & b)
 * parser.parse("~a -> b");      // (~a -> b)
 * parser.parse("(a | b) <-> c");
 *
 * parser.parse("a &");          // FormulaSyntaxException
 * parser.parse("(a");           // FormulaSyntaxException
 * }</pre>
 *
 * <p>Every call starts a new session with its own variable registry; parsing the same text
 * twice yields equal trees.</p>
 *
 * @see ParsedFormula
 * @author Frank KOSSI
 * @since 1.0
 */
public interface FormulaParser {

    /**
     * Parses {@code formula} into an expression tree.
     *
     * @param formula the formula text; whitespace anywhere in it is ignored
     * @return the tree and the variables it references
     * @throws FormulaSyntaxException if the formula has no valid parse
     * @throws FormulaComplexityException if the formula exceeds the configured length limit
     * @throws NullPointerException if {@code formula} is null
     */
    ParsedFormula parse(String formula) throws FormulaSyntaxException;
}
