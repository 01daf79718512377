package io.github.cyfko.truthtable.core.exception;

import io.github.cyfko.truthtable.core.api.FormulaParser;

/**
 * Exception thrown when a formula does not match the grammar.
 * <p>
 * Parsing either succeeds completely or fails with this exception; no partial tree is ever
 * returned. When the failure has an evident cause the message names it:
 * </p>
 * <pre>{@code
 * parser.parse("");      // → "Formula cannot be null or empty"
 * parser.parse("a $ b"); // → "Unknown character '$' at position 1"
 * parser.parse("(a");    // → "Mismatched parentheses: unmatched '(' at position 0"
 * parser.parse("a&");    // → "Not a valid expression: 'a&'"
 * }</pre>
 * <p>Positions refer to the formula with whitespace removed.</p>
 *
 * @see FormulaParser
 * @author Frank KOSSI
 * @since 1.0
 */
public class FormulaSyntaxException extends TruthTableException {

    private final String formula;
    private final int position;

    /**
     * @param message  description of the failure
     * @param formula  the formula as supplied by the caller
     * @param position offending position in the whitespace-free formula, or {@code -1} if unknown
     */
    public FormulaSyntaxException(String message, String formula, int position) {
        super(message);
        this.formula = formula;
        this.position = position;
    }

    public FormulaSyntaxException(String message, String formula) {
        this(message, formula, -1);
    }

    /**
     * @return the rejected formula
     */
    public String getFormula() {
        return formula;
    }

    /**
     * @return offending position in the whitespace-free formula, or {@code -1} when the parser
     *         cannot attribute the failure to one character
     */
    public int getPosition() {
        return position;
    }
}
