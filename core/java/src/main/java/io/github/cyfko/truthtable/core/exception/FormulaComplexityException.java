package io.github.cyfko.truthtable.core.exception;

import io.github.cyfko.truthtable.core.config.FormulaPolicy;

/**
 * Exception thrown when a formula exceeds the limits of the active {@link FormulaPolicy}:
 * its length (checked before parsing), a nesting deeper than the parser can descend, or its
 * number of distinct variables (checked before a truth table of {@code 2^n} rows is enumerated).
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public class FormulaComplexityException extends TruthTableException {

    public FormulaComplexityException(String message) {
        super(message);
    }

    public FormulaComplexityException(String message, Throwable cause) {
        super(message, cause);
    }
}
