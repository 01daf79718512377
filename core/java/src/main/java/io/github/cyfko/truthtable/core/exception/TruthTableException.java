package io.github.cyfko.truthtable.core.exception;

/**
 * Base class of the exceptions raised while parsing or tabulating a formula.
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public class TruthTableException extends RuntimeException {

    public TruthTableException(String message) {
        super(message);
    }

    public TruthTableException(String message, Throwable cause) {
        super(message, cause);
    }
}
