package io.github.cyfko.truthtable.core.parsing;

import io.github.cyfko.truthtable.core.api.Expression;

/**
 * Outcome of applying the grammar to one span of a formula.
 * <p>
 * Either a success carrying the expression built for the span, or a failure carrying the span
 * that could not be parsed. Instances are immutable and created via {@link #success(Expression)}
 * and {@link #failure(int, int)}.
 * </p>
 *
 * <pre>{@code
 * ParseResult result = session.parse(0, text.length() - 1);
 * if (result.isSuccess()) {
 *     Expression tree = result.expression();
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class ParseResult {

    private final Expression expression;
    private final int from;
    private final int to;

    private ParseResult(Expression expression, int from, int to) {
        this.expression = expression;
        this.from = from;
        this.to = to;
    }

    /**
     * @param expression the expression parsed from the span
     * @return a successful result
     */
    public static ParseResult success(Expression expression) {
        if (expression == null) {
            throw new IllegalArgumentException("A successful parse requires an expression");
        }
        return new ParseResult(expression, -1, -1);
    }

    /**
     * @param from first index of the rejected span (inclusive)
     * @param to   last index of the rejected span (inclusive); {@code to < from} denotes the empty span
     * @return a failed result
     */
    public static ParseResult failure(int from, int to) {
        return new ParseResult(null, from, to);
    }

    public boolean isSuccess() {
        return expression != null;
    }

    /**
     * @return the parsed expression
     * @throws IllegalStateException if this result is a failure
     */
    public Expression expression() {
        if (expression == null) {
            throw new IllegalStateException("No expression: span [" + from + ", " + to + "] failed to parse");
        }
        return expression;
    }

    /**
     * @return first index of the rejected span, or {@code -1} for a success
     */
    public int from() {
        return from;
    }

    /**
     * @return last index of the rejected span, or {@code -1} for a success
     */
    public int to() {
        return to;
    }

    @Override
    public String toString() {
        return isSuccess() ? "ParseResult[success=" + expression.toInfix() + "]"
                : "ParseResult[failure=[" + from + ", " + to + "]]";
    }
}
