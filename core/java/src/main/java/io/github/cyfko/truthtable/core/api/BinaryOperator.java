package io.github.cyfko.truthtable.core.api;

/**
 * Binary connectives of the formula language.
 * <p>
 * Constants are declared in the order the parser tries them for a span: {@link #IFF} first,
 * {@link #AND} last. The declaration order is part of the parsing contract; do not reorder.
 * </p>
 *
 * <table border="1">
 * <caption>Connective Reference</caption>
 * <thead>
 * <tr><th>Connective</th><th>Token</th><th>Truth function</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>IFF</td><td>&lt;-&gt;</td><td>a == b</td></tr>
 * <tr><td>IMPLIES</td><td>-&gt;</td><td>!a || b</td></tr>
 * <tr><td>OR</td><td>|</td><td>a || b</td></tr>
 * <tr><td>AND</td><td>&amp;</td><td>a &amp;&amp; b</td></tr>
 * </tbody>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public enum BinaryOperator {
    IFF("<->") {
        @Override
        public boolean apply(boolean left, boolean right) {
            return left == right;
        }
    },
    IMPLIES("->") {
        @Override
        public boolean apply(boolean left, boolean right) {
            return !left || right;
        }
    },
    OR("|") {
        @Override
        public boolean apply(boolean left, boolean right) {
            return left || right;
        }
    },
    AND("&") {
        @Override
        public boolean apply(boolean left, boolean right) {
            return left && right;
        }
    };

    private final String token;

    BinaryOperator(String token) {
        this.token = token;
    }

    /**
     * @return the textual token of this connective, as written in formulas
     */
    public String token() {
        return token;
    }

    /**
     * Applies the truth function of this connective.
     *
     * @param left  value of the left operand
     * @param right value of the right operand
     * @return the connective's value
     */
    public abstract boolean apply(boolean left, boolean right);
}
