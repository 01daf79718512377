package io.github.cyfko.truthtable.core.parsing;

import io.github.cyfko.truthtable.core.api.BinaryOperator;
import io.github.cyfko.truthtable.core.api.Expression;

/**
 * The rules of the formula grammar, declared in the order they are tried on every span.
 * <p>
 * The grammar is ambiguous and has no precedence table. A span is resolved by the first rule
 * in this order that succeeds on it; binary rules additionally pick the rightmost operator
 * occurrence whose two sides both parse. As a consequence {@code <->} binds loosest and
 * {@code &} tightest, and chains of one connective group to the left:
 * {@code a->b->c} parses as {@code ((a -> b) -> c)}.
 * </p>
 * <p>
 * Changing the declaration order, or the direction of the split search, changes which tree a
 * formula produces.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public enum GrammarRule {

    /** {@code '(' Expr ')'}. A failing interior makes this rule fail; later rules still run. */
    PARENTHESIZED {
        @Override
        ParseResult apply(ParseSession session, int from, int to) {
            if (session.charAt(from) == '(' && session.charAt(to) == ')') {
                return session.parse(from + 1, to - 1);
            }
            return ParseResult.failure(from, to);
        }
    },

    /** A single lowercase letter, {@code T} or {@code F}. */
    TERMINAL {
        @Override
        ParseResult apply(ParseSession session, int from, int to) {
            if (from != to) {
                return ParseResult.failure(from, to);
            }
            char c = session.charAt(from);
            if (c >= 'a' && c <= 'z') {
                return ParseResult.success(session.literal(c));
            }
            if (c == 'T') {
                return ParseResult.success(Expression.Constant.TRUE);
            }
            if (c == 'F') {
                return ParseResult.success(Expression.Constant.FALSE);
            }
            return ParseResult.failure(from, to);
        }
    },

    IFF {
        @Override
        ParseResult apply(ParseSession session, int from, int to) {
            return splitAtOperator(session, BinaryOperator.IFF, from, to);
        }
    },

    IMPLIES {
        @Override
        ParseResult apply(ParseSession session, int from, int to) {
            return splitAtOperator(session, BinaryOperator.IMPLIES, from, to);
        }
    },

    DISJUNCTION {
        @Override
        ParseResult apply(ParseSession session, int from, int to) {
            return splitAtOperator(session, BinaryOperator.OR, from, to);
        }
    },

    CONJUNCTION {
        @Override
        ParseResult apply(ParseSession session, int from, int to) {
            return splitAtOperator(session, BinaryOperator.AND, from, to);
        }
    },

    /** {@code '~' Expr}. */
    NEGATION {
        @Override
        ParseResult apply(ParseSession session, int from, int to) {
            if (session.charAt(from) != '~') {
                return ParseResult.failure(from, to);
            }
            ParseResult operand = session.parse(from + 1, to);
            return operand.isSuccess()
                    ? ParseResult.success(new Expression.Negation(operand.expression()))
                    : operand;
        }
    };

    /**
     * Attempts this rule on the non-empty span {@code [from, to]}.
     *
     * @param session the parse session owning the formula text and its variables
     * @param from    first index of the span (inclusive)
     * @param to      last index of the span (inclusive), {@code to >= from}
     * @return the rule's outcome on the span
     */
    abstract ParseResult apply(ParseSession session, int from, int to);

    /**
     * Searches {@code [from, to]} for {@code operator}'s token from right to left and splits at
     * the first occurrence whose left part {@code [from, i - 1]} and right part
     * {@code [i + len, to]} both parse.
     */
    private static ParseResult splitAtOperator(ParseSession session, BinaryOperator operator, int from, int to) {
        String token = operator.token();
        int length = token.length();

        int i = session.lastIndexOf(token, from, to);
        while (i >= 0) {
            ParseResult left = session.parse(from, i - 1);
            if (left.isSuccess()) {
                ParseResult right = session.parse(i + length, to);
                if (right.isSuccess()) {
                    return ParseResult.success(new Expression.Binary(operator, left.expression(), right.expression()));
                }
            }
            i = session.lastIndexOf(token, from, i - 1);
        }
        return ParseResult.failure(from, to);
    }
}
