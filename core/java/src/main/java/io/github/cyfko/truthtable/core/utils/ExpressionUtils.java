package io.github.cyfko.truthtable.core.utils;

import io.github.cyfko.truthtable.core.api.Expression;

import java.util.*;

/**
 * Structural queries over expression trees.
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class ExpressionUtils {

    private ExpressionUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Collects the names of the variables referenced by {@code expression}.
     *
     * @param expression the tree to inspect
     * @return referenced variable names in alphabetical order
     */
    public static SortedSet<Character> variablesOf(Expression expression) {
        Objects.requireNonNull(expression, "expression");
        SortedSet<Character> names = new TreeSet<>();
        Deque<Expression> pending = new ArrayDeque<>();
        pending.push(expression);
        while (!pending.isEmpty()) {
            Expression node = pending.pop();
            if (node instanceof Expression.Literal literal) {
                names.add(literal.name());
            } else if (node instanceof Expression.Negation negation) {
                pending.push(negation.operand());
            } else if (node instanceof Expression.Binary binary) {
                pending.push(binary.right());
                pending.push(binary.left());
            }
        }
        return names;
    }

    /**
     * Counts the nodes of {@code expression}.
     */
    public static int size(Expression expression) {
        Objects.requireNonNull(expression, "expression");
        int count = 0;
        Deque<Expression> pending = new ArrayDeque<>();
        pending.push(expression);
        while (!pending.isEmpty()) {
            Expression node = pending.pop();
            count++;
            if (node instanceof Expression.Negation negation) {
                pending.push(negation.operand());
            } else if (node instanceof Expression.Binary binary) {
                pending.push(binary.right());
                pending.push(binary.left());
            }
        }
        return count;
    }
}
