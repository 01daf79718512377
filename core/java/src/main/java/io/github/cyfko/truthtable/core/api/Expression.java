package io.github.cyfko.truthtable.core.api;

import java.util.Objects;

/**
 * Abstract syntax tree of a propositional formula.
 * <p>
 * Every node is an immutable record; children are always valid nodes, so a tree can be shared
 * freely once built. Two trees are structurally identical exactly when they are {@code equals}.
 * </p>
 *
 * <h2>Variants</h2>
 * <ul>
 *   <li>{@link Literal} - reference to a free variable (a single lowercase letter)</li>
 *   <li>{@link Constant} - the fixed values {@code T} and {@code F}</li>
 *   <li>{@link Negation} - {@code ~operand}</li>
 *   <li>{@link Binary} - {@code left <op> right} for every {@link BinaryOperator}</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Expression tree = new Expression.Binary(BinaryOperator.IMPLIES,
 *         new Expression.Literal('a'),
 *         new Expression.Negation(new Expression.Literal('b')));
 *
 * tree.toInfix(); // "(a -> ~b)"
 * }</pre>
 *
 * @see FormulaParser
 * @see AssignmentEvaluator
 * @author Frank KOSSI
 * @since 1.0
 */
public sealed interface Expression
        permits Expression.Literal, Expression.Constant, Expression.Negation, Expression.Binary {

    /**
     * Renders this tree in fully parenthesized infix form. Binary nodes are wrapped in
     * parentheses, so the grouping chosen by the parser is visible in the output.
     *
     * @return canonical infix rendering of this tree
     */
    String toInfix();

    record Literal(char name) implements Expression {
        public Literal {
            if (name < 'a' || name > 'z') {
                throw new IllegalArgumentException("Variable name must be a lowercase letter, got: '" + name + "'");
            }
        }

        @Override
        public String toInfix() {
            return String.valueOf(name);
        }
    }

    record Constant(boolean value) implements Expression {
        public static final Constant TRUE = new Constant(true);
        public static final Constant FALSE = new Constant(false);

        public static Constant of(boolean value) {
            return value ? TRUE : FALSE;
        }

        @Override
        public String toInfix() {
            return value ? "T" : "F";
        }
    }

    record Negation(Expression operand) implements Expression {
        public Negation {
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public String toInfix() {
            return "~" + operand.toInfix();
        }
    }

    record Binary(BinaryOperator operator, Expression left, Expression right) implements Expression {
        public Binary {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public String toInfix() {
            return "(" + left.toInfix() + " " + operator.token() + " " + right.toInfix() + ")";
        }
    }
}
