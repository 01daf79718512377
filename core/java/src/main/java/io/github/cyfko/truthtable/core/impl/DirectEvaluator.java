package io.github.cyfko.truthtable.core.impl;

import io.github.cyfko.truthtable.core.api.Assignment;
import io.github.cyfko.truthtable.core.api.AssignmentEvaluator;
import io.github.cyfko.truthtable.core.api.Expression;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates an expression tree in postfix order over an explicit operand stack, so the depth of
 * the tree is not limited by the thread's stack.
 * <ul>
 *   <li>{@code Literal}: the assigned value of the variable</li>
 *   <li>{@code Constant}: its value</li>
 *   <li>{@code Negation}: the complement of the operand</li>
 *   <li>{@code Binary}: the connective's truth function over both operands</li>
 * </ul>
 * Both operands of a binary node are always evaluated, so a missing variable is reported
 * regardless of the values of its siblings.
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class DirectEvaluator implements AssignmentEvaluator {

    @Override
    public boolean evaluate(Expression expression, Assignment assignment) {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(assignment, "assignment");

        Deque<Boolean> stack = new ArrayDeque<>();
        for (Expression node : postfix(expression)) {
            if (node instanceof Expression.Literal literal) {
                stack.push(assignment.valueOf(literal.name()));
            } else if (node instanceof Expression.Constant constant) {
                stack.push(constant.value());
            } else if (node instanceof Expression.Negation) {
                stack.push(!stack.pop());
            } else {
                Expression.Binary binary = (Expression.Binary) node;
                boolean right = stack.pop();
                boolean left = stack.pop();
                stack.push(binary.operator().apply(left, right));
            }
        }
        return stack.pop();
    }

    /**
     * Nodes of {@code root} in postfix order, left operands first.
     */
    private static List<Expression> postfix(Expression root) {
        List<Expression> reversed = new ArrayList<>();
        Deque<Expression> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Expression node = pending.pop();
            reversed.add(node);
            if (node instanceof Expression.Negation negation) {
                pending.push(negation.operand());
            } else if (node instanceof Expression.Binary binary) {
                pending.push(binary.left());
                pending.push(binary.right());
            }
        }
        Collections.reverse(reversed);
        return reversed;
    }
}
