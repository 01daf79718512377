package io.github.cyfko.truthtable.core.model;

import io.github.cyfko.truthtable.core.registry.Variable;

import java.util.List;
import java.util.Objects;

/**
 * Complete truth table of a formula: one {@link Row} per assignment of its variables, ordered
 * from all-false to all-true with the first variable (alphabetically) as the most significant bit.
 * <p>
 * A formula without variables has exactly one row, holding the empty assignment.
 * </p>
 *
 * @param formula   the formula text as supplied by the caller
 * @param variables the column variables in alphabetical order
 * @param rows      {@code 2^n} rows for {@code n} variables
 * @author Frank KOSSI
 * @since 1.0
 */
public record TruthTable(String formula, List<Variable> variables, List<Row> rows) {

    public TruthTable {
        Objects.requireNonNull(formula, "formula");
        variables = List.copyOf(variables);
        rows = List.copyOf(rows);
    }

    /**
     * @return {@code true} if the formula is true in every row
     */
    public boolean isTautology() {
        return rows.stream().allMatch(Row::result);
    }

    /**
     * @return {@code true} if the formula is true in at least one row
     */
    public boolean isSatisfiable() {
        return rows.stream().anyMatch(Row::result);
    }

    /**
     * @return {@code true} if the formula is false in every row
     */
    public boolean isContradiction() {
        return !isSatisfiable();
    }

    /**
     * @return rows in which the formula is true
     */
    public List<Row> models() {
        return rows.stream().filter(Row::result).toList();
    }
}
