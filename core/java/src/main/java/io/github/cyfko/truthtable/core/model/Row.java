package io.github.cyfko.truthtable.core.model;

import io.github.cyfko.truthtable.core.api.Assignment;

import java.util.Objects;

/**
 * One line of a truth table.
 *
 * @param index      position of the row, equal to the assignment read as a binary number
 * @param assignment values of the formula's variables in this row
 * @param result     the formula's value under {@code assignment}
 * @author Frank KOSSI
 * @since 1.0
 */
public record Row(long index, Assignment assignment, boolean result) {

    public Row {
        if (index < 0) {
            throw new IllegalArgumentException("Row index must be non-negative, got: " + index);
        }
        Objects.requireNonNull(assignment, "assignment");
    }
}
