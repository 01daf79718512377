package io.github.cyfko.truthtable.core.api;

import io.github.cyfko.truthtable.core.registry.Variable;

import java.util.*;

/**
 * Immutable mapping from variable names to truth values.
 * <p>
 * Assignments handed to an {@link AssignmentEvaluator} are total: they cover every variable
 * the evaluated tree references. Entries iterate in alphabetical order of variable name.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class Assignment {

    private static final Assignment EMPTY = new Assignment(new TreeMap<>());

    private final SortedMap<Character, Boolean> values;

    private Assignment(SortedMap<Character, Boolean> values) {
        this.values = Collections.unmodifiableSortedMap(values);
    }

    /**
     * @return the assignment binding no variable
     */
    public static Assignment empty() {
        return EMPTY;
    }

    /**
     * Creates an assignment from explicit bindings.
     *
     * @param values variable name to truth value; must not contain null keys or values
     * @return an immutable copy of {@code values}
     */
    public static Assignment of(Map<Character, Boolean> values) {
        Objects.requireNonNull(values, "values");
        SortedMap<Character, Boolean> copy = new TreeMap<>();
        values.forEach((name, value) -> copy.put(
                Objects.requireNonNull(name, "variable name"),
                Objects.requireNonNull(value, "value of " + name)));
        return new Assignment(copy);
    }

    /**
     * Decodes row {@code index} of a truth table over {@code variables}.
     * <p>
     * The index is read as an unsigned binary number of {@code variables.size()} bits, most
     * significant bit first: bit {@code (n - 1 - v)} gives the value of {@code variables.get(v)}.
     * </p>
     *
     * @param variables the variables in column order
     * @param index     row index in {@code [0, 2^n)}
     * @return the assignment of that row
     * @throws IllegalArgumentException if {@code index} is out of range
     */
    public static Assignment fromRowIndex(List<Variable> variables, long index) {
        int n = variables.size();
        if (n > 62 || index < 0 || index >= (1L << n)) {
            throw new IllegalArgumentException(String.format(
                    "Row index %d out of range for %d variable(s)", index, n));
        }
        SortedMap<Character, Boolean> bits = new TreeMap<>();
        for (int v = 0; v < n; v++) {
            long bit = 1L << (n - 1 - v);
            bits.put(variables.get(v).name(), (index & bit) == bit);
        }
        return new Assignment(bits);
    }

    /**
     * Returns a copy of this assignment with {@code name} bound to {@code value}.
     */
    public Assignment with(char name, boolean value) {
        SortedMap<Character, Boolean> copy = new TreeMap<>(values);
        copy.put(name, value);
        return new Assignment(copy);
    }

    /**
     * @param name a variable name
     * @return the value bound to {@code name}
     * @throws IllegalArgumentException if {@code name} is not bound
     */
    public boolean valueOf(char name) {
        Boolean value = values.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Variable '" + name + "' is not assigned in " + this);
        }
        return value;
    }

    public boolean isAssigned(char name) {
        return values.containsKey(name);
    }

    /**
     * @return bound names in alphabetical order
     */
    public Set<Character> names() {
        return values.keySet();
    }

    /**
     * @return the bindings in alphabetical order of name
     */
    public SortedMap<Character, Boolean> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Assignment other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Assignment" + values;
    }
}
