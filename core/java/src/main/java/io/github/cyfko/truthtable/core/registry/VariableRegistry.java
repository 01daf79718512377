package io.github.cyfko.truthtable.core.registry;

import java.util.*;

/**
 * Interns the variables of a single formula.
 * <p>
 * A registry belongs to exactly one parse session: the parser creates a fresh instance per
 * formula and hands it out through the parse result, so variables of unrelated formulas never
 * leak into each other's truth tables.
 * </p>
 *
 * <ul>
 *   <li>{@link #intern(char)} returns the existing handle or creates one (first-seen order)</li>
 *   <li>{@link #all()} lists handles alphabetically, the column order of a truth table</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> not thread-safe. A session is single-threaded; once
 * parsing completes the registry is only read.</p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class VariableRegistry {

    private final Map<Character, Variable> variables = new HashMap<>();

    /**
     * Returns the handle for {@code name}, creating it if this is the first occurrence.
     *
     * @param name a lowercase letter
     * @return the unique handle for {@code name}
     * @throws IllegalArgumentException if {@code name} is not a lowercase letter
     */
    public Variable intern(char name) {
        if (name < 'a' || name > 'z') {
            throw new IllegalArgumentException("Variable name must be a lowercase letter, got: '" + name + "'");
        }
        return variables.computeIfAbsent(name, key -> new Variable(key, variables.size()));
    }

    /**
     * Looks up a previously interned variable.
     *
     * @param name the variable name
     * @return the handle, or empty if {@code name} was never interned
     */
    public Optional<Variable> lookup(char name) {
        return Optional.ofNullable(variables.get(name));
    }

    /**
     * @return every interned variable, sorted alphabetically by name
     */
    public List<Variable> all() {
        List<Variable> sorted = new ArrayList<>(variables.values());
        Collections.sort(sorted);
        return Collections.unmodifiableList(sorted);
    }

    public int size() {
        return variables.size();
    }

    public boolean isEmpty() {
        return variables.isEmpty();
    }

    @Override
    public String toString() {
        return "VariableRegistry" + all();
    }
}
