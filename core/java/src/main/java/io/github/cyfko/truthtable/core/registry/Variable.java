package io.github.cyfko.truthtable.core.registry;

/**
 * Stable handle for a variable interned by a {@link VariableRegistry}.
 *
 * @param name      the variable's single-letter name
 * @param firstSeen zero-based position at which the parser first met this variable
 * @author Frank KOSSI
 * @since 1.0
 */
public record Variable(char name, int firstSeen) implements Comparable<Variable> {

    @Override
    public int compareTo(Variable other) {
        return Character.compare(name, other.name);
    }

    @Override
    public String toString() {
        return String.valueOf(name);
    }
}
