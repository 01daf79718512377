package io.github.cyfko.truthtable.core.api;

import io.github.cyfko.truthtable.core.registry.Variable;
import io.github.cyfko.truthtable.core.registry.VariableRegistry;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a successful parse: the tree together with the variables of its session.
 *
 * @param source     the formula exactly as supplied by the caller (used as the result column label)
 * @param normalized the formula with all whitespace removed, as seen by the grammar rules
 * @param root       root of the expression tree
 * @param registry   variables interned while parsing this formula, and only this formula
 * @author Frank KOSSI
 * @since 1.0
 */
public record ParsedFormula(String source, String normalized, Expression root, VariableRegistry registry) {

    public ParsedFormula {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(normalized, "normalized");
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(registry, "registry");
    }

    /**
     * @return the formula's variables in truth-table column order (alphabetical)
     */
    public List<Variable> variables() {
        return registry.all();
    }
}
