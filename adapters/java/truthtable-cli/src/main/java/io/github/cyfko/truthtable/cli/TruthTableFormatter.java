package io.github.cyfko.truthtable.cli;

import io.github.cyfko.truthtable.core.model.Row;
import io.github.cyfko.truthtable.core.model.TruthTable;
import io.github.cyfko.truthtable.core.registry.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Renders a {@link TruthTable} as plain text.
 * <pre>
 * a | b | a -&gt; b
 * ==============
 * F | F | T
 * F | T | T
 * T | F | F
 * T | T | T
 * </pre>
 * The header lists the variables alphabetically and ends with the formula exactly as typed;
 * the second line underlines the header with {@code =}. A formula without variables has a
 * single result column.
 */
public final class TruthTableFormatter {

    static final String SEPARATOR = " | ";

    /**
     * @param table the table to render
     * @return header, underline and one line per row
     */
    public List<String> format(TruthTable table) {
        List<String> lines = new ArrayList<>(table.rows().size() + 2);

        StringJoiner header = new StringJoiner(SEPARATOR);
        for (Variable variable : table.variables()) {
            header.add(String.valueOf(variable.name()));
        }
        header.add(table.formula());
        String top = header.toString();
        lines.add(top);
        lines.add("=".repeat(top.length()));

        for (Row row : table.rows()) {
            StringJoiner line = new StringJoiner(SEPARATOR);
            for (Variable variable : table.variables()) {
                line.add(symbol(row.assignment().valueOf(variable.name())));
            }
            line.add(symbol(row.result()));
            lines.add(line.toString());
        }
        return lines;
    }

    static String symbol(boolean value) {
        return value ? "T" : "F";
    }
}
