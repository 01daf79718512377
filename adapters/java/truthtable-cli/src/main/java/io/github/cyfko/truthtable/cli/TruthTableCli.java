package io.github.cyfko.truthtable.cli;

import io.github.cyfko.truthtable.core.TruthTables;
import io.github.cyfko.truthtable.core.exception.FormulaComplexityException;
import io.github.cyfko.truthtable.core.exception.FormulaSyntaxException;
import io.github.cyfko.truthtable.core.model.TruthTable;

import java.io.PrintStream;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Command line front end: prints the truth table of the formula given as sole argument.
 * <pre>
 * truthtable "(a | b) -&gt; c"
 * </pre>
 * Exit status is {@code 0} once the table is printed, {@code 1} when the argument count is
 * wrong or the formula is rejected. A rejected formula prints nothing on standard output.
 */
public final class TruthTableCli {

    private static final Logger log = Logger.getLogger(TruthTableCli.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final TruthTables truthTables;
    private final TruthTableFormatter formatter;

    public TruthTableCli() {
        this(TruthTables.defaults(), new TruthTableFormatter());
    }

    TruthTableCli(TruthTables truthTables, TruthTableFormatter formatter) {
        this.truthTables = Objects.requireNonNull(truthTables, "truthTables");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
    }

    public static void main(String[] args) {
        System.exit(new TruthTableCli().run(args, System.out, System.err));
    }

    /**
     * Runs the command.
     *
     * @param args command line arguments; exactly one, the formula, is expected
     * @param out  receives the table
     * @param err  receives error messages
     * @return the process exit status
     */
    public int run(String[] args, PrintStream out, PrintStream err) {
        if (args == null || args.length == 0) {
            err.println("Error: no argument supplied.");
            return EXIT_FAILURE;
        }
        if (args.length > 1) {
            err.println("Error: Only one argument should be supplied."
                    + " Note the argument should be surrounded by quotes");
            return EXIT_FAILURE;
        }

        TruthTable table;
        try {
            table = truthTables.tabulate(args[0]);
        } catch (FormulaSyntaxException e) {
            log.fine(() -> "Rejected formula '" + e.getFormula() + "': " + e.getMessage());
            err.println("Error parsing the supplied argument");
            err.println(e.getMessage());
            return EXIT_FAILURE;
        } catch (FormulaComplexityException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }

        formatter.format(table).forEach(out::println);
        return EXIT_OK;
    }
}
