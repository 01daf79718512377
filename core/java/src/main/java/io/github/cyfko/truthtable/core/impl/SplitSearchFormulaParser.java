package io.github.cyfko.truthtable.core.impl;

import io.github.cyfko.truthtable.core.api.FormulaParser;
import io.github.cyfko.truthtable.core.api.ParsedFormula;
import io.github.cyfko.truthtable.core.config.FormulaPolicy;
import io.github.cyfko.truthtable.core.exception.FormulaComplexityException;
import io.github.cyfko.truthtable.core.exception.FormulaSyntaxException;
import io.github.cyfko.truthtable.core.exception.TruthTableException;
import io.github.cyfko.truthtable.core.parsing.GrammarRule;
import io.github.cyfko.truthtable.core.parsing.ParseResult;
import io.github.cyfko.truthtable.core.parsing.ParseSession;
import io.github.cyfko.truthtable.core.registry.VariableRegistry;

import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.logging.Logger;

/**
 * {@link FormulaParser} resolving the ambiguous formula grammar by trial splitting.
 * <p>
 * Every span is matched against the {@link GrammarRule}s in their fixed order; binary rules
 * scan for their operator from the right and retry leftward until both operands parse. There
 * is no precedence table: the rule order and the split direction alone decide the tree.
 * </p>
 *
 * <h2>Processing</h2>
 * <ol>
 *   <li>Whitespace is removed from the formula</li>
 *   <li>The length limit of the {@link FormulaPolicy} is enforced</li>
 *   <li>A {@link ParseSession} with a fresh {@link VariableRegistry} parses the whole text. The search
 *       recurses once per nesting level, so formulas longer than {@value #CALLER_STACK_LENGTH}
 *       characters are parsed on a dedicated thread whose stack grows with the formula length</li>
 *   <li>On failure, the text is inspected for an evident cause to report</li>
 * </ol>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * FormulaParser parser = new SplitSearchFormulaParser();
 * ParsedFormula formula = parser.parse("a -> b -> c");
 * formula.root().toInfix();   // "((a -> b) -> c)"
 * formula.variables();        // [a, b, c]
 *
 * FormulaParser strict = new SplitSearchFormulaParser(FormulaPolicy.strict());
 * }</pre>
 *
 * <p>Instances hold no per-formula state and may be shared between threads.</p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public class SplitSearchFormulaParser implements FormulaParser {

    private static final Logger log = Logger.getLogger(SplitSearchFormulaParser.class.getName());

    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyzTF~&|-<>()";

    /**
     * Longest formula parsed directly on the calling thread.
     */
    static final int CALLER_STACK_LENGTH = 1000;

    /**
     * Stack reserved per formula character for longer formulas. One character adds at most one
     * level of nesting, and a level costs at most three frames.
     */
    static final long STACK_BYTES_PER_CHARACTER = 4096;

    private final FormulaPolicy policy;

    /**
     * Parser applying {@link FormulaPolicy#defaults()}.
     */
    public SplitSearchFormulaParser() {
        this(FormulaPolicy.defaults());
    }

    /**
     * @param policy the limits to enforce
     * @throws IllegalArgumentException if policy is null
     */
    public SplitSearchFormulaParser(FormulaPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Formula policy is required");
        }
        this.policy = policy;
    }

    public FormulaPolicy getPolicy() {
        return policy;
    }

    @Override
    public ParsedFormula parse(String formula) throws FormulaSyntaxException {
        Objects.requireNonNull(formula, "formula");

        String text = stripWhitespace(formula);
        if (text.isEmpty()) {
            throw new FormulaSyntaxException("Formula cannot be null or empty", formula);
        }
        if (text.length() > policy.maxFormulaLength()) {
            throw new FormulaComplexityException(String.format(
                    "Formula too long (%d characters, max: %d). Policy applied: %s",
                    text.length(), policy.maxFormulaLength(), policy.policyName()));
        }

        ParseSession session = new ParseSession(text, new VariableRegistry(), policy.memoizeSpans());
        ParseResult result;
        try {
            result = text.length() <= CALLER_STACK_LENGTH ? session.parseAll() : parseOnDedicatedStack(session, text);
        } catch (StackOverflowError e) {
            throw new FormulaComplexityException(String.format(
                    "Formula nested too deeply to parse (%d characters). Policy applied: %s",
                    text.length(), policy.policyName()), e);
        }

        log.fine(() -> String.format("Parsed '%s' in %d span attempt(s), success: %s",
                text, session.attempts(), result.isSuccess()));

        if (!result.isSuccess()) {
            throw diagnose(formula, text);
        }
        return new ParsedFormula(formula, text, result.expression(), session.registry());
    }

    /**
     * Runs the session on a thread whose stack is sized for the formula's worst-case nesting.
     * A {@link StackOverflowError} raised there is rethrown on the calling thread.
     */
    private static ParseResult parseOnDedicatedStack(ParseSession session, String text) {
        FutureTask<ParseResult> task = new FutureTask<>(session::parseAll);
        Thread worker = new Thread(null, task, "formula-parser", STACK_BYTES_PER_CHARACTER * text.length());
        worker.setDaemon(true);
        worker.start();
        try {
            return task.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TruthTableException("Interrupted while parsing formula", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new TruthTableException("Formula parsing failed", cause);
        }
    }

    static String stripWhitespace(String formula) {
        StringBuilder builder = new StringBuilder(formula.length());
        for (int i = 0; i < formula.length(); i++) {
            char c = formula.charAt(i);
            if (!Character.isWhitespace(c)) {
                builder.append(c);
            }
        }
        return builder.toString();
    }

    /**
     * Builds the exception for a formula that has no parse, naming an unknown character or an
     * unbalanced parenthesis when there is one. Both always prevent a parse.
     */
    private static FormulaSyntaxException diagnose(String formula, String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (ALPHABET.indexOf(c) < 0) {
                return new FormulaSyntaxException(
                        String.format("Unknown character '%c' at position %d", c, i), formula, i);
            }
        }

        int depth = 0;
        int lastOpen = -1;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                if (depth == 0) lastOpen = i;
                depth++;
            } else if (c == ')') {
                if (depth == 0) {
                    return new FormulaSyntaxException(
                            "Mismatched parentheses: unmatched ')' at position " + i, formula, i);
                }
                depth--;
            }
        }
        if (depth > 0) {
            return new FormulaSyntaxException(
                    "Mismatched parentheses: unmatched '(' at position " + lastOpen, formula, lastOpen);
        }

        return new FormulaSyntaxException("Not a valid expression: '" + formula + "'", formula);
    }
}
