package io.github.cyfko.truthtable.core.parsing;

import io.github.cyfko.truthtable.core.api.Expression;
import io.github.cyfko.truthtable.core.registry.VariableRegistry;

import java.util.HashMap;
import java.util.Map;

/**
 * State of a single parse: the whitespace-free formula, the registry its variables are interned
 * into, and optionally the outcome of every span already resolved.
 * <p>
 * A span's outcome depends only on its text, so caching it never changes the resulting tree;
 * it turns the backtracking search from exponential into polynomial time on formulas with many
 * failing split candidates.
 * </p>
 *
 * <p><strong>Thread Safety:</strong> a session is confined to the thread that parses.</p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class ParseSession {

    private final String text;
    private final VariableRegistry registry;
    private final Map<Long, ParseResult> resolvedSpans;
    private int attempts;

    /**
     * @param text     the formula with all whitespace removed
     * @param registry registry receiving the variables met while parsing
     * @param memoize  whether span outcomes are cached
     */
    public ParseSession(String text, VariableRegistry registry, boolean memoize) {
        this.text = text;
        this.registry = registry;
        this.resolvedSpans = memoize ? new HashMap<>() : null;
    }

    /**
     * Parses the whole formula.
     *
     * @return the outcome for the span covering the entire text
     */
    public ParseResult parseAll() {
        return parse(0, text.length() - 1);
    }

    /**
     * Parses the span {@code [from, to]} by trying each {@link GrammarRule} in declaration order.
     * An empty span ({@code from > to}) always fails.
     *
     * @param from first index (inclusive)
     * @param to   last index (inclusive)
     * @return the first successful rule's outcome, or a failure for the span
     */
    public ParseResult parse(int from, int to) {
        if (from > to) {
            return ParseResult.failure(from, to);
        }

        Long key = null;
        if (resolvedSpans != null) {
            key = ((long) from << 32) | (to & 0xFFFFFFFFL);
            ParseResult known = resolvedSpans.get(key);
            if (known != null) {
                return known;
            }
        }

        attempts++;
        ParseResult outcome = ParseResult.failure(from, to);
        for (GrammarRule rule : GrammarRule.values()) {
            ParseResult candidate = rule.apply(this, from, to);
            if (candidate.isSuccess()) {
                outcome = candidate;
                break;
            }
        }

        if (key != null) {
            resolvedSpans.put(key, outcome);
        }
        return outcome;
    }

    /**
     * @return number of spans evaluated against the rules (cache hits excluded)
     */
    public int attempts() {
        return attempts;
    }

    public VariableRegistry registry() {
        return registry;
    }

    char charAt(int index) {
        return text.charAt(index);
    }

    Expression.Literal literal(char name) {
        registry.intern(name);
        return new Expression.Literal(name);
    }

    /**
     * Rightmost start index {@code i} such that {@code token} lies entirely within
     * {@code [from, to]}, or {@code -1}.
     */
    int lastIndexOf(String token, int from, int to) {
        int i = text.lastIndexOf(token, to - token.length() + 1);
        return i >= from ? i : -1;
    }
}
