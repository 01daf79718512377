package io.github.cyfko.truthtable.core.config;

/**
 * Resource limits applied to formulas.
 * <p>
 * Parsing is a backtracking search and enumeration is exponential in the number of variables,
 * so both are bounded by policy rather than left to the caller.
 * </p>
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxFormulaLength</strong>: maximum length of the whitespace-free formula, at most
 *       {@value #MAX_FORMULA_LENGTH}; nesting depth grows with length and the parser reserves stack for it</li>
 *   <li><strong>maxVariables</strong>: maximum distinct variables a truth table may range over</li>
 *   <li><strong>memoizeSpans</strong>: remember the outcome of every span within one parse session</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * FormulaPolicy policy = FormulaPolicy.defaults(); // 1000 chars, 16 variables
 * FormulaPolicy policy = FormulaPolicy.strict();   // 200 chars, 10 variables
 * FormulaPolicy policy = FormulaPolicy.relaxed();  // 10000 chars, 26 variables
 *
 * FormulaPolicy policy = FormulaPolicy.builder()
 *     .maxVariables(20)
 *     .build();
 * }</pre>
 *
 * @param policyName       name reported in limit violations
 * @param maxFormulaLength maximum length of the whitespace-free formula, at most {@value #MAX_FORMULA_LENGTH}
 * @param maxVariables     maximum number of distinct variables to tabulate, at most 26
 * @param memoizeSpans     whether span outcomes are cached during a parse session
 * @author Frank KOSSI
 * @since 1.0
 */
public record FormulaPolicy(
    String policyName,
    int maxFormulaLength,
    int maxVariables,
    boolean memoizeSpans
) {

    /**
     * Number of distinct variable names the grammar admits ({@code a} to {@code z}).
     */
    public static final int VARIABLE_ALPHABET_SIZE = 26;

    /**
     * Upper bound accepted for {@code maxFormulaLength}.
     */
    public static final int MAX_FORMULA_LENGTH = 10000;

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if a limit is out of range
     */
    public FormulaPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxFormulaLength <= 0 || maxFormulaLength > MAX_FORMULA_LENGTH) {
            throw new IllegalArgumentException(
                "maxFormulaLength must be between 1 and " + MAX_FORMULA_LENGTH + ", got: " + maxFormulaLength);
        }
        if (maxVariables < 0 || maxVariables > VARIABLE_ALPHABET_SIZE) {
            throw new IllegalArgumentException(
                "maxVariables must be between 0 and " + VARIABLE_ALPHABET_SIZE + ", got: " + maxVariables);
        }
    }

    /**
     * Default configuration: 1000 characters, 16 variables (65536 rows), memoization enabled.
     *
     * @return default configuration
     */
    public static FormulaPolicy defaults() {
        return new FormulaPolicy(PolicyName.DEFAULT_POLICY.name(), 1000, 16, true);
    }

    /**
     * Strict configuration for untrusted input: 200 characters, 10 variables (1024 rows).
     *
     * @return strict configuration
     */
    public static FormulaPolicy strict() {
        return new FormulaPolicy(PolicyName.STRICT_POLICY.name(), 200, 10, true);
    }

    /**
     * Relaxed configuration for trusted callers: 10000 characters, every variable name.
     *
     * @return relaxed configuration
     */
    public static FormulaPolicy relaxed() {
        return new FormulaPolicy(PolicyName.RELAXED_POLICY.name(), MAX_FORMULA_LENGTH, VARIABLE_ALPHABET_SIZE, true);
    }

    /**
     * Creates a custom configuration. Builder parameters start at the {@link #defaults()} values.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxFormulaLength = 1000;
        private int _maxVariables = 16;
        private boolean _memoizeSpans = true;

        private Builder() {}

        public FormulaPolicy build() {
            return new FormulaPolicy(_policyName, _maxFormulaLength, _maxVariables, _memoizeSpans);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxFormulaLength(int maxFormulaLength) { this._maxFormulaLength = maxFormulaLength; return this; }
        public Builder maxVariables(int maxVariables) { this._maxVariables = maxVariables; return this; }
        public Builder memoizeSpans(boolean memoize) { this._memoizeSpans = memoize; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
