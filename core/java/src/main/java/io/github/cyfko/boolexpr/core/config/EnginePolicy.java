package io.github.cyfko.boolexpr.core.config;

/**
 * Resource limits of the expression engine, for protection against oversized or adversarial input.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxInputLength</strong>: Maximum character length of a JSON document accepted by the
 *       deserializer</li>
 *   <li><strong>maxNestingDepth</strong>: Maximum depth of the expression tree produced by the deserializer
 *       (every transformation recurses over the tree)</li>
 *   <li><strong>maxEquivalenceVariables</strong>: Maximum number of distinct variables an equivalence check may
 *       enumerate interpretations over. A check evaluates both sides under {@code 2^n} interpretations, and
 *       simplification runs up to two checks per operator node.</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for most use cases)
 * EnginePolicy policy = EnginePolicy.defaults();
 *
 * // Strict (for public endpoints with untrusted input)
 * EnginePolicy policy = EnginePolicy.strict();
 *
 * // Relaxed (for internal trusted batch processing)
 * EnginePolicy policy = EnginePolicy.relaxed();
 *
 * // Custom
 * EnginePolicy policy = EnginePolicy.builder()
 *     .maxEquivalenceVariables(12)
 *     .build();
 * }</pre>
 *
 * @param policyName              name of the preset, for diagnostics
 * @param maxInputLength          maximum character length of a JSON document
 * @param maxNestingDepth         maximum depth of a deserialized expression tree
 * @param maxEquivalenceVariables maximum variable count of an exhaustive equivalence check
 * @author cyfko
 * @since 1.0.0
 */
public record EnginePolicy(
    String policyName,
    int maxInputLength,
    int maxNestingDepth,
    int maxEquivalenceVariables
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any limit is invalid
     */
    public EnginePolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxInputLength <= 0) {
            throw new IllegalArgumentException("maxInputLength must be positive, got: " + maxInputLength);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
        if (maxEquivalenceVariables < 0 || maxEquivalenceVariables > 62) {
            throw new IllegalArgumentException(
                "maxEquivalenceVariables must be between 0 and 62, got: " + maxEquivalenceVariables);
        }
    }

    /**
     * Default configuration.
     * <ul>
     *   <li>Max Input Length: 100 000 characters</li>
     *   <li>Max Nesting Depth: 512</li>
     *   <li>Max Equivalence Variables: 16 (at most 65 536 interpretations per check)</li>
     * </ul>
     *
     * @return default configuration
     */
    public static EnginePolicy defaults() {
        return new EnginePolicy(PolicyName.DEFAULT_POLICY.name(), 100_000, 512, 16);
    }

    /**
     * Strict configuration for untrusted input.
     * <ul>
     *   <li>Max Input Length: 10 000 characters</li>
     *   <li>Max Nesting Depth: 128</li>
     *   <li>Max Equivalence Variables: 12</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static EnginePolicy strict() {
        return new EnginePolicy(PolicyName.STRICT_POLICY.name(), 10_000, 128, 12);
    }

    /**
     * Relaxed configuration for trusted input.
     * <ul>
     *   <li>Max Input Length: 1 000 000 characters</li>
     *   <li>Max Nesting Depth: 2048</li>
     *   <li>Max Equivalence Variables: 20</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static EnginePolicy relaxed() {
        return new EnginePolicy(PolicyName.RELAXED_POLICY.name(), 1_000_000, 2048, 20);
    }

    /**
     * Creates a custom configuration. Builder parameters start from the default values.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxInputLength = 100_000;
        private int _maxNestingDepth = 512;
        private int _maxEquivalenceVariables = 16;

        private Builder() {}

        public EnginePolicy build() {
            return new EnginePolicy(_policyName, _maxInputLength, _maxNestingDepth, _maxEquivalenceVariables);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxInputLength(int maxInputLength) { this._maxInputLength = maxInputLength; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
        public Builder maxEquivalenceVariables(int maxEquivalenceVariables) { this._maxEquivalenceVariables = maxEquivalenceVariables; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
