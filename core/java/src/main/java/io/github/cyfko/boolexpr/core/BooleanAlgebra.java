package io.github.cyfko.boolexpr.core;

import io.github.cyfko.boolexpr.core.algebra.BooleanSimplifier;
import io.github.cyfko.boolexpr.core.algebra.EquivalenceChecker;
import io.github.cyfko.boolexpr.core.algebra.NormalFormConverter;
import io.github.cyfko.boolexpr.core.config.EnginePolicy;
import io.github.cyfko.boolexpr.core.exception.ExpressionComplexityException;
import io.github.cyfko.boolexpr.core.model.BooleanExpression;
import io.github.cyfko.boolexpr.core.parsing.JsonExpressionCodec;

/**
 * Entry point of the expression engine.
 * <p>
 * Wires the {@link EquivalenceChecker}, the {@link BooleanSimplifier} and the {@link NormalFormConverter} under a
 * single {@link EnginePolicy}, together with a {@link JsonExpressionCodec} enforcing the same input limits.
 * </p>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * BooleanAlgebra algebra = BooleanAlgebra.defaults();
 *
 * BooleanExpression e = algebra.codec().parse("[\"AND\", [\"OR\", \"p\", \"q\"], \"r\"]");
 * algebra.toDNF(e);                     // ((p ∧ r) ∨ (q ∧ r))
 * algebra.isEquivalentTo(e, e.toNNF()); // true
 *
 * // Tighter limits for untrusted input
 * BooleanAlgebra strict = BooleanAlgebra.of(EnginePolicy.strict());
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe.</p>
 *
 * @author cyfko
 * @since 1.0.0
 */
public final class BooleanAlgebra {

    private static final BooleanAlgebra DEFAULT = new BooleanAlgebra(EnginePolicy.defaults());

    private final EnginePolicy policy;
    private final EquivalenceChecker checker;
    private final NormalFormConverter converter;
    private final JsonExpressionCodec codec;

    private BooleanAlgebra(EnginePolicy policy) {
        this.policy = policy;
        this.checker = new EquivalenceChecker(policy);
        this.converter = new NormalFormConverter(checker.simplifier());
        this.codec = new JsonExpressionCodec(policy);
    }

    /**
     * @return the shared engine configured with {@link EnginePolicy#defaults()}
     */
    public static BooleanAlgebra defaults() {
        return DEFAULT;
    }

    /**
     * Creates an engine with custom limits.
     *
     * @param policy the engine limits
     * @return a new engine
     * @throws IllegalArgumentException if policy is null
     */
    public static BooleanAlgebra of(EnginePolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Engine policy is required");
        }
        return new BooleanAlgebra(policy);
    }

    public EnginePolicy policy() {
        return policy;
    }

    /**
     * @return the JSON codec enforcing this engine's input limits
     */
    public JsonExpressionCodec codec() {
        return codec;
    }

    /**
     * @see BooleanSimplifier#simplify(BooleanExpression)
     */
    public BooleanExpression simplify(BooleanExpression expression) {
        return checker.simplifier().simplify(expression);
    }

    /**
     * @see NormalFormConverter#toNNF(BooleanExpression)
     */
    public BooleanExpression toNNF(BooleanExpression expression) {
        return converter.toNNF(expression);
    }

    /**
     * @see NormalFormConverter#nnfToDnf(BooleanExpression)
     */
    public BooleanExpression nnfToDnf(BooleanExpression expression) {
        return converter.nnfToDnf(expression);
    }

    /**
     * @see NormalFormConverter#toDNF(BooleanExpression)
     */
    public BooleanExpression toDNF(BooleanExpression expression) {
        return converter.toDNF(expression);
    }

    /**
     * @throws ExpressionComplexityException if the pair has more variables than the policy allows
     * @see EquivalenceChecker#isEquivalentTo(BooleanExpression, BooleanExpression)
     */
    public boolean isEquivalentTo(BooleanExpression a, BooleanExpression b) {
        return checker.isEquivalentTo(a, b);
    }

    /**
     * @see EquivalenceChecker#canDecide(BooleanExpression, BooleanExpression)
     */
    public boolean canDecide(BooleanExpression a, BooleanExpression b) {
        return checker.canDecide(a, b);
    }
}
