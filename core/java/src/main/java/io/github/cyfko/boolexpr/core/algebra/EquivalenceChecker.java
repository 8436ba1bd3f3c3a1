package io.github.cyfko.boolexpr.core.algebra;

import io.github.cyfko.boolexpr.core.config.EnginePolicy;
import io.github.cyfko.boolexpr.core.exception.ExpressionComplexityException;
import io.github.cyfko.boolexpr.core.model.BooleanExpression;
import io.github.cyfko.boolexpr.core.model.Interpretation;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Decides logical equivalence of two expressions by truth-table comparison.
 * <p>
 * Structurally equal sides are equivalent. Otherwise the check proceeds in four steps:
 * </p>
 * <ol>
 *   <li>Both sides are {@linkplain BooleanSimplifier#simplify(BooleanExpression) simplified}.</li>
 *   <li>If neither simplified side has variables, both are constants and are compared structurally.</li>
 *   <li>If both sides have variables and the two variable sets are disjoint, the sides are reported as not
 *       equivalent without enumeration.</li>
 *   <li>Otherwise both sides are evaluated under every interpretation over the union of their variables and
 *       must agree on each one.</li>
 * </ol>
 *
 * <h2>Complexity</h2>
 * <p>
 * Step 4 evaluates both sides under {@code 2^n} interpretations, {@code n} being the number of variables. It is
 * bounded by {@link EnginePolicy#maxEquivalenceVariables()}: when step 4 is reached with more variables,
 * {@link #isEquivalentTo} throws {@link ExpressionComplexityException}. Pairs answered by the structural check or by
 * steps 2 and 3 are never refused. Use {@link #canDecide} to test a pair beforehand.
 * </p>
 *
 * <p>Instances are immutable and thread-safe.</p>
 *
 * @author cyfko
 * @since 1.0.0
 */
public final class EquivalenceChecker {

    private static final Logger log = Logger.getLogger(EquivalenceChecker.class.getName());

    private final EnginePolicy policy;
    private final BooleanSimplifier simplifier;

    /**
     * Creates a checker together with the simplifier it relies on.
     *
     * @param policy the engine limits
     */
    public EquivalenceChecker(EnginePolicy policy) {
        this.policy = Objects.requireNonNull(policy, "Engine policy is required");
        this.simplifier = new BooleanSimplifier(this);
    }

    /**
     * @return the simplifier bound to this checker
     */
    public BooleanSimplifier simplifier() {
        return simplifier;
    }

    public EnginePolicy policy() {
        return policy;
    }

    /**
     * Tells whether {@link #isEquivalentTo} answers the pair without exceeding the configured variable bound.
     *
     * @param a first expression
     * @param b second expression
     * @return true if the pair is decided structurally, by a shortcut, or by an enumeration within the bound
     */
    public boolean canDecide(BooleanExpression a, BooleanExpression b) {
        Objects.requireNonNull(a, "Left expression is required");
        Objects.requireNonNull(b, "Right expression is required");

        return a.equals(b) || canDecideSimplified(simplifier.simplify(a), simplifier.simplify(b));
    }

    /**
     * Tells whether two expressions have the same truth value under every interpretation.
     *
     * @param a first expression
     * @param b second expression
     * @return true if {@code a} and {@code b} are logically equivalent
     * @throws ExpressionComplexityException if the pair needs an enumeration over more variables than allowed
     */
    public boolean isEquivalentTo(BooleanExpression a, BooleanExpression b) {
        Objects.requireNonNull(a, "Left expression is required");
        Objects.requireNonNull(b, "Right expression is required");

        if (a.equals(b)) {
            return true;
        }

        return isEquivalentSimplified(simplifier.simplify(a), simplifier.simplify(b));
    }

    /**
     * {@link #canDecide} for operands that are already simplified.
     */
    boolean canDecideSimplified(BooleanExpression left, BooleanExpression right) {
        if (left.equals(right)) {
            return true;
        }

        Set<String> leftVars = left.allVars();
        Set<String> rightVars = right.allVars();
        boolean disjoint = !leftVars.isEmpty() && !rightVars.isEmpty() && Collections.disjoint(leftVars, rightVars);

        return disjoint || union(leftVars, rightVars).size() <= policy.maxEquivalenceVariables();
    }

    /**
     * {@link #isEquivalentTo} for operands that are already simplified: step 1 is skipped.
     */
    boolean isEquivalentSimplified(BooleanExpression left, BooleanExpression right) {
        if (left.equals(right)) {
            return true;
        }

        Set<String> leftVars = left.allVars();
        Set<String> rightVars = right.allVars();

        if (leftVars.isEmpty() && rightVars.isEmpty()) {
            return false;
        }

        if (!leftVars.isEmpty() && !rightVars.isEmpty() && Collections.disjoint(leftVars, rightVars)) {
            return false;
        }

        Set<String> variables = union(leftVars, rightVars);
        if (variables.size() > policy.maxEquivalenceVariables()) {
            throw new ExpressionComplexityException(variables.size(), policy.maxEquivalenceVariables());
        }

        log.finest(() -> String.format("Enumerating %d interpretations for %s ≡ %s",
            1L << variables.size(), left, right));

        return Interpretation.allOver(variables)
            .allMatch(interpretation -> valueOf(left, interpretation) == valueOf(right, interpretation));
    }

    private static boolean valueOf(BooleanExpression expression, Interpretation interpretation) {
        return expression.evaluate(interpretation)
            .orElseThrow(() -> new IllegalStateException(
                "Interpretation " + interpretation.values() + " does not bind every variable of " + expression));
    }

    private static Set<String> union(Set<String> a, Set<String> b) {
        Set<String> all = new TreeSet<>(a);
        all.addAll(b);
        return all;
    }
}
