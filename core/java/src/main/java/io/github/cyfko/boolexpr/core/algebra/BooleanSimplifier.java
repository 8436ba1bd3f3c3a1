package io.github.cyfko.boolexpr.core.algebra;

import io.github.cyfko.boolexpr.core.model.And;
import io.github.cyfko.boolexpr.core.model.BooleanExpression;
import io.github.cyfko.boolexpr.core.model.BooleanExpression.Type;
import io.github.cyfko.boolexpr.core.model.Not;
import io.github.cyfko.boolexpr.core.model.Or;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Simplifies boolean expressions by equational rewriting.
 * <p>
 * The simplifier performs a <strong>single bottom-up pass</strong>: the operands of a node are simplified first,
 * then the rules below are tried on the node, in this order, and the first match wins.
 * </p>
 * <ul>
 *   <li>Identity: A | ⊥ → A, ⊥ | A → A, A &amp; ⊤ → A, ⊤ &amp; A → A</li>
 *   <li>Annihilation: A | ⊤ → ⊤, ⊤ | A → ⊤, A &amp; ⊥ → ⊥, ⊥ &amp; A → ⊥</li>
 *   <li>Idempotence: A | B → A and A &amp; B → A when A ≡ B</li>
 *   <li>Complement: A | B → ⊤ and A &amp; B → ⊥ when ¬A ≡ B</li>
 *   <li>Constant negation: !⊤ → ⊥, !⊥ → ⊤</li>
 *   <li>Double negation: !!A → A</li>
 * </ul>
 * <p>
 * The structural rules are tried before idempotence and complement. Those two rules first compare the operands
 * structurally (A | A, A | ¬A) and then fall back on an {@linkplain EquivalenceChecker#isEquivalentTo equivalence
 * check}. When the check would enumerate more variables than the checker allows, only the structural comparison is
 * applied for that node. Literals are never rewritten.
 * </p>
 * <p>
 * Each operator node costs at most two equivalence checks over the variables of its operands.
 * </p>
 * <p>
 * The pass is not iterated to a fixed point: the result is equivalent to the input but is not a canonical form.
 * A variable-free input always simplifies to ⊤ or ⊥.
 * </p>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * BooleanSimplifier simplifier = new EquivalenceChecker(EnginePolicy.defaults()).simplifier();
 *
 * simplifier.simplify(or(variable("p"), TRUE));                      // ⊤
 * simplifier.simplify(and(variable("p"), not(variable("p"))));       // ⊥
 * simplifier.simplify(or(and(variable("p"), FALSE), variable("q"))); // q
 * }</pre>
 *
 * @author cyfko
 * @since 1.0.0
 */
public final class BooleanSimplifier {

    private static final Logger log = Logger.getLogger(BooleanSimplifier.class.getName());

    private final EquivalenceChecker checker;

    BooleanSimplifier(EquivalenceChecker checker) {
        this.checker = checker;
    }

    /**
     * Simplifies the given expression.
     *
     * @param expression the expression to simplify
     * @return an equivalent, possibly smaller, expression
     */
    public BooleanExpression simplify(BooleanExpression expression) {
        Objects.requireNonNull(expression, "Expression is required");

        return switch (expression.type()) {
            case TRUE, FALSE, VARIABLE -> expression;
            case NOT -> expression.isLiteral()
                ? expression
                : simplifyNot(simplify(((Not) expression).operand()));
            case OR -> {
                Or or = (Or) expression;
                yield simplifyOr(simplify(or.left()), simplify(or.right()));
            }
            case AND -> {
                And and = (And) expression;
                yield simplifyAnd(simplify(and.left()), simplify(and.right()));
            }
        };
    }

    private BooleanExpression simplifyNot(BooleanExpression operand) {
        return switch (operand.type()) {
            case TRUE -> BooleanExpression.FALSE;                    // !⊤ → ⊥
            case FALSE -> BooleanExpression.TRUE;                    // !⊥ → ⊤
            case NOT -> ((Not) operand).operand();                   // !!A → A
            case VARIABLE, OR, AND -> new Not(operand);
        };
    }

    private BooleanExpression simplifyOr(BooleanExpression a, BooleanExpression b) {
        if (b.type() == Type.FALSE) return a;                                            // A | ⊥ → A
        if (a.type() == Type.FALSE) return b;                                            // ⊥ | A → A
        if (a.type() == Type.TRUE || b.type() == Type.TRUE) return BooleanExpression.TRUE; // A | ⊤ → ⊤

        if (a.equals(b)) return a;                                                       // A | A → A
        if (isComplement(a, b)) return BooleanExpression.TRUE;                           // A | !A → ⊤

        if (canCompare(a, b)) {
            if (checker.isEquivalentSimplified(a, b)) return a;                             // A | B → A, A ≡ B
            if (checker.isEquivalentSimplified(a.negate(), b)) return BooleanExpression.TRUE; // A | B → ⊤, !A ≡ B
        }

        return new Or(a, b);
    }

    private BooleanExpression simplifyAnd(BooleanExpression a, BooleanExpression b) {
        if (b.type() == Type.TRUE) return a;                                               // A & ⊤ → A
        if (a.type() == Type.TRUE) return b;                                               // ⊤ & A → A
        if (a.type() == Type.FALSE || b.type() == Type.FALSE) return BooleanExpression.FALSE; // A & ⊥ → ⊥

        if (a.equals(b)) return a;                                                         // A & A → A
        if (isComplement(a, b)) return BooleanExpression.FALSE;                            // A & !A → ⊥

        if (canCompare(a, b)) {
            if (checker.isEquivalentSimplified(a, b)) return a;                               // A & B → A, A ≡ B
            if (checker.isEquivalentSimplified(a.negate(), b)) return BooleanExpression.FALSE; // A & B → ⊥, !A ≡ B
        }

        return new And(a, b);
    }

    private static boolean isComplement(BooleanExpression a, BooleanExpression b) {
        return a.negate().equals(b) || b.equals(new Not(a)) || a.equals(new Not(b));
    }

    private boolean canCompare(BooleanExpression a, BooleanExpression b) {
        if (checker.canDecideSimplified(a, b)) {
            return true;
        }
        log.fine(() -> String.format(
            "Skipping equivalence-based idempotence and complement: %s and %s exceed %d variables",
            a, b, checker.policy().maxEquivalenceVariables()));
        return false;
    }
}
