package io.github.cyfko.boolexpr.core.algebra;

import io.github.cyfko.boolexpr.core.ExpressionGenerators;
import io.github.cyfko.boolexpr.core.config.EnginePolicy;
import io.github.cyfko.boolexpr.core.model.And;
import io.github.cyfko.boolexpr.core.model.BooleanExpression;
import io.github.cyfko.boolexpr.core.model.Not;
import io.github.cyfko.boolexpr.core.model.Or;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.Duration;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static io.github.cyfko.boolexpr.core.model.BooleanExpression.FALSE;
import static io.github.cyfko.boolexpr.core.model.BooleanExpression.TRUE;
import static io.github.cyfko.boolexpr.core.model.BooleanExpression.and;
import static io.github.cyfko.boolexpr.core.model.BooleanExpression.not;
import static io.github.cyfko.boolexpr.core.model.BooleanExpression.or;
import static io.github.cyfko.boolexpr.core.model.BooleanExpression.variable;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for {@link BooleanSimplifier}.
 * <ul>
 *   <li>Identity: A | ⊥ → A, A &amp; ⊤ → A</li>
 *   <li>Annihilation: A | ⊤ → ⊤, A &amp; ⊥ → ⊥</li>
 *   <li>Idempotence: A | A → A, A &amp; A → A (structurally, then up to equivalence)</li>
 *   <li>Complement: A | !A → ⊤, A &amp; !A → ⊥ (structurally, then up to equivalence)</li>
 *   <li>Negation folding: !⊤ → ⊥, !!A → A</li>
 * </ul>
 */
@DisplayName("BooleanSimplifier Tests")
class BooleanSimplifierTest {

    private final BooleanSimplifier simplifier = new EquivalenceChecker(EnginePolicy.defaults()).simplifier();

    private final BooleanExpression p = variable("p");
    private final BooleanExpression q = variable("q");
    private final BooleanExpression r = variable("r");

    static Stream<BooleanExpression> expressions() {
        return ExpressionGenerators.arbitrary(60);
    }

    // ========== Identity and Annihilation ==========

    @Test
    @DisplayName("Should simplify p | ⊤ to ⊤")
    void testOrAnnihilation() {
        assertEquals(TRUE, simplifier.simplify(or(p, TRUE)));
        assertEquals(TRUE, simplifier.simplify(or(TRUE, p)));
    }

    @Test
    @DisplayName("Should simplify p & ⊥ to ⊥")
    void testAndAnnihilation() {
        assertEquals(FALSE, simplifier.simplify(and(p, FALSE)));
        assertEquals(FALSE, simplifier.simplify(and(FALSE, p)));
    }

    @Test
    @DisplayName("Should drop neutral constants")
    void testIdentity() {
        assertEquals(p, simplifier.simplify(or(p, FALSE)));
        assertEquals(p, simplifier.simplify(or(FALSE, p)));
        assertEquals(p, simplifier.simplify(and(p, TRUE)));
        assertEquals(p, simplifier.simplify(and(TRUE, p)));
    }

    @Test
    @DisplayName("Should simplify children before the node")
    void testBottomUp() {
        assertEquals(q, simplifier.simplify(or(and(p, FALSE), q)));
        assertEquals(FALSE, simplifier.simplify(and(q, or(FALSE, and(p, not(p))))));
    }

    // ========== Idempotence and Complement ==========

    @Test
    @DisplayName("Should simplify p | p and p & p to p")
    void testIdempotence() {
        assertEquals(p, simplifier.simplify(or(p, p)));
        assertEquals(p, simplifier.simplify(and(p, p)));
    }

    @Test
    @DisplayName("Should keep the left operand of equivalent operands")
    void testIdempotenceUpToEquivalence() {
        BooleanExpression left = or(p, q);
        BooleanExpression right = or(q, p);

        assertEquals(left, simplifier.simplify(and(left, right)));
        assertEquals(right, simplifier.simplify(or(right, left)));
    }

    @Test
    @DisplayName("Should simplify p | !p to ⊤ and p & !p to ⊥")
    void testComplement() {
        assertEquals(TRUE, simplifier.simplify(or(p, not(p))));
        assertEquals(FALSE, simplifier.simplify(and(not(p), p)));
    }

    @Test
    @DisplayName("Should detect complements up to De Morgan")
    void testComplementUpToEquivalence() {
        BooleanExpression disjunction = or(p, q);
        BooleanExpression negated = and(not(q), not(p));

        assertEquals(TRUE, simplifier.simplify(or(disjunction, negated)));
        assertEquals(FALSE, simplifier.simplify(and(negated, disjunction)));
    }

    @Test
    @DisplayName("Should leave unrelated operands alone")
    void testNoRuleApplies() {
        BooleanExpression expression = and(or(p, q), not(r));

        assertEquals(expression, simplifier.simplify(expression));
    }

    // ========== Negation ==========

    @Test
    @DisplayName("Should fold negated constants and double negations")
    void testNegation() {
        assertEquals(FALSE, simplifier.simplify(not(TRUE)));
        assertEquals(TRUE, simplifier.simplify(not(FALSE)));
        assertEquals(p, simplifier.simplify(not(not(p))));
        assertEquals(not(p), simplifier.simplify(not(not(not(p)))));
        assertEquals(not(or(p, q)), simplifier.simplify(not(or(p, not(not(q))))));
    }

    @Test
    @DisplayName("Should return literals unchanged")
    void testLiterals() {
        assertSame(p, simplifier.simplify(p));
        assertSame(TRUE, simplifier.simplify(TRUE));
        BooleanExpression negated = not(p);
        assertSame(negated, simplifier.simplify(negated));
    }

    // ========== Complexity Bound ==========

    @Test
    @DisplayName("Should collapse identical operands above the variable bound")
    void testCollapsesIdenticalOperandsAboveBound() {
        // Given
        BooleanSimplifier bounded = new EquivalenceChecker(
            EnginePolicy.builder().maxEquivalenceVariables(1).build()).simplifier();
        BooleanExpression pq = or(p, q);

        // Then
        assertEquals(pq, bounded.simplify(or(pq, pq)));
        assertEquals(pq, bounded.simplify(and(pq, pq)));
        assertEquals(p, bounded.simplify(or(p, p)));
        assertEquals(TRUE, bounded.simplify(or(pq, TRUE)));
    }

    @Test
    @DisplayName("Should detect structural complements above the variable bound")
    void testDetectsComplementsAboveBound() {
        // Given
        BooleanSimplifier bounded = new EquivalenceChecker(
            EnginePolicy.builder().maxEquivalenceVariables(1).build()).simplifier();
        BooleanExpression pq = or(p, q);

        // Then
        assertEquals(FALSE, bounded.simplify(and(pq, not(pq))));
        assertEquals(FALSE, bounded.simplify(and(pq, and(not(p), not(q)))));
        assertEquals(TRUE, bounded.simplify(or(not(pq), pq)));
    }

    @Test
    @DisplayName("Should only skip the rules for overlapping operands that need enumeration")
    void testSkipsEnumerationAboveBound() {
        // Given
        BooleanSimplifier bounded = new EquivalenceChecker(
            EnginePolicy.builder().maxEquivalenceVariables(1).build()).simplifier();
        BooleanExpression reordered = or(or(p, q), or(q, p));

        // Then
        assertEquals(reordered, bounded.simplify(reordered));
        assertEquals(or(p, q), simplifier.simplify(reordered));
    }

    @Test
    @DisplayName("Should simplify a wide repeated disjunction with the default bound")
    void testWideRepeatedDisjunction() {
        // Given
        BooleanExpression wide = IntStream.range(0, 24)
            .mapToObj(i -> (BooleanExpression) variable("v" + i))
            .reduce(BooleanExpression::or)
            .orElseThrow();

        // When
        BooleanExpression simplified = assertTimeoutPreemptively(Duration.ofSeconds(10),
            () -> simplifier.simplify(or(wide, wide)));

        // Then
        assertEquals(wide, simplified);
        assertEquals(FALSE, simplifier.simplify(and(wide, not(wide))));
    }

    // ========== Properties ==========

    @ParameterizedTest
    @MethodSource("expressions")
    @DisplayName("Should preserve the truth table")
    void testPreservesTruthTable(BooleanExpression expression) {
        BooleanExpression simplified = simplifier.simplify(expression);

        assertTrue(ExpressionGenerators.sameTruthTable(expression, simplified),
            () -> expression + " simplified to " + simplified);
        assertTrue(simplified.size() <= expression.size());
    }

    @ParameterizedTest
    @MethodSource("expressions")
    @DisplayName("Should reduce variable-free expressions to a constant")
    void testConstantFolding(BooleanExpression expression) {
        BooleanExpression closed = substituteTrue(expression);

        BooleanExpression simplified = simplifier.simplify(closed);

        assertTrue(TRUE.equals(simplified) || FALSE.equals(simplified), () -> closed + " simplified to " + simplified);
    }

    private static BooleanExpression substituteTrue(BooleanExpression expression) {
        return switch (expression.type()) {
            case TRUE, FALSE -> expression;
            case VARIABLE -> TRUE;
            case NOT -> not(substituteTrue(((Not) expression).operand()));
            case OR -> {
                Or or = (Or) expression;
                yield or(substituteTrue(or.left()), substituteTrue(or.right()));
            }
            case AND -> {
                And and = (And) expression;
                yield and(substituteTrue(and.left()), substituteTrue(and.right()));
            }
        };
    }
}
