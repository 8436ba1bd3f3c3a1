package io.github.cyfko.boolexpr.core.model;

import io.github.cyfko.boolexpr.core.BooleanAlgebra;

import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.BinaryOperator;

/**
 * Immutable propositional-logic expression tree.
 * <p>
 * A {@code BooleanExpression} is a tagged union of six variants, each implemented as a record:
 * </p>
 * <ul>
 *   <li>{@link True} and {@link False} - the boolean constants</li>
 *   <li>{@link Variable} - a named, case-sensitive atom</li>
 *   <li>{@link Not} - unary negation</li>
 *   <li>{@link Or} and {@link And} - binary connectives, each owning its two subtrees</li>
 * </ul>
 *
 * <h2>Equality</h2>
 * <p>
 * Equality is <strong>structural</strong>: two trees are equal iff they have the same shape and the same
 * constants and variable names. Logical equivalence is a different relation, see
 * {@link #isEquivalentTo(BooleanExpression)}.
 * </p>
 *
 * <h2>Operations</h2>
 * <p>
 * Every structural query is a single method switching over {@link #type()}, so that all cases of one
 * operation can be read together. Transformations ({@link #negate()}, {@link #simplify()}, {@link #toNNF()},
 * {@link #toDNF()}) never modify a tree, they always return a new one.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * BooleanExpression expr = and(or(variable("p"), variable("q")), variable("r"));
 *
 * expr.allVars();   // [p, q, r]
 * expr.isDNF();     // false
 * expr.toDNF();     // ((p ∧ r) ∨ (q ∧ r))
 * }</pre>
 *
 * @author cyfko
 * @since 1.0.0
 */
public sealed interface BooleanExpression permits True, False, Variable, Not, Or, And {

    /**
     * Shared instance of the constant {@code true}.
     */
    BooleanExpression TRUE = new True();

    /**
     * Shared instance of the constant {@code false}.
     */
    BooleanExpression FALSE = new False();

    /**
     * Variant tag of an expression node.
     */
    enum Type {
        TRUE,
        FALSE,
        VARIABLE,
        NOT,
        OR,
        AND
    }

    /**
     * @return the variant tag of this node
     */
    Type type();

    static BooleanExpression constant(boolean value) {
        return value ? TRUE : FALSE;
    }

    static Variable variable(String name) {
        return new Variable(name);
    }

    static Not not(BooleanExpression operand) {
        return new Not(operand);
    }

    static Or or(BooleanExpression left, BooleanExpression right) {
        return new Or(left, right);
    }

    static And and(BooleanExpression left, BooleanExpression right) {
        return new And(left, right);
    }

    /**
     * Collects the names of all variables appearing anywhere in this tree.
     *
     * @return an unmodifiable, sorted set of variable names; empty for variable-free expressions
     */
    default Set<String> allVars() {
        Set<String> names = new TreeSet<>();
        collectVariables(this, names);
        return Collections.unmodifiableSet(names);
    }

    /**
     * Evaluates this expression under the given interpretation.
     * <p>
     * Both operands of a binary connective are always evaluated, even when one of them alone would decide
     * the result: the evaluation only succeeds if every variable of the tree is bound.
     * </p>
     *
     * @param interpretation the variable assignment to evaluate against
     * @return the truth value, or an empty {@code Optional} if a variable of this tree is not bound
     */
    default Optional<Boolean> evaluate(Interpretation interpretation) {
        Objects.requireNonNull(interpretation, "Interpretation is required");

        return switch (type()) {
            case TRUE -> Optional.of(Boolean.TRUE);
            case FALSE -> Optional.of(Boolean.FALSE);
            case VARIABLE -> interpretation.valueOf(((Variable) this).name());
            case NOT -> ((Not) this).operand().evaluate(interpretation).map(value -> !value);
            case OR -> {
                Or or = (Or) this;
                yield combine(or.left().evaluate(interpretation), or.right().evaluate(interpretation), Boolean::logicalOr);
            }
            case AND -> {
                And and = (And) this;
                yield combine(and.left().evaluate(interpretation), and.right().evaluate(interpretation), Boolean::logicalAnd);
            }
        };
    }

    /**
     * A literal is a constant, a variable or the negation of a variable.
     *
     * @return true if this node is a literal
     */
    default boolean isLiteral() {
        return switch (type()) {
            case TRUE, FALSE, VARIABLE -> true;
            case NOT -> ((Not) this).operand().type() == Type.VARIABLE;
            case OR, AND -> false;
        };
    }

    /**
     * Tells whether this node is a clause: literals combined by a single connective used consistently.
     * <p>
     * A literal is a degenerate clause. An {@code Or} node is a clause iff each child is a literal or an
     * {@code Or} clause, and symmetrically for {@code And}. Mixing connectives (an {@code Or} holding an
     * {@code And}, or the reverse) never yields a clause.
     * </p>
     *
     * @return true if this node is a clause
     */
    default boolean isClause() {
        return switch (type()) {
            case TRUE, FALSE, VARIABLE -> true;
            case NOT -> isLiteral();
            case OR -> {
                Or or = (Or) this;
                yield isClauseOperand(or.left(), Type.OR) && isClauseOperand(or.right(), Type.OR);
            }
            case AND -> {
                And and = (And) this;
                yield isClauseOperand(and.left(), Type.AND) && isClauseOperand(and.right(), Type.AND);
            }
        };
    }

    /**
     * Builds the negation of this expression by De Morgan's laws.
     * <p>
     * Negations are pushed one level down only where a connective is met; a double negation is removed.
     * The result is logically, not necessarily structurally, canonical.
     * </p>
     *
     * @return an expression equivalent to {@code NOT this}
     */
    default BooleanExpression negate() {
        return switch (type()) {
            case TRUE -> FALSE;
            case FALSE -> TRUE;
            case VARIABLE -> new Not(this);
            case NOT -> ((Not) this).operand();
            case OR -> {
                Or or = (Or) this;
                yield new And(or.left().negate(), or.right().negate());
            }
            case AND -> {
                And and = (And) this;
                yield new Or(and.left().negate(), and.right().negate());
            }
        };
    }

    /**
     * Tells whether this expression is in disjunctive normal form.
     *
     * @return true if this expression is a disjunction of conjunctive clauses of literals
     */
    default boolean isDNF() {
        return switch (type()) {
            case TRUE, FALSE, VARIABLE -> true;
            case NOT -> ((Not) this).operand().isLiteral();
            case OR -> {
                Or or = (Or) this;
                yield or.left().isDNF() && or.right().isDNF();
            }
            case AND -> isClause();
        };
    }

    /**
     * @return the number of nodes on the longest root-to-leaf path, 1 for a leaf
     */
    default int depth() {
        return switch (type()) {
            case TRUE, FALSE, VARIABLE -> 1;
            case NOT -> 1 + ((Not) this).operand().depth();
            case OR -> {
                Or or = (Or) this;
                yield 1 + Math.max(or.left().depth(), or.right().depth());
            }
            case AND -> {
                And and = (And) this;
                yield 1 + Math.max(and.left().depth(), and.right().depth());
            }
        };
    }

    /**
     * @return the total number of nodes of this tree
     */
    default int size() {
        return switch (type()) {
            case TRUE, FALSE, VARIABLE -> 1;
            case NOT -> 1 + ((Not) this).operand().size();
            case OR -> {
                Or or = (Or) this;
                yield 1 + or.left().size() + or.right().size();
            }
            case AND -> {
                And and = (And) this;
                yield 1 + and.left().size() + and.right().size();
            }
        };
    }

    /**
     * Shortcut for {@code BooleanAlgebra.defaults().simplify(this)}.
     *
     * @return the simplified expression
     * @see BooleanAlgebra#simplify(BooleanExpression)
     */
    default BooleanExpression simplify() {
        return BooleanAlgebra.defaults().simplify(this);
    }

    /**
     * Shortcut for {@code BooleanAlgebra.defaults().toNNF(this)}.
     *
     * @return the negation normal form of this expression
     * @see BooleanAlgebra#toNNF(BooleanExpression)
     */
    default BooleanExpression toNNF() {
        return BooleanAlgebra.defaults().toNNF(this);
    }

    /**
     * Shortcut for {@code BooleanAlgebra.defaults().toDNF(this)}.
     *
     * @return the disjunctive normal form of this expression
     * @see BooleanAlgebra#toDNF(BooleanExpression)
     */
    default BooleanExpression toDNF() {
        return BooleanAlgebra.defaults().toDNF(this);
    }

    /**
     * Shortcut for {@code BooleanAlgebra.defaults().isEquivalentTo(this, other)}.
     *
     * @param other the expression to compare with
     * @return true if both expressions have the same truth value under every interpretation
     * @see BooleanAlgebra#isEquivalentTo(BooleanExpression, BooleanExpression)
     */
    default boolean isEquivalentTo(BooleanExpression other) {
        return BooleanAlgebra.defaults().isEquivalentTo(this, other);
    }

    private static void collectVariables(BooleanExpression expression, Set<String> names) {
        switch (expression.type()) {
            case TRUE, FALSE -> { }
            case VARIABLE -> names.add(((Variable) expression).name());
            case NOT -> collectVariables(((Not) expression).operand(), names);
            case OR -> {
                Or or = (Or) expression;
                collectVariables(or.left(), names);
                collectVariables(or.right(), names);
            }
            case AND -> {
                And and = (And) expression;
                collectVariables(and.left(), names);
                collectVariables(and.right(), names);
            }
        }
    }

    private static boolean isClauseOperand(BooleanExpression operand, Type connective) {
        return operand.isLiteral() || (operand.type() == connective && operand.isClause());
    }

    private static Optional<Boolean> combine(Optional<Boolean> left, Optional<Boolean> right,
                                             BinaryOperator<Boolean> connective) {
        if (left.isEmpty() || right.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(connective.apply(left.get(), right.get()));
    }
}
