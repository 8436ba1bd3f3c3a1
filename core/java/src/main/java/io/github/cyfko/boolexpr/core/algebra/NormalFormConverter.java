package io.github.cyfko.boolexpr.core.algebra;

import io.github.cyfko.boolexpr.core.model.And;
import io.github.cyfko.boolexpr.core.model.BooleanExpression;
import io.github.cyfko.boolexpr.core.model.BooleanExpression.Type;
import io.github.cyfko.boolexpr.core.model.Not;
import io.github.cyfko.boolexpr.core.model.Or;

import java.util.Objects;

/**
 * Rewrites expressions into negation normal form (NNF) and disjunctive normal form (DNF).
 *
 * <h2>NNF</h2>
 * <p>
 * {@link #toNNF} pushes negations down to the variables with De Morgan's laws, removing double negations and
 * negated constants on the way.
 * </p>
 *
 * <h2>DNF</h2>
 * <p>
 * {@link #nnfToDnf} distributes conjunctions over disjunctions until no {@code Or} remains below an
 * {@code And}. {@link #toDNF} chains the whole pipeline:
 * </p>
 * <pre>{@code
 * toDNF(e) = nnfToDnf(simplify(toNNF(e)))
 * }</pre>
 * <p>
 * Simplifying before distributing removes redundant terms that distribution would otherwise duplicate.
 * </p>
 *
 * @author cyfko
 * @since 1.0.0
 */
public final class NormalFormConverter {

    private final BooleanSimplifier simplifier;

    /**
     * @param simplifier the simplifier applied between the NNF and DNF stages
     */
    public NormalFormConverter(BooleanSimplifier simplifier) {
        this.simplifier = Objects.requireNonNull(simplifier, "Simplifier is required");
    }

    /**
     * Converts an expression to negation normal form.
     *
     * @param expression any expression
     * @return an equivalent expression whose negations all sit directly above variables
     */
    public BooleanExpression toNNF(BooleanExpression expression) {
        Objects.requireNonNull(expression, "Expression is required");

        return switch (expression.type()) {
            case TRUE, FALSE, VARIABLE -> expression;
            case NOT -> negatedNNF(((Not) expression).operand());
            case OR -> {
                Or or = (Or) expression;
                yield new Or(toNNF(or.left()), toNNF(or.right()));
            }
            case AND -> {
                And and = (And) expression;
                yield new And(toNNF(and.left()), toNNF(and.right()));
            }
        };
    }

    /**
     * NNF of {@code Not(operand)}.
     */
    private BooleanExpression negatedNNF(BooleanExpression operand) {
        return switch (operand.type()) {
            case TRUE -> BooleanExpression.FALSE;
            case FALSE -> BooleanExpression.TRUE;
            case VARIABLE -> new Not(operand);
            case NOT -> toNNF(((Not) operand).operand());
            case OR -> {
                Or or = (Or) operand;
                yield new And(negatedNNF(or.left()), negatedNNF(or.right()));
            }
            case AND -> {
                And and = (And) operand;
                yield new Or(negatedNNF(and.left()), negatedNNF(and.right()));
            }
        };
    }

    /**
     * Converts an expression already in negation normal form to disjunctive normal form.
     * <p>
     * Literals and clauses are returned unchanged.
     * </p>
     *
     * @param expression an expression in NNF
     * @return an equivalent expression in DNF
     * @throws IllegalArgumentException if a negation is applied to something other than a variable
     */
    public BooleanExpression nnfToDnf(BooleanExpression expression) {
        Objects.requireNonNull(expression, "Expression is required");

        if (expression.isClause()) {
            return expression;
        }

        return switch (expression.type()) {
            case OR -> {
                Or or = (Or) expression;
                yield new Or(nnfToDnf(or.left()), nnfToDnf(or.right()));
            }
            case AND -> {
                And and = (And) expression;
                yield distribute(and.left(), and.right());
            }
            case NOT -> throw new IllegalArgumentException(
                "Expression is not in negation normal form: " + expression);
            // literals are clauses
            case TRUE, FALSE, VARIABLE -> expression;
        };
    }

    /**
     * Converts an expression to disjunctive normal form.
     *
     * @param expression any expression
     * @return an equivalent expression in DNF
     */
    public BooleanExpression toDNF(BooleanExpression expression) {
        return nnfToDnf(simplifier.simplify(toNNF(expression)));
    }

    /**
     * DNF of {@code And(a, b)}, a non-clause conjunction in NNF.
     */
    private BooleanExpression distribute(BooleanExpression a, BooleanExpression b) {
        // (x | y) & b → (x & b) | (y & b)
        if (a.type() == Type.OR) {
            Or or = (Or) a;
            return new Or(nnfToDnf(new And(or.left(), b)), nnfToDnf(new And(or.right(), b)));
        }

        // a & (x | y) → (a & x) | (a & y)
        if (b.type() == Type.OR) {
            Or or = (Or) b;
            return new Or(nnfToDnf(new And(a, or.left())), nnfToDnf(new And(a, or.right())));
        }

        if (a.isLiteral() && b.type() == Type.AND) {
            return redistribute(a, nnfToDnf(b));
        }

        if (b.isLiteral() && a.type() == Type.AND) {
            return redistribute(nnfToDnf(a), b);
        }

        return redistribute(nnfToDnf(a), nnfToDnf(b));
    }

    /**
     * Joins two operands already in DNF. A DNF operand that is not a disjunction is a literal or a conjunctive
     * clause, so the conjunction of two such operands is itself a clause.
     */
    private BooleanExpression redistribute(BooleanExpression a, BooleanExpression b) {
        And conjunction = new And(a, b);
        if (a.type() == Type.OR || b.type() == Type.OR) {
            return nnfToDnf(conjunction);
        }
        return conjunction;
    }
}
