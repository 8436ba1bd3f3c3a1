package io.github.cyfko.boolexpr.core.model;

import java.util.Objects;

/**
 * Logical disjunction of two operands.
 *
 * @param left  the left operand
 * @param right the right operand
 * @since 1.0.0
 */
public record Or(BooleanExpression left, BooleanExpression right) implements BooleanExpression {

    public Or {
        Objects.requireNonNull(left, "Left operand of OR is required");
        Objects.requireNonNull(right, "Right operand of OR is required");
    }

    @Override
    public Type type() {
        return Type.OR;
    }

    @Override
    public String toString() {
        return InfixRenderer.render(this);
    }
}
