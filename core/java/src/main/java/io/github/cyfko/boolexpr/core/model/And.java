package io.github.cyfko.boolexpr.core.model;

import java.util.Objects;

/**
 * Logical conjunction of two operands.
 *
 * @param left  the left operand
 * @param right the right operand
 * @since 1.0.0
 */
public record And(BooleanExpression left, BooleanExpression right) implements BooleanExpression {

    public And {
        Objects.requireNonNull(left, "Left operand of AND is required");
        Objects.requireNonNull(right, "Right operand of AND is required");
    }

    @Override
    public Type type() {
        return Type.AND;
    }

    @Override
    public String toString() {
        return InfixRenderer.render(this);
    }
}
