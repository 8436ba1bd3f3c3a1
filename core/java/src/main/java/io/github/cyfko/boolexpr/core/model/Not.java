package io.github.cyfko.boolexpr.core.model;

import java.util.Objects;

/**
 * Logical negation of an operand.
 *
 * @param operand the negated expression
 * @since 1.0.0
 */
public record Not(BooleanExpression operand) implements BooleanExpression {

    public Not {
        Objects.requireNonNull(operand, "Negated operand is required");
    }

    @Override
    public Type type() {
        return Type.NOT;
    }

    @Override
    public String toString() {
        return InfixRenderer.render(this);
    }
}
