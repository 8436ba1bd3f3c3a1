package io.github.cyfko.boolexpr.core.model;

/**
 * The boolean constant {@code true}. Prefer the shared {@link BooleanExpression#TRUE} instance.
 *
 * @since 1.0.0
 */
public record True() implements BooleanExpression {

    @Override
    public Type type() {
        return Type.TRUE;
    }

    @Override
    public String toString() {
        return InfixRenderer.render(this);
    }
}
