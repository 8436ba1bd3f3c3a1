package io.github.cyfko.boolexpr.core.model;

/**
 * The boolean constant {@code false}. Prefer the shared {@link BooleanExpression#FALSE} instance.
 *
 * @since 1.0.0
 */
public record False() implements BooleanExpression {

    @Override
    public Type type() {
        return Type.FALSE;
    }

    @Override
    public String toString() {
        return InfixRenderer.render(this);
    }
}
