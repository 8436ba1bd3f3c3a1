package io.github.cyfko.boolexpr.core.model;

import io.github.cyfko.boolexpr.core.parsing.OperatorToken;

import java.util.Objects;

/**
 * A named propositional atom.
 * <p>
 * Names are case-sensitive ({@code "p"} and {@code "P"} are distinct variables) and may not collide,
 * case-insensitively, with an operator token of the JSON grammar ({@code NOT}, {@code OR}, {@code AND}).
 * </p>
 *
 * @param name the variable name
 * @since 1.0.0
 */
public record Variable(String name) implements BooleanExpression {

    /**
     * @throws NullPointerException if name is null
     * @throws IllegalArgumentException if name is a reserved operator token
     */
    public Variable {
        Objects.requireNonNull(name, "Variable name is required");
        if (OperatorToken.isReserved(name)) {
            throw new IllegalArgumentException("'" + name + "' is a reserved operator token and cannot name a variable");
        }
    }

    @Override
    public Type type() {
        return Type.VARIABLE;
    }

    @Override
    public String toString() {
        return InfixRenderer.render(this);
    }
}
