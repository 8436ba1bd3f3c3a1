package io.github.cyfko.boolexpr.core.parsing;

import java.util.Arrays;
import java.util.Optional;

/**
 * Operator tokens of the JSON expression grammar.
 * <p>
 * Tokens are recognized case-insensitively on input ({@code "not"}, {@code "Not"} and {@code "NOT"} are the
 * same operator) and always written upper-case on output. Because they are reserved, none of them may be used
 * as a variable name, whatever its case.
 * </p>
 *
 * @author cyfko
 * @since 1.0.0
 */
public enum OperatorToken {
    NOT(1),
    OR(2),
    AND(2);

    private final int arity;

    OperatorToken(int arity) {
        this.arity = arity;
    }

    /**
     * @return the number of operands the operator takes
     */
    public int arity() {
        return arity;
    }

    /**
     * @return the canonical (upper-case) token written by the serializer
     */
    public String token() {
        return name();
    }

    /**
     * Resolves a token, ignoring case.
     *
     * @param token the raw token, may be null
     * @return the matching operator, or empty if {@code token} is not an operator
     */
    public static Optional<OperatorToken> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(op -> op.name().equalsIgnoreCase(token))
            .findFirst();
    }

    /**
     * @param name a candidate variable name
     * @return true if {@code name} case-insensitively equals an operator token
     */
    public static boolean isReserved(String name) {
        return fromToken(name).isPresent();
    }
}
