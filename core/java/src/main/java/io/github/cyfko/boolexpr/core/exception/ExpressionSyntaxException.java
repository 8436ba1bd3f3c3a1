package io.github.cyfko.boolexpr.core.exception;

import io.github.cyfko.boolexpr.core.parsing.JsonExpressionCodec;

/**
 * Exception thrown when a JSON document does not encode a boolean expression.
 * <p>
 * Two kinds of errors are reported with this exception and are indistinguishable to callers of the total
 * {@link JsonExpressionCodec#deserialize(String)} API:
 * </p>
 * <ul>
 *   <li><strong>JSON syntax errors:</strong> the text is not valid JSON at all (unbalanced brackets or braces,
 *       trailing content, empty input). The underlying Jackson exception is kept as cause.</li>
 *   <li><strong>Grammar violations:</strong> valid JSON of the wrong shape (wrong arity, unknown operator,
 *       reserved word used as a variable, numbers, objects or {@code null}).</li>
 * </ul>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * codec.parse("[\"AND\", \"OR\"]");
 * // → "Operator AND takes 2 operand(s), found 1 at $"
 *
 * codec.parse("[\"XOR\", \"p\", \"q\"]");
 * // → "Unknown operator 'XOR' at $[0]"
 *
 * codec.parse("[\"NOT\", \"p\"");
 * // → "Malformed JSON: Unexpected end-of-input ..."
 * }</pre>
 *
 * @author cyfko
 * @since 1.0.0
 * @see JsonExpressionCodec#parse(String)
 */
public class ExpressionSyntaxException extends RuntimeException {

    /**
     * @param message the message describing the error, including the JSON path when known
     */
    public ExpressionSyntaxException(String message) {
        super(message);
    }

    /**
     * @param message the message describing the error
     * @param cause   the original cause, typically a Jackson parsing exception
     */
    public ExpressionSyntaxException(String message, Throwable cause) {
        super(message, cause);
    }
}
