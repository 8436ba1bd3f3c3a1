package io.github.cyfko.boolexpr.core.api;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.cyfko.boolexpr.core.model.BooleanExpression;

import java.util.Optional;

/**
 * Encodes expressions to, and decodes them from, their JSON interchange form.
 * <p>
 * The grammar is a LISP-like nesting of JSON arrays:
 * </p>
 * <pre>
 * expr      := literal | not-expr | or-expr | and-expr | "[" expr "]"
 * literal   := true | false | variable (a JSON string other than an operator token)
 * not-expr  := "[" "NOT" "," expr "]"
 * or-expr   := "[" "OR" "," expr "," expr "]"
 * and-expr  := "[" "AND" "," expr "," expr "]"
 * </pre>
 * <p>
 * Operator tokens are matched case-insensitively on input. A one-element array is equivalent to its sole element
 * on input but is never produced on output.
 * </p>
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@code deserialize(serialize(e))} equals {@code e} for every expression {@code e}</li>
 *   <li>{@code deserialize} is total: it never throws, any failure is reported as an empty {@code Optional}</li>
 * </ul>
 *
 * @author cyfko
 * @since 1.0.0
 */
public interface ExpressionCodec {

    /**
     * @param expression the expression to encode
     * @return the compact JSON text of the expression
     */
    String serialize(BooleanExpression expression);

    /**
     * @param expression the expression to encode
     * @return the JSON tree of the expression
     */
    JsonNode toJsonNode(BooleanExpression expression);

    /**
     * Decodes JSON text.
     *
     * @param json the JSON text, may be null
     * @return the decoded expression, or empty if the text is not valid JSON or does not follow the grammar
     */
    Optional<BooleanExpression> deserialize(String json);

    /**
     * Decodes an already parsed JSON tree.
     *
     * @param json the JSON tree, may be null
     * @return the decoded expression, or empty if the tree does not follow the grammar
     */
    Optional<BooleanExpression> deserialize(JsonNode json);
}
