package io.github.cyfko.boolexpr.core.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Decode, rewrite and encode pipeline over the JSON expression grammar.
 * <p>
 * This is the contract an HTTP front end exposes: the request body is decoded with an {@link ExpressionCodec},
 * rewritten by the requested {@link Transformation}, and encoded back. Input that cannot be decoded yields the
 * JSON string {@value #MALFORMED_JSON}, whatever the transformation.
 * </p>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * TransformationService service = new DefaultTransformationService();
 *
 * service.transform("[\"NOT\", [\"OR\", \"x\", \"y\"]]", Transformation.NNF);
 * // ["AND",["NOT","x"],["NOT","y"]]
 *
 * service.transform("[\"AND\", \"OR\"]", Transformation.DNF);
 * // "Malformed JSON"
 *
 * service.transform("true", "CNF");
 * // Optional.empty
 * }</pre>
 *
 * @author cyfko
 * @since 1.0.0
 */
public interface TransformationService {

    /**
     * The JSON text returned for undecodable input, quotes included.
     */
    String MALFORMED_JSON = "\"Malformed JSON\"";

    /**
     * @param json the JSON text of an expression
     * @param transformation the rewrite to apply
     * @return the compact JSON text of the rewritten expression, or {@link #MALFORMED_JSON}
     */
    String transform(String json, Transformation transformation);

    /**
     * Tree variant of {@link #transform(String, Transformation)}.
     *
     * @param json the JSON tree of an expression
     * @param transformation the rewrite to apply
     * @return the JSON tree of the rewritten expression, or the text node {@code "Malformed JSON"}
     */
    JsonNode transform(JsonNode json, Transformation transformation);

    /**
     * Routes by endpoint name.
     *
     * @param json the JSON text of an expression
     * @param endpoint an endpoint name as listed by {@link Transformation#endpoints()}
     * @return the result of {@link #transform(String, Transformation)}, or empty if the endpoint is unknown
     */
    default Optional<String> transform(String json, String endpoint) {
        return Transformation.fromEndpoint(endpoint).map(t -> transform(json, t));
    }
}
