package io.github.cyfko.boolexpr.core.parsing;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.github.cyfko.boolexpr.core.api.ExpressionCodec;
import io.github.cyfko.boolexpr.core.config.EnginePolicy;
import io.github.cyfko.boolexpr.core.exception.ExpressionSyntaxException;
import io.github.cyfko.boolexpr.core.model.And;
import io.github.cyfko.boolexpr.core.model.BooleanExpression;
import io.github.cyfko.boolexpr.core.model.Not;
import io.github.cyfko.boolexpr.core.model.Or;
import io.github.cyfko.boolexpr.core.model.Variable;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Jackson-based implementation of the JSON expression grammar.
 *
 * <h2>Decoding</h2>
 * <p>
 * Decoding runs in two phases:
 * </p>
 * <ol>
 *   <li><strong>Phase 1</strong>: the text is parsed into a Jackson {@link JsonNode} tree. Invalid JSON, trailing
 *       content after the first value and empty input are syntax errors.</li>
 *   <li><strong>Phase 2</strong>: the tree is decoded by recursive descent. Each rejected node is reported with
 *       its JSON path, e.g. {@code $[2][0]}.</li>
 * </ol>
 * <p>
 * {@link #parse(String)} reports errors as {@link ExpressionSyntaxException}; {@link #deserialize(String)} is the
 * total variant returning an empty {@code Optional} instead.
 * </p>
 *
 * <h2>DoS Protection</h2>
 * <p>
 * Inputs longer than {@link EnginePolicy#maxInputLength()} characters or nested deeper than
 * {@link EnginePolicy#maxNestingDepth()} arrays are rejected.
 * </p>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * JsonExpressionCodec codec = new JsonExpressionCodec();
 *
 * codec.deserialize("[\"OR\", \"x\", [\"NOT\", \"y\"]]"); // Optional[(x ∨ ¬y)]
 * codec.deserialize("[\"AND\", \"OR\"]");                // Optional.empty
 *
 * codec.serialize(or(variable("x"), not(variable("y")))); // ["OR","x",["NOT","y"]]
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe.</p>
 *
 * @author cyfko
 * @since 1.0.0
 */
public class JsonExpressionCodec implements ExpressionCodec {

    private static final Logger log = Logger.getLogger(JsonExpressionCodec.class.getName());

    private static final String ROOT_PATH = "$";

    private final EnginePolicy enginePolicy;
    private final ObjectMapper mapper;

    /**
     * Codec using {@link EnginePolicy#defaults()}.
     */
    public JsonExpressionCodec() {
        this(EnginePolicy.defaults());
    }

    /**
     * @param enginePolicy the input limits to enforce
     */
    public JsonExpressionCodec(EnginePolicy enginePolicy) {
        this.enginePolicy = Objects.requireNonNull(enginePolicy, "Engine policy is required");

        // one extra level so that the depth error below, which carries the JSON path, is the one reported
        JsonFactory factory = JsonFactory.builder()
            .streamReadConstraints(StreamReadConstraints.builder()
                .maxNestingDepth(enginePolicy.maxNestingDepth() + 1)
                .build())
            .build();

        this.mapper = JsonMapper.builder(factory)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();
    }

    @Override
    public String serialize(BooleanExpression expression) {
        try {
            return mapper.writeValueAsString(toJsonNode(expression));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot write expression as JSON: " + expression, e);
        }
    }

    @Override
    public JsonNode toJsonNode(BooleanExpression expression) {
        Objects.requireNonNull(expression, "Expression is required");
        JsonNodeFactory nodes = mapper.getNodeFactory();

        return switch (expression.type()) {
            case TRUE -> nodes.booleanNode(true);
            case FALSE -> nodes.booleanNode(false);
            case VARIABLE -> nodes.textNode(((Variable) expression).name());
            case NOT -> nodes.arrayNode()
                .add(OperatorToken.NOT.token())
                .add(toJsonNode(((Not) expression).operand()));
            case OR -> {
                Or or = (Or) expression;
                yield operatorNode(nodes, OperatorToken.OR, or.left(), or.right());
            }
            case AND -> {
                And and = (And) expression;
                yield operatorNode(nodes, OperatorToken.AND, and.left(), and.right());
            }
        };
    }

    @Override
    public Optional<BooleanExpression> deserialize(String json) {
        try {
            return Optional.of(parse(json));
        } catch (ExpressionSyntaxException e) {
            log.fine(() -> "Rejected JSON expression: " + e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<BooleanExpression> deserialize(JsonNode json) {
        try {
            return Optional.of(parse(json));
        } catch (ExpressionSyntaxException e) {
            log.fine(() -> "Rejected JSON expression: " + e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Decodes JSON text, reporting why it was rejected.
     *
     * @param json the JSON text
     * @return the decoded expression
     * @throws ExpressionSyntaxException if the text is null, too long, not valid JSON, or does not follow the
     *                                   grammar
     */
    public BooleanExpression parse(String json) throws ExpressionSyntaxException {
        if (json == null) {
            throw new ExpressionSyntaxException("JSON input cannot be null");
        }

        if (json.length() > enginePolicy.maxInputLength()) {
            throw new ExpressionSyntaxException(String.format(
                "Input too long: %d characters (max: %d)", json.length(), enginePolicy.maxInputLength()));
        }

        // Phase 1: JSON syntax
        JsonNode tree;
        try {
            tree = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ExpressionSyntaxException("Malformed JSON: " + e.getOriginalMessage(), e);
        }

        // Phase 2: expression grammar
        return parse(tree);
    }

    /**
     * Decodes a JSON tree, reporting why it was rejected.
     *
     * @param json the JSON tree
     * @return the decoded expression
     * @throws ExpressionSyntaxException if the tree is null, missing, too deep, or does not follow the grammar
     */
    public BooleanExpression parse(JsonNode json) throws ExpressionSyntaxException {
        if (json == null || json.isMissingNode()) {
            throw new ExpressionSyntaxException("JSON document is empty");
        }
        return decode(json, ROOT_PATH, 0);
    }

    private BooleanExpression decode(JsonNode node, String path, int depth) {
        if (depth > enginePolicy.maxNestingDepth()) {
            throw new ExpressionSyntaxException(String.format(
                "Nesting too deep at %s (max: %d)", path, enginePolicy.maxNestingDepth()));
        }

        if (node.isBoolean()) {
            return BooleanExpression.constant(node.booleanValue());
        }

        if (node.isTextual()) {
            return decodeVariable(node.textValue(), path);
        }

        if (node.isArray()) {
            return decodeArray((ArrayNode) node, path, depth);
        }

        throw new ExpressionSyntaxException(String.format(
            "Unexpected JSON %s at %s", describe(node), path));
    }

    private BooleanExpression decodeVariable(String name, String path) {
        if (OperatorToken.isReserved(name)) {
            throw new ExpressionSyntaxException(String.format(
                "Operator token '%s' cannot be used as a variable at %s", name, path));
        }
        return new Variable(name);
    }

    private BooleanExpression decodeArray(ArrayNode array, String path, int depth) {
        int size = array.size();

        // redundant wrapping: [expr] is expr
        if (size == 1) {
            return decode(array.get(0), path + "[0]", depth + 1);
        }

        if (size != 2 && size != 3) {
            throw new ExpressionSyntaxException(String.format(
                "Expected an operator followed by 1 or 2 operands at %s, found %d element(s)", path, size));
        }

        JsonNode head = array.get(0);
        if (!head.isTextual()) {
            throw new ExpressionSyntaxException(String.format(
                "Expected an operator token at %s[0], found %s", path, describe(head)));
        }

        OperatorToken operator = OperatorToken.fromToken(head.textValue())
            .orElseThrow(() -> new ExpressionSyntaxException(String.format(
                "Unknown operator '%s' at %s[0]", head.textValue(), path)));

        if (operator.arity() != size - 1) {
            throw new ExpressionSyntaxException(String.format(
                "Operator %s takes %d operand(s), found %d at %s",
                operator.token(), operator.arity(), size - 1, path));
        }

        return switch (operator) {
            case NOT -> new Not(decode(array.get(1), path + "[1]", depth + 1));
            case OR -> new Or(
                decode(array.get(1), path + "[1]", depth + 1),
                decode(array.get(2), path + "[2]", depth + 1));
            case AND -> new And(
                decode(array.get(1), path + "[1]", depth + 1),
                decode(array.get(2), path + "[2]", depth + 1));
        };
    }

    private JsonNode operatorNode(JsonNodeFactory nodes, OperatorToken operator,
                                  BooleanExpression left, BooleanExpression right) {
        ArrayNode array = nodes.arrayNode();
        array.add(operator.token());
        array.add(toJsonNode(left));
        array.add(toJsonNode(right));
        return array;
    }

    private static String describe(JsonNode node) {
        return node.getNodeType().name().toLowerCase(Locale.ROOT);
    }
}
