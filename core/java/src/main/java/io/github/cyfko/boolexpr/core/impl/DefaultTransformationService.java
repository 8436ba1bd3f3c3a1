package io.github.cyfko.boolexpr.core.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.cyfko.boolexpr.core.BooleanAlgebra;
import io.github.cyfko.boolexpr.core.api.ExpressionCodec;
import io.github.cyfko.boolexpr.core.api.Transformation;
import io.github.cyfko.boolexpr.core.api.TransformationService;
import io.github.cyfko.boolexpr.core.cache.BoundedLRUCache;
import io.github.cyfko.boolexpr.core.config.CachePolicy;
import io.github.cyfko.boolexpr.core.model.BooleanExpression;

import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Default {@link TransformationService}, backed by a {@link BooleanAlgebra} and an {@link ExpressionCodec}.
 *
 * <h2>Caching</h2>
 * <p>
 * Text requests are cached in a {@link BoundedLRUCache}:
 * </p>
 * <ul>
 *   <li><strong>Cache Key</strong>: endpoint name and input text, e.g. {@code DNF:["NOT","x"]}</li>
 *   <li><strong>Cache Value</strong>: the serialized result</li>
 *   <li><strong>Failures</strong>: never cached, {@value TransformationService#MALFORMED_JSON} is recomputed</li>
 *   <li><strong>Configurable</strong>: enable, disable or size it via {@link CachePolicy}</li>
 * </ul>
 * <p>
 * Tree requests bypass the cache.
 * </p>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * // Default engine, default cache
 * TransformationService service = new DefaultTransformationService();
 *
 * // Strict limits for public input, no cache
 * TransformationService strict = new DefaultTransformationService(
 *     BooleanAlgebra.of(EnginePolicy.strict()), CachePolicy.none());
 * }</pre>
 *
 * @author cyfko
 * @since 1.0.0
 */
public class DefaultTransformationService implements TransformationService {

    private static final Logger log = Logger.getLogger(DefaultTransformationService.class.getName());

    private static final TextNode MALFORMED_JSON_NODE = TextNode.valueOf("Malformed JSON");

    private final BooleanAlgebra algebra;
    private final ExpressionCodec codec;
    private final CachePolicy cachePolicy;
    protected final BoundedLRUCache<String, String> cache;

    /**
     * Service over {@link BooleanAlgebra#defaults()} with {@link CachePolicy#defaults()}.
     */
    public DefaultTransformationService() {
        this(BooleanAlgebra.defaults(), CachePolicy.defaults());
    }

    /**
     * Service over the given engine, decoding with the engine's own codec.
     *
     * @param algebra the engine
     * @param cachePolicy the cache policy settings
     * @throws IllegalArgumentException if an argument is null
     */
    public DefaultTransformationService(BooleanAlgebra algebra, CachePolicy cachePolicy) {
        this(algebra, algebra == null ? null : algebra.codec(), cachePolicy);
    }

    /**
     * @param algebra the engine
     * @param codec the codec for input and output
     * @param cachePolicy the cache policy settings
     * @throws IllegalArgumentException if an argument is null
     */
    public DefaultTransformationService(BooleanAlgebra algebra, ExpressionCodec codec, CachePolicy cachePolicy) {
        if (algebra == null) {
            throw new IllegalArgumentException("Boolean algebra is required");
        }

        if (codec == null) {
            throw new IllegalArgumentException("Expression codec is required");
        }

        if (cachePolicy == null) {
            throw new IllegalArgumentException("Cache policy is required");
        }

        this.algebra = algebra;
        this.codec = codec;
        this.cachePolicy = cachePolicy;
        this.cache = cachePolicy.cacheEnabled()
            ? new BoundedLRUCache<>(cachePolicy.cacheSize())
            : null;
    }

    @Override
    public String transform(String json, Transformation transformation) {
        if (transformation == null) {
            throw new IllegalArgumentException("Transformation is required");
        }

        if (cache == null || json == null) {
            return compute(json, transformation).orElse(MALFORMED_JSON);
        }

        String key = transformation.endpoint() + ":" + json;
        String result = cache.computeIfAbsent(key, k -> {
            log.finest(() -> "Cache miss for " + k);
            return compute(json, transformation).orElse(null);
        });
        return result != null ? result : MALFORMED_JSON;
    }

    @Override
    public JsonNode transform(JsonNode json, Transformation transformation) {
        if (transformation == null) {
            throw new IllegalArgumentException("Transformation is required");
        }

        return codec.deserialize(json)
            .map(expression -> codec.toJsonNode(transformation.apply(algebra, expression)))
            .orElse(MALFORMED_JSON_NODE);
    }

    /**
     * Clears the result cache (if enabled).
     */
    public void clearCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    /**
     * Returns cache statistics (if caching is enabled).
     *
     * @return map containing cache statistics or {@code enabled=false} if the cache is disabled
     */
    public Map<String, Object> getCacheStats() {
        if (cache == null) {
            return Map.of("enabled", false);
        }

        return Map.of(
            "enabled", true,
            "size", cache.size(),
            "maxSize", cachePolicy.cacheSize(),
            "hits", cache.getHits(),
            "misses", cache.getMisses()
        );
    }

    private Optional<String> compute(String json, Transformation transformation) {
        long start = System.nanoTime();

        Optional<BooleanExpression> input = codec.deserialize(json);
        if (input.isEmpty()) {
            return Optional.empty();
        }

        String output = codec.serialize(transformation.apply(algebra, input.get()));

        log.fine(() -> String.format("%s computed in %.3f ms (%d → %d characters)",
            transformation.endpoint(), (System.nanoTime() - start) / 1_000_000.0, json.length(), output.length()));
        return Optional.of(output);
    }
}
