package io.github.cyfko.boolexpr.core.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.cyfko.boolexpr.core.BooleanAlgebra;
import io.github.cyfko.boolexpr.core.api.ExpressionCodec;
import io.github.cyfko.boolexpr.core.api.Transformation;
import io.github.cyfko.boolexpr.core.api.TransformationService;
import io.github.cyfko.boolexpr.core.config.CachePolicy;
import io.github.cyfko.boolexpr.core.config.EnginePolicy;
import io.github.cyfko.boolexpr.core.model.BooleanExpression;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static io.github.cyfko.boolexpr.core.model.BooleanExpression.and;
import static io.github.cyfko.boolexpr.core.model.BooleanExpression.not;
import static io.github.cyfko.boolexpr.core.model.BooleanExpression.or;
import static io.github.cyfko.boolexpr.core.model.BooleanExpression.variable;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("DefaultTransformationService Tests")
class DefaultTransformationServiceTest {

    private static final String MALFORMED = "\"Malformed JSON\"";

    @Nested
    @DisplayName("Request pipeline")
    class Pipeline {

        private final DefaultTransformationService service = new DefaultTransformationService();

        @Test
        @DisplayName("Should convert to DNF")
        void shouldConvertToDnf() {
            assertEquals("[\"OR\",[\"AND\",\"p\",\"r\"],[\"AND\",\"q\",\"r\"]]",
                service.transform("[\"AND\", [\"OR\", \"p\", \"q\"], \"r\"]", Transformation.DNF));
        }

        @Test
        @DisplayName("Should convert to NNF")
        void shouldConvertToNnf() {
            assertEquals("[\"AND\",[\"NOT\",\"x\"],[\"NOT\",\"y\"]]",
                service.transform("[\"NOT\", [\"OR\", \"x\", \"y\"]]", Transformation.NNF));
        }

        @Test
        @DisplayName("Should simplify")
        void shouldSimplify() {
            assertEquals("true", service.transform("[\"OR\", \"p\", true]", Transformation.SIMPLIFY));
            assertEquals("\"q\"", service.transform("[\"or\", [\"AND\", \"p\", false], [\"q\"]]", Transformation.SIMPLIFY));
        }

        @ParameterizedTest
        @EnumSource(Transformation.class)
        @DisplayName("Should answer Malformed JSON for undecodable input on every endpoint")
        void shouldAnswerMalformedJson(Transformation transformation) {
            assertEquals(MALFORMED, TransformationService.MALFORMED_JSON);
            assertEquals(MALFORMED, service.transform("[\"AND\", \"OR\"]", transformation));
            assertEquals(MALFORMED, service.transform("[\"NOT\", \"x\"", transformation));
            assertEquals(MALFORMED, service.transform((String) null, transformation));
        }

        @Test
        @DisplayName("Should route by endpoint name")
        void shouldRouteByEndpoint() {
            assertEquals(Optional.of("[\"NOT\",\"x\"]"), service.transform("[\"NOT\", [\"NOT\", [\"NOT\", \"x\"]]]", "NNF"));
            assertEquals(Optional.of(MALFORMED), service.transform("{}", "simplify"));
            assertEquals(Optional.empty(), service.transform("true", "CNF"));
            assertEquals(Optional.empty(), service.transform("true", "dnf"));
        }

        @Test
        @DisplayName("Should transform JSON trees")
        void shouldTransformTrees() throws Exception {
            ObjectMapper mapper = new ObjectMapper();

            JsonNode result = service.transform(mapper.readTree("[\"NOT\", [\"AND\", \"x\", true]]"), Transformation.DNF);
            JsonNode malformed = service.transform(mapper.readTree("[\"NOT\"]"), Transformation.DNF);

            assertEquals(mapper.readTree("[\"NOT\",\"x\"]"), result);
            assertEquals(TextNode.valueOf("Malformed JSON"), malformed);
        }

        @Test
        @DisplayName("Should require a transformation")
        void shouldRequireTransformation() {
            assertThrows(IllegalArgumentException.class, () -> service.transform("true", (Transformation) null));
        }
    }

    @Nested
    @DisplayName("Caching")
    @ExtendWith(MockitoExtension.class)
    class Caching {

        @Mock
        private ExpressionCodec codec;

        private final BooleanExpression x = variable("x");

        private DefaultTransformationService service;

        @BeforeEach
        void setUp() {
            service = new DefaultTransformationService(BooleanAlgebra.defaults(), codec, CachePolicy.custom(2));
        }

        @Test
        @DisplayName("Should serve repeated requests from the cache")
        void shouldServeFromCache() {
            // Given
            when(codec.deserialize("[\"NOT\",[\"NOT\",\"x\"]]")).thenReturn(Optional.of(not(not(x))));
            when(codec.serialize(x)).thenReturn("\"x\"");

            // When
            String first = service.transform("[\"NOT\",[\"NOT\",\"x\"]]", Transformation.SIMPLIFY);
            String second = service.transform("[\"NOT\",[\"NOT\",\"x\"]]", Transformation.SIMPLIFY);

            // Then
            assertEquals("\"x\"", first);
            assertEquals("\"x\"", second);
            verify(codec, times(1)).deserialize("[\"NOT\",[\"NOT\",\"x\"]]");
            verify(codec, times(1)).serialize(x);
            assertEquals(Map.of("enabled", true, "size", 1, "maxSize", 2, "hits", 1L, "misses", 1L),
                service.getCacheStats());
        }

        @Test
        @DisplayName("Should key the cache by transformation and input")
        void shouldKeyByTransformation() {
            // Given
            BooleanExpression expression = not(or(x, x));
            when(codec.deserialize("e")).thenReturn(Optional.of(expression));
            when(codec.serialize(any())).thenReturn("nnf", "simplified");

            // When
            String nnf = service.transform("e", Transformation.NNF);
            String simplified = service.transform("e", Transformation.SIMPLIFY);

            // Then
            assertEquals("nnf", nnf);
            assertEquals("simplified", simplified);
            verify(codec).serialize(and(not(x), not(x)));
            verify(codec).serialize(not(x));
            verify(codec, times(2)).deserialize("e");
        }

        @Test
        @DisplayName("Should answer cached requests while another request is being computed")
        void shouldNotBlockOnSlowRequests() throws Exception {
            // Given
            CountDownLatch computing = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            when(codec.deserialize("x")).thenReturn(Optional.of(x));
            when(codec.serialize(x)).thenReturn("\"x\"");
            when(codec.deserialize("slow")).thenAnswer(invocation -> {
                computing.countDown();
                release.await();
                return Optional.of(x);
            });
            service.transform("x", Transformation.NNF);
            ExecutorService executor = Executors.newSingleThreadExecutor();

            try {
                Future<String> slow = executor.submit(() -> service.transform("slow", Transformation.NNF));
                assertTrue(computing.await(5, TimeUnit.SECONDS));

                // When / Then
                assertTimeoutPreemptively(Duration.ofSeconds(5),
                    () -> assertEquals("\"x\"", service.transform("x", Transformation.NNF)));

                release.countDown();
                assertEquals("\"x\"", slow.get(5, TimeUnit.SECONDS));
            } finally {
                release.countDown();
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("Should not cache failures")
        void shouldNotCacheFailures() {
            // Given
            when(codec.deserialize("bad")).thenReturn(Optional.empty());

            // When
            service.transform("bad", Transformation.DNF);
            String second = service.transform("bad", Transformation.DNF);

            // Then
            assertEquals(MALFORMED, second);
            verify(codec, times(2)).deserialize("bad");
            verify(codec, never()).serialize(any());
            assertEquals(0, service.getCacheStats().get("size"));
        }

        @Test
        @DisplayName("Should recompute after clearing the cache")
        void shouldRecomputeAfterClear() {
            // Given
            when(codec.deserialize("x")).thenReturn(Optional.of(x));
            when(codec.serialize(x)).thenReturn("\"x\"");
            service.transform("x", Transformation.NNF);

            // When
            service.clearCache();
            service.transform("x", Transformation.NNF);

            // Then
            verify(codec, times(2)).deserialize("x");
        }

        @Test
        @DisplayName("Should bypass the cache for JSON trees")
        void shouldBypassCacheForTrees() {
            // Given
            JsonNode tree = TextNode.valueOf("x");
            when(codec.deserialize(tree)).thenReturn(Optional.of(x));
            when(codec.toJsonNode(x)).thenReturn(tree);

            // When
            service.transform(tree, Transformation.DNF);
            service.transform(tree, Transformation.DNF);

            // Then
            verify(codec, times(2)).deserialize(tree);
            assertEquals(0, service.getCacheStats().get("size"));
        }
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("Should work without cache")
        void shouldWorkWithoutCache() {
            DefaultTransformationService service = new DefaultTransformationService(
                BooleanAlgebra.of(EnginePolicy.strict()), CachePolicy.none());

            assertEquals("[\"NOT\",\"p\"]", service.transform("[\"NOT\", \"p\"]", Transformation.DNF));
            assertEquals(Map.of("enabled", false), service.getCacheStats());
            service.clearCache();
        }

        @Test
        @DisplayName("Should enforce the engine input limits")
        void shouldEnforceEngineLimits() {
            DefaultTransformationService service = new DefaultTransformationService(
                BooleanAlgebra.of(EnginePolicy.builder().maxInputLength(10).build()), CachePolicy.defaults());

            assertEquals(MALFORMED, service.transform("[\"NOT\", \"long\"]", Transformation.NNF));
        }

        @Test
        @DisplayName("Should reject missing collaborators")
        void shouldRejectNullArguments() {
            BooleanAlgebra algebra = BooleanAlgebra.defaults();

            assertThrows(IllegalArgumentException.class, () -> new DefaultTransformationService(null, CachePolicy.none()));
            assertThrows(IllegalArgumentException.class, () -> new DefaultTransformationService(algebra, null));
            assertThrows(IllegalArgumentException.class,
                () -> new DefaultTransformationService(algebra, null, CachePolicy.none()));
        }
    }
}
