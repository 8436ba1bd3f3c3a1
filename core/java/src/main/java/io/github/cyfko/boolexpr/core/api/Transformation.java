package io.github.cyfko.boolexpr.core.api;

import io.github.cyfko.boolexpr.core.BooleanAlgebra;
import io.github.cyfko.boolexpr.core.model.BooleanExpression;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The rewrites a {@link TransformationService} exposes, each under a fixed endpoint name.
 *
 * @author cyfko
 * @since 1.0.0
 */
public enum Transformation {

    /** Disjunctive normal form, see {@link BooleanAlgebra#toDNF}. */
    DNF("DNF"),

    /** Negation normal form, see {@link BooleanAlgebra#toNNF}. */
    NNF("NNF"),

    /** Single-pass simplification, see {@link BooleanAlgebra#simplify}. */
    SIMPLIFY("simplify");

    private final String endpoint;

    Transformation(String endpoint) {
        this.endpoint = endpoint;
    }

    public String endpoint() {
        return endpoint;
    }

    /**
     * Applies this rewrite with the given engine.
     *
     * @param algebra the engine to use
     * @param expression the expression to rewrite
     * @return the rewritten expression
     */
    public BooleanExpression apply(BooleanAlgebra algebra, BooleanExpression expression) {
        return switch (this) {
            case DNF -> algebra.toDNF(expression);
            case NNF -> algebra.toNNF(expression);
            case SIMPLIFY -> algebra.simplify(expression);
        };
    }

    /**
     * Resolves an endpoint name. Matching is exact and case-sensitive.
     *
     * @param endpoint the endpoint name, may be null
     * @return the matching transformation, or empty
     */
    public static Optional<Transformation> fromEndpoint(String endpoint) {
        return Arrays.stream(values())
            .filter(t -> t.endpoint.equals(endpoint))
            .findFirst();
    }

    /**
     * @return all endpoint names, in declaration order
     */
    public static List<String> endpoints() {
        return Arrays.stream(values())
            .map(Transformation::endpoint)
            .collect(Collectors.toUnmodifiableList());
    }
}
