package io.github.cyfko.boolexpr.core.model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.LongStream;
import java.util.stream.Stream;

/**
 * An assignment of truth values to variable names.
 * <p>
 * Instances are immutable: {@link #with(String, boolean)} returns a new interpretation. Keys are unique and
 * neither names nor values may be {@code null}.
 * </p>
 *
 * <h2>Exhaustive enumeration</h2>
 * <p>
 * {@link #allOver(Set)} lazily produces the {@code 2^k} interpretations over {@code k} variables, in binary
 * counting order over the sorted names (the first interpretation maps every variable to {@code false}).
 * The count is exponential: callers are expected to bound {@code k}.
 * </p>
 *
 * @param values the variable assignment
 * @author cyfko
 * @since 1.0.0
 */
public record Interpretation(Map<String, Boolean> values) {

    /**
     * Largest variable count {@link #allOver(Set)} can enumerate.
     */
    public static final int MAX_ENUMERABLE_VARIABLES = 62;

    private static final Interpretation EMPTY = new Interpretation(Map.of());

    /**
     * @throws NullPointerException if values, or any of its keys or values, is null
     */
    public Interpretation {
        Objects.requireNonNull(values, "Interpretation values are required");
        values = Map.copyOf(values);
    }

    public static Interpretation empty() {
        return EMPTY;
    }

    public static Interpretation of(Map<String, Boolean> values) {
        return new Interpretation(values);
    }

    /**
     * Returns a copy of this interpretation where {@code name} is bound to {@code value}.
     *
     * @param name  the variable name
     * @param value the truth value
     * @return a new interpretation
     */
    public Interpretation with(String name, boolean value) {
        Objects.requireNonNull(name, "Variable name is required");
        Map<String, Boolean> copy = new HashMap<>(values);
        copy.put(name, value);
        return new Interpretation(copy);
    }

    /**
     * @param name the variable name
     * @return the value bound to {@code name}, or empty if unbound
     */
    public Optional<Boolean> valueOf(String name) {
        return Optional.ofNullable(values.get(name));
    }

    /**
     * @return the names bound by this interpretation
     */
    public Set<String> variables() {
        return values.keySet();
    }

    /**
     * Enumerates every interpretation over the given variables.
     *
     * @param variables the variable names to assign
     * @return a lazy stream of {@code 2^variables.size()} interpretations
     * @throws IllegalArgumentException if more than {@value #MAX_ENUMERABLE_VARIABLES} variables are given
     */
    public static Stream<Interpretation> allOver(Set<String> variables) {
        Objects.requireNonNull(variables, "Variables are required");
        if (variables.size() > MAX_ENUMERABLE_VARIABLES) {
            throw new IllegalArgumentException(String.format(
                "Cannot enumerate interpretations over %d variables (max: %d)",
                variables.size(), MAX_ENUMERABLE_VARIABLES));
        }

        List<String> names = new ArrayList<>(new TreeSet<>(variables));
        long count = 1L << names.size();
        return LongStream.range(0, count).mapToObj(mask -> fromMask(names, mask));
    }

    private static Interpretation fromMask(List<String> names, long mask) {
        Map<String, Boolean> assignment = new HashMap<>(names.size() * 2);
        // the last name is the least significant bit
        for (int i = 0; i < names.size(); i++) {
            int shift = names.size() - 1 - i;
            assignment.put(names.get(i), ((mask >>> shift) & 1L) == 1L);
        }
        return new Interpretation(assignment);
    }
}
