package io.github.cyfko.boolexpr.core.config;

/**
 * Caching strategy of the transformation service.
 * <p>
 * Transformations are pure, so a result computed for a given JSON document and transformation can be served
 * again without recomputing it. Only successful transformations are cached.
 * </p>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * CachePolicy.defaults();   // enabled, 1000 entries
 * CachePolicy.strict();     // enabled, 500 entries
 * CachePolicy.relaxed();    // enabled, 2000 entries
 * CachePolicy.none();       // disabled
 * CachePolicy.custom(5000); // enabled, 5000 entries
 * }</pre>
 *
 * @param cacheEnabled whether results are cached
 * @param cacheSize    maximum number of cached results
 * @author cyfko
 * @since 1.0.0
 */
public record CachePolicy(
        boolean cacheEnabled,
        int cacheSize
) {

    /**
     * Canonical constructor with validation.
     */
    public CachePolicy {
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("cacheSize must be positive, got: " + cacheSize);
        }
    }

    /**
     * @return cache enabled with 1000 entries
     */
    public static CachePolicy defaults() {
        return new CachePolicy(true, 1000);
    }

    /**
     * Smaller cache for services exposed to untrusted clients, where distinct inputs are cheap to forge.
     *
     * @return cache enabled with 500 entries
     */
    public static CachePolicy strict() {
        return new CachePolicy(true, 500);
    }

    /**
     * @return cache enabled with 2000 entries
     */
    public static CachePolicy relaxed() {
        return new CachePolicy(true, 2000);
    }

    /**
     * Caching completely disabled; the size is unused.
     *
     * @return a CachePolicy with caching disabled
     */
    public static CachePolicy none() {
        return new CachePolicy(false, 1);
    }

    public static CachePolicy custom(int cacheSize) {
        return new CachePolicy(true, cacheSize);
    }
}
