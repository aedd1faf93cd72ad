package io.github.cyfko.phraseql.core.config;

/**
 * Configuration of the compiled-formula cache held by the engine.
 * <p>
 * A file scan compiles its formula once, but an editor that validates on demand or a service
 * receiving the same formulas repeatedly benefits from reusing earlier compilations.
 * </p>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * CachePolicy.defaults();   // enabled, 256 entries
 * CachePolicy.strict();     // enabled, 64 entries
 * CachePolicy.relaxed();    // enabled, 1024 entries
 * CachePolicy.none();       // disabled
 * CachePolicy.custom(500);  // enabled, 500 entries
 * }</pre>
 *
 * @param cacheEnabled whether compiled formulas are cached
 * @param cacheSize    maximum number of cached formulas
 * @since 1.0
 */
public record CachePolicy(
        boolean cacheEnabled,
        int cacheSize
) {

    public CachePolicy {
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("cacheSize must be positive, got: " + cacheSize);
        }
    }

    public static CachePolicy defaults() {
        return new CachePolicy(true, 256);
    }

    public static CachePolicy strict() {
        return new CachePolicy(true, 64);
    }

    public static CachePolicy relaxed() {
        return new CachePolicy(true, 1024);
    }

    /**
     * Caching disabled; every call compiles from scratch.
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
