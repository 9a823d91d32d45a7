package io.gqlextract.shopify.graphql.config;

/**
 * Configuration interface for extractor settings.
 *
 * <p>Abstracts configuration sources (system properties, maps handed over by an embedding
 * application, etc.) so the extractor can be driven from tests and from a host process alike.</p>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * ExtractorConfiguration config = new SystemPropertyConfiguration();
 * String store = config.get("shopify.extractor.store");
 * }</pre>
 *
 * @see ExtractorSettings for the recognised keys
 */
public interface ExtractorConfiguration {

    /**
     * Gets configuration value by key.
     *
     * @param key Configuration key
     * @return Configuration value or null if not found
     */
    String get(String key);

    /**
     * Gets configuration value by key with default fallback.
     *
     * @param key Configuration key
     * @param defaultValue Default value if key not found
     * @return Configuration value or default value
     */
    default String get(String key, String defaultValue) {
        String value = get(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Checks if configuration key exists.
     *
     * @param key Configuration key
     * @return true if key exists, false otherwise
     */
    default boolean has(String key) {
        return get(key) != null;
    }
}
