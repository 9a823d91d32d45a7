package io.gqlextract.shopify.graphql.typemapper;

import io.gqlextract.shopify.graphql.PropertyType;

/**
 * Interface for mapping GraphQL scalar type names to record property types.
 *
 * <p><b>Example mappings:</b></p>
 * <ul>
 *   <li>Int → INTEGER</li>
 *   <li>DateTime → TIMESTAMP</li>
 *   <li>Money, ID, URL → STRING (fallback)</li>
 * </ul>
 */
public interface ScalarTypeMapper {

    /**
     * Checks if this mapper can handle the given scalar.
     *
     * @param scalarName GraphQL scalar name (e.g., "Int", "DateTime")
     * @return true if this mapper can handle this scalar
     */
    boolean canHandle(String scalarName);

    /**
     * Maps the scalar to a property type.
     *
     * @param scalarName GraphQL scalar name
     * @return property type
     */
    PropertyType mapType(String scalarName);

    /**
     * Returns mapper priority for chain ordering.
     * Lower values are checked first (specific mappers before generic).
     *
     * @return priority value (default: 50)
     */
    default int getPriority() {
        return 50;
    }

    /**
     * Returns mapper name for debugging.
     *
     * @return mapper name
     */
    String getName();
}
