package io.gqlextract.shopify.graphql.typemapper;

import io.gqlextract.shopify.graphql.PropertyType;

/**
 * Maps the GraphQL {@code Int} scalar to INTEGER.
 *
 * <p>{@code UnsignedInt64} is serialized as a string by the API and is left to the default mapper.</p>
 */
public class IntTypeMapper implements ScalarTypeMapper {

    @Override
    public boolean canHandle(String scalarName) {
        return "Int".equals(scalarName);
    }

    @Override
    public PropertyType mapType(String scalarName) {
        return PropertyType.INTEGER;
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    public String getName() {
        return "IntTypeMapper";
    }
}
