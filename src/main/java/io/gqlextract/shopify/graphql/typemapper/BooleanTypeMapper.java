package io.gqlextract.shopify.graphql.typemapper;

import io.gqlextract.shopify.graphql.PropertyType;

/**
 * Maps the GraphQL {@code Boolean} scalar to BOOLEAN.
 */
public class BooleanTypeMapper implements ScalarTypeMapper {

    @Override
    public boolean canHandle(String scalarName) {
        return "Boolean".equals(scalarName);
    }

    @Override
    public PropertyType mapType(String scalarName) {
        return PropertyType.BOOLEAN;
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    public String getName() {
        return "BooleanTypeMapper";
    }
}
