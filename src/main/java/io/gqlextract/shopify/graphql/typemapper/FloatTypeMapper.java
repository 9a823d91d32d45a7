package io.gqlextract.shopify.graphql.typemapper;

import io.gqlextract.shopify.graphql.PropertyType;

/**
 * Maps the GraphQL {@code Float} scalar to FLOAT.
 *
 * <p>Decimal-as-string scalars ({@code Decimal}, {@code Money}) are not floats on the wire
 * and fall through to the string default.</p>
 */
public class FloatTypeMapper implements ScalarTypeMapper {

    @Override
    public boolean canHandle(String scalarName) {
        return "Float".equals(scalarName);
    }

    @Override
    public PropertyType mapType(String scalarName) {
        return PropertyType.FLOAT;
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    public String getName() {
        return "FloatTypeMapper";
    }
}
