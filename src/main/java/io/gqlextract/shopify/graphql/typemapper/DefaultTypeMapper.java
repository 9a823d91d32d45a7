package io.gqlextract.shopify.graphql.typemapper;

import io.gqlextract.shopify.graphql.PropertyType;

/**
 * Default fallback mapper for every other scalar ({@code String}, {@code ID}, {@code URL},
 * {@code Money}, {@code JSON}, ...).
 *
 * <p><b>Priority:</b> 100 (checked last)</p>
 */
public class DefaultTypeMapper implements ScalarTypeMapper {

    @Override
    public boolean canHandle(String scalarName) {
        return true;
    }

    @Override
    public PropertyType mapType(String scalarName) {
        return PropertyType.STRING;
    }

    @Override
    public int getPriority() {
        return 100;
    }

    @Override
    public String getName() {
        return "DefaultTypeMapper";
    }
}
