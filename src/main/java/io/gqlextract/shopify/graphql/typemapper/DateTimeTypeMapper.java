package io.gqlextract.shopify.graphql.typemapper;

import io.gqlextract.shopify.graphql.PropertyType;

/**
 * Maps the {@code DateTime} scalar to TIMESTAMP.
 *
 * <p>{@code Date} stays a plain string: Shopify sends it without a time part.</p>
 */
public class DateTimeTypeMapper implements ScalarTypeMapper {

    public static final String DATE_TIME = "DateTime";

    @Override
    public boolean canHandle(String scalarName) {
        return DATE_TIME.equals(scalarName);
    }

    @Override
    public PropertyType mapType(String scalarName) {
        return PropertyType.TIMESTAMP;
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    public String getName() {
        return "DateTimeTypeMapper";
    }
}
