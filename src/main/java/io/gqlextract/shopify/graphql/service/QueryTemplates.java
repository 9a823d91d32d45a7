package io.gqlextract.shopify.graphql.service;

import com.google.common.io.Resources;
import io.gqlextract.shopify.freemarker.exception.FreeMarkerException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * GraphQL document templates shipped under {@code templates/} on the classpath.
 */
final class QueryTemplates {

    static final String INTROSPECTION_TYPES = load("introspection_types.ftl");
    static final String INTROSPECTION_QUERIES = load("introspection_queries.ftl");
    static final String PAGED_QUERY = load("paged_query.ftl");
    static final String BULK_QUERY = load("bulk_query.ftl");
    static final String BULK_QUERY_STATUS = load("bulk_query_status.ftl");
    static final String ORDER_LINE_ITEMS = load("order_line_items.ftl");

    private QueryTemplates() {
    }

    private static String load(String name) {
        try {
            return Resources.toString(Resources.getResource("templates/" + name), StandardCharsets.UTF_8);
        } catch (IOException | IllegalArgumentException e) {
            throw new FreeMarkerException("Cannot load template " + name, e);
        }
    }
}
