package io.gqlextract.shopify.graphql;

import java.util.HashMap;
import java.util.Map;

/**
 * GraphQL {@code __TypeKind} values as returned by introspection.
 * <p>
 * Only OBJECT, LIST, ENUM, SCALAR and NON_NULL take part in record schema resolution;
 * INTERFACE fields are skipped, UNION and INPUT_OBJECT are carried but never expanded.
 * </p>
 */
public enum TypeKind {

    SCALAR,
    OBJECT,
    INTERFACE,
    UNION,
    ENUM,
    INPUT_OBJECT,
    LIST,
    NON_NULL;

    private static final Map<String, TypeKind> MAP = new HashMap<>();

    static {
        for (TypeKind value : values()) {
            MAP.put(value.name(), value);
        }
    }

    /** True for the two wrapper kinds that carry an {@code ofType}. */
    public boolean isWrapper() {
        return this == LIST || this == NON_NULL;
    }

    /**
     * Looks up a kind by its introspection name.
     *
     * @param kind kind name, e.g. "NON_NULL"
     * @return matching kind, or null when absent or unknown
     */
    public static TypeKind of(String kind) {
        return kind == null ? null : MAP.get(kind);
    }
}
