package io.gqlextract.shopify.graphql;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Map;

/**
 * Reference to a type in a field position: {@code kind}, {@code name} and, for wrappers, {@code ofType}.
 * <p>
 * Introspection nests wrappers, so {@code [Order!]!} arrives as
 * NON_NULL → LIST → NON_NULL → OBJECT(Order).
 * </p>
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
public final class TypeRef {

    private final TypeKind kind;
    private final String name;
    private final TypeRef ofType;

    public static TypeRef named(TypeKind kind, String name) {
        return new TypeRef(kind, name, null);
    }

    public static TypeRef nonNull(TypeRef ofType) {
        return new TypeRef(TypeKind.NON_NULL, null, ofType);
    }

    public static TypeRef list(TypeRef ofType) {
        return new TypeRef(TypeKind.LIST, null, ofType);
    }

    /**
     * Strips every wrapper and returns the innermost named type.
     *
     * @return the named type, or the deepest reference reached if the chain is truncated
     */
    public TypeRef unwrap() {
        TypeRef current = this;
        while (current.kind != null && current.kind.isWrapper() && current.ofType != null) {
            current = current.ofType;
        }
        return current;
    }

    /**
     * Parses an introspection {@code type} object.
     *
     * @param json map with kind/name/ofType keys, may be null
     * @return parsed reference or null
     */
    @SuppressWarnings("unchecked")
    public static TypeRef fromJson(Object json) {
        if (!(json instanceof Map)) {
            return null;
        }
        Map<String, Object> map = (Map<String, Object>) json;
        return new TypeRef(
                TypeKind.of((String) map.get("kind")),
                (String) map.get("name"),
                fromJson(map.get("ofType")));
    }

    @Override
    public String toString() {
        if (kind == TypeKind.NON_NULL) {
            return ofType + "!";
        }
        if (kind == TypeKind.LIST) {
            return "[" + ofType + "]";
        }
        return name;
    }
}
