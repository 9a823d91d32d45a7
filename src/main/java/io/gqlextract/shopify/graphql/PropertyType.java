package io.gqlextract.shopify.graphql;

/**
 * Semantic type of a record property, as emitted in the JSON schema of an entity.
 * <p>
 * Scalar mappers resolve GraphQL scalar names to one of the leaf constants;
 * OBJECT and ARRAY are produced by the type resolver for composite fields.
 * </p>
 */
public enum PropertyType {

    STRING("string", "string", null),
    BOOLEAN("boolean", "boolean", null),
    INTEGER("integer", "integer", null),
    FLOAT("float", "number", null),
    TIMESTAMP("timestamp", "string", "date-time"),
    OBJECT("object", "object", null),
    ARRAY("array", "array", null);

    /** Simple type identifier used by the scalar mappers */
    private final String simpleName;
    /** JSON schema {@code type} keyword value */
    private final String jsonType;
    /** JSON schema {@code format} keyword value, null when none */
    private final String jsonFormat;

    PropertyType(String simpleName, String jsonType, String jsonFormat) {
        this.simpleName = simpleName;
        this.jsonType = jsonType;
        this.jsonFormat = jsonFormat;
    }

    public String getSimpleName() {
        return simpleName;
    }

    public String getJsonType() {
        return jsonType;
    }

    public String getJsonFormat() {
        return jsonFormat;
    }

    public boolean isComposite() {
        return this == OBJECT || this == ARRAY;
    }
}
