package io.gqlextract.shopify.graphql;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Type of a record property: a leaf {@link PropertyType}, an object with its own
 * {@link RecordSchema}, or an array of another field type.
 * <p>
 * An object without a schema is "untyped": it is emitted as a bare JSON object and is
 * never expanded into a selection set.
 * </p>
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class FieldType {

    private final PropertyType type;
    /** Nested schema for OBJECT; null for leaves and untyped objects */
    private final RecordSchema properties;
    /** Element type for ARRAY */
    private final FieldType items;

    public static FieldType scalar(PropertyType type) {
        if (type.isComposite()) {
            throw new IllegalArgumentException("Not a leaf type: " + type);
        }
        return new FieldType(type, null, null);
    }

    public static FieldType object(RecordSchema properties) {
        return new FieldType(PropertyType.OBJECT, properties, null);
    }

    public static FieldType untypedObject() {
        return new FieldType(PropertyType.OBJECT, null, null);
    }

    public static FieldType array(FieldType items) {
        return new FieldType(PropertyType.ARRAY, null, items);
    }

    /**
     * Schema that a selection set descends into: the object's own schema, or for arrays
     * the schema of the element type.
     *
     * @return nested schema, or null when the type renders as a leaf
     */
    public RecordSchema getNestedSchema() {
        if (type == PropertyType.OBJECT) {
            return properties;
        }
        if (type == PropertyType.ARRAY) {
            return items.getNestedSchema();
        }
        return null;
    }

    /**
     * Returns a copy whose nested schema (see {@link #getNestedSchema()}) is replaced.
     */
    public FieldType withNestedSchema(RecordSchema replacement) {
        if (type == PropertyType.OBJECT) {
            return object(replacement);
        }
        if (type == PropertyType.ARRAY) {
            return array(items.withNestedSchema(replacement));
        }
        return this;
    }

    Map<String, Object> toJsonSchema(boolean required) {
        Map<String, Object> json = new LinkedHashMap<>();
        if (required) {
            json.put("type", type.getJsonType());
        } else {
            List<String> types = new ArrayList<>();
            types.add(type.getJsonType());
            types.add("null");
            json.put("type", types);
        }
        if (type.getJsonFormat() != null) {
            json.put("format", type.getJsonFormat());
        }
        if (type == PropertyType.OBJECT && properties != null) {
            json.putAll(properties.propertiesJson());
        } else if (type == PropertyType.ARRAY) {
            json.put("items", items.toJsonSchema(true));
        }
        return json;
    }

    @Override
    public String toString() {
        if (type == PropertyType.ARRAY) {
            return "array<" + items + ">";
        }
        if (type == PropertyType.OBJECT && properties != null) {
            return "object" + properties.getPropertyNames();
        }
        return type.getSimpleName();
    }
}
