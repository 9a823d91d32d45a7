package io.gqlextract.shopify.graphql;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A named type definition from {@code __schema.types}.
 * Immutable; shared by every entity of a run.
 */
@Getter
@AllArgsConstructor
public final class TypeNode {

    private final TypeKind kind;
    private final String name;
    /** Empty for scalars and enums. */
    private final List<FieldDef> fields;

    public FieldDef field(String fieldName) {
        for (FieldDef field : fields) {
            if (field.getName().equals(fieldName)) {
                return field;
            }
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    public static TypeNode fromJson(Map<String, Object> json) {
        List<FieldDef> fields = new ArrayList<>();
        Object rawFields = json.get("fields");
        if (rawFields instanceof List) {
            for (Object field : (List<Object>) rawFields) {
                if (field instanceof Map) {
                    fields.add(FieldDef.fromJson((Map<String, Object>) field));
                }
            }
        }
        return new TypeNode(
                TypeKind.of((String) json.get("kind")),
                (String) json.get("name"),
                Collections.unmodifiableList(fields));
    }
}
