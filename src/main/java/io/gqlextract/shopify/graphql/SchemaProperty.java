package io.gqlextract.shopify.graphql;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A named, typed property of a {@link RecordSchema}.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
public final class SchemaProperty {

    private final String name;
    private final FieldType type;
    private final boolean required;

    public SchemaProperty withType(FieldType replacement) {
        return new SchemaProperty(name, replacement, required);
    }

    @Override
    public String toString() {
        return name + ":" + type + (required ? "!" : "");
    }
}
