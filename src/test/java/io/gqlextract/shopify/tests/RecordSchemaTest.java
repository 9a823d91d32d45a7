package io.gqlextract.shopify.tests;

import io.gqlextract.shopify.graphql.FieldType;
import io.gqlextract.shopify.graphql.PropertyType;
import io.gqlextract.shopify.graphql.RecordSchema;
import io.gqlextract.shopify.graphql.SchemaProperty;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Value semantics and path lookup of record schemas.
 */
public class RecordSchemaTest {

    private static RecordSchema customer() {
        return RecordSchema.of(List.of(
                new SchemaProperty("id", FieldType.scalar(PropertyType.STRING), true),
                new SchemaProperty("defaultAddress", FieldType.object(RecordSchema.of(List.of(
                        new SchemaProperty("city", FieldType.scalar(PropertyType.STRING), false)))), false),
                new SchemaProperty("tags", FieldType.array(FieldType.scalar(PropertyType.STRING)), false)));
    }

    @Test
    @DisplayName("Separately built schemas with the same properties are equal")
    public void testValueEquality() {
        RecordSchema first = customer();
        RecordSchema second = customer();

        assertNotSame(first, second);
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertEquals(first.property("defaultAddress"), second.property("defaultAddress"));
        assertNotEquals(first, first.withoutPath(List.of("defaultAddress", "city")));
    }

    @Test
    @DisplayName("Pruning and restoring a property yields an equal schema")
    public void testEqualAfterDerivation() {
        RecordSchema schema = customer();
        SchemaProperty tags = schema.property("tags");

        assertEquals(schema, schema.withoutPath(List.of("tags")).with(tags));
    }

    @Test
    @DisplayName("containsPath follows nested objects")
    public void testContainsPath() {
        RecordSchema schema = customer();

        assertTrue(schema.containsPath(List.of("defaultAddress", "city")));
        assertTrue(schema.containsPath(List.of("tags")));
        assertFalse(schema.containsPath(List.of("defaultAddress", "zip")));
        assertFalse(schema.containsPath(List.of("tags", "city")));
        assertFalse(schema.containsPath(List.of()));
        assertFalse(schema.withoutPath(List.of("defaultAddress", "city")).containsPath(List.of("defaultAddress", "city")));
    }
}
