package io.gqlextract.shopify.tests;

import io.gqlextract.shopify.graphql.IntrospectionSchema;
import io.gqlextract.shopify.graphql.PropertyType;
import io.gqlextract.shopify.graphql.RecordSchema;
import io.gqlextract.shopify.graphql.config.ExtractorSettings;
import io.gqlextract.shopify.graphql.service.TypeResolver;
import io.gqlextract.shopify.graphql.typemapper.ScalarTypeMapperChain;
import io.gqlextract.shopify.tests.base.BaseTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Resolution of the shared Admin API fixture types into record schemas.
 */
public class TypeResolverTest extends BaseTest {

    @Override
    protected String getTestResourceDirectory() {
        return "TypeResolverTest";
    }

    private TypeResolver createResolver(ExtractorSettings settings) throws Exception {
        IntrospectionSchema introspection = introspect(settings);
        TypeResolver resolver = new TypeResolver(introspection, ScalarTypeMapperChain.defaultChain(), settings);
        resolver.registerEntityType("Order");
        resolver.registerEntityType("Customer");
        return resolver;
    }

    @Test
    @DisplayName("Scalars, enums and lists map to leaf property types in declaration order")
    public void testScalarMapping() throws Exception {
        RecordSchema schema = createResolver(createSettings()).resolve("Order");

        assertEquals(List.of("id", "name", "email", "createdAt", "updatedAt", "test",
                "currentSubtotalLineItemsQuantity", "totalWeight", "displayFinancialStatus", "tags",
                "customer", "billingAddress", "shippingLines"), List.copyOf(schema.getPropertyNames()));

        assertEquals(PropertyType.STRING, schema.property("id").getType().getType());
        assertEquals(PropertyType.TIMESTAMP, schema.property("updatedAt").getType().getType());
        assertEquals(PropertyType.BOOLEAN, schema.property("test").getType().getType());
        assertEquals(PropertyType.INTEGER, schema.property("currentSubtotalLineItemsQuantity").getType().getType());
        assertEquals(PropertyType.STRING, schema.property("totalWeight").getType().getType());
        assertEquals(PropertyType.STRING, schema.property("displayFinancialStatus").getType().getType());

        assertEquals(PropertyType.ARRAY, schema.property("tags").getType().getType());
        assertEquals(PropertyType.STRING, schema.property("tags").getType().getItems().getType());
    }

    @Test
    @DisplayName("JSON schema rendering: nullable types, date-time format, array items")
    @SuppressWarnings("unchecked")
    public void testJsonSchema() throws Exception {
        Map<String, Object> json = createResolver(createSettings()).resolve("Order").toJsonSchema();
        Map<String, Object> properties = (Map<String, Object>) json.get("properties");

        Map<String, Object> updatedAt = (Map<String, Object>) properties.get("updatedAt");
        assertEquals(List.of("string", "null"), updatedAt.get("type"));
        assertEquals("date-time", updatedAt.get("format"));

        Map<String, Object> tags = (Map<String, Object>) properties.get("tags");
        assertEquals(Map.of("type", "string"), tags.get("items"));

        Map<String, Object> weight = (Map<String, Object>) properties.get("currentSubtotalLineItemsQuantity");
        assertEquals(List.of("integer", "null"), weight.get("type"));
    }

    @Test
    @DisplayName("A field typed as another entity resolves to a required id only")
    public void testEntityReference() throws Exception {
        RecordSchema schema = createResolver(createSettings()).resolve("Order");

        RecordSchema customer = schema.property("customer").getType().getNestedSchema();
        assertEquals(Set.of("id"), customer.getPropertyNames());
        assertTrue(customer.property("id").isRequired());

        RecordSchema customerSchema = createResolver(createSettings()).resolve("Customer");
        assertEquals(Set.of("id"), customerSchema.property("lastOrder").getType().getNestedSchema().getPropertyNames());
    }

    @Test
    @DisplayName("A self-referencing type is expanded once and the walk terminates")
    public void testCycleProtection() throws Exception {
        RecordSchema schema = createResolver(createSettings()).resolve("Order");

        RecordSchema billingAddress = schema.property("billingAddress").getType().getNestedSchema();
        assertEquals(List.of("address1", "city", "zip"), List.copyOf(billingAddress.getPropertyNames()));
    }

    @Test
    @DisplayName("Visited types are tracked per top-level field")
    public void testVisitedSetResetBetweenFields() throws Exception {
        RecordSchema schema = createResolver(createSettings()).resolve("Customer");

        assertEquals(List.of("id", "email", "updatedAt", "defaultAddress", "lastOrder"),
                List.copyOf(schema.getPropertyNames()));
        assertEquals(List.of("address1", "city", "zip"),
                List.copyOf(schema.property("defaultAddress").getType().getNestedSchema().getPropertyNames()));
    }

    @Test
    @DisplayName("Nested objects and arrays of objects are expanded")
    public void testNestedObjects() throws Exception {
        RecordSchema schema = createResolver(createSettings()).resolve("Order");

        RecordSchema shippingLine = schema.property("shippingLines").getType().getNestedSchema();
        assertEquals(List.of("title", "code", "originalPriceSet"), List.copyOf(shippingLine.getPropertyNames()));
        RecordSchema money = shippingLine.property("originalPriceSet").getType().getNestedSchema()
                .property("shopMoney").getType().getNestedSchema();
        assertEquals(List.of("amount", "currencyCode"), List.copyOf(money.getPropertyNames()));
    }

    @Test
    @DisplayName("Argument fields, deprecated fields, interfaces and empty objects are skipped")
    public void testFieldFiltering() throws Exception {
        TypeResolver resolver = createResolver(createSettings());
        RecordSchema schema = resolver.resolve("Order");

        assertNull(schema.property("lineItems"));
        assertNull(schema.property("metafield"));
        assertNull(schema.property("legacyResourceId"));
        assertNull(schema.property("sourceObject"));
        assertNull(schema.property("riskSummary"));

        assertEquals(Set.of("lineItems"), resolver.getNestedConnections("Order"));
        assertTrue(resolver.getNestedConnections("OrderRiskSummary").contains("assessments"));
    }

    @Test
    @DisplayName("ignoreDeprecated=false keeps deprecated fields")
    public void testDeprecatedFieldsKept() throws Exception {
        ExtractorSettings settings = createSettings();
        settings.setIgnoreDeprecated(false);

        RecordSchema schema = createResolver(settings).resolve("Order");

        assertNotNull(schema.property("legacyResourceId"));
    }

    @Test
    @DisplayName("Ignored fields are never resolved")
    public void testIgnoredFields() throws Exception {
        ExtractorSettings settings = createSettings();
        settings.getIgnoredFields().add("email");

        RecordSchema schema = createResolver(settings).resolve("Order");

        assertNull(schema.property("email"));
    }

    @Test
    @DisplayName("Non-null fields are required only when access errors are not ignored")
    public void testRequiredRelaxation() throws Exception {
        assertEquals(List.of(), createResolver(createSettings()).resolve("Order").requiredNames());

        ExtractorSettings strict = createSettings();
        strict.setIgnoreAccessDenied(false);
        RecordSchema schema = createResolver(strict).resolve("Order");

        assertEquals(List.of("id", "name", "createdAt", "updatedAt", "test",
                "currentSubtotalLineItemsQuantity", "tags", "shippingLines"), schema.requiredNames());
    }

    @Test
    @DisplayName("Unknown type resolves to an empty schema")
    public void testUnknownType() throws Exception {
        assertTrue(createResolver(createSettings()).resolve("NoSuchType").isEmpty());
    }
}
