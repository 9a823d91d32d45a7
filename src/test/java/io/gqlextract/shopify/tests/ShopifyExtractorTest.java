package io.gqlextract.shopify.tests;

import com.github.tomakehurst.wiremock.verification.LoggedRequest;
import com.jayway.jsonpath.JsonPath;
import io.gqlextract.shopify.graphql.ShopifyExtractor;
import io.gqlextract.shopify.graphql.config.ExtractorSettings;
import io.gqlextract.shopify.graphql.exception.ExtractionException;
import io.gqlextract.shopify.model.EntityDescriptor;
import io.gqlextract.shopify.tests.base.BaseTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Whole runs: introspection, discovery, selection, interactive and bulk extraction.
 */
public class ShopifyExtractorTest extends BaseTest {

    @Override
    protected String getTestResourceDirectory() {
        return "ShopifyExtractorTest";
    }

    private ShopifyExtractor createExtractor(ExtractorSettings settings) throws Exception {
        setupIntrospection();
        return new ShopifyExtractor(settings, createClient(settings), sleeper, ticker);
    }

    private List<LoggedRequest> requests(String queryMarker) {
        return getWireMockServer().findAll(postRequestedFor(urlEqualTo(GRAPHQL_PATH))
            .withRequestBody(matchingJsonPath("$.query", containing(queryMarker))));
    }

    private static List<Object> names(List<Map<String, Object>> records) {
        return records.stream().map(r -> r.get("name")).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Discovery through the extractor: introspection is fetched once")
    public void testDiscover() throws Exception {
        ShopifyExtractor extractor = createExtractor(createSettings());

        List<EntityDescriptor> first = extractor.discover();
        List<EntityDescriptor> second = extractor.discover();

        assertEquals(List.of("orders", "customers", "draft_orders"),
            first.stream().map(EntityDescriptor::getName).collect(Collectors.toList()));
        assertSame(first, second);
        assertEquals(1, requests("IntrospectTypes").size());
        assertEquals(1, requests("IntrospectQueries").size());
    }

    @Test
    @DisplayName("Interactive run: paginates orders, skips denied customers, emits checkpoints")
    public void testInteractiveRun() throws Exception {
        setupResponseSequence("orders(first", "orders_page1.json", "orders_page2.json");
        setupStaticJsonResponse("customers(first", "customers_denied.json");
        setupStaticJsonResponse("draftOrders(first", "draft_orders_page.json");

        CollectingEmitter emitter = new CollectingEmitter();
        createExtractor(createSettings()).run(emitter, null, null);

        assertEquals(List.of("#1001", "#1002", "#1003"), names(emitter.records("orders")));
        assertEquals(List.of(), emitter.records("customers"));
        assertEquals(List.of("#D7"), names(emitter.records("draft_orders")));

        // string maximum, not the last row
        assertEquals("2024-03-05T08:30:00Z", emitter.checkpoints.get("orders"));
        assertEquals("2024-02-10T00:00:00Z", emitter.checkpoints.get("draft_orders"));
        assertFalse(emitter.checkpoints.containsKey("customers"));
        assertEquals(Set.of("orders", "customers", "draft_orders"), emitter.schemas.keySet());

        List<LoggedRequest> orderRequests = requests("orders(first");
        assertEquals(2, orderRequests.size());
        String firstBody = orderRequests.get(0).getBodyAsString();
        String secondBody = orderRequests.get(1).getBodyAsString();
        assertEquals(1, (int) JsonPath.read(firstBody, "$.variables.first"));
        assertNull(JsonPath.read(firstBody, "$.variables.after"));
        assertEquals(250, (int) JsonPath.read(secondBody, "$.variables.first"));
        assertEquals("c2", JsonPath.read(secondBody, "$.variables.after"));
        assertTrue(sleeps.isEmpty());

        String draftQuery = JsonPath.read(requests("draftOrders(first").get(0).getBodyAsString(), "$.query");
        assertTrue(draftQuery.contains("includeClosed: true"), draftQuery);
    }

    @Test
    @DisplayName("Orders schema carries the lineItems object and the query its fragment")
    @SuppressWarnings("unchecked")
    public void testOrdersSchemaAndQuery() throws Exception {
        setupStaticJsonResponse("orders(first", "orders_single_page.json");

        CollectingEmitter emitter = new CollectingEmitter();
        Map<String, Set<String>> selections = new HashMap<>();
        selections.put("orders", null);
        createExtractor(createSettings()).run(emitter, null, selections);

        Map<String, Object> properties = (Map<String, Object>) emitter.schemas.get("orders").get("properties");
        assertEquals(List.of("object", "null"), ((Map<String, Object>) properties.get("lineItems")).get("type"));
        assertFalse(properties.containsKey("metafield"));

        String query = JsonPath.read(requests("orders(first").get(0).getBodyAsString(), "$.query");
        assertTrue(query.contains("lineItems(first: 250) {"), query);
        assertTrue(query.contains("billingAddress {"), query);
        assertEquals(Set.of("orders"), emitter.schemas.keySet());
    }

    @Test
    @DisplayName("Selection: only listed entities, listed fields plus keys")
    public void testSelection() throws Exception {
        setupStaticJsonResponse("orders(first", "orders_single_page.json");

        CollectingEmitter emitter = new CollectingEmitter();
        createExtractor(createSettings()).run(emitter, null, Map.of("orders", Set.of("name")));

        String query = JsonPath.read(requests("orders(first").get(0).getBodyAsString(), "$.query");
        assertTrue(query.contains("id\n"), query);
        assertTrue(query.contains("name\n"), query);
        assertTrue(query.contains("updatedAt\n"), query);
        assertFalse(query.contains("email"), query);
        assertFalse(query.contains("lineItems"), query);
        assertEquals(Set.of("orders"), emitter.records.keySet());
        assertEquals(0, requests("customers(first").size());
    }

    @Test
    @DisplayName("Selections of one run do not narrow the next run of the same extractor")
    public void testSelectionPerRun() throws Exception {
        setupStaticJsonResponse("orders(first", "orders_single_page.json");
        ShopifyExtractor extractor = createExtractor(createSettings());

        extractor.run(new CollectingEmitter(), null, Map.of("orders", Set.of("name")));
        extractor.run(new CollectingEmitter(), null, Map.of("orders", Set.of("email")));

        List<LoggedRequest> orderRequests = requests("orders(first");
        assertEquals(2, orderRequests.size());
        String firstQuery = JsonPath.read(orderRequests.get(0).getBodyAsString(), "$.query");
        String secondQuery = JsonPath.read(orderRequests.get(1).getBodyAsString(), "$.query");
        assertFalse(firstQuery.contains("email"), firstQuery);
        assertTrue(secondQuery.contains("email\n"), secondQuery);
        assertNull(extractor.discover().get(0).getSelectedFields());
    }

    @Test
    @DisplayName("Access denied on a nested field: prune it and replay the same page")
    public void testPruneAndReplay() throws Exception {
        setupResponseSequence("orders(first", "orders_city_denied.json", "orders_single_page.json");

        CollectingEmitter emitter = new CollectingEmitter();
        createExtractor(createSettings()).run(emitter, null, Map.of("orders", Set.of("billingAddress")));

        List<LoggedRequest> orderRequests = requests("orders(first");
        assertEquals(2, orderRequests.size());
        String firstQuery = JsonPath.read(orderRequests.get(0).getBodyAsString(), "$.query");
        String replayQuery = JsonPath.read(orderRequests.get(1).getBodyAsString(), "$.query");
        assertTrue(firstQuery.contains("city"), firstQuery);
        assertFalse(replayQuery.contains("city"), replayQuery);
        assertTrue(replayQuery.contains("zip"), replayQuery);
        assertEquals((Object) JsonPath.read(orderRequests.get(0).getBodyAsString(), "$.variables"),
            JsonPath.read(orderRequests.get(1).getBodyAsString(), "$.variables"));

        // rows of the failed response are not emitted
        assertEquals(List.of("#1001"), names(emitter.records("orders")));
    }

    @Test
    @DisplayName("Incremental start: later of startDate and the stored checkpoint")
    public void testIncrementalStart() throws Exception {
        setupStaticJsonResponse("orders(first", "orders_single_page.json");
        ExtractorSettings settings = createSettings();
        settings.setStartDate(ExtractorSettings.parseTimestamp("2024-01-01T00:00:00Z"));
        Map<String, Set<String>> selections = new HashMap<>();
        selections.put("orders", null);

        createExtractor(settings).run(new CollectingEmitter(), Map.of("orders", "2024-05-01T00:00:00Z"), selections);
        assertEquals("updated_at:>2024-05-01T00:00:00",
            JsonPath.read(requests("orders(first").get(0).getBodyAsString(), "$.variables.filter"));

        getWireMockServer().resetAll();
        setupStaticJsonResponse("orders(first", "orders_single_page.json");
        createExtractor(settings).run(new CollectingEmitter(), Map.of("orders", "2023-05-01T00:00:00Z"), selections);
        assertEquals("updated_at:>2024-01-01T00:00:00",
            JsonPath.read(requests("orders(first").get(0).getBodyAsString(), "$.variables.filter"));
    }

    @Test
    @DisplayName("A fatal entity failure aborts the run by default")
    public void testFatalFailureAborts() throws Exception {
        setupStaticJsonResponse("orders(first", "orders_single_page.json");
        setupStaticJsonResponse("customers(first", "customers_failure.json");
        setupStaticJsonResponse("draftOrders(first", "draft_orders_page.json");

        CollectingEmitter emitter = new CollectingEmitter();
        ShopifyExtractor extractor = createExtractor(createSettings());

        ExtractionException e = assertThrows(ExtractionException.class, () -> extractor.run(emitter, null, null));

        assertEquals("customers", e.getEntity());
        assertEquals("INTERNAL_SERVER_ERROR", e.getCode());
        assertFalse(emitter.records.containsKey("draft_orders"));
    }

    @Test
    @DisplayName("With abortOnEntityFailure=false the run moves on to the next entity")
    public void testFatalFailureSkipped() throws Exception {
        setupStaticJsonResponse("orders(first", "orders_single_page.json");
        setupStaticJsonResponse("customers(first", "customers_failure.json");
        setupStaticJsonResponse("draftOrders(first", "draft_orders_page.json");
        ExtractorSettings settings = createSettings();
        settings.setAbortOnEntityFailure(false);

        CollectingEmitter emitter = new CollectingEmitter();
        createExtractor(settings).run(emitter, null, null);

        assertEquals(List.of("#D7"), names(emitter.records("draft_orders")));
        assertEquals(List.of("#1001"), names(emitter.records("orders")));
    }

    @Test
    @DisplayName("Bulk run: filtered mutation, polling, line items folded into their order")
    @SuppressWarnings("unchecked")
    public void testBulkRun() throws Exception {
        setupStaticJsonResponse("bulkOperationRunQuery", "bulk_submit.json");
        setupResponseSequence("currentBulkOperation", "bulk_status_completed.json");
        setupDownload("/bulk/orders.jsonl", "bulk_orders.jsonl");
        ExtractorSettings settings = createSettings();
        settings.setBulk(true);
        settings.setStartDate(ExtractorSettings.parseTimestamp("2024-01-01T00:00:00Z"));

        CollectingEmitter emitter = new CollectingEmitter();
        Map<String, Set<String>> selections = new HashMap<>();
        selections.put("orders", null);
        createExtractor(settings).run(emitter, null, selections);

        String mutation = JsonPath.read(requests("bulkOperationRunQuery").get(0).getBodyAsString(), "$.query");
        assertTrue(mutation.contains("orders(query: \"updated_at:>2024-01-01T00:00:00\") {"), mutation);
        assertTrue(mutation.contains("lineItems(first: 250) {"), mutation);

        List<Map<String, Object>> orders = emitter.records("orders");
        assertEquals(List.of("#1001", "#1002"), names(orders));
        List<Object> lineItemNames = JsonPath.read(orders.get(0), "$.lineItems.edges[*].node.name");
        assertEquals(List.of("Shirt", "Socks"), lineItemNames);
        assertFalse(((Map<String, Object>) JsonPath.read(orders.get(0), "$.lineItems.edges[0].node"))
            .containsKey("__parentId"));
        assertFalse(orders.get(1).containsKey("lineItems"));
        assertEquals("2024-05-01T12:00:00Z", emitter.checkpoints.get("orders"));
        assertEquals(0, requests("orders(first").size());
    }
}
