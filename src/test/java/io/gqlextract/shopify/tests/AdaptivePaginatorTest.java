package io.gqlextract.shopify.tests;

import io.gqlextract.shopify.graphql.GraphQLResponse;
import io.gqlextract.shopify.graphql.service.AdaptivePaginator;
import io.gqlextract.shopify.model.PageRequest;
import io.gqlextract.shopify.model.PaginationState;
import io.gqlextract.shopify.tests.base.BaseTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Cost-driven page sizing and backpressure.
 */
public class AdaptivePaginatorTest extends BaseTest {

    @Override
    protected String getTestResourceDirectory() {
        return "AdaptivePaginatorTest";
    }

    private GraphQLResponse response(String file) throws Exception {
        return new GraphQLResponse(loadStaticResponse(file));
    }

    @Test
    @DisplayName("First page asks for one record")
    public void testFirstPage() {
        PageRequest first = new AdaptivePaginator(sleeper).firstPage(new PaginationState());

        assertEquals(1, first.getPageSize());
        assertNull(first.getCursor());
    }

    @Test
    @DisplayName("Low budget: sleep 48s, then size the page to 250 (cost 200 for 50 records)")
    public void testBackpressureAndPageSize() throws Exception {
        AdaptivePaginator paginator = new AdaptivePaginator(sleeper);
        PaginationState state = new PaginationState();
        state.setPageSize(50);

        Optional<PageRequest> next = paginator.nextPageRequest("orders", response("page_low_budget.json"), state);

        assertTrue(next.isPresent());
        assertEquals(250, next.get().getPageSize());
        assertEquals("c2", next.get().getCursor());
        assertEquals(List.of(48L), sleeps);
        assertEquals(100.0, state.getAvailable());
        assertEquals(50.0, state.getRestoreRate());
    }

    @Test
    @DisplayName("Enough budget: no sleep, page size from cost per record")
    public void testNoSleepWithBudget() throws Exception {
        AdaptivePaginator paginator = new AdaptivePaginator(sleeper);
        PaginationState state = new PaginationState();
        state.setPageSize(10);

        Optional<PageRequest> next = paginator.nextPageRequest("orders", response("page_plenty_budget.json"), state);

        // 20 / 10 = 2 per record, 1000 / 2 = 500, capped at 250
        assertEquals(250, next.orElseThrow().getPageSize());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("Page size never drops below one")
    public void testPageSizeFloor() throws Exception {
        AdaptivePaginator paginator = new AdaptivePaginator(sleeper);
        PaginationState state = new PaginationState();
        state.setPageSize(1);

        Optional<PageRequest> next = paginator.nextPageRequest("orders", response("page_expensive.json"), state);

        assertEquals(1, next.orElseThrow().getPageSize());
        assertEquals("c4", next.get().getCursor());
    }

    @Test
    @DisplayName("Intermediate page size: floor(costCap / cost per record)")
    public void testIntermediatePageSize() {
        AdaptivePaginator paginator = new AdaptivePaginator(sleeper);
        PaginationState state = new PaginationState();
        state.setPageSize(4);
        state.setLastQueryCost(30.0);
        state.setAvailable(5000.0);

        // 30 / 4 = 7.5 per record, 1000 / 7.5 = 133.3
        assertEquals(133, paginator.nextPageSize(state));
    }

    @Test
    @DisplayName("Without cost data the next page asks for one record")
    public void testNoCostData() throws Exception {
        AdaptivePaginator paginator = new AdaptivePaginator(sleeper);
        PaginationState state = new PaginationState();
        state.setPageSize(1);

        Optional<PageRequest> next = paginator.nextPageRequest("orders", response("page_without_cost.json"), state);

        assertEquals(1, next.orElseThrow().getPageSize());
        assertEquals("c5", next.get().getCursor());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("hasNextPage=false ends pagination")
    public void testLastPage() throws Exception {
        PaginationState state = new PaginationState();

        Optional<PageRequest> next = new AdaptivePaginator(sleeper)
                .nextPageRequest("orders", response("last_page.json"), state);

        assertTrue(next.isEmpty());
        assertTrue(state.isFinished());
    }

    @Test
    @DisplayName("A response with errors ends pagination silently")
    public void testErrorsEndPagination() throws Exception {
        PaginationState state = new PaginationState();

        Optional<PageRequest> next = new AdaptivePaginator(sleeper)
                .nextPageRequest("orders", response("page_with_errors.json"), state);

        assertTrue(next.isEmpty());
        assertTrue(state.isFinished());
        assertTrue(sleeps.isEmpty());
    }
}
