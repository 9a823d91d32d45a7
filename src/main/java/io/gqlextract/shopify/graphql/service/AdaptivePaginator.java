package io.gqlextract.shopify.graphql.service;

import io.gqlextract.shopify.graphql.GraphQLResponse;
import io.gqlextract.shopify.graphql.interfaces.Sleeper;
import io.gqlextract.shopify.model.PageRequest;
import io.gqlextract.shopify.model.PaginationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Sizes interactive connection pages from the cost accounting of the previous response.
 *
 * <p><b>Algorithm:</b></p>
 * <ul>
 *   <li>No cost data yet: page size 1</li>
 *   <li>Budget below the reserve ({@code max(ceiling / 4, 2 * costCap)}): block until the
 *       restore rate refills it</li>
 *   <li>Next size: {@code floor(costCap / (lastCost / lastPageSize))}, clamped to 1..250</li>
 * </ul>
 *
 * <p>A response with errors, or without a next page, ends pagination.</p>
 */
public class AdaptivePaginator {

    private static final Logger logger = LoggerFactory.getLogger(AdaptivePaginator.class);

    public static final int MAX_PAGE_SIZE = 250;
    public static final int MIN_PAGE_SIZE = 1;
    /** Used when the server reports no restore rate. */
    static final double DEFAULT_RESTORE_RATE = 50;

    private final Sleeper sleeper;

    public AdaptivePaginator(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    public PageRequest firstPage(PaginationState state) {
        state.setCursor(null);
        state.setPageSize(MIN_PAGE_SIZE);
        return state.currentPage();
    }

    /**
     * Computes the request following {@code lastResponse}, sleeping first when the budget is low.
     *
     * @param queryName    root query field of the connection
     * @param lastResponse response to the request described by {@code state}
     * @param state        pagination state, updated in place
     * @return next page, or empty when pagination is over
     */
    public Optional<PageRequest> nextPageRequest(String queryName, GraphQLResponse lastResponse,
                                                 PaginationState state) {
        if (lastResponse.hasErrors()) {
            logger.debug("Pagination of {} ends on a response with errors", queryName);
            state.setFinished(true);
            return Optional.empty();
        }
        state.update(lastResponse.cost());
        if (!lastResponse.hasNextPage(queryName)) {
            state.setFinished(true);
            return Optional.empty();
        }
        state.setCursor(lastResponse.endCursor(queryName));
        state.setPageSize(nextPageSize(state));
        return Optional.of(state.currentPage());
    }

    /**
     * Page size for the next request; blocks while the cost budget refills.
     */
    public int nextPageSize(PaginationState state) {
        Double lastCost = state.getLastQueryCost();
        if (lastCost == null || lastCost <= 0) {
            return MIN_PAGE_SIZE;
        }
        long wait = backoffSeconds(state);
        if (wait > 0) {
            logger.info("Query cost budget low ({} available), sleeping {}s", state.getAvailable(), wait);
            sleeper.sleepSeconds(wait);
        }
        double perRecordCost = lastCost / Math.max(state.getPageSize(), MIN_PAGE_SIZE);
        long size = (long) Math.floor(state.getCostCap() / perRecordCost);
        return (int) Math.max(MIN_PAGE_SIZE, Math.min(MAX_PAGE_SIZE, size));
    }

    /**
     * Seconds to wait until the budget is back at the reserve level.
     */
    long backoffSeconds(PaginationState state) {
        if (state.getAvailable() == null) {
            return 0;
        }
        double reserve = Math.max(state.getBudgetCeiling() / 4, 2 * state.getCostCap());
        double available = state.getAvailable();
        if (available >= reserve) {
            return 0;
        }
        double restoreRate = state.getRestoreRate() != null && state.getRestoreRate() > 0
                ? state.getRestoreRate() : DEFAULT_RESTORE_RATE;
        return (long) Math.ceil((reserve - available) / restoreRate);
    }
}
