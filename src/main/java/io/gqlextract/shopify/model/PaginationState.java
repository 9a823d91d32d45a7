package io.gqlextract.shopify.model;

import lombok.Data;

/**
 * Mutable pagination state of one entity sync in interactive mode.
 * <p>
 * The cost figures are a local snapshot of the credential-wide budget, refreshed from
 * every response.
 * </p>
 */
@Data
public class PaginationState {

    public static final double DEFAULT_BUDGET_CEILING = 10000;
    public static final double DEFAULT_COST_CAP = 1000;

    private String cursor;
    /** Page size of the request that produced the last response */
    private int pageSize = 1;
    private Double lastQueryCost;
    private Double available;
    private Double restoreRate;
    private double budgetCeiling = DEFAULT_BUDGET_CEILING;
    /** Largest cost a single query may have */
    private double costCap = DEFAULT_COST_CAP;
    private boolean finished;

    public PageRequest currentPage() {
        return new PageRequest(pageSize, cursor);
    }

    /**
     * Takes over the cost accounting of a response.
     */
    public void update(QueryCost cost) {
        if (cost == null) {
            return;
        }
        lastQueryCost = cost.getRequestedQueryCost();
        available = cost.getCurrentlyAvailable();
        restoreRate = cost.getRestoreRate();
        if (cost.getMaximumAvailable() != null && cost.getMaximumAvailable() > 0) {
            budgetCeiling = cost.getMaximumAvailable();
        }
    }
}
