package io.gqlextract.shopify.model;

import lombok.Data;

/**
 * Cost accounting block of an interactive response ({@code extensions.cost}).
 */
@Data
public class QueryCost {
    private Double requestedQueryCost;
    private Double currentlyAvailable;
    private Double restoreRate;
    private Double maximumAvailable;
}
