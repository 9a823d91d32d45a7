package io.gqlextract.shopify.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Arguments of the next connection page: {@code first} and {@code after}.
 */
@Data
@AllArgsConstructor
public class PageRequest {
    private int pageSize;
    /** null for the first page */
    private String cursor;
}
