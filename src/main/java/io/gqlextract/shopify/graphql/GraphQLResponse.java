package io.gqlextract.shopify.graphql;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.PathNotFoundException;
import io.gqlextract.shopify.graphql.json.JsonArrayReader;
import io.gqlextract.shopify.model.GraphQLError;
import io.gqlextract.shopify.model.QueryCost;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Parsed GraphQL response: {@code data}, {@code errors[]} and {@code extensions}.
 */
public class GraphQLResponse {

    private final String body;
    private final DocumentContext document;
    private final List<GraphQLError> errors;

    public GraphQLResponse(String body) {
        this.body = body;
        this.document = JsonPath.parse(body);
        this.errors = parseErrors();
    }

    public String getBody() {
        return body;
    }

    public List<GraphQLError> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Reads a value by JsonPath.
     *
     * @return the value, or null when the path is absent
     */
    public <T> T read(String path) {
        try {
            return document.read(path);
        } catch (PathNotFoundException e) {
            return null;
        }
    }

    /**
     * Rows of a connection query: every {@code node} under {@code edges}.
     */
    public List<Map<String, Object>> records(String queryName) {
        return new JsonArrayReader(document).read("$.data['" + queryName + "'].edges[*].node");
    }

    public boolean hasNextPage(String queryName) {
        Object hasNext = read("$.data['" + queryName + "'].pageInfo.hasNextPage");
        return Boolean.TRUE.equals(hasNext);
    }

    public String endCursor(String queryName) {
        Object cursor = read("$.data['" + queryName + "'].pageInfo.endCursor");
        return cursor != null ? cursor.toString() : null;
    }

    /**
     * Cost accounting of the request.
     *
     * @return the cost block, or null when the response carries none
     */
    public QueryCost cost() {
        Map<String, Object> cost = read("$.extensions.cost");
        if (cost == null) {
            return null;
        }
        QueryCost queryCost = new QueryCost();
        queryCost.setRequestedQueryCost(number(cost.get("requestedQueryCost")));
        Object throttle = cost.get("throttleStatus");
        if (throttle instanceof Map) {
            Map<?, ?> throttleStatus = (Map<?, ?>) throttle;
            queryCost.setCurrentlyAvailable(number(throttleStatus.get("currentlyAvailable")));
            queryCost.setRestoreRate(number(throttleStatus.get("restoreRate")));
            queryCost.setMaximumAvailable(number(throttleStatus.get("maximumAvailable")));
        }
        return queryCost;
    }

    @SuppressWarnings("unchecked")
    private List<GraphQLError> parseErrors() {
        Object rawErrors = read("$.errors");
        if (!(rawErrors instanceof List)) {
            return Collections.emptyList();
        }
        List<GraphQLError> parsed = new ArrayList<>();
        for (Object error : (List<Object>) rawErrors) {
            if (error instanceof Map) {
                parsed.add(GraphQLError.fromJson((Map<String, Object>) error));
            }
        }
        return Collections.unmodifiableList(parsed);
    }

    private static Double number(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value != null) {
            try {
                return Double.parseDouble(value.toString());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
