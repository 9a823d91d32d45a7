package io.gqlextract.shopify.graphql.json;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.PathNotFoundException;
import net.minidev.json.JSONArray;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads record arrays out of a parsed GraphQL response, e.g. {@code $.data['orders'].edges[*].node}.
 */
public class JsonArrayReader {
    private final DocumentContext document;

    public JsonArrayReader(DocumentContext document) {
        this.document = document;
    }

    /**
     * @param path JsonPath expression selecting objects
     * @return matched objects in document order; empty when the path is absent
     */
    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> read(String path) {
        List<Map<String, Object>> result = new ArrayList<>();
        Object responseObj;
        try {
            responseObj = document.read(path);
        } catch (PathNotFoundException e) {
            return result;
        }
        if (responseObj instanceof JSONArray || responseObj instanceof List) {
            for (Object item : (List<Object>) responseObj) {
                if (item instanceof Map) {
                    result.add((Map<String, Object>) item);
                }
            }
        } else if (responseObj instanceof Map) {
            // a definite path to a single object
            result.add((Map<String, Object>) responseObj);
        }
        return result;
    }
}
