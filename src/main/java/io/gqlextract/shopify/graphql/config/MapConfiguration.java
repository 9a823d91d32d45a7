package io.gqlextract.shopify.graphql.config;

import java.util.HashMap;
import java.util.Map;

/**
 * Configuration backed by a plain map, for hosts that load settings themselves.
 */
public class MapConfiguration implements ExtractorConfiguration {

    private final Map<String, String> values;

    public MapConfiguration(Map<String, String> values) {
        this.values = new HashMap<>(values);
    }

    @Override
    public String get(String key) {
        return values.get(key);
    }
}
