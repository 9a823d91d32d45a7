package io.gqlextract.shopify.graphql.config;

/**
 * Configuration implementation that reads from Java system properties.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * System.setProperty("shopify.extractor.store", "my-shop");
 * ExtractorSettings settings = ExtractorSettings.from(new SystemPropertyConfiguration());
 * }</pre>
 */
public class SystemPropertyConfiguration implements ExtractorConfiguration {

    @Override
    public String get(String key) {
        return System.getProperty(key);
    }
}
