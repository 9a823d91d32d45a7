package io.gqlextract.shopify.graphql.config;

import com.google.common.base.Splitter;
import io.gqlextract.shopify.graphql.exception.ConfigurationException;
import lombok.Data;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Typed view of the extractor configuration.
 *
 * <p><b>Keys</b> (all prefixed with {@value #PREFIX}):</p>
 * <ul>
 *   <li>store - shop name, the {@code <store>} in {@code <store>.myshopify.com}</li>
 *   <li>accessToken - Admin API access token</li>
 *   <li>apiVersion - Admin API version (default {@value #DEFAULT_API_VERSION})</li>
 *   <li>endpointUrl - full GraphQL endpoint URL, overrides store/apiVersion</li>
 *   <li>bulk - use bulk operations instead of paged queries (default false)</li>
 *   <li>ignoreAccessDenied - skip entities and prune fields on access errors (default true)</li>
 *   <li>ignoreDeprecated - leave deprecated fields out of schemas (default true)</li>
 *   <li>startDate - ISO-8601 timestamp, earliest record update to extract</li>
 *   <li>ignoredFields - comma separated field names never resolved</li>
 *   <li>pollIntervalSeconds / pollTimeoutSeconds - bulk status polling (10 / 1800)</li>
 *   <li>connectionTimeout / responseTimeout - HTTP timeouts in seconds (10 / 60)</li>
 *   <li>abortOnEntityFailure - rethrow fatal entity failures instead of moving on (default true)</li>
 * </ul>
 */
@Data
public class ExtractorSettings {

    public static final String PREFIX = "shopify.extractor.";
    public static final String DEFAULT_API_VERSION = "2023-04";

    private String store;
    private String accessToken;
    private String apiVersion = DEFAULT_API_VERSION;
    private String endpointUrl;
    private boolean bulk;
    private boolean ignoreAccessDenied = true;
    private boolean ignoreDeprecated = true;
    private Instant startDate;
    private Set<String> ignoredFields = new LinkedHashSet<>();
    private long pollIntervalSeconds = 10;
    private long pollTimeoutSeconds = 1800;
    private int connectionTimeout = 10;
    private int responseTimeout = 60;
    private boolean abortOnEntityFailure = true;

    /**
     * Binds settings from a configuration source.
     *
     * @throws ConfigurationException if neither store nor endpointUrl is set, or a value does not parse
     */
    public static ExtractorSettings from(ExtractorConfiguration configuration) {
        ExtractorSettings settings = new ExtractorSettings();
        settings.setStore(configuration.get(PREFIX + "store"));
        settings.setAccessToken(configuration.get(PREFIX + "accessToken"));
        settings.setApiVersion(configuration.get(PREFIX + "apiVersion", DEFAULT_API_VERSION));
        settings.setEndpointUrl(configuration.get(PREFIX + "endpointUrl"));
        settings.setBulk(bool(configuration, "bulk", false));
        settings.setIgnoreAccessDenied(bool(configuration, "ignoreAccessDenied", true));
        settings.setIgnoreDeprecated(bool(configuration, "ignoreDeprecated", true));
        settings.setAbortOnEntityFailure(bool(configuration, "abortOnEntityFailure", true));
        settings.setPollIntervalSeconds(number(configuration, "pollIntervalSeconds", 10));
        settings.setPollTimeoutSeconds(number(configuration, "pollTimeoutSeconds", 1800));
        settings.setConnectionTimeout((int) number(configuration, "connectionTimeout", 10));
        settings.setResponseTimeout((int) number(configuration, "responseTimeout", 60));

        String startDate = configuration.get(PREFIX + "startDate");
        if (startDate != null && !startDate.isBlank()) {
            settings.setStartDate(parseTimestamp(startDate));
        }

        String ignored = configuration.get(PREFIX + "ignoredFields");
        if (ignored != null) {
            Splitter.on(',').trimResults().omitEmptyStrings().split(ignored)
                    .forEach(settings.getIgnoredFields()::add);
        }

        if (settings.getEndpointUrl() == null && settings.getStore() == null) {
            throw new ConfigurationException("Either " + PREFIX + "store or " + PREFIX + "endpointUrl must be set");
        }
        return settings;
    }

    /**
     * GraphQL endpoint: the explicit override, or the Admin API URL of the store.
     */
    public String resolveEndpointUrl() {
        if (endpointUrl != null) {
            return endpointUrl;
        }
        return "https://" + store + ".myshopify.com/admin/api/" + apiVersion + "/graphql.json";
    }

    /**
     * Parses an ISO-8601 instant, with or without offset ({@code 2023-01-01T00:00:00Z},
     * {@code 2023-01-01T00:00:00+02:00}).
     */
    public static Instant parseTimestamp(String value) {
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(value);
            } catch (DateTimeParseException inner) {
                ConfigurationException failure = new ConfigurationException("Not an ISO-8601 timestamp: " + value, e);
                failure.addSuppressed(inner);
                throw failure;
            }
        }
    }

    private static boolean bool(ExtractorConfiguration configuration, String key, boolean defaultValue) {
        String value = configuration.get(PREFIX + key);
        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }

    private static long number(ExtractorConfiguration configuration, String key, long defaultValue) {
        String value = configuration.get(PREFIX + key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Setting " + PREFIX + key + " is not a number: " + value, e);
        }
    }
}
