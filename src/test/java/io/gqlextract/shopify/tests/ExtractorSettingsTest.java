package io.gqlextract.shopify.tests;

import io.gqlextract.shopify.graphql.ShopifyExtractor;
import io.gqlextract.shopify.graphql.config.ExtractorSettings;
import io.gqlextract.shopify.graphql.config.MapConfiguration;
import io.gqlextract.shopify.graphql.config.SystemPropertyConfiguration;
import io.gqlextract.shopify.graphql.exception.ConfigurationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Binding of shopify.extractor.* keys.
 */
public class ExtractorSettingsTest {

    @AfterEach
    public void clearSystemProperties() {
        System.clearProperty("shopify.extractor.store");
        System.clearProperty("shopify.extractor.bulk");
    }

    @Test
    @DisplayName("Defaults when only the store is configured")
    public void testDefaults() {
        ExtractorSettings settings = ExtractorSettings.from(new MapConfiguration(Map.of("shopify.extractor.store", "my-shop")));

        assertEquals("2023-04", settings.getApiVersion());
        assertEquals("https://my-shop.myshopify.com/admin/api/2023-04/graphql.json", settings.resolveEndpointUrl());
        assertFalse(settings.isBulk());
        assertTrue(settings.isIgnoreAccessDenied());
        assertTrue(settings.isIgnoreDeprecated());
        assertTrue(settings.isAbortOnEntityFailure());
        assertNull(settings.getStartDate());
        assertEquals(10, settings.getPollIntervalSeconds());
        assertEquals(1800, settings.getPollTimeoutSeconds());
        assertEquals(10, settings.getConnectionTimeout());
        assertEquals(60, settings.getResponseTimeout());
        assertTrue(settings.getIgnoredFields().isEmpty());
    }

    @Test
    @DisplayName("Every key is bound")
    public void testAllKeys() {
        ExtractorSettings settings = ExtractorSettings.from(new MapConfiguration(Map.ofEntries(
            Map.entry("shopify.extractor.store", "my-shop"),
            Map.entry("shopify.extractor.accessToken", "shpat_1"),
            Map.entry("shopify.extractor.apiVersion", "2024-01"),
            Map.entry("shopify.extractor.bulk", "true"),
            Map.entry("shopify.extractor.ignoreAccessDenied", "false"),
            Map.entry("shopify.extractor.ignoreDeprecated", "false"),
            Map.entry("shopify.extractor.startDate", "2024-01-01T00:00:00+01:00"),
            Map.entry("shopify.extractor.ignoredFields", "email, note ,,phone"),
            Map.entry("shopify.extractor.pollIntervalSeconds", "5"),
            Map.entry("shopify.extractor.pollTimeoutSeconds", "600"),
            Map.entry("shopify.extractor.abortOnEntityFailure", "false"))));

        assertEquals("shpat_1", settings.getAccessToken());
        assertEquals("https://my-shop.myshopify.com/admin/api/2024-01/graphql.json", settings.resolveEndpointUrl());
        assertTrue(settings.isBulk());
        assertFalse(settings.isIgnoreAccessDenied());
        assertFalse(settings.isIgnoreDeprecated());
        assertFalse(settings.isAbortOnEntityFailure());
        assertEquals(Instant.parse("2023-12-31T23:00:00Z"), settings.getStartDate());
        assertEquals(Set.of("email", "note", "phone"), settings.getIgnoredFields());
        assertEquals(5, settings.getPollIntervalSeconds());
        assertEquals(600, settings.getPollTimeoutSeconds());
    }

    @Test
    @DisplayName("endpointUrl overrides the store URL")
    public void testEndpointOverride() {
        ExtractorSettings settings = ExtractorSettings.from(new MapConfiguration(
            Map.of("shopify.extractor.endpointUrl", "http://localhost:8080/graphql")));

        assertEquals("http://localhost:8080/graphql", settings.resolveEndpointUrl());
    }

    @Test
    @DisplayName("Neither store nor endpointUrl is a configuration error")
    public void testMissingStore() {
        assertThrows(ConfigurationException.class, () -> ExtractorSettings.from(new MapConfiguration(Map.of())));
    }

    @Test
    @DisplayName("Malformed numbers and timestamps are configuration errors")
    public void testMalformedValues() {
        assertThrows(ConfigurationException.class, () -> ExtractorSettings.from(new MapConfiguration(Map.of(
            "shopify.extractor.store", "my-shop",
            "shopify.extractor.pollIntervalSeconds", "ten"))));
        assertThrows(ConfigurationException.class, () -> ExtractorSettings.from(new MapConfiguration(Map.of(
            "shopify.extractor.store", "my-shop",
            "shopify.extractor.startDate", "yesterday"))));
    }

    @Test
    @DisplayName("Timestamps with and without offset")
    public void testParseTimestamp() {
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), ExtractorSettings.parseTimestamp("2024-01-01T00:00:00Z"));
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), ExtractorSettings.parseTimestamp("2024-01-01T02:00:00+02:00"));
    }

    @Test
    @DisplayName("System properties are a configuration source")
    public void testSystemProperties() {
        System.setProperty("shopify.extractor.store", "sys-shop");
        System.setProperty("shopify.extractor.bulk", "true");

        ExtractorSettings settings = ExtractorSettings.from(new SystemPropertyConfiguration());

        assertEquals("https://sys-shop.myshopify.com/admin/api/2023-04/graphql.json", settings.resolveEndpointUrl());
        assertTrue(settings.isBulk());
        assertNotNull(ShopifyExtractor.fromSystemProperties());
    }
}
