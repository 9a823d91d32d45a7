package io.gqlextract.shopify.graphql.exception;

/**
 * Missing or malformed extractor setting.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
