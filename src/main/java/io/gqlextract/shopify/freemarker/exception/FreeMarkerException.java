package io.gqlextract.shopify.freemarker.exception;

/**
 * Failure while compiling one of the GraphQL document templates, or while binding a value
 * to it (a template referencing a variable the query builder did not supply).
 */
public class FreeMarkerException extends RuntimeException {

    public FreeMarkerException(String message, Throwable cause) {
        super(message, cause);
    }
}
