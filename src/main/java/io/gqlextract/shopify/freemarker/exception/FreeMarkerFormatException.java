package io.gqlextract.shopify.freemarker.exception;

/**
 * Rendering of a compiled document template failed.
 */
public class FreeMarkerFormatException extends FreeMarkerException {

    public FreeMarkerFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
