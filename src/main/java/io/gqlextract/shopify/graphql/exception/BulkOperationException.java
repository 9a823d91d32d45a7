package io.gqlextract.shopify.graphql.exception;

/**
 * Fatal bulk operation outcome: job id mismatch, unrecognised failure code, inconsistent
 * completion or poll timeout.
 */
public class BulkOperationException extends ExtractionException {

    public BulkOperationException(String entity, String code, String message) {
        super(entity, null, code, message);
    }

    public BulkOperationException(String entity, String message) {
        super(entity, message);
    }
}
