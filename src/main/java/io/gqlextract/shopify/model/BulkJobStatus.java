package io.gqlextract.shopify.model;

/**
 * {@code BulkOperationStatus} values reported by the server.
 */
public enum BulkJobStatus {

    CREATED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELING,
    CANCELED,
    EXPIRED,
    UNKNOWN;

    public static BulkJobStatus of(String status) {
        if (status == null) {
            return UNKNOWN;
        }
        for (BulkJobStatus value : values()) {
            if (value.name().equals(status)) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
