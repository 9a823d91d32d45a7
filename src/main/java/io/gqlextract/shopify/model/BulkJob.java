package io.gqlextract.shopify.model;

import lombok.Data;

/**
 * A submitted bulk operation as seen by this process.
 */
@Data
public class BulkJob {

    /**
     * Client-side lifecycle of a job.
     */
    public enum Phase {
        SUBMITTED,
        POLLING,
        /** Finished with a result URL */
        COMPLETED,
        /** Finished with no objects and no URL */
        COMPLETED_EMPTY,
        /** Failed with a code that means "skip this entity" */
        FAILED_RECOVERABLE,
        FAILED_FATAL,
        STREAMING,
        DONE
    }

    private final String id;
    private Phase phase = Phase.SUBMITTED;
    private BulkJobStatus status = BulkJobStatus.CREATED;
    private String url;
    private String errorCode;
    private long objectCount;

    /** True when the job ended with something to download. */
    public boolean hasResult() {
        return url != null;
    }
}
