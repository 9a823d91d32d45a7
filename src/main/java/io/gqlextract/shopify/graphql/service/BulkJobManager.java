package io.gqlextract.shopify.graphql.service;

import com.google.common.base.Joiner;
import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.jayway.jsonpath.InvalidJsonException;
import com.jayway.jsonpath.JsonPath;
import io.gqlextract.shopify.graphql.GraphQLResponse;
import io.gqlextract.shopify.graphql.config.ExtractorSettings;
import io.gqlextract.shopify.graphql.exception.BulkOperationException;
import io.gqlextract.shopify.graphql.exception.ExtractionException;
import io.gqlextract.shopify.graphql.interfaces.Sleeper;
import io.gqlextract.shopify.model.BulkJob;
import io.gqlextract.shopify.model.BulkJobStatus;
import io.gqlextract.shopify.model.EntityDescriptor;
import io.gqlextract.shopify.model.GraphQLError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs the bulk operation lifecycle of one entity: submit, poll, download.
 *
 * <p><b>Lifecycle:</b> SUBMITTED → POLLING → COMPLETED / COMPLETED_EMPTY /
 * FAILED_RECOVERABLE / FAILED_FATAL → STREAMING → DONE.</p>
 *
 * <p>Failures with {@code ACCESS_DENIED} or {@code INTERNAL_SERVER_ERROR} end the entity
 * with zero rows; every other failure, a job id mismatch and a poll timeout throw
 * {@link BulkOperationException}.</p>
 */
public class BulkJobManager {

    private static final Logger logger = LoggerFactory.getLogger(BulkJobManager.class);

    static final String INTERNAL_SERVER_ERROR = "INTERNAL_SERVER_ERROR";
    private static final Set<String> RECOVERABLE_ERROR_CODES = Set.of(GraphQLError.ACCESS_DENIED, INTERNAL_SERVER_ERROR);

    private final GraphQLClient graphQLClient;
    private final QueryBuilder queryBuilder;
    private final ExtractorSettings settings;
    private final Sleeper sleeper;
    private final Ticker ticker;

    public BulkJobManager(GraphQLClient graphQLClient, QueryBuilder queryBuilder, ExtractorSettings settings,
                          Sleeper sleeper, Ticker ticker) {
        this.graphQLClient = graphQLClient;
        this.queryBuilder = queryBuilder;
        this.settings = settings;
        this.sleeper = sleeper;
        this.ticker = ticker;
    }

    /**
     * Submits, waits for and streams one bulk operation.
     *
     * @param mutation     bulk submission document
     * @param rowConsumer  receives every result line as a JSON object
     * @return number of rows streamed, 0 for empty or recoverably failed jobs
     */
    public long run(EntityDescriptor entity, String mutation, Consumer<Map<String, Object>> rowConsumer) {
        BulkJob job = submit(entity, mutation);
        awaitCompletion(entity, job);
        if (!job.hasResult()) {
            job.setPhase(BulkJob.Phase.DONE);
            return 0;
        }
        return streamResults(entity, job, rowConsumer);
    }

    /**
     * Sends the bulk mutation.
     *
     * @return the created job
     * @throws BulkOperationException when the server created no job
     */
    public BulkJob submit(EntityDescriptor entity, String mutation) {
        GraphQLResponse response = graphQLClient.execute(entity.getName(), mutation, Collections.emptyMap());
        String id = response.read("$.data.bulkOperationRunQuery.bulkOperation.id");
        if (id == null) {
            throw new BulkOperationException(entity.getName(), "Bulk operation was not created: " + submitErrors(response));
        }
        logger.info("Submitted bulk operation {} for {}", id, entity.getName());
        return new BulkJob(id);
    }

    /**
     * Polls {@code currentBulkOperation} until the job reaches a terminal state.
     *
     * @param job job to wait for, updated in place
     * @return the same job; {@link BulkJob#hasResult()} tells whether there is something to stream
     * @throws BulkOperationException on id mismatch, fatal failure or timeout
     */
    public BulkJob awaitCompletion(EntityDescriptor entity, BulkJob job) {
        Stopwatch stopwatch = Stopwatch.createStarted(ticker);
        String statusQuery = queryBuilder.buildBulkStatusQuery();
        while (true) {
            GraphQLResponse response = graphQLClient.execute(entity.getName(), statusQuery, Collections.emptyMap());
            Map<String, Object> operation = response.read("$.data.currentBulkOperation");
            if (operation == null) {
                throw new BulkOperationException(entity.getName(), "No current bulk operation while waiting for " + job.getId());
            }
            String currentId = stringValue(operation.get("id"));
            if (!job.getId().equals(currentId)) {
                throw new BulkOperationException(entity.getName(),
                        "Current bulk operation " + currentId + " is not the submitted " + job.getId());
            }
            job.setStatus(BulkJobStatus.of(stringValue(operation.get("status"))));
            job.setUrl(stringValue(operation.get("url")));
            job.setErrorCode(stringValue(operation.get("errorCode")));
            job.setObjectCount(longValue(operation.get("objectCount")));
            logger.debug("Bulk operation {} status {} ({} objects)", job.getId(), job.getStatus(), job.getObjectCount());

            if (job.getUrl() != null) {
                job.setPhase(BulkJob.Phase.COMPLETED);
                return job;
            }
            if (job.getStatus() == BulkJobStatus.COMPLETED) {
                if (job.getObjectCount() == 0) {
                    logger.info("Bulk operation {} for {} completed without results", job.getId(), entity.getName());
                    job.setPhase(BulkJob.Phase.COMPLETED_EMPTY);
                    return job;
                }
                job.setPhase(BulkJob.Phase.FAILED_FATAL);
                throw new BulkOperationException(entity.getName(),
                        "Bulk operation " + job.getId() + " completed with " + job.getObjectCount() + " objects but no result URL");
            }
            if (isFailed(job.getStatus())) {
                if (job.getErrorCode() != null && RECOVERABLE_ERROR_CODES.contains(job.getErrorCode())) {
                    logger.warn("Bulk operation {} for {} failed with {}, skipping", job.getId(), entity.getName(), job.getErrorCode());
                    job.setPhase(BulkJob.Phase.FAILED_RECOVERABLE);
                    return job;
                }
                job.setPhase(BulkJob.Phase.FAILED_FATAL);
                throw new BulkOperationException(entity.getName(), job.getErrorCode(),
                        "Bulk operation " + job.getId() + " ended " + job.getStatus());
            }
            if (stopwatch.elapsed(TimeUnit.SECONDS) >= settings.getPollTimeoutSeconds()) {
                job.setPhase(BulkJob.Phase.FAILED_FATAL);
                throw new BulkOperationException(entity.getName(),
                        "Bulk operation " + job.getId() + " did not finish within " + settings.getPollTimeoutSeconds() + "s");
            }
            job.setPhase(BulkJob.Phase.POLLING);
            sleeper.sleepSeconds(settings.getPollIntervalSeconds());
        }
    }

    /**
     * Downloads the result file, parsing one line at a time.
     *
     * @return number of rows handed to {@code rowConsumer}
     */
    public long streamResults(EntityDescriptor entity, BulkJob job, Consumer<Map<String, Object>> rowConsumer) {
        job.setPhase(BulkJob.Phase.STREAMING);
        long rows = graphQLClient.download(entity.getName(), job.getUrl(), line -> rowConsumer.accept(parseLine(entity, line)));
        job.setPhase(BulkJob.Phase.DONE);
        logger.info("Streamed {} rows of bulk operation {} for {}", rows, job.getId(), entity.getName());
        return rows;
    }

    private static Map<String, Object> parseLine(EntityDescriptor entity, String line) {
        try {
            return JsonPath.parse(line).json();
        } catch (InvalidJsonException | ClassCastException e) {
            throw new ExtractionException(entity.getName(), "Malformed bulk result line", e);
        }
    }

    private static boolean isFailed(BulkJobStatus status) {
        return status == BulkJobStatus.FAILED || status == BulkJobStatus.CANCELED || status == BulkJobStatus.EXPIRED;
    }

    private static String submitErrors(GraphQLResponse response) {
        List<String> messages = new ArrayList<>();
        List<Map<String, Object>> userErrors = response.read("$.data.bulkOperationRunQuery.userErrors");
        if (userErrors != null) {
            for (Map<String, Object> userError : userErrors) {
                messages.add(stringValue(userError.get("message")));
            }
        }
        for (GraphQLError error : response.getErrors()) {
            messages.add(error.getMessage());
        }
        return messages.isEmpty() ? "no job id returned" : Joiner.on("; ").useForNull("?").join(messages);
    }

    private static String stringValue(Object value) {
        return value != null ? value.toString() : null;
    }

    private static long longValue(Object value) {
        return value == null ? 0 : Long.parseLong(value.toString());
    }
}
