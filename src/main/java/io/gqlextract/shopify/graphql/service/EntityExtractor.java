package io.gqlextract.shopify.graphql.service;

import io.gqlextract.shopify.graphql.GraphQLResponse;
import io.gqlextract.shopify.graphql.RecordSchema;
import io.gqlextract.shopify.graphql.config.ExtractorSettings;
import io.gqlextract.shopify.graphql.interfaces.RecordEmitter;
import io.gqlextract.shopify.model.EntityDescriptor;
import io.gqlextract.shopify.model.PageRequest;
import io.gqlextract.shopify.model.PaginationState;
import io.gqlextract.shopify.model.RecoveryDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Extracts one entity: resolves its schema, fetches its rows in interactive or bulk mode and
 * hands schema, rows and checkpoint to the {@link RecordEmitter}.
 *
 * <p>The same routine serves every discovered entity; nothing is specific to a query except
 * the auxiliary sub-resources known to the {@link QueryBuilder}.</p>
 */
public class EntityExtractor {

    private static final Logger logger = LoggerFactory.getLogger(EntityExtractor.class);

    /** Set by bulk operations on rows of a nested connection. */
    static final String PARENT_ID = "__parentId";

    private final GraphQLClient graphQLClient;
    private final QueryBuilder queryBuilder;
    private final TypeResolver typeResolver;
    private final AdaptivePaginator paginator;
    private final BulkJobManager bulkJobManager;
    private final ErrorRecovery errorRecovery;
    private final ExtractorSettings settings;

    public EntityExtractor(GraphQLClient graphQLClient, QueryBuilder queryBuilder, TypeResolver typeResolver,
                           AdaptivePaginator paginator, BulkJobManager bulkJobManager, ErrorRecovery errorRecovery,
                           ExtractorSettings settings) {
        this.graphQLClient = graphQLClient;
        this.queryBuilder = queryBuilder;
        this.typeResolver = typeResolver;
        this.paginator = paginator;
        this.bulkJobManager = bulkJobManager;
        this.errorRecovery = errorRecovery;
        this.settings = settings;
    }

    /**
     * Runs the extraction.
     *
     * @param entity          entity to extract
     * @param startCheckpoint stored incremental-key value of a previous run, may be null
     * @param emitter         output seam
     * @return number of rows emitted
     * @throws io.gqlextract.shopify.graphql.exception.ExtractionException on fatal failures
     */
    public long extract(EntityDescriptor entity, String startCheckpoint, RecordEmitter emitter) {
        RecordSchema schema = queryBuilder.withAuxiliaryProperties(entity, typeResolver.resolve(entity.getTypeName()));
        emitter.emitSchema(entity, schema.toJsonSchema());

        Instant since = startTimestamp(entity, startCheckpoint);
        CheckpointTracker checkpoint = new CheckpointTracker(entity.getReplicationKey());
        Consumer<Map<String, Object>> sink = row -> {
            checkpoint.observe(row);
            emitter.emitRecord(entity, row);
        };

        logger.info("Extracting {} ({} mode{})", entity.getName(), settings.isBulk() ? "bulk" : "interactive",
                since != null ? ", since " + since : "");
        long rows = settings.isBulk()
                ? extractBulk(entity, schema, since, sink)
                : extractInteractive(entity, schema, since, sink);

        if (checkpoint.getMaxValue() != null) {
            emitter.emitCheckpoint(entity, checkpoint.getMaxValue());
        }
        logger.info("Extracted {} rows of {}", rows, entity.getName());
        return rows;
    }

    /**
     * Later of the configured start date and the stored checkpoint; null for full extraction.
     */
    Instant startTimestamp(EntityDescriptor entity, String startCheckpoint) {
        if (entity.getReplicationKey() == null) {
            return null;
        }
        Instant start = settings.getStartDate();
        if (startCheckpoint != null && !startCheckpoint.isBlank()) {
            Instant checkpoint = ExtractorSettings.parseTimestamp(startCheckpoint);
            if (start == null || checkpoint.isAfter(start)) {
                start = checkpoint;
            }
        }
        return start;
    }

    private long extractInteractive(EntityDescriptor entity, RecordSchema initialSchema, Instant since,
                                    Consumer<Map<String, Object>> sink) {
        RecordSchema schema = initialSchema;
        PaginationState state = new PaginationState();
        PageRequest page = paginator.firstPage(state);
        long rows = 0;
        while (true) {
            String query = queryBuilder.buildPagedQuery(entity, schema);
            GraphQLResponse response = graphQLClient.execute(entity.getName(), query,
                    queryBuilder.pageVariables(entity, page, since));

            RecoveryDecision decision = errorRecovery.recover(entity, schema, response.getErrors());
            if (decision.getAction() == RecoveryDecision.Action.SKIP) {
                return rows;
            }
            if (decision.getAction() == RecoveryDecision.Action.RETRY) {
                schema = decision.getSchema();
                continue;
            }

            for (Map<String, Object> row : response.records(entity.getQueryName())) {
                sink.accept(row);
                rows++;
            }
            Optional<PageRequest> next = paginator.nextPageRequest(entity.getQueryName(), response, state);
            if (next.isEmpty()) {
                return rows;
            }
            page = next.get();
        }
    }

    private long extractBulk(EntityDescriptor entity, RecordSchema schema, Instant since,
                             Consumer<Map<String, Object>> sink) {
        String mutation = queryBuilder.buildBulkQuery(entity, schema, since);
        ChildRowAssembler assembler = new ChildRowAssembler(sink);
        bulkJobManager.run(entity, mutation, assembler);
        assembler.flush();
        return assembler.getEmitted();
    }

    /**
     * Keeps the largest incremental-key value seen. Values are ISO-8601 strings, so string
     * order is time order.
     */
    static final class CheckpointTracker {

        private final String replicationKey;
        private String maxValue;

        CheckpointTracker(String replicationKey) {
            this.replicationKey = replicationKey;
        }

        void observe(Map<String, Object> row) {
            if (replicationKey == null) {
                return;
            }
            Object value = row.get(replicationKey);
            if (value != null && (maxValue == null || value.toString().compareTo(maxValue) > 0)) {
                maxValue = value.toString();
            }
        }

        String getMaxValue() {
            return maxValue;
        }
    }

    /**
     * Bulk results list nested connection rows on their own lines, right after their parent
     * and tagged with {@value #PARENT_ID}. This folds them back into the parent under the
     * connection's {@code edges[].node} shape before the parent is emitted.
     */
    static final class ChildRowAssembler implements Consumer<Map<String, Object>> {

        private static final String CHILD_CONNECTION = "lineItems";

        private final Consumer<Map<String, Object>> sink;
        private Map<String, Object> pending;
        private long emitted;

        ChildRowAssembler(Consumer<Map<String, Object>> sink) {
            this.sink = sink;
        }

        @Override
        @SuppressWarnings("unchecked")
        public void accept(Map<String, Object> row) {
            Object parentId = row.get(PARENT_ID);
            if (parentId == null) {
                flush();
                pending = row;
                return;
            }
            if (pending == null || !parentId.equals(pending.get("id"))) {
                logger.debug("Dropping bulk row without a preceding parent {}", parentId);
                return;
            }
            Map<String, Object> child = new LinkedHashMap<>(row);
            child.remove(PARENT_ID);
            Map<String, Object> connection = (Map<String, Object>) pending.computeIfAbsent(
                    CHILD_CONNECTION, k -> new LinkedHashMap<String, Object>());
            List<Object> edges = (List<Object>) connection.computeIfAbsent("edges", k -> new ArrayList<>());
            Map<String, Object> edge = new LinkedHashMap<>();
            edge.put("node", child);
            edges.add(edge);
        }

        void flush() {
            if (pending != null) {
                sink.accept(pending);
                pending = null;
                emitted++;
            }
        }

        long getEmitted() {
            return emitted;
        }
    }
}
