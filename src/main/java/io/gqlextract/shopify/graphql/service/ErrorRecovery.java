package io.gqlextract.shopify.graphql.service;

import io.gqlextract.shopify.graphql.RecordSchema;
import io.gqlextract.shopify.graphql.SchemaProperty;
import io.gqlextract.shopify.graphql.config.ExtractorSettings;
import io.gqlextract.shopify.graphql.exception.ExtractionException;
import io.gqlextract.shopify.model.EntityDescriptor;
import io.gqlextract.shopify.model.GraphQLError;
import io.gqlextract.shopify.model.RecoveryDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Interprets field-level errors of an interactive response.
 *
 * <p><b>Rules</b>, applied to the errors in order:</p>
 * <ul>
 *   <li>Recovery disabled ({@code ignoreAccessDenied=false}): the first error is fatal</li>
 *   <li>Error scoped to the root query field, or {@code missingRequiredArguments}: skip the entity</li>
 *   <li>Error on a nested field: prune the field from the schema and replay the request</li>
 *   <li>Error without a path: fatal</li>
 * </ul>
 *
 * <p>Pruning derives a new schema; the caller swaps its stored reference, so a pruned field
 * never comes back for the rest of the run.</p>
 */
public class ErrorRecovery {

    private static final Logger logger = LoggerFactory.getLogger(ErrorRecovery.class);

    /** Connection segments of an error path that never name a record property. */
    static final Set<String> CONNECTION_SEGMENTS = Set.of("edges", "node", "nodes");

    private final ExtractorSettings settings;

    public ErrorRecovery(ExtractorSettings settings) {
        this.settings = settings;
    }

    /**
     * Decides how to go on after a response.
     *
     * @param entity entity being extracted; its selection narrows when a top-level field is pruned
     * @param schema current record schema
     * @param errors errors of the response, possibly empty
     * @return the decision and the schema to continue with
     * @throws ExtractionException for errors that cannot be recovered
     */
    public RecoveryDecision recover(EntityDescriptor entity, RecordSchema schema, List<GraphQLError> errors) {
        if (errors.isEmpty()) {
            return RecoveryDecision.proceed(schema);
        }
        if (!settings.isIgnoreAccessDenied()) {
            throw fatal(entity, errors.get(0));
        }

        RecordSchema current = schema;
        Set<String> removedLeaves = new HashSet<>();
        for (GraphQLError error : errors) {
            if (GraphQLError.MISSING_REQUIRED_ARGUMENTS.equals(error.getCode())) {
                logger.warn("Skipping {}: {}", entity.getName(), error.getMessage());
                return RecoveryDecision.skip(current);
            }
            if (!error.hasUsablePath()) {
                throw fatal(entity, error);
            }
            if (error.isTopLevel()) {
                logger.warn("Skipping {}: {} ({})", entity.getName(), error.getMessage(), error.getCode());
                return RecoveryDecision.skip(current);
            }
            // row-indexed errors repeat the same field; resolve against the schema of the request
            List<String> propertyPath = toPropertyPath(schema, error.getPath());
            if (propertyPath != null) {
                if (!current.containsPath(propertyPath)) {
                    logger.debug("{} already pruned from {}", propertyPath, entity.getName());
                    continue;
                }
                current = removePath(entity, current, propertyPath);
            } else {
                String leaf = leafName(error.getPath());
                if (leaf != null && removedLeaves.contains(leaf)) {
                    continue;
                }
                current = removeEverywhere(entity, current, error.getPath());
                removedLeaves.add(leaf);
            }
            logger.warn("Pruned {} from {}: {} ({})", error.getPath(), entity.getName(), error.getMessage(), error.getCode());
        }
        return RecoveryDecision.retry(current);
    }

    /**
     * Removes the field an error path points at.
     *
     * @param path error path, starting with the root query field
     * @return pruned copy of {@code schema}
     * @throws ExtractionException when nothing could be removed
     */
    public RecordSchema prune(EntityDescriptor entity, RecordSchema schema, List<Object> path) {
        List<String> propertyPath = toPropertyPath(schema, path);
        return propertyPath != null
                ? removePath(entity, schema, propertyPath)
                : removeEverywhere(entity, schema, path);
    }

    private static RecordSchema removePath(EntityDescriptor entity, RecordSchema schema, List<String> propertyPath) {
        RecordSchema pruned = schema.withoutPath(propertyPath);
        if (pruned == schema) {
            throw new ExtractionException(entity.getName(), new ArrayList<>(propertyPath), null,
                    "Field of the error path is not part of the schema");
        }
        if (propertyPath.size() == 1) {
            entity.deselect(propertyPath.get(0));
        }
        return pruned;
    }

    private static RecordSchema removeEverywhere(EntityDescriptor entity, RecordSchema schema, List<Object> path) {
        String leaf = leafName(path);
        RecordSchema pruned = leaf != null ? schema.withoutEverywhere(leaf) : schema;
        if (pruned == schema) {
            throw new ExtractionException(entity.getName(), path, null, "Field of the error path is not part of the schema");
        }
        if (schema.property(leaf) != null) {
            entity.deselect(leaf);
        }
        return pruned;
    }

    /**
     * Maps an error path onto schema property names: the root query field is dropped, list
     * indices and connection segments are skipped where they do not name a property.
     *
     * @return property names from the top level down, or null when the path leaves the schema
     */
    static List<String> toPropertyPath(RecordSchema schema, List<Object> path) {
        List<String> names = new ArrayList<>();
        RecordSchema current = schema;
        for (Object segment : path.subList(1, path.size())) {
            if (!(segment instanceof String)) {
                continue;
            }
            String name = (String) segment;
            SchemaProperty property = current != null ? current.property(name) : null;
            if (property != null) {
                names.add(name);
                current = property.getType().getNestedSchema();
            } else if (!CONNECTION_SEGMENTS.contains(name)) {
                return null;
            }
        }
        return names.isEmpty() ? null : names;
    }

    private static String leafName(List<Object> path) {
        for (int i = path.size() - 1; i > 0; i--) {
            if (path.get(i) instanceof String) {
                return (String) path.get(i);
            }
        }
        return null;
    }

    private static ExtractionException fatal(EntityDescriptor entity, GraphQLError error) {
        logger.error("Unrecoverable error for {}: {}", entity.getName(), error.getMessage());
        return new ExtractionException(entity.getName(), error.getPath(), error.getCode(), error.getMessage());
    }
}
