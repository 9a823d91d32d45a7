package io.gqlextract.shopify.graphql.interfaces;

import io.gqlextract.shopify.model.EntityDescriptor;

import java.util.Map;

/**
 * Receives the output of an extraction run.
 * <p>
 * Implementations own the emission protocol (message format, destination). For every
 * entity the extractor calls {@link #emitSchema} once, then {@link #emitRecord} per row,
 * then {@link #emitCheckpoint} at most once.
 * </p>
 */
public interface RecordEmitter {

    /**
     * @param entity     entity being extracted
     * @param jsonSchema JSON schema of its records
     */
    void emitSchema(EntityDescriptor entity, Map<String, Object> jsonSchema);

    /**
     * @param entity entity being extracted
     * @param record one row, as decoded from the response
     */
    void emitRecord(EntityDescriptor entity, Map<String, Object> record);

    /**
     * @param entity entity being extracted
     * @param value  latest incremental-key value seen during this extraction
     */
    void emitCheckpoint(EntityDescriptor entity, String value);
}
