package io.gqlextract.shopify.model;

import io.gqlextract.shopify.graphql.RecordSchema;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of inspecting the errors of one interactive response.
 */
@Getter
@AllArgsConstructor
public class RecoveryDecision {

    public enum Action {
        /** No errors: use the response */
        PROCEED,
        /** Fields were pruned: rebuild the query and replay the same request */
        RETRY,
        /** Abandon the entity without failing the run */
        SKIP
    }

    private final Action action;
    /** Schema to continue with; the pruned copy for RETRY */
    private final RecordSchema schema;

    public static RecoveryDecision proceed(RecordSchema schema) {
        return new RecoveryDecision(Action.PROCEED, schema);
    }

    public static RecoveryDecision retry(RecordSchema prunedSchema) {
        return new RecoveryDecision(Action.RETRY, prunedSchema);
    }

    public static RecoveryDecision skip(RecordSchema schema) {
        return new RecoveryDecision(Action.SKIP, schema);
    }
}
