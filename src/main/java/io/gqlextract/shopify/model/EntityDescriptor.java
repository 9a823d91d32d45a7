package io.gqlextract.shopify.model;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An extractable entity found by discovery: one paginated root query field and the
 * record type behind it.
 * <p>
 * Everything but the selected-field set is fixed at discovery. The selection only ever
 * narrows, when error recovery prunes a top-level field, so each run works on a
 * {@link #copy()} of the discovered descriptor.
 * </p>
 */
@Getter
public class EntityDescriptor {

    /** snake_case entity name, e.g. {@code draft_orders} */
    private final String name;
    /** Root query field, e.g. {@code draftOrders} */
    private final String queryName;
    /** Record type behind the connection, e.g. {@code DraftOrder} */
    private final String typeName;
    private final List<String> primaryKeys;
    /** Incremental key, null when the entity only supports full extraction */
    private final String replicationKey;
    /** Arguments the query always needs, rendered verbatim, e.g. {@code includeClosed: true} */
    private final List<String> staticArguments;
    /** Selected top-level fields; null means every field of the schema */
    private Set<String> selectedFields;

    public EntityDescriptor(String name, String queryName, String typeName, List<String> primaryKeys,
                            String replicationKey, List<String> staticArguments) {
        this.name = name;
        this.queryName = queryName;
        this.typeName = typeName;
        this.primaryKeys = List.copyOf(primaryKeys);
        this.replicationKey = replicationKey;
        this.staticArguments = List.copyOf(staticArguments);
    }

    /**
     * Same entity with a fresh, unrestricted selection.
     */
    public EntityDescriptor copy() {
        return new EntityDescriptor(name, queryName, typeName, primaryKeys, replicationKey, staticArguments);
    }

    public Set<String> getSelectedFields() {
        return selectedFields == null ? null : Collections.unmodifiableSet(selectedFields);
    }

    /**
     * Narrows the selection to the given fields. May be called once the selection is known;
     * later calls can only shrink it further.
     */
    public synchronized void select(Set<String> fields) {
        Set<String> narrowed = new LinkedHashSet<>(fields);
        if (selectedFields != null) {
            narrowed.retainAll(selectedFields);
        }
        selectedFields = narrowed;
    }

    /**
     * Drops a pruned field from the selection.
     */
    public synchronized void deselect(String field) {
        if (selectedFields != null) {
            selectedFields.remove(field);
        }
    }

    /** Identity and incremental-key fields, always part of the query. */
    public Set<String> getKeyFields() {
        Set<String> keys = new LinkedHashSet<>(primaryKeys);
        if (replicationKey != null) {
            keys.add(replicationKey);
        }
        return keys;
    }

    @Override
    public String toString() {
        return name + "(" + queryName + ": " + typeName + ", pk=" + primaryKeys
                + (replicationKey != null ? ", rk=" + replicationKey : "") + ")";
    }
}
