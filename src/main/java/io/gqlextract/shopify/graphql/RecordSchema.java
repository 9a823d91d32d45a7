package io.gqlextract.shopify.graphql;

import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Hierarchical record schema of one entity, derived from the remote type system.
 * <p>
 * Instances are immutable: restriction and pruning return new schemas, and the
 * extraction context swaps its stored reference. Property order is declaration order
 * of the introspected type, which is also the order of the rendered selection set.
 * </p>
 */
@EqualsAndHashCode(doNotUseGetters = true)
public final class RecordSchema {

    private static final RecordSchema EMPTY = new RecordSchema(Collections.emptyList());

    private final Map<String, SchemaProperty> properties;

    private RecordSchema(Collection<SchemaProperty> properties) {
        Map<String, SchemaProperty> map = new LinkedHashMap<>();
        for (SchemaProperty property : properties) {
            map.put(property.getName(), property);
        }
        this.properties = Collections.unmodifiableMap(map);
    }

    public static RecordSchema of(Collection<SchemaProperty> properties) {
        return properties.isEmpty() ? EMPTY : new RecordSchema(properties);
    }

    public static RecordSchema empty() {
        return EMPTY;
    }

    public Collection<SchemaProperty> getProperties() {
        return properties.values();
    }

    public Set<String> getPropertyNames() {
        return properties.keySet();
    }

    public SchemaProperty property(String name) {
        return properties.get(name);
    }

    public boolean isEmpty() {
        return properties.isEmpty();
    }

    public List<String> requiredNames() {
        List<String> required = new ArrayList<>();
        for (SchemaProperty property : properties.values()) {
            if (property.isRequired()) {
                required.add(property.getName());
            }
        }
        return required;
    }

    /**
     * Keeps only top-level properties whose name passes the predicate.
     */
    public RecordSchema restrictTo(Predicate<String> keep) {
        List<SchemaProperty> kept = new ArrayList<>();
        for (SchemaProperty property : properties.values()) {
            if (keep.test(property.getName())) {
                kept.add(property);
            }
        }
        return kept.size() == properties.size() ? this : of(kept);
    }

    /**
     * Appends a property, or replaces the one with the same name in place.
     */
    public RecordSchema with(SchemaProperty property) {
        Map<String, SchemaProperty> copy = new LinkedHashMap<>(properties);
        copy.put(property.getName(), property);
        return of(copy.values());
    }

    /**
     * Derives a copy without the property addressed by {@code path}, each element naming a
     * property one level deeper (array element schemas are traversed transparently).
     *
     * @param path property names from this schema down to the property to remove
     * @return pruned copy, or this instance when the path does not resolve
     */
    public RecordSchema withoutPath(List<String> path) {
        if (path.isEmpty()) {
            return this;
        }
        SchemaProperty head = properties.get(path.get(0));
        if (head == null) {
            return this;
        }
        Map<String, SchemaProperty> copy = new LinkedHashMap<>(properties);
        if (path.size() == 1) {
            copy.remove(head.getName());
            return of(copy.values());
        }
        RecordSchema nested = head.getType().getNestedSchema();
        if (nested == null) {
            return this;
        }
        RecordSchema prunedNested = nested.withoutPath(path.subList(1, path.size()));
        if (prunedNested == nested) {
            return this;
        }
        copy.put(head.getName(), head.withType(head.getType().withNestedSchema(prunedNested)));
        return of(copy.values());
    }

    /**
     * Derives a copy with every property named {@code name} removed, at any depth.
     *
     * @return pruned copy, or this instance when nothing matched
     */
    public RecordSchema withoutEverywhere(String name) {
        boolean changed = false;
        List<SchemaProperty> kept = new ArrayList<>();
        for (SchemaProperty property : properties.values()) {
            if (property.getName().equals(name)) {
                changed = true;
                continue;
            }
            RecordSchema nested = property.getType().getNestedSchema();
            if (nested != null) {
                RecordSchema prunedNested = nested.withoutEverywhere(name);
                if (prunedNested != nested) {
                    changed = true;
                    property = property.withType(property.getType().withNestedSchema(prunedNested));
                }
            }
            kept.add(property);
        }
        return changed ? of(kept) : this;
    }

    /**
     * True when {@code path} names an existing property (see {@link #withoutPath(List)}).
     */
    public boolean containsPath(List<String> path) {
        RecordSchema current = this;
        for (int i = 0; i < path.size(); i++) {
            if (current == null) {
                return false;
            }
            SchemaProperty property = current.property(path.get(i));
            if (property == null) {
                return false;
            }
            current = property.getType().getNestedSchema();
        }
        return !path.isEmpty();
    }

    /**
     * Renders the schema as a JSON schema object ({@code type}, {@code properties}, {@code required}).
     */
    public Map<String, Object> toJsonSchema() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("type", "object");
        json.putAll(propertiesJson());
        return json;
    }

    Map<String, Object> propertiesJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        Map<String, Object> props = new LinkedHashMap<>();
        for (SchemaProperty property : properties.values()) {
            props.put(property.getName(), property.getType().toJsonSchema(property.isRequired()));
        }
        json.put("properties", props);
        List<String> required = requiredNames();
        if (!required.isEmpty()) {
            json.put("required", required);
        }
        return json;
    }

    @Override
    public String toString() {
        return properties.values().toString();
    }
}
