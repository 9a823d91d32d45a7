package io.gqlextract.shopify.graphql.service;

import io.gqlextract.shopify.graphql.FieldDef;
import io.gqlextract.shopify.graphql.FieldType;
import io.gqlextract.shopify.graphql.IntrospectionSchema;
import io.gqlextract.shopify.graphql.PropertyType;
import io.gqlextract.shopify.graphql.RecordSchema;
import io.gqlextract.shopify.graphql.SchemaProperty;
import io.gqlextract.shopify.graphql.TypeKind;
import io.gqlextract.shopify.graphql.TypeNode;
import io.gqlextract.shopify.graphql.TypeRef;
import io.gqlextract.shopify.graphql.config.ExtractorSettings;
import io.gqlextract.shopify.graphql.typemapper.ScalarTypeMapperChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts introspected GraphQL types into record schemas.
 *
 * <p>Responsibilities:</p>
 * <ul>
 *   <li>Map scalars and enums to leaf property types through the {@link ScalarTypeMapperChain}</li>
 *   <li>Unwrap NON_NULL and LIST wrappers, marking required properties</li>
 *   <li>Expand nested object types, stopping at types already seen in the current walk</li>
 *   <li>Reduce references to other extractable entities to their {@code id}</li>
 *   <li>Record argument-taking sub-collections ("nested connections") instead of expanding them</li>
 * </ul>
 *
 * <p><b>Field filtering:</b> fields with arguments, deprecated fields (when configured),
 * explicitly ignored fields and interface-typed fields never become properties.</p>
 */
public class TypeResolver {

    private static final Logger logger = LoggerFactory.getLogger(TypeResolver.class);

    /** Argument that marks a paginated sub-collection. */
    static final String CONNECTION_ARGUMENT = "first";

    private final IntrospectionSchema introspection;
    private final ScalarTypeMapperChain scalarTypeMapperChain;
    private final ExtractorSettings settings;
    private final Set<String> entityTypes = new HashSet<>();
    private final Map<String, Set<String>> nestedConnections = new LinkedHashMap<>();

    public TypeResolver(IntrospectionSchema introspection, ScalarTypeMapperChain scalarTypeMapperChain,
                        ExtractorSettings settings) {
        this.introspection = introspection;
        this.scalarTypeMapperChain = scalarTypeMapperChain;
        this.settings = settings;
    }

    /**
     * Registers the record type of a discovered entity. Fields of that type found elsewhere
     * resolve to a reference holding only {@code id}.
     */
    public void registerEntityType(String typeName) {
        entityTypes.add(typeName);
    }

    public boolean isEntityType(String typeName) {
        return entityTypes.contains(typeName);
    }

    /**
     * Resolves the record schema of an entity type.
     * Each top-level field is walked with its own set of visited object types.
     *
     * @param typeNode introspected OBJECT type
     * @return schema in field declaration order, possibly empty
     */
    public RecordSchema resolve(TypeNode typeNode) {
        List<SchemaProperty> properties = new ArrayList<>();
        for (FieldDef field : typeNode.getFields()) {
            SchemaProperty property = resolveField(typeNode.getName(), field, new HashSet<>());
            if (property != null) {
                properties.add(property);
            }
        }
        logger.debug("Resolved {} into {} properties", typeNode.getName(), properties.size());
        return RecordSchema.of(properties);
    }

    /**
     * Resolves an entity type by name.
     *
     * @return the schema, or an empty schema if introspection has no such type
     */
    public RecordSchema resolve(String typeName) {
        TypeNode typeNode = introspection.type(typeName);
        if (typeNode == null) {
            logger.warn("Type {} not found in introspection result", typeName);
            return RecordSchema.empty();
        }
        return resolve(typeNode);
    }

    /**
     * Sub-collection fields skipped while resolving {@code typeName}.
     */
    public Set<String> getNestedConnections(String typeName) {
        Set<String> connections = nestedConnections.get(typeName);
        return connections == null ? Collections.emptySet() : Collections.unmodifiableSet(connections);
    }

    private SchemaProperty resolveField(String ownerType, FieldDef field, Set<String> visited) {
        if (field.hasArguments()) {
            if (CONNECTION_ARGUMENT.equals(field.getArgumentNames().get(0))) {
                nestedConnections.computeIfAbsent(ownerType, k -> new LinkedHashSet<>()).add(field.getName());
            }
            return null;
        }
        if (field.isDeprecated() && settings.isIgnoreDeprecated()) {
            return null;
        }
        if (settings.getIgnoredFields().contains(field.getName())) {
            return null;
        }
        TypeRef typeRef = field.getType();
        if (typeRef == null || typeRef.unwrap().getKind() == TypeKind.INTERFACE) {
            return null;
        }

        FieldType fieldType = resolveType(typeRef, visited);
        if (fieldType == null) {
            return null;
        }
        boolean required = typeRef.getKind() == TypeKind.NON_NULL && !settings.isIgnoreAccessDenied();
        return new SchemaProperty(field.getName(), fieldType, required);
    }

    private FieldType resolveType(TypeRef typeRef, Set<String> visited) {
        if (typeRef == null || typeRef.getKind() == null) {
            return null;
        }
        switch (typeRef.getKind()) {
            case NON_NULL:
                return resolveType(typeRef.getOfType(), visited);
            case LIST:
                TypeRef element = typeRef.getOfType();
                if (element != null && element.getKind() == TypeKind.NON_NULL) {
                    element = element.getOfType();
                }
                FieldType items = resolveType(element, visited);
                return items == null ? null : FieldType.array(items);
            case SCALAR:
                return FieldType.scalar(scalarTypeMapperChain.mapType(typeRef.getName()));
            case ENUM:
                return FieldType.scalar(PropertyType.STRING);
            case OBJECT:
                return resolveObject(typeRef.getName(), visited);
            default:
                return null;
        }
    }

    private FieldType resolveObject(String typeName, Set<String> visited) {
        if (entityTypes.contains(typeName)) {
            return FieldType.object(referenceShape());
        }
        if (!visited.add(typeName)) {
            return null;
        }
        TypeNode typeNode = introspection.type(typeName);
        if (typeNode == null) {
            return null;
        }
        List<SchemaProperty> properties = new ArrayList<>();
        for (FieldDef field : typeNode.getFields()) {
            SchemaProperty property = resolveField(typeName, field, visited);
            if (property != null) {
                properties.add(property);
            }
        }
        return properties.isEmpty() ? null : FieldType.object(RecordSchema.of(properties));
    }

    private static RecordSchema referenceShape() {
        return RecordSchema.of(List.of(new SchemaProperty("id", FieldType.scalar(PropertyType.STRING), true)));
    }
}
