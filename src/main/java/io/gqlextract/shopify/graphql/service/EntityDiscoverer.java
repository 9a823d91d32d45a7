package io.gqlextract.shopify.graphql.service;

import com.google.common.base.CaseFormat;
import io.gqlextract.shopify.graphql.FieldDef;
import io.gqlextract.shopify.graphql.IntrospectionSchema;
import io.gqlextract.shopify.graphql.TypeKind;
import io.gqlextract.shopify.graphql.TypeNode;
import io.gqlextract.shopify.graphql.TypeRef;
import io.gqlextract.shopify.graphql.typemapper.DateTimeTypeMapper;
import io.gqlextract.shopify.model.EntityDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds extractable entities among the root query fields.
 *
 * <p>An entity is a root field taking both {@code first} and {@code query} arguments whose
 * connection type has a {@code nodes} field. Its record type must expose at least one
 * non-null {@code ID} field, which becomes the primary key.</p>
 *
 * <p>Every discovered record type is registered with the {@link TypeResolver}, so
 * references between entities resolve to an {@code id} instead of being expanded.</p>
 */
public class EntityDiscoverer {

    private static final Logger logger = LoggerFactory.getLogger(EntityDiscoverer.class);

    static final String ID_SCALAR = "ID";
    static final String NODES_FIELD = "nodes";
    static final String INCLUDE_CLOSED = "includeClosed";

    /** Incremental key candidates, most preferred first. */
    static final List<String> REPLICATION_KEY_PRIORITY = List.of(
            "updatedAt", "editedAt", "lastEditDate", "occurredAt", "createdAt", "startedAt", "processedAt");

    private final TypeResolver typeResolver;

    public EntityDiscoverer(TypeResolver typeResolver) {
        this.typeResolver = typeResolver;
    }

    /**
     * @param introspection introspection result of the run
     * @return entities in root field declaration order
     */
    public List<EntityDescriptor> discover(IntrospectionSchema introspection) {
        List<EntityDescriptor> entities = new ArrayList<>();
        for (FieldDef queryField : introspection.getQueryFields()) {
            if (!queryField.acceptsArgument(TypeResolver.CONNECTION_ARGUMENT) || !queryField.acceptsArgument("query")) {
                continue;
            }
            EntityDescriptor entity = describe(introspection, queryField);
            if (entity != null) {
                typeResolver.registerEntityType(entity.getTypeName());
                entities.add(entity);
            }
        }
        logger.info("Discovered {} entities", entities.size());
        return entities;
    }

    private EntityDescriptor describe(IntrospectionSchema introspection, FieldDef queryField) {
        TypeRef connectionRef = queryField.getType() != null ? queryField.getType().unwrap() : null;
        TypeNode connection = connectionRef != null ? introspection.type(connectionRef.getName()) : null;
        FieldDef nodes = connection != null ? connection.field(NODES_FIELD) : null;
        if (nodes == null || nodes.getType() == null) {
            logger.debug("Skipping {}: no {} field on its connection", queryField.getName(), NODES_FIELD);
            return null;
        }
        String typeName = nodes.getType().unwrap().getName();
        TypeNode recordType = introspection.type(typeName);
        if (recordType == null) {
            logger.debug("Skipping {}: record type {} not found", queryField.getName(), typeName);
            return null;
        }

        List<String> primaryKeys = new ArrayList<>();
        List<String> timestamps = new ArrayList<>();
        for (FieldDef field : recordType.getFields()) {
            TypeRef type = field.getType();
            if (type == null || type.getKind() != TypeKind.NON_NULL || type.getOfType() == null) {
                continue;
            }
            TypeRef inner = type.getOfType();
            if (inner.getKind() != TypeKind.SCALAR) {
                continue;
            }
            if (ID_SCALAR.equals(inner.getName())) {
                primaryKeys.add(field.getName());
            } else if (DateTimeTypeMapper.DATE_TIME.equals(inner.getName())) {
                timestamps.add(field.getName());
            }
        }
        if (primaryKeys.isEmpty()) {
            logger.debug("Skipping {}: {} has no non-null ID field", queryField.getName(), typeName);
            return null;
        }

        String replicationKey = null;
        for (String candidate : REPLICATION_KEY_PRIORITY) {
            if (timestamps.contains(candidate)) {
                replicationKey = candidate;
                break;
            }
        }

        List<String> staticArguments = new ArrayList<>();
        if (queryField.acceptsArgument(INCLUDE_CLOSED)) {
            staticArguments.add(INCLUDE_CLOSED + ": true");
        }

        EntityDescriptor entity = new EntityDescriptor(
                CaseFormat.LOWER_CAMEL.to(CaseFormat.LOWER_UNDERSCORE, queryField.getName()),
                queryField.getName(),
                recordType.getName(),
                primaryKeys,
                replicationKey,
                staticArguments);
        logger.debug("Discovered {}", entity);
        return entity;
    }
}
