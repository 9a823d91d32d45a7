package io.gqlextract.shopify.graphql;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Result of introspecting the remote API: every named type plus the root query fields.
 * <p>
 * Built once per run by {@link io.gqlextract.shopify.graphql.service.IntrospectionService}
 * and read by discovery and type resolution. Type lookup ignores case.
 * </p>
 */
public final class IntrospectionSchema {

    private final Map<String, TypeNode> typesByLowerName = new LinkedHashMap<>();
    private final List<FieldDef> queryFields;

    public IntrospectionSchema(List<TypeNode> types, List<FieldDef> queryFields) {
        for (TypeNode type : types) {
            if (type.getName() != null) {
                typesByLowerName.put(type.getName().toLowerCase(Locale.ROOT), type);
            }
        }
        this.queryFields = Collections.unmodifiableList(queryFields);
    }

    /**
     * @param typeName type name in any case
     * @return the type definition, or null if the schema has none by that name
     */
    public TypeNode type(String typeName) {
        if (typeName == null) {
            return null;
        }
        return typesByLowerName.get(typeName.toLowerCase(Locale.ROOT));
    }

    public List<FieldDef> getQueryFields() {
        return queryFields;
    }
}
