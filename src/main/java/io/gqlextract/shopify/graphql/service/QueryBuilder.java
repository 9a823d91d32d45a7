package io.gqlextract.shopify.graphql.service;

import com.google.common.base.Joiner;
import freemarker.template.TemplateModel;
import io.gqlextract.shopify.freemarker.FreeMarkerEngine;
import io.gqlextract.shopify.graphql.FieldType;
import io.gqlextract.shopify.graphql.PropertyType;
import io.gqlextract.shopify.graphql.RecordSchema;
import io.gqlextract.shopify.graphql.SchemaProperty;
import io.gqlextract.shopify.model.EntityDescriptor;
import io.gqlextract.shopify.model.PageRequest;
import org.apache.commons.lang3.time.FastDateFormat;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TimeZone;

/**
 * Builds GraphQL documents for an entity from its record schema.
 *
 * <p>Responsibilities:</p>
 * <ul>
 *   <li>Restrict the schema to the selected fields plus identity and incremental-key fields</li>
 *   <li>Render the nested selection set in declaration order</li>
 *   <li>Splice selection, static arguments and filters into the paged or bulk template</li>
 *   <li>Build the variables of a paged request</li>
 * </ul>
 *
 * <p><b>Output is deterministic:</b> the same entity, schema, selection and filters always
 * render the same document.</p>
 */
public class QueryBuilder {

    /** Selection used when nothing else is left, so the document stays valid. */
    public static final String EMPTY_SELECTION = "__typename";

    /** Search field the incremental filter compares against. */
    static final String INCREMENTAL_FILTER_FIELD = "updated_at";

    private static final String INDENT = "    ";
    private static final FastDateFormat FILTER_TIMESTAMP =
            FastDateFormat.getInstance("yyyy-MM-dd'T'HH:mm:ss", TimeZone.getTimeZone("UTC"));

    /**
     * Sub-resources not expanded by the generic serializer: the entity's schema carries an
     * untyped property of that name and the query gets a fixed fragment instead.
     */
    private static final Map<String, AuxiliaryFragment> AUXILIARY_FRAGMENTS =
            Map.of("orders", new AuxiliaryFragment("lineItems", QueryTemplates.ORDER_LINE_ITEMS));

    private final FreeMarkerEngine freeMarkerEngine = FreeMarkerEngine.getInstance();

    /**
     * Adds the untyped auxiliary property to an entity schema when the entity has one.
     */
    public RecordSchema withAuxiliaryProperties(EntityDescriptor entity, RecordSchema schema) {
        AuxiliaryFragment fragment = AUXILIARY_FRAGMENTS.get(entity.getQueryName());
        if (fragment == null) {
            return schema;
        }
        return schema.with(new SchemaProperty(fragment.property, FieldType.untypedObject(), false));
    }

    /**
     * Keeps the selected top-level properties, plus identity and incremental-key fields.
     *
     * @param selectedFields selected top-level names; null selects everything
     */
    public RecordSchema restrict(EntityDescriptor entity, RecordSchema schema, Set<String> selectedFields) {
        if (selectedFields == null) {
            return schema;
        }
        Set<String> keep = new LinkedHashSet<>(selectedFields);
        keep.addAll(entity.getKeyFields());
        return schema.restrictTo(keep::contains);
    }

    /**
     * Builds a document.
     *
     * @param entity         entity to query
     * @param schema         current record schema of the entity
     * @param selectedFields selected top-level names; null selects everything
     * @param filters        connection arguments, rendered verbatim in order
     * @param bulk           bulk submission mutation instead of a paged query
     * @return GraphQL document
     */
    public String buildQuery(EntityDescriptor entity, RecordSchema schema, Set<String> selectedFields,
                             List<String> filters, boolean bulk) {
        RecordSchema restricted = restrict(entity, schema, selectedFields);

        Map<String, TemplateModel> variables = new HashMap<>();
        variables.put("queryName", FreeMarkerEngine.convert(entity.getQueryName()));
        variables.put("selectedFields", FreeMarkerEngine.convert(renderEntitySelection(entity, restricted)));
        if (bulk) {
            variables.put("filters", FreeMarkerEngine.convert(renderArguments(filters)));
            return freeMarkerEngine.process(QueryTemplates.BULK_QUERY, variables);
        }
        StringBuilder additional = new StringBuilder();
        for (String filter : filters) {
            additional.append(", ").append(filter);
        }
        variables.put("additionalArguments", FreeMarkerEngine.convert(additional.toString()));
        return freeMarkerEngine.process(QueryTemplates.PAGED_QUERY, variables);
    }

    /**
     * Paged query; the incremental filter travels as the {@code $filter} variable.
     */
    public String buildPagedQuery(EntityDescriptor entity, RecordSchema schema) {
        return buildQuery(entity, schema, entity.getSelectedFields(), entity.getStaticArguments(), false);
    }

    /**
     * Bulk submission mutation with static arguments and the incremental filter inlined.
     */
    public String buildBulkQuery(EntityDescriptor entity, RecordSchema schema, Instant since) {
        return buildQuery(entity, schema, entity.getSelectedFields(), filters(entity, since), true);
    }

    public String buildBulkStatusQuery() {
        return QueryTemplates.BULK_QUERY_STATUS;
    }

    public String buildTypesIntrospectionQuery() {
        return QueryTemplates.INTROSPECTION_TYPES;
    }

    public String buildQueriesIntrospectionQuery() {
        return QueryTemplates.INTROSPECTION_QUERIES;
    }

    /**
     * Static arguments followed by the incremental filter, if any.
     */
    public List<String> filters(EntityDescriptor entity, Instant since) {
        List<String> filters = new ArrayList<>(entity.getStaticArguments());
        String search = incrementalFilter(entity, since);
        if (search != null) {
            filters.add("query: \"" + search + "\"");
        }
        return filters;
    }

    /**
     * Search expression selecting records updated after {@code since}.
     *
     * @return the expression, or null for full extraction
     */
    public String incrementalFilter(EntityDescriptor entity, Instant since) {
        if (entity.getReplicationKey() == null || since == null) {
            return null;
        }
        return INCREMENTAL_FILTER_FIELD + ":>" + FILTER_TIMESTAMP.format(Date.from(since));
    }

    /**
     * Variables of one paged request: {@code first}, {@code after} and {@code filter}.
     */
    public Map<String, Object> pageVariables(EntityDescriptor entity, PageRequest page, Instant since) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("first", page.getPageSize());
        variables.put("after", page.getCursor());
        variables.put("filter", incrementalFilter(entity, since));
        return variables;
    }

    /**
     * Renders a selection set, one field per line.
     *
     * @return the selection, or {@value #EMPTY_SELECTION} when the schema selects nothing
     */
    public String renderSelectionSet(RecordSchema schema) {
        StringBuilder out = new StringBuilder();
        render(schema, 0, null, out);
        return out.length() == 0 ? EMPTY_SELECTION : out.toString().stripTrailing();
    }

    private String renderEntitySelection(EntityDescriptor entity, RecordSchema schema) {
        AuxiliaryFragment fragment = AUXILIARY_FRAGMENTS.get(entity.getQueryName());
        StringBuilder out = new StringBuilder();
        render(schema, 0, fragment != null ? fragment.property : null, out);
        if (fragment != null && schema.property(fragment.property) != null) {
            out.append(fragment.text.strip()).append('\n');
        }
        return out.length() == 0 ? EMPTY_SELECTION : out.toString().stripTrailing();
    }

    private void render(RecordSchema schema, int depth, String skipTopLevel, StringBuilder out) {
        String indent = INDENT.repeat(depth);
        for (SchemaProperty property : schema.getProperties()) {
            if (depth == 0 && property.getName().equals(skipTopLevel)) {
                continue;
            }
            RecordSchema nested = property.getType().getNestedSchema();
            if (nested == null) {
                if (rendersAsLeaf(property.getType())) {
                    out.append(indent).append(property.getName()).append('\n');
                }
                continue;
            }
            StringBuilder inner = new StringBuilder();
            render(nested, depth + 1, null, inner);
            if (inner.length() > 0) {
                out.append(indent).append(property.getName()).append(" {\n")
                        .append(inner)
                        .append(indent).append("}\n");
            }
        }
    }

    private static boolean rendersAsLeaf(FieldType type) {
        if (type.getType() == PropertyType.ARRAY) {
            return rendersAsLeaf(type.getItems());
        }
        return !type.getType().isComposite();
    }

    private static String renderArguments(List<String> arguments) {
        return arguments.isEmpty() ? "" : "(" + Joiner.on(", ").join(arguments) + ")";
    }

    private static final class AuxiliaryFragment {
        private final String property;
        private final String text;

        private AuxiliaryFragment(String property, String text) {
            this.property = property;
            this.text = text;
        }
    }
}
