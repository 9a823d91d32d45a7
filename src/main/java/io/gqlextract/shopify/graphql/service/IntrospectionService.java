package io.gqlextract.shopify.graphql.service;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import io.gqlextract.shopify.graphql.FieldDef;
import io.gqlextract.shopify.graphql.GraphQLResponse;
import io.gqlextract.shopify.graphql.IntrospectionSchema;
import io.gqlextract.shopify.graphql.TypeNode;
import io.gqlextract.shopify.graphql.exception.ExtractionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fetches the remote type system once per run.
 *
 * <p>Two documents are sent: the full type list and the root query fields. The parsed
 * result is memoized, so every entity of the run shares one immutable
 * {@link IntrospectionSchema}.</p>
 */
public class IntrospectionService {

    private static final Logger logger = LoggerFactory.getLogger(IntrospectionService.class);

    private final GraphQLClient graphQLClient;
    private final QueryBuilder queryBuilder;
    private final Supplier<IntrospectionSchema> schema = Suppliers.memoize(this::introspect);

    public IntrospectionService(GraphQLClient graphQLClient, QueryBuilder queryBuilder) {
        this.graphQLClient = graphQLClient;
        this.queryBuilder = queryBuilder;
    }

    /**
     * @return the introspection result, fetched on first call
     * @throws ExtractionException when either document fails
     */
    public IntrospectionSchema getSchema() {
        return schema.get();
    }

    private IntrospectionSchema introspect() {
        List<TypeNode> types = new ArrayList<>();
        for (Map<String, Object> json : readList(queryBuilder.buildTypesIntrospectionQuery(), "data.__schema.types")) {
            types.add(TypeNode.fromJson(json));
        }
        List<FieldDef> queryFields = new ArrayList<>();
        for (Map<String, Object> json : readList(queryBuilder.buildQueriesIntrospectionQuery(),
                "data.__schema.queryType.fields")) {
            queryFields.add(FieldDef.fromJson(json));
        }
        logger.info("Introspected {} types and {} root query fields", types.size(), queryFields.size());
        return new IntrospectionSchema(types, queryFields);
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> readList(String query, String path) {
        GraphQLResponse response = graphQLClient.execute(query);
        if (response.hasErrors()) {
            throw new ExtractionException(null, null, response.getErrors().get(0).getCode(),
                    "Introspection failed: " + response.getErrors().get(0).getMessage());
        }
        Object value = response.read("$." + path);
        if (!(value instanceof List)) {
            throw new ExtractionException(null, "Introspection response has no " + path);
        }
        return (List<Map<String, Object>>) value;
    }
}
