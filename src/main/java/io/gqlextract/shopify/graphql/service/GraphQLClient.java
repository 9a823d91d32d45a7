package io.gqlextract.shopify.graphql.service;

import com.jayway.jsonpath.InvalidJsonException;
import io.gqlextract.shopify.graphql.GraphQLResponse;
import io.gqlextract.shopify.graphql.exception.ExtractionException;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Sends GraphQL documents to the Admin API endpoint and downloads bulk results.
 *
 * <p>Transport failures without a structured GraphQL error body are fatal and surface as
 * {@link ExtractionException}; structured errors are returned inside the
 * {@link GraphQLResponse} for error recovery to interpret.</p>
 */
public class GraphQLClient {

    private static final Logger logger = LoggerFactory.getLogger(GraphQLClient.class);

    private final HttpRequestBuilder httpRequestBuilder;
    private final HttpRequestExecutor httpRequestExecutor;

    public GraphQLClient(HttpRequestBuilder httpRequestBuilder, HttpRequestExecutor httpRequestExecutor) {
        this.httpRequestBuilder = httpRequestBuilder;
        this.httpRequestExecutor = httpRequestExecutor;
    }

    public GraphQLResponse execute(String query) {
        return execute(null, query, Collections.emptyMap());
    }

    /**
     * Executes one document.
     *
     * @param entity    entity the request belongs to, for error reporting; may be null
     * @param query     GraphQL document
     * @param variables variables object
     * @return parsed response, possibly carrying errors
     * @throws ExtractionException on transport failure or a body that is not JSON
     */
    public GraphQLResponse execute(String entity, String query, Map<String, Object> variables) {
        HttpUriRequestBase request = httpRequestBuilder.buildGraphQLRequest(query, variables);
        String body;
        try {
            body = httpRequestExecutor.executeRequest(request);
        } catch (IOException e) {
            logger.error("GraphQL request failed for {}: {}", entity != null ? entity : "introspection", e.getMessage());
            throw new ExtractionException(entity, "GraphQL request failed: " + e.getMessage(), e);
        }
        try {
            return new GraphQLResponse(body);
        } catch (InvalidJsonException e) {
            throw new ExtractionException(entity, "GraphQL endpoint returned a non-JSON body", e);
        }
    }

    /**
     * Streams a newline-delimited result file.
     *
     * @return number of lines read
     */
    public long download(String entity, String url, Consumer<String> lineConsumer) {
        try {
            return httpRequestExecutor.streamLines(httpRequestBuilder.buildDownloadRequest(url), lineConsumer);
        } catch (IOException e) {
            logger.error("Bulk result download failed for {}: {}", entity, e.getMessage());
            throw new ExtractionException(entity, "Bulk result download failed: " + e.getMessage(), e);
        }
    }
}
