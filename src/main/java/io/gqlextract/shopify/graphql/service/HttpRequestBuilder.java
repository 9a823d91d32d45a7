package io.gqlextract.shopify.graphql.service;

import io.gqlextract.shopify.graphql.config.ExtractorSettings;
import io.gqlextract.shopify.graphql.interfaces.RequestAuthenticator;
import net.minidev.json.JSONObject;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.io.entity.StringEntity;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Builds HTTP requests for the GraphQL endpoint and for bulk result downloads.
 *
 * <p>Responsibilities:</p>
 * <ul>
 *   <li>Serialize the {@code {query, variables}} body</li>
 *   <li>Configure request timeouts</li>
 *   <li>Apply the credential headers through the {@link RequestAuthenticator}</li>
 * </ul>
 */
public class HttpRequestBuilder {

    private final ExtractorSettings settings;
    private final RequestAuthenticator authenticator;

    public HttpRequestBuilder(ExtractorSettings settings, RequestAuthenticator authenticator) {
        this.settings = settings;
        this.authenticator = authenticator;
    }

    /**
     * Builds the POST carrying one GraphQL document.
     *
     * @param query     GraphQL document
     * @param variables variables object, may be empty
     * @return configured request
     */
    public HttpUriRequestBase buildGraphQLRequest(String query, Map<String, Object> variables) {
        HttpPost request = new HttpPost(settings.resolveEndpointUrl());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", query);
        body.put("variables", variables != null ? variables : new LinkedHashMap<>());
        request.setEntity(new StringEntity(JSONObject.toJSONString(body), ContentType.APPLICATION_JSON));
        request.setHeader("Content-Type", "application/json");

        configureTimeouts(request);
        if (authenticator != null) {
            authenticator.authenticate(request);
        }
        return request;
    }

    /**
     * Builds the plain GET for a pre-signed bulk result URL. No credentials are attached.
     */
    public HttpUriRequestBase buildDownloadRequest(String url) {
        HttpGet request = new HttpGet(url);
        configureTimeouts(request);
        return request;
    }

    private void configureTimeouts(HttpUriRequestBase request) {
        request.setConfig(RequestConfig.custom()
                .setConnectionRequestTimeout(settings.getConnectionTimeout(), TimeUnit.SECONDS)
                .setResponseTimeout(settings.getResponseTimeout(), TimeUnit.SECONDS)
                .build());
    }
}
