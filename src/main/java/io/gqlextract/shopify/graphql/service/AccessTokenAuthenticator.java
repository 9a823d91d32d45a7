package io.gqlextract.shopify.graphql.service;

import io.gqlextract.shopify.graphql.interfaces.RequestAuthenticator;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;

/**
 * Sends the Admin API access token in the {@code X-Shopify-Access-Token} header.
 */
public class AccessTokenAuthenticator implements RequestAuthenticator {

    public static final String HEADER = "X-Shopify-Access-Token";

    private final String accessToken;

    public AccessTokenAuthenticator(String accessToken) {
        this.accessToken = accessToken;
    }

    @Override
    public void authenticate(HttpUriRequestBase request) {
        if (accessToken != null) {
            request.setHeader(HEADER, accessToken);
        }
    }
}
