package io.gqlextract.shopify.graphql.interfaces;

import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;

/**
 * Adds credentials to outgoing GraphQL requests.
 * <p>
 * Not applied to bulk result downloads: those URLs are pre-signed.
 * </p>
 */
public interface RequestAuthenticator {

    void authenticate(HttpUriRequestBase request);

}
