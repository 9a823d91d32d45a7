package io.gqlextract.shopify.graphql.service;

import com.jayway.jsonpath.InvalidJsonException;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.PathNotFoundException;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.function.Consumer;

/**
 * Executes HTTP requests and handles responses.
 *
 * <p>Responsibilities:</p>
 * <ul>
 *   <li>Execute GraphQL POSTs and bulk result GETs</li>
 *   <li>Log request/response details for debugging</li>
 *   <li>Validate response status codes</li>
 *   <li>Stream newline-delimited bodies line by line</li>
 * </ul>
 *
 * <p><b>Success criteria:</b> HTTP status codes 200-299. A GraphQL endpoint may also answer
 * with an error status and a structured {@code errors} body; such bodies are returned so
 * the caller can interpret them.</p>
 *
 * <p><b>Note:</b> Uses a shared HttpClient instance for connection pooling.</p>
 */
public class HttpRequestExecutor {

    private static final Logger logger = LoggerFactory.getLogger(HttpRequestExecutor.class);

    private static final CloseableHttpClient SHARED_HTTP_CLIENT = HttpClientBuilder.create().build();

    /**
     * Executes an HTTP request and returns the response body as string.
     *
     * @param request Configured HTTP request to execute
     * @return Response body as UTF-8 string
     * @throws IOException If request execution fails, or the response is unsuccessful
     *                     and carries no structured GraphQL errors
     */
    public String executeRequest(HttpUriRequestBase request) throws IOException {
        if (logger.isDebugEnabled()) {
            logRequest(request);
        }

        return SHARED_HTTP_CLIENT.execute(request, response -> {
            int statusCode = response.getCode();

            if (logger.isDebugEnabled()) {
                logResponse(response, statusCode);
            }

            HttpEntity entity = response.getEntity();
            if (entity == null) {
                throw new IOException("Empty response entity, status code (" + statusCode + ")");
            }

            String responseBody;
            try (InputStream is = entity.getContent()) {
                responseBody = new String(is.readAllBytes(), StandardCharsets.UTF_8);
            }
            if (logger.isDebugEnabled()) {
                logger.debug("Response Body:");
                logger.debug("{}", responseBody);
            }

            if (!isSuccessfulResponse(statusCode) && !hasStructuredErrors(responseBody)) {
                throw new IOException("Request Failed, status code (" + statusCode + ")");
            }
            return responseBody;
        });
    }

    /**
     * Executes a GET and hands each non-blank line of the body to {@code lineConsumer}
     * while the body is still being received.
     *
     * @param request      Configured request
     * @param lineConsumer receives lines in order
     * @return number of lines consumed
     * @throws IOException If the request fails or the status is unsuccessful
     */
    public long streamLines(HttpUriRequestBase request, Consumer<String> lineConsumer) throws IOException {
        if (logger.isDebugEnabled()) {
            logRequest(request);
        }

        return SHARED_HTTP_CLIENT.execute(request, response -> {
            int statusCode = response.getCode();
            if (logger.isDebugEnabled()) {
                logResponse(response, statusCode);
            }
            if (!isSuccessfulResponse(statusCode)) {
                throw new IOException("Download Failed, status code (" + statusCode + ")");
            }
            HttpEntity entity = response.getEntity();
            if (entity == null) {
                return 0L;
            }
            long lines = 0;
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(entity.getContent(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (!line.isBlank()) {
                        lineConsumer.accept(line);
                        lines++;
                    }
                }
            }
            return lines;
        });
    }

    /**
     * Checks if HTTP status code indicates success (200-299).
     */
    private boolean isSuccessfulResponse(int statusCode) {
        return (statusCode - 200 >= 0) && (statusCode - 200 < 100);
    }

    /**
     * True when the body is a GraphQL response with an {@code errors} array.
     */
    private boolean hasStructuredErrors(String responseBody) {
        try {
            return JsonPath.read(responseBody, "$.errors") instanceof List;
        } catch (InvalidJsonException | PathNotFoundException | IllegalArgumentException e) {
            logger.debug("Unsuccessful response without GraphQL errors: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Logs HTTP request details for debugging. Credential headers are masked.
     */
    private void logRequest(HttpUriRequestBase request) {
        logger.debug("=== HTTP REQUEST ===");
        logger.debug("Method: {}", request.getMethod());
        logger.debug("URI: {}", request.getRequestUri());
        logger.debug("Headers:");
        for (var header : request.getHeaders()) {
            boolean secret = header.getName().toLowerCase().contains("token")
                    || header.getName().equalsIgnoreCase("Authorization");
            logger.debug("  {}: {}", header.getName(), secret ? "****" : header.getValue());
        }

        if (request.getEntity() != null) {
            try {
                String requestBody = EntityUtils.toString(request.getEntity(), StandardCharsets.UTF_8);
                logger.debug("Request Body:");
                logger.debug("{}", requestBody);
                // Recreate entity after reading (since InputStream is consumed)
                request.setEntity(new StringEntity(requestBody, StandardCharsets.UTF_8));
            } catch (Exception e) {
                logger.warn("Could not log request body: {}", e.getMessage());
            }
        } else {
            logger.debug("Request Body: <none>");
        }
    }

    private void logResponse(org.apache.hc.core5.http.HttpResponse response, int statusCode) {
        logger.debug("=== HTTP RESPONSE ===");
        logger.debug("Status Code: {}", statusCode);
        logger.debug("Response Headers:");
        for (var header : response.getHeaders()) {
            logger.debug("  {}: {}", header.getName(), header.getValue());
        }
    }
}
