package org.apache.calcite.adapter.scrollreader.source.service;

import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpResponse;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Executes HTTP requests against search nodes and returns response bodies.
 *
 * <p>Responsibilities:</p>
 * <ul>
 *   <li>Execute the scroll protocol's requests (GET, POST, DELETE)</li>
 *   <li>Log request/response details for debugging</li>
 *   <li>Turn unsuccessful responses into {@link IOException}s carrying the node's error body</li>
 * </ul>
 *
 * <p><b>Success criteria:</b> HTTP status codes 200-299.</p>
 *
 * <p><b>Note:</b> Uses a shared HttpClient instance for connection pooling across datasets.</p>
 */
public class HttpRequestExecutor {

    private static final Logger logger = LoggerFactory.getLogger(HttpRequestExecutor.class);

    /** Error bodies longer than this are cut in exception messages. */
    private static final int MAX_ERROR_BODY = 512;

    /** Requests are sent once; a failing node is skipped, never retried. */
    private static final CloseableHttpClient SHARED_HTTP_CLIENT = HttpClientBuilder.create()
            .disableAutomaticRetries()
            .build();

    /**
     * Executes an HTTP request and returns the response body as string.
     *
     * @param request Configured HTTP request to execute
     * @return Response body as UTF-8 string
     * @throws IOException If the node cannot be reached or answers with a non-2xx status
     */
    public String executeRequest(HttpUriRequestBase request) throws IOException {
        if (logger.isDebugEnabled()) {
            logRequest(request);
        }
        return SHARED_HTTP_CLIENT.execute(request, response -> readBody(request, response));
    }

    private String readBody(HttpUriRequestBase request, ClassicHttpResponse response)
            throws IOException, ParseException {
        int statusCode = response.getCode();
        if (logger.isDebugEnabled()) {
            logResponse(response, statusCode);
        }

        HttpEntity entity = response.getEntity();
        String body = entity != null ? EntityUtils.toString(entity, StandardCharsets.UTF_8) : null;
        if (logger.isDebugEnabled()) {
            logger.debug("Response Body:");
            logger.debug("{}", body);
        }

        if (statusCode < 200 || statusCode >= 300) {
            throw new IOException("Request " + request.getMethod() + " " + request.getRequestUri()
                    + " failed, status code (" + statusCode + ")" + errorDetail(body));
        }
        if (body == null) {
            throw new IOException("Empty response entity from " + request.getRequestUri());
        }
        return body;
    }

    private static String errorDetail(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String trimmed = body.strip();
        return ": " + (trimmed.length() > MAX_ERROR_BODY ? trimmed.substring(0, MAX_ERROR_BODY) + "..." : trimmed);
    }

    private void logRequest(HttpUriRequestBase request) {
        logger.debug("=== HTTP REQUEST ===");
        logger.debug("{} {}", request.getMethod(), request.getRequestUri());
        for (var header : request.getHeaders()) {
            logger.debug("  {}: {}", header.getName(), header.getValue());
        }

        // Bodies are always StringEntity, which is repeatable
        if (request.getEntity() != null) {
            try {
                logger.debug("Request Body:");
                logger.debug("{}", EntityUtils.toString(request.getEntity(), StandardCharsets.UTF_8));
            } catch (Exception e) {
                logger.warn("Could not log request body: {}", e.getMessage());
            }
        }
    }

    private void logResponse(HttpResponse response, int statusCode) {
        logger.debug("=== HTTP RESPONSE ===");
        logger.debug("Status Code: {}", statusCode);
        for (var header : response.getHeaders()) {
            logger.debug("  {}: {}", header.getName(), header.getValue());
        }
    }
}
