package org.apache.calcite.adapter.scrollreader.source.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.calcite.adapter.scrollreader.source.SearchUrlBuilder;
import org.apache.hc.client5.http.classic.methods.HttpDelete;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.entity.StringEntity;

import java.util.concurrent.TimeUnit;

/**
 * Builds the HTTP requests of the scroll protocol.
 *
 * <ul>
 *   <li>health check and initial search: {@code GET}</li>
 *   <li>scroll continuation: {@code POST {"scroll":"1m","scroll_id":"..."}}</li>
 *   <li>scroll release: {@code DELETE {"scroll_id":["..."]}}</li>
 * </ul>
 *
 * Every request gets the configured timeouts and asks for JSON.
 */
public class HttpRequestBuilder {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final int connectionTimeout;
    private final int responseTimeout;

    /**
     * @param connectionTimeout Connection request timeout, seconds
     * @param responseTimeout   Response timeout, seconds
     */
    public HttpRequestBuilder(int connectionTimeout, int responseTimeout) {
        this.connectionTimeout = connectionTimeout;
        this.responseTimeout = responseTimeout;
    }

    public HttpUriRequestBase buildGet(String url) {
        return configure(new HttpGet(url));
    }

    public HttpUriRequestBase buildScrollRequest(String scrollUrl, String scrollId) {
        ObjectNode body = MAPPER.createObjectNode()
                .put("scroll", SearchUrlBuilder.SCROLL_WINDOW)
                .put("scroll_id", scrollId);
        HttpUriRequestBase request = configure(new HttpPost(scrollUrl));
        request.setEntity(new StringEntity(body.toString(), ContentType.APPLICATION_JSON));
        return request;
    }

    public HttpUriRequestBase buildClearScrollRequest(String scrollUrl, String scrollId) {
        ObjectNode body = MAPPER.createObjectNode();
        body.putArray("scroll_id").add(scrollId);
        HttpUriRequestBase request = configure(new HttpDelete(scrollUrl));
        request.setEntity(new StringEntity(body.toString(), ContentType.APPLICATION_JSON));
        return request;
    }

    private HttpUriRequestBase configure(HttpUriRequestBase request) {
        request.setConfig(RequestConfig.custom()
                .setConnectionRequestTimeout(connectionTimeout, TimeUnit.SECONDS)
                .setResponseTimeout(responseTimeout, TimeUnit.SECONDS)
                .build());
        request.setHeader(HttpHeaders.ACCEPT, ContentType.APPLICATION_JSON.getMimeType());
        return request;
    }
}
