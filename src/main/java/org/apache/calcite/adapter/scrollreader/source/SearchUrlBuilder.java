package org.apache.calcite.adapter.scrollreader.source;

import org.apache.calcite.adapter.scrollreader.model.QueryTarget;

import java.net.URI;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Derives the endpoints a reader talks to from a node's base URL.
 *
 * <pre>
 * health check : {base}/_cluster/health
 * search       : {base}/{index}[/{docType}]/_search?scroll=1m
 * scroll       : {scheme}://{authority}/_search/scroll
 * </pre>
 *
 * The paths must match the backend's API exactly.
 */
public class SearchUrlBuilder {

    /** Keep-alive of the server-side scroll context between two page requests. */
    public static final String SCROLL_WINDOW = "1m";

    static final String HEALTHCHECK_PATH = "/_cluster/health";
    static final String SEARCH_PATH = "/_search?scroll=" + SCROLL_WINDOW;
    static final String SCROLL_PATH = "/_search/scroll";

    public String healthcheckUrl(String baseUrl) {
        return baseUrl + HEALTHCHECK_PATH;
    }

    public String requestUrl(String baseUrl, QueryTarget target) {
        if (target.hasDocType()) {
            return baseUrl + "/" + target.getIndex() + "/" + target.getDocType() + SEARCH_PATH;
        }
        return baseUrl + "/" + target.getIndex() + SEARCH_PATH;
    }

    public List<String> healthcheckUrls(List<String> baseUrls) {
        return baseUrls.stream().map(this::healthcheckUrl).collect(Collectors.toList());
    }

    public List<String> requestUrls(List<String> baseUrls, QueryTarget target) {
        return baseUrls.stream().map(base -> requestUrl(base, target)).collect(Collectors.toList());
    }

    /**
     * Scroll continuation URL for a search URL: same scheme and authority, fixed path,
     * no query.
     *
     * @param requestUrl Any search URL built by this class
     * @return The scroll URL of the same node
     */
    public String scrollUrl(String requestUrl) {
        URI uri = URI.create(requestUrl);
        return uri.getScheme() + "://" + uri.getRawAuthority() + SCROLL_PATH;
    }
}
