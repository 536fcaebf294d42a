package org.apache.calcite.adapter.scrollreader.source;

import org.apache.calcite.adapter.scrollreader.source.exception.ConfigurationException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns the configured node list into base URLs of the form {@code scheme://authority}.
 *
 * <ul>
 *   <li>No nodes: the single default node {@value #DEFAULT_NODE}.</li>
 *   <li>Every entry must spell out its protocol ({@code http://host:port}).</li>
 *   <li>Path, query and fragment of an entry are dropped.</li>
 *   <li>Order is preserved and duplicates are kept.</li>
 * </ul>
 */
public class EndpointResolver {

    public static final String DEFAULT_NODE = "http://localhost:9200";

    /**
     * Resolves a node list.
     *
     * @param nodes Ordered node entries, or null for the default node
     * @return Base URLs in input order
     * @throws ConfigurationException if an entry lacks a scheme or cannot be parsed
     */
    public List<String> resolve(List<String> nodes) {
        if (nodes == null) {
            nodes = List.of(DEFAULT_NODE);
        }
        List<String> baseUrls = new ArrayList<>(nodes.size());
        for (String node : nodes) {
            baseUrls.add(toBaseUrl(node));
        }
        return baseUrls;
    }

    /**
     * Resolves a single node entry.
     */
    public List<String> resolve(String node) {
        return resolve(node == null ? null : List.of(node));
    }

    private String toBaseUrl(String node) {
        if (node == null || !node.contains("//")) {
            throw ConfigurationException.buildConfigurationException(
                    "Please provide the list of nodes in 'protocol://host:port' format, got: " + node);
        }
        URI uri;
        try {
            uri = new URI(node.trim());
        } catch (URISyntaxException e) {
            throw ConfigurationException.buildConfigurationException("Malformed node URL: " + node, e);
        }
        if (uri.getScheme() == null || uri.getRawAuthority() == null || uri.getRawAuthority().isEmpty()) {
            throw ConfigurationException.buildConfigurationException(
                    "Node URL needs both a protocol and a host: " + node);
        }
        return uri.getScheme() + "://" + uri.getRawAuthority();
    }
}
