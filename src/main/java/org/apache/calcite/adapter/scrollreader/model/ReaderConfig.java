package org.apache.calcite.adapter.scrollreader.model;

import lombok.Data;
import org.apache.calcite.adapter.scrollreader.source.config.AdapterConfiguration;
import org.apache.calcite.adapter.scrollreader.source.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Connection settings of a scroll reader.
 * <p>
 * {@code nodes} may be left null, in which case the default local node is used.
 * Timeouts are in seconds.
 * </p>
 */
@Data
public class ReaderConfig {

    public static final String DEFAULT_HEALTHCHECK_FIELD = "status";
    public static final int DEFAULT_TIMEOUT_SECONDS = 30;

    private List<String> nodes;
    private String index;
    private String docType;
    private String healthcheckField = DEFAULT_HEALTHCHECK_FIELD;
    private int connectionTimeout = DEFAULT_TIMEOUT_SECONDS;
    private int responseTimeout = DEFAULT_TIMEOUT_SECONDS;

    public static ReaderConfig of(List<String> nodes, String index, String docType) {
        ReaderConfig config = new ReaderConfig();
        config.setNodes(nodes);
        config.setIndex(index);
        config.setDocType(docType);
        return config;
    }

    public QueryTarget toQueryTarget() {
        return new QueryTarget(index, docType);
    }

    /**
     * Returns a copy of these settings pointed at another index.
     */
    public ReaderConfig forIndex(String otherIndex) {
        ReaderConfig copy = new ReaderConfig();
        copy.setNodes(nodes == null ? null : new ArrayList<>(nodes));
        copy.setIndex(otherIndex);
        copy.setDocType(docType);
        copy.setHealthcheckField(healthcheckField);
        copy.setConnectionTimeout(connectionTimeout);
        copy.setResponseTimeout(responseTimeout);
        return copy;
    }

    /**
     * Builds settings from a Calcite schema operand map.
     * <p>
     * Recognized keys: {@code nodes} (string or list), {@code index}, {@code docType},
     * {@code healthcheckField}, {@code connectionTimeout}, {@code responseTimeout}.
     * Timeouts missing from the operand fall back to {@code configuration}.
     * A list-valued {@code index} is left unset here; callers split it per table.
     * </p>
     *
     * @param operand       Operand map from the Calcite model
     * @param configuration Source of default settings
     * @return Populated configuration
     * @throws ConfigurationException if a value has the wrong shape
     */
    public static ReaderConfig fromOperand(Map<String, Object> operand, AdapterConfiguration configuration) {
        ReaderConfig config = new ReaderConfig();
        config.setNodes(toNodeList(operand.get("nodes")));
        Object index = operand.get("index");
        if (index instanceof String) {
            config.setIndex((String) index);
        }
        Object docType = operand.get("docType");
        if (docType != null) {
            config.setDocType(docType.toString());
        }
        Object healthcheckField = operand.get("healthcheckField");
        if (healthcheckField != null) {
            config.setHealthcheckField(healthcheckField.toString());
        }
        try {
            config.setConnectionTimeout(intValue(operand.get("connectionTimeout"),
                    configuration.getInt(AdapterConfiguration.CONNECTION_TIMEOUT, DEFAULT_TIMEOUT_SECONDS)));
            config.setResponseTimeout(intValue(operand.get("responseTimeout"),
                    configuration.getInt(AdapterConfiguration.RESPONSE_TIMEOUT, DEFAULT_TIMEOUT_SECONDS)));
        } catch (NumberFormatException e) {
            throw ConfigurationException.buildConfigurationException("Invalid timeout: " + e.getMessage(), e);
        }
        return config;
    }

    /**
     * Normalizes the accepted node shapes (absent, single string, ordered collection) to a list.
     */
    public static List<String> toNodeList(Object nodes) {
        if (nodes == null) {
            return null;
        }
        if (nodes instanceof String) {
            return List.of((String) nodes);
        }
        if (nodes instanceof Collection) {
            List<String> list = new ArrayList<>();
            for (Object node : (Collection<?>) nodes) {
                if (!(node instanceof String)) {
                    throw ConfigurationException.buildConfigurationException("Node entries must be strings, got: " + node);
                }
                list.add((String) node);
            }
            return list;
        }
        throw ConfigurationException.buildConfigurationException(
                "Nodes must be a string or a list of strings, got: " + nodes.getClass().getSimpleName());
    }

    private static int intValue(Object value, int defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(value.toString().trim());
    }
}
