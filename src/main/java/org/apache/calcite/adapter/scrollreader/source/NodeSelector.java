package org.apache.calcite.adapter.scrollreader.source;

import com.google.common.base.Joiner;
import org.apache.calcite.adapter.scrollreader.source.exception.NoHealthyNodeException;
import org.apache.calcite.adapter.scrollreader.source.exception.NodeUnavailableException;
import org.apache.calcite.adapter.scrollreader.source.interfaces.QueryBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Picks the first candidate node that passes its health check and answers the initial search.
 * <p>
 * Candidates are tried strictly in the given order; once one succeeds, the rest are not
 * contacted. This is a one-time enumeration at setup, not a retry policy.
 * </p>
 */
public class NodeSelector {

    private static final Logger logger = LoggerFactory.getLogger(NodeSelector.class);

    private final QueryBackend backend;
    private final String healthcheckField;

    public NodeSelector(QueryBackend backend, String healthcheckField) {
        this.backend = backend;
        this.healthcheckField = healthcheckField;
    }

    /**
     * Opens a session on the first healthy node.
     *
     * @param healthcheckUrls Health-check URL per candidate
     * @param requestUrls     Search URL per candidate, parallel to {@code healthcheckUrls}
     * @return Session bound to the first candidate that succeeded
     * @throws NoHealthyNodeException if every candidate failed
     */
    public Session select(List<String> healthcheckUrls, List<String> requestUrls) {
        if (healthcheckUrls.size() != requestUrls.size()) {
            throw new IllegalArgumentException("Got " + healthcheckUrls.size() + " health-check URLs but "
                    + requestUrls.size() + " request URLs");
        }
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < healthcheckUrls.size(); i++) {
            String healthcheckUrl = healthcheckUrls.get(i);
            try {
                Session session = open(healthcheckUrl, requestUrls.get(i));
                logger.info("Connection successful: {}", healthcheckUrl);
                return session;
            } catch (NodeUnavailableException e) {
                errors.add(e.getMessage());
                logger.warn("Skipping host: {} ({})", healthcheckUrl, e.getCause().getMessage());
            }
        }
        throw NoHealthyNodeException.buildNoHealthyNodeException(
                "No healthy node available for this index, check the cluster status and index: "
                        + Joiner.on(", \n").join(errors));
    }

    /**
     * Attempts a single candidate.
     *
     * @throws NodeUnavailableException on any failure of the health check, the initial search or its decoding,
     *                                  including unchecked failures raised by the backend
     */
    Session open(String healthcheckUrl, String requestUrl) {
        try {
            QueryInit init = backend.init(healthcheckUrl, healthcheckField, requestUrl);
            List<ColumnType> columnTypes = ColumnType.fromTags(init.getTypeTags());
            logger.debug("Columns {} with types {} from {}", init.getColumnNames(), columnTypes, requestUrl);
            return new Session(requestUrl, init.getColumnNames(), columnTypes, init.getCursor());
        } catch (IOException | RuntimeException e) {
            throw NodeUnavailableException.buildNodeUnavailableException(healthcheckUrl, e);
        }
    }
}
