package org.apache.calcite.adapter.scrollreader.source.exception;

import lombok.Getter;

/**
 * A single candidate node failed its health check or its initial search request.
 * <p>
 * Recovered locally by the node selector, which skips to the next candidate.
 * </p>
 */
@Getter
public class NodeUnavailableException extends ScrollReaderException {

    /** Health-check URL of the node that was skipped. */
    private final String healthcheckUrl;

    NodeUnavailableException(String healthcheckUrl, Throwable cause) {
        super("Node unavailable (" + healthcheckUrl + "): " + cause.getMessage(), cause);
        this.healthcheckUrl = healthcheckUrl;
    }

    public static NodeUnavailableException buildNodeUnavailableException(String healthcheckUrl, Throwable cause) {
        return new NodeUnavailableException(healthcheckUrl, cause);
    }
}
