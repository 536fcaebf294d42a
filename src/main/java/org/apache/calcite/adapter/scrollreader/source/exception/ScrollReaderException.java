package org.apache.calcite.adapter.scrollreader.source.exception;

/**
 * Base type for all failures raised while resolving, selecting or reading a scroll source.
 * <p>
 * Unchecked, so that the lazy page sequence can surface errors through
 * {@link java.util.Iterator} methods.
 * </p>
 */
public class ScrollReaderException extends RuntimeException {

    public ScrollReaderException(String message) {
        super(message);
    }

    public ScrollReaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
