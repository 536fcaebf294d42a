package org.apache.calcite.adapter.scrollreader.source.exception;

/**
 * A page fetch failed after the session was established.
 * <p>
 * Not retried and not failed over to another node; the page sequence ends with this error.
 * </p>
 */
public class FetchException extends ScrollReaderException {

    FetchException(String message, Throwable cause) {
        super(message, cause);
    }

    public static FetchException buildFetchException(String scrollUrl, Throwable cause) {
        return new FetchException("Failed to fetch next page from " + scrollUrl + ": " + cause.getMessage(), cause);
    }
}
