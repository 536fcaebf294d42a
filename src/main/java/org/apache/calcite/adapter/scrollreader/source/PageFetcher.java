package org.apache.calcite.adapter.scrollreader.source;

import org.apache.calcite.adapter.scrollreader.source.exception.DecodeException;
import org.apache.calcite.adapter.scrollreader.source.exception.FetchException;
import org.apache.calcite.adapter.scrollreader.source.interfaces.QueryBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Fetches one page of an open session and shapes it into named columns.
 * <p>
 * Never changes the session. Failures are not retried.
 * </p>
 */
public class PageFetcher {

    private static final Logger logger = LoggerFactory.getLogger(PageFetcher.class);

    private final QueryBackend backend;
    private final SearchUrlBuilder urlBuilder;

    public PageFetcher(QueryBackend backend, SearchUrlBuilder urlBuilder) {
        this.backend = backend;
        this.urlBuilder = urlBuilder;
    }

    /**
     * Fetches the page at {@code cursor}.
     *
     * @param session Session the cursor belongs to
     * @param cursor  Current scroll position
     * @return The page and the cursor for the next fetch
     * @throws FetchException  if the request fails
     * @throws DecodeException if the response cannot be decoded into the session's columns
     */
    public ScrolledPage fetchNext(Session session, ScrollCursor cursor) {
        String scrollUrl = urlBuilder.scrollUrl(session.getRequestUrl());
        ScrollBatch batch;
        try {
            batch = backend.next(cursor, session.getRequestUrl(), scrollUrl,
                    session.getColumnNames(), session.getColumnTypes());
        } catch (IOException e) {
            throw FetchException.buildFetchException(scrollUrl, e);
        }
        if (batch.getColumnValues().size() != session.getColumnNames().size()) {
            throw DecodeException.buildDecodeException("Backend returned " + batch.getColumnValues().size()
                    + " columns, session has " + session.getColumnNames().size());
        }
        Page page = Page.of(session.getColumnNames(), batch.getColumnValues());
        return new ScrolledPage(page, batch.getNextCursor());
    }

    /**
     * Releases the scroll context behind {@code cursor}. Failures are logged, not thrown:
     * the backend expires the context on its own once the scroll window passes.
     */
    public void release(Session session, ScrollCursor cursor) {
        if (!cursor.hasScrollId()) {
            return;
        }
        String scrollUrl = urlBuilder.scrollUrl(session.getRequestUrl());
        try {
            backend.clear(cursor, scrollUrl);
            logger.debug("Cleared scroll at {}", scrollUrl);
        } catch (IOException e) {
            logger.warn("Could not clear scroll at {}: {}", scrollUrl, e.getMessage());
        }
    }
}
