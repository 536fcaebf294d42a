package org.apache.calcite.adapter.scrollreader.source.interfaces;

import org.apache.calcite.adapter.scrollreader.source.ScrollCursor;
import org.apache.calcite.adapter.scrollreader.source.ScrolledPage;

/**
 * Callback that pulls pages out of a scroll, one per call.
 */
@FunctionalInterface
public interface ScrollIterator {

    /**
     * Fetches the page at {@code cursor}.
     *
     * @return the page and the cursor for the next call; an empty page means the scroll is exhausted
     */
    ScrolledPage getMore(ScrollCursor cursor);

    /**
     * Lets go of the scroll once no more pages will be requested.
     */
    default void release(ScrollCursor cursor) {
    }
}
