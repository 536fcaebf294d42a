package org.apache.calcite.adapter.scrollreader.source;

import org.apache.calcite.adapter.scrollreader.source.interfaces.ScrollIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.NoSuchElementException;

/**
 * {@link PageSource} driven by a fetch counter over a scroll.
 * <p>
 * Each pull fetches one page. Pages are yielded while they hold rows; the first empty page
 * ends the sequence and is not yielded. Every page is checked for equal column lengths
 * before anything else is decided about it.
 * </p>
 * <p>
 * A failed fetch terminates the source: the exception is thrown to the caller and the
 * source reports no further pages. Not thread-safe.
 * </p>
 */
public class ScrollPageSource implements PageSource {

    private static final Logger logger = LoggerFactory.getLogger(ScrollPageSource.class);

    private final ScrollIterator scrollIterator;
    /** Cursor for the next fetch. */
    private ScrollCursor cursor;
    /** Fetched page not yet handed to the caller. */
    private Page pending;
    /** Number of fetches issued so far. */
    private long fetchCount;
    private boolean exhausted;
    private boolean released;

    public ScrollPageSource(ScrollCursor initialCursor, ScrollIterator scrollIterator) {
        this.cursor = initialCursor;
        this.scrollIterator = scrollIterator;
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (exhausted) {
            return false;
        }
        Page page;
        try {
            ScrolledPage scrolled = scrollIterator.getMore(cursor);
            fetchCount++;
            cursor = scrolled.getNextCursor();
            page = scrolled.getPage().validate();
        } catch (RuntimeException e) {
            logger.error("Page fetch #{} failed, ending scroll", fetchCount + 1, e);
            try {
                finish();
            } catch (RuntimeException releaseFailure) {
                e.addSuppressed(releaseFailure);
            }
            throw e;
        }
        if (page.isEmpty()) {
            logger.debug("Scroll exhausted after {} fetches", fetchCount);
            finish();
            return false;
        }
        pending = page;
        return true;
    }

    @Override
    public Page next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Scroll is exhausted");
        }
        Page page = pending;
        pending = null;
        return page;
    }

    /**
     * Number of fetches issued, including the final empty one.
     */
    public long getFetchCount() {
        return fetchCount;
    }

    @Override
    public void close() {
        pending = null;
        finish();
    }

    private void finish() {
        exhausted = true;
        if (!released) {
            released = true;
            scrollIterator.release(cursor);
        }
    }
}
