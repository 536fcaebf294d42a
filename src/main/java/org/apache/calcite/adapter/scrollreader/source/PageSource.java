package org.apache.calcite.adapter.scrollreader.source;

import com.google.common.collect.Streams;

import java.util.Iterator;
import java.util.stream.Stream;

/**
 * Lazily pulled sequence of pages.
 * <p>
 * {@link #hasNext()} fetches at most one page ahead; {@link #next()} hands it over.
 * A source is consumed once and cannot be rewound.
 * </p>
 */
public interface PageSource extends Iterator<Page>, AutoCloseable {

    /**
     * Stops reading and releases server-side state. Safe to call more than once.
     */
    @Override
    void close();

    /**
     * Remaining pages as a sequential stream; closing the stream closes this source.
     */
    default Stream<Page> stream() {
        return Streams.stream(this).onClose(this::close);
    }
}
