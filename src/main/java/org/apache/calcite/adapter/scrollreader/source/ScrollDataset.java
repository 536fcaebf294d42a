package org.apache.calcite.adapter.scrollreader.source;

import org.apache.calcite.adapter.scrollreader.model.QueryTarget;
import org.apache.calcite.adapter.scrollreader.model.ReaderConfig;
import org.apache.calcite.adapter.scrollreader.source.exception.ConfigurationException;
import org.apache.calcite.adapter.scrollreader.source.exception.NoHealthyNodeException;
import org.apache.calcite.adapter.scrollreader.source.interfaces.QueryBackend;
import org.apache.calcite.adapter.scrollreader.source.interfaces.ScrollIterator;
import org.apache.calcite.adapter.scrollreader.source.service.HttpQueryBackend;

import java.util.List;

/**
 * A search index read as a lazy sequence of column-oriented pages.
 * <p>
 * Construction resolves the configured nodes, derives their URLs and selects the first
 * healthy one; all of that happens exactly once. The page sequence can be obtained once.
 * To read the index again, construct a new dataset.
 * </p>
 *
 * <pre>{@code
 * try (ScrollDataset dataset = new ScrollDataset(ReaderConfig.of(List.of("http://localhost:9200"), "books", null))) {
 *     for (Page page : dataset) {
 *         List<String> titles = page.getValues("title", String.class);
 *     }
 * }
 * }</pre>
 */
public class ScrollDataset implements Iterable<Page>, AutoCloseable {

    private final Session session;
    private final PageFetcher pageFetcher;
    private PageSource pageSource;
    private boolean closed;

    /**
     * Connects over HTTP.
     *
     * @throws ConfigurationException if the configuration is malformed
     * @throws NoHealthyNodeException if no node could be used
     */
    public ScrollDataset(ReaderConfig config) {
        this(config, new HttpQueryBackend(config));
    }

    public ScrollDataset(ReaderConfig config, QueryBackend backend) {
        QueryTarget target = config.toQueryTarget();
        List<String> baseUrls = new EndpointResolver().resolve(config.getNodes());
        SearchUrlBuilder urlBuilder = new SearchUrlBuilder();
        NodeSelector nodeSelector = new NodeSelector(backend, config.getHealthcheckField());
        this.session = nodeSelector.select(urlBuilder.healthcheckUrls(baseUrls), urlBuilder.requestUrls(baseUrls, target));
        this.pageFetcher = new PageFetcher(backend, urlBuilder);
    }

    public List<String> getColumnNames() {
        return session.getColumnNames();
    }

    public List<ColumnType> getColumnTypes() {
        return session.getColumnTypes();
    }

    /**
     * Search URL of the node this dataset reads from.
     */
    public String getRequestUrl() {
        return session.getRequestUrl();
    }

    /**
     * Returns the page sequence.
     *
     * @throws IllegalStateException on a second call
     */
    @Override
    public PageSource iterator() {
        if (pageSource != null) {
            throw new IllegalStateException("A scroll dataset can be iterated only once, construct a new one to read again");
        }
        pageSource = new ScrollPageSource(session.getInitialCursor(), new ScrollIterator() {
            @Override
            public ScrolledPage getMore(ScrollCursor cursor) {
                return pageFetcher.fetchNext(session, cursor);
            }

            @Override
            public void release(ScrollCursor cursor) {
                pageFetcher.release(session, cursor);
            }
        });
        return pageSource;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (pageSource != null) {
            pageSource.close();
        } else {
            pageFetcher.release(session, session.getInitialCursor());
        }
    }
}
