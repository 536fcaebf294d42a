package org.apache.calcite.adapter.scrollreader.source.service;

import org.apache.calcite.adapter.scrollreader.model.ReaderConfig;
import org.apache.calcite.adapter.scrollreader.source.ColumnType;
import org.apache.calcite.adapter.scrollreader.source.QueryInit;
import org.apache.calcite.adapter.scrollreader.source.ScrollBatch;
import org.apache.calcite.adapter.scrollreader.source.ScrollCursor;
import org.apache.calcite.adapter.scrollreader.source.exception.DecodeException;
import org.apache.calcite.adapter.scrollreader.source.interfaces.QueryBackend;
import org.apache.calcite.adapter.scrollreader.source.json.SearchResponseReader;
import org.apache.calcite.adapter.scrollreader.source.typetag.TypeTagMapperChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link QueryBackend} speaking the search engine's scroll API over HTTP.
 *
 * <p><b>Opening a scroll:</b></p>
 * <ol>
 *   <li>{@code GET} the health-check URL; the configured field must be present, its value is not judged.</li>
 *   <li>{@code GET} the search URL, which opens the scroll.</li>
 *   <li>Columns are the keys of the first hit's {@code _source}; their tags come from the sample values.</li>
 *   <li>The hits of that response stay in the initial cursor and become the first page.</li>
 * </ol>
 *
 * <p><b>Paging:</b> buffered hits first, then {@code POST} to the scroll URL with the current scroll id.
 * Without a scroll id there is nothing left to page through.</p>
 */
public class HttpQueryBackend implements QueryBackend {

    private static final Logger logger = LoggerFactory.getLogger(HttpQueryBackend.class);

    private final HttpRequestBuilder requestBuilder;
    private final HttpRequestExecutor requestExecutor;
    private final TypeTagMapperChain typeTagMapperChain;

    public HttpQueryBackend(ReaderConfig config) {
        this(new HttpRequestBuilder(config.getConnectionTimeout(), config.getResponseTimeout()),
                new HttpRequestExecutor(),
                TypeTagMapperChain.defaultChain());
    }

    public HttpQueryBackend(HttpRequestBuilder requestBuilder, HttpRequestExecutor requestExecutor,
                            TypeTagMapperChain typeTagMapperChain) {
        this.requestBuilder = requestBuilder;
        this.requestExecutor = requestExecutor;
        this.typeTagMapperChain = typeTagMapperChain;
    }

    @Override
    public QueryInit init(String healthcheckUrl, String healthcheckField, String requestUrl) throws IOException {
        String health = requestExecutor.executeRequest(requestBuilder.buildGet(healthcheckUrl));
        Object status = new SearchResponseReader(health).readField(healthcheckField);
        logger.debug("Health check {} reported {}={}", healthcheckUrl, healthcheckField, status);

        SearchResponseReader search = new SearchResponseReader(
                requestExecutor.executeRequest(requestBuilder.buildGet(requestUrl)));
        List<Map<String, Object>> hits = search.readHitSources();

        List<String> columnNames = new ArrayList<>();
        List<String> typeTags = new ArrayList<>();
        if (hits.isEmpty()) {
            logger.info("No documents behind {}, the dataset has no columns", requestUrl);
        } else {
            for (Map.Entry<String, Object> field : hits.get(0).entrySet()) {
                columnNames.add(field.getKey());
                typeTags.add(typeTagMapperChain.mapTag(field.getValue()));
            }
        }
        return new QueryInit(ScrollCursor.initial(search.readScrollId(), hits), columnNames, typeTags);
    }

    @Override
    public ScrollBatch next(ScrollCursor cursor, String requestUrl, String scrollUrl,
                            List<String> columnNames, List<ColumnType> columnTypes) throws IOException {
        if (cursor.hasBufferedHits()) {
            return new ScrollBatch(decode(cursor.getBufferedHits(), columnNames, columnTypes), cursor.advance(null));
        }
        if (!cursor.hasScrollId()) {
            logger.debug("No scroll id issued for {}, nothing more to read", requestUrl);
            return new ScrollBatch(decode(List.of(), columnNames, columnTypes), cursor);
        }
        SearchResponseReader response = new SearchResponseReader(
                requestExecutor.executeRequest(requestBuilder.buildScrollRequest(scrollUrl, cursor.getScrollId())));
        List<Map<String, Object>> hits = response.readHitSources();
        return new ScrollBatch(decode(hits, columnNames, columnTypes), cursor.advance(response.readScrollId()));
    }

    @Override
    public void clear(ScrollCursor cursor, String scrollUrl) throws IOException {
        if (!cursor.hasScrollId()) {
            return;
        }
        requestExecutor.executeRequest(requestBuilder.buildClearScrollRequest(scrollUrl, cursor.getScrollId()));
    }

    /**
     * Pivots document sources into one typed value list per column.
     *
     * @throws DecodeException if a document lacks a column or holds a value of the wrong type
     */
    private List<List<Object>> decode(List<Map<String, Object>> hits, List<String> columnNames,
                                      List<ColumnType> columnTypes) {
        List<List<Object>> columns = new ArrayList<>(columnNames.size());
        for (int i = 0; i < columnNames.size(); i++) {
            String name = columnNames.get(i);
            ColumnType type = columnTypes.get(i);
            List<Object> values = new ArrayList<>(hits.size());
            for (Map<String, Object> hit : hits) {
                if (!hit.containsKey(name)) {
                    throw DecodeException.buildDecodeException("Document is missing field '" + name + "': " + hit);
                }
                try {
                    values.add(type.convert(hit.get(name)));
                } catch (DecodeException e) {
                    throw DecodeException.buildDecodeException("Field '" + name + "': " + e.getMessage(), e);
                }
            }
            columns.add(values);
        }
        return columns;
    }
}
