package org.apache.calcite.adapter.scrollreader.source.interfaces;

import org.apache.calcite.adapter.scrollreader.source.ColumnType;
import org.apache.calcite.adapter.scrollreader.source.QueryInit;
import org.apache.calcite.adapter.scrollreader.source.ScrollBatch;
import org.apache.calcite.adapter.scrollreader.source.ScrollCursor;

import java.io.IOException;
import java.util.List;

/**
 * Executes scroll queries against one search node.
 * <p>
 * All scroll state travels in the {@link ScrollCursor} values passed in and returned,
 * so an implementation can stay stateless.
 * </p>
 */
public interface QueryBackend {

    /**
     * Checks a node's health and opens a scroll on it.
     *
     * @param healthcheckUrl   Health-check endpoint of the node
     * @param healthcheckField Field that must be present in the health-check response
     * @param requestUrl       Search endpoint that opens the scroll
     * @return Starting cursor, column names and raw column type tags
     * @throws IOException if the node cannot be reached or answers with a non-success status
     */
    QueryInit init(String healthcheckUrl, String healthcheckField, String requestUrl) throws IOException;

    /**
     * Fetches the next batch of rows.
     *
     * @param cursor      Position in the scroll
     * @param requestUrl  Search endpoint the scroll was opened with
     * @param scrollUrl   Scroll continuation endpoint of the same node
     * @param columnNames Columns to extract, in order
     * @param columnTypes Type of each column, in the same order
     * @return One value list per column and the cursor for the following call
     * @throws IOException if the request fails
     */
    ScrollBatch next(ScrollCursor cursor, String requestUrl, String scrollUrl,
                     List<String> columnNames, List<ColumnType> columnTypes) throws IOException;

    /**
     * Releases the server-side scroll context behind {@code cursor}, if it has one.
     *
     * @throws IOException if the request fails
     */
    void clear(ScrollCursor cursor, String scrollUrl) throws IOException;
}
