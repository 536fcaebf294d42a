package org.apache.calcite.adapter.scrollreader.source;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Raw result of one backend fetch: typed values per column, in session column order,
 * and the cursor for the next fetch.
 */
@AllArgsConstructor
@Getter
public class ScrollBatch {

    private final List<List<Object>> columnValues;
    private final ScrollCursor nextCursor;
}
