package org.apache.calcite.adapter.scrollreader.source;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * What the backend reports after opening a scroll: the starting cursor and the columns
 * it discovered, with their raw backend type tags.
 */
@AllArgsConstructor
@Getter
public class QueryInit {

    private final ScrollCursor cursor;
    private final List<String> columnNames;
    private final List<String> typeTags;
}
