package org.apache.calcite.adapter.scrollreader.source;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A fetched page together with the cursor for the following fetch.
 */
@AllArgsConstructor
@Getter
public class ScrolledPage {

    private final Page page;
    private final ScrollCursor nextCursor;
}
