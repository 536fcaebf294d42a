package org.apache.calcite.adapter.scrollreader.source;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Outcome of a successful node selection: where to read from and what the columns are.
 * <p>
 * Created once per dataset and never rebuilt, even if the node later becomes unhealthy.
 * </p>
 */
@Getter
@ToString
public final class Session {

    /** Search URL of the node that passed selection. */
    private final String requestUrl;
    private final List<String> columnNames;
    private final List<ColumnType> columnTypes;
    /** Cursor to start paging from. */
    private final ScrollCursor initialCursor;

    public Session(String requestUrl, List<String> columnNames, List<ColumnType> columnTypes, ScrollCursor initialCursor) {
        if (columnNames.size() != columnTypes.size()) {
            throw new IllegalArgumentException("Got " + columnNames.size() + " column names but "
                    + columnTypes.size() + " column types");
        }
        this.requestUrl = requestUrl;
        this.columnNames = List.copyOf(columnNames);
        this.columnTypes = List.copyOf(columnTypes);
        this.initialCursor = initialCursor;
    }
}
