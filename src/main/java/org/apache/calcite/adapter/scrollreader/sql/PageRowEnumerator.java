package org.apache.calcite.adapter.scrollreader.sql;

import org.apache.calcite.adapter.scrollreader.source.Page;
import org.apache.calcite.adapter.scrollreader.source.PageSource;
import org.apache.calcite.adapter.scrollreader.source.ScrollDataset;
import org.apache.calcite.linq4j.Enumerator;

import java.util.List;

/**
 * Enumerator that flattens a dataset's pages into table rows.
 * <p>
 * Pages are pulled one at a time as rows run out. Row values are picked by column name,
 * so the row layout follows the table's row type even if a scan sees the columns in a
 * different order.
 * </p>
 */
public class PageRowEnumerator implements Enumerator<Object[]> {

    private final ScrollDataset dataset;
    private final PageSource pages;
    /** Column names in row-type order */
    private final List<String> columnNames;

    /** Current page */
    private Page page;
    /** Current row index within the page */
    private int index = -1;
    private Object[] current;

    public PageRowEnumerator(ScrollDataset dataset, List<String> columnNames) {
        this.dataset = dataset;
        this.pages = dataset.iterator();
        this.columnNames = columnNames;
    }

    @Override
    public Object[] current() {
        return current;
    }

    /**
     * Advances to the next row, fetching the next page when the current one is used up.
     */
    @Override
    public boolean moveNext() {
        while (page == null || index + 1 >= page.getRowCount()) {
            if (!pages.hasNext()) {
                current = null;
                return false;
            }
            page = pages.next();
            index = -1;
        }
        index++;
        current = buildRow(page, index);
        return true;
    }

    /**
     * A scroll cannot be rewound; scan the table again instead.
     */
    @Override
    public void reset() {
        throw new UnsupportedOperationException("Scroll enumerators cannot be reset");
    }

    @Override
    public void close() {
        dataset.close();
    }

    private Object[] buildRow(Page page, int row) {
        Object[] values = new Object[columnNames.size()];
        for (int i = 0; i < columnNames.size(); i++) {
            values[i] = page.getValues(columnNames.get(i)).get(row);
        }
        return values;
    }
}
