package org.apache.calcite.adapter.scrollreader.source;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.apache.calcite.adapter.scrollreader.source.exception.CorruptPageException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One batch of rows, stored column by column.
 * <p>
 * Column order follows the session's column order. The row count is the length of the
 * first column; {@link #validate()} checks that every other column agrees.
 * A page with a row count of zero marks the end of the scroll.
 * </p>
 */
@ToString
@EqualsAndHashCode
public final class Page {

    private final Map<String, List<Object>> columns;

    private Page(Map<String, List<Object>> columns) {
        this.columns = Collections.unmodifiableMap(columns);
    }

    /**
     * Zips column names with their value lists.
     *
     * @param names  Ordered column names
     * @param values Value lists, one per name, in the same order
     * @return New page
     * @throws IllegalArgumentException if the two lists differ in size
     */
    public static Page of(List<String> names, List<List<Object>> values) {
        if (names.size() != values.size()) {
            throw new IllegalArgumentException("Got " + values.size() + " value columns for " + names.size() + " names");
        }
        Map<String, List<Object>> columns = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            columns.put(names.get(i), Collections.unmodifiableList(values.get(i)));
        }
        return new Page(columns);
    }

    public Set<String> getColumnNames() {
        return columns.keySet();
    }

    public Map<String, List<Object>> asMap() {
        return columns;
    }

    /**
     * Values of one column.
     *
     * @throws IllegalArgumentException if the column does not exist
     */
    public List<Object> getValues(String column) {
        List<Object> values = columns.get(column);
        if (values == null) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        return values;
    }

    /**
     * Values of one column, cast to the expected element type.
     *
     * @throws ClassCastException if a value is not of {@code type}
     */
    @SuppressWarnings("unchecked")
    public <T> List<T> getValues(String column, Class<T> type) {
        List<Object> values = getValues(column);
        for (Object value : values) {
            type.cast(value);
        }
        return (List<T>) (List<?>) values;
    }

    /**
     * Number of rows, taken from the first column. Zero when the page has no columns.
     */
    public int getRowCount() {
        if (columns.isEmpty()) {
            return 0;
        }
        return columns.values().iterator().next().size();
    }

    public boolean isEmpty() {
        return getRowCount() == 0;
    }

    /**
     * Checks that all columns hold the same number of values.
     *
     * @return this page
     * @throws CorruptPageException on the first column whose length differs from the first column's
     */
    public Page validate() {
        int rowCount = getRowCount();
        for (Map.Entry<String, List<Object>> column : columns.entrySet()) {
            if (column.getValue().size() != rowCount) {
                throw CorruptPageException.buildCorruptPageException(column.getKey(), rowCount, column.getValue().size());
            }
        }
        return this;
    }
}
