package org.apache.calcite.adapter.scrollreader.source.exception;

/**
 * A fetched page whose columns do not all have the same number of values.
 */
public class CorruptPageException extends ScrollReaderException {

    CorruptPageException(String message) {
        super(message);
    }

    public static CorruptPageException buildCorruptPageException(String column, int expectedRows, int actualRows) {
        return new CorruptPageException("Column '" + column + "' has " + actualRows
                + " values, expected " + expectedRows);
    }
}
