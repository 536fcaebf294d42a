package org.apache.calcite.adapter.scrollreader.source.typetag;

import org.apache.calcite.adapter.scrollreader.source.ColumnType;

import java.math.BigInteger;

/**
 * Maps integral numbers: values in 32-bit range → "DT_INT32", values in 64-bit range → "DT_INT64",
 * anything wider → {@link ColumnType#INVALID_TAG}.
 */
public class IntegerTagMapper implements TypeTagMapper {

    @Override
    public boolean canHandle(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger;
    }

    @Override
    public String mapTag(Object value) {
        if (value instanceof BigInteger) {
            return ((BigInteger) value).bitLength() < Long.SIZE ? "DT_INT64" : ColumnType.INVALID_TAG;
        }
        long longValue = ((Number) value).longValue();
        if (longValue >= Integer.MIN_VALUE && longValue <= Integer.MAX_VALUE) {
            return "DT_INT32";
        }
        return "DT_INT64";
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    public String getName() {
        return "IntegerTagMapper";
    }
}
