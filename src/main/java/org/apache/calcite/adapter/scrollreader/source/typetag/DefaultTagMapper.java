package org.apache.calcite.adapter.scrollreader.source.typetag;

import org.apache.calcite.adapter.scrollreader.source.ColumnType;

/**
 * Fallback for booleans, nulls, objects and arrays. They get the invalid tag,
 * which the session rejects when it maps tags to column types.
 */
public class DefaultTagMapper implements TypeTagMapper {

    @Override
    public boolean canHandle(Object value) {
        return true;
    }

    @Override
    public String mapTag(Object value) {
        return ColumnType.INVALID_TAG;
    }

    @Override
    public int getPriority() {
        return 100;
    }

    @Override
    public String getName() {
        return "DefaultTagMapper";
    }
}
