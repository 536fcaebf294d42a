package org.apache.calcite.adapter.scrollreader.source.typetag;

/**
 * Maps fractional numbers to "DT_DOUBLE". Checked after {@link IntegerTagMapper}.
 */
public class NumberTagMapper implements TypeTagMapper {

    @Override
    public boolean canHandle(Object value) {
        return value instanceof Number;
    }

    @Override
    public String mapTag(Object value) {
        return "DT_DOUBLE";
    }

    @Override
    public int getPriority() {
        return 20;
    }

    @Override
    public String getName() {
        return "NumberTagMapper";
    }
}
