package org.apache.calcite.adapter.scrollreader.source.typetag;

public class StringTagMapper implements TypeTagMapper {

    @Override
    public boolean canHandle(Object value) {
        return value instanceof String;
    }

    @Override
    public String mapTag(Object value) {
        return "DT_STRING";
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    public String getName() {
        return "StringTagMapper";
    }
}
