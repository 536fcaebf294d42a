package org.apache.calcite.adapter.scrollreader.source.typetag;

import org.apache.calcite.adapter.scrollreader.source.ColumnType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Selects the type-tag mapper for a sample value.
 *
 * <p>Mappers are checked in priority order (lower priority values first).
 * The first mapper that can handle the value is used.</p>
 *
 * <pre>{@code
 * TypeTagMapperChain chain = TypeTagMapperChain.defaultChain();
 * String tag = chain.mapTag(3.5); // "DT_DOUBLE"
 * }</pre>
 */
public class TypeTagMapperChain {

    private final List<TypeTagMapper> mappers = new ArrayList<>();

    /**
     * Chain with the integer, number, string and fallback mappers registered.
     */
    public static TypeTagMapperChain defaultChain() {
        return new TypeTagMapperChain()
                .addMapper(new IntegerTagMapper())
                .addMapper(new NumberTagMapper())
                .addMapper(new StringTagMapper())
                .addMapper(new DefaultTagMapper());
    }

    /**
     * Adds a mapper to the chain, keeping the chain sorted by priority.
     *
     * @param mapper Mapper to add
     * @return This chain instance for method chaining
     */
    public TypeTagMapperChain addMapper(TypeTagMapper mapper) {
        mappers.add(mapper);
        mappers.sort(Comparator.comparingInt(TypeTagMapper::getPriority));
        return this;
    }

    /**
     * Maps a value using the first matching mapper.
     *
     * @param value Decoded JSON value
     * @return Backend type tag, {@link ColumnType#INVALID_TAG} if no mapper matched
     */
    public String mapTag(Object value) {
        for (TypeTagMapper mapper : mappers) {
            if (mapper.canHandle(value)) {
                return mapper.mapTag(value);
            }
        }
        return ColumnType.INVALID_TAG;
    }

    /**
     * Returns all registered mappers in priority order.
     */
    public List<TypeTagMapper> getMappers() {
        return new ArrayList<>(mappers);
    }
}
