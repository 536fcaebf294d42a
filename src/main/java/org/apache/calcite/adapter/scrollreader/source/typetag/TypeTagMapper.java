package org.apache.calcite.adapter.scrollreader.source.typetag;

/**
 * Infers a backend type tag from a sample JSON value.
 *
 * <p><b>Example mappings:</b></p>
 * <ul>
 *   <li>42 → "DT_INT32"</li>
 *   <li>9007199254740993 → "DT_INT64"</li>
 *   <li>"abc" → "DT_STRING"</li>
 * </ul>
 */
public interface TypeTagMapper {

    /**
     * Checks if this mapper can handle the given value.
     *
     * @param value Decoded JSON value (may be null)
     * @return true if this mapper can tag it
     */
    boolean canHandle(Object value);

    /**
     * Maps the value to its type tag.
     *
     * @param value Decoded JSON value
     * @return Backend type tag
     */
    String mapTag(Object value);

    /**
     * Lower values are checked first.
     *
     * @return priority value (default: 50)
     */
    default int getPriority() {
        return 50;
    }

    String getName();
}
