package org.apache.calcite.adapter.scrollreader.source;

import org.apache.calcite.adapter.scrollreader.source.exception.DecodeException;
import org.apache.calcite.sql.type.SqlTypeName;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The four value types a column can carry.
 * <p>
 * Each constant is bound to the backend type tag it is decoded from, the Java class its
 * values have inside a {@link Page}, and the SQL type it is exposed as through Calcite.
 * A column keeps its type for the whole lifetime of a session.
 * </p>
 */
public enum ColumnType {

    INT32("DT_INT32", Integer.class, SqlTypeName.INTEGER),
    INT64("DT_INT64", Long.class, SqlTypeName.BIGINT),
    DOUBLE("DT_DOUBLE", Double.class, SqlTypeName.DOUBLE),
    STRING("DT_STRING", String.class, SqlTypeName.VARCHAR);

    /** Tag produced for values outside the supported vocabulary. */
    public static final String INVALID_TAG = "DT_INVALID";

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    /** Fast lookup: backend tag -> ColumnType */
    private static final Map<String, ColumnType> BY_TAG = new HashMap<>();

    static {
        for (ColumnType value : values()) {
            BY_TAG.put(value.tag, value);
        }
    }

    private final String tag;
    private final Class<?> javaClass;
    private final SqlTypeName sqlTypeName;

    ColumnType(String tag, Class<?> javaClass, SqlTypeName sqlTypeName) {
        this.tag = tag;
        this.javaClass = javaClass;
        this.sqlTypeName = sqlTypeName;
    }

    public String getTag() {
        return tag;
    }

    public Class<?> getJavaClass() {
        return javaClass;
    }

    public SqlTypeName getSqlTypeName() {
        return sqlTypeName;
    }

    /**
     * Maps a backend type tag to its column type.
     *
     * @param tag Backend tag, e.g. {@code "DT_INT64"}
     * @return The matching type
     * @throws DecodeException if the tag is outside the supported vocabulary
     */
    public static ColumnType fromTag(String tag) {
        ColumnType type = BY_TAG.get(tag);
        if (type == null) {
            throw DecodeException.buildDecodeException("Unsupported column type tag: " + tag);
        }
        return type;
    }

    /**
     * Maps an ordered list of tags, failing on the first unsupported one.
     */
    public static List<ColumnType> fromTags(List<String> tags) {
        return tags.stream().map(ColumnType::fromTag).collect(Collectors.toUnmodifiableList());
    }

    /**
     * Converts a decoded JSON value to this column's Java type.
     *
     * @param value Value as produced by the JSON provider
     * @return Value of class {@link #getJavaClass()}
     * @throws DecodeException if the value is null or does not fit this type
     */
    public Object convert(Object value) {
        if (value == null) {
            throw DecodeException.buildDecodeException("Null value for " + this + " column");
        }
        switch (this) {
            case INT32: {
                Long integral = integralValue(value);
                if (integral == null || integral < Integer.MIN_VALUE || integral > Integer.MAX_VALUE) {
                    throw mismatch(value);
                }
                return integral.intValue();
            }
            case INT64: {
                Long integral = integralValue(value);
                if (integral == null) {
                    throw mismatch(value);
                }
                return integral;
            }
            case DOUBLE:
                if (!(value instanceof Number)) {
                    throw mismatch(value);
                }
                return ((Number) value).doubleValue();
            case STRING:
            default:
                if (value instanceof Map || value instanceof List) {
                    throw mismatch(value);
                }
                return value.toString();
        }
    }

    private DecodeException mismatch(Object value) {
        return DecodeException.buildDecodeException(
                "Value " + value + " (" + value.getClass().getSimpleName() + ") does not fit a " + this + " column");
    }

    private static Long integralValue(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger) {
            BigInteger big = (BigInteger) value;
            if (big.compareTo(LONG_MIN) >= 0 && big.compareTo(LONG_MAX) <= 0) {
                return big.longValue();
            }
        }
        return null;
    }
}
