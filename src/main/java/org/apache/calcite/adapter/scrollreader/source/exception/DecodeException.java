package org.apache.calcite.adapter.scrollreader.source.exception;

/**
 * A backend response could not be decoded into typed columns: a missing field,
 * a value incompatible with its column type, or an unknown backend type tag.
 */
public class DecodeException extends ScrollReaderException {

    DecodeException(String message) {
        super(message);
    }

    DecodeException(String message, Throwable cause) {
        super(message, cause);
    }

    public static DecodeException buildDecodeException(String message) {
        return new DecodeException(message);
    }

    public static DecodeException buildDecodeException(String message, Throwable cause) {
        return new DecodeException(message, cause);
    }
}
