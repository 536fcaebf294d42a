package org.apache.calcite.adapter.scrollreader.source.exception;

/**
 * Raised at construction time when the reader configuration is malformed,
 * e.g. a node entry without an explicit {@code protocol://} scheme.
 * <p>
 * Never retried.
 * </p>
 */
public class ConfigurationException extends ScrollReaderException {

    ConfigurationException(String message) {
        super(message);
    }

    ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Factory method for a configuration failure with a message.
     *
     * @param message Human-readable description of the invalid setting.
     * @return A new ConfigurationException.
     */
    public static ConfigurationException buildConfigurationException(String message) {
        return new ConfigurationException(message);
    }

    /**
     * Factory method wrapping a parse failure of a configuration value.
     *
     * @param message Human-readable description of the invalid setting.
     * @param cause   The underlying parse error.
     * @return A new ConfigurationException.
     */
    public static ConfigurationException buildConfigurationException(String message, Throwable cause) {
        return new ConfigurationException(message, cause);
    }
}
