package org.apache.calcite.adapter.scrollreader.source.config;

/**
 * Source of reader-wide default settings.
 *
 * <p>Abstracts where defaults come from (system properties, environment, a test map)
 * so that the operand-driven configuration stays testable.</p>
 *
 * <p><b>Configuration keys:</b></p>
 * <ul>
 *   <li>{@value #CONNECTION_TIMEOUT} - connection request timeout, seconds</li>
 *   <li>{@value #RESPONSE_TIMEOUT} - response timeout, seconds</li>
 * </ul>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * AdapterConfiguration config = new SystemPropertyConfiguration();
 * int timeout = config.getInt(AdapterConfiguration.RESPONSE_TIMEOUT, 30);
 * }</pre>
 */
public interface AdapterConfiguration {

    String CONNECTION_TIMEOUT = "calcite.scrollreader.connectionTimeout";
    String RESPONSE_TIMEOUT = "calcite.scrollreader.responseTimeout";

    /**
     * Gets configuration value by key.
     *
     * @param key Configuration key
     * @return Configuration value or null if not found
     */
    String get(String key);

    /**
     * Gets configuration value by key with default fallback.
     *
     * @param key Configuration key
     * @param defaultValue Default value if key not found
     * @return Configuration value or default value
     */
    default String get(String key, String defaultValue) {
        String value = get(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Gets an integer configuration value.
     *
     * @param key Configuration key
     * @param defaultValue Default value if key not found
     * @return Parsed value or default value
     * @throws NumberFormatException if the value is present but not an integer
     */
    default int getInt(String key, int defaultValue) {
        String value = get(key);
        return value != null ? Integer.parseInt(value.trim()) : defaultValue;
    }
}
