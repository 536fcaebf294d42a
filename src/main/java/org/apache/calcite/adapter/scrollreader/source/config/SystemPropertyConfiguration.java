package org.apache.calcite.adapter.scrollreader.source.config;

/**
 * Configuration implementation that reads from Java system properties.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * System.setProperty("calcite.scrollreader.responseTimeout", "10");
 * AdapterConfiguration config = new SystemPropertyConfiguration();
 * }</pre>
 */
public class SystemPropertyConfiguration implements AdapterConfiguration {

    @Override
    public String get(String key) {
        return System.getProperty(key);
    }
}
