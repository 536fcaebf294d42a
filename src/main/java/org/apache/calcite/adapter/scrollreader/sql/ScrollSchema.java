package org.apache.calcite.adapter.scrollreader.sql;

import org.apache.calcite.adapter.scrollreader.model.ReaderConfig;
import org.apache.calcite.adapter.scrollreader.source.config.AdapterConfiguration;
import org.apache.calcite.adapter.scrollreader.source.config.SystemPropertyConfiguration;
import org.apache.calcite.adapter.scrollreader.source.exception.ConfigurationException;
import org.apache.calcite.schema.Table;
import org.apache.calcite.schema.impl.AbstractSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Schema with one table per configured index.
 * <p>
 * The operand map carries the reader settings (see {@link ReaderConfig#fromOperand}); its
 * {@code index} entry may be a single name or a list of names. An {@code AdapterConfiguration}
 * can be injected under {@code configuration}; system properties are used otherwise.
 * </p>
 */
public class ScrollSchema extends AbstractSchema {

    private static final Logger logger = LoggerFactory.getLogger(ScrollSchema.class);

    private final ReaderConfig baseConfig;
    private final List<String> indices;
    private Map<String, Table> tableMap;

    public ScrollSchema(Map<String, Object> operand) {
        Object configObject = operand.get("configuration");
        AdapterConfiguration configuration = configObject instanceof AdapterConfiguration
                ? (AdapterConfiguration) configObject
                : new SystemPropertyConfiguration();
        this.baseConfig = ReaderConfig.fromOperand(operand, configuration);
        this.indices = toIndexList(operand.get("index"));
    }

    @Override
    protected Map<String, Table> getTableMap() {
        if (tableMap == null) {
            tableMap = new LinkedHashMap<>();
            for (String index : indices) {
                tableMap.put(index, new ScrollTable(baseConfig.forIndex(index)));
            }
            logger.info("Created scroll schema with tables {} on nodes {}", indices, baseConfig.getNodes());
        }
        return tableMap;
    }

    private static List<String> toIndexList(Object index) {
        if (index instanceof String) {
            return List.of((String) index);
        }
        if (index instanceof Collection && !((Collection<?>) index).isEmpty()) {
            List<String> list = new ArrayList<>();
            for (Object name : (Collection<?>) index) {
                list.add(name.toString());
            }
            return list;
        }
        throw ConfigurationException.buildConfigurationException("Operand 'index' must be an index name or a non-empty list of names");
    }
}
