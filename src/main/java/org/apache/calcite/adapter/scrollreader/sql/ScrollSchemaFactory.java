package org.apache.calcite.adapter.scrollreader.sql;

import org.apache.calcite.schema.Schema;
import org.apache.calcite.schema.SchemaFactory;
import org.apache.calcite.schema.SchemaPlus;

import java.util.Map;

/**
 * Entry point for Calcite JSON models:
 * <pre>
 * {
 *   "name": "search",
 *   "type": "custom",
 *   "factory": "org.apache.calcite.adapter.scrollreader.sql.ScrollSchemaFactory",
 *   "operand": { "nodes": ["http://localhost:9200"], "index": ["books", "authors"] }
 * }
 * </pre>
 */
public class ScrollSchemaFactory implements SchemaFactory {

    @Override
    public Schema create(SchemaPlus parentSchema, String name, Map<String, Object> operand) {
        return new ScrollSchema(operand);
    }
}
