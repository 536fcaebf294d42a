package org.apache.calcite.adapter.scrollreader.sql;

import org.apache.calcite.DataContext;
import org.apache.calcite.adapter.scrollreader.model.ReaderConfig;
import org.apache.calcite.adapter.scrollreader.source.ColumnType;
import org.apache.calcite.adapter.scrollreader.source.ScrollDataset;
import org.apache.calcite.linq4j.AbstractEnumerable;
import org.apache.calcite.linq4j.Enumerable;
import org.apache.calcite.linq4j.Enumerator;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.schema.ScannableTable;
import org.apache.calcite.schema.impl.AbstractTable;

import java.util.List;

/**
 * {@code ScrollTable} exposes one search index as a Calcite table.
 * <p>
 * The row type is discovered once, through a short-lived dataset. Every scan then opens a
 * dataset of its own, since a dataset's page sequence can only be read once.
 * </p>
 */
public class ScrollTable extends AbstractTable implements ScannableTable {

    private final ReaderConfig config;

    private List<String> columnNames;
    private List<ColumnType> columnTypes;

    public ScrollTable(ReaderConfig config) {
        this.config = config;
    }

    @Override
    public RelDataType getRowType(RelDataTypeFactory typeFactory) {
        discoverColumns();
        RelDataTypeFactory.Builder builder = typeFactory.builder();
        for (int i = 0; i < columnNames.size(); i++) {
            RelDataType sqlType = typeFactory.createSqlType(columnTypes.get(i).getSqlTypeName());
            builder.add(columnNames.get(i), typeFactory.createTypeWithNullability(sqlType, true));
        }
        return builder.build();
    }

    @Override
    public Enumerable<Object[]> scan(DataContext root) {
        discoverColumns();
        return new AbstractEnumerable<>() {
            @Override
            public Enumerator<Object[]> enumerator() {
                return new PageRowEnumerator(openDataset(), columnNames);
            }
        };
    }

    protected ScrollDataset openDataset() {
        return new ScrollDataset(config);
    }

    private synchronized void discoverColumns() {
        if (columnNames != null) {
            return;
        }
        try (ScrollDataset dataset = openDataset()) {
            columnTypes = dataset.getColumnTypes();
            columnNames = dataset.getColumnNames();
        }
    }
}
