package org.apache.calcite.adapter.scrollreader.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.calcite.adapter.scrollreader.source.exception.ConfigurationException;

/**
 * Identifies what to query: an index and, optionally, a document type within it.
 * Immutable for the lifetime of a dataset.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class QueryTarget {

    private final String index;
    /** Null when the request should not be narrowed to a document type. */
    private final String docType;

    public QueryTarget(String index, String docType) {
        if (index == null || index.isBlank()) {
            throw ConfigurationException.buildConfigurationException("An index name is required");
        }
        this.index = index;
        this.docType = docType == null || docType.isEmpty() ? null : docType;
    }

    public QueryTarget(String index) {
        this(index, null);
    }

    public boolean hasDocType() {
        return docType != null;
    }
}
