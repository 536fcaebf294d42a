package org.apache.calcite.adapter.scrollreader.source.json;

import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.InvalidJsonException;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.PathNotFoundException;
import com.jayway.jsonpath.spi.json.JacksonJsonProvider;
import com.jayway.jsonpath.spi.mapper.JacksonMappingProvider;
import org.apache.calcite.adapter.scrollreader.source.exception.DecodeException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads the parts of search and health-check responses the reader cares about.
 * <p>
 * Parsing goes through Jackson, so objects keep their document key order
 * (column order is taken from it) and integers come back as Integer, Long or BigInteger.
 * </p>
 */
public class SearchResponseReader {

    private static final Configuration JSON_CONFIGURATION = Configuration.builder()
            .jsonProvider(new JacksonJsonProvider())
            .mappingProvider(new JacksonMappingProvider())
            .build();

    private final DocumentContext document;

    /**
     * @param json Response body
     * @throws DecodeException if the body is not JSON
     */
    public SearchResponseReader(String json) {
        if (json == null || json.isBlank()) {
            throw DecodeException.buildDecodeException("Empty response body");
        }
        try {
            this.document = JsonPath.using(JSON_CONFIGURATION).parse(json);
        } catch (InvalidJsonException e) {
            throw DecodeException.buildDecodeException("Response is not valid JSON", e);
        }
    }

    /**
     * Reads a top-level field.
     *
     * @throws DecodeException if the field is absent
     */
    public Object readField(String field) {
        try {
            return document.read("$['" + field + "']");
        } catch (PathNotFoundException e) {
            throw DecodeException.buildDecodeException("Response has no '" + field + "' field", e);
        }
    }

    /**
     * @return the scroll id, or null if the response carries none
     */
    public String readScrollId() {
        try {
            Object scrollId = document.read("$._scroll_id");
            return scrollId != null ? scrollId.toString() : null;
        } catch (PathNotFoundException e) {
            return null;
        }
    }

    /**
     * Reads {@code hits.hits[*]._source}, in hit order.
     *
     * @throws DecodeException if the hits array is missing or a hit has no object source
     */
    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> readHitSources() {
        Object hits;
        try {
            hits = document.read("$.hits.hits");
        } catch (PathNotFoundException e) {
            throw DecodeException.buildDecodeException("Response has no hits.hits array", e);
        }
        if (!(hits instanceof List)) {
            throw DecodeException.buildDecodeException("hits.hits is not an array");
        }
        List<Map<String, Object>> sources = new ArrayList<>();
        for (Object hit : (List<Object>) hits) {
            Object source = hit instanceof Map ? ((Map<String, Object>) hit).get("_source") : null;
            if (!(source instanceof Map)) {
                throw DecodeException.buildDecodeException("Hit without an object _source: " + hit);
            }
            sources.add((Map<String, Object>) source);
        }
        return sources;
    }
}
