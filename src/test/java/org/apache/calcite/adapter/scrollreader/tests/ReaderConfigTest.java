package org.apache.calcite.adapter.scrollreader.tests;

import org.apache.calcite.adapter.scrollreader.model.QueryTarget;
import org.apache.calcite.adapter.scrollreader.model.ReaderConfig;
import org.apache.calcite.adapter.scrollreader.source.config.AdapterConfiguration;
import org.apache.calcite.adapter.scrollreader.source.exception.ConfigurationException;
import org.apache.calcite.adapter.scrollreader.sql.ScrollSchema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ReaderConfigTest {

    private static final AdapterConfiguration EMPTY = key -> null;

    @Test
    @DisplayName("Single node string becomes a one-element list")
    public void testSingleNode() {
        Map<String, Object> operand = new HashMap<>();
        operand.put("nodes", "http://es1:9200");
        operand.put("index", "books");

        ReaderConfig config = ReaderConfig.fromOperand(operand, EMPTY);

        assertEquals(List.of("http://es1:9200"), config.getNodes());
        assertEquals("books", config.getIndex());
        assertNull(config.getDocType());
        assertEquals("status", config.getHealthcheckField());
        assertEquals(ReaderConfig.DEFAULT_TIMEOUT_SECONDS, config.getConnectionTimeout());
        assertEquals(ReaderConfig.DEFAULT_TIMEOUT_SECONDS, config.getResponseTimeout());
    }

    @Test
    @DisplayName("Operand values win over configured defaults")
    public void testTimeouts() {
        AdapterConfiguration configuration = key -> AdapterConfiguration.CONNECTION_TIMEOUT.equals(key) ? "7" : "9";
        Map<String, Object> operand = new HashMap<>();
        operand.put("nodes", List.of("http://es1:9200", "http://es2:9200"));
        operand.put("index", "books");
        operand.put("docType", "novel");
        operand.put("responseTimeout", 3);

        ReaderConfig config = ReaderConfig.fromOperand(operand, configuration);

        assertEquals(List.of("http://es1:9200", "http://es2:9200"), config.getNodes());
        assertEquals(7, config.getConnectionTimeout());
        assertEquals(3, config.getResponseTimeout());
        assertEquals("novel", config.toQueryTarget().getDocType());
    }

    @Test
    @DisplayName("Malformed values are configuration errors")
    public void testMalformedValues() {
        Map<String, Object> badNodes = new HashMap<>();
        badNodes.put("nodes", 9200);
        assertThrows(ConfigurationException.class, () -> ReaderConfig.fromOperand(badNodes, EMPTY));

        Map<String, Object> badTimeout = new HashMap<>();
        badTimeout.put("connectionTimeout", "soon");
        assertThrows(ConfigurationException.class, () -> ReaderConfig.fromOperand(badTimeout, EMPTY));

        assertThrows(ConfigurationException.class, () -> new ScrollSchema(new HashMap<>()));
    }

    @Test
    @DisplayName("Query target requires an index and drops an empty document type")
    public void testQueryTarget() {
        assertThrows(ConfigurationException.class, () -> new QueryTarget(" ", null));

        QueryTarget target = ReaderConfig.of(null, "books", "").toQueryTarget();
        assertFalse(target.hasDocType());
        assertNull(target.getDocType());
    }

    @Test
    @DisplayName("Copy for another index keeps every other setting")
    public void testForIndex() {
        ReaderConfig config = ReaderConfig.of(List.of("http://es1:9200"), "books", "novel");
        config.setHealthcheckField("state");
        config.setResponseTimeout(4);

        ReaderConfig copy = config.forIndex("authors");

        assertEquals("authors", copy.getIndex());
        assertEquals("books", config.getIndex());
        assertEquals(config.getNodes(), copy.getNodes());
        assertEquals("novel", copy.getDocType());
        assertEquals("state", copy.getHealthcheckField());
        assertEquals(4, copy.getResponseTimeout());
    }
}
