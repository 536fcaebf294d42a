package org.apache.calcite.adapter.scrollreader.tests;

import org.apache.calcite.adapter.scrollreader.source.config.AdapterConfiguration;
import org.apache.calcite.adapter.scrollreader.sql.ScrollSchema;
import org.apache.calcite.adapter.scrollreader.sql.ScrollSchemaFactory;
import org.apache.calcite.adapter.scrollreader.tests.base.BaseTest;
import org.apache.calcite.jdbc.CalciteConnection;
import org.apache.calcite.schema.SchemaPlus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

public class ScrollTableTest extends BaseTest {

    @Override
    protected String getTestResourceDirectory() {
        return "ScrollTableTest";
    }

    @BeforeEach
    public void stubIndices() throws Exception {
        stubHealth(wireMockServer, 200, "health-green.json");
        stubSearch(wireMockServer, "/books/_search?scroll=1m", "books-search.json");
        stubScroll(wireMockServer, "scroll-1", "books-scroll-1.json");
        stubScroll(wireMockServer, "scroll-2", "books-scroll-2-empty.json");
        stubSearch(wireMockServer, "/authors/_search?scroll=1m", "authors-search.json");
        stubScroll(wireMockServer, "scroll-a1", "authors-scroll-empty.json");
        stubClearScroll(wireMockServer);
    }

    private Connection connect() throws Exception {
        Properties info = new Properties();
        info.setProperty("lex", "JAVA");
        Connection connection = DriverManager.getConnection("jdbc:calcite:", info);
        CalciteConnection calciteConnection = connection.unwrap(CalciteConnection.class);
        SchemaPlus rootSchema = calciteConnection.getRootSchema();

        Map<String, Object> operand = new HashMap<>();
        operand.put("nodes", List.of(nodeUrl(wireMockServer)));
        operand.put("index", List.of("books", "authors"));
        AdapterConfiguration configuration = key -> AdapterConfiguration.RESPONSE_TIMEOUT.equals(key) ? "5" : null;
        operand.put("configuration", configuration);
        rootSchema.add("es", new ScrollSchema(operand));
        return connection;
    }

    @Test
    @DisplayName("SELECT over every page of an index")
    public void testSelectAllPages() throws Exception {
        List<String> titles = new ArrayList<>();
        try (Connection connection = connect();
             Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("select title, isbn from es.books")) {
            while (resultSet.next()) {
                titles.add(resultSet.getString("title"));
                assertTrue(resultSet.getLong("isbn") > 9780000000000L);
            }
        }

        assertEquals(List.of("Dune", "Neuromancer", "Hyperion"), titles);
        wireMockServer.verify(2, postRequestedFor(urlEqualTo("/_search/scroll"))
                .withRequestBody(matchingJsonPath("$.scroll", equalTo("1m"))));
    }

    @Test
    @DisplayName("Column types are exposed as SQL types")
    public void testRowType() throws Exception {
        try (Connection connection = connect();
             Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("select * from es.books")) {
            ResultSetMetaData metaData = resultSet.getMetaData();
            assertEquals(4, metaData.getColumnCount());
            assertEquals("title", metaData.getColumnName(1));
            assertEquals(Types.VARCHAR, metaData.getColumnType(1));
            assertEquals("year", metaData.getColumnName(2));
            assertEquals(Types.INTEGER, metaData.getColumnType(2));
            assertEquals(Types.DOUBLE, metaData.getColumnType(3));
            assertEquals(Types.BIGINT, metaData.getColumnType(4));
        }
    }

    @Test
    @DisplayName("Filters and aggregates run over scrolled rows")
    public void testFilterAndAggregate() throws Exception {
        try (Connection connection = connect();
             Statement statement = connection.createStatement()) {
            try (ResultSet resultSet = statement.executeQuery(
                    "select title from es.books where rating > 4 and `year` < 1970")) {
                assertTrue(resultSet.next());
                assertEquals("Dune", resultSet.getString(1));
                assertFalse(resultSet.next());
            }
            try (ResultSet resultSet = statement.executeQuery("select count(*), max(`year`) from es.books")) {
                assertTrue(resultSet.next());
                assertEquals(3, resultSet.getLong(1));
                assertEquals(1989, resultSet.getInt(2));
            }
        }
    }

    @Test
    @DisplayName("Schema declared in a Calcite model through the schema factory")
    public void testModelWithSchemaFactory() throws Exception {
        String model = "inline:{"
                + "\"version\":\"1.0\",\"defaultSchema\":\"es\","
                + "\"schemas\":[{\"name\":\"es\",\"type\":\"custom\","
                + "\"factory\":\"" + ScrollSchemaFactory.class.getName() + "\","
                + "\"operand\":{\"nodes\":\"" + nodeUrl(wireMockServer) + "\",\"index\":\"authors\","
                + "\"responseTimeout\":5}}]}";
        Properties info = new Properties();
        info.setProperty("lex", "JAVA");
        info.setProperty("model", model);

        try (Connection connection = DriverManager.getConnection("jdbc:calcite:", info);
             Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("select count(*) from authors where born < 1930")) {
            assertTrue(resultSet.next());
            assertEquals(1, resultSet.getLong(1));
        }
    }

    @Test
    @DisplayName("Every configured index is its own table")
    public void testSecondIndex() throws Exception {
        List<String> names = new ArrayList<>();
        try (Connection connection = connect();
             Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery(
                     "select `name`, born from es.authors order by born desc")) {
            while (resultSet.next()) {
                names.add(resultSet.getString(1));
            }
        }

        assertEquals(List.of("William Gibson", "Frank Herbert"), names);
    }
}
