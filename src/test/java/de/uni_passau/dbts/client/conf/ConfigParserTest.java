package de.uni_passau.dbts.client.conf;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import de.uni_passau.dbts.client.enums.Aggregation;
import de.uni_passau.dbts.client.enums.ComparisonOperator;
import de.uni_passau.dbts.client.enums.FillPolicy;
import de.uni_passau.dbts.client.enums.SortOrder;
import de.uni_passau.dbts.client.query.Query;
import de.uni_passau.dbts.client.query.QueryCondition;
import de.uni_passau.dbts.client.tsdb.DB;
import de.uni_passau.dbts.client.tsdb.TsdbException;
import de.uni_passau.dbts.client.tsdb.rrdtool.tags.TagStrategyType;
import java.io.File;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.List;
import org.junit.BeforeClass;
import org.junit.Test;

public class ConfigParserTest {

  private static Config config;

  @BeforeClass
  public static void parseFixture() throws Exception {
    config = ConfigParser.INSTANCE.parse(resource("test-config.xml"));
  }

  private static File resource(String name) throws URISyntaxException {
    return new File(ConfigParserTest.class.getResource("/conf/" + name).toURI());
  }

  @Test
  public void testConnectionSettings() {
    assertEquals(DB.AGGREGATE, config.DB_SWITCH);
    assertEquals("https://db.example.org:8086", config.getBaseUrl());
    assertEquals("metrics", config.DB_NAME);
    assertEquals(5L, config.CONNECT_TIMEOUT);
    assertEquals(60L, config.READ_TIMEOUT);
    assertEquals(30L, config.WRITE_TIMEOUT);
    assertFalse(config.RETRY_ON_CONNECTION_FAILURE);
  }

  @Test
  public void testBackendSections() {
    assertEquals("secret", config.INFLUX_TOKEN);
    assertEquals("30s", config.PROMETHEUS_STEP);
    assertEquals("push.example.org", config.PUSHGATEWAY_HOST);
    assertEquals("9191", config.PUSHGATEWAY_PORT);
    assertEquals("bench", config.PUSHGATEWAY_JOB);
    assertEquals("servers", config.GRAPHITE_PREFIX);
    assertEquals(2003, config.GRAPHITE_CARBON_PORT);
    assertEquals(100, config.GRAPHITE_BATCH_SIZE);
    assertEquals("/data/rrd/", config.RRD_DIR);
    assertEquals(TagStrategyType.FOLDER, config.RRD_TAG_STRATEGY);
    assertEquals(Arrays.asList("region", "host"), config.RRD_FOLDER_TAGS);
    assertEquals(60, config.RRD_STEP);
    assertEquals("rrdtool", config.RRD_BINARY);
  }

  @Test
  public void testAggregateMembers() {
    List<Config> writers = config.AGGREGATE_WRITE_DATABASES;
    assertEquals(2, writers.size());

    assertEquals(DB.INFLUXDB, writers.get(0).DB_SWITCH);
    assertEquals("https://db.example.org:8086", writers.get(0).getBaseUrl());
    assertEquals("secret", writers.get(0).INFLUX_TOKEN);

    assertEquals(DB.GRAPHITE, writers.get(1).DB_SWITCH);
    assertEquals("https://db.example.org:8080", writers.get(1).getBaseUrl());
    assertEquals("servers", writers.get(1).GRAPHITE_PREFIX);

    Config reader = config.AGGREGATE_READ_DATABASE;
    assertEquals(DB.PROMETHEUS, reader.DB_SWITCH);
    assertEquals("https://prom.example.org:9090", reader.getBaseUrl());
    assertTrue(reader.AGGREGATE_WRITE_DATABASES.isEmpty());
    assertNull(reader.QUERY);
  }

  @Test
  public void testQuery() {
    Query query = config.QUERY;

    assertEquals("cpu_usage", query.getMeasurement());
    assertEquals(Arrays.asList("value", "idle"), query.getFields());
    assertFalse(query.isDistinct());
    assertEquals(1685314800000L, query.getStartTime().getMillis());
    assertEquals(1685316540000L, query.getEndTime().getMillis());
    assertEquals(Arrays.asList("host"), query.getGroupBy());
    assertEquals("5m", query.getInterval());
    assertTrue(query.validate().isEmpty());
  }

  @Test
  public void testQueryConditions() {
    List<QueryCondition> conditions = config.QUERY.getConditions();
    assertEquals(5, conditions.size());

    assertFalse(conditions.get(0).isOr());
    assertEquals("server1", conditions.get(0).getValue());
    assertTrue(conditions.get(1).isOr());

    assertEquals(ComparisonOperator.IN, conditions.get(2).getOperator());
    assertEquals(Arrays.asList("eu", "us"), conditions.get(2).getValue());

    assertEquals(ComparisonOperator.REGEX, conditions.get(3).getOperator());
    assertEquals("^fra\\d+", conditions.get(3).getValue());

    assertEquals(ComparisonOperator.GREATER_THAN_OR_EQUAL, conditions.get(4).getOperator());
    assertEquals(0.5, conditions.get(4).getValue());
  }

  @Test
  public void testQueryPostProcessing() {
    Query query = config.QUERY;

    assertEquals(2, query.getAggregations().size());
    assertEquals(Aggregation.AVG, query.getAggregations().get(0).getFunction());
    assertEquals("avg_value", query.getAggregations().get(0).getAlias());
    assertEquals(Aggregation.PERCENTILE, query.getAggregations().get(1).getFunction());
    assertEquals(Double.valueOf(95), query.getAggregations().get(1).getRank());

    assertEquals(FillPolicy.VALUE, query.getFillPolicy());
    assertEquals(0L, query.getFillValue());
    assertEquals("avg_value * 100", query.getMathExpressions().get(0).getExpression());
    assertEquals("result", query.getMathExpressions().get(0).getAlias());
    assertEquals(10L, query.getHaving().get(0).getValue());
    assertEquals(SortOrder.DESC, query.getOrderBy().get(Query.TIME_FIELD));
    assertEquals(Integer.valueOf(10), query.getLimit());
    assertEquals(Integer.valueOf(2), query.getOffset());
  }

  @Test
  public void testSampleConfiguration() throws Exception {
    Config sample =
        ConfigParser.INSTANCE.parse(new File("src/main/resources/conf/config.xml"));

    assertEquals(DB.INFLUXDB, sample.DB_SWITCH);
    assertEquals(TagStrategyType.FILENAME, sample.RRD_TAG_STRATEGY);
    assertEquals(2, sample.AGGREGATE_WRITE_DATABASES.size());
    assertEquals(DB.INFLUXDB, sample.AGGREGATE_READ_DATABASE.DB_SWITCH);
    assertTrue(sample.QUERY.validate().isEmpty());
  }

  @Test
  public void testDefaultConfig() {
    Config defaults = ConfigParser.INSTANCE.defaultConfig();

    assertEquals(DB.INFLUXDB, defaults.DB_SWITCH);
    assertEquals("http://127.0.0.1:8086", defaults.getBaseUrl());
    assertNull(defaults.QUERY);
    assertNull(defaults.AGGREGATE_READ_DATABASE);
  }

  @Test(expected = TsdbException.class)
  public void testUnknownDatabase() throws Exception {
    ConfigParser.INSTANCE.parse(resource("invalid-config.xml"));
  }

  @Test(expected = TsdbException.class)
  public void testNestedAggregate() throws Exception {
    ConfigParser.INSTANCE.parse(resource("nested-aggregate-config.xml"));
  }

  @Test(expected = TsdbException.class)
  public void testMissingFile() throws Exception {
    ConfigParser.INSTANCE.parse(new File("does-not-exist.xml"));
  }
}
