package de.uni_passau.dbts.client.tsdb.influxdb;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import de.uni_passau.dbts.client.enums.Aggregation;
import de.uni_passau.dbts.client.query.Query;
import de.uni_passau.dbts.client.tsdb.QueryException;
import java.util.Arrays;
import java.util.Collections;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.junit.Before;
import org.junit.Test;

public class InfluxDbQueryBuilderTest {

  private static final DateTime START = new DateTime(1685314800000L, DateTimeZone.UTC);
  private static final DateTime END = new DateTime(1685316540000L, DateTimeZone.UTC);

  private InfluxDbQueryBuilder builder;

  @Before
  public void setUp() {
    builder = new InfluxDbQueryBuilder("metrics");
  }

  @Test
  public void testSimpleQuery() throws Exception {
    Query query = new Query("cpu_usage").where("host", "=", "server1").timeRange(START, END);

    String expected =
        "from(bucket: \"metrics\")\n"
            + "  |> range(start: 2023-05-28T23:00:00+00:00, stop: 2023-05-28T23:29:00+00:00)\n"
            + "  |> filter(fn: (r) => r._measurement == \"cpu_usage\")\n"
            + "  |> filter(fn: (r) => r[\"host\"] == \"server1\")";
    assertEquals(expected, builder.build(query).getRawQuery());
  }

  @Test
  public void testMinimalQueryReadsLastHour() throws Exception {
    String expected =
        "from(bucket: \"metrics\")\n"
            + "  |> range(start: -1h)\n"
            + "  |> filter(fn: (r) => r._measurement == \"cpu_usage\")";
    assertEquals(expected, builder.build(new Query("cpu_usage")).getRawQuery());
  }

  @Test
  public void testAggregationWithGroupingAndWindow() throws Exception {
    Query query =
        new Query("cpu_usage")
            .select("value")
            .latest("1h")
            .groupBy(Collections.singletonList("host"), "5m")
            .avg("value");

    String expected =
        "from(bucket: \"metrics\")\n"
            + "  |> range(start: -1h)\n"
            + "  |> filter(fn: (r) => r._measurement == \"cpu_usage\")\n"
            + "  |> filter(fn: (r) => r._field == \"value\")\n"
            + "  |> group(columns: [\"host\"])\n"
            + "  |> window(every: 5m)\n"
            + "  |> mean(column: \"value\")";
    assertEquals(expected, builder.build(query).getRawQuery());
  }

  @Test
  public void testMultipleAggregationsUseColumnCopies() throws Exception {
    Query query =
        new Query("cpu_usage")
            .groupByTime("10m")
            .aggregate(Aggregation.AVG, null, "avg")
            .aggregate(Aggregation.MAX, null, "max");

    String flux = builder.build(query).getRawQuery();
    assertTrue(flux.contains("  |> duplicate(column: \"value\", as: \"value_copy1\")\n"
        + "  |> mean(column: \"value\")\n"
        + "  |> rename(columns: {_value: \"avg\"})\n"
        + "  |> max(column: \"value_copy1\")\n"
        + "  |> rename(columns: {_value: \"max\"})"));
  }

  @Test
  public void testPercentile() throws Exception {
    Query query = new Query("latency").groupByTime("1m").percentile("value", 95, null);
    assertTrue(
        builder.build(query).getRawQuery().endsWith("|> quantile(q: 0.95, column: \"value\")"));
  }

  @Test
  public void testConditionOperators() throws Exception {
    Query query =
        new Query("cpu_usage")
            .whereIn("host", Arrays.asList("a", "b"))
            .whereNotIn("region", Arrays.asList("eu", "us"))
            .whereBetween("value", 10, 20)
            .whereRegex("dc", "^fra")
            .where("time", ">", START);

    String flux = builder.build(query).getRawQuery();
    assertTrue(flux.contains("filter(fn: (r) => contains(value: r[\"host\"], set: [\"a\", \"b\"]))"));
    assertTrue(flux.contains("filter(fn: (r) => r[\"region\"] != \"eu\" and r[\"region\"] != \"us\")"));
    assertTrue(flux.contains("filter(fn: (r) => r[\"value\"] >= 10 and r[\"value\"] <= 20)"));
    assertTrue(flux.contains("filter(fn: (r) => r[\"dc\"] =~ /^fra/)"));
    assertTrue(flux.contains("filter(fn: (r) => r._time > time(v: \"2023-05-28T23:00:00+00:00\"))"));
  }

  @Test
  public void testTrailingStages() throws Exception {
    Query query =
        new Query("cpu_usage")
            .since(START)
            .groupByTime("1m")
            .sum("value")
            .fillValue(0)
            .math("r._value * 100", "percent")
            .having("_value", ">", 5)
            .orderByTime("DESC")
            .offset(2)
            .limit(10);

    String expected =
        "from(bucket: \"metrics\")\n"
            + "  |> range(start: 2023-05-28T23:00:00+00:00)\n"
            + "  |> filter(fn: (r) => r._measurement == \"cpu_usage\")\n"
            + "  |> window(every: 1m)\n"
            + "  |> sum(column: \"value\")\n"
            + "  |> fill(value: 0)\n"
            + "  |> map(fn: (r) => ({ r with percent: r._value * 100 }))\n"
            + "  |> filter(fn: (r) => r[\"_value\"] > 5)\n"
            + "  |> sort(columns: [\"time\"], desc: true)\n"
            + "  |> tail(offset: 2)\n"
            + "  |> limit(n: 10)";
    assertEquals(expected, builder.build(query).getRawQuery());
  }

  @Test
  public void testBuildIsIdempotent() throws Exception {
    Query query = new Query("cpu_usage").where("host", "=", "server1").avg("value");
    assertEquals(builder.build(query).getRawQuery(), builder.build(query).getRawQuery());
  }

  @Test(expected = QueryException.class)
  public void testMissingMeasurement() throws Exception {
    builder.build(new Query(""));
  }

  @Test
  public void testFormatValue() throws Exception {
    assertEquals("\"say \\\"hi\\\"\"", InfluxDbQueryBuilder.formatValue("say \"hi\""));
    assertEquals("1.5", InfluxDbQueryBuilder.formatValue(1.5d));
    assertEquals("true", InfluxDbQueryBuilder.formatValue(true));
    assertEquals("null", InfluxDbQueryBuilder.formatValue(null));
  }

  @Test(expected = QueryException.class)
  public void testFormatValueRejectsUnknownTypes() throws Exception {
    InfluxDbQueryBuilder.formatValue(new Object());
  }
}
