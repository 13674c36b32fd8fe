package de.uni_passau.dbts.client.tsdb.prometheus;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import de.uni_passau.dbts.client.query.DataPoint;
import de.uni_passau.dbts.client.query.QueryResult;
import de.uni_passau.dbts.client.tsdb.TsdbException;
import java.util.Collections;
import org.junit.Test;

public class PrometheusTransportTest {

  private static final String MATRIX =
      "{\"status\":\"success\",\"data\":{\"resultType\":\"matrix\",\"result\":["
          + "{\"metric\":{\"__name__\":\"cpu\",\"host\":\"a\"},"
          + "\"values\":[[1685314800,\"0.5\"],[1685314815,\"0.75\"]]},"
          + "{\"metric\":{\"__name__\":\"cpu\",\"host\":\"b\"},"
          + "\"values\":[[1685314800,\"1\"]]}]}}";

  @Test
  public void testParseMatrix() throws Exception {
    QueryResult result = PrometheusTransport.parseResponse(MATRIX, null);
    assertEquals(2, result.getSeries().size());
    assertEquals(2, result.getSeries("cpu{host=\"a\"}").size());
    assertEquals(1685314815000L, result.getSeries("cpu{host=\"a\"}").get(1).getTimestamp());
    assertEquals(1L, result.getSeries("cpu{host=\"b\"}").get(0).getValue());
    assertEquals("matrix", result.getMetadata().get("resultType"));
  }

  @Test
  public void testLimitCapsTheNumberOfSeries() throws Exception {
    QueryResult result = PrometheusTransport.parseResponse(MATRIX, 1);
    assertEquals(1, result.getSeries().size());
  }

  @Test
  public void testParseVectorAndScalar() throws Exception {
    String vector =
        "{\"status\":\"success\",\"data\":{\"resultType\":\"vector\",\"result\":["
            + "{\"metric\":{},\"value\":[1685314800.5,\"42\"]}]}}";
    QueryResult result = PrometheusTransport.parseResponse(vector, null);
    assertEquals(1685314800500L, result.getSeries("value").get(0).getTimestamp());
    assertEquals(42L, result.getSingleValue());

    String scalar =
        "{\"status\":\"success\",\"data\":{\"resultType\":\"scalar\","
            + "\"result\":[1685314800,\"2.5\"]}}";
    assertEquals(2.5, (Double) PrometheusTransport.parseResponse(scalar, null).getSingleValue(),
        1e-9);
  }

  @Test
  public void testParseError() {
    try {
      PrometheusTransport.parseResponse(
          "{\"status\":\"error\",\"errorType\":\"bad_data\",\"error\":\"parse error\"}", null);
    } catch (TsdbException e) {
      assertTrue(e.getMessage().contains("parse error"));
      return;
    }
    throw new AssertionError("Expected a TsdbException");
  }

  @Test
  public void testToExposition() {
    DataPoint dataPoint =
        new DataPoint("cpu", 1000L)
            .addTag("host", "server1")
            .addField("value", 0.5)
            .addField("user", 3)
            .addField("state", "idle");
    assertEquals(
        "cpu{host=\"server1\"} 0.5\ncpu_user{host=\"server1\"} 3\n",
        PrometheusTransport.toExposition(Collections.singletonList(dataPoint)));
  }
}
