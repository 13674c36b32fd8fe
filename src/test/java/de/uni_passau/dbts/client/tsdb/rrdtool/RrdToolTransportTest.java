package de.uni_passau.dbts.client.tsdb.rrdtool;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.mockito.Mockito.mock;

import de.uni_passau.dbts.client.conf.Config;
import de.uni_passau.dbts.client.conf.ConfigParser;
import de.uni_passau.dbts.client.query.DataPoint;
import de.uni_passau.dbts.client.query.QueryResult;
import de.uni_passau.dbts.client.tsdb.QueryException;
import de.uni_passau.dbts.client.tsdb.rrdtool.tags.TagStrategy;
import java.util.Arrays;
import org.junit.Before;
import org.junit.Test;

public class RrdToolTransportTest {

  private RrdToolTransport transport;

  @Before
  public void setUp() {
    Config config = ConfigParser.INSTANCE.defaultConfig();
    config.RRD_BINARY = "/usr/bin/rrdtool";
    config.RRD_STEP = 300;
    config.RRD_HEARTBEAT = 600;
    config.RRD_ROWS = 2016;
    transport = new RrdToolTransport(config, mock(TagStrategy.class));
  }

  @Test
  public void testParseXport() throws Exception {
    String json =
        "{ about: 'RRDtool xport JSON output',\n"
            + "  meta: {\n"
            + "    \"start\": 1685314800,\n"
            + "    \"step\": 300,\n"
            + "    \"end\": 1685315400,\n"
            + "    \"legend\": [\n"
            + "      'user',\n"
            + "      'system'\n"
            + "    ]\n"
            + "  },\n"
            + "  \"data\": [\n"
            + "    [ 1.0e+00, 2.5e+00 ],\n"
            + "    [ null, 3.0e+00 ]\n"
            + "  ]\n"
            + "}";

    QueryResult result = RrdToolTransport.parseXport(json);
    assertEquals(2, result.getSeries().size());
    assertEquals(1685314800000L, result.getSeries("user").get(0).getTimestamp());
    assertEquals(1685315100000L, result.getSeries("system").get(1).getTimestamp());
    assertNull(result.getSeries("user").get(1).getValue());
    assertEquals(300L, result.getMetadata().get("step"));
  }

  @Test(expected = QueryException.class)
  public void testParseXportRejectsOtherOutput() throws Exception {
    RrdToolTransport.parseXport("{\"data\": []}");
  }

  @Test
  public void testCreateCommand() {
    DataPoint dataPoint =
        new DataPoint("cpu", 1685314800000L).addField("user", 1).addField("system.time", 2);

    assertEquals(
        Arrays.asList(
            "/usr/bin/rrdtool", "create", "/rrd/cpu.rrd",
            "--start", "1685314500", "--step", "300",
            "DS:user:GAUGE:600:U:U", "DS:system_time:GAUGE:600:U:U",
            "RRA:AVERAGE:0.5:1:2016"),
        transport.createCommand("/rrd/cpu.rrd", dataPoint));
  }

  @Test
  public void testUpdateCommand() {
    DataPoint dataPoint =
        new DataPoint("cpu", 1685314800000L)
            .addField("user", 1.5)
            .addField("state", "idle")
            .addField("up", true);

    assertEquals(
        Arrays.asList(
            "/usr/bin/rrdtool", "update", "/rrd/cpu.rrd",
            "--template", "user:state:up", "1685314800:1.5:U:1"),
        transport.updateCommand("/rrd/cpu.rrd", dataPoint));
  }

  @Test
  public void testDataSourceName() {
    assertEquals("a_very_long_data_so", RrdToolTransport.dataSourceName("a-very-long-data-source"));
    assertEquals("cpu_user", RrdToolTransport.dataSourceName("cpu.user"));
  }

  @Test
  public void testNotConnectedBeforeConnect() {
    assertFalse(transport.isConnected());
  }
}
