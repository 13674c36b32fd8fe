package de.uni_passau.dbts.client.tsdb.rrdtool;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.util.Arrays;
import org.junit.Test;

public class RrdToolRawQueryTest {

  @Test
  public void testXportStatements() {
    RrdToolRawQuery query =
        new RrdToolRawQuery()
            .param("--start", "end-1h")
            .def("v1", "/data/cpu.rrd", "value", "AVERAGE")
            .cdef("c1", "v1,100,*")
            .xport("c1", "load: percent");

    assertEquals(
        "'xport' '--json' '--start' 'end-1h' 'DEF:v1=/data/cpu.rrd:value:AVERAGE'"
            + " 'CDEF:c1=v1,100,*' 'XPORT:c1:load\\: percent'",
        query.getRawQuery());
    assertEquals(Arrays.asList("load: percent"), query.getFields());
    assertEquals("end-1h", query.getParam("--start"));
    assertNull(query.getParam("--json"));
  }

  @Test
  public void testDefOptions() {
    RrdToolRawQuery query =
        new RrdToolRawQuery()
            .def("v1", "cpu.rrd", "value", "AVERAGE", "300", "end-1d", null, "MAX",
                "unix:/run/rrdcached.sock");
    assertEquals(
        Arrays.asList(
            "--json",
            "DEF:v1=cpu.rrd:value:AVERAGE:step=300:start=end-1d:reduce=MAX"
                + ":daemon=unix:/run/rrdcached.sock"),
        query.getArgs());
  }

  @Test
  public void testGraphWritesToStdoutByDefault() {
    RrdToolRawQuery query =
        new RrdToolRawQuery(RrdToolRawQuery.GRAPH, null)
            .param("--width", 800)
            .def("v1", "cpu.rrd", "value", "AVERAGE")
            .line("2", "v1", "FF0000", "CPU", true);

    assertEquals("-", query.getFilename());
    assertEquals(
        "'graph' '-' '--width' '800' 'DEF:v1=cpu.rrd:value:AVERAGE' 'LINE2:v1#FF0000:CPU:STACK'",
        query.getRawQuery());
  }

  @Test
  public void testExportWithoutLegendUsesTheVariableName() {
    RrdToolRawQuery query = new RrdToolRawQuery().def("v1", "a.rrd", "x", "AVERAGE").xport("v1", null);
    assertEquals(Arrays.asList("v1"), query.getFields());
  }

  @Test(expected = IllegalStateException.class)
  public void testDefAfterCdefIsRejected() {
    new RrdToolRawQuery().cdef("c1", "1").def("v1", "a.rrd", "x", "AVERAGE");
  }

  @Test(expected = IllegalStateException.class)
  public void testCdefAfterXportIsRejected() {
    new RrdToolRawQuery().def("v1", "a.rrd", "x", "AVERAGE").xport("v1", "x").cdef("c1", "v1");
  }

  @Test
  public void testEscape() {
    assertEquals("C\\:\\\\temp", RrdToolRawQuery.escape("C:\\temp"));
  }
}
