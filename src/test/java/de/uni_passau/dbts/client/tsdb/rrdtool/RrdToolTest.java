package de.uni_passau.dbts.client.tsdb.rrdtool;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import de.uni_passau.dbts.client.conf.Config;
import de.uni_passau.dbts.client.conf.ConfigParser;
import de.uni_passau.dbts.client.query.Query;
import de.uni_passau.dbts.client.tsdb.rrdtool.tags.FileNameStrategy;
import java.io.File;
import java.util.Arrays;
import java.util.Collections;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class RrdToolTest {

  @Rule public TemporaryFolder folder = new TemporaryFolder();

  private String baseDir;
  private RrdTool rrdTool;

  @Before
  public void setUp() throws Exception {
    baseDir = folder.getRoot().getAbsolutePath() + "/";
    Config config = ConfigParser.INSTANCE.defaultConfig();
    config.RRD_DIR = baseDir;
    FileNameStrategy strategy = new FileNameStrategy(baseDir);
    rrdTool =
        new RrdTool(new RrdToolQueryBuilder(strategy), new RrdToolTransport(config, strategy));

    for (String name :
        Arrays.asList(
            "cpu_host-a.rrd", "cpu_host-b.rrd", "cpu_usage_host-a.rrd", "memory.rrd", "cpu.rrd")) {
      assertTrue(new File(folder.getRoot(), name).createNewFile());
    }
  }

  @Test
  public void testGetDatabasesListsMeasurements() throws Exception {
    assertEquals(Arrays.asList("cpu", "cpu_usage", "memory"), rrdTool.getDatabases());
  }

  @Test
  public void testDeleteMeasurementKeepsOtherMeasurements() throws Exception {
    assertTrue(rrdTool.deleteMeasurement("cpu", null, null));

    assertFalse(new File(folder.getRoot(), "cpu_host-a.rrd").exists());
    assertFalse(new File(folder.getRoot(), "cpu_host-b.rrd").exists());
    assertFalse(new File(folder.getRoot(), "cpu.rrd").exists());
    assertTrue(new File(folder.getRoot(), "cpu_usage_host-a.rrd").exists());
    assertTrue(new File(folder.getRoot(), "memory.rrd").exists());
  }

  @Test
  public void testBelongsTo() {
    assertTrue(RrdTool.belongsTo(baseDir + "cpu_host-a.rrd", "cpu"));
    assertTrue(RrdTool.belongsTo(baseDir + "cpu.rrd", "cpu"));
    assertFalse(RrdTool.belongsTo(baseDir + "cpu_usage_host-a.rrd", "cpu"));
    assertTrue(RrdTool.belongsTo(baseDir + "cpu_usage_host-a.rrd", "cpu_usage"));
  }

  @Test
  public void testQueryBuilderReadsTheResolvedFile() throws Exception {
    String rawQuery = rrdTool.getQueryBuilder().build(new Query("memory")).getRawQuery();
    assertEquals(
        "'xport' '--json' '--start' 'end-1h' 'DEF:v1=" + baseDir + "memory.rrd:value:AVERAGE'"
            + " 'XPORT:v1:value'",
        rawQuery);
  }

  @Test
  public void testEmptyDirectoryHasNoDatabases() throws Exception {
    FileNameStrategy strategy =
        new FileNameStrategy(folder.newFolder("empty").getAbsolutePath() + "/");
    RrdTool empty =
        new RrdTool(
            new RrdToolQueryBuilder(strategy),
            new RrdToolTransport(ConfigParser.INSTANCE.defaultConfig(), strategy));
    assertEquals(Collections.emptyList(), empty.getDatabases());
  }
}
