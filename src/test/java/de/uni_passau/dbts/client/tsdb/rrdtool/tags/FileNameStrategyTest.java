package de.uni_passau.dbts.client.tsdb.rrdtool.tags;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import de.uni_passau.dbts.client.enums.ComparisonOperator;
import de.uni_passau.dbts.client.enums.Connective;
import java.io.File;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class FileNameStrategyTest {

  @Rule public TemporaryFolder folder = new TemporaryFolder();

  private String baseDir;
  private FileNameStrategy strategy;

  @Before
  public void setUp() throws Exception {
    baseDir = folder.getRoot().getAbsolutePath() + "/";
    strategy = new FileNameStrategy(baseDir);
  }

  private String create(String measurement, Map<String, ?> tags) throws Exception {
    String path = strategy.getFilePath(measurement, tags);
    assertTrue(new File(path).createNewFile());
    return path;
  }

  private static Map<String, Object> tags(Object... keyValues) {
    Map<String, Object> tags = new HashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      tags.put((String) keyValues[i], keyValues[i + 1]);
    }
    return tags;
  }

  @Test
  public void testFileNameSortsAndSanitizesTags() throws Exception {
    assertEquals(
        baseDir + "cpu_usage_host-server1_region-us.east.rrd",
        strategy.getFilePath("cpu_usage", tags("region", "us-east", "host", "server1")));
    assertEquals(baseDir + "memory.rrd", strategy.getFilePath("memory"));
    assertEquals(baseDir + "disk_used.pct-5.rrd", strategy.getFilePath("disk", tags("used_pct", 5)));
  }

  @Test(expected = RrdTagException.class)
  public void testBaseDirMustEndWithSlash() throws Exception {
    new FileNameStrategy(folder.getRoot().getAbsolutePath());
  }

  @Test(expected = RrdTagException.class)
  public void testCompoundTagValuesAreRejected() throws Exception {
    strategy.getFilePath("cpu", tags("hosts", Arrays.asList("a", "b")));
  }

  @Test(expected = RrdTagException.class)
  public void testFileNameLengthIsLimited() throws Exception {
    StringBuilder value = new StringBuilder();
    for (int i = 0; i < 300; i++) {
      value.append('x');
    }
    strategy.getFilePath("cpu", tags("host", value.toString()));
  }

  @Test
  public void testRoundTrip() throws Exception {
    create("cpu_usage", tags("host", "server1", "region", "us-east"));

    List<String> measurements =
        strategy.findMeasurementsByTags(
            Arrays.asList(
                new TagCondition("host", ComparisonOperator.EQUALS, "server1"),
                new TagCondition("region", ComparisonOperator.EQUALS, "us-east")));
    assertEquals(Collections.singletonList("cpu_usage"), measurements);
  }

  @Test
  public void testResolveFilePaths() throws Exception {
    String a = create("cpu", tags("host", "a"));
    String b = create("cpu", tags("host", "b"));
    String usage = create("cpu_usage", tags("host", "a"));
    create("memory", tags("host", "a"));

    assertEquals(
        Arrays.asList(a, b, usage), strategy.resolveFilePaths("cpu", Collections.emptyList()));
    assertEquals(
        Arrays.asList(a, usage),
        strategy.resolveFilePaths(
            "cpu", Collections.singletonList(new TagCondition("host", ComparisonOperator.EQUALS, "a"))));
    assertEquals(
        Arrays.asList(a, b, usage),
        strategy.resolveFilePaths(
            "cpu",
            Arrays.asList(
                new TagCondition("host", ComparisonOperator.EQUALS, "a"),
                new TagCondition("host", ComparisonOperator.EQUALS, "b", Connective.OR),
                new TagCondition("host", ComparisonOperator.IN, Arrays.asList("a", "b")))));
  }

  @Test
  public void testDashedMeasurementIsFoundAgain() throws Exception {
    String path = create("disk-io", tags("host", "server1"));

    assertEquals(baseDir + "disk.io_host-server1.rrd", path);
    assertEquals(
        Collections.singletonList(path),
        strategy.resolveFilePaths(
            "disk-io",
            Collections.singletonList(
                new TagCondition("host", ComparisonOperator.EQUALS, "server1"))));
  }

  @Test
  public void testFindMeasurementsByTags() throws Exception {
    create("cpu", tags("host", "a"));
    create("memory", tags("host", "b"));
    create("disk", Collections.emptyMap());

    assertEquals(
        Arrays.asList("cpu", "disk", "memory"),
        strategy.findMeasurementsByTags(Collections.emptyList()));
    assertEquals(
        Collections.singletonList("memory"),
        strategy.findMeasurementsByTags(
            Collections.singletonList(new TagCondition("host", ComparisonOperator.EQUALS, "b"))));
  }

  @Test
  public void testMissingDirectoryResolvesNothing() throws Exception {
    FileNameStrategy missing = new FileNameStrategy(baseDir + "missing/");
    assertTrue(missing.resolveFilePaths("cpu", Collections.emptyList()).isEmpty());
  }
}
