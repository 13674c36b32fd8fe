package de.uni_passau.dbts.client.tsdb.rrdtool.tags;

import de.uni_passau.dbts.client.utils.FileUtils;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores every tag in the file name, all files share the base directory, e.g.,
 * {@code /rrd/cpu_usage_host-server1_region-us.east.rrd}.
 */
public class FileNameStrategy extends AbstractTagStrategy {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileNameStrategy.class);

  /**
   * Creates the strategy.
   *
   * @param baseDir Directory holding the RRD files, must end with a slash.
   * @throws RrdTagException if the directory does not end with a slash.
   */
  public FileNameStrategy(String baseDir) throws RrdTagException {
    super(baseDir);
  }

  @Override
  public String getFilePath(String measurement, Map<String, ?> tags) throws RrdTagException {
    return baseDir + encodeFileName(measurement, tags);
  }

  @Override
  public List<String> resolveFilePaths(String measurementPrefix, List<TagCondition> conditions)
      throws RrdTagException {
    String prefix = FileUtils.sanitizeMeasurement(measurementPrefix);
    List<String> paths = new ArrayList<>();
    for (String fileName : listRrdFiles(Paths.get(baseDir))) {
      DecodedFileName decoded = decodeFileName(fileName);
      if (decoded == null || !decoded.getMeasurement().startsWith(prefix)) {
        continue;
      }
      if (TagSearch.search(decoded.getTags(), conditions)) {
        paths.add(baseDir + fileName);
      }
    }
    LOGGER.debug("Resolved {} files for {} and {}", paths.size(), measurementPrefix, conditions);
    return paths;
  }

  @Override
  public List<String> findMeasurementsByTags(List<TagCondition> conditions)
      throws RrdTagException {
    TreeSet<String> measurements = new TreeSet<>();
    for (String fileName : listRrdFiles(Paths.get(baseDir))) {
      DecodedFileName decoded = decodeFileName(fileName);
      if (decoded != null && TagSearch.search(decoded.getTags(), conditions)) {
        measurements.add(decoded.getMeasurement());
      }
    }
    return new ArrayList<>(measurements);
  }
}
