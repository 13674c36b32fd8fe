package de.uni_passau.dbts.client.tsdb.rrdtool.tags;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Ignores tags, there is one file per measurement. */
public class NoTagsStrategy extends AbstractTagStrategy {

  private static final Logger LOGGER = LoggerFactory.getLogger(NoTagsStrategy.class);

  /**
   * Creates the strategy.
   *
   * @param baseDir Directory holding the RRD files, must end with a slash.
   * @throws RrdTagException if the directory does not end with a slash.
   */
  public NoTagsStrategy(String baseDir) throws RrdTagException {
    super(baseDir);
  }

  @Override
  public String getFilePath(String measurement, Map<String, ?> tags) {
    if (!tags.isEmpty()) {
      LOGGER.debug("Ignoring tags {} of {}", tags.keySet(), measurement);
    }
    return baseDir + fileStem(measurement) + ".rrd";
  }

  /** Conditions are not evaluated since files carry no tags. */
  @Override
  public List<String> resolveFilePaths(String measurementPrefix, List<TagCondition> conditions)
      throws RrdTagException {
    List<String> paths = new ArrayList<>();
    for (String fileName : listRrdFiles(Paths.get(baseDir))) {
      if (fileName.startsWith(fileStem(measurementPrefix))) {
        paths.add(baseDir + fileName);
      }
    }
    return paths;
  }

  /** Conditions are not evaluated, every measurement is returned. */
  @Override
  public List<String> findMeasurementsByTags(List<TagCondition> conditions)
      throws RrdTagException {
    List<String> measurements = new ArrayList<>();
    for (String fileName : listRrdFiles(Paths.get(baseDir))) {
      measurements.add(fileName.substring(0, fileName.length() - ".rrd".length()));
    }
    return measurements;
  }

  private static String fileStem(String measurement) {
    return measurement.replaceAll("[^a-zA-Z0-9_-]", "_");
  }
}
