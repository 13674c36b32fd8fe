package de.uni_passau.dbts.client.tsdb.rrdtool;

import de.uni_passau.dbts.client.conf.Config;
import de.uni_passau.dbts.client.tsdb.AbstractDatabase;
import de.uni_passau.dbts.client.tsdb.TsdbException;
import de.uni_passau.dbts.client.tsdb.WriteException;
import de.uni_passau.dbts.client.tsdb.rrdtool.tags.RrdTagException;
import de.uni_passau.dbts.client.tsdb.rrdtool.tags.TagStrategy;
import de.uni_passau.dbts.client.utils.FileUtils;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import org.joda.time.DateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Driver of RRDtool. Every measurement and tag set is stored in its own RRD file below the
 * configured directory, the tag strategy decides the file layout.
 */
public class RrdTool extends AbstractDatabase {

  private static final Logger LOGGER = LoggerFactory.getLogger(RrdTool.class);

  private final TagStrategy tagStrategy;

  /**
   * Creates a driver.
   *
   * @param config Binary, directory and tag strategy settings.
   * @throws TsdbException if the directory is invalid for the tag strategy.
   */
  public RrdTool(Config config) throws TsdbException {
    this(config, config.RRD_TAG_STRATEGY.create(config.RRD_DIR, config.RRD_FOLDER_TAGS));
  }

  private RrdTool(Config config, TagStrategy tagStrategy) {
    this(new RrdToolQueryBuilder(tagStrategy), new RrdToolTransport(config, tagStrategy));
  }

  /**
   * Creates a driver.
   *
   * @param queryBuilder xport query builder.
   * @param transport Process transport.
   */
  public RrdTool(RrdToolQueryBuilder queryBuilder, RrdToolTransport transport) {
    super(queryBuilder, transport);
    this.tagStrategy = queryBuilder.getTagStrategy();
  }

  /**
   * Lists the measurements stored in the RRD directory.
   *
   * @return Measurement names.
   * @throws TsdbException if the directory cannot be read.
   */
  @Override
  public List<String> getDatabases() throws TsdbException {
    return tagStrategy.findMeasurementsByTags(Collections.emptyList());
  }

  /**
   * Deletes every file of the measurement. RRD files cannot drop a time range, so the range is
   * ignored.
   */
  @Override
  public boolean deleteMeasurement(String measurement, DateTime start, DateTime stop)
      throws TsdbException {
    List<String> paths;
    try {
      paths = tagStrategy.resolveFilePaths(measurement, Collections.emptyList());
    } catch (RrdTagException e) {
      throw new WriteException("Could not resolve the files of " + measurement, e);
    }
    if (start != null || stop != null) {
      LOGGER.debug("RRD files cannot delete a time range, deleting all of {}", measurement);
    }
    boolean deleted = true;
    for (String path : paths) {
      if (!belongsTo(path, measurement)) {
        continue;
      }
      try {
        Files.deleteIfExists(Paths.get(path));
        LOGGER.info("Deleted {}", path);
      } catch (IOException e) {
        LOGGER.error("Failed to delete {} because ", path, e);
        deleted = false;
      }
    }
    return deleted;
  }

  /** Filters files of measurements that merely share the prefix, e.g., cpu and cpu_usage. */
  static boolean belongsTo(String path, String measurement) {
    String name = new File(path).getName();
    String sanitized = FileUtils.sanitizeMeasurement(measurement);
    if (name.equals(sanitized + FileUtils.RRD_EXTENSION)) {
      return true;
    }
    if (!name.startsWith(sanitized + FileUtils.TAG_SEPARATOR)) {
      return false;
    }
    String firstTag = name.substring(sanitized.length() + 1).split(FileUtils.TAG_SEPARATOR)[0];
    return firstTag.contains(FileUtils.TAG_VALUE_SEPARATOR);
  }
}
