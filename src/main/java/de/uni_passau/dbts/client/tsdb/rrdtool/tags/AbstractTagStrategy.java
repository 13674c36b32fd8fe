package de.uni_passau.dbts.client.tsdb.rrdtool.tags;

import de.uni_passau.dbts.client.conf.Constants;
import de.uni_passau.dbts.client.utils.FileUtils;
import de.uni_passau.dbts.client.utils.ValueUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File name encoding shared by the strategies. A file name consists of the measurement followed by
 * one {@code _key-value} segment per tag, sorted by key, e.g.,
 * {@code cpu_usage_host-server1_region-us.east.rrd}. Separators inside keys and values are
 * replaced by dots, so names decode unambiguously.
 */
public abstract class AbstractTagStrategy implements TagStrategy {

  /** Directory holding the RRD files. */
  protected final String baseDir;

  /**
   * Creates a strategy.
   *
   * @param baseDir Directory holding the RRD files, must end with a slash.
   * @throws RrdTagException if the directory does not end with a slash.
   */
  protected AbstractTagStrategy(String baseDir) throws RrdTagException {
    if (baseDir == null || !baseDir.endsWith("/")) {
      throw new RrdTagException("Base directory must end with a slash");
    }
    this.baseDir = baseDir;
  }

  @Override
  public String getBaseDir() {
    return baseDir;
  }

  /**
   * Encodes a measurement and its tags into a file name.
   *
   * @param measurement Measurement name.
   * @param tags Tags, values must be scalars.
   * @return File name including the extension.
   * @throws RrdTagException if a value is not a scalar or the name gets too long.
   */
  protected String encodeFileName(String measurement, Map<String, ?> tags)
      throws RrdTagException {
    StringBuilder name = new StringBuilder(FileUtils.sanitizeMeasurement(measurement));
    for (Map.Entry<String, ?> tag : new TreeMap<String, Object>(tags).entrySet()) {
      name.append(FileUtils.TAG_SEPARATOR)
          .append(FileUtils.sanitizeTagValue(tag.getKey()))
          .append(FileUtils.TAG_VALUE_SEPARATOR)
          .append(FileUtils.sanitizeTagValue(scalarValue(tag.getKey(), tag.getValue())));
    }
    name.append(FileUtils.RRD_EXTENSION);
    if (name.length() > Constants.MAX_FILE_NAME_LENGTH) {
      throw new RrdTagException(
          String.format(
              "File name of %s exceeds %d characters", measurement,
              Constants.MAX_FILE_NAME_LENGTH));
    }
    return name.toString();
  }

  /**
   * Decodes a file name produced by {@link #encodeFileName(String, Map)}.
   *
   * @param fileName File name including the extension.
   * @return Measurement and tags, or null if the file is no RRD file.
   */
  protected DecodedFileName decodeFileName(String fileName) {
    if (!fileName.endsWith(FileUtils.RRD_EXTENSION)) {
      return null;
    }
    String stem = fileName.substring(0, fileName.length() - FileUtils.RRD_EXTENSION.length());
    String[] segments = stem.split(FileUtils.TAG_SEPARATOR, -1);

    List<String> measurementParts = new ArrayList<>();
    Map<String, String> tags = new LinkedHashMap<>();
    String lastKey = null;
    for (String segment : segments) {
      int separator = segment.indexOf(FileUtils.TAG_VALUE_SEPARATOR);
      if (separator < 0) {
        if (lastKey == null) {
          measurementParts.add(segment);
        } else {
          tags.put(lastKey, tags.get(lastKey) + FileUtils.TAG_SEPARATOR + segment);
        }
        continue;
      }
      lastKey = segment.substring(0, separator);
      tags.put(lastKey, segment.substring(separator + 1));
    }
    return new DecodedFileName(String.join(FileUtils.TAG_SEPARATOR, measurementParts), tags);
  }

  /**
   * Lists the RRD files of a directory.
   *
   * @param directory Directory to scan.
   * @return Sorted file names, empty if the directory does not exist.
   * @throws RrdTagException if the directory cannot be read.
   */
  protected List<String> listRrdFiles(Path directory) throws RrdTagException {
    if (!Files.isDirectory(directory)) {
      return Collections.emptyList();
    }
    try (Stream<Path> files = Files.list(directory)) {
      return files
          .filter(Files::isRegularFile)
          .map(file -> file.getFileName().toString())
          .filter(name -> name.endsWith(FileUtils.RRD_EXTENSION))
          .sorted()
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new RrdTagException("Could not list RRD files of " + directory, e);
    }
  }

  /**
   * Lists the sub directories of a directory.
   *
   * @param directory Directory to scan.
   * @return Sorted directory names, empty if the directory does not exist.
   * @throws RrdTagException if the directory cannot be read.
   */
  protected List<String> listDirectories(Path directory) throws RrdTagException {
    if (!Files.isDirectory(directory)) {
      return Collections.emptyList();
    }
    try (Stream<Path> files = Files.list(directory)) {
      return files
          .filter(Files::isDirectory)
          .map(file -> file.getFileName().toString())
          .sorted()
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new RrdTagException("Could not list directories of " + directory, e);
    }
  }

  /**
   * Creates a directory and its parents.
   *
   * @param directory Directory path.
   * @throws RrdTagException if the directory cannot be created.
   */
  protected void createDirectories(String directory) throws RrdTagException {
    try {
      Files.createDirectories(Paths.get(directory));
    } catch (IOException e) {
      throw new RrdTagException("Could not create directory " + directory, e);
    }
  }

  /**
   * Converts a tag value to a string, rejecting collections, maps and other compound values.
   *
   * @param key Tag name.
   * @param value Tag value.
   * @return String value.
   * @throws RrdTagException if the value is not a scalar.
   */
  protected static String scalarValue(String key, Object value) throws RrdTagException {
    if (value == null
        || value instanceof String
        || value instanceof Number
        || value instanceof Boolean
        || value instanceof Character) {
      return ValueUtils.stringValue(value);
    }
    throw new RrdTagException(
        String.format("Tag %s must have a scalar value, got %s", key, value.getClass().getName()));
  }

  /** Measurement and tags decoded from a file name. */
  protected static class DecodedFileName {
    private final String measurement;
    private final Map<String, String> tags;

    DecodedFileName(String measurement, Map<String, String> tags) {
      this.measurement = measurement;
      this.tags = tags;
    }

    public String getMeasurement() {
      return measurement;
    }

    public Map<String, String> getTags() {
      return tags;
    }
  }
}
