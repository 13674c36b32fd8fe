package de.uni_passau.dbts.client.tsdb.rrdtool.tags;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Maps a measurement and its tags to an RRD file, and finds files and measurements that satisfy
 * tag conditions.
 */
public interface TagStrategy {

  /**
   * Returns the directory that holds all RRD files.
   *
   * @return Base directory, ending with a slash.
   */
  String getBaseDir();

  /**
   * Returns the file of a measurement and tag set. Missing directories are created.
   *
   * @param measurement Measurement name.
   * @param tags Tags, values must be scalars.
   * @return Absolute file path.
   * @throws RrdTagException if the tags cannot be encoded.
   */
  String getFilePath(String measurement, Map<String, ?> tags) throws RrdTagException;

  /**
   * Returns the file of a measurement without tags.
   *
   * @param measurement Measurement name.
   * @return Absolute file path.
   * @throws RrdTagException if the path cannot be created.
   */
  default String getFilePath(String measurement) throws RrdTagException {
    return getFilePath(measurement, Collections.emptyMap());
  }

  /**
   * Lists the files whose measurement starts with a prefix and whose tags satisfy the conditions.
   *
   * @param measurementPrefix Measurement name or prefix.
   * @param conditions Tag condition chain.
   * @return Sorted file paths.
   * @throws RrdTagException if the directory cannot be read or a condition is invalid.
   */
  List<String> resolveFilePaths(String measurementPrefix, List<TagCondition> conditions)
      throws RrdTagException;

  /**
   * Lists the measurements that have at least one file whose tags satisfy the conditions.
   *
   * @param conditions Tag condition chain.
   * @return Sorted, distinct measurement names.
   * @throws RrdTagException if the directory cannot be read or a condition is invalid.
   */
  List<String> findMeasurementsByTags(List<TagCondition> conditions) throws RrdTagException;
}
