package de.uni_passau.dbts.client.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Normalized response of a query: series keyed by field or alias, each an ordered list of
 * timestamped values, plus free-form metadata.
 */
public class QueryResult {

  /** Column that carries the timestamp in tabular results. */
  private static final String TIME_COLUMN = "time";

  private final Map<String, List<SeriesPoint>> series = new LinkedHashMap<>();
  private final Map<String, Object> metadata = new LinkedHashMap<>();

  /**
   * Appends a value to a series, creating the series if necessary.
   *
   * @param name Series name.
   * @param timestamp Timestamp in milliseconds.
   * @param value Value, may be null.
   * @return The muted object to use in the builder style.
   */
  public QueryResult appendPoint(String name, long timestamp, Object value) {
    series.computeIfAbsent(name, k -> new ArrayList<>()).add(new SeriesPoint(timestamp, value));
    return this;
  }

  /**
   * Adds a tabular result. The {@code time} column supplies the timestamps, every other column
   * becomes the series {@code name.column}.
   *
   * @param name Table name.
   * @param columns Column names.
   * @param rows Rows, each aligned with the columns.
   * @return The muted object to use in the builder style.
   */
  public QueryResult addSeries(String name, List<String> columns, List<List<Object>> rows) {
    int timeIndex = columns.indexOf(TIME_COLUMN);
    for (List<Object> row : rows) {
      long timestamp = 0L;
      if (timeIndex >= 0 && row.get(timeIndex) instanceof Number) {
        timestamp = ((Number) row.get(timeIndex)).longValue();
      }
      for (int i = 0; i < columns.size(); i++) {
        if (i == timeIndex) {
          continue;
        }
        appendPoint(name + "." + columns.get(i), timestamp, i < row.size() ? row.get(i) : null);
      }
    }
    return this;
  }

  public QueryResult addMetadata(String key, Object value) {
    metadata.put(key, value);
    return this;
  }

  public Map<String, List<SeriesPoint>> getSeries() {
    return Collections.unmodifiableMap(series);
  }

  /**
   * Returns a single series.
   *
   * @param name Series name.
   * @return The points, empty if there is no such series.
   */
  public List<SeriesPoint> getSeries(String name) {
    List<SeriesPoint> points = series.get(name);
    return points == null ? Collections.emptyList() : Collections.unmodifiableList(points);
  }

  public Map<String, Object> getMetadata() {
    return Collections.unmodifiableMap(metadata);
  }

  /**
   * Returns the first value of the first series. Handy for queries that aggregate to one value.
   *
   * @return The value, or null for an empty result.
   */
  public Object getSingleValue() {
    for (List<SeriesPoint> points : series.values()) {
      if (!points.isEmpty()) {
        return points.get(0).getValue();
      }
    }
    return null;
  }

  /**
   * Returns the first value of a series.
   *
   * @param name Series name.
   * @return The value, or null if the series is empty or missing.
   */
  public Object getSingleValue(String name) {
    List<SeriesPoint> points = series.get(name);
    return points == null || points.isEmpty() ? null : points.get(0).getValue();
  }

  /**
   * Returns the distinct timestamps of all series in ascending order.
   *
   * @return Timestamps in milliseconds.
   */
  public List<Long> getTimestamps() {
    TreeSet<Long> timestamps = new TreeSet<>();
    for (List<SeriesPoint> points : series.values()) {
      for (SeriesPoint point : points) {
        timestamps.add(point.getTimestamp());
      }
    }
    return new ArrayList<>(timestamps);
  }

  public boolean isEmpty() {
    return count() == 0;
  }

  /**
   * Counts the points of all series.
   *
   * @return Number of points.
   */
  public int count() {
    int count = 0;
    for (List<SeriesPoint> points : series.values()) {
      count += points.size();
    }
    return count;
  }

  @Override
  public String toString() {
    return "QueryResult{series=" + series + ", metadata=" + metadata + "}";
  }
}
