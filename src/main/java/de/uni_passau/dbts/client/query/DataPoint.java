package de.uni_passau.dbts.client.query;

import com.google.common.base.Preconditions;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single tagged sample of a measurement with one or more field values.
 */
public class DataPoint {
  private final String measurement;
  private final Map<String, Object> fields = new LinkedHashMap<>();
  private final Map<String, String> tags = new LinkedHashMap<>();

  /** Timestamp in milliseconds. */
  private final long timestamp;

  /**
   * Creates a data point timestamped with the current time.
   *
   * @param measurement Measurement name.
   */
  public DataPoint(String measurement) {
    this(measurement, System.currentTimeMillis());
  }

  /**
   * Creates a data point.
   *
   * @param measurement Measurement name.
   * @param timestamp Timestamp in milliseconds.
   */
  public DataPoint(String measurement, long timestamp) {
    Preconditions.checkArgument(
        measurement != null && !measurement.isEmpty(), "Measurement must not be empty.");
    this.measurement = measurement;
    this.timestamp = timestamp;
  }

  /**
   * Adds a field value.
   *
   * @param name Field name.
   * @param value Number, boolean or string.
   * @return The muted object to use in the builder style.
   */
  public DataPoint addField(String name, Object value) {
    fields.put(Preconditions.checkNotNull(name), value);
    return this;
  }

  /**
   * Adds a tag.
   *
   * @param name Tag name.
   * @param value Tag value.
   * @return The muted object to use in the builder style.
   */
  public DataPoint addTag(String name, String value) {
    tags.put(Preconditions.checkNotNull(name), value);
    return this;
  }

  public String getMeasurement() {
    return measurement;
  }

  public Map<String, Object> getFields() {
    return Collections.unmodifiableMap(fields);
  }

  public Map<String, String> getTags() {
    return Collections.unmodifiableMap(tags);
  }

  public long getTimestamp() {
    return timestamp;
  }

  @Override
  public String toString() {
    return measurement + tags + fields + "@" + timestamp;
  }
}
