package de.uni_passau.dbts.client.query;

import java.util.Objects;

/**
 * A timestamped value of a result series.
 */
public class SeriesPoint {

  /** Timestamp in milliseconds. */
  private final long timestamp;

  /** Value, null for gaps. */
  private final Object value;

  /**
   * Creates a new point.
   *
   * @param timestamp Timestamp in milliseconds.
   * @param value Value, may be null.
   */
  public SeriesPoint(long timestamp, Object value) {
    this.timestamp = timestamp;
    this.value = value;
  }

  public long getTimestamp() {
    return timestamp;
  }

  public Object getValue() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SeriesPoint)) {
      return false;
    }
    SeriesPoint that = (SeriesPoint) o;
    return timestamp == that.timestamp && Objects.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(timestamp, value);
  }

  @Override
  public String toString() {
    return "(" + timestamp + ", " + value + ")";
  }
}
