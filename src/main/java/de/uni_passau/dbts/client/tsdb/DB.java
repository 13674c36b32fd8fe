package de.uni_passau.dbts.client.tsdb;

import java.util.Locale;

/**
 * Databases supported by the client.
 */
public enum DB {
  INFLUXDB,
  PROMETHEUS,
  GRAPHITE,
  RRDTOOL,
  AGGREGATE;

  /**
   * Returns the name a driver is registered with.
   *
   * @return Lower case driver name.
   */
  public String getName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a driver name, case insensitive.
   *
   * @param name Driver name.
   * @return The database type.
   * @throws IllegalArgumentException if the name is unknown.
   */
  public static DB parse(String name) {
    try {
      return valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new IllegalArgumentException("Unsupported database " + name, e);
    }
  }
}
