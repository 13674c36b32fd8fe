package de.uni_passau.dbts.client.enums;

import java.util.Locale;

/**
 * Aggregation functions.
 */
public enum Aggregation {
  COUNT,
  AVG,
  SUM,
  MAX,
  MIN,
  LAST,
  FIRST,
  STDDEV,
  PERCENTILE;

  /**
   * Returns the lower case name of the function, e.g., {@code avg}.
   *
   * @return Function name.
   */
  public String getName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Returns true if the function needs a numeric rank to be evaluated.
   *
   * @return true for percentiles.
   */
  public boolean requiresRank() {
    return this == PERCENTILE;
  }

  /**
   * Parses a function name. {@code mean} is accepted as a synonym of {@link #AVG}.
   *
   * @param name Function name, case insensitive.
   * @return The aggregation function.
   * @throws IllegalArgumentException if the name is unknown.
   */
  public static Aggregation parse(String name) {
    if (name == null) {
      throw new IllegalArgumentException("Aggregation function must not be null.");
    }
    String normalized = name.trim().toUpperCase(Locale.ROOT);
    switch (normalized) {
      case "MEAN":
      case "AVERAGE":
        return AVG;
      case "STDEV":
        return STDDEV;
      default:
        try {
          return valueOf(normalized);
        } catch (IllegalArgumentException e) {
          throw new IllegalArgumentException("Unknown aggregation function " + name, e);
        }
    }
  }
}
