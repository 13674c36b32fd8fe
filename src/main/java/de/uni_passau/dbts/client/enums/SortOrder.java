package de.uni_passau.dbts.client.enums;

import java.util.Locale;

/**
 * Sort directions.
 */
public enum SortOrder {
  ASC,
  DESC;

  /**
   * Parses a direction, case insensitive.
   *
   * @param value Textual direction.
   * @return The direction.
   * @throws IllegalArgumentException if the direction is neither ASC nor DESC.
   */
  public static SortOrder parse(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Sort direction must not be null.");
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
