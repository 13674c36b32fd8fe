package de.uni_passau.dbts.client.enums;

import java.util.Locale;

/**
 * Logical join of a condition with its predecessor.
 */
public enum Connective {
  AND,
  OR;

  /**
   * Parses a connective, case insensitive. A missing value yields {@link #AND}.
   *
   * @param value Textual connective.
   * @return The connective.
   */
  public static Connective parse(String value) {
    if (value == null || value.trim().isEmpty()) {
      return AND;
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
