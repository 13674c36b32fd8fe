package de.uni_passau.dbts.client.enums;

import java.util.Locale;

/**
 * Strategies to fill empty time buckets.
 */
public enum FillPolicy {
  NULL,
  NONE,
  PREVIOUS,
  LINEAR,
  VALUE;

  /**
   * Parses a fill policy, case insensitive.
   *
   * @param value Textual policy.
   * @return The fill policy.
   */
  public static FillPolicy parse(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
