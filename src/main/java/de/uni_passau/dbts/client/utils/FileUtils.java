package de.uni_passau.dbts.client.utils;

/** Helpers to turn measurement names and tag values into safe file name parts. */
public class FileUtils {

  /** Separates a tag key from its value, e.g., {@code host-server1}. */
  public static final String TAG_VALUE_SEPARATOR = "-";

  /** Separates the measurement and the tag segments of a file name. */
  public static final String TAG_SEPARATOR = "_";

  /** Replaces separator characters inside tag keys and values. */
  public static final String BAD_CHARACTER_REPLACEMENT = ".";

  /** Extension of round robin database files. */
  public static final String RRD_EXTENSION = ".rrd";

  private FileUtils() {}

  /**
   * Strips every character that is neither alphanumeric nor one of {@code - _ .} or a space.
   *
   * @param value Raw value.
   * @return Sanitized and trimmed value.
   */
  public static String sanitize(String value) {
    if (value == null) {
      return "";
    }
    return value.replaceAll("[^a-zA-Z0-9\\-_. ]", "").trim();
  }

  /**
   * Sanitizes a tag key or value and replaces both separators so that the encoded file name can be
   * split unambiguously.
   *
   * @param value Raw tag key or value.
   * @return Encodable value.
   */
  public static String sanitizeTagValue(String value) {
    return sanitize(value)
        .replace(TAG_SEPARATOR, BAD_CHARACTER_REPLACEMENT)
        .replace(TAG_VALUE_SEPARATOR, BAD_CHARACTER_REPLACEMENT);
  }

  /**
   * Sanitizes a measurement name. Underscores are allowed, dashes are not since they mark tags.
   *
   * @param measurement Raw measurement name.
   * @return Encodable measurement name.
   */
  public static String sanitizeMeasurement(String measurement) {
    return sanitize(measurement).replace(TAG_VALUE_SEPARATOR, BAD_CHARACTER_REPLACEMENT);
  }
}
