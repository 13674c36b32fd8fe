package de.uni_passau.dbts.client.utils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Pattern;

/** Coercion of condition and field values. */
public class ValueUtils {

  private static final Pattern INTEGER_PATTERN = Pattern.compile("^-?\\d+$");
  private static final Pattern DECIMAL_PATTERN = Pattern.compile("^-?\\d*\\.\\d+([eE][-+]?\\d+)?$");

  private ValueUtils() {}

  /**
   * Coerces a value to a string: null becomes an empty string, true becomes {@code 1} and false
   * an empty string.
   *
   * @param value Value to convert.
   * @return String representation.
   */
  public static String stringValue(Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof Boolean) {
      return (Boolean) value ? "1" : "";
    }
    if (value instanceof Number) {
      return formatNumber((Number) value);
    }
    return value.toString();
  }

  /**
   * Prints a number without a trailing fraction of zeros, e.g., {@code 95.0} becomes {@code 95}.
   *
   * @param number The number.
   * @return Plain string representation.
   */
  public static String formatNumber(Number number) {
    if (number instanceof Integer
        || number instanceof Long
        || number instanceof Short
        || number instanceof Byte
        || number instanceof BigInteger) {
      return number.toString();
    }
    if (number instanceof BigDecimal) {
      return ((BigDecimal) number).stripTrailingZeros().toPlainString();
    }
    double value = number.doubleValue();
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return Double.toString(value);
    }
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }

  /**
   * Converts a value to a double.
   *
   * @param value A number, a boolean or a numeric string.
   * @return The numeric value.
   * @throws NumberFormatException if the value is not numeric.
   */
  public static double toDouble(Object value) {
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    if (value instanceof Boolean) {
      return (Boolean) value ? 1d : 0d;
    }
    if (value == null) {
      throw new NumberFormatException("null is not a number");
    }
    return Double.parseDouble(value.toString().trim());
  }

  /**
   * Returns true if the value is a number or a string holding one.
   *
   * @param value Value to check.
   * @return true if {@link #toDouble(Object)} would succeed for a non-boolean value.
   */
  public static boolean isNumeric(Object value) {
    if (value instanceof Number) {
      return true;
    }
    if (value instanceof String) {
      String text = ((String) value).trim();
      return INTEGER_PATTERN.matcher(text).matches() || DECIMAL_PATTERN.matcher(text).matches();
    }
    return false;
  }

  /**
   * Reads a literal from configuration text: booleans, integers and decimals get their Java type,
   * everything else stays a string.
   *
   * @param text Literal text.
   * @return Typed value, null for null input.
   */
  public static Object parseLiteral(String text) {
    if (text == null) {
      return null;
    }
    String trimmed = text.trim();
    if ("true".equalsIgnoreCase(trimmed) || "false".equalsIgnoreCase(trimmed)) {
      return Boolean.valueOf(trimmed);
    }
    if (INTEGER_PATTERN.matcher(trimmed).matches()) {
      try {
        return Long.valueOf(trimmed);
      } catch (NumberFormatException e) {
        return new BigInteger(trimmed);
      }
    }
    if (DECIMAL_PATTERN.matcher(trimmed).matches()) {
      return Double.valueOf(trimmed);
    }
    return text;
  }
}
