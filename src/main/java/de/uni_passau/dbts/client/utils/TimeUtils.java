package de.uni_passau.dbts.client.utils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.joda.time.DateTime;
import org.joda.time.Period;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;

/** Time utility. */
public class TimeUtils {

  /** Relative windows such as {@code 15m} or {@code 2d}. */
  private static final Pattern DURATION_PATTERN = Pattern.compile("^(\\d+)([smhdwy])$");

  /** Bucket intervals, a plain number is read as seconds. */
  private static final Pattern INTERVAL_PATTERN = Pattern.compile("^(\\d+)([smhdw]?)$");

  /** ISO 8601 in UTC with an explicit offset, e.g., {@code 2023-05-28T23:00:00+00:00}. */
  private static final DateTimeFormatter ISO_FORMATTER =
      DateTimeFormat.forPattern("yyyy-MM-dd'T'HH:mm:ssZZ").withZoneUTC();

  private static final long SECONDS_PER_MINUTE = 60L;
  private static final long SECONDS_PER_HOUR = 60L * SECONDS_PER_MINUTE;
  private static final long SECONDS_PER_DAY = 24L * SECONDS_PER_HOUR;
  private static final long SECONDS_PER_WEEK = 7L * SECONDS_PER_DAY;

  /** Months are counted as 30 days. */
  private static final long SECONDS_PER_MONTH = 30L * SECONDS_PER_DAY;

  /** Years are counted as 365 days. */
  private static final long SECONDS_PER_YEAR = 365L * SECONDS_PER_DAY;

  private TimeUtils() {}

  /**
   * Converts a datetime string to timestamp in milliseconds.
   *
   * @param dateStr Datetime string.
   * @return Timestamp in milliseconds.
   */
  public static long convertDateStrToTimestamp(String dateStr) {
    DateTime dateTime = new DateTime(dateStr);
    return dateTime.getMillis();
  }

  /**
   * Prints a timestamp as ISO 8601 string in UTC.
   *
   * @param dateTime Timestamp.
   * @return ISO string with a {@code +00:00} offset.
   */
  public static String toIsoString(DateTime dateTime) {
    return ISO_FORMATTER.print(dateTime);
  }

  /**
   * Converts a timestamp to Unix epoch seconds.
   *
   * @param dateTime Timestamp.
   * @return Seconds since the epoch.
   */
  public static long toEpochSeconds(DateTime dateTime) {
    return dateTime.getMillis() / 1000L;
  }

  /**
   * Parses a relative window such as {@code 1h}. Supported units are s, m, h, d, w and y.
   *
   * @param duration Duration string.
   * @return The period.
   * @throws IllegalArgumentException if the string does not match the expected format.
   */
  public static Period parseDuration(String duration) {
    Matcher matcher = DURATION_PATTERN.matcher(duration == null ? "" : duration);
    if (!matcher.matches()) {
      throw new IllegalArgumentException("Invalid duration format: " + duration);
    }
    int amount = Integer.parseInt(matcher.group(1));
    switch (matcher.group(2)) {
      case "s":
        return Period.seconds(amount);
      case "m":
        return Period.minutes(amount);
      case "h":
        return Period.hours(amount);
      case "d":
        return Period.days(amount);
      case "w":
        return Period.weeks(amount);
      case "y":
        return Period.years(amount);
      default:
        throw new IllegalArgumentException("Invalid duration format: " + duration);
    }
  }

  /**
   * Prints the non-zero parts of a period, largest first. Weeks are folded into days.
   *
   * @param period The period.
   * @param units Unit suffixes for years, months, days, hours, minutes and seconds.
   * @param separator Text between two parts.
   * @return Formatted period, {@code 0s} if every part is zero.
   */
  public static String formatPeriod(Period period, String[] units, String separator) {
    long[] amounts = {
      period.getYears(),
      period.getMonths(),
      period.getWeeks() * 7L + period.getDays(),
      period.getHours(),
      period.getMinutes(),
      period.getSeconds()
    };
    StringBuilder builder = new StringBuilder();
    for (int i = 0; i < amounts.length; i++) {
      if (amounts[i] > 0) {
        if (builder.length() > 0) {
          builder.append(separator);
        }
        builder.append(amounts[i]).append(units[i]);
      }
    }
    return builder.length() == 0 ? "0s" : builder.toString();
  }

  /**
   * Converts a period to seconds.
   *
   * @param period The period.
   * @return Length of the period in seconds.
   */
  public static long toSeconds(Period period) {
    return period.getYears() * SECONDS_PER_YEAR
        + period.getMonths() * SECONDS_PER_MONTH
        + period.getWeeks() * SECONDS_PER_WEEK
        + period.getDays() * SECONDS_PER_DAY
        + period.getHours() * SECONDS_PER_HOUR
        + period.getMinutes() * SECONDS_PER_MINUTE
        + period.getSeconds();
  }

  /**
   * Converts a bucket interval such as {@code 5m} into seconds.
   *
   * @param interval Interval string, units s, m, h, d and w, or a plain number of seconds.
   * @return Interval length in seconds.
   * @throws IllegalArgumentException if the interval cannot be parsed.
   */
  public static long parseIntervalSeconds(String interval) {
    Matcher matcher = INTERVAL_PATTERN.matcher(interval == null ? "" : interval.trim());
    if (!matcher.matches()) {
      throw new IllegalArgumentException("Invalid interval format: " + interval);
    }
    long amount = Long.parseLong(matcher.group(1));
    switch (matcher.group(2)) {
      case "m":
        return amount * SECONDS_PER_MINUTE;
      case "h":
        return amount * SECONDS_PER_HOUR;
      case "d":
        return amount * SECONDS_PER_DAY;
      case "w":
        return amount * SECONDS_PER_WEEK;
      default:
        return amount;
    }
  }
}
