package de.uni_passau.dbts.client.tsdb.prometheus;

import de.uni_passau.dbts.client.query.RawQuery;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.joda.time.DateTime;

/**
 * PromQL expression with optional trailing comments carrying what PromQL cannot express, e.g.,
 * {@code cpu_usage{host="server1"} # limit: 10 # time range: A to B}. The transport reads the
 * comments to choose between instant and range queries.
 */
public class PrometheusRawQuery implements RawQuery {

  private static final String COMMENT = " # ";
  private static final Pattern LIMIT = Pattern.compile("^limit: (\\d+)$");
  private static final Pattern TIME_RANGE = Pattern.compile("^time range: (\\S+) to (\\S+)$");
  private static final Pattern RELATIVE_TIME = Pattern.compile("^relative time: (.+)$");
  private static final Pattern RELATIVE_PART = Pattern.compile("^(\\d+)(y|mo|d|h|m|s)$");

  private final String rawQuery;
  private final String expression;
  private Integer limit;
  private DateTime start;
  private DateTime end;
  private String relativeTime;

  /**
   * Creates a query and parses its comments.
   *
   * @param rawQuery PromQL expression, optionally followed by comments.
   */
  public PrometheusRawQuery(String rawQuery) {
    this.rawQuery = rawQuery;
    String[] parts = rawQuery.split(Pattern.quote(COMMENT));
    this.expression = parts[0].trim();
    for (int i = 1; i < parts.length; i++) {
      parseComment(parts[i].trim());
    }
  }

  private void parseComment(String comment) {
    Matcher matcher = LIMIT.matcher(comment);
    if (matcher.matches()) {
      limit = Integer.valueOf(matcher.group(1));
      return;
    }
    matcher = TIME_RANGE.matcher(comment);
    if (matcher.matches()) {
      start = new DateTime(matcher.group(1));
      end = new DateTime(matcher.group(2));
      return;
    }
    matcher = RELATIVE_TIME.matcher(comment);
    if (matcher.matches()) {
      relativeTime = matcher.group(1);
    }
  }

  @Override
  public String getRawQuery() {
    return rawQuery;
  }

  /**
   * Returns the PromQL expression without comments.
   *
   * @return PromQL expression.
   */
  public String getExpression() {
    return expression;
  }

  public Integer getLimit() {
    return limit;
  }

  public DateTime getStart() {
    return start;
  }

  public DateTime getEnd() {
    return end;
  }

  public String getRelativeTime() {
    return relativeTime;
  }

  /**
   * Returns true if the query covers a time range and should be evaluated at several steps.
   *
   * @return true for range queries.
   */
  public boolean isRangeQuery() {
    return (start != null && end != null) || relativeTime != null;
  }

  /**
   * Converts the relative window, e.g., {@code 1d 2h}, into seconds.
   *
   * @return Window length in seconds, 0 if there is no relative window.
   */
  public long getRelativeSeconds() {
    if (relativeTime == null) {
      return 0;
    }
    long seconds = 0;
    for (String part : relativeTime.split(" ")) {
      Matcher matcher = RELATIVE_PART.matcher(part);
      if (!matcher.matches()) {
        throw new IllegalArgumentException("Invalid relative time " + relativeTime);
      }
      long amount = Long.parseLong(matcher.group(1));
      switch (matcher.group(2)) {
        case "y":
          seconds += amount * 365 * 86400;
          break;
        case "mo":
          seconds += amount * 30 * 86400;
          break;
        case "d":
          seconds += amount * 86400;
          break;
        case "h":
          seconds += amount * 3600;
          break;
        case "m":
          seconds += amount * 60;
          break;
        default:
          seconds += amount;
          break;
      }
    }
    return seconds;
  }

  @Override
  public String toString() {
    return rawQuery;
  }
}
