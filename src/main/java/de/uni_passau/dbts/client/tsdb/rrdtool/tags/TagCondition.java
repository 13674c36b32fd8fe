package de.uni_passau.dbts.client.tsdb.rrdtool.tags;

import com.google.common.base.Preconditions;
import de.uni_passau.dbts.client.enums.ComparisonOperator;
import de.uni_passau.dbts.client.enums.Connective;
import de.uni_passau.dbts.client.query.QueryCondition;
import de.uni_passau.dbts.client.utils.FileUtils;
import de.uni_passau.dbts.client.utils.ValueUtils;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * A condition on a tag decoded from an RRD file path. Values are compared after the same
 * sanitizing that was applied when the path was encoded, so {@code us-east} matches a file
 * encoded as {@code us.east}.
 */
public class TagCondition {
  private final String tag;
  private final ComparisonOperator operator;
  private final Object value;
  private final Connective connective;

  /**
   * Creates an AND-joined condition.
   *
   * @param tag Tag name.
   * @param operator Comparison operator.
   * @param value Scalar value, or a list for IN, NOT IN and BETWEEN.
   */
  public TagCondition(String tag, ComparisonOperator operator, Object value) {
    this(tag, operator, value, Connective.AND);
  }

  /**
   * Creates a condition.
   *
   * @param tag Tag name.
   * @param operator Comparison operator.
   * @param value Scalar value, or a list for IN, NOT IN and BETWEEN.
   * @param connective Join with the previous condition.
   */
  public TagCondition(String tag, ComparisonOperator operator, Object value, Connective connective) {
    this.tag = Preconditions.checkNotNull(tag);
    this.operator = Preconditions.checkNotNull(operator);
    this.value = value;
    this.connective = Preconditions.checkNotNull(connective);
  }

  /**
   * Creates a condition from operator and connective symbols, e.g., {@code "NOT IN"} and
   * {@code "or"}.
   *
   * @param tag Tag name.
   * @param operator Operator symbol.
   * @param value Value(s) to compare with.
   * @param connective Connective, case insensitive.
   */
  public TagCondition(String tag, String operator, Object value, String connective) {
    this(tag, ComparisonOperator.fromSymbol(operator), value, Connective.parse(connective));
  }

  /**
   * Converts a query condition.
   *
   * @param condition Query condition.
   * @return The tag condition.
   */
  public static TagCondition fromQueryCondition(QueryCondition condition) {
    return new TagCondition(
        condition.getField(),
        condition.getOperator(),
        condition.getValue(),
        condition.getConnective());
  }

  public String getTag() {
    return tag;
  }

  public ComparisonOperator getOperator() {
    return operator;
  }

  public Object getValue() {
    return value;
  }

  public Connective getConnective() {
    return connective;
  }

  /**
   * Evaluates the condition against a tag set. A missing tag never matches.
   *
   * @param tags Decoded tags.
   * @return true if the tag exists and matches.
   * @throws RrdTagException if the operator cannot be evaluated against tags.
   */
  public boolean evaluate(Map<String, ?> tags) throws RrdTagException {
    checkOperator();
    if (!tags.containsKey(tag)) {
      return false;
    }
    return matches(tags.get(tag));
  }

  /**
   * Tests a tag value.
   *
   * @param tagValue Value of the tag.
   * @return true if the value satisfies the condition.
   * @throws RrdTagException if the operator is not supported or the value is malformed.
   */
  public boolean matches(Object tagValue) throws RrdTagException {
    checkOperator();
    switch (operator) {
      case EQUALS:
      case SAME:
        return normalize(tagValue).equals(normalize(value));
      case NOT_EQUALS:
      case NOT_EQUALS_ALT:
        return !normalize(tagValue).equals(normalize(value));
      case IN:
        return normalizedValues().contains(normalize(tagValue));
      case NOT_IN:
        return !normalizedValues().contains(normalize(tagValue));
      case REGEX:
        return compile(ValueUtils.stringValue(value))
            .matcher(ValueUtils.stringValue(tagValue))
            .find();
      case BETWEEN:
        return between(tagValue);
      default:
        throw new RrdTagException("Operator " + operator.getSymbol() + " not supported");
    }
  }

  private void checkOperator() throws RrdTagException {
    switch (operator) {
      case EQUALS:
      case SAME:
      case NOT_EQUALS:
      case NOT_EQUALS_ALT:
      case IN:
      case NOT_IN:
      case REGEX:
      case BETWEEN:
        return;
      default:
        throw new RrdTagException("Operator " + operator.getSymbol() + " not supported");
    }
  }

  private boolean between(Object tagValue) throws RrdTagException {
    List<?> bounds = values();
    if (bounds.size() != 2) {
      throw new RrdTagException("Operator BETWEEN requires exactly two values");
    }
    double min;
    double max;
    try {
      min = ValueUtils.toDouble(bounds.get(0));
      max = ValueUtils.toDouble(bounds.get(1));
    } catch (NumberFormatException e) {
      throw new RrdTagException("Operator BETWEEN requires numeric bounds, got " + bounds, e);
    }
    if (!ValueUtils.isNumeric(tagValue)) {
      return false;
    }
    double number = ValueUtils.toDouble(tagValue);
    return number >= min && number <= max;
  }

  private List<?> values() {
    if (value instanceof Collection) {
      return new ArrayList<Object>((Collection<?>) value);
    }
    if (value instanceof Object[]) {
      return Arrays.asList((Object[]) value);
    }
    return Collections.singletonList(value);
  }

  private List<String> normalizedValues() {
    return values().stream().map(TagCondition::normalize).collect(Collectors.toList());
  }

  private static String normalize(Object value) {
    return FileUtils.sanitizeTagValue(ValueUtils.stringValue(value));
  }

  /**
   * Compiles a pattern that may be enclosed in slashes with trailing flags, e.g., {@code /^a/i}.
   *
   * @param pattern Pattern text.
   * @return Compiled pattern.
   * @throws RrdTagException if the pattern is invalid.
   */
  private static Pattern compile(String pattern) throws RrdTagException {
    String expression = pattern;
    int flags = 0;
    int closing = pattern.lastIndexOf('/');
    if (pattern.startsWith("/") && closing > 0) {
      expression = pattern.substring(1, closing);
      String modifiers = pattern.substring(closing + 1);
      if (modifiers.contains("i")) {
        flags |= Pattern.CASE_INSENSITIVE;
      }
      if (modifiers.contains("m")) {
        flags |= Pattern.MULTILINE;
      }
      if (modifiers.contains("s")) {
        flags |= Pattern.DOTALL;
      }
    }
    try {
      return Pattern.compile(expression, flags);
    } catch (PatternSyntaxException e) {
      throw new RrdTagException("Invalid pattern " + pattern, e);
    }
  }

  @Override
  public String toString() {
    return connective + " " + tag + " " + operator.getSymbol() + " " + value;
  }
}
