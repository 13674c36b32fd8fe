package de.uni_passau.dbts.client.query;

import com.google.common.base.Preconditions;
import de.uni_passau.dbts.client.enums.ComparisonOperator;
import de.uni_passau.dbts.client.enums.Connective;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * A single filter predicate. The connective joins the condition with the previous one in a query,
 * so the conditions of a query form a left to right chain rather than a tree.
 */
public class QueryCondition {

  /** Name of the field or tag to filter on. */
  private final String field;

  /** Comparison operator. */
  private final ComparisonOperator operator;

  /** A scalar or, for IN, NOT IN and BETWEEN, an immutable list of values. */
  private final Object value;

  /** Join with the previous condition. */
  private final Connective connective;

  /**
   * Creates a new condition.
   *
   * @param field Field or tag name.
   * @param operator Comparison operator.
   * @param value Scalar value, or a collection or array for list operators.
   * @param connective Join with the previous condition.
   */
  public QueryCondition(
      String field, ComparisonOperator operator, Object value, Connective connective) {
    Preconditions.checkNotNull(field, "Condition field must not be null.");
    Preconditions.checkNotNull(operator, "Condition operator must not be null.");
    Preconditions.checkNotNull(connective, "Condition connective must not be null.");
    this.field = field;
    this.operator = operator;
    this.connective = connective;

    Object normalized = value;
    if (value instanceof Object[]) {
      normalized = Arrays.asList((Object[]) value);
    }
    if (normalized instanceof Collection) {
      normalized = Collections.unmodifiableList(new ArrayList<Object>((Collection<?>) normalized));
    }
    if (operator.requiresListValue() && !(normalized instanceof List)) {
      throw new IllegalArgumentException(
          String.format("Operator %s requires a list of values.", operator.getSymbol()));
    }
    if (operator == ComparisonOperator.BETWEEN && ((List<?>) normalized).size() != 2) {
      throw new IllegalArgumentException("Operator BETWEEN requires exactly two values.");
    }
    if ((operator == ComparisonOperator.IN || operator == ComparisonOperator.NOT_IN)
        && ((List<?>) normalized).isEmpty()) {
      throw new IllegalArgumentException(
          String.format("Operator %s requires at least one value.", operator.getSymbol()));
    }
    this.value = normalized;
  }

  /**
   * Creates an AND-joined condition.
   *
   * @param field Field or tag name.
   * @param operator Comparison operator.
   * @param value Value(s) to compare with.
   * @return The condition.
   */
  public static QueryCondition where(String field, ComparisonOperator operator, Object value) {
    return new QueryCondition(field, operator, value, Connective.AND);
  }

  /**
   * Creates an OR-joined condition.
   *
   * @param field Field or tag name.
   * @param operator Comparison operator.
   * @param value Value(s) to compare with.
   * @return The condition.
   */
  public static QueryCondition orWhere(String field, ComparisonOperator operator, Object value) {
    return new QueryCondition(field, operator, value, Connective.OR);
  }

  public static QueryCondition in(String field, List<?> values) {
    return where(field, ComparisonOperator.IN, values);
  }

  public static QueryCondition notIn(String field, List<?> values) {
    return where(field, ComparisonOperator.NOT_IN, values);
  }

  public static QueryCondition between(String field, Object min, Object max) {
    return where(field, ComparisonOperator.BETWEEN, Arrays.asList(min, max));
  }

  public static QueryCondition regex(String field, String pattern) {
    return where(field, ComparisonOperator.REGEX, pattern);
  }

  public String getField() {
    return field;
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

  public boolean isOr() {
    return connective == Connective.OR;
  }

  /**
   * Returns true if the condition holds a list of values.
   *
   * @return true for list values.
   */
  public boolean isListValue() {
    return value instanceof List;
  }

  /**
   * Returns the value as a scalar. For list values the first element is returned.
   *
   * @return Scalar value, possibly null.
   */
  public Object getScalarValue() {
    if (value instanceof List) {
      List<?> values = (List<?>) value;
      return values.isEmpty() ? null : values.get(0);
    }
    return value;
  }

  /**
   * Returns the value as a list. A scalar is wrapped into a singleton list.
   *
   * @return List of values, empty for a null scalar.
   */
  public List<?> getValues() {
    if (value instanceof List) {
      return (List<?>) value;
    }
    if (value == null) {
      return Collections.emptyList();
    }
    return Collections.singletonList(value);
  }

  @Override
  public String toString() {
    return connective + " " + field + " " + operator.getSymbol() + " " + value;
  }
}
