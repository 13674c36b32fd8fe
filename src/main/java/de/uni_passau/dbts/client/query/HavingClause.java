package de.uni_passau.dbts.client.query;

import com.google.common.base.Preconditions;
import de.uni_passau.dbts.client.enums.ComparisonOperator;

/**
 * Filter that is applied to aggregated values.
 */
public class HavingClause {
  private final String field;
  private final ComparisonOperator operator;
  private final Object value;

  /**
   * Creates a new having clause.
   *
   * @param field Aggregated field or alias.
   * @param operator Comparison operator.
   * @param value Value to compare with.
   */
  public HavingClause(String field, ComparisonOperator operator, Object value) {
    this.field = Preconditions.checkNotNull(field);
    this.operator = Preconditions.checkNotNull(operator);
    this.value = value;
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
}
