package de.uni_passau.dbts.client.query;

import com.google.common.base.Preconditions;

/**
 * Free-form arithmetic applied to query results. The expression is passed to the backend as is.
 */
public class MathExpression {
  private final String expression;
  private final String alias;

  /**
   * Creates a new math expression.
   *
   * @param expression Backend specific expression.
   * @param alias Name of the computed column.
   */
  public MathExpression(String expression, String alias) {
    this.expression = Preconditions.checkNotNull(expression);
    this.alias = Preconditions.checkNotNull(alias);
  }

  public String getExpression() {
    return expression;
  }

  public String getAlias() {
    return alias;
  }
}
