package de.uni_passau.dbts.client.query;

import com.google.common.base.Preconditions;
import de.uni_passau.dbts.client.enums.Aggregation;

/**
 * One aggregation request of a query.
 */
public class AggregationClause {

  private final Aggregation function;

  /** Source field, null for the backend default. */
  private final String field;

  /** Name of the result column, may be null. */
  private final String alias;

  /** Rank of a percentile in [0, 100], null for all other functions. */
  private final Double rank;

  /**
   * Creates an aggregation request.
   *
   * @param function Aggregation function.
   * @param field Source field, may be null.
   * @param alias Result name, may be null.
   * @param rank Percentile rank, may be null.
   */
  public AggregationClause(Aggregation function, String field, String alias, Double rank) {
    this.function = Preconditions.checkNotNull(function, "Aggregation function must not be null.");
    this.field = field;
    this.alias = alias;
    this.rank = rank;
  }

  public Aggregation getFunction() {
    return function;
  }

  public String getField() {
    return field;
  }

  /**
   * Returns the source field or the given default if none is set.
   *
   * @param defaultField Fallback field name.
   * @return Field name.
   */
  public String getFieldOrDefault(String defaultField) {
    return field == null || field.isEmpty() ? defaultField : field;
  }

  public String getAlias() {
    return alias;
  }

  public boolean hasAlias() {
    return alias != null && !alias.isEmpty();
  }

  public Double getRank() {
    return rank;
  }

  @Override
  public String toString() {
    return function.getName() + "(" + (field == null ? "" : field) + ")"
        + (rank == null ? "" : "[" + rank + "]")
        + (alias == null ? "" : " as " + alias);
  }
}
