package de.uni_passau.dbts.client.tsdb;

import de.uni_passau.dbts.client.query.AggregationClause;
import de.uni_passau.dbts.client.query.Query;
import de.uni_passau.dbts.client.query.RawQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Performs the checks every backend shares before a query is translated.
 */
public abstract class AbstractQueryBuilder implements QueryBuilder {
  private static final Logger LOGGER = LoggerFactory.getLogger(AbstractQueryBuilder.class);

  @Override
  public final RawQuery build(Query query) throws QueryException {
    if (query == null) {
      throw new QueryException("Query must not be null");
    }
    if (query.getMeasurement().isEmpty()) {
      throw new QueryException("Measurement is required");
    }
    for (AggregationClause aggregation : query.getAggregations()) {
      if (aggregation.getFunction().requiresRank() && aggregation.getRank() == null) {
        throw new QueryException(
            String.format("Aggregation %s requires a numeric rank", aggregation.getFunction()));
      }
    }
    RawQuery rawQuery = translate(query);
    LOGGER.debug("{} built native query: {}", getClass().getSimpleName(), rawQuery.getRawQuery());
    return rawQuery;
  }

  /**
   * Translates an already checked query.
   *
   * @param query Query with a measurement and complete aggregations.
   * @return Native query.
   * @throws QueryException if the query cannot be expressed by the backend.
   */
  protected abstract RawQuery translate(Query query) throws QueryException;
}
