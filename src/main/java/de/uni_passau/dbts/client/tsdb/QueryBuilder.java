package de.uni_passau.dbts.client.tsdb;

import de.uni_passau.dbts.client.query.Query;
import de.uni_passau.dbts.client.query.RawQuery;

/**
 * Translates backend independent queries into the native query language of a database.
 */
public interface QueryBuilder {

  /**
   * Translates a query. The query is not modified, so building it twice yields identical output.
   *
   * @param query Backend independent query.
   * @return Native query.
   * @throws QueryException if the query cannot be expressed by the backend.
   */
  RawQuery build(Query query) throws QueryException;
}
