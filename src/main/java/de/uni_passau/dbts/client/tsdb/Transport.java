package de.uni_passau.dbts.client.tsdb;

import de.uni_passau.dbts.client.query.DataPoint;
import de.uni_passau.dbts.client.query.QueryResult;
import de.uni_passau.dbts.client.query.RawQuery;
import java.util.List;

/**
 * Talks to a live backend: executes native queries and writes data points.
 */
public interface Transport {

  /**
   * Opens the connection and checks that the backend is reachable.
   *
   * @throws TsdbException if the backend cannot be reached.
   */
  void connect() throws TsdbException;

  boolean isConnected();

  /**
   * Executes a native query.
   *
   * @param query Native query of this backend.
   * @return The parsed response.
   * @throws TsdbException if the query is of the wrong kind or the request failed.
   */
  QueryResult execute(RawQuery query) throws TsdbException;

  /**
   * Writes data points.
   *
   * @param dataPoints The data points.
   * @return true if the backend accepted every point.
   * @throws TsdbException if the request failed.
   */
  boolean write(List<DataPoint> dataPoints) throws TsdbException;

  /** Releases the connection. */
  void close();
}
