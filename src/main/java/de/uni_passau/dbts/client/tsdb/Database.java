package de.uni_passau.dbts.client.tsdb;

import de.uni_passau.dbts.client.query.DataPoint;
import de.uni_passau.dbts.client.query.Query;
import de.uni_passau.dbts.client.query.QueryResult;
import de.uni_passau.dbts.client.query.RawQuery;
import java.util.List;
import org.joda.time.DateTime;

/**
 * A set of methods that each database driver complies with, in order to write data points and to
 * execute queries.
 */
public interface Database {

  /** Initializes the connection to the database. */
  void init() throws TsdbException;

  /**
   * Returns true once {@link #init()} succeeded and until {@link #close()} is called.
   *
   * @return Connection state.
   */
  boolean isConnected();

  /**
   * Writes a single data point.
   *
   * @param dataPoint The data point.
   * @return true if the point was written.
   * @throws TsdbException if the write failed.
   */
  boolean write(DataPoint dataPoint) throws TsdbException;

  /**
   * Writes several data points at once.
   *
   * @param dataPoints The data points.
   * @return true if every point was written.
   * @throws TsdbException if the write failed.
   */
  boolean writeBatch(List<DataPoint> dataPoints) throws TsdbException;

  /**
   * Translates a query into the native query language of the database and executes it.
   *
   * @param query Backend independent query.
   * @return The normalized result.
   * @throws TsdbException if the query could not be translated or executed.
   */
  QueryResult query(Query query) throws TsdbException;

  /**
   * Executes a native query.
   *
   * @param query Native query of this database.
   * @return The normalized result.
   * @throws TsdbException if the query failed.
   */
  QueryResult rawQuery(RawQuery query) throws TsdbException;

  /**
   * Creates a database (bucket, directory) on the server.
   *
   * @param name Database name.
   * @return true on success.
   */
  boolean createDatabase(String name) throws TsdbException;

  /**
   * Deletes a database from the server.
   *
   * @param name Database name.
   * @return true on success.
   */
  boolean deleteDatabase(String name) throws TsdbException;

  /**
   * Lists the databases of the server.
   *
   * @return Database names.
   */
  List<String> getDatabases() throws TsdbException;

  /**
   * Deletes the data of a measurement.
   *
   * @param measurement Measurement name.
   * @param start Start of the range to delete, null for the beginning of time.
   * @param stop End of the range to delete, null for now.
   * @return true on success.
   */
  boolean deleteMeasurement(String measurement, DateTime start, DateTime stop)
      throws TsdbException;

  /** Closes the connection to the database. */
  void close() throws TsdbException;
}
