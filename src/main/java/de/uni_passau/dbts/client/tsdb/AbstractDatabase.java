package de.uni_passau.dbts.client.tsdb;

import com.google.common.base.Preconditions;
import de.uni_passau.dbts.client.query.DataPoint;
import de.uni_passau.dbts.client.query.Query;
import de.uni_passau.dbts.client.query.QueryResult;
import de.uni_passau.dbts.client.query.RawQuery;
import java.util.Collections;
import java.util.List;
import org.apache.commons.lang3.NotImplementedException;
import org.joda.time.DateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Driver skeleton that translates queries with a {@link QueryBuilder} and hands native queries
 * and data points over to a {@link Transport}. Management operations a backend does not offer
 * throw {@link NotImplementedException}.
 */
public abstract class AbstractDatabase implements Database {
  private static final Logger LOGGER = LoggerFactory.getLogger(AbstractDatabase.class);

  /** Translates queries into the native language. */
  protected final QueryBuilder queryBuilder;

  /** Connection to the backend. */
  protected final Transport transport;

  /**
   * Creates a driver.
   *
   * @param queryBuilder Query translator of the backend.
   * @param transport Connection to the backend.
   */
  protected AbstractDatabase(QueryBuilder queryBuilder, Transport transport) {
    this.queryBuilder = Preconditions.checkNotNull(queryBuilder);
    this.transport = Preconditions.checkNotNull(transport);
  }

  @Override
  public void init() throws TsdbException {
    try {
      transport.connect();
      LOGGER.info("{} connection established.", getName());
    } catch (TsdbException e) {
      LOGGER.error("{} could not be initialized because ", getName(), e);
      throw e;
    }
  }

  @Override
  public boolean isConnected() {
    return transport.isConnected();
  }

  @Override
  public boolean write(DataPoint dataPoint) throws TsdbException {
    return writeBatch(Collections.singletonList(dataPoint));
  }

  @Override
  public boolean writeBatch(List<DataPoint> dataPoints) throws TsdbException {
    if (dataPoints.isEmpty()) {
      return true;
    }
    checkConnected();
    boolean written = transport.write(dataPoints);
    LOGGER.debug("{} wrote {} data points: {}", getName(), dataPoints.size(), written);
    return written;
  }

  @Override
  public QueryResult query(Query query) throws TsdbException {
    RawQuery rawQuery = queryBuilder.build(query);
    return rawQuery(rawQuery);
  }

  @Override
  public QueryResult rawQuery(RawQuery query) throws TsdbException {
    checkConnected();
    LOGGER.debug("{} executes {}", getName(), query.getRawQuery());
    return transport.execute(query);
  }

  @Override
  public boolean createDatabase(String name) throws TsdbException {
    throw new NotImplementedException(getName() + " does not support creating databases.");
  }

  @Override
  public boolean deleteDatabase(String name) throws TsdbException {
    throw new NotImplementedException(getName() + " does not support deleting databases.");
  }

  @Override
  public List<String> getDatabases() throws TsdbException {
    throw new NotImplementedException(getName() + " does not support listing databases.");
  }

  @Override
  public boolean deleteMeasurement(String measurement, DateTime start, DateTime stop)
      throws TsdbException {
    throw new NotImplementedException(getName() + " does not support deleting measurements.");
  }

  @Override
  public void close() throws TsdbException {
    transport.close();
    LOGGER.info("{} connection closed.", getName());
  }

  public QueryBuilder getQueryBuilder() {
    return queryBuilder;
  }

  /**
   * Fails if the transport has not been connected yet.
   *
   * @throws TsdbException if {@link #init()} has not been called.
   */
  protected void checkConnected() throws TsdbException {
    if (!isConnected()) {
      throw new TsdbException(getName() + " is not connected, call init() first.");
    }
  }

  protected String getName() {
    return getClass().getSimpleName();
  }
}
