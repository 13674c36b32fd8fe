package de.uni_passau.dbts.client.tsdb.influxdb;

import de.uni_passau.dbts.client.conf.Config;
import de.uni_passau.dbts.client.tsdb.AbstractDatabase;
import de.uni_passau.dbts.client.tsdb.TsdbException;
import java.util.List;
import org.joda.time.DateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Driver of InfluxDB 2.x. Databases are buckets of the configured organization. */
public class InfluxDB extends AbstractDatabase {

  private static final Logger LOGGER = LoggerFactory.getLogger(InfluxDB.class);

  private final InfluxDbTransport influxTransport;

  /**
   * Creates a driver reading from and writing to the bucket named by {@link Config#DB_NAME}.
   *
   * @param config Connection settings.
   */
  public InfluxDB(Config config) {
    this(new InfluxDbQueryBuilder(config.DB_NAME), new InfluxDbTransport(config));
  }

  /**
   * Creates a driver.
   *
   * @param queryBuilder Flux query builder.
   * @param transport HTTP transport.
   */
  public InfluxDB(InfluxDbQueryBuilder queryBuilder, InfluxDbTransport transport) {
    super(queryBuilder, transport);
    this.influxTransport = transport;
  }

  @Override
  public boolean createDatabase(String name) throws TsdbException {
    checkConnected();
    influxTransport.createBucket(name);
    LOGGER.info("Bucket {} created.", name);
    return true;
  }

  @Override
  public boolean deleteDatabase(String name) throws TsdbException {
    checkConnected();
    boolean deleted = influxTransport.deleteBucket(name);
    LOGGER.info("Bucket {} deleted: {}", name, deleted);
    return deleted;
  }

  @Override
  public List<String> getDatabases() throws TsdbException {
    checkConnected();
    return influxTransport.getBuckets();
  }

  @Override
  public boolean deleteMeasurement(String measurement, DateTime start, DateTime stop)
      throws TsdbException {
    checkConnected();
    DateTime from = start == null ? new DateTime(0L) : start;
    DateTime to = stop == null ? DateTime.now() : stop;
    influxTransport.deleteMeasurement(measurement, from, to);
    LOGGER.info("Deleted {} between {} and {}.", measurement, from, to);
    return true;
  }
}
