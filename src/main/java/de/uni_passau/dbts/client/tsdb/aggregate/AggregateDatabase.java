package de.uni_passau.dbts.client.tsdb.aggregate;

import de.uni_passau.dbts.client.conf.Config;
import de.uni_passau.dbts.client.query.DataPoint;
import de.uni_passau.dbts.client.query.Query;
import de.uni_passau.dbts.client.query.QueryResult;
import de.uni_passau.dbts.client.query.RawQuery;
import de.uni_passau.dbts.client.tsdb.Database;
import de.uni_passau.dbts.client.tsdb.DriverRegistry;
import de.uni_passau.dbts.client.tsdb.TsdbException;
import de.uni_passau.dbts.client.tsdb.WriteException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.joda.time.DateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Driver that mirrors every write to several databases and reads from one of them. A write
 * succeeds only if it succeeds everywhere. If every database fails for the same reason the
 * failure is rethrown, otherwise the partial failure is reported as {@code false}.
 */
public class AggregateDatabase implements Database {

  private static final Logger LOGGER = LoggerFactory.getLogger(AggregateDatabase.class);

  private final List<Database> writeDatabases;
  private final Database readDatabase;

  /**
   * Creates an aggregate.
   *
   * @param writeDatabases Databases receiving every write.
   * @param readDatabase Database answering queries, the first write database if null.
   */
  public AggregateDatabase(List<Database> writeDatabases, Database readDatabase) {
    this.writeDatabases = new ArrayList<>(writeDatabases);
    if (readDatabase == null && !writeDatabases.isEmpty()) {
      readDatabase = writeDatabases.get(0);
    }
    this.readDatabase = readDatabase;
  }

  /**
   * Creates the member drivers of an aggregate configuration.
   *
   * @param config Configuration holding the member configurations.
   * @param registry Registry creating the members.
   * @return The aggregate.
   * @throws TsdbException if a member cannot be created.
   */
  public static AggregateDatabase create(Config config, DriverRegistry registry)
      throws TsdbException {
    List<Database> writeDatabases = new ArrayList<>();
    for (Config member : config.AGGREGATE_WRITE_DATABASES) {
      writeDatabases.add(registry.create(member));
    }
    Database readDatabase = null;
    if (config.AGGREGATE_READ_DATABASE != null) {
      int index = config.AGGREGATE_WRITE_DATABASES.indexOf(config.AGGREGATE_READ_DATABASE);
      readDatabase =
          index >= 0
              ? writeDatabases.get(index)
              : registry.create(config.AGGREGATE_READ_DATABASE);
    }
    LOGGER.info(
        "Aggregating {} write databases, reading from {}",
        writeDatabases.size(),
        readDatabase == null ? "the first write database" : readDatabase.getClass().getSimpleName());
    return new AggregateDatabase(writeDatabases, readDatabase);
  }

  public List<Database> getWriteDatabases() {
    return Collections.unmodifiableList(writeDatabases);
  }

  public Database getReadDatabase() {
    return readDatabase;
  }

  @Override
  public void init() throws TsdbException {
    for (Database database : members()) {
      database.init();
    }
  }

  @Override
  public boolean isConnected() {
    for (Database database : members()) {
      if (!database.isConnected()) {
        return false;
      }
    }
    return !writeDatabases.isEmpty();
  }

  @Override
  public boolean write(DataPoint dataPoint) throws TsdbException {
    return fanOut("write", database -> database.write(dataPoint));
  }

  @Override
  public boolean writeBatch(List<DataPoint> dataPoints) throws TsdbException {
    return fanOut("write batch", database -> database.writeBatch(dataPoints));
  }

  @Override
  public QueryResult query(Query query) throws TsdbException {
    return reader().query(query);
  }

  @Override
  public QueryResult rawQuery(RawQuery query) throws TsdbException {
    return reader().rawQuery(query);
  }

  @Override
  public boolean createDatabase(String name) throws TsdbException {
    return fanOut("create database", database -> database.createDatabase(name));
  }

  @Override
  public boolean deleteDatabase(String name) throws TsdbException {
    return fanOut("delete database", database -> database.deleteDatabase(name));
  }

  @Override
  public List<String> getDatabases() throws TsdbException {
    return reader().getDatabases();
  }

  @Override
  public boolean deleteMeasurement(String measurement, DateTime start, DateTime stop)
      throws TsdbException {
    return fanOut(
        "delete measurement", database -> database.deleteMeasurement(measurement, start, stop));
  }

  /** Closes every member, even if closing one of them fails. */
  @Override
  public void close() throws TsdbException {
    TsdbException failure = null;
    for (Database database : members()) {
      try {
        database.close();
      } catch (TsdbException e) {
        LOGGER.error("Failed to close {} because ", database.getClass().getSimpleName(), e);
        if (failure == null) {
          failure = e;
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }

  /**
   * Runs an operation on every write database in order.
   *
   * @param operationName Name used in log messages.
   * @param operation The operation.
   * @return true if the operation succeeded on every database.
   * @throws TsdbException if every database failed with the same message.
   */
  private boolean fanOut(String operationName, Operation operation) throws TsdbException {
    if (writeDatabases.isEmpty()) {
      throw new WriteException("No write databases configured");
    }
    List<String> errors = new ArrayList<>();
    boolean success = true;
    for (int i = 0; i < writeDatabases.size(); i++) {
      Database database = writeDatabases.get(i);
      try {
        if (!operation.apply(database)) {
          String message = "Write failed for database at index " + i;
          LOGGER.error("Failed to {} on {}: {}", operationName, describe(database), message);
          errors.add(message);
          success = false;
        }
      } catch (TsdbException | RuntimeException e) {
        LOGGER.error("Failed to {} on {} because ", operationName, describe(database), e);
        errors.add(String.valueOf(e.getMessage()));
        success = false;
      }
    }
    if (errors.size() == writeDatabases.size() && errors.stream().distinct().count() == 1) {
      throw new WriteException(errors.get(0));
    }
    return success;
  }

  private Database reader() throws TsdbException {
    if (readDatabase == null) {
      throw new TsdbException("No read database available");
    }
    return readDatabase;
  }

  private List<Database> members() {
    List<Database> members = new ArrayList<>(writeDatabases);
    if (readDatabase != null && !members.contains(readDatabase)) {
      members.add(readDatabase);
    }
    return members;
  }

  private static String describe(Database database) {
    return database.getClass().getSimpleName();
  }

  /** An operation on one member database. */
  @FunctionalInterface
  private interface Operation {
    boolean apply(Database database) throws TsdbException;
  }
}
