package de.uni_passau.dbts.client;

import de.uni_passau.dbts.client.conf.Config;
import de.uni_passau.dbts.client.conf.ConfigParser;
import de.uni_passau.dbts.client.query.Query;
import de.uni_passau.dbts.client.query.QueryResult;
import de.uni_passau.dbts.client.query.RawQuery;
import de.uni_passau.dbts.client.tsdb.AbstractDatabase;
import de.uni_passau.dbts.client.tsdb.Database;
import de.uni_passau.dbts.client.tsdb.DriverRegistry;
import de.uni_passau.dbts.client.tsdb.QueryBuilder;
import de.uni_passau.dbts.client.tsdb.TsdbException;
import de.uni_passau.dbts.client.tsdb.aggregate.AggregateDatabase;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point. Loads the configuration passed with -cf, creates the configured
 * driver, translates the configured query and prints the native query. With -execute the query is
 * run and its result logged.
 */
public class App {

  private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

  /**
   * Entry point, e.g., {@code -cf conf/config.xml -execute}. See {@link CommandCli#init(String[])}.
   *
   * @param args CLI params.
   */
  public static void main(String[] args) {
    CommandCli cli = new CommandCli();
    if (!cli.init(args)) {
      return;
    }
    Config config = ConfigParser.INSTANCE.config();
    if (cli.getDatabase() != null) {
      LOGGER.info("Using {} instead of {}.", cli.getDatabase().getName(),
          config.DB_SWITCH.getName());
      config.DB_SWITCH = cli.getDatabase();
    }
    try {
      run(config, DriverRegistry.defaults(), cli.isExecute());
    } catch (TsdbException e) {
      LOGGER.error("Failed to run the query because ", e);
      System.exit(1);
    }
  }

  /**
   * Translates and optionally executes the configured query.
   *
   * @param config Configuration holding the driver and the query.
   * @param registry Registry creating the driver.
   * @param execute true to run the query.
   * @return The native query.
   * @throws TsdbException if the query is missing or invalid, or the driver fails.
   */
  static RawQuery run(Config config, DriverRegistry registry, boolean execute)
      throws TsdbException {
    Query query = config.QUERY;
    if (query == null) {
      throw new TsdbException("The configuration does not describe a query.");
    }
    List<String> errors = query.validate();
    if (!errors.isEmpty()) {
      throw new TsdbException("Invalid query: " + String.join(", ", errors));
    }

    Database database = registry.create(config);
    RawQuery rawQuery = queryBuilder(database).build(query);
    System.out.println(rawQuery);
    if (!execute) {
      return rawQuery;
    }

    database.init();
    try {
      QueryResult result = database.rawQuery(rawQuery);
      LOGGER.info("Query returned {} points in {} series.", result.count(),
          result.getSeries().size());
      System.out.println(result);
    } finally {
      database.close();
    }
    return rawQuery;
  }

  /**
   * Finds the query builder of a driver, for the aggregate driver the one of its read database.
   *
   * @param database Driver.
   * @return Query builder.
   * @throws TsdbException if the driver has no query builder.
   */
  static QueryBuilder queryBuilder(Database database) throws TsdbException {
    if (database instanceof AbstractDatabase) {
      return ((AbstractDatabase) database).getQueryBuilder();
    }
    if (database instanceof AggregateDatabase
        && ((AggregateDatabase) database).getReadDatabase() != null) {
      return queryBuilder(((AggregateDatabase) database).getReadDatabase());
    }
    throw new TsdbException(
        "Cannot translate queries for " + database.getClass().getSimpleName());
  }
}
