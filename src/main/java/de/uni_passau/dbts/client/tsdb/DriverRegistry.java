package de.uni_passau.dbts.client.tsdb;

import de.uni_passau.dbts.client.conf.Config;
import de.uni_passau.dbts.client.tsdb.aggregate.AggregateDatabase;
import de.uni_passau.dbts.client.tsdb.graphite.Graphite;
import de.uni_passau.dbts.client.tsdb.influxdb.InfluxDB;
import de.uni_passau.dbts.client.tsdb.prometheus.Prometheus;
import de.uni_passau.dbts.client.tsdb.rrdtool.RrdTool;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps driver names to factories. A registry is created once, e.g., with {@link #defaults()}, and
 * passed to whatever needs to create drivers.
 */
public class DriverRegistry {
  private static final Logger LOGGER = LoggerFactory.getLogger(DriverRegistry.class);

  private final Map<String, DriverFactory> factories = new LinkedHashMap<>();

  /**
   * Creates a registry with a factory for every {@link DB}.
   *
   * @return The registry.
   */
  public static DriverRegistry defaults() {
    DriverRegistry registry = new DriverRegistry();
    for (DB db : DB.values()) {
      switch (db) {
        case INFLUXDB:
          registry.register(db.getName(), InfluxDB::new);
          break;
        case PROMETHEUS:
          registry.register(db.getName(), Prometheus::new);
          break;
        case GRAPHITE:
          registry.register(db.getName(), Graphite::new);
          break;
        case RRDTOOL:
          registry.register(db.getName(), RrdTool::new);
          break;
        case AGGREGATE:
          registry.register(db.getName(), config -> AggregateDatabase.create(config, registry));
          break;
        default:
          throw new IllegalStateException("No factory for database " + db);
      }
    }
    return registry;
  }

  /**
   * Registers a factory, replacing a previous one with the same name.
   *
   * @param name Driver name, case insensitive.
   * @param factory Driver factory.
   * @return The muted object to use in the builder style.
   */
  public DriverRegistry register(String name, DriverFactory factory) {
    factories.put(normalize(name), factory);
    return this;
  }

  public boolean contains(String name) {
    return factories.containsKey(normalize(name));
  }

  public Set<String> getNames() {
    return Collections.unmodifiableSet(factories.keySet());
  }

  /**
   * Creates the driver configured by {@link Config#DB_SWITCH}.
   *
   * @param config Configuration.
   * @return A driver that still needs to be initialized.
   * @throws TsdbException if the driver is unknown or cannot be created.
   */
  public Database create(Config config) throws TsdbException {
    return create(config.DB_SWITCH.getName(), config);
  }

  /**
   * Creates a driver by name.
   *
   * @param name Driver name, case insensitive.
   * @param config Configuration.
   * @return A driver that still needs to be initialized.
   * @throws TsdbException if the driver is unknown or cannot be created.
   */
  public Database create(String name, Config config) throws TsdbException {
    DriverFactory factory = factories.get(normalize(name));
    if (factory == null) {
      LOGGER.error("unsupported database {}", name);
      throw new TsdbException("Unsupported database " + name);
    }
    return factory.create(config);
  }

  private static String normalize(String name) {
    return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
  }
}
