package de.uni_passau.dbts.client.tsdb;

import de.uni_passau.dbts.client.conf.Config;

/**
 * Creates a driver from configuration.
 */
@FunctionalInterface
public interface DriverFactory {

  /**
   * Creates a driver. The returned driver is not initialized yet.
   *
   * @param config Configuration of the driver.
   * @return The driver.
   * @throws TsdbException if the configuration is not usable.
   */
  Database create(Config config) throws TsdbException;
}
