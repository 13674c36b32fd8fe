package de.uni_passau.dbts.client.tsdb.prometheus;

import de.uni_passau.dbts.client.conf.Config;
import de.uni_passau.dbts.client.tsdb.AbstractDatabase;
import de.uni_passau.dbts.client.tsdb.TsdbException;
import org.joda.time.DateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Driver of Prometheus. Data points are written through a Pushgateway. */
public class Prometheus extends AbstractDatabase {

  private static final Logger LOGGER = LoggerFactory.getLogger(Prometheus.class);

  private final PrometheusTransport prometheusTransport;

  /**
   * Creates a driver.
   *
   * @param config Connection settings.
   */
  public Prometheus(Config config) {
    this(new PrometheusQueryBuilder(), new PrometheusTransport(config));
  }

  /**
   * Creates a driver.
   *
   * @param queryBuilder PromQL query builder.
   * @param transport HTTP transport.
   */
  public Prometheus(PrometheusQueryBuilder queryBuilder, PrometheusTransport transport) {
    super(queryBuilder, transport);
    this.prometheusTransport = transport;
  }

  /** Deletes the series through the admin API, which must be enabled on the server. */
  @Override
  public boolean deleteMeasurement(String measurement, DateTime start, DateTime stop)
      throws TsdbException {
    checkConnected();
    prometheusTransport.deleteSeries(measurement, start, stop);
    LOGGER.info("Deleted series of {}.", measurement);
    return true;
  }
}
