package de.uni_passau.dbts.client.tsdb.influxdb;

import de.uni_passau.dbts.client.query.RawQuery;

/** Native InfluxDB query, either a Flux pipeline or an InfluxQL statement. */
public class InfluxDbRawQuery implements RawQuery {

  private final String query;
  private final boolean flux;

  /**
   * Creates a Flux query.
   *
   * @param query Flux pipeline.
   */
  public InfluxDbRawQuery(String query) {
    this(query, true);
  }

  /**
   * Creates a query.
   *
   * @param query Query text.
   * @param flux true for Flux, false for InfluxQL.
   */
  public InfluxDbRawQuery(String query, boolean flux) {
    this.query = query;
    this.flux = flux;
  }

  @Override
  public String getRawQuery() {
    return query;
  }

  public boolean isFlux() {
    return flux;
  }

  @Override
  public String toString() {
    return (flux ? "flux: " : "influxql: ") + query;
  }
}
