package de.uni_passau.dbts.client.tsdb.graphite;

import de.uni_passau.dbts.client.conf.Config;
import de.uni_passau.dbts.client.tsdb.AbstractDatabase;

/** Driver of Graphite, reading from graphite-web and writing to Carbon. */
public class Graphite extends AbstractDatabase {

  /**
   * Creates a driver.
   *
   * @param config Connection settings.
   */
  public Graphite(Config config) {
    this(new GraphiteQueryBuilder(config.GRAPHITE_PREFIX), new GraphiteTransport(config));
  }

  /**
   * Creates a driver.
   *
   * @param queryBuilder Render query builder.
   * @param transport Render API and Carbon transport.
   */
  public Graphite(GraphiteQueryBuilder queryBuilder, GraphiteTransport transport) {
    super(queryBuilder, transport);
  }
}
