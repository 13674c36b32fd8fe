package de.uni_passau.dbts.client;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import de.uni_passau.dbts.client.conf.Config;
import de.uni_passau.dbts.client.conf.ConfigParser;
import de.uni_passau.dbts.client.query.Query;
import de.uni_passau.dbts.client.query.QueryResult;
import de.uni_passau.dbts.client.query.RawQuery;
import de.uni_passau.dbts.client.tsdb.DB;
import de.uni_passau.dbts.client.tsdb.Database;
import de.uni_passau.dbts.client.tsdb.DriverRegistry;
import de.uni_passau.dbts.client.tsdb.TsdbException;
import de.uni_passau.dbts.client.tsdb.aggregate.AggregateDatabase;
import de.uni_passau.dbts.client.tsdb.graphite.Graphite;
import de.uni_passau.dbts.client.tsdb.graphite.GraphiteQueryBuilder;
import de.uni_passau.dbts.client.tsdb.graphite.GraphiteTransport;
import java.util.Collections;
import org.joda.time.DateTime;
import org.junit.Before;
import org.junit.Test;

public class AppTest {

  private static final String TARGET =
      "target=cpu_usage.*&from=1685314800&until=1685316540&format=json";

  private Config config;
  private GraphiteTransport transport;
  private Graphite graphite;
  private DriverRegistry registry;

  @Before
  public void setUp() {
    config = ConfigParser.INSTANCE.defaultConfig();
    config.DB_SWITCH = DB.GRAPHITE;
    config.QUERY =
        new Query("cpu_usage")
            .timeRange(new DateTime(1685314800000L), new DateTime(1685316540000L));
    transport = mock(GraphiteTransport.class);
    graphite = new Graphite(new GraphiteQueryBuilder(), transport);
    registry = new DriverRegistry().register("graphite", c -> graphite);
  }

  @Test
  public void testPrintOnly() throws Exception {
    RawQuery rawQuery = App.run(config, registry, false);

    assertEquals(TARGET, rawQuery.getRawQuery());
    verify(transport, never()).connect();
  }

  @Test
  public void testExecute() throws Exception {
    when(transport.isConnected()).thenReturn(true);
    when(transport.execute(any())).thenReturn(new QueryResult().appendPoint("cpu", 1L, 2.0));

    App.run(config, registry, true);

    verify(transport).connect();
    verify(transport).execute(any());
    verify(transport).close();
  }

  @Test
  public void testConnectionClosedAfterFailedQuery() throws Exception {
    when(transport.isConnected()).thenReturn(true);
    when(transport.execute(any())).thenThrow(new TsdbException("timeout"));

    try {
      App.run(config, registry, true);
      fail();
    } catch (TsdbException e) {
      assertEquals("timeout", e.getMessage());
    }
    verify(transport).close();
  }

  @Test(expected = TsdbException.class)
  public void testMissingQuery() throws Exception {
    config.QUERY = null;
    App.run(config, registry, false);
  }

  @Test(expected = TsdbException.class)
  public void testInvalidQuery() throws Exception {
    config.QUERY = new Query("cpu_usage").avg("value");
    App.run(config, registry, false);
  }

  @Test
  public void testQueryBuilderOfAggregate() throws Exception {
    AggregateDatabase aggregate =
        new AggregateDatabase(Collections.<Database>singletonList(graphite), null);

    assertSame(graphite.getQueryBuilder(), App.queryBuilder(aggregate));
  }

  @Test(expected = TsdbException.class)
  public void testQueryBuilderOfUnknownDriver() throws Exception {
    App.queryBuilder(mock(Database.class));
  }
}
