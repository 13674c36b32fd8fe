package de.uni_passau.dbts.client.tsdb.influxdb;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import de.uni_passau.dbts.client.query.DataPoint;
import de.uni_passau.dbts.client.query.Query;
import de.uni_passau.dbts.client.query.QueryResult;
import de.uni_passau.dbts.client.query.RawQuery;
import de.uni_passau.dbts.client.tsdb.TsdbException;
import java.util.Collections;
import java.util.List;
import org.joda.time.DateTime;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

public class InfluxDbTest {

  private InfluxDbTransport transport;
  private InfluxDB influxDb;

  @Before
  public void setUp() {
    transport = mock(InfluxDbTransport.class);
    influxDb = new InfluxDB(new InfluxDbQueryBuilder("metrics"), transport);
  }

  @Test
  public void testQueryExecutesTheBuiltFlux() throws Exception {
    QueryResult result = new QueryResult();
    when(transport.isConnected()).thenReturn(true);
    when(transport.execute(any())).thenReturn(result);

    assertSame(result, influxDb.query(new Query("cpu")));

    ArgumentCaptor<RawQuery> captor = ArgumentCaptor.forClass(RawQuery.class);
    verify(transport).execute(captor.capture());
    assertTrue(captor.getValue() instanceof InfluxDbRawQuery);
    assertTrue(captor.getValue().getRawQuery().startsWith("from(bucket: \"metrics\")"));
  }

  @Test(expected = TsdbException.class)
  public void testWriteRequiresConnection() throws Exception {
    influxDb.write(new DataPoint("cpu", 1L).addField("value", 1));
  }

  @Test
  public void testEmptyBatchIsNoOp() throws Exception {
    assertTrue(influxDb.writeBatch(Collections.emptyList()));
    verify(transport, never()).write(any());
  }

  @Test
  public void testBucketManagement() throws Exception {
    when(transport.isConnected()).thenReturn(true);
    List<String> buckets = Collections.singletonList("metrics");
    when(transport.getBuckets()).thenReturn(buckets);
    when(transport.deleteBucket("old")).thenReturn(true);

    assertTrue(influxDb.createDatabase("metrics"));
    verify(transport).createBucket("metrics");
    assertEquals(buckets, influxDb.getDatabases());
    assertTrue(influxDb.deleteDatabase("old"));
  }

  @Test
  public void testDeleteMeasurementDefaultsToEverything() throws Exception {
    when(transport.isConnected()).thenReturn(true);

    assertTrue(influxDb.deleteMeasurement("cpu", null, null));

    ArgumentCaptor<DateTime> start = ArgumentCaptor.forClass(DateTime.class);
    verify(transport).deleteMeasurement(eq("cpu"), start.capture(), any(DateTime.class));
    assertEquals(0L, start.getValue().getMillis());
  }
}
