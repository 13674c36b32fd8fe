package de.uni_passau.dbts.client.tsdb.prometheus;

import static org.junit.Assert.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import de.uni_passau.dbts.client.tsdb.TsdbException;
import org.joda.time.DateTime;
import org.junit.Before;
import org.junit.Test;

public class PrometheusTest {

  private PrometheusTransport transport;
  private Prometheus prometheus;

  @Before
  public void setUp() {
    transport = mock(PrometheusTransport.class);
    prometheus = new Prometheus(new PrometheusQueryBuilder(), transport);
  }

  @Test
  public void testDeleteMeasurementUsesAdminApi() throws Exception {
    DateTime start = new DateTime(1000L);
    when(transport.isConnected()).thenReturn(true);

    assertTrue(prometheus.deleteMeasurement("cpu_usage", start, null));

    verify(transport).deleteSeries("cpu_usage", start, null);
  }

  @Test(expected = TsdbException.class)
  public void testDeleteMeasurementRequiresConnection() throws Exception {
    prometheus.deleteMeasurement("cpu_usage", null, null);
  }
}
