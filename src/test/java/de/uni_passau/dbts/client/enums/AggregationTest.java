package de.uni_passau.dbts.client.enums;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class AggregationTest {

  @Test
  public void testParseSynonyms() {
    assertEquals(Aggregation.AVG, Aggregation.parse("mean"));
    assertEquals(Aggregation.AVG, Aggregation.parse("Average"));
    assertEquals(Aggregation.STDDEV, Aggregation.parse("stdev"));
    assertEquals(Aggregation.COUNT, Aggregation.parse(" count "));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testParseUnknown() {
    Aggregation.parse("median");
  }

  @Test
  public void testRank() {
    assertTrue(Aggregation.PERCENTILE.requiresRank());
    assertFalse(Aggregation.MAX.requiresRank());
    assertEquals("percentile", Aggregation.PERCENTILE.getName());
  }
}
