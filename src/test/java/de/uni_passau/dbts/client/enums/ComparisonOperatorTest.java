package de.uni_passau.dbts.client.enums;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class ComparisonOperatorTest {

  @Test
  public void testFromSymbol() {
    assertEquals(ComparisonOperator.GREATER_THAN_OR_EQUAL, ComparisonOperator.fromSymbol(">="));
    assertEquals(ComparisonOperator.NOT_IN, ComparisonOperator.fromSymbol("not   in"));
    assertEquals(ComparisonOperator.NOT_IN, ComparisonOperator.fromSymbol("NOT_IN"));
    assertEquals(ComparisonOperator.NOT_EQUALS_ALT, ComparisonOperator.fromSymbol("<>"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownSymbol() {
    ComparisonOperator.fromSymbol("~=");
  }

  @Test
  public void testListOperators() {
    assertTrue(ComparisonOperator.IN.requiresListValue());
    assertTrue(ComparisonOperator.BETWEEN.requiresListValue());
    assertFalse(ComparisonOperator.LIKE.requiresListValue());
  }

  @Test
  public void testParseHelpers() {
    assertEquals(SortOrder.DESC, SortOrder.parse(" desc "));
    assertEquals(FillPolicy.PREVIOUS, FillPolicy.parse("previous"));
    assertEquals(Connective.AND, Connective.parse(null));
    assertEquals(Connective.OR, Connective.parse("or"));
  }
}
