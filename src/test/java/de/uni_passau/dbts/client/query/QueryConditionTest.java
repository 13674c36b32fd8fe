package de.uni_passau.dbts.client.query;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import de.uni_passau.dbts.client.enums.ComparisonOperator;
import de.uni_passau.dbts.client.enums.Connective;
import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;

public class QueryConditionTest {

  @Test
  public void testScalarCondition() {
    QueryCondition condition = QueryCondition.where("host", ComparisonOperator.EQUALS, "a");

    assertFalse(condition.isListValue());
    assertFalse(condition.isOr());
    assertEquals("a", condition.getScalarValue());
    assertEquals(Collections.singletonList("a"), condition.getValues());
    assertEquals("AND host = a", condition.toString());
  }

  @Test
  public void testArraysBecomeLists() {
    QueryCondition condition =
        new QueryCondition(
            "host", ComparisonOperator.IN, new String[] {"a", "b"}, Connective.OR);

    assertTrue(condition.isListValue());
    assertTrue(condition.isOr());
    assertEquals(Arrays.asList("a", "b"), condition.getValue());
    assertEquals("a", condition.getScalarValue());
  }

  @Test
  public void testNullScalar() {
    QueryCondition condition = QueryCondition.where("host", ComparisonOperator.NOT_EQUALS, null);

    assertNull(condition.getScalarValue());
    assertTrue(condition.getValues().isEmpty());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testListOperatorRequiresList() {
    QueryCondition.where("host", ComparisonOperator.IN, "a");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBetweenRequiresTwoValues() {
    QueryCondition.where("value", ComparisonOperator.BETWEEN, Arrays.asList(1, 2, 3));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNotInRequiresAValue() {
    QueryCondition.where("host", ComparisonOperator.NOT_IN, Collections.emptyList());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInRequiresAValue() {
    new Query("cpu").whereIn("host", Collections.emptyList());
  }

  @Test(expected = NullPointerException.class)
  public void testFieldIsRequired() {
    QueryCondition.where(null, ComparisonOperator.EQUALS, 1);
  }
}
