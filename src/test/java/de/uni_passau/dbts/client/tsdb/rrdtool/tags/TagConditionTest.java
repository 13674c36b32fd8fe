package de.uni_passau.dbts.client.tsdb.rrdtool.tags;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import de.uni_passau.dbts.client.enums.ComparisonOperator;
import de.uni_passau.dbts.client.enums.Connective;
import de.uni_passau.dbts.client.query.QueryCondition;
import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;

public class TagConditionTest {

  @Test
  public void testEqualityComparesSanitizedValues() throws Exception {
    TagCondition condition = new TagCondition("region", ComparisonOperator.EQUALS, "us-east");
    assertTrue(condition.matches("us.east"));
    assertTrue(condition.matches("us_east"));
    assertFalse(condition.matches("eu.west"));
    assertTrue(new TagCondition("port", "==", 80, "AND").matches("80"));
  }

  @Test
  public void testInequality() throws Exception {
    assertTrue(new TagCondition("host", ComparisonOperator.NOT_EQUALS, "a").matches("b"));
    assertFalse(new TagCondition("host", ComparisonOperator.NOT_EQUALS_ALT, "a").matches("a"));
  }

  @Test
  public void testInAndNotIn() throws Exception {
    TagCondition in = new TagCondition("host", ComparisonOperator.IN, Arrays.asList("a", "b"));
    assertTrue(in.matches("b"));
    assertFalse(in.matches("c"));

    TagCondition notIn =
        new TagCondition("host", ComparisonOperator.NOT_IN, Arrays.asList("a", "b"));
    assertTrue(notIn.matches("c"));
  }

  @Test
  public void testRegex() throws Exception {
    assertTrue(new TagCondition("host", ComparisonOperator.REGEX, "^web\\d+$").matches("web12"));
    assertTrue(new TagCondition("host", ComparisonOperator.REGEX, "/^WEB/i").matches("web1"));
    assertFalse(new TagCondition("host", ComparisonOperator.REGEX, "/^db/").matches("web1"));
  }

  @Test
  public void testBetweenIsInclusiveAndNumeric() throws Exception {
    TagCondition between = new TagCondition("rack", ComparisonOperator.BETWEEN, Arrays.asList(1, 5));
    assertTrue(between.matches("1"));
    assertTrue(between.matches("5"));
    assertFalse(between.matches("6"));
    assertFalse(between.matches("rack1"));
  }

  @Test
  public void testUnsupportedOperator() {
    TagCondition condition = new TagCondition("host", ComparisonOperator.GREATER_THAN, 1);
    try {
      condition.matches("2");
    } catch (RrdTagException e) {
      assertEquals("Operator > not supported", e.getMessage());
      return;
    }
    throw new AssertionError("Expected an RrdTagException");
  }

  @Test
  public void testMissingTagNeverMatches() throws Exception {
    TagCondition condition = new TagCondition("host", ComparisonOperator.NOT_EQUALS, "a");
    assertFalse(condition.evaluate(Collections.singletonMap("region", "eu")));
  }

  @Test
  public void testFromQueryCondition() {
    TagCondition condition =
        TagCondition.fromQueryCondition(
            QueryCondition.orWhere("host", ComparisonOperator.EQUALS, "a"));
    assertEquals("host", condition.getTag());
    assertEquals(Connective.OR, condition.getConnective());
    assertEquals("a", condition.getValue());
  }
}
