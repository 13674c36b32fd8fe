package de.uni_passau.dbts.client.tsdb.rrdtool.tags;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import de.uni_passau.dbts.client.enums.ComparisonOperator;
import de.uni_passau.dbts.client.enums.Connective;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.junit.Test;

public class TagSearchTest {

  private static Map<String, String> tags() {
    Map<String, String> tags = new HashMap<>();
    tags.put("host", "web1");
    tags.put("region", "eu");
    return tags;
  }

  private static TagCondition and(String tag, String value) {
    return new TagCondition(tag, ComparisonOperator.EQUALS, value, Connective.AND);
  }

  private static TagCondition or(String tag, String value) {
    return new TagCondition(tag, ComparisonOperator.EQUALS, value, Connective.OR);
  }

  @Test
  public void testEmptyConditionsMatch() throws Exception {
    assertTrue(TagSearch.search(tags(), Collections.emptyList()));
    assertTrue(TagSearch.search(Collections.emptyMap(), Collections.emptyList()));
  }

  @Test
  public void testSingleConditionIgnoresConnective() throws Exception {
    for (String value : Arrays.asList("web1", "web2")) {
      assertEquals(
          TagSearch.search(tags(), Collections.singletonList(and("host", value))),
          TagSearch.search(tags(), Collections.singletonList(or("host", value))));
    }
  }

  @Test
  public void testAndChain() throws Exception {
    assertTrue(TagSearch.search(tags(), Arrays.asList(and("host", "web1"), and("region", "eu"))));
    assertFalse(TagSearch.search(tags(), Arrays.asList(and("host", "web1"), and("region", "us"))));
  }

  @Test
  public void testOrChain() throws Exception {
    assertTrue(TagSearch.search(tags(), Arrays.asList(and("host", "web2"), or("region", "eu"))));
    assertFalse(TagSearch.search(tags(), Arrays.asList(and("host", "web2"), or("region", "us"))));
  }

  @Test
  public void testChainIsEvaluatedLeftToRight() throws Exception {
    // (false OR true) AND false
    assertFalse(
        TagSearch.search(
            tags(), Arrays.asList(and("host", "web2"), or("region", "eu"), and("dc", "fra"))));
    // (false AND true) OR true
    assertTrue(
        TagSearch.search(
            tags(), Arrays.asList(and("host", "web2"), and("region", "eu"), or("host", "web1"))));
  }

  @Test
  public void testMissingTagIsFalse() throws Exception {
    assertFalse(TagSearch.search(tags(), Collections.singletonList(and("dc", "fra"))));
  }
}
