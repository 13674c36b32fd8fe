package de.uni_passau.dbts.client.tsdb.rrdtool.tags;

import de.uni_passau.dbts.client.enums.Connective;
import java.util.List;
import java.util.Map;

/**
 * Evaluates tag conditions as a left to right chain: the first condition seeds the result, every
 * further AND condition intersects and every OR condition unions. There is no precedence of AND
 * over OR, so {@code a AND b OR c} reads as {@code (a AND b) OR c}.
 */
public final class TagSearch {

  private TagSearch() {}

  /**
   * Tests a tag set.
   *
   * @param tags Decoded tags.
   * @param conditions Chain of conditions. An empty chain matches every tag set.
   * @return true if the tag set satisfies the chain.
   * @throws RrdTagException if a condition uses an unsupported operator.
   */
  public static boolean search(Map<String, ?> tags, List<TagCondition> conditions)
      throws RrdTagException {
    if (conditions.isEmpty()) {
      return true;
    }
    boolean result = false;
    for (int i = 0; i < conditions.size(); i++) {
      TagCondition condition = conditions.get(i);
      boolean matches = condition.evaluate(tags);
      if (i == 0) {
        result = matches;
      } else if (condition.getConnective() == Connective.OR) {
        result = result || matches;
      } else {
        result = result && matches;
      }
    }
    return result;
  }
}
