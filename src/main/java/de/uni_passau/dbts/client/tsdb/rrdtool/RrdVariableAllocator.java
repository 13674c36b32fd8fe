package de.uni_passau.dbts.client.tsdb.rrdtool;

/**
 * Hands out the names of virtual data sources of one {@code xport} command. Every category counts
 * up from its own base, so names of different categories never collide: {@code v1, v2, ...} for
 * DEFs, {@code agg1000, agg1001, ...} for aggregations and {@code math2000, ...} for math
 * expressions.
 */
public class RrdVariableAllocator {

  /** Categories of virtual data sources. */
  public enum Category {
    DEF("v", 1),
    AGGREGATION("agg", 1000),
    MATH("math", 2000);

    private final String prefix;
    private final int base;

    Category(String prefix, int base) {
      this.prefix = prefix;
      this.base = base;
    }

    public String getPrefix() {
      return prefix;
    }

    public int getBase() {
      return base;
    }
  }

  private int defs;
  private int aggregations;
  private int maths;

  /**
   * Allocates the next name of a category.
   *
   * @param category Variable category.
   * @return Unused variable name.
   */
  public String next(Category category) {
    int index;
    switch (category) {
      case DEF:
        index = defs++;
        break;
      case AGGREGATION:
        index = aggregations++;
        break;
      case MATH:
        index = maths++;
        break;
      default:
        throw new IllegalStateException("Unknown category " + category);
    }
    return category.getPrefix() + (category.getBase() + index);
  }

  /**
   * Returns how many names of a category were handed out.
   *
   * @param category Variable category.
   * @return Number of allocated names.
   */
  public int count(Category category) {
    switch (category) {
      case DEF:
        return defs;
      case AGGREGATION:
        return aggregations;
      case MATH:
        return maths;
      default:
        throw new IllegalStateException("Unknown category " + category);
    }
  }
}
