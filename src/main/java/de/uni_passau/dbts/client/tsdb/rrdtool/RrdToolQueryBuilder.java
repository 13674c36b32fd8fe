package de.uni_passau.dbts.client.tsdb.rrdtool;

import de.uni_passau.dbts.client.conf.Constants;
import de.uni_passau.dbts.client.enums.ComparisonOperator;
import de.uni_passau.dbts.client.query.AggregationClause;
import de.uni_passau.dbts.client.query.MathExpression;
import de.uni_passau.dbts.client.query.Query;
import de.uni_passau.dbts.client.query.QueryCondition;
import de.uni_passau.dbts.client.query.RawQuery;
import de.uni_passau.dbts.client.tsdb.AbstractQueryBuilder;
import de.uni_passau.dbts.client.tsdb.QueryException;
import de.uni_passau.dbts.client.tsdb.rrdtool.RrdVariableAllocator.Category;
import de.uni_passau.dbts.client.tsdb.rrdtool.tags.RrdTagException;
import de.uni_passau.dbts.client.tsdb.rrdtool.tags.TagCondition;
import de.uni_passau.dbts.client.tsdb.rrdtool.tags.TagStrategy;
import de.uni_passau.dbts.client.utils.TimeUtils;
import de.uni_passau.dbts.client.utils.ValueUtils;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates queries into {@code rrdtool xport} commands. The tag strategy resolves the RRD file
 * of the measurement, every selected field becomes a DEF, aggregations become CDEFs (row wise
 * over all DEFs) or VDEFs (reducing the first matching DEF), math expressions become CDEFs and
 * the results are exported with XPORT.
 */
public class RrdToolQueryBuilder extends AbstractQueryBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(RrdToolQueryBuilder.class);

  private static final String CONSOLIDATION = "AVERAGE";
  private static final String DEFAULT_START = "end-1h";

  private final TagStrategy tagStrategy;

  /**
   * Creates a builder.
   *
   * @param tagStrategy Strategy resolving measurement and tags to RRD files.
   */
  public RrdToolQueryBuilder(TagStrategy tagStrategy) {
    this.tagStrategy = tagStrategy;
  }

  public TagStrategy getTagStrategy() {
    return tagStrategy;
  }

  @Override
  protected RawQuery translate(Query query) throws QueryException {
    RrdToolRawQuery rawQuery = new RrdToolRawQuery();
    RrdVariableAllocator allocator = new RrdVariableAllocator();

    timeRange(query, rawQuery);
    String file = resolveFile(query);

    Map<String, String> defs = new LinkedHashMap<>();
    for (String field : fields(query)) {
      String name = allocator.next(Category.DEF);
      rawQuery.def(name, file, field, CONSOLIDATION);
      defs.put(name, field);
    }

    Map<String, String> exports = new LinkedHashMap<>();
    for (AggregationClause aggregation : query.getAggregations()) {
      String name = allocator.next(Category.AGGREGATION);
      aggregate(aggregation, name, defs, rawQuery);
      exports.put(name, exportName(aggregation));
    }
    for (MathExpression math : query.getMathExpressions()) {
      String name = allocator.next(Category.MATH);
      rawQuery.cdef(name, math.getExpression());
      exports.put(name, math.getAlias());
    }
    if (exports.isEmpty()) {
      exports.putAll(defs);
    }
    for (Map.Entry<String, String> export : exports.entrySet()) {
      rawQuery.xport(export.getKey(), export.getValue());
    }

    if (!query.getGroupBy().isEmpty() || !query.getOrderBy().isEmpty()
        || query.getLimit() != null || query.getOffset() != null || query.isDistinct()) {
      LOGGER.debug("Grouping, ordering, limit, offset and distinct are ignored by xport");
    }
    return rawQuery;
  }

  private void timeRange(Query query, RrdToolRawQuery rawQuery) throws QueryException {
    if (query.getRelativeTime() != null) {
      rawQuery.param("--start", "end-" + TimeUtils.toSeconds(query.getRelativeTime()) + "s");
    } else if (query.getStartTime() != null) {
      rawQuery.param("--start", TimeUtils.toEpochSeconds(query.getStartTime()));
    } else {
      rawQuery.param("--start", DEFAULT_START);
    }
    if (query.getEndTime() != null) {
      rawQuery.param("--end", TimeUtils.toEpochSeconds(query.getEndTime()));
    }
    if (query.hasTimeGrouping()) {
      try {
        rawQuery.param("--step", TimeUtils.parseIntervalSeconds(query.getInterval()));
      } catch (IllegalArgumentException e) {
        throw new QueryException(e.getMessage(), e);
      }
    }
  }

  /**
   * Resolves the RRD file from the equality and IN conditions. Only the first match is read.
   */
  private String resolveFile(Query query) throws QueryException {
    List<TagCondition> tagConditions = new ArrayList<>();
    for (QueryCondition condition : query.getConditions()) {
      ComparisonOperator operator = condition.getOperator();
      if (operator == ComparisonOperator.EQUALS || operator == ComparisonOperator.IN) {
        tagConditions.add(TagCondition.fromQueryCondition(condition));
      }
    }
    List<String> paths;
    try {
      paths = tagStrategy.resolveFilePaths(query.getMeasurement(), tagConditions);
    } catch (RrdTagException e) {
      throw new QueryException("Could not resolve RRD files of " + query.getMeasurement(), e);
    }
    if (paths.isEmpty()) {
      throw new QueryException(
          String.format(
              "No RRD file found for %s and %s", query.getMeasurement(), tagConditions));
    }
    if (paths.size() > 1) {
      LOGGER.debug("{} RRD files match {}, reading {}", paths.size(), tagConditions, paths.get(0));
    }
    return paths.get(0);
  }

  private static List<String> fields(Query query) {
    List<String> fields = new ArrayList<>();
    for (String field : query.getFields()) {
      if (!Query.ALL_FIELDS.equals(field)) {
        fields.add(field);
      }
    }
    if (fields.isEmpty()) {
      fields.add(Constants.DEFAULT_FIELD);
    }
    return fields;
  }

  private static void aggregate(
      AggregationClause aggregation, String name, Map<String, String> defs,
      RrdToolRawQuery rawQuery) {
    List<String> sources = new ArrayList<>(defs.keySet());
    switch (aggregation.getFunction()) {
      case SUM:
        rawQuery.cdef(name, fold(sources, "+"));
        break;
      case AVG:
        String sum = fold(sources, "+");
        rawQuery.cdef(name, sources.size() > 1 ? sum + "," + sources.size() + ",/" : sum);
        break;
      case MIN:
        rawQuery.cdef(name, fold(sources, "MIN"));
        break;
      case MAX:
        rawQuery.cdef(name, fold(sources, "MAX"));
        break;
      case COUNT:
        List<String> known = new ArrayList<>();
        for (String source : sources) {
          known.add(source + ",UN,0,1,IF");
        }
        rawQuery.cdef(name, fold(known, "+"));
        break;
      case FIRST:
        rawQuery.vdef(name, source(aggregation, defs) + ",FIRST");
        break;
      case LAST:
        rawQuery.vdef(name, source(aggregation, defs) + ",LAST");
        break;
      case STDDEV:
        rawQuery.vdef(name, source(aggregation, defs) + ",STDEV");
        break;
      case PERCENTILE:
        rawQuery.vdef(
            name,
            source(aggregation, defs) + ","
                + ValueUtils.formatNumber(aggregation.getRank()) + ",PERCENT");
        break;
      default:
        throw new IllegalStateException("Unknown aggregation " + aggregation.getFunction());
    }
  }

  /**
   * Joins operands with a binary RPN operator, e.g., {@code v1,v2,+,v3,+}.
   */
  private static String fold(List<String> operands, String operator) {
    StringBuilder rpn = new StringBuilder(operands.get(0));
    for (int i = 1; i < operands.size(); i++) {
      rpn.append(',').append(operands.get(i)).append(',').append(operator);
    }
    return rpn.toString();
  }

  /** Returns the DEF reading the aggregated field, the first DEF if the field is not selected. */
  private static String source(AggregationClause aggregation, Map<String, String> defs) {
    for (Map.Entry<String, String> def : defs.entrySet()) {
      if (def.getValue().equals(aggregation.getField())) {
        return def.getKey();
      }
    }
    return defs.keySet().iterator().next();
  }

  private static String exportName(AggregationClause aggregation) {
    if (aggregation.hasAlias()) {
      return aggregation.getAlias();
    }
    return aggregation.getFieldOrDefault(Constants.DEFAULT_FIELD) + "_"
        + aggregation.getFunction().name().toLowerCase(Locale.ROOT);
  }
}
