package de.uni_passau.dbts.client.tsdb.graphite;

import de.uni_passau.dbts.client.enums.SortOrder;
import de.uni_passau.dbts.client.query.AggregationClause;
import de.uni_passau.dbts.client.query.Query;
import de.uni_passau.dbts.client.query.QueryCondition;
import de.uni_passau.dbts.client.query.RawQuery;
import de.uni_passau.dbts.client.tsdb.AbstractQueryBuilder;
import de.uni_passau.dbts.client.utils.TimeUtils;
import de.uni_passau.dbts.client.utils.ValueUtils;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates queries into render API parameters. The target is composed of nested Graphite
 * functions, e.g., {@code alias(summarize(averageSeries(servers.cpu.*), "5minute", "avg"),
 * "avg_cpu")}.
 */
public class GraphiteQueryBuilder extends AbstractQueryBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(GraphiteQueryBuilder.class);

  private static final String[] DURATION_UNITS = {"y", "mon", "d", "h", "min", "s"};
  private static final Pattern INTERVAL = Pattern.compile("^(\\d+)([smhdw])$");
  private static final String WILDCARD = "*";

  private final String prefix;

  /** Creates a builder without path prefix. */
  public GraphiteQueryBuilder() {
    this("");
  }

  /**
   * Creates a builder.
   *
   * @param prefix Path prefix of every metric, may be empty.
   */
  public GraphiteQueryBuilder(String prefix) {
    this.prefix = prefix == null ? "" : prefix;
  }

  public String getPrefix() {
    return prefix;
  }

  @Override
  protected RawQuery translate(Query query) {
    String target = baseTarget(query);
    for (QueryCondition condition : query.getConditions()) {
      target = applyCondition(target, condition);
    }

    List<AggregationClause> aggregations = query.getAggregations();
    if (aggregations.size() > 1) {
      List<String> targets = new ArrayList<>();
      for (AggregationClause aggregation : aggregations) {
        targets.add(aggregate(target, aggregation, query.getInterval()));
      }
      target = "group(" + String.join(",", targets) + ")";
    } else if (aggregations.size() == 1) {
      target = aggregate(target, aggregations.get(0), query.getInterval());
    } else if (query.hasTimeGrouping()) {
      target = summarize(target, query.getInterval(), "avg");
    }

    if (query.getLimit() != null) {
      target = String.format("limit(%s, %d)", target, query.getLimit());
    }
    for (SortOrder order : query.getOrderBy().values()) {
      target = String.format(order == SortOrder.DESC ? "sortByMaxima(%s)" : "sortByMinima(%s)",
          target);
    }

    Map<String, String> parameters = new LinkedHashMap<>();
    parameters.put("target", target);
    parameters.put("from", from(query));
    parameters.put("until", until(query));
    parameters.put("format", "json");
    return new GraphiteRawQuery(encode(parameters));
  }

  private String baseTarget(Query query) {
    String path = prefix.isEmpty() ? query.getMeasurement() : prefix + "." + query.getMeasurement();
    List<String> fields = query.getFields();
    if (fields.isEmpty() || fields.contains(Query.ALL_FIELDS)) {
      return path + "." + WILDCARD;
    }
    if (fields.size() == 1) {
      return path + "." + fields.get(0);
    }
    List<String> paths = new ArrayList<>();
    for (String field : fields) {
      paths.add('"' + path + "." + field + '"');
    }
    return "group(" + String.join(", ", paths) + ")";
  }

  private static String applyCondition(String target, QueryCondition condition) {
    String value = ValueUtils.stringValue(condition.getScalarValue());
    switch (condition.getOperator()) {
      case EQUALS:
      case SAME:
        return target.replace(WILDCARD, value);
      case NOT_EQUALS:
      case NOT_EQUALS_ALT:
        return String.format("exclude(%s, \"%s\")", target, value);
      case REGEX:
        return String.format("grep(%s, \"%s\")", target, value);
      default:
        LOGGER.debug("Graphite cannot filter by {}", condition);
        return target;
    }
  }

  /** Consolidates, summarizes and aliases one aggregation, in this order. */
  private static String aggregate(String target, AggregationClause aggregation, String interval) {
    String result;
    switch (aggregation.getFunction()) {
      case AVG:
        result = "averageSeries(" + target + ")";
        break;
      case SUM:
        result = "sumSeries(" + target + ")";
        break;
      case COUNT:
        result = "countSeries(" + target + ")";
        break;
      case MIN:
        result = "minSeries(" + target + ")";
        break;
      case MAX:
        result = "maxSeries(" + target + ")";
        break;
      case STDDEV:
        result = "stdev(" + target + ")";
        break;
      case PERCENTILE:
        result = String.format(
            "percentileOfSeries(%s, %s)", target, ValueUtils.formatNumber(aggregation.getRank()));
        break;
      default:
        result = target;
        break;
    }
    if (interval != null && !interval.isEmpty()) {
      result = summarize(result, interval, summarizeFunction(aggregation));
    }
    if (aggregation.hasAlias()) {
      result = String.format("alias(%s, \"%s\")", result, aggregation.getAlias());
    }
    return result;
  }

  private static String summarizeFunction(AggregationClause aggregation) {
    switch (aggregation.getFunction()) {
      case PERCENTILE:
      case STDDEV:
        return "avg";
      default:
        return aggregation.getFunction().getName();
    }
  }

  private static String summarize(String target, String interval, String function) {
    return String.format("summarize(%s, \"%s\", \"%s\")", target, intervalWord(interval),
        function);
  }

  /**
   * Converts a compact interval into the unit words of Graphite, e.g., {@code 5m} into
   * {@code 5minute}. Other formats are passed on unchanged.
   */
  static String intervalWord(String interval) {
    Matcher matcher = INTERVAL.matcher(interval);
    if (!matcher.matches()) {
      return interval;
    }
    String amount = matcher.group(1);
    switch (matcher.group(2)) {
      case "s":
        return amount + "second";
      case "m":
        return amount + "minute";
      case "h":
        return amount + "hour";
      case "d":
        return amount + "day";
      default:
        return amount + "week";
    }
  }

  private static String from(Query query) {
    if (query.getStartTime() != null) {
      return String.valueOf(TimeUtils.toEpochSeconds(query.getStartTime()));
    }
    if (query.getRelativeTime() != null) {
      return "-" + TimeUtils.formatPeriod(query.getRelativeTime(), DURATION_UNITS, "");
    }
    return "-1h";
  }

  private static String until(Query query) {
    if (query.getEndTime() != null) {
      return String.valueOf(TimeUtils.toEpochSeconds(query.getEndTime()));
    }
    return "now";
  }

  /** Form encodes the parameters, wildcards stay readable. */
  private static String encode(Map<String, String> parameters) {
    List<String> pairs = new ArrayList<>();
    for (Map.Entry<String, String> parameter : parameters.entrySet()) {
      String value = URLEncoder.encode(parameter.getValue(), StandardCharsets.UTF_8);
      pairs.add(parameter.getKey() + "=" + value);
    }
    return String.join("&", pairs).replace("%2A", WILDCARD);
  }
}
