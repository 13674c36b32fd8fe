package de.uni_passau.dbts.client.tsdb.influxdb;

import de.uni_passau.dbts.client.enums.ComparisonOperator;
import de.uni_passau.dbts.client.enums.SortOrder;
import de.uni_passau.dbts.client.query.AggregationClause;
import de.uni_passau.dbts.client.query.HavingClause;
import de.uni_passau.dbts.client.query.MathExpression;
import de.uni_passau.dbts.client.query.Query;
import de.uni_passau.dbts.client.query.QueryCondition;
import de.uni_passau.dbts.client.query.RawQuery;
import de.uni_passau.dbts.client.tsdb.AbstractQueryBuilder;
import de.uni_passau.dbts.client.tsdb.QueryException;
import de.uni_passau.dbts.client.utils.TimeUtils;
import de.uni_passau.dbts.client.utils.ValueUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.joda.time.DateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates queries into Flux pipelines for InfluxDB 2.x. Example output:
 *
 * <p><code>
 *   from(bucket: "metrics")
 *     |&gt; range(start: 2023-05-28T23:00:00+00:00, stop: 2023-05-28T23:29:00+00:00)
 *     |&gt; filter(fn: (r) =&gt; r._measurement == "cpu_usage")
 *     |&gt; filter(fn: (r) =&gt; r["host"] == "server1")
 * </code>
 */
public class InfluxDbQueryBuilder extends AbstractQueryBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(InfluxDbQueryBuilder.class);

  private static final String STAGE_PREFIX = "  |> ";
  private static final String DEFAULT_RANGE = "-1h";
  private static final String[] DURATION_UNITS = {"y", "mo", "d", "h", "m", "s"};

  /** Field read by a single aggregation without explicit field. */
  private static final String VALUE_COLUMN = "_value";

  /** Field duplicated for several aggregations without explicit field. */
  private static final String DEFAULT_FIELD = "value";

  private final String bucket;

  /**
   * Creates a builder.
   *
   * @param bucket Bucket every query reads from.
   */
  public InfluxDbQueryBuilder(String bucket) {
    this.bucket = bucket;
  }

  @Override
  protected RawQuery translate(Query query) throws QueryException {
    List<String> stages = new ArrayList<>();
    stages.add(range(query));
    if (query.getTimezone() != null) {
      stages.add(
          String.format("timeShift(duration: 0s, timeZone: \"%s\")", query.getTimezone()));
    }
    stages.add(
        String.format("filter(fn: (r) => r._measurement == \"%s\")", query.getMeasurement()));

    for (QueryCondition condition : query.getConditions()) {
      if (condition.isOr()) {
        LOGGER.debug("Flux has no condition chain, {} is applied as a separate filter", condition);
      }
      String stage = condition(condition);
      if (stage != null) {
        stages.add(stage);
      }
    }

    if (!query.selectsAllFields()) {
      List<String> fieldFilters = new ArrayList<>();
      for (String field : query.getFields()) {
        fieldFilters.add(String.format("r._field == \"%s\"", field));
      }
      stages.add(String.format("filter(fn: (r) => %s)", String.join(" or ", fieldFilters)));
    }
    if (query.isDistinct()) {
      stages.add("distinct()");
    }
    if (!query.getGroupBy().isEmpty()) {
      stages.add(String.format("group(columns: [%s])", quoteAll(query.getGroupBy())));
    }
    if (query.getInterval() != null) {
      stages.add(String.format("window(every: %s)", query.getInterval()));
    }

    aggregations(query.getAggregations(), stages);

    String fill = fill(query);
    if (fill != null) {
      stages.add(fill);
    }
    for (MathExpression math : query.getMathExpressions()) {
      stages.add(
          String.format(
              "map(fn: (r) => ({ r with %s: %s }))", math.getAlias(), math.getExpression()));
    }
    for (HavingClause having : query.getHaving()) {
      stages.add(
          String.format(
              "filter(fn: (r) => r[\"%s\"] %s %s)",
              having.getField(),
              having.getOperator().toFluxOperator(),
              formatValue(having.getValue())));
    }
    for (Map.Entry<String, SortOrder> order : query.getOrderBy().entrySet()) {
      stages.add(
          String.format(
              "sort(columns: [\"%s\"], desc: %s)",
              order.getKey(), order.getValue() == SortOrder.DESC));
    }
    if (query.getOffset() != null) {
      stages.add(String.format("tail(offset: %d)", query.getOffset()));
    }
    if (query.getLimit() != null) {
      stages.add(String.format("limit(n: %d)", query.getLimit()));
    }

    StringBuilder flux = new StringBuilder(String.format("from(bucket: \"%s\")", bucket));
    for (String stage : stages) {
      flux.append('\n').append(STAGE_PREFIX).append(stage);
    }
    return new InfluxDbRawQuery(flux.toString());
  }

  private String range(Query query) {
    DateTime start = query.getStartTime();
    DateTime end = query.getEndTime();
    if (start != null && end != null) {
      return String.format(
          "range(start: %s, stop: %s)", TimeUtils.toIsoString(start), TimeUtils.toIsoString(end));
    }
    if (start != null) {
      return String.format("range(start: %s)", TimeUtils.toIsoString(start));
    }
    if (query.getRelativeTime() != null) {
      return String.format(
          "range(start: -%s)",
          TimeUtils.formatPeriod(query.getRelativeTime(), DURATION_UNITS, ""));
    }
    return String.format("range(start: %s)", DEFAULT_RANGE);
  }

  /**
   * Compiles one condition into a filter stage.
   *
   * @param condition The condition.
   * @return The stage, null if the condition cannot be expressed.
   * @throws QueryException if a value has an unsupported type.
   */
  private String condition(QueryCondition condition) throws QueryException {
    String field = condition.getField();
    ComparisonOperator operator = condition.getOperator();

    if (Query.TIME_FIELD.equals(field)) {
      switch (operator) {
        case EQUALS:
        case SAME:
        case NOT_EQUALS:
        case NOT_EQUALS_ALT:
        case GREATER_THAN:
        case GREATER_THAN_OR_EQUAL:
        case LESS_THAN:
        case LESS_THAN_OR_EQUAL:
          return String.format(
              "filter(fn: (r) => r._time %s %s)",
              operator.toFluxOperator(), formatValue(condition.getScalarValue()));
        default:
          LOGGER.debug("Operator {} is not supported on the time column", operator);
          return null;
      }
    }

    switch (operator) {
      case IN:
        List<String> set = new ArrayList<>();
        for (Object value : condition.getValues()) {
          set.add(formatValue(value));
        }
        return String.format(
            "filter(fn: (r) => contains(value: r[\"%s\"], set: [%s]))",
            field, String.join(", ", set));
      case NOT_IN:
        List<String> inequalities = new ArrayList<>();
        for (Object value : condition.getValues()) {
          inequalities.add(String.format("r[\"%s\"] != %s", field, formatValue(value)));
        }
        return String.format("filter(fn: (r) => %s)", String.join(" and ", inequalities));
      case BETWEEN:
        List<?> bounds = condition.getValues();
        return String.format(
            "filter(fn: (r) => r[\"%s\"] >= %s and r[\"%s\"] <= %s)",
            field, formatValue(bounds.get(0)), field, formatValue(bounds.get(1)));
      case REGEX:
        return String.format(
            "filter(fn: (r) => r[\"%s\"] =~ /%s/)", field, condition.getScalarValue());
      default:
        return String.format(
            "filter(fn: (r) => r[\"%s\"] %s %s)",
            field, operator.toFluxOperator(), formatValue(condition.getValue()));
    }
  }

  /**
   * Appends the aggregation stages. Several aggregations work on copies of the first field so
   * that each aggregate function consumes its own column.
   */
  private void aggregations(List<AggregationClause> aggregations, List<String> stages) {
    if (aggregations.isEmpty()) {
      return;
    }
    if (aggregations.size() == 1) {
      AggregationClause aggregation = aggregations.get(0);
      stages.add(aggregate(aggregation, aggregation.getFieldOrDefault(VALUE_COLUMN)));
      rename(aggregation, stages);
      return;
    }

    String field = aggregations.get(0).getFieldOrDefault(DEFAULT_FIELD);
    for (int i = 1; i < aggregations.size(); i++) {
      stages.add(
          String.format("duplicate(column: \"%s\", as: \"%s\")", field, copyName(field, i)));
    }
    for (int i = 0; i < aggregations.size(); i++) {
      AggregationClause aggregation = aggregations.get(i);
      stages.add(aggregate(aggregation, i == 0 ? field : copyName(field, i)));
      rename(aggregation, stages);
    }
  }

  private static String copyName(String field, int index) {
    return field + "_copy" + index;
  }

  private static String aggregate(AggregationClause aggregation, String column) {
    switch (aggregation.getFunction()) {
      case AVG:
        return String.format("mean(column: \"%s\")", column);
      case PERCENTILE:
        return String.format(
            "quantile(q: %s, column: \"%s\")",
            ValueUtils.formatNumber(aggregation.getRank() / 100d), column);
      default:
        return String.format("%s(column: \"%s\")", aggregation.getFunction().getName(), column);
    }
  }

  private static void rename(AggregationClause aggregation, List<String> stages) {
    if (aggregation.hasAlias()) {
      stages.add(String.format("rename(columns: {_value: \"%s\"})", aggregation.getAlias()));
    }
  }

  private static String fill(Query query) {
    if (query.getFillPolicy() == null) {
      return null;
    }
    switch (query.getFillPolicy()) {
      case NULL:
        return "fill(value: null)";
      case PREVIOUS:
        return "fill(usePrevious: true)";
      case LINEAR:
        return "interpolate.linear()";
      case VALUE:
        if (query.getFillValue() == null) {
          return null;
        }
        return String.format("fill(value: %s)", ValueUtils.formatNumber(query.getFillValue()));
      case NONE:
      default:
        return null;
    }
  }

  private static String quoteAll(List<String> names) {
    List<String> quoted = new ArrayList<>();
    for (String name : names) {
      quoted.add('"' + name + '"');
    }
    return String.join(", ", quoted);
  }

  /**
   * Prints a value as a Flux literal.
   *
   * @param value The value.
   * @return Flux literal.
   * @throws QueryException if the value has no Flux representation.
   */
  static String formatValue(Object value) throws QueryException {
    if (value == null) {
      return "null";
    }
    if (value instanceof String) {
      return '"' + ((String) value).replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
    if (value instanceof Boolean) {
      return value.toString();
    }
    if (value instanceof DateTime) {
      return String.format("time(v: \"%s\")", TimeUtils.toIsoString((DateTime) value));
    }
    if (value instanceof Number) {
      return ValueUtils.formatNumber((Number) value);
    }
    throw new QueryException(
        String.format(
            "Unsupported value type: %s (%s)", value.getClass().getSimpleName(), value));
  }
}
