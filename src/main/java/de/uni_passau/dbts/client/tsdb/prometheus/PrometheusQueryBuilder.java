package de.uni_passau.dbts.client.tsdb.prometheus;

import de.uni_passau.dbts.client.query.AggregationClause;
import de.uni_passau.dbts.client.query.MathExpression;
import de.uni_passau.dbts.client.query.Query;
import de.uni_passau.dbts.client.query.QueryCondition;
import de.uni_passau.dbts.client.query.RawQuery;
import de.uni_passau.dbts.client.tsdb.AbstractQueryBuilder;
import de.uni_passau.dbts.client.utils.TimeUtils;
import de.uni_passau.dbts.client.utils.ValueUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates queries into PromQL. Time ranges and limits cannot be part of an expression, they
 * are appended as comments that {@link PrometheusRawQuery} parses again.
 */
public class PrometheusQueryBuilder extends AbstractQueryBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(PrometheusQueryBuilder.class);

  private static final String[] DURATION_UNITS = {"y", "mo", "d", "h", "m", "s"};
  private static final Pattern FUNCTION_CALL = Pattern.compile("^(\\w+)\\((.*)\\)$");

  @Override
  protected RawQuery translate(Query query) {
    String selector = query.getMeasurement() + matchers(query.getConditions());

    String expression;
    if (query.hasAggregations()) {
      List<AggregationClause> aggregations = query.getAggregations();
      if (aggregations.size() > 1) {
        LOGGER.debug("PromQL supports one aggregation, ignoring {}", aggregations.subList(1,
            aggregations.size()));
      }
      expression = aggregate(aggregations.get(0), selector);
      if (!query.getGroupBy().isEmpty()) {
        Matcher matcher = FUNCTION_CALL.matcher(expression);
        if (matcher.matches()) {
          expression =
              String.format(
                  "%s by (%s) (%s)",
                  matcher.group(1), String.join(",", query.getGroupBy()), matcher.group(2));
        }
      }
    } else {
      expression = selector;
    }

    if (query.getInterval() != null) {
      expression = String.format("rate(%s[%s])", expression, query.getInterval());
    }
    if (!query.getMathExpressions().isEmpty()) {
      MathExpression math = query.getMathExpressions().get(0);
      expression = String.format("(%s) %s", expression, math.getExpression());
    }

    StringBuilder promql = new StringBuilder(expression);
    if (query.getLimit() != null) {
      promql.append(" # limit: ").append(query.getLimit());
    }
    if (query.getStartTime() != null && query.getEndTime() != null) {
      promql
          .append(" # time range: ")
          .append(TimeUtils.toIsoString(query.getStartTime()))
          .append(" to ")
          .append(TimeUtils.toIsoString(query.getEndTime()));
    } else if (query.getRelativeTime() != null) {
      promql
          .append(" # relative time: ")
          .append(TimeUtils.formatPeriod(query.getRelativeTime(), DURATION_UNITS, " "));
    }
    if (query.isDistinct() || query.getOffset() != null || !query.getOrderBy().isEmpty()
        || !query.getHaving().isEmpty()) {
      LOGGER.debug("Distinct, offset, ordering and having are not expressed in PromQL");
    }
    return new PrometheusRawQuery(promql.toString());
  }

  private static String matchers(List<QueryCondition> conditions) {
    List<String> matchers = new ArrayList<>();
    for (QueryCondition condition : conditions) {
      String label = condition.getField();
      switch (condition.getOperator()) {
        case BETWEEN:
          LOGGER.debug("Label matchers cannot express {}", condition);
          break;
        case NOT_EQUALS:
        case NOT_EQUALS_ALT:
          matchers.add(label + "!=" + quote(condition.getScalarValue()));
          break;
        case REGEX:
          matchers.add(label + "=~" + quote(condition.getScalarValue()));
          break;
        case IN:
          matchers.add(label + "=~" + quote(alternation(condition.getValues())));
          break;
        case NOT_IN:
          matchers.add(label + "!~" + quote(alternation(condition.getValues())));
          break;
        default:
          matchers.add(label + "=" + quote(condition.getScalarValue()));
          break;
      }
    }
    return matchers.isEmpty() ? "" : "{" + String.join(",", matchers) + "}";
  }

  private static String alternation(List<?> values) {
    List<String> options = new ArrayList<>();
    for (Object value : values) {
      options.add(ValueUtils.stringValue(value));
    }
    return "^(" + String.join("|", options) + ")$";
  }

  private static String quote(Object value) {
    return '"' + ValueUtils.stringValue(value).replace("\\", "\\\\").replace("\"", "\\\"") + '"';
  }

  private static String aggregate(AggregationClause aggregation, String selector) {
    switch (aggregation.getFunction()) {
      case PERCENTILE:
        return String.format(
            "quantile(%s, %s)",
            ValueUtils.formatNumber(aggregation.getRank() / 100d), selector);
      case FIRST:
      case LAST:
        LOGGER.debug("PromQL has no {} aggregation, using the plain selector",
            aggregation.getFunction());
        return selector;
      default:
        return String.format("%s(%s)", aggregation.getFunction().getName(), selector);
    }
  }
}
