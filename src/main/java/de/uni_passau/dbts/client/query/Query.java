package de.uni_passau.dbts.client.query;

import com.google.common.base.Preconditions;
import de.uni_passau.dbts.client.enums.Aggregation;
import de.uni_passau.dbts.client.enums.ComparisonOperator;
import de.uni_passau.dbts.client.enums.Connective;
import de.uni_passau.dbts.client.enums.FillPolicy;
import de.uni_passau.dbts.client.enums.SortOrder;
import de.uni_passau.dbts.client.utils.TimeUtils;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.joda.time.DateTime;
import org.joda.time.Period;

/**
 * Backend independent description of a query. Every setter returns the same instance so that
 * queries can be assembled in the builder style, e.g.:
 *
 * <pre>
 *   new Query("cpu_usage")
 *       .where("host", "=", "server1")
 *       .latest("1h")
 *       .groupByTime("5m")
 *       .avg("value", "avg_value");
 * </pre>
 *
 * <p>Apart from argument checks no validation happens while the query is assembled. Combinations a
 * backend cannot translate are rejected by its query builder.
 */
public class Query {

  /** Name of the time column used by {@link #orderByTime(SortOrder)}. */
  public static final String TIME_FIELD = "time";

  /** Field selector meaning all fields. */
  public static final String ALL_FIELDS = "*";

  private final String measurement;
  private List<String> fields = new ArrayList<>(Collections.singletonList(ALL_FIELDS));
  private final List<QueryCondition> conditions = new ArrayList<>();
  private DateTime startTime;
  private DateTime endTime;
  private Period relativeTime;
  private final List<String> groupBy = new ArrayList<>();
  private String interval;
  private final List<AggregationClause> aggregations = new ArrayList<>();
  private FillPolicy fillPolicy;
  private Number fillValue;
  private final Map<String, SortOrder> orderBy = new LinkedHashMap<>();
  private Integer limit;
  private Integer offset;
  private boolean distinct;
  private final List<HavingClause> having = new ArrayList<>();
  private final List<MathExpression> mathExpressions = new ArrayList<>();
  private String timezone;

  /**
   * Creates a query against a measurement.
   *
   * @param measurement Name of the measurement (metric, series prefix or RRD file prefix).
   */
  public Query(String measurement) {
    this.measurement = measurement == null ? "" : measurement;
  }

  /**
   * Selects the fields to return. No fields selects all of them.
   *
   * @param fields Field names.
   * @return The muted object to use in the builder style.
   */
  public Query select(String... fields) {
    return select(Arrays.asList(fields));
  }

  /**
   * Selects the fields to return. An empty list selects all of them.
   *
   * @param fields Field names.
   * @return The muted object to use in the builder style.
   */
  public Query select(List<String> fields) {
    this.fields =
        fields == null || fields.isEmpty()
            ? new ArrayList<>(Collections.singletonList(ALL_FIELDS))
            : new ArrayList<>(fields);
    return this;
  }

  /**
   * Selects the fields to return and requests distinct values.
   *
   * @param fields Field names.
   * @return The muted object to use in the builder style.
   */
  public Query selectDistinct(String... fields) {
    select(fields);
    distinct = true;
    return this;
  }

  /**
   * Appends an AND-joined condition.
   *
   * @param field Field or tag name.
   * @param operator Comparison operator.
   * @param value Value(s) to compare with.
   * @return The muted object to use in the builder style.
   */
  public Query where(String field, ComparisonOperator operator, Object value) {
    conditions.add(new QueryCondition(field, operator, value, Connective.AND));
    return this;
  }

  /**
   * Appends an AND-joined condition.
   *
   * @param field Field or tag name.
   * @param operator Operator symbol, e.g., {@code >=} or {@code NOT IN}.
   * @param value Value(s) to compare with.
   * @return The muted object to use in the builder style.
   */
  public Query where(String field, String operator, Object value) {
    return where(field, ComparisonOperator.fromSymbol(operator), value);
  }

  /**
   * Appends an OR-joined condition.
   *
   * @param field Field or tag name.
   * @param operator Comparison operator.
   * @param value Value(s) to compare with.
   * @return The muted object to use in the builder style.
   */
  public Query orWhere(String field, ComparisonOperator operator, Object value) {
    conditions.add(new QueryCondition(field, operator, value, Connective.OR));
    return this;
  }

  /**
   * Appends an OR-joined condition.
   *
   * @param field Field or tag name.
   * @param operator Operator symbol.
   * @param value Value(s) to compare with.
   * @return The muted object to use in the builder style.
   */
  public Query orWhere(String field, String operator, Object value) {
    return orWhere(field, ComparisonOperator.fromSymbol(operator), value);
  }

  public Query whereIn(String field, List<?> values) {
    return where(field, ComparisonOperator.IN, values);
  }

  public Query whereNotIn(String field, List<?> values) {
    return where(field, ComparisonOperator.NOT_IN, values);
  }

  /**
   * Appends an inclusive range condition.
   *
   * @param field Field or tag name.
   * @param min Lower bound.
   * @param max Upper bound.
   * @return The muted object to use in the builder style.
   */
  public Query whereBetween(String field, Object min, Object max) {
    return where(field, ComparisonOperator.BETWEEN, Arrays.asList(min, max));
  }

  public Query whereRegex(String field, String pattern) {
    return where(field, ComparisonOperator.REGEX, pattern);
  }

  /**
   * Restricts the query to an absolute time range. Clears a relative window.
   *
   * @param start Start of the range.
   * @param end End of the range.
   * @return The muted object to use in the builder style.
   */
  public Query timeRange(DateTime start, DateTime end) {
    this.startTime = start;
    this.endTime = end;
    this.relativeTime = null;
    return this;
  }

  /**
   * Sets the start of the time range. Clears a relative window.
   *
   * @param start Start of the range.
   * @return The muted object to use in the builder style.
   */
  public Query since(DateTime start) {
    this.startTime = start;
    this.relativeTime = null;
    return this;
  }

  /**
   * Sets the end of the time range. Clears a relative window.
   *
   * @param end End of the range.
   * @return The muted object to use in the builder style.
   */
  public Query until(DateTime end) {
    this.endTime = end;
    this.relativeTime = null;
    return this;
  }

  /**
   * Restricts the query to the most recent window, e.g., {@code 1h}. Clears an absolute range.
   *
   * @param duration Amount followed by one of the units s, m, h, d, w or y.
   * @return The muted object to use in the builder style.
   * @throws IllegalArgumentException if the duration cannot be parsed.
   */
  public Query latest(String duration) {
    this.relativeTime = TimeUtils.parseDuration(duration);
    this.startTime = null;
    this.endTime = null;
    return this;
  }

  public Query timezone(String timezone) {
    this.timezone = timezone;
    return this;
  }

  /**
   * Groups the results by tags.
   *
   * @param tags Tag names.
   * @return The muted object to use in the builder style.
   */
  public Query groupBy(String... tags) {
    return groupBy(Arrays.asList(tags), null);
  }

  /**
   * Groups the results by tags and, optionally, by time buckets.
   *
   * @param tags Tag names.
   * @param interval Bucket length such as {@code 5m}, may be null.
   * @return The muted object to use in the builder style.
   */
  public Query groupBy(List<String> tags, String interval) {
    groupBy.clear();
    groupBy.addAll(tags);
    if (interval != null) {
      this.interval = interval;
    }
    return this;
  }

  /**
   * Groups the results into time buckets.
   *
   * @param interval Bucket length such as {@code 5m}.
   * @return The muted object to use in the builder style.
   */
  public Query groupByTime(String interval) {
    this.interval = interval;
    return this;
  }

  /**
   * Appends an aggregation.
   *
   * @param function Aggregation function.
   * @param field Source field, null for the backend default.
   * @param alias Result name, may be null.
   * @return The muted object to use in the builder style.
   */
  public Query aggregate(Aggregation function, String field, String alias) {
    aggregations.add(new AggregationClause(function, field, alias, null));
    return this;
  }

  public Query avg(String field) {
    return aggregate(Aggregation.AVG, field, null);
  }

  public Query avg(String field, String alias) {
    return aggregate(Aggregation.AVG, field, alias);
  }

  public Query sum(String field) {
    return aggregate(Aggregation.SUM, field, null);
  }

  public Query sum(String field, String alias) {
    return aggregate(Aggregation.SUM, field, alias);
  }

  public Query count() {
    return aggregate(Aggregation.COUNT, null, null);
  }

  public Query count(String field, String alias) {
    return aggregate(Aggregation.COUNT, field, alias);
  }

  public Query min(String field) {
    return aggregate(Aggregation.MIN, field, null);
  }

  public Query min(String field, String alias) {
    return aggregate(Aggregation.MIN, field, alias);
  }

  public Query max(String field) {
    return aggregate(Aggregation.MAX, field, null);
  }

  public Query max(String field, String alias) {
    return aggregate(Aggregation.MAX, field, alias);
  }

  public Query first(String field, String alias) {
    return aggregate(Aggregation.FIRST, field, alias);
  }

  public Query last(String field, String alias) {
    return aggregate(Aggregation.LAST, field, alias);
  }

  public Query stddev(String field, String alias) {
    return aggregate(Aggregation.STDDEV, field, alias);
  }

  /**
   * Appends a percentile aggregation.
   *
   * @param field Source field.
   * @param rank Percentile rank, e.g., 95.
   * @param alias Result name, may be null.
   * @return The muted object to use in the builder style.
   */
  public Query percentile(String field, double rank, String alias) {
    Preconditions.checkArgument(
        rank >= 0 && rank <= 100, "Percentile rank must be within [0, 100], got %s", rank);
    aggregations.add(new AggregationClause(Aggregation.PERCENTILE, field, alias, rank));
    return this;
  }

  /**
   * Appends an aggregation parsed from configuration. Percentiles use the given rank.
   *
   * @param clause Aggregation request.
   * @return The muted object to use in the builder style.
   */
  public Query aggregate(AggregationClause clause) {
    aggregations.add(Preconditions.checkNotNull(clause));
    return this;
  }

  /**
   * Sets how empty buckets are filled.
   *
   * @param policy Fill policy.
   * @param value Fill value, only used by {@link FillPolicy#VALUE}.
   * @return The muted object to use in the builder style.
   */
  public Query fill(FillPolicy policy, Number value) {
    this.fillPolicy = policy;
    this.fillValue = value;
    return this;
  }

  public Query fillNull() {
    return fill(FillPolicy.NULL, null);
  }

  public Query fillNone() {
    return fill(FillPolicy.NONE, null);
  }

  public Query fillPrevious() {
    return fill(FillPolicy.PREVIOUS, null);
  }

  public Query fillLinear() {
    return fill(FillPolicy.LINEAR, null);
  }

  public Query fillValue(Number value) {
    return fill(FillPolicy.VALUE, Preconditions.checkNotNull(value));
  }

  /**
   * Appends a free-form expression computing a new column.
   *
   * @param expression Backend specific expression.
   * @param alias Name of the computed column.
   * @return The muted object to use in the builder style.
   */
  public Query math(String expression, String alias) {
    mathExpressions.add(new MathExpression(expression, alias));
    return this;
  }

  /**
   * Limits the number of results.
   *
   * @param limit Non-negative limit.
   * @return The muted object to use in the builder style.
   */
  public Query limit(int limit) {
    Preconditions.checkArgument(limit >= 0, "Limit must not be negative, got %s", limit);
    this.limit = limit;
    return this;
  }

  /**
   * Skips a number of results.
   *
   * @param offset Non-negative offset.
   * @return The muted object to use in the builder style.
   */
  public Query offset(int offset) {
    Preconditions.checkArgument(offset >= 0, "Offset must not be negative, got %s", offset);
    this.offset = offset;
    return this;
  }

  public Query orderBy(String field, SortOrder direction) {
    orderBy.put(field, direction);
    return this;
  }

  public Query orderBy(String field, String direction) {
    return orderBy(field, SortOrder.parse(direction));
  }

  public Query orderByTime(SortOrder direction) {
    return orderBy(TIME_FIELD, direction);
  }

  public Query orderByTime(String direction) {
    return orderBy(TIME_FIELD, SortOrder.parse(direction));
  }

  /**
   * Appends a filter on aggregated values.
   *
   * @param field Aggregated field or alias.
   * @param operator Operator symbol.
   * @param value Value to compare with.
   * @return The muted object to use in the builder style.
   */
  public Query having(String field, String operator, Object value) {
    having.add(new HavingClause(field, ComparisonOperator.fromSymbol(operator), value));
    return this;
  }

  public String getMeasurement() {
    return measurement;
  }

  public List<String> getFields() {
    return Collections.unmodifiableList(fields);
  }

  /**
   * Returns true if every field is selected.
   *
   * @return true for an empty selection or one containing {@code *}.
   */
  public boolean selectsAllFields() {
    return fields.isEmpty() || fields.contains(ALL_FIELDS);
  }

  public List<QueryCondition> getConditions() {
    return Collections.unmodifiableList(conditions);
  }

  public DateTime getStartTime() {
    return startTime;
  }

  public DateTime getEndTime() {
    return endTime;
  }

  public Period getRelativeTime() {
    return relativeTime;
  }

  public List<String> getGroupBy() {
    return Collections.unmodifiableList(groupBy);
  }

  public String getInterval() {
    return interval;
  }

  public List<AggregationClause> getAggregations() {
    return Collections.unmodifiableList(aggregations);
  }

  public FillPolicy getFillPolicy() {
    return fillPolicy;
  }

  public Number getFillValue() {
    return fillValue;
  }

  public Map<String, SortOrder> getOrderBy() {
    return Collections.unmodifiableMap(orderBy);
  }

  public Integer getLimit() {
    return limit;
  }

  public Integer getOffset() {
    return offset;
  }

  public boolean isDistinct() {
    return distinct;
  }

  public List<HavingClause> getHaving() {
    return Collections.unmodifiableList(having);
  }

  public List<MathExpression> getMathExpressions() {
    return Collections.unmodifiableList(mathExpressions);
  }

  public String getTimezone() {
    return timezone;
  }

  public boolean hasAggregations() {
    return !aggregations.isEmpty();
  }

  public boolean hasTimeGrouping() {
    return interval != null && !interval.isEmpty();
  }

  public boolean hasConditionForField(String field) {
    return conditions.stream().anyMatch(c -> c.getField().equals(field));
  }

  public List<QueryCondition> getConditionsForField(String field) {
    return conditions.stream().filter(c -> c.getField().equals(field)).collect(Collectors.toList());
  }

  public List<QueryCondition> getConditionsByOperator(ComparisonOperator operator) {
    return conditions.stream()
        .filter(c -> c.getOperator() == operator)
        .collect(Collectors.toList());
  }

  public List<QueryCondition> getAndConditions() {
    return conditions.stream().filter(c -> !c.isOr()).collect(Collectors.toList());
  }

  public List<QueryCondition> getOrConditions() {
    return conditions.stream().filter(QueryCondition::isOr).collect(Collectors.toList());
  }

  /**
   * Lists the problems that make the query meaningless for most backends.
   *
   * @return Human readable problems, empty for a valid query.
   */
  public List<String> validate() {
    List<String> errors = new ArrayList<>();
    if (measurement.isEmpty()) {
      errors.add("Measurement is required");
    }
    if (hasAggregations() && groupBy.isEmpty() && !hasTimeGrouping()) {
      errors.add("Aggregations require GROUP BY clause or time interval");
    }
    if (!having.isEmpty() && !hasAggregations()) {
      errors.add("HAVING clause requires aggregation functions");
    }
    return errors;
  }

  @Override
  public String toString() {
    return "Query{measurement=" + measurement
        + ", fields=" + fields
        + ", conditions=" + conditions
        + ", aggregations=" + aggregations
        + "}";
  }
}
