package de.uni_passau.dbts.client.tsdb.prometheus;

import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONArray;
import com.alibaba.fastjson.JSONObject;
import de.uni_passau.dbts.client.conf.Config;
import de.uni_passau.dbts.client.conf.Constants;
import de.uni_passau.dbts.client.query.DataPoint;
import de.uni_passau.dbts.client.query.QueryResult;
import de.uni_passau.dbts.client.query.RawQuery;
import de.uni_passau.dbts.client.tsdb.HttpTransport;
import de.uni_passau.dbts.client.tsdb.TsdbException;
import de.uni_passau.dbts.client.utils.TimeUtils;
import de.uni_passau.dbts.client.utils.ValueUtils;
import io.mikael.urlbuilder.UrlBuilder;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.joda.time.DateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP transport of Prometheus. Queries use the HTTP API, writes are pushed to a Pushgateway in
 * the text exposition format. The Pushgateway does not accept timestamps, so pushed samples get
 * the scrape time.
 */
public class PrometheusTransport extends HttpTransport {

  private static final Logger LOGGER = LoggerFactory.getLogger(PrometheusTransport.class);

  private final String pushgatewayUrl;

  /**
   * Creates a transport.
   *
   * @param config Connection settings of the server and the Pushgateway.
   */
  public PrometheusTransport(Config config) {
    super(config, config.getBaseUrl());
    this.pushgatewayUrl =
        String.format(
            "%s://%s:%s/metrics/job/%s",
            config.USE_HTTPS ? "https" : "http",
            config.PUSHGATEWAY_HOST,
            config.PUSHGATEWAY_PORT,
            config.PUSHGATEWAY_JOB);
  }

  @Override
  protected void ping() throws TsdbException {
    get(baseUrl + "/-/ready");
  }

  @Override
  public QueryResult execute(RawQuery query) throws TsdbException {
    PrometheusRawQuery promQuery =
        query instanceof PrometheusRawQuery
            ? (PrometheusRawQuery) query
            : new PrometheusRawQuery(query.getRawQuery());

    String url;
    if (promQuery.isRangeQuery()) {
      DateTime end = promQuery.getEnd() != null ? promQuery.getEnd() : DateTime.now();
      DateTime start =
          promQuery.getStart() != null
              ? promQuery.getStart()
              : end.minusSeconds((int) promQuery.getRelativeSeconds());
      url =
          UrlBuilder.fromString(baseUrl + "/api/v1/query_range")
              .addParameter("query", promQuery.getExpression())
              .addParameter("start", String.valueOf(TimeUtils.toEpochSeconds(start)))
              .addParameter("end", String.valueOf(TimeUtils.toEpochSeconds(end)))
              .addParameter("step", config.PROMETHEUS_STEP)
              .toString();
    } else {
      url =
          UrlBuilder.fromString(baseUrl + "/api/v1/query")
              .addParameter("query", promQuery.getExpression())
              .toString();
    }
    return parseResponse(get(url), promQuery.getLimit());
  }

  @Override
  public boolean write(List<DataPoint> dataPoints) throws TsdbException {
    post(pushgatewayUrl, toExposition(dataPoints), Constants.TEXT_MEDIA_TYPE);
    return true;
  }

  /**
   * Deletes the series of a metric.
   *
   * @param measurement Metric name.
   * @param start Start of the range, may be null.
   * @param stop End of the range, may be null.
   * @throws TsdbException if the admin API is disabled or the request fails.
   */
  public void deleteSeries(String measurement, DateTime start, DateTime stop)
      throws TsdbException {
    UrlBuilder url =
        UrlBuilder.fromString(baseUrl + "/api/v1/admin/tsdb/delete_series")
            .addParameter("match[]", measurement);
    if (start != null) {
      url = url.addParameter("start", String.valueOf(TimeUtils.toEpochSeconds(start)));
    }
    if (stop != null) {
      url = url.addParameter("end", String.valueOf(TimeUtils.toEpochSeconds(stop)));
    }
    post(url.toString(), "", Constants.TEXT_MEDIA_TYPE);
  }

  /**
   * Renders data points in the text exposition format. Every field becomes a sample of the metric
   * {@code measurement_field}, the field {@value Constants#DEFAULT_FIELD} uses the measurement
   * name alone.
   *
   * @param dataPoints Points to render.
   * @return Exposition text ending with a line break.
   */
  static String toExposition(List<DataPoint> dataPoints) {
    StringBuilder text = new StringBuilder();
    for (DataPoint dataPoint : dataPoints) {
      String labels = labels(dataPoint.getTags());
      for (Map.Entry<String, Object> field : dataPoint.getFields().entrySet()) {
        if (!ValueUtils.isNumeric(field.getValue()) && !(field.getValue() instanceof Boolean)) {
          LOGGER.debug("Skipping non numeric field {} of {}", field.getKey(), dataPoint);
          continue;
        }
        String metric =
            Constants.DEFAULT_FIELD.equals(field.getKey())
                ? dataPoint.getMeasurement()
                : dataPoint.getMeasurement() + "_" + field.getKey();
        text.append(metricName(metric))
            .append(labels)
            .append(' ')
            .append(ValueUtils.formatNumber(ValueUtils.toDouble(field.getValue())))
            .append('\n');
      }
    }
    return text.toString();
  }

  private static String labels(Map<String, String> tags) {
    if (tags.isEmpty()) {
      return "";
    }
    List<String> labels = new ArrayList<>();
    for (Map.Entry<String, String> tag : new TreeMap<>(tags).entrySet()) {
      String value = tag.getValue().replace("\\", "\\\\").replace("\"", "\\\"");
      labels.add(metricName(tag.getKey()) + "=\"" + value + "\"");
    }
    return "{" + String.join(",", labels) + "}";
  }

  private static String metricName(String name) {
    return name.replaceAll("[^a-zA-Z0-9_:]", "_");
  }

  /**
   * Reads a response of the query API. Matrix, vector and scalar results are supported.
   *
   * @param json Response body.
   * @param limit Maximum number of series, may be null.
   * @return The result.
   * @throws TsdbException if the response reports an error.
   */
  static QueryResult parseResponse(String json, Integer limit) throws TsdbException {
    JSONObject response = JSON.parseObject(json);
    if (!"success".equals(response.getString("status"))) {
      throw new TsdbException("Prometheus query failed: " + response.getString("error"));
    }
    JSONObject data = response.getJSONObject("data");
    String resultType = data.getString("resultType");
    QueryResult result = new QueryResult();
    result.addMetadata("resultType", resultType);

    if ("scalar".equals(resultType) || "string".equals(resultType)) {
      appendSample(result, "value", data.getJSONArray("result"));
      return result;
    }
    JSONArray series = data.getJSONArray("result");
    int count = limit == null ? series.size() : Math.min(limit, series.size());
    for (int i = 0; i < count; i++) {
      JSONObject serie = series.getJSONObject(i);
      String name = seriesName(serie.getJSONObject("metric"));
      if (serie.containsKey("values")) {
        JSONArray values = serie.getJSONArray("values");
        for (int j = 0; j < values.size(); j++) {
          appendSample(result, name, values.getJSONArray(j));
        }
      } else {
        appendSample(result, name, serie.getJSONArray("value"));
      }
    }
    return result;
  }

  private static void appendSample(QueryResult result, String name, JSONArray sample) {
    long timestamp = Math.round(sample.getDoubleValue(0) * Constants.MILLIS_TO_SECONDS);
    result.appendPoint(name, timestamp, ValueUtils.parseLiteral(sample.getString(1)));
  }

  /** Names a series like PromQL prints it, e.g., {@code cpu_usage{host="server1"}}. */
  private static String seriesName(JSONObject metric) {
    if (metric == null || metric.isEmpty()) {
      return "value";
    }
    Map<String, String> labels = new TreeMap<>();
    String name = "";
    for (String key : metric.keySet()) {
      if ("__name__".equals(key)) {
        name = metric.getString(key);
      } else {
        labels.put(key, metric.getString(key));
      }
    }
    if (labels.isEmpty()) {
      return name;
    }
    List<String> pairs = new ArrayList<>();
    for (Map.Entry<String, String> label : labels.entrySet()) {
      pairs.add(label.getKey() + "=\"" + label.getValue() + "\"");
    }
    return name + "{" + String.join(",", pairs) + "}";
  }
}
