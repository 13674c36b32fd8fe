package de.uni_passau.dbts.client.tsdb.influxdb;

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
import de.uni_passau.dbts.client.tsdb.WriteException;
import de.uni_passau.dbts.client.utils.TimeUtils;
import de.uni_passau.dbts.client.utils.ValueUtils;
import io.mikael.urlbuilder.UrlBuilder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.RequestBody;
import org.influxdb.dto.Point;
import org.joda.time.DateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP transport of InfluxDB 2.x. Flux queries are sent to {@code /api/v2/query} and answered
 * with annotated CSV, InfluxQL queries use the v1 compatible {@code /query} endpoint, data points
 * are written as line protocol.
 */
public class InfluxDbTransport extends HttpTransport {

  private static final Logger LOGGER = LoggerFactory.getLogger(InfluxDbTransport.class);

  /** Columns of a Flux table that never hold values. */
  private static final Set<String> META_COLUMNS =
      new HashSet<>(
          Arrays.asList(
              "", "result", "table", "_start", "_stop", "_time", "_measurement", "_field"));

  /**
   * Creates a transport.
   *
   * @param config Connection settings, the database name is used as bucket.
   */
  public InfluxDbTransport(Config config) {
    super(config, config.getBaseUrl());
  }

  @Override
  protected void ping() throws TsdbException {
    get(baseUrl + "/ping");
  }

  @Override
  protected Request.Builder decorate(Request.Builder builder) {
    if (config.INFLUX_TOKEN != null && !config.INFLUX_TOKEN.isEmpty()) {
      builder.header("Authorization", "Token " + config.INFLUX_TOKEN);
    }
    return builder;
  }

  @Override
  public QueryResult execute(RawQuery query) throws TsdbException {
    boolean flux = !(query instanceof InfluxDbRawQuery) || ((InfluxDbRawQuery) query).isFlux();
    if (flux) {
      String url =
          UrlBuilder.fromString(baseUrl + "/api/v2/query")
              .addParameter("org", config.INFLUX_ORG)
              .toString();
      Request request =
          decorate(new Request.Builder().url(url))
              .header("Accept", "application/csv")
              .post(
                  RequestBody.create(
                      query.getRawQuery(), MediaType.get(Constants.FLUX_MEDIA_TYPE)))
              .build();
      return parseCsv(send(request));
    }
    String url =
        UrlBuilder.fromString(baseUrl + "/query")
            .addParameter("db", config.DB_NAME)
            .addParameter("q", query.getRawQuery())
            .addParameter("epoch", "ms")
            .toString();
    return parseInfluxQl(get(url));
  }

  @Override
  public boolean write(List<DataPoint> dataPoints) throws TsdbException {
    String url =
        UrlBuilder.fromString(baseUrl + "/api/v2/write")
            .addParameter("org", config.INFLUX_ORG)
            .addParameter("bucket", config.DB_NAME)
            .addParameter("precision", "ms")
            .toString();
    String lines;
    try {
      lines = toLineProtocol(dataPoints);
    } catch (IllegalArgumentException e) {
      throw new WriteException("Invalid data point: " + e.getMessage(), e);
    }
    post(url, lines, Constants.TEXT_MEDIA_TYPE);
    return true;
  }

  /**
   * Lists the names of the buckets of the organization.
   *
   * @return Bucket names.
   * @throws TsdbException if the request fails.
   */
  public List<String> getBuckets() throws TsdbException {
    String url =
        UrlBuilder.fromString(baseUrl + "/api/v2/buckets")
            .addParameter("org", config.INFLUX_ORG)
            .toString();
    List<String> names = new ArrayList<>();
    JSONArray buckets = JSON.parseObject(get(url)).getJSONArray("buckets");
    if (buckets != null) {
      for (int i = 0; i < buckets.size(); i++) {
        names.add(buckets.getJSONObject(i).getString("name"));
      }
    }
    return names;
  }

  /**
   * Creates a bucket with infinite retention.
   *
   * @param name Bucket name.
   * @throws TsdbException if the organization is unknown or the request fails.
   */
  public void createBucket(String name) throws TsdbException {
    JSONObject body = new JSONObject();
    body.put("orgID", getOrganizationId());
    body.put("name", name);
    body.put("retentionRules", new JSONArray());
    post(baseUrl + "/api/v2/buckets", body.toJSONString(), Constants.JSON_MEDIA_TYPE);
  }

  /**
   * Deletes a bucket.
   *
   * @param name Bucket name.
   * @return false if there is no such bucket.
   * @throws TsdbException if the request fails.
   */
  public boolean deleteBucket(String name) throws TsdbException {
    String url =
        UrlBuilder.fromString(baseUrl + "/api/v2/buckets")
            .addParameter("org", config.INFLUX_ORG)
            .addParameter("name", name)
            .toString();
    JSONArray buckets = JSON.parseObject(get(url)).getJSONArray("buckets");
    if (buckets == null || buckets.isEmpty()) {
      LOGGER.warn("Bucket {} does not exist.", name);
      return false;
    }
    delete(baseUrl + "/api/v2/buckets/" + buckets.getJSONObject(0).getString("id"));
    return true;
  }

  /**
   * Deletes the points of a measurement within a time range.
   *
   * @param measurement Measurement name.
   * @param start Start of the range.
   * @param stop End of the range.
   * @throws TsdbException if the request fails.
   */
  public void deleteMeasurement(String measurement, DateTime start, DateTime stop)
      throws TsdbException {
    String url =
        UrlBuilder.fromString(baseUrl + "/api/v2/delete")
            .addParameter("org", config.INFLUX_ORG)
            .addParameter("bucket", config.DB_NAME)
            .toString();
    JSONObject body = new JSONObject();
    body.put("start", TimeUtils.toIsoString(start));
    body.put("stop", TimeUtils.toIsoString(stop));
    body.put("predicate", String.format("_measurement=\"%s\"", measurement));
    post(url, body.toJSONString(), Constants.JSON_MEDIA_TYPE);
  }

  private String getOrganizationId() throws TsdbException {
    String url =
        UrlBuilder.fromString(baseUrl + "/api/v2/orgs")
            .addParameter("org", config.INFLUX_ORG)
            .toString();
    JSONArray orgs = JSON.parseObject(get(url)).getJSONArray("orgs");
    if (orgs == null || orgs.isEmpty()) {
      throw new TsdbException("Unknown organization " + config.INFLUX_ORG);
    }
    return orgs.getJSONObject(0).getString("id");
  }

  /**
   * Renders data points as line protocol with millisecond precision.
   *
   * @param dataPoints Points to render.
   * @return One line per point.
   * @throws IllegalArgumentException if a point has no fields.
   */
  static String toLineProtocol(List<DataPoint> dataPoints) {
    StringBuilder lines = new StringBuilder();
    for (DataPoint dataPoint : dataPoints) {
      Point.Builder builder =
          Point.measurement(dataPoint.getMeasurement())
              .time(dataPoint.getTimestamp(), TimeUnit.MILLISECONDS)
              .tag(dataPoint.getTags());
      for (Map.Entry<String, Object> field : dataPoint.getFields().entrySet()) {
        Object value = field.getValue();
        if (value instanceof Number) {
          builder.addField(field.getKey(), (Number) value);
        } else if (value instanceof Boolean) {
          builder.addField(field.getKey(), (Boolean) value);
        } else if (value != null) {
          builder.addField(field.getKey(), value.toString());
        }
      }
      if (lines.length() > 0) {
        lines.append('\n');
      }
      lines.append(builder.build().lineProtocol(TimeUnit.MILLISECONDS));
    }
    return lines.toString();
  }

  /**
   * Reads an annotated CSV response of a Flux query. The {@code _value} column becomes a series
   * named after the record's field, every other numeric column a series named after the column.
   *
   * @param csv Response body.
   * @return The result.
   */
  static QueryResult parseCsv(String csv) {
    QueryResult result = new QueryResult();
    List<String> header = null;
    for (String line : csv.split("\r?\n")) {
      if (line.trim().isEmpty()) {
        header = null;
        continue;
      }
      if (line.startsWith("#")) {
        continue;
      }
      List<String> cells = splitCsvLine(line);
      if (header == null) {
        header = cells;
        continue;
      }
      record(header, cells, result);
    }
    return result;
  }

  private static void record(List<String> header, List<String> cells, QueryResult result) {
    int timeIndex = header.indexOf("_time");
    if (timeIndex < 0) {
      timeIndex = header.indexOf("_stop");
    }
    long timestamp =
        timeIndex < 0 || timeIndex >= cells.size()
            ? 0
            : TimeUtils.convertDateStrToTimestamp(cells.get(timeIndex));
    int fieldIndex = header.indexOf("_field");
    for (int i = 0; i < header.size() && i < cells.size(); i++) {
      String column = header.get(i);
      if (META_COLUMNS.contains(column) || !ValueUtils.isNumeric(cells.get(i))) {
        continue;
      }
      String name = column;
      if ("_value".equals(column) && fieldIndex >= 0 && fieldIndex < cells.size()) {
        name = cells.get(fieldIndex);
      }
      result.appendPoint(name, timestamp, ValueUtils.parseLiteral(cells.get(i)));
    }
  }

  /** Splits a CSV line, quoted cells may contain commas and doubled quotes. */
  static List<String> splitCsvLine(String line) {
    List<String> cells = new ArrayList<>();
    StringBuilder cell = new StringBuilder();
    boolean quoted = false;
    for (int i = 0; i < line.length(); i++) {
      char c = line.charAt(i);
      if (quoted) {
        if (c == '"' && i + 1 < line.length() && line.charAt(i + 1) == '"') {
          cell.append('"');
          i++;
        } else if (c == '"') {
          quoted = false;
        } else {
          cell.append(c);
        }
      } else if (c == '"') {
        quoted = true;
      } else if (c == ',') {
        cells.add(cell.toString());
        cell.setLength(0);
      } else {
        cell.append(c);
      }
    }
    cells.add(cell.toString());
    return cells;
  }

  /**
   * Reads the JSON response of an InfluxQL query.
   *
   * @param json Response body.
   * @return The result.
   * @throws TsdbException if the response reports an error.
   */
  static QueryResult parseInfluxQl(String json) throws TsdbException {
    QueryResult result = new QueryResult();
    JSONArray results = JSON.parseObject(json).getJSONArray("results");
    if (results == null) {
      return result;
    }
    for (int i = 0; i < results.size(); i++) {
      JSONObject statement = results.getJSONObject(i);
      if (statement.containsKey("error")) {
        throw new TsdbException("InfluxQL query failed: " + statement.getString("error"));
      }
      JSONArray series = statement.getJSONArray("series");
      if (series == null) {
        continue;
      }
      for (int j = 0; j < series.size(); j++) {
        JSONObject serie = series.getJSONObject(j);
        List<String> columns = serie.getJSONArray("columns").toJavaList(String.class);
        List<List<Object>> rows = new ArrayList<>();
        JSONArray values = serie.getJSONArray("values");
        for (int k = 0; values != null && k < values.size(); k++) {
          rows.add(new ArrayList<>(values.getJSONArray(k)));
        }
        result.addSeries(serie.getString("name"), columns, rows);
      }
    }
    return result;
  }
}
