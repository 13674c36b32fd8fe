package de.uni_passau.dbts.client.tsdb.graphite;

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
import de.uni_passau.dbts.client.utils.ValueUtils;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transport of Graphite. Queries use the render API of graphite-web, writes use the plaintext
 * protocol of Carbon: one {@code path value timestamp} line per sample.
 */
public class GraphiteTransport extends HttpTransport {

  private static final Logger LOGGER = LoggerFactory.getLogger(GraphiteTransport.class);

  /**
   * Creates a transport.
   *
   * @param config Connection settings of graphite-web and Carbon.
   */
  public GraphiteTransport(Config config) {
    super(config, config.getBaseUrl());
  }

  @Override
  protected void ping() throws TsdbException {
    get(baseUrl + "/version");
  }

  @Override
  public QueryResult execute(RawQuery query) throws TsdbException {
    return parseRender(get(baseUrl + "/render?" + query.getRawQuery()));
  }

  @Override
  public boolean write(List<DataPoint> dataPoints) throws TsdbException {
    List<String> lines = toPlaintext(config.GRAPHITE_PREFIX, dataPoints);
    try (Socket socket = new Socket()) {
      socket.connect(
          new InetSocketAddress(config.HOST, config.GRAPHITE_CARBON_PORT),
          (int) (config.CONNECT_TIMEOUT * Constants.MILLIS_TO_SECONDS));
      Writer writer =
          new BufferedWriter(
              new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
      for (int i = 0; i < lines.size(); i++) {
        writer.write(lines.get(i));
        writer.write('\n');
        if ((i + 1) % Math.max(1, config.GRAPHITE_BATCH_SIZE) == 0) {
          writer.flush();
        }
      }
      writer.flush();
    } catch (IOException e) {
      LOGGER.error("Could not send {} lines to Carbon because ", lines.size(), e);
      throw new WriteException("Could not write to Carbon at " + config.HOST, e);
    }
    return true;
  }

  /**
   * Renders data points as plaintext lines {@code prefix.measurement.tag.value.field value
   * seconds}. Tags are sorted by name.
   *
   * @param prefix Path prefix, may be empty.
   * @param dataPoints Points to render.
   * @return One line per numeric field.
   */
  static List<String> toPlaintext(String prefix, List<DataPoint> dataPoints) {
    List<String> lines = new ArrayList<>();
    for (DataPoint dataPoint : dataPoints) {
      StringBuilder path = new StringBuilder();
      if (prefix != null && !prefix.isEmpty()) {
        path.append(prefix).append('.');
      }
      path.append(segment(dataPoint.getMeasurement()));
      for (Map.Entry<String, String> tag : new TreeMap<>(dataPoint.getTags()).entrySet()) {
        path.append('.').append(segment(tag.getKey())).append('.').append(segment(tag.getValue()));
      }
      long seconds = dataPoint.getTimestamp() / Constants.MILLIS_TO_SECONDS;
      for (Map.Entry<String, Object> field : dataPoint.getFields().entrySet()) {
        Object value = field.getValue();
        if (!ValueUtils.isNumeric(value) && !(value instanceof Boolean)) {
          LOGGER.debug("Skipping non numeric field {} of {}", field.getKey(), dataPoint);
          continue;
        }
        lines.add(
            String.format(
                "%s.%s %s %d",
                path,
                segment(field.getKey()),
                ValueUtils.formatNumber(ValueUtils.toDouble(value)),
                seconds));
      }
    }
    return lines;
  }

  private static String segment(String value) {
    return value.replaceAll("[^a-zA-Z0-9_\\-]", "_");
  }

  /**
   * Reads the JSON response of the render API, a list of targets with
   * {@code [value, seconds]} pairs.
   *
   * @param json Response body.
   * @return The result.
   */
  static QueryResult parseRender(String json) {
    QueryResult result = new QueryResult();
    JSONArray targets = JSON.parseArray(json);
    for (int i = 0; i < targets.size(); i++) {
      JSONObject target = targets.getJSONObject(i);
      String name = target.getString("target");
      JSONArray datapoints = target.getJSONArray("datapoints");
      for (int j = 0; datapoints != null && j < datapoints.size(); j++) {
        JSONArray datapoint = datapoints.getJSONArray(j);
        result.appendPoint(
            name, datapoint.getLongValue(1) * Constants.MILLIS_TO_SECONDS, datapoint.get(0));
      }
    }
    return result;
  }
}
