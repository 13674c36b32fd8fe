package de.uni_passau.dbts.client.tsdb.rrdtool;

import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONArray;
import com.alibaba.fastjson.JSONObject;
import de.uni_passau.dbts.client.conf.Config;
import de.uni_passau.dbts.client.conf.Constants;
import de.uni_passau.dbts.client.query.DataPoint;
import de.uni_passau.dbts.client.query.QueryResult;
import de.uni_passau.dbts.client.query.RawQuery;
import de.uni_passau.dbts.client.tsdb.QueryException;
import de.uni_passau.dbts.client.tsdb.Transport;
import de.uni_passau.dbts.client.tsdb.TsdbException;
import de.uni_passau.dbts.client.tsdb.WriteException;
import de.uni_passau.dbts.client.tsdb.rrdtool.tags.RrdTagException;
import de.uni_passau.dbts.client.tsdb.rrdtool.tags.TagStrategy;
import de.uni_passau.dbts.client.utils.ValueUtils;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the {@code rrdtool} binary. Queries are {@code xport} commands, writes create the RRD file
 * of a measurement and tag set on first use and append samples with {@code update}.
 */
public class RrdToolTransport implements Transport {

  private static final Logger LOGGER = LoggerFactory.getLogger(RrdToolTransport.class);

  /** Data source names are limited to 19 characters of this alphabet. */
  private static final int MAX_DS_NAME_LENGTH = 19;

  private static final String UNKNOWN = "U";

  private final Config config;
  private final TagStrategy tagStrategy;
  private boolean connected;

  /**
   * Creates a transport.
   *
   * @param config Binary, step and archive settings.
   * @param tagStrategy Strategy mapping data points to files.
   */
  public RrdToolTransport(Config config, TagStrategy tagStrategy) {
    this.config = config;
    this.tagStrategy = tagStrategy;
  }

  @Override
  public void connect() throws TsdbException {
    try {
      Files.createDirectories(Paths.get(tagStrategy.getBaseDir()));
    } catch (IOException e) {
      throw new TsdbException("Could not create RRD directory " + tagStrategy.getBaseDir(), e);
    }
    List<String> command = new ArrayList<>();
    command.add(config.RRD_BINARY);
    String output = run(command, false);
    LOGGER.debug("Using {}", output.isEmpty() ? config.RRD_BINARY : output.split("\n")[0]);
    connected = true;
  }

  @Override
  public boolean isConnected() {
    return connected;
  }

  @Override
  public QueryResult execute(RawQuery query) throws TsdbException {
    if (!(query instanceof RrdToolRawQuery)) {
      throw new QueryException("RRDtool cannot execute " + query.getClass().getSimpleName());
    }
    RrdToolRawQuery rrdQuery = (RrdToolRawQuery) query;
    List<String> command = new ArrayList<>();
    command.add(config.RRD_BINARY);
    command.add(rrdQuery.getCommand());
    command.addAll(rrdQuery.getArgs());
    String output = run(command, true);
    if (!RrdToolRawQuery.XPORT.equals(rrdQuery.getCommand())) {
      return new QueryResult().addMetadata("output", output);
    }
    return parseXport(output);
  }

  @Override
  public boolean write(List<DataPoint> dataPoints) throws TsdbException {
    for (DataPoint dataPoint : dataPoints) {
      String file;
      try {
        file = tagStrategy.getFilePath(dataPoint.getMeasurement(), dataPoint.getTags());
      } catch (RrdTagException e) {
        throw new WriteException("Could not resolve the RRD file of " + dataPoint, e);
      }
      if (!new File(file).exists()) {
        run(createCommand(file, dataPoint), true);
        LOGGER.info("Created {}", file);
      }
      run(updateCommand(file, dataPoint), true);
    }
    return true;
  }

  @Override
  public void close() {
    connected = false;
  }

  /**
   * Builds the command creating the file of a data point: one GAUGE data source per field and an
   * AVERAGE archive.
   *
   * @param file RRD file.
   * @param dataPoint First point written to the file.
   * @return Command line.
   */
  List<String> createCommand(String file, DataPoint dataPoint) {
    List<String> command = new ArrayList<>();
    command.add(config.RRD_BINARY);
    command.add("create");
    command.add(file);
    command.add("--start");
    command.add(String.valueOf(seconds(dataPoint) - config.RRD_STEP));
    command.add("--step");
    command.add(String.valueOf(config.RRD_STEP));
    for (String field : dataPoint.getFields().keySet()) {
      command.add(
          String.format("DS:%s:GAUGE:%d:U:U", dataSourceName(field), config.RRD_HEARTBEAT));
    }
    command.add(String.format("RRA:AVERAGE:0.5:1:%d", config.RRD_ROWS));
    return command;
  }

  /**
   * Builds the command appending a data point, e.g.,
   * {@code rrdtool update file --template user:system 1685314800:1:2}.
   *
   * @param file RRD file.
   * @param dataPoint The point.
   * @return Command line.
   */
  List<String> updateCommand(String file, DataPoint dataPoint) {
    List<String> names = new ArrayList<>();
    StringBuilder values = new StringBuilder(String.valueOf(seconds(dataPoint)));
    for (Map.Entry<String, Object> field : dataPoint.getFields().entrySet()) {
      names.add(dataSourceName(field.getKey()));
      Object value = field.getValue();
      values.append(':');
      if (value instanceof Boolean || ValueUtils.isNumeric(value)) {
        values.append(ValueUtils.formatNumber(ValueUtils.toDouble(value)));
      } else {
        values.append(UNKNOWN);
      }
    }
    List<String> command = new ArrayList<>();
    command.add(config.RRD_BINARY);
    command.add("update");
    command.add(file);
    command.add("--template");
    command.add(String.join(":", names));
    command.add(values.toString());
    return command;
  }

  private static long seconds(DataPoint dataPoint) {
    return dataPoint.getTimestamp() / Constants.MILLIS_TO_SECONDS;
  }

  /**
   * Converts a field name into a valid data source name.
   *
   * @param field Field name.
   * @return Name of at most 19 characters of {@code [a-zA-Z0-9_]}.
   */
  static String dataSourceName(String field) {
    String name = field.replaceAll("[^a-zA-Z0-9_]", "_");
    return name.length() > MAX_DS_NAME_LENGTH ? name.substring(0, MAX_DS_NAME_LENGTH) : name;
  }

  /**
   * Runs a command and waits for it at most the configured timeout. The output is buffered in a
   * temporary file, so a chatty process cannot block on a full pipe.
   *
   * @param command Command line.
   * @param checkExitCode true to fail on a non-zero exit code.
   * @return Standard output and standard error.
   * @throws TsdbException if the process cannot be started, times out or fails.
   */
  private String run(List<String> command, boolean checkExitCode) throws TsdbException {
    LOGGER.debug("Running {}", command);
    Path output = null;
    try {
      output = Files.createTempFile("rrdtool", ".out");
      Process process =
          new ProcessBuilder(command)
              .redirectErrorStream(true)
              .redirectOutput(output.toFile())
              .start();
      if (!process.waitFor(config.RRD_TIMEOUT, TimeUnit.SECONDS)) {
        process.destroyForcibly();
        throw new TsdbException(
            String.format("%s timed out after %d seconds", command, config.RRD_TIMEOUT));
      }
      String text = new String(Files.readAllBytes(output), StandardCharsets.UTF_8).trim();
      if (checkExitCode && process.exitValue() != 0) {
        throw new TsdbException(
            String.format("%s exited with %d: %s", command, process.exitValue(), text));
      }
      return text;
    } catch (IOException e) {
      LOGGER.error("Could not run {} because ", command, e);
      throw new TsdbException("Could not run " + config.RRD_BINARY, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TsdbException("Interrupted while running " + config.RRD_BINARY, e);
    } finally {
      deleteQuietly(output);
    }
  }

  private static void deleteQuietly(Path file) {
    if (file == null) {
      return;
    }
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOGGER.warn("Could not delete temporary file {}", file, e);
    }
  }

  /**
   * Reads the output of {@code xport --json}. Older RRDtool releases print keys without quotes,
   * which the lenient parser accepts. Row {@code i} belongs to {@code start + i * step}.
   *
   * @param json Output of the command.
   * @return One series per legend entry.
   * @throws QueryException if the output is no xport document.
   */
  static QueryResult parseXport(String json) throws QueryException {
    JSONObject document;
    try {
      document = JSON.parseObject(json);
    } catch (RuntimeException e) {
      throw new QueryException("Unexpected xport output: " + json, e);
    }
    JSONObject meta = document == null ? null : document.getJSONObject("meta");
    if (meta == null) {
      throw new QueryException("Unexpected xport output: " + json);
    }
    long start = meta.getLongValue("start");
    long step = meta.getLongValue("step");
    JSONArray legend = meta.getJSONArray("legend");
    JSONArray data = document.getJSONArray("data");

    QueryResult result = new QueryResult();
    result.addMetadata("start", start).addMetadata("step", step);
    for (int row = 0; data != null && row < data.size(); row++) {
      long timestamp = (start + row * step) * Constants.MILLIS_TO_SECONDS;
      JSONArray values = data.getJSONArray(row);
      for (int column = 0; column < values.size(); column++) {
        String name =
            legend != null && column < legend.size()
                ? legend.getString(column)
                : "column" + column;
        result.appendPoint(name, timestamp, values.get(column));
      }
    }
    return result;
  }
}
