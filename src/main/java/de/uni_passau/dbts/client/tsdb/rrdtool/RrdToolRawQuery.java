package de.uni_passau.dbts.client.tsdb.rrdtool;

import de.uni_passau.dbts.client.query.RawQuery;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Arguments of one {@code rrdtool} invocation. Parameters keep their insertion order; statements
 * must be added in the order the RRDtool grammar requires: DEFs, then CDEFs and VDEFs, then
 * XPORTs and graph elements.
 *
 * <p>Example: {@code 'xport' '--json' '--start' 'end-3600s'
 * 'DEF:v1=/rrd/cpu_usage.rrd:value:AVERAGE' 'XPORT:v1:value'}
 */
public class RrdToolRawQuery implements RawQuery {

  public static final String XPORT = "xport";
  public static final String GRAPH = "graph";

  private static final String STDOUT = "-";

  private final String command;
  private final String filename;
  private final Map<String, String> parameters = new LinkedHashMap<>();
  private final List<List<String>> statements = new ArrayList<>();
  private int lastStage;

  /** Creates an {@code xport} query. */
  public RrdToolRawQuery() {
    this(XPORT, null);
  }

  /**
   * Creates a query. {@code xport} queries request JSON output, {@code graph} queries without
   * file write to stdout.
   *
   * @param command RRDtool sub command.
   * @param filename Output file, may be null.
   */
  public RrdToolRawQuery(String command, String filename) {
    this.command = command;
    if (GRAPH.equals(command) && (filename == null || filename.isEmpty())) {
      this.filename = STDOUT;
    } else {
      this.filename = filename;
    }
    if (XPORT.equals(command)) {
      param("--json");
    }
  }

  /**
   * Adds a flag without value.
   *
   * @param name Flag, e.g., {@code --json}.
   * @return The muted object to use in the builder style.
   */
  public RrdToolRawQuery param(String name) {
    parameters.put(name, null);
    return this;
  }

  /**
   * Adds a parameter. Setting a parameter twice replaces the value but keeps the position.
   *
   * @param name Parameter, e.g., {@code --start}.
   * @param value Value, colons and backslashes are escaped.
   * @return The muted object to use in the builder style.
   */
  public RrdToolRawQuery param(String name, Object value) {
    parameters.put(name, value == null ? null : escape(String.valueOf(value)));
    return this;
  }

  /**
   * Adds a DEF reading a data source with the given consolidation function.
   *
   * @param name Variable name.
   * @param file RRD file.
   * @param dataSource Data source name.
   * @param consolidation Consolidation function, e.g., {@code AVERAGE}.
   * @return The muted object to use in the builder style.
   */
  public RrdToolRawQuery def(String name, String file, String dataSource, String consolidation) {
    return def(name, file, dataSource, consolidation, null, null, null, null, null);
  }

  /**
   * Adds a DEF with options.
   *
   * @param name Variable name.
   * @param file RRD file.
   * @param dataSource Data source name.
   * @param consolidation Consolidation function.
   * @param step Step in seconds, may be null.
   * @param start Start time, may be null.
   * @param end End time, may be null.
   * @param reduce Consolidation function used to reduce rows, may be null.
   * @param daemon Address of rrdcached, may be null.
   * @return The muted object to use in the builder style.
   */
  public RrdToolRawQuery def(
      String name,
      String file,
      String dataSource,
      String consolidation,
      String step,
      String start,
      String end,
      String reduce,
      String daemon) {
    List<String> parts = new ArrayList<>();
    parts.add(name + "=" + file);
    parts.add(dataSource);
    parts.add(consolidation);
    addOption(parts, "step", step);
    addOption(parts, "start", start);
    addOption(parts, "end", end);
    addOption(parts, "reduce", reduce);
    addOption(parts, "daemon", daemon);
    return statement(0, "DEF", parts);
  }

  private static void addOption(List<String> parts, String name, String value) {
    if (value != null && !value.isEmpty()) {
      parts.add(name + "=" + value);
    }
  }

  /**
   * Adds a CDEF, a per row calculation.
   *
   * @param name Variable name.
   * @param rpnExpression Expression in reverse polish notation.
   * @return The muted object to use in the builder style.
   */
  public RrdToolRawQuery cdef(String name, String rpnExpression) {
    return statement(1, "CDEF", Collections.singletonList(name + "=" + rpnExpression));
  }

  /**
   * Adds a VDEF, a calculation reducing a series to one value.
   *
   * @param name Variable name.
   * @param rpnExpression Expression in reverse polish notation.
   * @return The muted object to use in the builder style.
   */
  public RrdToolRawQuery vdef(String name, String rpnExpression) {
    return statement(1, "VDEF", Collections.singletonList(name + "=" + rpnExpression));
  }

  /**
   * Exports a variable.
   *
   * @param name Variable name.
   * @param legend Legend of the exported column, may be null.
   * @return The muted object to use in the builder style.
   */
  public RrdToolRawQuery xport(String name, String legend) {
    if (legend == null || legend.isEmpty()) {
      return statement(2, "XPORT", Collections.singletonList(name));
    }
    return statement(2, "XPORT", Arrays.asList(name, escape(legend)));
  }

  /**
   * Draws a line in a graph.
   *
   * @param width Line width.
   * @param name Variable name.
   * @param color Color as RRGGBB, with or without leading hash.
   * @param legend Legend, may be null.
   * @param stack true to stack the line on the previous one.
   * @return The muted object to use in the builder style.
   */
  public RrdToolRawQuery line(String width, String name, String color, String legend,
      boolean stack) {
    String value = name + (color.startsWith("#") ? color : "#" + color);
    List<String> parts = new ArrayList<>();
    parts.add(value);
    if (legend != null && !legend.isEmpty()) {
      parts.add(escape(legend));
      if (stack) {
        parts.add("STACK");
      }
    }
    return statement(2, "LINE" + width, parts);
  }

  private RrdToolRawQuery statement(int stage, String type, List<String> parts) {
    if (stage < lastStage) {
      throw new IllegalStateException(
          String.format("%s must be added before %s statements", type, stageName(lastStage)));
    }
    lastStage = stage;
    List<String> statement = new ArrayList<>();
    statement.add(type);
    statement.addAll(parts);
    statements.add(statement);
    return this;
  }

  private static String stageName(int stage) {
    return stage == 1 ? "CDEF/VDEF" : "XPORT/graph";
  }

  @Override
  public String getRawQuery() {
    StringBuilder builder = new StringBuilder("'").append(command).append('\'');
    for (String arg : getArgs()) {
      builder.append(" '").append(arg).append('\'');
    }
    return builder.toString();
  }

  /**
   * Returns the arguments following the command: output file, parameters, then statements.
   *
   * @return Arguments in the order RRDtool expects them.
   */
  public List<String> getArgs() {
    List<String> args = new ArrayList<>();
    if (filename != null && !filename.isEmpty()) {
      args.add(filename);
    }
    for (Map.Entry<String, String> parameter : parameters.entrySet()) {
      args.add(parameter.getKey());
      if (parameter.getValue() != null) {
        args.add(parameter.getValue());
      }
    }
    for (List<String> statement : statements) {
      args.add(String.join(":", statement));
    }
    return args;
  }

  public String getCommand() {
    return command;
  }

  public String getFilename() {
    return filename;
  }

  /**
   * Returns the value of a parameter.
   *
   * @param name Parameter name.
   * @return Escaped value, null for flags and missing parameters.
   */
  public String getParam(String name) {
    return parameters.get(name);
  }

  /**
   * Returns the names of the exported columns, the legend if there is one, else the variable.
   *
   * @return Column names in export order.
   */
  public List<String> getFields() {
    List<String> fields = new ArrayList<>();
    for (List<String> statement : statements) {
      if ("XPORT".equals(statement.get(0))) {
        fields.add(statement.size() > 2 ? unescape(statement.get(2)) : statement.get(1));
      }
    }
    return fields;
  }

  /**
   * Escapes colons and backslashes, the only characters with a meaning inside RRDtool arguments.
   *
   * @param value Raw text.
   * @return Escaped text.
   */
  static String escape(String value) {
    return value.replace("\\", "\\\\").replace(":", "\\:");
  }

  private static String unescape(String value) {
    return value.replace("\\:", ":").replace("\\\\", "\\");
  }

  @Override
  public String toString() {
    return getRawQuery();
  }
}
