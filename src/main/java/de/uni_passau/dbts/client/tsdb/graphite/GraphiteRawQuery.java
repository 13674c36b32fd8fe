package de.uni_passau.dbts.client.tsdb.graphite;

import de.uni_passau.dbts.client.query.RawQuery;
import java.io.UnsupportedEncodingException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/** Form encoded query string of the Graphite render API, e.g., {@code target=a.*&from=-1h}. */
public class GraphiteRawQuery implements RawQuery {

  private final String queryString;

  /**
   * Creates a query.
   *
   * @param queryString Form encoded render parameters.
   */
  public GraphiteRawQuery(String queryString) {
    this.queryString = queryString;
  }

  @Override
  public String getRawQuery() {
    return queryString;
  }

  /**
   * Decodes the parameters.
   *
   * @return Parameters in query string order.
   */
  public Map<String, String> getParameters() {
    Map<String, String> parameters = new LinkedHashMap<>();
    for (String pair : queryString.split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      int separator = pair.indexOf('=');
      String key = separator < 0 ? pair : pair.substring(0, separator);
      String value = separator < 0 ? "" : pair.substring(separator + 1);
      parameters.put(decode(key), decode(value));
    }
    return parameters;
  }

  /**
   * Returns a decoded parameter.
   *
   * @param name Parameter name, e.g., {@code target}.
   * @return Decoded value, null if missing.
   */
  public String getParameter(String name) {
    return getParameters().get(name);
  }

  private static String decode(String value) {
    try {
      return URLDecoder.decode(value, StandardCharsets.UTF_8.name());
    } catch (UnsupportedEncodingException e) {
      throw new IllegalStateException("UTF-8 is not supported", e);
    }
  }

  @Override
  public String toString() {
    return queryString;
  }
}
