package de.uni_passau.dbts.client.conf;

/** Constants container. */
public class Constants {

  /** Prefix to print in console. */
  public static final String CONSOLE_PREFIX = "dbts>";

  /** System property holding the path of the config file. */
  public static final String CLIENT_CONF = "conf";

  /** Field that is read when a query does not name one. */
  public static final String DEFAULT_FIELD = "value";

  /** Directory of a folder tag without a value. */
  public static final String UNSET_FOLDER = "_unset";

  /** Longest file name most file systems accept. */
  public static final int MAX_FILE_NAME_LENGTH = 255;

  /** Milliseconds to seconds convert factor. */
  public static final long MILLIS_TO_SECONDS = 1000L;

  /** Content type of Flux queries. */
  public static final String FLUX_MEDIA_TYPE = "application/vnd.flux";

  /** Content type of InfluxDB line protocol and Prometheus text exposition. */
  public static final String TEXT_MEDIA_TYPE = "text/plain; charset=utf-8";

  /** Content type of JSON request bodies. */
  public static final String JSON_MEDIA_TYPE = "application/json; charset=utf-8";
}
