package de.uni_passau.dbts.client.conf;

import de.uni_passau.dbts.client.query.Query;
import de.uni_passau.dbts.client.tsdb.DB;
import de.uni_passau.dbts.client.tsdb.rrdtool.tags.TagStrategyType;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration parameters. Instances are created by {@link ConfigParser}.
 */
public class Config {

  /**
   * Only {@link ConfigParser} should be able to instantiate an object.
   */
  Config() {}

  /** Driver to use. */
  public DB DB_SWITCH = DB.INFLUXDB;

  /** Host name of the database server. */
  public String HOST = "127.0.0.1";

  /** Port of the database server's HTTP API. */
  public String PORT = "8086";

  /** Database name, used as InfluxDB bucket. */
  public String DB_NAME = "test";

  /** Use https instead of http. */
  public boolean USE_HTTPS = false;

  /** HTTP connect timeout in seconds. */
  public long CONNECT_TIMEOUT = 10;

  /** HTTP read timeout in seconds. */
  public long READ_TIMEOUT = 30;

  /** HTTP write timeout in seconds. */
  public long WRITE_TIMEOUT = 30;

  /** Retries requests after connectivity problems. */
  public boolean RETRY_ON_CONNECTION_FAILURE = true;

  /** InfluxDB organization. */
  public String INFLUX_ORG = "";

  /** InfluxDB API token. */
  public String INFLUX_TOKEN = "";

  /** Resolution step of Prometheus range queries. */
  public String PROMETHEUS_STEP = "15s";

  /** Host of the Prometheus Pushgateway, which receives writes. */
  public String PUSHGATEWAY_HOST = "127.0.0.1";

  /** Port of the Prometheus Pushgateway. */
  public String PUSHGATEWAY_PORT = "9091";

  /** Job label of pushed metrics. */
  public String PUSHGATEWAY_JOB = "dbts";

  /** Prefix of every Graphite metric path, may be empty. */
  public String GRAPHITE_PREFIX = "";

  /** Port of the Carbon plaintext receiver. */
  public int GRAPHITE_CARBON_PORT = 2003;

  /** Maximum number of lines per Carbon connection. */
  public int GRAPHITE_BATCH_SIZE = 500;

  /** Path of the rrdtool executable. */
  public String RRD_BINARY = "rrdtool";

  /** Directory holding the RRD files, must end with a slash. */
  public String RRD_DIR = "/tmp/rrd/";

  /** How tags map to RRD files. */
  public TagStrategyType RRD_TAG_STRATEGY = TagStrategyType.FILENAME;

  /** Tags that become directories with the folder strategy. */
  public List<String> RRD_FOLDER_TAGS = new ArrayList<>();

  /** Base interval of new RRD files in seconds. */
  public int RRD_STEP = 10;

  /** Maximum gap between two updates before a value is unknown, in seconds. */
  public int RRD_HEARTBEAT = 20;

  /** Rows of the archive of new RRD files. */
  public int RRD_ROWS = 8640;

  /** Time limit of one rrdtool invocation in seconds. */
  public long RRD_TIMEOUT = 30;

  /** Databases the aggregate driver writes to. */
  public List<Config> AGGREGATE_WRITE_DATABASES = new ArrayList<>();

  /** Database the aggregate driver reads from, null for the first write database. */
  public Config AGGREGATE_READ_DATABASE;

  /** Query defined in the configuration file, may be null. */
  public Query QUERY;

  /**
   * Returns the base URL of the database server's HTTP API.
   *
   * @return URL such as {@code http://127.0.0.1:8086}.
   */
  public String getBaseUrl() {
    return String.format("%s://%s:%s", USE_HTTPS ? "https" : "http", HOST, PORT);
  }

  /**
   * Creates a copy that can be customized for a member of the aggregate driver. Lists are copied,
   * the query and the aggregate members are not.
   *
   * @return The copy.
   */
  Config copy() {
    Config copy = new Config();
    copy.DB_SWITCH = DB_SWITCH;
    copy.HOST = HOST;
    copy.PORT = PORT;
    copy.DB_NAME = DB_NAME;
    copy.USE_HTTPS = USE_HTTPS;
    copy.CONNECT_TIMEOUT = CONNECT_TIMEOUT;
    copy.READ_TIMEOUT = READ_TIMEOUT;
    copy.WRITE_TIMEOUT = WRITE_TIMEOUT;
    copy.RETRY_ON_CONNECTION_FAILURE = RETRY_ON_CONNECTION_FAILURE;
    copy.INFLUX_ORG = INFLUX_ORG;
    copy.INFLUX_TOKEN = INFLUX_TOKEN;
    copy.PROMETHEUS_STEP = PROMETHEUS_STEP;
    copy.PUSHGATEWAY_HOST = PUSHGATEWAY_HOST;
    copy.PUSHGATEWAY_PORT = PUSHGATEWAY_PORT;
    copy.PUSHGATEWAY_JOB = PUSHGATEWAY_JOB;
    copy.GRAPHITE_PREFIX = GRAPHITE_PREFIX;
    copy.GRAPHITE_CARBON_PORT = GRAPHITE_CARBON_PORT;
    copy.GRAPHITE_BATCH_SIZE = GRAPHITE_BATCH_SIZE;
    copy.RRD_BINARY = RRD_BINARY;
    copy.RRD_DIR = RRD_DIR;
    copy.RRD_TAG_STRATEGY = RRD_TAG_STRATEGY;
    copy.RRD_FOLDER_TAGS = new ArrayList<>(RRD_FOLDER_TAGS);
    copy.RRD_STEP = RRD_STEP;
    copy.RRD_HEARTBEAT = RRD_HEARTBEAT;
    copy.RRD_ROWS = RRD_ROWS;
    copy.RRD_TIMEOUT = RRD_TIMEOUT;
    return copy;
  }
}
