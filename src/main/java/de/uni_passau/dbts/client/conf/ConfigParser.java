package de.uni_passau.dbts.client.conf;

import com.google.common.base.Splitter;
import de.uni_passau.dbts.client.enums.Aggregation;
import de.uni_passau.dbts.client.enums.ComparisonOperator;
import de.uni_passau.dbts.client.enums.Connective;
import de.uni_passau.dbts.client.enums.FillPolicy;
import de.uni_passau.dbts.client.query.AggregationClause;
import de.uni_passau.dbts.client.query.Query;
import de.uni_passau.dbts.client.tsdb.DB;
import de.uni_passau.dbts.client.tsdb.TsdbException;
import de.uni_passau.dbts.client.tsdb.rrdtool.tags.TagStrategyType;
import de.uni_passau.dbts.client.utils.ValueUtils;
import java.io.File;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.configuration2.HierarchicalConfiguration;
import org.apache.commons.configuration2.XMLConfiguration;
import org.apache.commons.configuration2.builder.fluent.Configurations;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.tree.ImmutableNode;
import org.joda.time.DateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parser of XML configuration files.
 */
public enum ConfigParser {
  INSTANCE;

  private static final Logger LOGGER = LoggerFactory.getLogger(ConfigParser.class);

  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  private Config config;

  /**
   * Returns the configuration of the file named by the {@link Constants#CLIENT_CONF} system
   * property. The file is parsed on first access.
   *
   * @return Configuration.
   * @throws IllegalStateException if the property is missing or the file cannot be parsed.
   */
  public synchronized Config config() {
    if (config == null) {
      String xmlPath = System.getProperty(Constants.CLIENT_CONF);
      if (xmlPath == null) {
        throw new IllegalStateException(
            "System property " + Constants.CLIENT_CONF + " does not point to a config file.");
      }
      try {
        config = parse(new File(xmlPath));
      } catch (TsdbException e) {
        throw new IllegalStateException("Could not parse config " + xmlPath, e);
      }
    }
    return config;
  }

  /**
   * Returns a configuration holding only default values.
   *
   * @return Configuration.
   */
  public Config defaultConfig() {
    return new Config();
  }

  /**
   * Loads config parameters from an XML file.
   *
   * @param configFile XML file.
   * @return Configuration.
   * @throws TsdbException if the file cannot be read or holds invalid values.
   */
  public Config parse(File configFile) throws TsdbException {
    Configurations configurations = new Configurations();
    XMLConfiguration xml;
    try {
      xml = configurations.xml(configFile);
    } catch (ConfigurationException e) {
      LOGGER.error("Could not parse config {} because ", configFile, e);
      throw new TsdbException("Could not parse config " + configFile, e);
    }
    try {
      return load(xml);
    } catch (IllegalArgumentException e) {
      throw new TsdbException("Invalid config " + configFile + ": " + e.getMessage(), e);
    }
  }

  /**
   * Reads every section of the configuration.
   *
   * @param xml The XML config instance.
   * @return Configuration.
   */
  private Config load(XMLConfiguration xml) {
    Config config = new Config();
    config.DB_SWITCH = DB.parse(xml.getString("db.type", config.DB_SWITCH.name()));
    config.HOST = xml.getString("db.host", config.HOST);
    config.PORT = xml.getString("db.port", config.PORT);
    config.DB_NAME = xml.getString("db.name", config.DB_NAME);
    config.USE_HTTPS = xml.getBoolean("db.https", config.USE_HTTPS);

    config.CONNECT_TIMEOUT = xml.getLong("http[@connectTimeout]", config.CONNECT_TIMEOUT);
    config.READ_TIMEOUT = xml.getLong("http[@readTimeout]", config.READ_TIMEOUT);
    config.WRITE_TIMEOUT = xml.getLong("http[@writeTimeout]", config.WRITE_TIMEOUT);
    config.RETRY_ON_CONNECTION_FAILURE =
        xml.getBoolean("http[@retry]", config.RETRY_ON_CONNECTION_FAILURE);

    config.INFLUX_ORG = xml.getString("influxdb.org", config.INFLUX_ORG);
    config.INFLUX_TOKEN = xml.getString("influxdb.token", config.INFLUX_TOKEN);

    config.PROMETHEUS_STEP = xml.getString("prometheus.step", config.PROMETHEUS_STEP);
    config.PUSHGATEWAY_HOST =
        xml.getString("prometheus.pushgateway[@host]", config.PUSHGATEWAY_HOST);
    config.PUSHGATEWAY_PORT =
        xml.getString("prometheus.pushgateway[@port]", config.PUSHGATEWAY_PORT);
    config.PUSHGATEWAY_JOB = xml.getString("prometheus.pushgateway[@job]", config.PUSHGATEWAY_JOB);

    config.GRAPHITE_PREFIX = xml.getString("graphite.prefix", config.GRAPHITE_PREFIX);
    config.GRAPHITE_CARBON_PORT = xml.getInt("graphite.carbonPort", config.GRAPHITE_CARBON_PORT);
    config.GRAPHITE_BATCH_SIZE = xml.getInt("graphite.batchSize", config.GRAPHITE_BATCH_SIZE);

    config.RRD_BINARY = xml.getString("rrdtool.binary", config.RRD_BINARY);
    config.RRD_DIR = xml.getString("rrdtool.dir", config.RRD_DIR);
    config.RRD_TAG_STRATEGY =
        TagStrategyType.parse(
            xml.getString("rrdtool.tagStrategy", config.RRD_TAG_STRATEGY.name()));
    config.RRD_FOLDER_TAGS =
        splitList(xml.getString("rrdtool.tagStrategy[@folderTags]", ""));
    config.RRD_STEP = xml.getInt("rrdtool.step", config.RRD_STEP);
    config.RRD_HEARTBEAT = xml.getInt("rrdtool.heartbeat", config.RRD_HEARTBEAT);
    config.RRD_ROWS = xml.getInt("rrdtool.rows", config.RRD_ROWS);
    config.RRD_TIMEOUT = xml.getLong("rrdtool.timeout", config.RRD_TIMEOUT);

    initAggregate(xml, config);

    if (!xml.configurationsAt("query").isEmpty()) {
      config.QUERY = parseQuery(xml.configurationAt("query"));
    }
    return config;
  }

  /**
   * Creates the member configurations of the aggregate driver. Each member inherits the settings
   * of the enclosing file and overrides the connection attributes it declares.
   *
   * @param xml The XML config instance.
   * @param config Configuration to fill.
   */
  private void initAggregate(XMLConfiguration xml, Config config) {
    List<HierarchicalConfiguration<ImmutableNode>> members =
        xml.configurationsAt("aggregate.database");
    for (HierarchicalConfiguration<ImmutableNode> member : members) {
      Config memberConfig = config.copy();
      memberConfig.DB_SWITCH = DB.parse(member.getString("[@type]"));
      if (memberConfig.DB_SWITCH == DB.AGGREGATE) {
        throw new IllegalArgumentException("Aggregate databases cannot be nested.");
      }
      memberConfig.HOST = member.getString("[@host]", memberConfig.HOST);
      memberConfig.PORT = member.getString("[@port]", memberConfig.PORT);
      memberConfig.DB_NAME = member.getString("[@name]", memberConfig.DB_NAME);
      memberConfig.RRD_DIR = member.getString("[@dir]", memberConfig.RRD_DIR);

      boolean write = member.getBoolean("[@write]", true);
      boolean read = member.getBoolean("[@read]", false);
      if (write) {
        config.AGGREGATE_WRITE_DATABASES.add(memberConfig);
      }
      if (read) {
        config.AGGREGATE_READ_DATABASE = memberConfig;
      }
    }
  }

  /**
   * Creates a query from its XML description.
   *
   * @param xml The {@code query} element.
   * @return The query.
   */
  Query parseQuery(HierarchicalConfiguration<ImmutableNode> xml) {
    Query query = new Query(xml.getString("[@measurement]", ""));

    List<String> fields = splitList(xml.getString("fields", ""));
    if (xml.getBoolean("fields[@distinct]", false)) {
      query.selectDistinct(fields.toArray(new String[0]));
    } else {
      query.select(fields);
    }

    for (HierarchicalConfiguration<ImmutableNode> condition : xml.configurationsAt("condition")) {
      ComparisonOperator operator =
          ComparisonOperator.fromSymbol(condition.getString("[@operator]", "="));
      String rawValue = condition.getString("[@value]");
      Object value;
      if (operator.requiresListValue()) {
        List<Object> values = new ArrayList<>();
        for (String item : splitList(rawValue)) {
          values.add(ValueUtils.parseLiteral(item));
        }
        value = values;
      } else if (operator == ComparisonOperator.REGEX || operator == ComparisonOperator.NOT_REGEX) {
        value = rawValue;
      } else {
        value = ValueUtils.parseLiteral(rawValue);
      }
      String field = condition.getString("[@field]");
      if (Connective.parse(condition.getString("[@connective]")) == Connective.OR) {
        query.orWhere(field, operator, value);
      } else {
        query.where(field, operator, value);
      }
    }

    String start = xml.getString("range[@start]");
    String end = xml.getString("range[@end]");
    if (start != null || end != null) {
      query.timeRange(
          start == null ? null : new DateTime(start), end == null ? null : new DateTime(end));
    }
    String latest = xml.getString("latest");
    if (latest != null) {
      query.latest(latest.trim());
    }
    query.timezone(xml.getString("timezone"));

    List<String> groupTags = splitList(xml.getString("groupBy[@tags]", ""));
    query.groupBy(groupTags, xml.getString("groupBy[@interval]"));

    for (HierarchicalConfiguration<ImmutableNode> aggregation :
        xml.configurationsAt("aggregation")) {
      String rank = aggregation.getString("[@rank]");
      query.aggregate(
          new AggregationClause(
              Aggregation.parse(aggregation.getString("[@function]")),
              aggregation.getString("[@field]"),
              aggregation.getString("[@alias]"),
              rank == null ? null : Double.valueOf(rank)));
    }

    String fill = xml.getString("fill[@policy]");
    if (fill != null) {
      Object fillValue = ValueUtils.parseLiteral(xml.getString("fill[@value]"));
      query.fill(FillPolicy.parse(fill), fillValue instanceof Number ? (Number) fillValue : null);
    }

    for (HierarchicalConfiguration<ImmutableNode> math : xml.configurationsAt("math")) {
      query.math(math.getString("[@expression]"), math.getString("[@alias]", "result"));
    }
    for (HierarchicalConfiguration<ImmutableNode> having : xml.configurationsAt("having")) {
      query.having(
          having.getString("[@field]"),
          having.getString("[@operator]", "="),
          ValueUtils.parseLiteral(having.getString("[@value]")));
    }
    for (HierarchicalConfiguration<ImmutableNode> order : xml.configurationsAt("orderBy")) {
      query.orderBy(order.getString("[@field]"), order.getString("[@direction]", "ASC"));
    }

    if (xml.containsKey("limit")) {
      query.limit(xml.getInt("limit"));
    }
    if (xml.containsKey("offset")) {
      query.offset(xml.getInt("offset"));
    }
    return query;
  }

  private static List<String> splitList(String value) {
    if (value == null) {
      return new ArrayList<>();
    }
    return new ArrayList<>(LIST_SPLITTER.splitToList(value));
  }
}
