package de.uni_passau.dbts.client;

import de.uni_passau.dbts.client.conf.Constants;
import de.uni_passau.dbts.client.tsdb.DB;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

/**
 * CLI arguments parser. Supports -cf to choose the config file, -db to override the configured
 * driver, -execute to run the configured query and -help.
 */
public class CommandCli {
  private static final String HELP_ARGS = "help";
  private static final String CONFIG_ARGS = "cf";
  private static final String DATABASE_ARGS = "db";
  private static final String EXECUTE_ARGS = "execute";

  private static final int MAX_HELP_CONSOLE_WIDTH = 88;

  private final Options options = createOptions();

  private DB database;
  private boolean execute;

  /**
   * Registers CLI options.
   *
   * @return CLI options.
   */
  private static Options createOptions() {
    Options options = new Options();
    options.addOption(new Option(HELP_ARGS, false, "Display help information"));
    options.addOption(
        Option.builder(CONFIG_ARGS)
            .argName("config file")
            .hasArg()
            .required()
            .desc("Config file path")
            .build());
    options.addOption(
        Option.builder(DATABASE_ARGS)
            .argName("database")
            .hasArg()
            .desc("Driver to use instead of db.type, e.g., prometheus")
            .build());
    options.addOption(
        new Option(EXECUTE_ARGS, false, "Run the configured query instead of only printing it"));
    return options;
  }

  /**
   * Parses the CLI input and points the {@link Constants#CLIENT_CONF} property to the config
   * file.
   *
   * @param args CLI input.
   * @return true if options were entered correctly, false otherwise.
   */
  public boolean init(String[] args) {
    if (args == null || args.length == 0) {
      printHelp("Require more params input, please check the following hint.");
      return false;
    }
    CommandLine commandLine;
    try {
      commandLine = new DefaultParser().parse(options, args);
    } catch (ParseException e) {
      printHelp("Wrong params input, because " + e.getMessage());
      return false;
    }
    if (commandLine.hasOption(HELP_ARGS)) {
      printHelp(null);
      return false;
    }
    if (commandLine.hasOption(DATABASE_ARGS)) {
      try {
        database = DB.parse(commandLine.getOptionValue(DATABASE_ARGS));
      } catch (IllegalArgumentException e) {
        printHelp(e.getMessage());
        return false;
      }
    }
    System.setProperty(Constants.CLIENT_CONF, commandLine.getOptionValue(CONFIG_ARGS));
    execute = commandLine.hasOption(EXECUTE_ARGS);
    return true;
  }

  private void printHelp(String message) {
    if (message != null) {
      System.out.println(message);
    }
    HelpFormatter hf = new HelpFormatter();
    hf.setWidth(MAX_HELP_CONSOLE_WIDTH);
    hf.printHelp(Constants.CONSOLE_PREFIX, options, true);
  }

  /**
   * Returns the driver given with -db.
   *
   * @return The driver, null if the configured one should be used.
   */
  public DB getDatabase() {
    return database;
  }

  /**
   * Returns true if -execute was given.
   *
   * @return Whether the configured query should be executed.
   */
  public boolean isExecute() {
    return execute;
  }
}
