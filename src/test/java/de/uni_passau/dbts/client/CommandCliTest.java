package de.uni_passau.dbts.client;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import de.uni_passau.dbts.client.conf.Constants;
import de.uni_passau.dbts.client.tsdb.DB;
import org.junit.After;
import org.junit.Test;

public class CommandCliTest {

  @After
  public void clearProperty() {
    System.clearProperty(Constants.CLIENT_CONF);
  }

  @Test
  public void testConfigFile() {
    CommandCli cli = new CommandCli();

    assertTrue(cli.init(new String[] {"-cf", "conf/config.xml"}));
    assertEquals("conf/config.xml", System.getProperty(Constants.CLIENT_CONF));
    assertFalse(cli.isExecute());
    assertNull(cli.getDatabase());
  }

  @Test
  public void testDatabaseOverride() {
    CommandCli cli = new CommandCli();

    assertTrue(cli.init(new String[] {"-cf", "conf/config.xml", "-db", "Prometheus"}));
    assertEquals(DB.PROMETHEUS, cli.getDatabase());
  }

  @Test
  public void testUnknownDatabase() {
    assertFalse(new CommandCli().init(new String[] {"-cf", "conf/config.xml", "-db", "opentsdb"}));
    assertNull(System.getProperty(Constants.CLIENT_CONF));
  }

  @Test
  public void testExecute() {
    CommandCli cli = new CommandCli();

    assertTrue(cli.init(new String[] {"-cf", "conf/config.xml", "-execute"}));
    assertTrue(cli.isExecute());
  }

  @Test
  public void testMissingArguments() {
    assertFalse(new CommandCli().init(new String[0]));
    assertFalse(new CommandCli().init(new String[] {"-execute"}));
  }

  @Test
  public void testHelp() {
    assertFalse(new CommandCli().init(new String[] {"-cf", "conf/config.xml", "-help"}));
  }
}
