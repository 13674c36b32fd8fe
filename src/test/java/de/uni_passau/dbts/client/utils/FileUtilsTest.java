package de.uni_passau.dbts.client.utils;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class FileUtilsTest {

  @Test
  public void testSanitize() {
    assertEquals("server 1.local", FileUtils.sanitize(" server/ 1.local* "));
    assertEquals("", FileUtils.sanitize(null));
  }

  @Test
  public void testSanitizeTagValue() {
    assertEquals("eu.west.1", FileUtils.sanitizeTagValue("eu-west_1"));
  }

  @Test
  public void testSanitizeMeasurement() {
    assertEquals("cpu_usage.total", FileUtils.sanitizeMeasurement("cpu_usage-total"));
  }
}
