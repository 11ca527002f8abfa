package build.please.gotest.main;

import org.junit.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class ReportOptionsTest {

  private static final Map<String, String> NO_ENV = Collections.emptyMap();

  @Test
  public void testDefaults() {
    ReportOptions options = ReportOptions.parse(new String[0], NO_ENV);
    assertNull(options.getInputFile());
    assertNull(options.getOutputFile());
    assertFalse(options.isIndent());
    assertFalse(options.isFailOnFailure());
  }

  @Test
  public void testFlags() {
    ReportOptions options = ReportOptions.parse(
        new String[]{"-i", "in.txt", "--output", "out.xml", "--indent", "--fail_on_failure"}, NO_ENV);
    assertEquals("in.txt", options.getInputFile());
    assertEquals("out.xml", options.getOutputFile());
    assertTrue(options.isIndent());
    assertTrue(options.isFailOnFailure());
  }

  @Test
  public void testEnvironmentDefaults() {
    Map<String, String> env = new HashMap<>();
    env.put(ReportOptions.OUTPUT_ENV, "env.xml");
    env.put(ReportOptions.INDENT_ENV, "1");
    ReportOptions options = ReportOptions.parse(new String[0], env);
    assertEquals("env.xml", options.getOutputFile());
    assertTrue(options.isIndent());

    options = ReportOptions.parse(new String[]{"-o", "flag.xml"}, env);
    assertEquals("flag.xml", options.getOutputFile());
  }

  @Test
  public void testEmptyEnvironmentValuesAreIgnored() {
    Map<String, String> env = new HashMap<>();
    env.put(ReportOptions.OUTPUT_ENV, "");
    env.put(ReportOptions.INDENT_ENV, "");
    ReportOptions options = ReportOptions.parse(new String[0], env);
    assertNull(options.getOutputFile());
    assertFalse(options.isIndent());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownFlag() {
    ReportOptions.parse(new String[]{"--verbose"}, NO_ENV);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMissingValue() {
    ReportOptions.parse(new String[]{"-o"}, NO_ENV);
  }
}
