package build.please.gotest.main;

import build.please.gotest.result.CaseStatus;
import build.please.gotest.result.TestCaseResult;
import build.please.gotest.result.TestSuiteResult;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

public class ReportMainTest {

  private static final Map<String, String> NO_ENV = Collections.emptyMap();
  private static final String PASSING = "=== RUN   TestA\n--- PASS: TestA (0.01s)\nok\tpkg\t0.02s\n";
  private static final String FAILING = "=== RUN   TestA\nboom\n--- FAIL: TestA (0.01s)\nFAIL\tpkg\t0.02s\n";

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
  private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();

  private int run(String input, String... args) {
    return run(new ByteArrayInputStream(input.getBytes(UTF_8)), args);
  }

  private int run(InputStream input, String... args) {
    return ReportMain.run(args, NO_ENV, input, new PrintStream(stdout, true), new PrintStream(stderr, true));
  }

  @Test
  public void testStdinToStdout() {
    Assert.assertEquals(ReportMain.SUCCESS_EXIT, run(PASSING));
    String xml = new String(stdout.toByteArray(), UTF_8);
    Assert.assertTrue(xml.startsWith("<?xml"));
    Assert.assertTrue(xml.contains("<testsuite "));
    Assert.assertTrue(xml.contains("name=\"TestA\""));
  }

  @Test
  public void testFailuresDoNotChangeExitCodeByDefault() {
    Assert.assertEquals(ReportMain.SUCCESS_EXIT, run(FAILING));
  }

  @Test
  public void testFailOnFailure() {
    Assert.assertEquals(ReportMain.FAILURE_EXIT, run(FAILING, "--fail_on_failure"));
    Assert.assertTrue(stdout.size() > 0);
  }

  @Test
  public void testFiles() throws Exception {
    File input = tmp.newFile("test.log");
    Files.write(input.toPath(), PASSING.getBytes(UTF_8));
    File output = new File(tmp.getRoot(), "report.xml");

    Assert.assertEquals(ReportMain.SUCCESS_EXIT, run("", "-i", input.getPath(), "-o", output.getPath(), "--indent"));
    Assert.assertEquals(0, stdout.size());
    String xml = new String(Files.readAllBytes(output.toPath()), UTF_8);
    Assert.assertTrue(xml.contains("\n  <testsuite "));
  }

  @Test
  public void testReadFailureWritesNothing() {
    InputStream failing = new InputStream() {
      @Override
      public int read() throws IOException {
        throw new IOException("broken pipe");
      }
    };
    File output = new File(tmp.getRoot(), "report.xml");

    Assert.assertEquals(ReportMain.EXCEPTION_EXIT, run(failing, "-o", output.getPath()));
    Assert.assertFalse(output.exists());
    Assert.assertEquals(0, stdout.size());
  }

  @Test
  public void testMissingInputFile() {
    File missing = new File(tmp.getRoot(), "missing.log");
    Assert.assertEquals(ReportMain.EXCEPTION_EXIT, run("", "-i", missing.getPath()));
    Assert.assertEquals(0, stdout.size());
  }

  @Test
  public void testUsageError() {
    Assert.assertEquals(ReportMain.EXCEPTION_EXIT, run(PASSING, "--bogus"));
    Assert.assertTrue(new String(stderr.toByteArray(), UTF_8).contains("Usage:"));
    Assert.assertEquals(0, stdout.size());
  }

  @Test
  public void testExitCode() {
    TestSuiteResult passed = new TestSuiteResult("a", Duration.ZERO, Collections.singletonList(
        TestCaseResult.create(CaseStatus.SUCCESS, "TestA", Duration.ZERO, "")));
    TestSuiteResult failed = new TestSuiteResult("b", Duration.ZERO, Collections.singletonList(
        TestCaseResult.create(CaseStatus.FAILURE, "TestB", Duration.ZERO, "")));
    TestSuiteResult errored = new TestSuiteResult("c", Duration.ZERO, Collections.singletonList(
        TestCaseResult.create(CaseStatus.ERROR, "TestC", Duration.ZERO, "")));

    Assert.assertEquals(ReportMain.SUCCESS_EXIT, ReportMain.exitCode(Collections.singletonList(passed)));
    Assert.assertEquals(ReportMain.FAILURE_EXIT, ReportMain.exitCode(Arrays.asList(passed, failed)));
    Assert.assertEquals(ReportMain.EXCEPTION_EXIT, ReportMain.exitCode(Arrays.asList(failed, errored)));
  }
}
