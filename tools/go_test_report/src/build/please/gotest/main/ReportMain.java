package build.please.gotest.main;

import build.please.gotest.report.ReportConverter;
import build.please.gotest.result.TestSuiteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;

/**
 * Main class which converts go test output into a JUnit XML report.
 */
public class ReportMain {
  private static final Logger LOGGER = LoggerFactory.getLogger(ReportMain.class);

  // Same exit codes as the JUnit runner.
  static final int SUCCESS_EXIT = 0;
  static final int FAILURE_EXIT = 1;
  static final int EXCEPTION_EXIT = 2;

  public static void main(String[] args) {
    System.exit(run(args, System.getenv(), System.in, System.out, System.err));
  }

  static int run(String[] args, Map<String, String> env, InputStream stdin, PrintStream stdout, PrintStream stderr) {
    ReportOptions options;
    try {
      options = ReportOptions.parse(args, env);
    } catch (IllegalArgumentException ex) {
      stderr.println(ex.getMessage());
      stderr.println(ReportOptions.USAGE);
      return EXCEPTION_EXIT;
    }

    ReportConverter converter = new ReportConverter(options.isIndent());
    List<TestSuiteResult> suites;
    try {
      suites = read(converter, options, stdin);
    } catch (IOException ex) {
      LOGGER.error("Failed to read test output", ex);
      return EXCEPTION_EXIT;
    }
    try {
      write(converter, options, suites, stdout);
    } catch (IOException ex) {
      LOGGER.error("Failed to write test report", ex);
      return EXCEPTION_EXIT;
    }
    return options.isFailOnFailure() ? exitCode(suites) : SUCCESS_EXIT;
  }

  private static List<TestSuiteResult> read(ReportConverter converter, ReportOptions options, InputStream stdin)
      throws IOException {
    if (options.getInputFile() == null) {
      return converter.read(stdin);
    }
    try (InputStream input = new BufferedInputStream(new FileInputStream(options.getInputFile()))) {
      return converter.read(input);
    }
  }

  // The output file is only opened once all of the input has been read.
  private static void write(ReportConverter converter, ReportOptions options, List<TestSuiteResult> suites,
                            PrintStream stdout) throws IOException {
    if (options.getOutputFile() == null) {
      converter.write(suites, stdout);
      if (stdout.checkError()) {
        throw new IOException("Error writing to stdout");
      }
      return;
    }
    try (OutputStream output = new BufferedOutputStream(new FileOutputStream(options.getOutputFile()))) {
      converter.write(suites, output);
    }
  }

  static int exitCode(List<TestSuiteResult> suites) {
    boolean error = false;
    boolean failure = false;
    for (TestSuiteResult result : suites) {
      error |= result.isError();
      failure |= result.isFailure();
    }
    if (error) {
      return EXCEPTION_EXIT;
    } else if (failure) {
      return FAILURE_EXIT;
    }
    return SUCCESS_EXIT;
  }
}
