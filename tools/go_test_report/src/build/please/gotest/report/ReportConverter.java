package build.please.gotest.report;

import build.please.gotest.parse.TestOutputParser;
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
import java.util.List;

/**
 * Runs the whole conversion: parse all of the input, then write the report.
 * Nothing is written if reading the input fails.
 */
public class ReportConverter {
  private static final Logger LOGGER = LoggerFactory.getLogger(ReportConverter.class);

  private final TestOutputParser parser = new TestOutputParser();
  private final XmlTestReporter reporter;

  public ReportConverter(boolean indent) {
    this.reporter = new XmlTestReporter(indent);
  }

  public List<TestSuiteResult> read(InputStream input) throws IOException {
    return parser.parse(input);
  }

  public void write(List<TestSuiteResult> suites, OutputStream output) throws IOException {
    reporter.write(suites, output);
    LOGGER.debug("Wrote report for {} suite(s)", suites.size());
  }

  public List<TestSuiteResult> convert(InputStream input, OutputStream output) throws IOException {
    List<TestSuiteResult> suites = read(input);
    write(suites, output);
    return suites;
  }

  public List<TestSuiteResult> convertFile(String inputFile, String outputFile) throws IOException {
    List<TestSuiteResult> suites;
    try (InputStream input = new BufferedInputStream(new FileInputStream(inputFile))) {
      suites = read(input);
    }
    try (OutputStream output = new BufferedOutputStream(new FileOutputStream(outputFile))) {
      write(suites, output);
    }
    return suites;
  }
}
