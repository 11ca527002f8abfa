package build.please.gotest.parse;

import build.please.gotest.result.TestSuiteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Reads the verbose output of a Go test run ("go test -v") and rebuilds the suites and cases it describes.
 *
 * The parser is deliberately lenient: lines it does not recognise become output of the current test case,
 * and fields that don't parse are left at zero. Only a failure to read the input is an error.
 * Cases after the last "ok" / "FAIL" summary line belong to no suite and are dropped.
 */
public class TestOutputParser {
  private static final Logger LOGGER = LoggerFactory.getLogger(TestOutputParser.class);

  public List<TestSuiteResult> parse(InputStream inputStream) throws IOException {
    return parse(new InputStreamReader(inputStream, UTF_8));
  }

  public List<TestSuiteResult> parse(Reader reader) throws IOException {
    BufferedReader br = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
    ParserState state = new ParserState();
    for (String line; (line = readLine(br)) != null; ) {
      LineClassifier.classify(line).applyTo(state);
    }
    return finish(state);
  }

  /**
   * Reads up to the next '\n', dropping it and one '\r' before it.
   * Unlike {@link BufferedReader#readLine()} a lone '\r' (progress output) stays part of the line.
   * @return the line, or null at end of input.
   */
  static String readLine(BufferedReader br) throws IOException {
    StringBuilder sb = new StringBuilder();
    int c;
    while ((c = br.read()) != -1) {
      if (c == '\n') {
        return stripCarriageReturn(sb);
      }
      sb.append((char) c);
    }
    return sb.length() == 0 ? null : stripCarriageReturn(sb);
  }

  private static String stripCarriageReturn(StringBuilder sb) {
    int len = sb.length();
    if (len > 0 && sb.charAt(len - 1) == '\r') {
      sb.setLength(len - 1);
    }
    return sb.toString();
  }

  public List<TestSuiteResult> parse(Iterable<String> lines) {
    ParserState state = new ParserState();
    for (String line : lines) {
      LineClassifier.classify(line).applyTo(state);
    }
    return finish(state);
  }

  private static List<TestSuiteResult> finish(ParserState state) {
    if (state.openCaseCount() > 0) {
      LOGGER.debug("Dropping {} test case(s) with no suite summary line at end of input", state.openCaseCount());
    }
    LOGGER.debug("Parsed {} suite(s)", state.getSuites().size());
    return state.getSuites();
  }
}
