package build.please.gotest.parse;

import build.please.gotest.result.CaseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Decides what each line of verbose test output means.
 * Prefixes are checked in a fixed order and the first match wins, so e.g. "--- FAIL:" is a case
 * result and never a suite summary.
 */
public final class LineClassifier {
  private static final Logger LOGGER = LoggerFactory.getLogger(LineClassifier.class);

  static final String RUN_PREFIX = "=== RUN";
  static final String FAIL_RESULT_PREFIX = "--- FAIL:";
  static final String PASS_RESULT_PREFIX = "--- PASS:";
  static final String FAIL_SUMMARY_PREFIX = "FAIL";
  static final String OK_SUMMARY_PREFIX = "ok";

  private LineClassifier() {
  }

  public static LineAction classify(String line) {
    if (line.equals("PASS") || line.equals("FAIL")) {
      // Bare summaries carry no package; the following "ok"/"FAIL <pkg>" line is the one that counts.
      return LineAction.ignore();
    } else if (line.startsWith(RUN_PREFIX)) {
      List<String> fields = fields(line);
      return new LineAction.StartCase(fields.size() > 2 ? fields.get(2) : "");
    } else if (line.startsWith(FAIL_RESULT_PREFIX)) {
      return new LineAction.MarkResult(CaseStatus.FAILURE, caseDuration(fields(line)));
    } else if (line.startsWith(PASS_RESULT_PREFIX)) {
      return new LineAction.MarkResult(CaseStatus.SUCCESS, caseDuration(fields(line)));
    } else if (line.startsWith(FAIL_SUMMARY_PREFIX) || line.startsWith(OK_SUMMARY_PREFIX)) {
      List<String> fields = fields(line);
      String name = fields.size() > 1 ? fields.get(1) : "";
      Duration duration = fields.size() > 2 ? parseDuration(fields.get(2)) : Duration.ZERO;
      return new LineAction.EndSuite(name, duration);
    }
    return new LineAction.AppendOutput(line);
  }

  /**
   * Reads the duration from the fourth field of a "--- PASS:" / "--- FAIL:" line.
   * Both "(1.23s)" and the older "(1.23 seconds)" forms are understood; anything else is zero.
   * @return null if there is no fourth field.
   */
  static Duration caseDuration(List<String> fields) {
    if (fields.size() <= 3) {
      return null;
    }
    String value = fields.get(3).substring(1);
    if (value.endsWith(")")) {
      value = value.substring(0, value.length() - 1);
      if (!value.isEmpty() && Character.isDigit(value.charAt(value.length() - 1))) {
        value += "s";
      }
    } else {
      value += "s";
    }
    return parseDuration(value);
  }

  private static Duration parseDuration(String value) {
    Duration duration = GoDuration.tryParse(value).orElse(null);
    if (duration == null) {
      LOGGER.trace("Ignoring unparseable duration '{}'", value);
      return Duration.ZERO;
    }
    return duration;
  }

  /**
   * Splits a line on runs of whitespace, dropping empty fields.
   * Whitespace is the Unicode White_Space set, which includes U+0085 and no-break spaces.
   */
  static List<String> fields(String line) {
    List<String> fields = new ArrayList<>();
    int i = 0;
    while (i < line.length()) {
      while (i < line.length() && isSpace(line.charAt(i))) {
        ++i;
      }
      int start = i;
      while (i < line.length() && !isSpace(line.charAt(i))) {
        ++i;
      }
      if (i > start) {
        fields.add(line.substring(start, i));
      }
    }
    return fields;
  }

  static boolean isSpace(char c) {
    switch (c) {
      case '\t':
      case '\n':
      case '\u000b':
      case '\f':
      case '\r':
      case ' ':
      case '\u0085':
      case '\u00a0':
      case '\u1680':
      case '\u2028':
      case '\u2029':
      case '\u202f':
      case '\u205f':
      case '\u3000':
        return true;
      default:
        return c >= '\u2000' && c <= '\u200a';
    }
  }
}
