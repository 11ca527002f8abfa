package build.please.gotest.main;

import java.util.Map;

/**
 * Settings for one invocation, taken from the command line with defaults from the environment.
 */
public final class ReportOptions {
  static final String OUTPUT_ENV = "GO_TEST_REPORT_OUTPUT";
  static final String INDENT_ENV = "GO_TEST_REPORT_INDENT";

  static final String USAGE =
      "Usage: go_test_report [-i|--input FILE] [-o|--output FILE] [--indent] [--fail_on_failure]\n"
      + "Reads verbose go test output (stdin by default) and writes a JUnit XML report (stdout by default).";

  private final String inputFile;
  private final String outputFile;
  private final boolean indent;
  private final boolean failOnFailure;

  private ReportOptions(String inputFile, String outputFile, boolean indent, boolean failOnFailure) {
    this.inputFile = inputFile;
    this.outputFile = outputFile;
    this.indent = indent;
    this.failOnFailure = failOnFailure;
  }

  /**
   * Parses command-line arguments. Flags override the environment.
   * @throws IllegalArgumentException on an unknown flag or a flag missing its value.
   */
  public static ReportOptions parse(String[] args, Map<String, String> env) {
    String inputFile = null;
    String outputFile = emptyToNull(env.get(OUTPUT_ENV));
    boolean indent = emptyToNull(env.get(INDENT_ENV)) != null;
    boolean failOnFailure = false;
    for (int i = 0; i < args.length; ++i) {
      String arg = args[i];
      switch (arg) {
        case "-i":
        case "--input":
          inputFile = value(args, ++i, arg);
          break;
        case "-o":
        case "--output":
          outputFile = value(args, ++i, arg);
          break;
        case "--indent":
          indent = true;
          break;
        case "--fail_on_failure":
          failOnFailure = true;
          break;
        default:
          throw new IllegalArgumentException("Unknown argument: " + arg);
      }
    }
    return new ReportOptions(inputFile, outputFile, indent, failOnFailure);
  }

  private static String value(String[] args, int i, String flag) {
    if (i >= args.length || args[i].isEmpty()) {
      throw new IllegalArgumentException("Missing value for " + flag);
    }
    return args[i];
  }

  private static String emptyToNull(String s) {
    return s == null || s.isEmpty() ? null : s;
  }

  /**
   * @return the file to read, or null for stdin.
   */
  public String getInputFile() {
    return inputFile;
  }

  /**
   * @return the file to write, or null for stdout.
   */
  public String getOutputFile() {
    return outputFile;
  }

  public boolean isIndent() {
    return indent;
  }

  public boolean isFailOnFailure() {
    return failOnFailure;
  }
}
