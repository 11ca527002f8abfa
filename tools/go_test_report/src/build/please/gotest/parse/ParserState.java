package build.please.gotest.parse;

import build.please.gotest.result.CaseStatus;
import build.please.gotest.result.TestCaseResult;
import build.please.gotest.result.TestSuiteResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable state of one pass over the runner's output: the suites finished so far, the cases of the
 * suite currently being read, and which of those cases is current.
 */
final class ParserState {
  private final List<TestSuiteResult> suites = new ArrayList<>();
  private final List<CaseBuilder> cases = new ArrayList<>();
  // Receives output that arrives while no case is running; never ends up in a suite.
  private CaseBuilder placeholder = new CaseBuilder("");
  private int current = -1;

  void startCase(String name) {
    cases.add(new CaseBuilder(name));
    current = cases.size() - 1;
  }

  void markResult(CaseStatus status, Duration duration) {
    CaseBuilder builder = currentCase();
    builder.status = status;
    if (duration != null) {
      builder.duration = duration;
    }
  }

  void appendOutput(String line) {
    currentCase().output.append(line).append('\n');
  }

  void endSuite(String name, Duration duration) {
    List<TestCaseResult> results = new ArrayList<>(cases.size());
    for (CaseBuilder builder : cases) {
      results.add(builder.build());
    }
    suites.add(new TestSuiteResult(name, duration, results));
    cases.clear();
    current = -1;
    placeholder = new CaseBuilder("");
  }

  List<TestSuiteResult> getSuites() {
    return Collections.unmodifiableList(suites);
  }

  /**
   * @return the number of cases seen since the last suite summary line.
   */
  int openCaseCount() {
    return cases.size();
  }

  String placeholderOutput() {
    return placeholder.output.toString();
  }

  private CaseBuilder currentCase() {
    return current < 0 ? placeholder : cases.get(current);
  }

  private static final class CaseBuilder {
    private final String name;
    private final StringBuilder output = new StringBuilder();
    private Duration duration = Duration.ZERO;
    private CaseStatus status = CaseStatus.UNSET;

    CaseBuilder(String name) {
      this.name = name;
    }

    TestCaseResult build() {
      return TestCaseResult.create(status, name, duration, output.toString());
    }
  }
}
