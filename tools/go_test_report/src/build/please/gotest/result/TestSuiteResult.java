package build.please.gotest.result;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collated results for one package run, closed by its "ok" or "FAIL" summary line.
 */
public class TestSuiteResult {
  private final String name;
  private final Duration duration;
  private final List<TestCaseResult> caseResults;

  public TestSuiteResult(String name, Duration duration, List<TestCaseResult> caseResults) {
    this.name = name == null ? "" : name;
    this.duration = duration == null ? Duration.ZERO : duration;
    this.caseResults = Collections.unmodifiableList(new ArrayList<>(caseResults));
  }

  public String getName() {
    return name;
  }

  public Duration getDuration() {
    return duration;
  }

  public List<TestCaseResult> getCaseResults() {
    return caseResults;
  }

  public int count(CaseStatus status) {
    int n = 0;
    for (TestCaseResult result : caseResults) {
      if (result.getStatus() == status) {
        ++n;
      }
    }
    return n;
  }

  /**
   * @return <code>true</code> if any of the results were an abnormal exit.
   */
  public boolean isError() {
    return count(CaseStatus.ERROR) > 0;
  }

  /**
   * @return <code>true</code> if any of the results were a test failure exit.
   */
  public boolean isFailure() {
    return count(CaseStatus.FAILURE) > 0;
  }
}
