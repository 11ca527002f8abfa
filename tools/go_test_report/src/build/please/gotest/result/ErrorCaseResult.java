package build.please.gotest.result;

import java.time.Duration;

// Counted in the suite's errors total only, there is no <error> element in this report format.
public final class ErrorCaseResult extends TestCaseResult {
  ErrorCaseResult(String name, Duration duration, String output) {
    super(name, duration, output);
  }

  @Override
  public CaseStatus getStatus() {
    return CaseStatus.ERROR;
  }
}
