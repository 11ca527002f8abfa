package build.please.gotest.result;

import java.time.Duration;

public final class SuccessCaseResult extends TestCaseResult {
  SuccessCaseResult(String name, Duration duration, String output) {
    super(name, duration, output);
  }

  @Override
  public CaseStatus getStatus() {
    return CaseStatus.SUCCESS;
  }
}
