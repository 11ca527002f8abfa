package build.please.gotest.result;

import java.time.Duration;

// Counted in the suite's skipped total; the report has no per-case element for it.
public final class SkippedCaseResult extends TestCaseResult {
  SkippedCaseResult(String name, Duration duration, String output) {
    super(name, duration, output);
  }

  @Override
  public CaseStatus getStatus() {
    return CaseStatus.SKIPPED;
  }
}
